package io.ridetrack.fusion;

/**
 * Row-major 3x3 matrix helpers used by {@link SensorFusion}. All methods write into a caller-owned
 * output array so the per-sample path never allocates.
 */
public final class RotationMath {

    private RotationMath() {
        // hidden constructor
    }

    public static void transpose3x3(float[] src, float[] dst) {
        dst[0] = src[0]; dst[1] = src[3]; dst[2] = src[6];
        dst[3] = src[1]; dst[4] = src[4]; dst[5] = src[7];
        dst[6] = src[2]; dst[7] = src[5]; dst[8] = src[8];
    }

    public static void multiply3x3(float[] a, float[] b, float[] out) {
        for (int row = 0; row < 3; row++) {
            for (int col = 0; col < 3; col++) {
                out[row * 3 + col] =
                        a[row * 3] * b[col]
                        + a[row * 3 + 1] * b[3 + col]
                        + a[row * 3 + 2] * b[6 + col];
            }
        }
    }

    /**
     * Converts a rotation vector (x, y, z components of a unit quaternion, optionally followed by the
     * scalar part) into a row-major rotation matrix mapping device coordinates to world coordinates.
     * When the scalar part is missing it is derived from the vector part.
     */
    public static void rotationMatrixFromVector(float[] rotationVector, float[] out) {
        float q1 = rotationVector[0];
        float q2 = rotationVector[1];
        float q3 = rotationVector[2];
        float q0;
        if (rotationVector.length >= 4) {
            q0 = rotationVector[3];
        } else {
            q0 = 1 - q1 * q1 - q2 * q2 - q3 * q3;
            q0 = q0 > 0 ? (float) Math.sqrt(q0) : 0;
        }

        float sqQ1 = 2 * q1 * q1;
        float sqQ2 = 2 * q2 * q2;
        float sqQ3 = 2 * q3 * q3;
        float q1q2 = 2 * q1 * q2;
        float q3q0 = 2 * q3 * q0;
        float q1q3 = 2 * q1 * q3;
        float q2q0 = 2 * q2 * q0;
        float q2q3 = 2 * q2 * q3;
        float q1q0 = 2 * q1 * q0;

        out[0] = 1 - sqQ2 - sqQ3;
        out[1] = q1q2 - q3q0;
        out[2] = q1q3 + q2q0;

        out[3] = q1q2 + q3q0;
        out[4] = 1 - sqQ1 - sqQ3;
        out[5] = q2q3 - q1q0;

        out[6] = q1q3 - q2q0;
        out[7] = q2q3 + q1q0;
        out[8] = 1 - sqQ1 - sqQ2;
    }
}
