package io.ridetrack.fusion;

/**
 * Reference orientation captured when fusion starts. The buffers are allocated once and reused
 * across calibrations.
 */
public class CalibrationFrame {

    private static final float MIN_FORWARD_PROJECTION = 0.001f;

    private final float[] reference = new float[9];
    private final float[] inverse = new float[9];
    private final float[] forwardWorld = new float[3];
    private boolean valid;

    /**
     * Stores {@code orientation} as the reference. Its transpose is the inverse because rotation
     * matrices are orthonormal. The forward heading is the device Y axis projected onto the
     * horizontal plane. It falls back to world X when the device is mounted edge-on and the
     * projection vanishes.
     */
    public void capture(float[] orientation) {
        System.arraycopy(orientation, 0, reference, 0, 9);
        RotationMath.transpose3x3(reference, inverse);

        float fx = reference[1];
        float fy = reference[4];
        float len = (float) Math.sqrt(fx * fx + fy * fy);
        if (len > MIN_FORWARD_PROJECTION) {
            forwardWorld[0] = fx / len;
            forwardWorld[1] = fy / len;
        } else {
            forwardWorld[0] = 1f;
            forwardWorld[1] = 0f;
        }
        forwardWorld[2] = 0f;
        valid = true;
    }

    public void invalidate() {
        valid = false;
    }

    public boolean isValid() {
        return valid;
    }

    float[] reference() {
        return reference;
    }

    float[] inverse() {
        return inverse;
    }

    float[] forwardWorld() {
        return forwardWorld;
    }

    public float[] copyForwardWorld() {
        return forwardWorld.clone();
    }
}
