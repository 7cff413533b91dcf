package io.ridetrack.model;

/**
 * One timestamped inertial reading. Timestamps are in nanoseconds on the sensor clock.
 */
public final class InertialSample {

    public enum Kind {
        // row-major device-to-world
        ROTATION_MATRIX,
        ROTATION_VECTOR,
        // m/s², gravity removed
        LINEAR_ACCELERATION
    }

    private final Kind kind;
    private final long timestampNs;
    private final float[] values;

    public InertialSample(Kind kind, long timestampNs, float[] values) {
        this.kind = kind;
        this.timestampNs = timestampNs;
        this.values = values;
    }

    public static InertialSample rotationMatrix(long timestampNs, float[] matrix) {
        if (matrix.length != 9) {
            throw new IllegalArgumentException("Rotation matrix needs 9 values, got " + matrix.length);
        }
        return new InertialSample(Kind.ROTATION_MATRIX, timestampNs, matrix);
    }

    public static InertialSample rotationVector(long timestampNs, float[] vector) {
        if (vector.length < 3 || vector.length > 4) {
            throw new IllegalArgumentException("Rotation vector needs 3 or 4 values, got " + vector.length);
        }
        return new InertialSample(Kind.ROTATION_VECTOR, timestampNs, vector);
    }

    public static InertialSample linearAcceleration(long timestampNs, float x, float y, float z) {
        return new InertialSample(Kind.LINEAR_ACCELERATION, timestampNs, new float[]{x, y, z});
    }

    public Kind getKind() { return kind; }
    public long getTimestampNs() { return timestampNs; }
    public float[] getValues() { return values; }
}
