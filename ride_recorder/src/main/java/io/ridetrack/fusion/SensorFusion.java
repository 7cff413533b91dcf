package io.ridetrack.fusion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lean angle and longitudinal acceleration relative to the orientation captured right after {@link #start}.
 */
public class SensorFusion {
    private static final Logger LOG = LoggerFactory.getLogger(SensorFusion.class);

    public static final float CUTOFF_HZ = 2.0f;
    private static final float RAD_TO_DEG = (float) (180.0 / Math.PI);

    private final CalibrationFrame calibration = new CalibrationFrame();
    private final LowPassFilter leanFilter = new LowPassFilter(CUTOFF_HZ);
    private final LowPassFilter accelFilter = new LowPassFilter(CUTOFF_HZ);

    private final float[] liveRotation = new float[9];
    private final float[] relativeRotation = new float[9];
    private final float[] vectorScratch = new float[9];
    private boolean hasLiveRotation;

    private FusionState state = FusionState.INACTIVE;

    // Both streams are required, otherwise fusion stays inactive
    public boolean start(boolean orientationAvailable, boolean accelerationAvailable) {
        resetState();
        if (!orientationAvailable || !accelerationAvailable) {
            LOG.warn("Inertial fusion unavailable (orientation={}, acceleration={})",
                    orientationAvailable, accelerationAvailable);
            state = FusionState.INACTIVE;
            return false;
        }
        state = FusionState.CALIBRATING;
        LOG.debug("Inertial fusion waiting for calibration sample");
        return true;
    }

    public void stop() {
        resetState();
        state = FusionState.INACTIVE;
    }

    // Row-major device-to-world
    public void onOrientation(long timestampNs, float[] rotationMatrix) {
        if (state == FusionState.INACTIVE) {
            return;
        }
        System.arraycopy(rotationMatrix, 0, liveRotation, 0, 9);
        hasLiveRotation = true;

        if (state == FusionState.CALIBRATING) {
            calibration.capture(liveRotation);
            leanFilter.prime(0f, timestampNs);
            accelFilter.reset();
            state = FusionState.ACTIVE;
            LOG.info("Inertial fusion calibrated");
            return;
        }

        RotationMath.multiply3x3(liveRotation, calibration.inverse(), relativeRotation);
        float rawLean = (float) Math.atan2(relativeRotation[7], relativeRotation[8]) * RAD_TO_DEG;
        leanFilter.update(rawLean, timestampNs);
    }

    public void onRotationVector(long timestampNs, float[] rotationVector) {
        if (state == FusionState.INACTIVE) {
            return;
        }
        RotationMath.rotationMatrixFromVector(rotationVector, vectorScratch);
        onOrientation(timestampNs, vectorScratch);
    }

    public void onAcceleration(long timestampNs, float x, float y, float z) {
        if (state != FusionState.ACTIVE || !hasLiveRotation) {
            return;
        }
        float[] r = liveRotation;
        float worldX = r[0] * x + r[1] * y + r[2] * z;
        float worldY = r[3] * x + r[4] * y + r[5] * z;

        float[] forward = calibration.forwardWorld();
        float rawAccel = worldX * forward[0] + worldY * forward[1];
        accelFilter.update(rawAccel, timestampNs);
    }

    public FusionState state() {
        return state;
    }

    public boolean isActive() {
        return state != FusionState.INACTIVE;
    }

    public float leanAngleDeg() {
        return state == FusionState.ACTIVE ? leanFilter.value() : Float.NaN;
    }

    public float longitudinalAccelMps2() {
        return state == FusionState.ACTIVE && accelFilter.hasValue() ? accelFilter.value() : Float.NaN;
    }

    CalibrationFrame calibration() {
        return calibration;
    }

    private void resetState() {
        calibration.invalidate();
        leanFilter.reset();
        accelFilter.reset();
        hasLiveRotation = false;
    }
}
