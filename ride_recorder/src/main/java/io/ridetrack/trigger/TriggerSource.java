package io.ridetrack.trigger;

import io.ridetrack.RecorderConfig;

/**
 * Deployment policy deciding when recording starts and pauses. Implementations look at whatever
 * observations they care about and answer with a {@link TriggerSignal}; the session engine only
 * ever sees the resulting start and pause events.
 */
public interface TriggerSource {

    default TriggerSignal onPowerState(boolean connected, long atMs) {
        return TriggerSignal.NONE;
    }

    default TriggerSignal onLinearAcceleration(float x, float y, float z, long atMs) {
        return TriggerSignal.NONE;
    }

    default TriggerSignal onTick(long atMs) {
        return TriggerSignal.NONE;
    }

    default void onUserCommand(boolean start, long atMs) {
    }

    static TriggerSource forConfig(RecorderConfig config) {
        switch (config.getTriggerMode()) {
            case POWER:
                return new PowerTriggerSource();
            case MOTION:
                return new MotionTriggerSource(config.getMotionThreshold(), config.getStillnessMs());
            case EMULATED_POWER:
                return new EmulatedPowerTriggerSource();
            default:
                throw new IllegalArgumentException("Unknown trigger mode " + config.getTriggerMode());
        }
    }
}
