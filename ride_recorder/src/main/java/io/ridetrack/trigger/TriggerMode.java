package io.ridetrack.trigger;

public enum TriggerMode {
    POWER,
    MOTION,
    EMULATED_POWER
}
