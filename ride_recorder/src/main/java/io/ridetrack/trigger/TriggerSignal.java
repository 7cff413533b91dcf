package io.ridetrack.trigger;

public enum TriggerSignal {
    NONE,
    START,
    PAUSE
}
