package io.ridetrack.fusion;

public enum FusionState {
    INACTIVE,
    CALIBRATING,
    ACTIVE
}
