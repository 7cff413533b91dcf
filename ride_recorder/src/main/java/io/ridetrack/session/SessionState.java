package io.ridetrack.session;

public enum SessionState {
    IDLE,
    RECORDING,
    PENDING_FINALIZE
}
