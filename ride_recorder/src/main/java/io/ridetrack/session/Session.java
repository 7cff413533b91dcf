package io.ridetrack.session;

import io.ridetrack.model.TrackPoint;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one trip, owned by {@link SessionEngine}. The scheduled deadlines live here too,
 * so dropping the session cancels all of its timers at once.
 */
final class Session {

    static final long UNSCHEDULED = -1L;

    final String token;
    final long startMs;
    final GpsQualityTracker gps = new GpsQualityTracker();
    final List<TrackPoint> buffer = new ArrayList<>();

    SessionState state = SessionState.RECORDING;
    int sequenceNumber;
    double distanceMeters;
    TrackPoint lastPoint;
    int consecutiveFlushFailures;

    long pausedAtMs = UNSCHEDULED;
    long finalizeDeadlineMs = UNSCHEDULED;
    long nextFlushMs = UNSCHEDULED;
    long nextStatsMs = UNSCHEDULED;

    Session(String token, long startMs) {
        this.token = token;
        this.startMs = startMs;
    }
}
