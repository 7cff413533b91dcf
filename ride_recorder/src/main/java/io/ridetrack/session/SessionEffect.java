package io.ridetrack.session;

import io.ridetrack.analytics.TrackSummary;

import java.nio.file.Path;

/**
 * Output of {@link SessionEngine#apply}: lifecycle notifications, periodic statistics and warnings.
 */
public final class SessionEffect {

    public enum Type {
        SESSION_STARTED,
        SESSION_RESUMED,
        SESSION_PAUSED,
        SESSION_FINALIZED,
        STATISTICS,
        FLUSH_FAILED,
        SESSIONS_RECOVERED
    }

    private final Type type;
    private final String token;
    private final long occurredAtMs;
    private final SessionStatistics statistics;
    private final Path trackFile;
    private final TrackSummary summary;
    private final int count;

    private SessionEffect(Type type, String token, long occurredAtMs, SessionStatistics statistics,
                          Path trackFile, TrackSummary summary, int count) {
        this.type = type;
        this.token = token;
        this.occurredAtMs = occurredAtMs;
        this.statistics = statistics;
        this.trackFile = trackFile;
        this.summary = summary;
        this.count = count;
    }

    static SessionEffect lifecycle(Type type, String token, long occurredAtMs) {
        return new SessionEffect(type, token, occurredAtMs, null, null, null, 0);
    }

    static SessionEffect statistics(String token, long occurredAtMs, SessionStatistics statistics) {
        return new SessionEffect(Type.STATISTICS, token, occurredAtMs, statistics, null, null, 0);
    }

    static SessionEffect finalized(String token, long occurredAtMs, Path trackFile, TrackSummary summary) {
        return new SessionEffect(Type.SESSION_FINALIZED, token, occurredAtMs, null, trackFile, summary, 0);
    }

    static SessionEffect flushFailed(String token, long occurredAtMs, int bufferedPoints) {
        return new SessionEffect(Type.FLUSH_FAILED, token, occurredAtMs, null, null, null, bufferedPoints);
    }

    static SessionEffect recovered(long occurredAtMs, int recoveredSessions) {
        return new SessionEffect(Type.SESSIONS_RECOVERED, null, occurredAtMs, null, null, null, recoveredSessions);
    }

    public Type getType() { return type; }
    public String getToken() { return token; }
    public long getOccurredAtMs() { return occurredAtMs; }
    public SessionStatistics getStatistics() { return statistics; }
    public Path getTrackFile() { return trackFile; }
    public TrackSummary getSummary() { return summary; }
    // Buffered points for FLUSH_FAILED, recovered sessions for SESSIONS_RECOVERED
    public int getCount() { return count; }

    public String toString() {
        return String.format(">> %s token: %s at %s", type, token, occurredAtMs);
    }
}
