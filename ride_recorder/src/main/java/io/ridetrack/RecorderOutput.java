package io.ridetrack;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.ridetrack.analytics.TrackSummary;
import io.ridetrack.session.SessionEffect;
import io.ridetrack.session.SessionStatistics;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class RecorderOutput {
    @JsonProperty("device_id")
    private String deviceId;

    @JsonProperty("event_type")
    private String eventType;

    @JsonProperty("token")
    private String token;

    @JsonProperty("occurred_at_ms")
    private long occurredAtMs;

    @JsonProperty("statistics")
    private SessionStatistics statistics;

    @JsonProperty("track_file")
    private String trackFile;

    @JsonProperty("summary")
    private TrackSummary summary;

    @JsonProperty("recovered_count")
    private Integer recoveredCount;

    @JsonProperty("buffered_points")
    private Integer bufferedPoints;

    // Default constructor
    public RecorderOutput() {
        // Explicit default constructor
    }

    public RecorderOutput(String deviceId, SessionEffect effect) {
        this.deviceId = deviceId;
        this.eventType = effect.getType().name();
        this.token = effect.getToken();
        this.occurredAtMs = effect.getOccurredAtMs();
        this.statistics = effect.getStatistics();
        this.trackFile = effect.getTrackFile() != null ? effect.getTrackFile().toString() : null;
        this.summary = effect.getSummary();
        if (effect.getType() == SessionEffect.Type.SESSIONS_RECOVERED) {
            this.recoveredCount = effect.getCount();
        } else if (effect.getType() == SessionEffect.Type.FLUSH_FAILED) {
            this.bufferedPoints = effect.getCount();
        }
    }

    // Getters and Setters
    public String getDeviceId() { return deviceId; }
    public void setDeviceId(String deviceId) { this.deviceId = deviceId; }
    public String getEventType() { return eventType; }
    public void setEventType(String eventType) { this.eventType = eventType; }
    public String getToken() { return token; }
    public void setToken(String token) { this.token = token; }
    public long getOccurredAtMs() { return occurredAtMs; }
    public void setOccurredAtMs(long occurredAtMs) { this.occurredAtMs = occurredAtMs; }
    public SessionStatistics getStatistics() { return statistics; }
    public void setStatistics(SessionStatistics statistics) { this.statistics = statistics; }
    public String getTrackFile() { return trackFile; }
    public void setTrackFile(String trackFile) { this.trackFile = trackFile; }
    public TrackSummary getSummary() { return summary; }
    public void setSummary(TrackSummary summary) { this.summary = summary; }
    public Integer getRecoveredCount() { return recoveredCount; }
    public void setRecoveredCount(Integer recoveredCount) { this.recoveredCount = recoveredCount; }
    public Integer getBufferedPoints() { return bufferedPoints; }
    public void setBufferedPoints(Integer bufferedPoints) { this.bufferedPoints = bufferedPoints; }

    public String toString() {
        return String.format(">> device_id: %s, event_type: %s, token: %s", this.deviceId, this.eventType, this.token);
    }
}
