package io.ridetrack.session;

import com.fasterxml.jackson.annotation.JsonProperty;

public class SessionStatistics {
    @JsonProperty("distance_m")
    private double distanceMeters;

    @JsonProperty("duration_ms")
    private long durationMs;

    @JsonProperty("is_recording")
    private boolean recording;

    @JsonProperty("file_name")
    private String fileName;

    @JsonProperty("pause_timeout_remaining_ms")
    private long pauseTimeoutRemainingMs;

    @JsonProperty("paused_for_ms")
    private long pausedForMs;

    @JsonProperty("current_accuracy")
    private float currentAccuracy;

    @JsonProperty("avg_accuracy")
    private float avgAccuracy;

    @JsonProperty("current_update_rate_hz")
    private float currentUpdateRateHz;

    @JsonProperty("avg_update_rate_hz")
    private float avgUpdateRateHz;

    // Default constructor
    public SessionStatistics() {
        // Explicit default constructor
    }

    // Getters and Setters
    public double getDistanceMeters() { return distanceMeters; }
    public void setDistanceMeters(double distanceMeters) { this.distanceMeters = distanceMeters; }
    public long getDurationMs() { return durationMs; }
    public void setDurationMs(long durationMs) { this.durationMs = durationMs; }
    public boolean isRecording() { return recording; }
    public void setRecording(boolean recording) { this.recording = recording; }
    public String getFileName() { return fileName; }
    public void setFileName(String fileName) { this.fileName = fileName; }
    public long getPauseTimeoutRemainingMs() { return pauseTimeoutRemainingMs; }
    public void setPauseTimeoutRemainingMs(long pauseTimeoutRemainingMs) { this.pauseTimeoutRemainingMs = pauseTimeoutRemainingMs; }
    public long getPausedForMs() { return pausedForMs; }
    public void setPausedForMs(long pausedForMs) { this.pausedForMs = pausedForMs; }
    public float getCurrentAccuracy() { return currentAccuracy; }
    public void setCurrentAccuracy(float currentAccuracy) { this.currentAccuracy = currentAccuracy; }
    public float getAvgAccuracy() { return avgAccuracy; }
    public void setAvgAccuracy(float avgAccuracy) { this.avgAccuracy = avgAccuracy; }
    public float getCurrentUpdateRateHz() { return currentUpdateRateHz; }
    public void setCurrentUpdateRateHz(float currentUpdateRateHz) { this.currentUpdateRateHz = currentUpdateRateHz; }
    public float getAvgUpdateRateHz() { return avgUpdateRateHz; }
    public void setAvgUpdateRateHz(float avgUpdateRateHz) { this.avgUpdateRateHz = avgUpdateRateHz; }

    public String toString() {
        return String.format(">> file: %s, recording: %s, distance_m: %.1f, duration_ms: %s",
                fileName, recording, distanceMeters, durationMs);
    }
}
