package io.ridetrack.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;

public class TrackSummary {
    @JsonProperty("point_count")
    private int pointCount;

    @JsonProperty("distance_m")
    private double distanceMeters;

    @JsonProperty("total_duration_ms")
    private long totalDurationMs;

    @JsonProperty("moving_time_ms")
    private long movingTimeMs;

    @JsonProperty("paused_time_ms")
    private long pausedTimeMs;

    @JsonProperty("avg_moving_speed_kmh")
    private double avgMovingSpeedKmh;

    @JsonProperty("max_speed_kmh")
    private double maxSpeedKmh;

    @JsonProperty("max_lean_deg")
    private double maxLeanDeg;

    @JsonProperty("max_accel_g")
    private double maxAccelG;

    @JsonProperty("max_brake_g")
    private double maxBrakeG;

    @JsonProperty("lean_from_sensor")
    private boolean leanFromSensor;

    @JsonProperty("accel_from_sensor")
    private boolean accelFromSensor;

    // Default constructor
    public TrackSummary() {
        // Explicit default constructor
    }

    // Getters and Setters
    public int getPointCount() { return pointCount; }
    public void setPointCount(int pointCount) { this.pointCount = pointCount; }
    public double getDistanceMeters() { return distanceMeters; }
    public void setDistanceMeters(double distanceMeters) { this.distanceMeters = distanceMeters; }
    public long getTotalDurationMs() { return totalDurationMs; }
    public void setTotalDurationMs(long totalDurationMs) { this.totalDurationMs = totalDurationMs; }
    public long getMovingTimeMs() { return movingTimeMs; }
    public void setMovingTimeMs(long movingTimeMs) { this.movingTimeMs = movingTimeMs; }
    public long getPausedTimeMs() { return pausedTimeMs; }
    public void setPausedTimeMs(long pausedTimeMs) { this.pausedTimeMs = pausedTimeMs; }
    public double getAvgMovingSpeedKmh() { return avgMovingSpeedKmh; }
    public void setAvgMovingSpeedKmh(double avgMovingSpeedKmh) { this.avgMovingSpeedKmh = avgMovingSpeedKmh; }
    public double getMaxSpeedKmh() { return maxSpeedKmh; }
    public void setMaxSpeedKmh(double maxSpeedKmh) { this.maxSpeedKmh = maxSpeedKmh; }
    public double getMaxLeanDeg() { return maxLeanDeg; }
    public void setMaxLeanDeg(double maxLeanDeg) { this.maxLeanDeg = maxLeanDeg; }
    public double getMaxAccelG() { return maxAccelG; }
    public void setMaxAccelG(double maxAccelG) { this.maxAccelG = maxAccelG; }
    public double getMaxBrakeG() { return maxBrakeG; }
    public void setMaxBrakeG(double maxBrakeG) { this.maxBrakeG = maxBrakeG; }
    public boolean isLeanFromSensor() { return leanFromSensor; }
    public void setLeanFromSensor(boolean leanFromSensor) { this.leanFromSensor = leanFromSensor; }
    public boolean isAccelFromSensor() { return accelFromSensor; }
    public void setAccelFromSensor(boolean accelFromSensor) { this.accelFromSensor = accelFromSensor; }

    public String toString() {
        return String.format(">> points: %s, distance_m: %.1f, moving_ms: %s, paused_ms: %s, max_lean: %.1f",
                pointCount, distanceMeters, movingTimeMs, pausedTimeMs, maxLeanDeg);
    }
}
