package io.ridetrack;

import io.ridetrack.trigger.TriggerMode;

import java.io.Serializable;
import java.util.Map;

/**
 * Job and recorder settings, read from environment variables. Shipped to the Flink task managers
 * with the keyed function, hence serializable.
 */
public class RecorderConfig implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final String DEFAULT_INPUT_TOPIC = "ride-telemetry";
    public static final String DEFAULT_OUTPUT_TOPIC = "ride-events";
    public static final String DEFAULT_GROUP_ID = "ride-recorder";
    public static final String DEFAULT_STORAGE_DIR = "./ride-data";
    public static final long DEFAULT_FINALIZE_TIMEOUT_MS = 20 * 60 * 1000L;
    public static final long DEFAULT_FLUSH_INTERVAL_MS = 10_000L;
    public static final long DEFAULT_STATS_INTERVAL_MS = 1_000L;
    public static final float DEFAULT_MAX_ACCURACY_M = 20f;
    public static final float DEFAULT_MOTION_THRESHOLD = 0.8f;
    public static final long DEFAULT_STILLNESS_MS = 5_000L;

    private String bootstrapServers;
    private String inputTopic = DEFAULT_INPUT_TOPIC;
    private String outputTopic = DEFAULT_OUTPUT_TOPIC;
    private String groupId = DEFAULT_GROUP_ID;
    private String storageDir = DEFAULT_STORAGE_DIR;
    private TriggerMode triggerMode = TriggerMode.POWER;
    private long finalizeTimeoutMs = DEFAULT_FINALIZE_TIMEOUT_MS;
    private long flushIntervalMs = DEFAULT_FLUSH_INTERVAL_MS;
    private long statsIntervalMs = DEFAULT_STATS_INTERVAL_MS;
    private float maxAccuracyMeters = DEFAULT_MAX_ACCURACY_M;
    private float minDistanceMeters;
    private boolean sensorRecording = true;
    private float motionThreshold = DEFAULT_MOTION_THRESHOLD;
    private long stillnessMs = DEFAULT_STILLNESS_MS;

    public RecorderConfig() {
        // defaults
    }

    public static RecorderConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static RecorderConfig fromEnvironment(Map<String, String> env) {
        RecorderConfig config = new RecorderConfig();
        config.bootstrapServers = env.get("BOOTSTRAP_SERVERS");
        config.inputTopic = env.getOrDefault("INPUT_TOPIC", DEFAULT_INPUT_TOPIC);
        config.outputTopic = env.getOrDefault("OUTPUT_TOPIC", DEFAULT_OUTPUT_TOPIC);
        config.groupId = env.getOrDefault("GROUP_ID", DEFAULT_GROUP_ID);
        config.storageDir = env.getOrDefault("STORAGE_DIR", DEFAULT_STORAGE_DIR);
        config.triggerMode = parseTriggerMode(env.get("TRIGGER_MODE"));
        config.finalizeTimeoutMs = positiveLong(env, "FINALIZE_TIMEOUT_MS", DEFAULT_FINALIZE_TIMEOUT_MS);
        config.flushIntervalMs = positiveLong(env, "FLUSH_INTERVAL_MS", DEFAULT_FLUSH_INTERVAL_MS);
        config.statsIntervalMs = positiveLong(env, "STATS_INTERVAL_MS", DEFAULT_STATS_INTERVAL_MS);
        config.maxAccuracyMeters = nonNegativeFloat(env, "MAX_ACCURACY_M", DEFAULT_MAX_ACCURACY_M);
        config.minDistanceMeters = nonNegativeFloat(env, "MIN_DISTANCE_M", 0f);
        config.sensorRecording = Boolean.parseBoolean(env.getOrDefault("SENSOR_RECORDING", "true"));
        config.motionThreshold = nonNegativeFloat(env, "MOTION_THRESHOLD", DEFAULT_MOTION_THRESHOLD);
        config.stillnessMs = positiveLong(env, "STILLNESS_MS", DEFAULT_STILLNESS_MS);
        return config;
    }

    private static TriggerMode parseTriggerMode(String value) {
        if (value == null || value.isBlank()) {
            return TriggerMode.POWER;
        }
        try {
            return TriggerMode.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("TRIGGER_MODE must be one of POWER, MOTION, EMULATED_POWER: " + value, e);
        }
    }

    private static long positiveLong(Map<String, String> env, String name, long fallback) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            long parsed = Long.parseLong(value.trim());
            if (parsed <= 0) {
                throw new IllegalArgumentException(name + " must be positive: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not a number: " + value, e);
        }
    }

    private static float nonNegativeFloat(Map<String, String> env, String name, float fallback) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            float parsed = Float.parseFloat(value.trim());
            if (parsed < 0 || Float.isNaN(parsed)) {
                throw new IllegalArgumentException(name + " must not be negative: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not a number: " + value, e);
        }
    }

    // Getters and Setters
    public String getBootstrapServers() { return bootstrapServers; }
    public void setBootstrapServers(String bootstrapServers) { this.bootstrapServers = bootstrapServers; }
    public String getInputTopic() { return inputTopic; }
    public void setInputTopic(String inputTopic) { this.inputTopic = inputTopic; }
    public String getOutputTopic() { return outputTopic; }
    public void setOutputTopic(String outputTopic) { this.outputTopic = outputTopic; }
    public String getGroupId() { return groupId; }
    public void setGroupId(String groupId) { this.groupId = groupId; }
    public String getStorageDir() { return storageDir; }
    public void setStorageDir(String storageDir) { this.storageDir = storageDir; }
    public TriggerMode getTriggerMode() { return triggerMode; }
    public void setTriggerMode(TriggerMode triggerMode) { this.triggerMode = triggerMode; }
    public long getFinalizeTimeoutMs() { return finalizeTimeoutMs; }
    public void setFinalizeTimeoutMs(long finalizeTimeoutMs) { this.finalizeTimeoutMs = finalizeTimeoutMs; }
    public long getFlushIntervalMs() { return flushIntervalMs; }
    public void setFlushIntervalMs(long flushIntervalMs) { this.flushIntervalMs = flushIntervalMs; }
    public long getStatsIntervalMs() { return statsIntervalMs; }
    public void setStatsIntervalMs(long statsIntervalMs) { this.statsIntervalMs = statsIntervalMs; }
    public float getMaxAccuracyMeters() { return maxAccuracyMeters; }
    public void setMaxAccuracyMeters(float maxAccuracyMeters) { this.maxAccuracyMeters = maxAccuracyMeters; }
    public float getMinDistanceMeters() { return minDistanceMeters; }
    public void setMinDistanceMeters(float minDistanceMeters) { this.minDistanceMeters = minDistanceMeters; }
    public boolean isSensorRecording() { return sensorRecording; }
    public void setSensorRecording(boolean sensorRecording) { this.sensorRecording = sensorRecording; }
    public float getMotionThreshold() { return motionThreshold; }
    public void setMotionThreshold(float motionThreshold) { this.motionThreshold = motionThreshold; }
    public long getStillnessMs() { return stillnessMs; }
    public void setStillnessMs(long stillnessMs) { this.stillnessMs = stillnessMs; }
}
