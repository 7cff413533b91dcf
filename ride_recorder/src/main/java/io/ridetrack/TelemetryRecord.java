package io.ridetrack;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class TelemetryRecord {
    public static final String LOCATION_FIX = "LOCATION_FIX";
    public static final String ORIENTATION = "ORIENTATION";
    public static final String LINEAR_ACCELERATION = "LINEAR_ACCELERATION";
    public static final String POWER_STATE = "POWER_STATE";
    public static final String USER_START = "USER_START";
    public static final String USER_STOP = "USER_STOP";
    public static final String CAPABILITIES = "CAPABILITIES";

    @JsonProperty("device_id")
    private String deviceId;

    @JsonProperty("event_type")
    private String eventType;

    @JsonProperty("occurred_at_ms")
    private long occurredAtMs;

    @JsonProperty("location")
    private Location location;

    @JsonProperty("orientation")
    private Orientation orientation;

    @JsonProperty("acceleration")
    private Acceleration acceleration;

    @JsonProperty("power")
    private Power power;

    @JsonProperty("capabilities")
    private Capabilities capabilities;

    // Default constructor
    public TelemetryRecord() {
        // Explicit default constructor
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Location {
        @JsonProperty("latitude")
        private double latitude;

        @JsonProperty("longitude")
        private double longitude;

        @JsonProperty("speed")
        private Float speed;

        @JsonProperty("altitude")
        private Double altitude;

        @JsonProperty("accuracy")
        private Float accuracy;

        @JsonProperty("time_ms")
        private long timeMs;

        // Default constructor
        public Location() {
            // Explicit default constructor
        }

        public double getLatitude() { return latitude; }
        public void setLatitude(double latitude) { this.latitude = latitude; }
        public double getLongitude() { return longitude; }
        public void setLongitude(double longitude) { this.longitude = longitude; }
        public Float getSpeed() { return speed; }
        public void setSpeed(Float speed) { this.speed = speed; }
        public Double getAltitude() { return altitude; }
        public void setAltitude(Double altitude) { this.altitude = altitude; }
        public Float getAccuracy() { return accuracy; }
        public void setAccuracy(Float accuracy) { this.accuracy = accuracy; }
        public long getTimeMs() { return timeMs; }
        public void setTimeMs(long timeMs) { this.timeMs = timeMs; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Orientation {
        @JsonProperty("timestamp_ns")
        private long timestampNs;

        @JsonProperty("rotation_matrix")
        private float[] rotationMatrix;

        @JsonProperty("rotation_vector")
        private float[] rotationVector;

        // Default constructor
        public Orientation() {
            // Explicit default constructor
        }

        public long getTimestampNs() { return timestampNs; }
        public void setTimestampNs(long timestampNs) { this.timestampNs = timestampNs; }
        public float[] getRotationMatrix() { return rotationMatrix; }
        public void setRotationMatrix(float[] rotationMatrix) { this.rotationMatrix = rotationMatrix; }
        public float[] getRotationVector() { return rotationVector; }
        public void setRotationVector(float[] rotationVector) { this.rotationVector = rotationVector; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Acceleration {
        @JsonProperty("timestamp_ns")
        private long timestampNs;

        private float x, y, z;

        // Default constructor
        public Acceleration() {
            // Explicit default constructor
        }

        public long getTimestampNs() { return timestampNs; }
        public void setTimestampNs(long timestampNs) { this.timestampNs = timestampNs; }
        public float getX() { return x; }
        public void setX(float x) { this.x = x; }
        public float getY() { return y; }
        public void setY(float y) { this.y = y; }
        public float getZ() { return z; }
        public void setZ(float z) { this.z = z; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Power {
        @JsonProperty("connected")
        private boolean connected;

        // Default constructor
        public Power() {
            // Explicit default constructor
        }

        public boolean isConnected() { return connected; }
        public void setConnected(boolean connected) { this.connected = connected; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Capabilities {
        @JsonProperty("orientation")
        private boolean orientation = true;

        @JsonProperty("linear_acceleration")
        private boolean linearAcceleration = true;

        // Default constructor
        public Capabilities() {
            // Explicit default constructor
        }

        public boolean isOrientation() { return orientation; }
        public void setOrientation(boolean orientation) { this.orientation = orientation; }
        public boolean isLinearAcceleration() { return linearAcceleration; }
        public void setLinearAcceleration(boolean linearAcceleration) { this.linearAcceleration = linearAcceleration; }
    }

    // Getters and Setters
    public String getDeviceId() { return deviceId; }
    public void setDeviceId(String deviceId) { this.deviceId = deviceId; }
    public String getEventType() { return eventType; }
    public void setEventType(String eventType) { this.eventType = eventType; }
    public long getOccurredAtMs() { return occurredAtMs; }
    public void setOccurredAtMs(long occurredAtMs) { this.occurredAtMs = occurredAtMs; }
    public Location getLocation() { return location; }
    public void setLocation(Location location) { this.location = location; }
    public Orientation getOrientation() { return orientation; }
    public void setOrientation(Orientation orientation) { this.orientation = orientation; }
    public Acceleration getAcceleration() { return acceleration; }
    public void setAcceleration(Acceleration acceleration) { this.acceleration = acceleration; }
    public Power getPower() { return power; }
    public void setPower(Power power) { this.power = power; }
    public Capabilities getCapabilities() { return capabilities; }
    public void setCapabilities(Capabilities capabilities) { this.capabilities = capabilities; }

    public String toString() {
        return String.format(">> device_id: %s, event_type: %s, occurred_at_ms: %s", deviceId, eventType, occurredAtMs);
    }
}
