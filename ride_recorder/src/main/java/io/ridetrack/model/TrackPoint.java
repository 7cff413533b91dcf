package io.ridetrack.model;

import java.util.Objects;

/**
 * One recorded fix. Lean and longitudinal acceleration are NaN when no inertial data was available.
 */
public final class TrackPoint {

    private final double latitude;
    private final double longitude;
    private final double elevation;
    private final float speedMps;
    private final long timestampMs;
    private final float leanAngleDeg;
    private final float longitudinalAccelMps2;

    public TrackPoint(double latitude, double longitude, double elevation, float speedMps, long timestampMs) {
        this(latitude, longitude, elevation, speedMps, timestampMs, Float.NaN, Float.NaN);
    }

    public TrackPoint(double latitude, double longitude, double elevation, float speedMps, long timestampMs,
                      float leanAngleDeg, float longitudinalAccelMps2) {
        this.latitude = latitude;
        this.longitude = longitude;
        this.elevation = elevation;
        this.speedMps = speedMps;
        this.timestampMs = timestampMs;
        this.leanAngleDeg = leanAngleDeg;
        this.longitudinalAccelMps2 = longitudinalAccelMps2;
    }

    public double getLatitude() { return latitude; }
    public double getLongitude() { return longitude; }
    public double getElevation() { return elevation; }
    public float getSpeedMps() { return speedMps; }
    public long getTimestampMs() { return timestampMs; }
    public float getLeanAngleDeg() { return leanAngleDeg; }
    public float getLongitudinalAccelMps2() { return longitudinalAccelMps2; }

    public boolean hasLeanAngle() {
        return !Float.isNaN(leanAngleDeg);
    }

    public boolean hasLongitudinalAccel() {
        return !Float.isNaN(longitudinalAccelMps2);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TrackPoint)) {
            return false;
        }
        TrackPoint that = (TrackPoint) o;
        return Double.compare(latitude, that.latitude) == 0
                && Double.compare(longitude, that.longitude) == 0
                && Double.compare(elevation, that.elevation) == 0
                && Float.compare(speedMps, that.speedMps) == 0
                && timestampMs == that.timestampMs
                && Float.compare(leanAngleDeg, that.leanAngleDeg) == 0
                && Float.compare(longitudinalAccelMps2, that.longitudinalAccelMps2) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(latitude, longitude, elevation, speedMps, timestampMs, leanAngleDeg, longitudinalAccelMps2);
    }

    @Override
    public String toString() {
        return String.format(">> lat: %s, lon: %s, t: %s, speed: %s, lean: %s, accel: %s",
                latitude, longitude, timestampMs, speedMps, leanAngleDeg, longitudinalAccelMps2);
    }
}
