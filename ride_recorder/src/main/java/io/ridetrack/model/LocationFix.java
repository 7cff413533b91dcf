package io.ridetrack.model;

/**
 * A position reported by the location source. Speed, altitude and accuracy are null when the
 * receiver did not provide them.
 */
public final class LocationFix {

    private final double latitude;
    private final double longitude;
    private final Float speedMps;
    private final Double altitude;
    private final Float accuracyMeters;
    private final long timeMs;

    public LocationFix(double latitude, double longitude, Float speedMps, Double altitude, Float accuracyMeters,
                       long timeMs) {
        this.latitude = latitude;
        this.longitude = longitude;
        this.speedMps = speedMps;
        this.altitude = altitude;
        this.accuracyMeters = accuracyMeters;
        this.timeMs = timeMs;
    }

    public double getLatitude() { return latitude; }
    public double getLongitude() { return longitude; }
    public Float getSpeedMps() { return speedMps; }
    public Double getAltitude() { return altitude; }
    public Float getAccuracyMeters() { return accuracyMeters; }
    public long getTimeMs() { return timeMs; }

    public boolean hasAccuracy() {
        return accuracyMeters != null;
    }

    public String toString() {
        return String.format(">> lat: %s, lon: %s, speed: %s, accuracy: %s, t: %s",
                latitude, longitude, speedMps, accuracyMeters, timeMs);
    }
}
