package io.ridetrack.increment;

import io.ridetrack.model.TrackPoint;

/**
 * Line format of a segment file: {@code lat,lon,speed,timestampMs,elevation,lean,accel}, with
 * lean and accel left blank when absent. Values are written at full precision.
 */
public final class SegmentCodec {

    private static final int REQUIRED_FIELDS = 5;

    private SegmentCodec() {
        // hidden constructor
    }

    public static String encode(TrackPoint point) {
        return point.getLatitude() + ","
                + point.getLongitude() + ","
                + point.getSpeedMps() + ","
                + point.getTimestampMs() + ","
                + point.getElevation() + ","
                + optional(point.getLeanAngleDeg()) + ","
                + optional(point.getLongitudinalAccelMps2());
    }

    // null if latitude, longitude or timestamp is unusable
    public static TrackPoint decode(String line) {
        String[] parts = line.split(",", -1);
        if (parts.length < REQUIRED_FIELDS) {
            return null;
        }
        try {
            double lat = Double.parseDouble(parts[0]);
            double lon = Double.parseDouble(parts[1]);
            long timestampMs = Long.parseLong(parts[3]);
            float speed = parseFloat(parts[2], 0f);
            double elevation = parseDouble(parts[4], 0.0);
            float lean = parts.length > 5 ? parseFloat(parts[5], Float.NaN) : Float.NaN;
            float accel = parts.length > 6 ? parseFloat(parts[6], Float.NaN) : Float.NaN;
            return new TrackPoint(lat, lon, elevation, speed, timestampMs, lean, accel);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String optional(float value) {
        return Float.isNaN(value) ? "" : Float.toString(value);
    }

    private static float parseFloat(String text, float fallback) {
        if (text.isBlank()) {
            return fallback;
        }
        try {
            return Float.parseFloat(text);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static double parseDouble(String text, double fallback) {
        if (text.isBlank()) {
            return fallback;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
