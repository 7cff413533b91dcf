package io.ridetrack.analytics;

import io.ridetrack.model.TrackPoint;

public final class GeoMath {

    public static final double EARTH_RADIUS_KM = 6371.0;
    public static final double GRAVITY_MPS2 = 9.81;

    private GeoMath() {
        // hidden constructor
    }

    public static double haversineKm(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double a = Math.pow(Math.sin(dLat / 2), 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2)) * Math.pow(Math.sin(dLon / 2), 2);
        return EARTH_RADIUS_KM * 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
    }

    public static double distanceMeters(TrackPoint from, TrackPoint to) {
        return haversineKm(from.getLatitude(), from.getLongitude(), to.getLatitude(), to.getLongitude()) * 1000.0;
    }

    /** Initial bearing from the first point to the second, degrees in [0, 360). */
    public static double bearingDeg(TrackPoint from, TrackPoint to) {
        double lat1 = Math.toRadians(from.getLatitude());
        double lat2 = Math.toRadians(to.getLatitude());
        double dLon = Math.toRadians(to.getLongitude() - from.getLongitude());
        double y = Math.sin(dLon) * Math.cos(lat2);
        double x = Math.cos(lat1) * Math.sin(lat2) - Math.sin(lat1) * Math.cos(lat2) * Math.cos(dLon);
        double bearing = Math.toDegrees(Math.atan2(y, x));
        return (bearing + 360.0) % 360.0;
    }

    /** Signed difference {@code to - from} folded into (-180, 180]. */
    public static double bearingDeltaDeg(double fromDeg, double toDeg) {
        double delta = (toDeg - fromDeg) % 360.0;
        if (delta > 180.0) {
            delta -= 360.0;
        } else if (delta <= -180.0) {
            delta += 360.0;
        }
        return delta;
    }
}
