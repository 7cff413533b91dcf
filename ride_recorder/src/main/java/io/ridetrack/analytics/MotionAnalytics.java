package io.ridetrack.analytics;

import io.ridetrack.model.TrackPoint;

import java.util.List;

/**
 * Derived series and statistics of a finished track. Sensor values are used when recorded, GPS estimates otherwise.
 */
public final class MotionAnalytics {

    /** ~2 km/h. */
    public static final float MOVING_SPEED_THRESHOLD_MPS = 0.556f;
    public static final long MAX_MOVING_INTERVAL_MS = 60_000L;

    /** ~10 km/h; slower turns are dominated by GPS noise. */
    public static final double MIN_LEAN_SPEED_MPS = 2.8;
    public static final double MIN_LEAN_SEGMENT_M = 2.0;
    public static final double MAX_LEAN_DEG = 60.0;

    public static final long MAX_ACCEL_INTERVAL_MS = 10_000L;

    private MotionAnalytics() {
        // hidden constructor
    }

    public static double distanceMeters(List<TrackPoint> points) {
        double total = 0.0;
        for (int i = 1; i < points.size(); i++) {
            total += GeoMath.distanceMeters(points.get(i - 1), points.get(i));
        }
        return total;
    }

    public static long totalDurationMs(List<TrackPoint> points) {
        if (points.size() < 2) {
            return 0L;
        }
        long duration = points.get(points.size() - 1).getTimestampMs() - points.get(0).getTimestampMs();
        return Math.max(0L, duration);
    }

    public static long movingTimeMs(List<TrackPoint> points) {
        long moving = 0L;
        for (int i = 1; i < points.size(); i++) {
            TrackPoint prev = points.get(i - 1);
            TrackPoint cur = points.get(i);
            if (isMovingInterval(prev, cur)) {
                moving += cur.getTimestampMs() - prev.getTimestampMs();
            }
        }
        return moving;
    }

    public static boolean isMovingInterval(TrackPoint prev, TrackPoint cur) {
        long intervalMs = cur.getTimestampMs() - prev.getTimestampMs();
        if (intervalMs <= 0 || intervalMs > MAX_MOVING_INTERVAL_MS) {
            return false;
        }
        float avgSpeed = (prev.getSpeedMps() + cur.getSpeedMps()) / 2f;
        return avgSpeed > MOVING_SPEED_THRESHOLD_MPS;
    }

    public static long pausedTimeMs(List<TrackPoint> points) {
        return Math.max(0L, totalDurationMs(points) - movingTimeMs(points));
    }

    public static boolean hasSensorLean(List<TrackPoint> points) {
        for (TrackPoint point : points) {
            if (point.hasLeanAngle()) {
                return true;
            }
        }
        return false;
    }

    public static boolean hasSensorAccel(List<TrackPoint> points) {
        for (TrackPoint point : points) {
            if (point.hasLongitudinalAccel()) {
                return true;
            }
        }
        return false;
    }

    public static double[] leanSeries(List<TrackPoint> points) {
        if (!hasSensorLean(points)) {
            return estimateLeanFromTrajectory(points);
        }
        double[] series = new double[points.size()];
        for (int i = 0; i < series.length; i++) {
            TrackPoint point = points.get(i);
            series[i] = point.hasLeanAngle() ? point.getLeanAngleDeg() : 0.0;
        }
        return series;
    }

    public static double[] longitudinalSeries(List<TrackPoint> points) {
        if (!hasSensorAccel(points)) {
            return estimateLongitudinalFromSpeed(points);
        }
        double[] series = new double[points.size()];
        for (int i = 0; i < series.length; i++) {
            TrackPoint point = points.get(i);
            series[i] = point.hasLongitudinalAccel() ? point.getLongitudinalAccelMps2() / GeoMath.GRAVITY_MPS2 : 0.0;
        }
        return series;
    }

    // r = arc / dTheta, lean = atan(v^2 / (r * g)); negative for left turns
    public static double[] estimateLeanFromTrajectory(List<TrackPoint> points) {
        double[] lean = new double[points.size()];
        for (int i = 1; i < points.size() - 1; i++) {
            TrackPoint prev = points.get(i - 1);
            TrackPoint cur = points.get(i);
            TrackPoint next = points.get(i + 1);

            double speed = cur.getSpeedMps();
            if (speed < MIN_LEAN_SPEED_MPS) {
                continue;
            }
            double inLeg = GeoMath.distanceMeters(prev, cur);
            double outLeg = GeoMath.distanceMeters(cur, next);
            if (inLeg < MIN_LEAN_SEGMENT_M || outLeg < MIN_LEAN_SEGMENT_M) {
                continue;
            }

            double delta = GeoMath.bearingDeltaDeg(GeoMath.bearingDeg(prev, cur), GeoMath.bearingDeg(cur, next));
            double deltaRad = Math.toRadians(Math.abs(delta));
            if (deltaRad < 1e-9) {
                continue;
            }
            double radius = ((inLeg + outLeg) / 2.0) / deltaRad;
            double angle = Math.toDegrees(Math.atan(speed * speed / (radius * GeoMath.GRAVITY_MPS2)));
            lean[i] = Math.copySign(Math.min(angle, MAX_LEAN_DEG), delta);
        }
        return lean;
    }

    public static double[] estimateLongitudinalFromSpeed(List<TrackPoint> points) {
        double[] force = new double[points.size()];
        for (int i = 1; i < points.size(); i++) {
            TrackPoint prev = points.get(i - 1);
            TrackPoint cur = points.get(i);
            long intervalMs = cur.getTimestampMs() - prev.getTimestampMs();
            if (intervalMs <= 0 || intervalMs > MAX_ACCEL_INTERVAL_MS) {
                continue;
            }
            double dv = cur.getSpeedMps() - prev.getSpeedMps();
            force[i] = dv / (intervalMs / 1000.0) / GeoMath.GRAVITY_MPS2;
        }
        return force;
    }

    public static TrackSummary summarize(List<TrackPoint> points) {
        TrackSummary summary = new TrackSummary();
        summary.setPointCount(points.size());
        if (points.isEmpty()) {
            return summary;
        }

        double distance = distanceMeters(points);
        long moving = movingTimeMs(points);
        summary.setDistanceMeters(distance);
        summary.setTotalDurationMs(totalDurationMs(points));
        summary.setMovingTimeMs(moving);
        summary.setPausedTimeMs(pausedTimeMs(points));
        summary.setAvgMovingSpeedKmh(moving > 0 ? (distance / 1000.0) / (moving / 3_600_000.0) : 0.0);

        double maxSpeed = 0.0;
        for (TrackPoint point : points) {
            maxSpeed = Math.max(maxSpeed, point.getSpeedMps());
        }
        summary.setMaxSpeedKmh(maxSpeed * 3.6);

        double maxLean = 0.0;
        for (double lean : leanSeries(points)) {
            maxLean = Math.max(maxLean, Math.abs(lean));
        }
        summary.setMaxLeanDeg(maxLean);

        double maxAccel = 0.0;
        double maxBrake = 0.0;
        for (double force : longitudinalSeries(points)) {
            maxAccel = Math.max(maxAccel, force);
            maxBrake = Math.max(maxBrake, -force);
        }
        summary.setMaxAccelG(maxAccel);
        summary.setMaxBrakeG(maxBrake);
        summary.setLeanFromSensor(hasSensorLean(points));
        summary.setAccelFromSensor(hasSensorAccel(points));
        return summary;
    }
}
