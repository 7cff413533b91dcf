package io.ridetrack.session;

class GpsQualityTracker {

    private float currentAccuracy;
    private double accuracySum;
    private long accuracyCount;

    private long lastFixTimeMs = -1L;
    private float currentUpdateRateHz;
    private double updateRateSum;
    private long updateRateCount;

    void onFix(Float accuracyMeters, long fixTimeMs) {
        if (accuracyMeters != null) {
            currentAccuracy = accuracyMeters;
            accuracySum += accuracyMeters;
            accuracyCount++;
        }
        if (lastFixTimeMs >= 0) {
            long deltaMs = fixTimeMs - lastFixTimeMs;
            if (deltaMs > 0) {
                currentUpdateRateHz = 1000f / deltaMs;
                updateRateSum += currentUpdateRateHz;
                updateRateCount++;
            }
        }
        lastFixTimeMs = fixTimeMs;
    }

    // A pause is not an update interval
    void breakInterval() {
        lastFixTimeMs = -1L;
    }

    float currentAccuracy() {
        return currentAccuracy;
    }

    float avgAccuracy() {
        return accuracyCount > 0 ? (float) (accuracySum / accuracyCount) : 0f;
    }

    float currentUpdateRateHz() {
        return currentUpdateRateHz;
    }

    float avgUpdateRateHz() {
        return updateRateCount > 0 ? (float) (updateRateSum / updateRateCount) : 0f;
    }
}
