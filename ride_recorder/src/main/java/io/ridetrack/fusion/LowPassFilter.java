package io.ridetrack.fusion;

/**
 * Single-pole (exponential moving average) low-pass filter whose smoothing factor is derived from
 * the actual interval between samples, so sensors with a jittery sample rate are filtered alike.
 */
public class LowPassFilter {

    private final float rc;

    private long lastTimestampNs;
    private float value = Float.NaN;
    private boolean primed;

    public LowPassFilter(float cutoffHz) {
        if (cutoffHz <= 0) {
            throw new IllegalArgumentException("cutoffHz must be positive: " + cutoffHz);
        }
        this.rc = 1f / (2f * (float) Math.PI * cutoffHz);
    }

    /** Seeds the filter so that the next sample is blended against {@code initial}. */
    public void prime(float initial, long timestampNs) {
        value = initial;
        lastTimestampNs = timestampNs;
        primed = true;
    }

    public float update(float raw, long timestampNs) {
        long dtNs = timestampNs - lastTimestampNs;
        if (primed && dtNs > 0) {
            float dtSec = dtNs / 1_000_000_000f;
            float alpha = dtSec / (rc + dtSec);
            value = alpha * raw + (1f - alpha) * value;
        } else {
            value = raw;
        }
        lastTimestampNs = timestampNs;
        primed = true;
        return value;
    }

    public void reset() {
        lastTimestampNs = 0L;
        value = Float.NaN;
        primed = false;
    }

    public boolean hasValue() {
        return primed;
    }

    public float value() {
        return value;
    }
}
