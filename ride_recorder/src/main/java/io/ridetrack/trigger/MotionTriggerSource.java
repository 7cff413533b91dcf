package io.ridetrack.trigger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts on the first acceleration above the threshold and pauses once the device has been still
 * for the configured window.
 */
public class MotionTriggerSource implements TriggerSource {
    private static final Logger LOG = LoggerFactory.getLogger(MotionTriggerSource.class);

    private final float threshold;
    private final long stillnessMs;

    private boolean moving;
    private long lastMotionMs;

    public MotionTriggerSource(float threshold, long stillnessMs) {
        this.threshold = threshold;
        this.stillnessMs = stillnessMs;
    }

    @Override
    public TriggerSignal onLinearAcceleration(float x, float y, float z, long atMs) {
        float magnitude = (float) Math.sqrt(x * x + y * y + z * z);
        if (magnitude > threshold) {
            lastMotionMs = atMs;
            if (!moving) {
                moving = true;
                LOG.debug("Motion detected ({} m/s²)", magnitude);
                return TriggerSignal.START;
            }
            return TriggerSignal.NONE;
        }
        return checkStillness(atMs);
    }

    @Override
    public TriggerSignal onTick(long atMs) {
        return checkStillness(atMs);
    }

    @Override
    public void onUserCommand(boolean start, long atMs) {
        moving = start;
        lastMotionMs = atMs;
    }

    private TriggerSignal checkStillness(long atMs) {
        if (moving && atMs - lastMotionMs > stillnessMs) {
            moving = false;
            LOG.debug("No motion for {} ms", atMs - lastMotionMs);
            return TriggerSignal.PAUSE;
        }
        return TriggerSignal.NONE;
    }
}
