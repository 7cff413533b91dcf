package io.ridetrack.fusion;

import org.junit.Assert;
import org.junit.Test;

public class LowPassFilterTest {

    @Test
    public void firstSamplePassesThrough() {
        LowPassFilter filter = new LowPassFilter(2f);
        Assert.assertFalse(filter.hasValue());
        Assert.assertTrue(Float.isNaN(filter.value()));

        Assert.assertEquals(7f, filter.update(7f, 123L), 0f);
        Assert.assertTrue(filter.hasValue());
    }

    @Test
    public void alphaFollowsSampleInterval() {
        LowPassFilter filter = new LowPassFilter(2f);
        filter.prime(0f, 0L);

        double rc = 1.0 / (2 * Math.PI * 2.0);
        double alpha = 0.1 / (rc + 0.1);
        Assert.assertEquals((float) (alpha * 10), filter.update(10f, 100_000_000L), 1e-4f);
    }

    @Test
    public void nonIncreasingTimestampTakesRawValue() {
        LowPassFilter filter = new LowPassFilter(2f);
        filter.prime(0f, 1_000L);
        Assert.assertEquals(4f, filter.update(4f, 1_000L), 0f);
    }

    @Test
    public void resetForgetsState() {
        LowPassFilter filter = new LowPassFilter(2f);
        filter.update(1f, 0L);
        filter.reset();
        Assert.assertFalse(filter.hasValue());
        Assert.assertEquals(5f, filter.update(5f, 10L), 0f);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsNonPositiveCutoff() {
        new LowPassFilter(0f);
    }
}
