package org.janelia.oct.util;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link ProgressTracker} class.
 *
 * @author Eric Trautman
 */
public class ProgressTrackerTest {

    @Test
    public void testReporting() {

        final ProgressTracker tracker = new ProgressTracker(100, 4);
        Assert.assertEquals("invalid report interval", 25, tracker.getReportInterval());

        int reportCount = 0;
        for (int i = 0; i < 100; i++) {
            if (tracker.increment()) {
                reportCount++;
            }
        }

        Assert.assertEquals("invalid number of reports", 4, reportCount);
        Assert.assertEquals("invalid percent complete", 100.0, tracker.getPercentComplete(), 0.0);
        Assert.assertTrue("invalid summary " + tracker, tracker.toString().startsWith("100/100 (100.0%)"));
    }

    @Test
    public void testSmallTotal() {
        final ProgressTracker tracker = new ProgressTracker(3);
        Assert.assertEquals("interval should never be zero", 1, tracker.getReportInterval());
        Assert.assertTrue("every item should be reported", tracker.increment());
    }
}
