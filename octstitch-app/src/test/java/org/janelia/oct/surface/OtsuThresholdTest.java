package org.janelia.oct.surface;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link OtsuThreshold} class.
 *
 * @author Eric Trautman
 */
public class OtsuThresholdTest {

    @Test
    public void testBimodalValues() {

        final double[] values = new double[200];
        for (int i = 0; i < values.length; i++) {
            values[i] = i < 100 ? 0.1 : 0.9;
        }

        final double level = OtsuThreshold.level(values);

        Assert.assertTrue("level " + level + " should separate the two modes", (level > 0.1) && (level < 0.9));
    }

    @Test
    public void testPlateauUsesMeanBin() {

        // every threshold between the two spikes gives the same variance
        final double[] values = { 0.0, 0.0, 1.0, 1.0 };

        final double level = OtsuThreshold.level(values);

        Assert.assertEquals("level should be the middle of the plateau", 127.0 / 255.0, level, 1.0e-12);
    }

    @Test
    public void testUnbalancedModes() {

        final double[] values = new double[1000];
        for (int i = 0; i < values.length; i++) {
            values[i] = i < 900 ? 0.2 + (i % 10) * 0.001 : 0.8 + (i % 10) * 0.001;
        }

        final double level = OtsuThreshold.level(values);

        Assert.assertTrue("level " + level + " should separate unbalanced modes", (level > 0.21) && (level < 0.8));
    }

    @Test
    public void testDegenerateValues() {
        Assert.assertEquals("empty values should give 0", 0.0, OtsuThreshold.level(new double[0]), 0.0);
        Assert.assertEquals("constant values should give 0", 0.0, OtsuThreshold.level(new double[] {0.5, 0.5}), 0.0);
    }
}
