package org.janelia.oct.stitch;

import java.io.File;
import java.util.BitSet;

import org.janelia.oct.dimension.DimensionAxis;
import org.janelia.oct.dimension.LengthUnit;
import org.janelia.oct.spectral.SpectralTransformParameters;
import org.janelia.oct.tile.LatticeParameters;
import org.janelia.oct.tile.ScanConfiguration;
import org.janelia.oct.util.FileUtil;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link StitchAccumulator} class.
 *
 * @author Eric Trautman
 */
public class StitchAccumulatorTest {

    private static final int X_COUNT = 8;
    private static final int Y_COUNT = 4;

    @Test
    public void testSingleTileReproducesTransformedAmplitude() throws Exception {

        final TestFrameLoader loader = new TestFrameLoader(X_COUNT);
        final StitchContext context = buildContext(new double[] {0.0}, loader, amplitudeParameters());
        final StitchAccumulator accumulator = new StitchAccumulator(context);

        final int depthCount = context.getOutputDimensions().getZ().size();
        Assert.assertEquals("invalid depth count", TestFrameLoader.LAMBDA_COUNT / 2, depthCount);
        Assert.assertEquals("invalid x count", X_COUNT, context.getOutputDimensions().getX().size());
        Assert.assertEquals("invalid y count", Y_COUNT, context.getOutputDimensions().getY().size());

        for (int y = 0; y < Y_COUNT; y++) {
            final RowData row = accumulator.processRow(y);
            final double[] expected = loader.buildExpectedAmplitude(y);
            Assert.assertEquals("all pixels of row " + y + " should be defined",
                                depthCount * X_COUNT, row.getDefinedCount());
            for (int x = 0; x < X_COUNT; x++) {
                for (int z = 0; z < depthCount; z++) {
                    assertClose("row " + y + " (" + z + ", " + x + ")",
                                expected[z + depthCount * x], row.getValue(z, x));
                }
            }
        }
    }

    @Test
    public void testCoincidentTilesAverageToSameValue() throws Exception {

        final TestFrameLoader loader = new TestFrameLoader(X_COUNT);
        final StitchContext context = buildContext(new double[] {0.0, 0.0}, loader, amplitudeParameters());
        final RowData row = new StitchAccumulator(context).processRow(1);

        final int depthCount = row.getDepthCount();
        final double[] expected = loader.buildExpectedAmplitude(1);
        Assert.assertEquals("invalid x count", X_COUNT, row.getXCount());
        for (int x = 0; x < X_COUNT; x++) {
            for (int z = 0; z < depthCount; z++) {
                assertClose("(" + z + ", " + x + ")", expected[z + depthCount * x], row.getValue(z, x));
            }
        }
    }

    @Test
    public void testOverlappingTilesAreAveraged() throws Exception {

        final TestFrameLoader loader = new TestFrameLoader(X_COUNT);
        final StitchContext context = buildContext(new double[] {0.0, 0.004}, loader, amplitudeParameters());
        final RowData row = new StitchAccumulator(context).processRow(2);

        final int depthCount = row.getDepthCount();
        final double[] tile = loader.buildExpectedAmplitude(2);
        Assert.assertEquals("invalid x count", 12, row.getXCount());

        for (int z = 0; z < depthCount; z++) {
            assertClose("first tile only at z " + z, tile[z + depthCount * 2], row.getValue(z, 2));
            assertClose("second tile only at z " + z, tile[z + depthCount * 6], row.getValue(z, 10));
            final double mean = (tile[z + depthCount * 5] + tile[z + depthCount]) / 2.0;
            assertClose("overlap at z " + z, mean, row.getValue(z, 5));
        }
    }

    @Test
    public void testInvalidFramesAreSkipped() throws Exception {

        final TestFrameLoader loader = new TestFrameLoader(X_COUNT).withInvalidTilesAtXIndex(1);
        final StitchContext context = buildContext(new double[] {0.0, 0.004}, loader, amplitudeParameters());
        final RowData row = new StitchAccumulator(context).processRow(0);

        final int depthCount = row.getDepthCount();
        final double[] tile = loader.buildExpectedAmplitude(0);
        for (int z = 0; z < depthCount; z++) {
            assertClose("overlap should only hold first tile at z " + z, tile[z + depthCount * 5], row.getValue(z, 5));
            Assert.assertNull("pixel only covered by the invalid tile should be undefined at z " + z,
                              row.getValue(z, 10));
        }
    }

    @Test
    public void testDecibelScale() throws Exception {

        final TestFrameLoader loader = new TestFrameLoader(X_COUNT);
        final StitchContext context = buildContext(new double[] {0.0}, loader,
                                                   new StitchParameters().withApplyPathLengthCorrection(false));
        final RowData row = new StitchAccumulator(context).processRow(3);

        final int depthCount = row.getDepthCount();
        final double[] expected = loader.buildExpectedAmplitude(3);
        for (int z = 0; z < depthCount; z++) {
            Assert.assertEquals("invalid decibel value at z " + z,
                                20.0 * Math.log10(expected[z + depthCount * 4]), row.getValue(z, 4), 1.0e-3);
        }
    }

    @Test
    public void testPathCorrection() throws Exception {

        final TestFrameLoader loader = new TestFrameLoader(X_COUNT);
        final ScanConfiguration[] receivedGeometry = new ScanConfiguration[1];
        final OpticalPathCorrector doublingCorrector = (amplitude, frameDimensions, probeGeometry) -> {
            receivedGeometry[0] = probeGeometry;
            final int depthCount = amplitude.length / X_COUNT;
            final double[] corrected = new double[amplitude.length];
            final BitSet validMask = new BitSet(amplitude.length);
            for (int i = 0; i < amplitude.length; i++) {
                corrected[i] = 2.0 * amplitude[i];
            }
            // first column is extrapolated
            validMask.set(depthCount, amplitude.length);
            return new OpticalPathCorrection(corrected, validMask);
        };

        final StitchParameters stitchParameters = new StitchParameters().withOutputScale(OutputScale.AMPLITUDE);
        final StitchContext context = buildContext(new double[] {0.0}, loader, stitchParameters, doublingCorrector);
        Assert.assertNotNull("corrector should be applied", context.getPathCorrector());

        final RowData row = new StitchAccumulator(context).processRow(1);
        final int depthCount = row.getDepthCount();
        final double[] expected = loader.buildExpectedAmplitude(1);
        for (int z = 0; z < depthCount; z++) {
            Assert.assertNull("extrapolated pixel should be undefined at z " + z, row.getValue(z, 0));
            assertClose("corrected pixel at z " + z, 2.0 * expected[z + depthCount * 3], row.getValue(z, 3));
        }
        Assert.assertSame("corrector should receive the scan's probe geometry",
                          context.getScanConfiguration(), receivedGeometry[0]);

        final StitchContext uncorrectedContext = buildContext(new double[] {0.0}, loader,
                                                              amplitudeParameters(), doublingCorrector);
        Assert.assertNull("corrector should be ignored when correction is disabled",
                          uncorrectedContext.getPathCorrector());
    }

    @Test
    public void testFindIndexInTile() throws Exception {

        final StitchContext context = buildContext(new double[] {0.0}, new TestFrameLoader(X_COUNT),
                                                   amplitudeParameters());
        final StitchAccumulator accumulator = new StitchAccumulator(context);

        // tile y values are -0.002, -0.001, 0.0 and 0.001 mm
        Assert.assertEquals("invalid index for exact value", 2, accumulator.findIndexInTile(0.0));
        Assert.assertEquals("invalid index within half a pixel", 3, accumulator.findIndexInTile(0.0006));
        Assert.assertEquals("invalid index within half a pixel", 0, accumulator.findIndexInTile(-0.0024));
        Assert.assertEquals("value beyond tile should not be found", -1, accumulator.findIndexInTile(0.0016));
    }

    @Test
    public void testToTilePositions() {
        final DimensionAxis tileAxis = DimensionAxis.uniform(1.0, 0.5, 5, LengthUnit.MM, null);
        final DimensionAxis outputAxis = DimensionAxis.uniform(0.5, 0.25, 12, LengthUnit.MM, null);
        final double[] positions = StitchAccumulator.toTilePositions(outputAxis, tileAxis);
        Assert.assertEquals("value before tile should be outside", -1.0, positions[0], 0.0);
        Assert.assertEquals("invalid position for first tile value", 0.0, positions[2], 1.0e-12);
        Assert.assertEquals("invalid fractional position", 0.5, positions[3], 1.0e-12);
        Assert.assertEquals("invalid position for last tile value", 4.0, positions[10], 1.0e-12);
        Assert.assertEquals("value after tile should be outside", -1.0, positions[11], 0.0);
    }

    @Test
    public void testBuildRowMarksLowWeightUndefined() {
        final double[] weightedSum = {2.0, 1.0, -1.0, 0.0};
        final double[] weightTotal = {1.0, FocusWeightFunction.MIN_TOTAL_WEIGHT / 2, 1.0, 0.0};

        final RowData amplitudeRow = StitchAccumulator.buildRow(weightedSum, weightTotal, 2, 2,
                                                                OutputScale.AMPLITUDE);
        final BitSet defined = amplitudeRow.getDefined();
        Assert.assertTrue("well weighted pixel should be defined", defined.get(0));
        Assert.assertFalse("low weight pixel should be undefined", defined.get(1));
        Assert.assertTrue("negative amplitude is defined in linear scale", defined.get(2));
        Assert.assertFalse("zero weight pixel should be undefined", defined.get(3));
        Assert.assertEquals("invalid value", 2.0f, amplitudeRow.getValue(0, 0), 0.0f);

        final RowData decibelRow = StitchAccumulator.buildRow(weightedSum, weightTotal, 2, 2,
                                                              OutputScale.DECIBEL);
        Assert.assertEquals("invalid decibel value", (float) (20.0 * Math.log10(2.0)), decibelRow.getValue(0, 0),
                            1.0e-6f);
        Assert.assertNull("negative amplitude is undefined in decibels", decibelRow.getValue(0, 1));
    }

    @Test
    public void testYPlanesAreSaved() throws Exception {

        final File yPlaneDirectory = new File("target/test_y_planes_" + System.currentTimeMillis()).getAbsoluteFile();
        try {
            final StitchParameters stitchParameters =
                    amplitudeParameters().withYPlanes(yPlaneDirectory.getPath(), 2);
            final StitchContext context = buildContext(new double[] {0.0}, new TestFrameLoader(X_COUNT),
                                                       stitchParameters);
            final StitchAccumulator accumulator = new StitchAccumulator(context);
            accumulator.processRow(0);
            accumulator.processRow(1);

            Assert.assertTrue("tile frame should be saved for selected row",
                              new File(yPlaneDirectory, "y0000_xtile0000_ztile0000.tif").exists());
            Assert.assertTrue("weights should be saved for selected row",
                              new File(yPlaneDirectory, "y0000_totalWeights.tif").exists());
            Assert.assertFalse("weights should not be saved for unselected row",
                               new File(yPlaneDirectory, "y0001_totalWeights.tif").exists());
        } finally {
            FileUtil.deleteRecursive(yPlaneDirectory);
        }
    }

    static StitchParameters amplitudeParameters() {
        return new StitchParameters()
                .withApplyPathLengthCorrection(false)
                .withOutputScale(OutputScale.AMPLITUDE);
    }

    /**
     * Builds a context for tiles with 1 micron lateral pixels at the specified x centers
     * and a single y center and depth.
     */
    static StitchContext buildContext(final double[] xCenters,
                                      final TestFrameLoader loader,
                                      final StitchParameters stitchParameters)
            throws Exception {
        return buildContext(xCenters, loader, stitchParameters, null);
    }

    private static StitchContext buildContext(final double[] xCenters,
                                              final TestFrameLoader loader,
                                              final StitchParameters stitchParameters,
                                              final OpticalPathCorrector pathCorrector)
            throws Exception {
        final ScanConfiguration configuration = new ScanConfiguration(xCenters,
                                                                      new double[] {0.0},
                                                                      new double[] {0.0},
                                                                      X_COUNT,
                                                                      Y_COUNT,
                                                                      X_COUNT * 0.001,
                                                                      Y_COUNT * 0.001);
        return StitchContext.build(configuration,
                                   new SpectralTransformParameters(0.0),
                                   new LatticeParameters(null, null, false),
                                   stitchParameters,
                                   loader,
                                   pathCorrector);
    }

    private static void assertClose(final String message,
                                    final double expected,
                                    final Float actual) {
        Assert.assertNotNull(message + " should be defined", actual);
        Assert.assertEquals(message, expected, actual, 1.0e-5 * Math.abs(expected) + 1.0e-9);
    }
}
