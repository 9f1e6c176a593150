package org.janelia.oct.tile;

import org.janelia.oct.ConfigurationException;
import org.janelia.oct.dimension.DimensionAxis;
import org.janelia.oct.dimension.DimensionSet;
import org.janelia.oct.dimension.LengthUnit;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link TileFrameBuilder} class.
 *
 * @author Eric Trautman
 */
public class TileFrameBuilderTest {

    @Test
    public void testTileLateralAxis() {
        final DimensionAxis axis = TileFrameBuilder.buildTileLateralAxis(0.0, 0.1, 100, "test");
        Assert.assertEquals("invalid size", 100, axis.size());
        Assert.assertEquals("invalid first value", -0.05, axis.getFirst(), 1.0e-12);
        Assert.assertEquals("invalid last value", 0.049, axis.getLast(), 1.0e-12);
        Assert.assertEquals("invalid spacing", 0.001, axis.getMeanSpacing(), 1.0e-12);
        Assert.assertEquals("invalid units", LengthUnit.MM, axis.getUnits());
    }

    @Test
    public void testMultipleXCenters() throws Exception {

        final ScanConfiguration configuration = buildConfiguration(new double[] {0.0, 0.05}, new double[] {0.0});
        final TileFrames frames = new TileFrameBuilder(configuration, new LatticeParameters()).build(buildProbe());

        final DimensionAxis outputX = frames.getOutputDimensions().getX();
        Assert.assertEquals("invalid output x size", 150, outputX.size());
        Assert.assertEquals("invalid output x first", -0.05, outputX.getFirst(), 1.0e-9);
        Assert.assertEquals("invalid output x last", 0.099, outputX.getLast(), 1.0e-9);
        Assert.assertEquals("invalid output x origin", TileFrameBuilder.OUTPUT_X_ORIGIN, outputX.getOrigin());

        final DimensionAxis outputZ = frames.getOutputDimensions().getZ();
        Assert.assertEquals("invalid output z size", 64, outputZ.size());
        Assert.assertEquals("output z should start at the tissue interface", 0.0, outputZ.getFirst(), 0.0);
        Assert.assertEquals("invalid output z spacing", 0.001, outputZ.getSpacing(), 1.0e-12);

        final DimensionSet oneTile = frames.getOneTileDimensions();
        Assert.assertEquals("invalid tile x size", 100, oneTile.getX().size());
        Assert.assertEquals("tile z should keep probe sampling", 64, oneTile.getZ().size());
    }

    @Test
    public void testSingleXCenter() throws Exception {

        final ScanConfiguration configuration = buildConfiguration(new double[] {0.2}, new double[] {0.0});
        final TileFrames frames = new TileFrameBuilder(configuration, new LatticeParameters()).build(buildProbe());

        final DimensionAxis tileX = frames.getOneTileDimensions().getX();
        final DimensionAxis outputX = frames.getOutputDimensions().getX();
        Assert.assertEquals("invalid output x size", tileX.size(), outputX.size());
        for (int i = 0; i < tileX.size(); i++) {
            Assert.assertEquals("output x " + i + " should be tile x plus center",
                                tileX.getValue(i) + 0.2, outputX.getValue(i), 1.0e-12);
        }
    }

    @Test
    public void testFocusAndCrop() throws Exception {

        final ScanConfiguration configuration = new ScanConfiguration(new double[] {0.0},
                                                                      new double[] {0.0},
                                                                      new double[] {0.0, 0.02},
                                                                      100,
                                                                      1,
                                                                      0.1,
                                                                      0.0);
        final LatticeParameters latticeParameters = new LatticeParameters(new double[] {10.0}, 1.0, true);
        final TileFrames frames = new TileFrameBuilder(configuration, latticeParameters).build(buildProbe());

        final DimensionAxis tileZ = frames.getOneTileDimensions().getZ();
        Assert.assertEquals("focus pixel should be tile z 0", 0.0, tileZ.getValue(10), 0.0);
        Assert.assertEquals("invalid tile z first", -0.01, tileZ.getFirst(), 1.0e-12);
        Assert.assertEquals("invalid tile z origin", TileFrameBuilder.TILE_Z_ORIGIN, tileZ.getOrigin());

        final DimensionAxis outputZ = frames.getOutputDimensions().getZ();
        Assert.assertEquals("invalid cropped z size", 21, outputZ.size());
        Assert.assertEquals("invalid cropped z first", 0.0, outputZ.getFirst(), 0.0);
        Assert.assertEquals("invalid cropped z last", 0.02, outputZ.getLast(), 1.0e-12);
        Assert.assertEquals("invalid output z origin", TileFrameBuilder.OUTPUT_Z_ORIGIN, outputZ.getOrigin());
    }

    @Test
    public void testFocusWithoutCrop() throws Exception {

        final ScanConfiguration configuration = new ScanConfiguration(new double[] {0.0},
                                                                      new double[] {0.0},
                                                                      new double[] {0.0, 0.02},
                                                                      100,
                                                                      1,
                                                                      0.1,
                                                                      0.0);
        final LatticeParameters latticeParameters = new LatticeParameters(new double[] {10.0}, 1.0, false);
        final DimensionAxis outputZ =
                new TileFrameBuilder(configuration, latticeParameters).build(buildProbe()).getOutputDimensions().getZ();

        Assert.assertEquals("invalid z size", 84, outputZ.size());
        Assert.assertEquals("invalid z first", -0.01, outputZ.getFirst(), 1.0e-12);
        Assert.assertEquals("lattice should include the tissue interface",
                            0.0, outputZ.getValue(outputZ.getNearestIndex(0.0)), 0.0);
    }

    @Test
    public void testCropWithoutFocusIsIgnored() throws Exception {
        final ScanConfiguration configuration = buildConfiguration(new double[] {0.0}, new double[] {0.0});
        final LatticeParameters latticeParameters = new LatticeParameters(null, null, true);
        final TileFrames frames = new TileFrameBuilder(configuration, latticeParameters).build(buildProbe());
        Assert.assertEquals("z should not be cropped", 64, frames.getOutputDimensions().getZ().size());
    }

    @Test(expected = ConfigurationException.class)
    public void testDifferentFocusPositions() throws Exception {
        final ScanConfiguration configuration = new ScanConfiguration(new double[] {0.0},
                                                                      new double[] {0.0},
                                                                      new double[] {0.0, 0.02},
                                                                      100,
                                                                      1,
                                                                      0.1,
                                                                      0.0);
        final LatticeParameters latticeParameters = new LatticeParameters(new double[] {10.0, 12.0}, 1.0, true);
        new TileFrameBuilder(configuration, latticeParameters).build(buildProbe());
    }

    @Test(expected = ConfigurationException.class)
    public void testAnisotropicPixels() throws Exception {
        final ScanConfiguration configuration = new ScanConfiguration(new double[] {0.0},
                                                                      new double[] {0.0},
                                                                      new double[] {0.0},
                                                                      100,
                                                                      10,
                                                                      0.1,
                                                                      0.02);
        new TileFrameBuilder(configuration, new LatticeParameters()).build(buildProbe());
    }

    @Test
    public void testPixelSizeMismatch() {
        final DimensionAxis x = TileFrameBuilder.buildTileLateralAxis(0.0, 0.1, 100, null);
        final DimensionAxis y = TileFrameBuilder.buildTileLateralAxis(0.0, 0.05, 50, null);
        try {
            TileFrameBuilder.checkIsotropicPixels(x, y, 1.0);
        } catch (final ConfigurationException e) {
            Assert.fail("matching pixel sizes should pass but caught " + e.getMessage());
        }
        try {
            TileFrameBuilder.checkIsotropicPixels(x, y, 2.0);
            Assert.fail("requested pixel size mismatch should have caused exception");
        } catch (final ConfigurationException e) {
            Assert.assertTrue("message should mention requested size",
                              e.getMessage().contains("outputFilePixelSize_um"));
        }
    }

    @Test(expected = ConfigurationException.class)
    public void testMissingProbeDepthAxis() throws Exception {
        final ScanConfiguration configuration = buildConfiguration(new double[] {0.0}, new double[] {0.0});
        final DimensionSet probe = new DimensionSet(null, null, null, null, null);
        new TileFrameBuilder(configuration, new LatticeParameters()).build(probe);
    }

    @Test
    public void testAnchorAtZero() {
        final double[] anchored = TileFrameBuilder.anchorAtZero(new double[] {-0.0199, -0.0099, 0.0001, 0.0101}, 0.01);
        Assert.assertArrayEquals("invalid anchored values",
                                 new double[] {-0.02, -0.01, 0.0, 0.01}, anchored, 1.0e-15);
    }

    @Test
    public void testRoundPixelSize() {
        Assert.assertEquals("invalid rounding", 1.0, TileFrameBuilder.roundPixelSize(0.0010004), 0.0);
        Assert.assertEquals("invalid rounding", 0.99, TileFrameBuilder.roundPixelSize(0.00099), 0.0);
    }

    private static ScanConfiguration buildConfiguration(final double[] xCenters,
                                                        final double[] zDepths) {
        return new ScanConfiguration(xCenters, new double[] {0.0}, zDepths, 100, 1, 0.1, 0.0);
    }

    /**
     * @return probe with a 64 sample, 1 micron depth axis.
     */
    private static DimensionSet buildProbe() {
        return new DimensionSet(null,
                                null,
                                null,
                                DimensionAxis.uniform(0.0, 1.0, 64, LengthUnit.MICRONS, null),
                                null);
    }
}
