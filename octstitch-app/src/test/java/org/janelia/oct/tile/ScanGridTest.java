package org.janelia.oct.tile;

import java.io.StringReader;
import java.util.Arrays;
import java.util.List;

import org.janelia.oct.ConfigurationException;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link ScanGrid} and {@link ScanConfiguration} classes.
 *
 * @author Eric Trautman
 */
public class ScanGridTest {

    @Test
    public void testTileOrderAndFolders() throws Exception {

        final ScanConfiguration configuration = buildConfiguration(new double[] {0.0, 0.5});
        final ScanGrid scanGrid = new ScanGrid(configuration);

        final List<Tile> tiles = scanGrid.getTiles();
        Assert.assertEquals("invalid number of tiles", 8, tiles.size());

        final Tile first = tiles.get(0);
        Assert.assertEquals("invalid first tile folder", "Data01", first.getRawFolderRef());

        final Tile second = tiles.get(1);
        Assert.assertEquals("depth should vary fastest", 1, second.getZIndex());
        Assert.assertEquals("invalid second tile folder", "Data02", second.getRawFolderRef());
        Assert.assertEquals("invalid second tile depth", 0.5, second.getZDepth_mm(), 0.0);

        final Tile last = tiles.get(7);
        Assert.assertEquals("invalid last tile x index", 1, last.getXIndex());
        Assert.assertEquals("invalid last tile y index", 1, last.getYIndex());
        Assert.assertEquals("invalid last tile folder", "Data08", last.getRawFolderRef());
        Assert.assertEquals("invalid last tile y center", 1.0, last.getYCenter_mm(), 0.0);

        Assert.assertEquals("invalid tiles for second y center", 4, scanGrid.getTilesForYIndex(1).size());
        Assert.assertEquals("invalid min depth", 0.0, scanGrid.getMinDepth(), 0.0);
        Assert.assertEquals("invalid max depth", 0.5, scanGrid.getMaxDepth(), 0.0);
    }

    @Test
    public void testDisabledTiles() throws Exception {

        final ScanConfiguration configuration = buildConfiguration(new double[] {0.0});
        configuration.setDisabledTiles(new int[][] { {1, 0} });

        final ScanGrid scanGrid = new ScanGrid(configuration);

        Assert.assertEquals("disabled tile should be excluded", 3, scanGrid.getTiles().size());

        final List<Tile> firstRow = scanGrid.getTilesForYIndex(0);
        Assert.assertEquals("invalid number of tiles in first row", 1, firstRow.size());
        Assert.assertEquals("folder numbering should not change for disabled tiles",
                            "Data03", scanGrid.getTilesForYIndex(1).get(0).getRawFolderRef());
    }

    @Test
    public void testExplicitFolders() throws Exception {

        final ScanConfiguration configuration = buildConfiguration(new double[] {0.0});
        configuration.setOctFolders(Arrays.asList("a", "b", "c", "d"));

        final ScanGrid scanGrid = new ScanGrid(configuration);
        Assert.assertEquals("invalid folder for tile (1, 1)", "d", scanGrid.getTiles().get(3).getRawFolderRef());

        configuration.setOctFolders(Arrays.asList("a", "b"));
        try {
            new ScanGrid(configuration);
            Assert.fail("folder count mismatch should have caused exception");
        } catch (final ConfigurationException e) {
            Assert.assertTrue("message should mention folders", e.getMessage().contains("octFolders"));
        }
    }

    @Test(expected = ConfigurationException.class)
    public void testMissingZeroDepth() throws Exception {
        new ScanGrid(buildConfiguration(new double[] {0.1, 0.2}));
    }

    @Test
    public void testNearZeroDepthIsAccepted() throws Exception {
        final ScanGrid scanGrid = new ScanGrid(buildConfiguration(new double[] {0.0005, 0.2}));
        Assert.assertEquals("invalid depth count", 2, scanGrid.getDepthCount());
    }

    @Test(expected = ConfigurationException.class)
    public void testInvalidDisabledTile() throws Exception {
        final ScanConfiguration configuration = buildConfiguration(new double[] {0.0});
        configuration.setDisabledTiles(new int[][] { {2, 0} });
        new ScanGrid(configuration);
    }

    @Test
    public void testJsonRoundTrip() {

        final ScanConfiguration configuration = buildConfiguration(new double[] {0.0, 0.25});
        configuration.setTissueRefractiveIndex(1.4);
        configuration.setDefaultDispersionQuadraticTerm(-2.5e7);
        configuration.setOctProbeFOV_mm(0.5);
        configuration.setDisabledTiles(new int[][] { {0, 1} });

        final ScanConfiguration parsed = ScanConfiguration.fromJson(new StringReader(configuration.toJson()));

        Assert.assertArrayEquals("invalid x centers", configuration.getXCenters_mm(), parsed.getXCenters_mm(), 0.0);
        Assert.assertArrayEquals("invalid depths", configuration.getZDepths(), parsed.getZDepths(), 0.0);
        Assert.assertEquals("invalid x pixel count", 10, parsed.getNXPixels());
        Assert.assertEquals("invalid refractive index", 1.4, parsed.getTissueRefractiveIndex(), 0.0);
        Assert.assertEquals("invalid dispersion", -2.5e7, parsed.getDefaultDispersionQuadraticTerm(), 0.0);
        Assert.assertEquals("invalid fov", 0.5, parsed.getOctProbeFOV_mm(), 0.0);
        Assert.assertTrue("disabled tile should be parsed", parsed.isDisabled(0, 1));
        Assert.assertFalse("enabled tile should be parsed", parsed.isDisabled(1, 1));
    }

    @Test
    public void testDefaultRefractiveIndexFromJson() {
        final String json = "{ \"xCenters_mm\": [0], \"yCenters_mm\": [0], \"zDepths\": [0], " +
                            "\"nXPixels\": 4, \"nYPixels\": 1, \"tileRangeX_mm\": 0.1, \"tileRangeY_mm\": 0 }";
        final ScanConfiguration parsed = ScanConfiguration.fromJson(new StringReader(json));
        Assert.assertEquals("missing refractive index should default",
                            1.33, parsed.getTissueRefractiveIndex(), 0.0);
        Assert.assertNull("missing dispersion should stay null", parsed.getDefaultDispersionQuadraticTerm());
    }

    static ScanConfiguration buildConfiguration(final double[] zDepths) {
        return new ScanConfiguration(new double[] {0.0, 0.5},
                                     new double[] {0.0, 1.0},
                                     zDepths,
                                     10,
                                     10,
                                     1.0,
                                     1.0);
    }
}
