package org.janelia.oct.client;

import java.io.File;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.Random;

import org.janelia.oct.client.parameter.CommandLineParameters;
import org.janelia.oct.dimension.DimensionSet;
import org.janelia.oct.simulation.InterferogramSimulator;
import org.janelia.oct.simulation.SimulatedInterferogram;
import org.janelia.oct.stitch.OutputScale;
import org.janelia.oct.stitch.StitchContext;
import org.janelia.oct.stitch.TiledScanStitcher;
import org.janelia.oct.tile.LoadedFrame;
import org.janelia.oct.tile.RawFrameLoader;
import org.janelia.oct.tile.ScanConfiguration;
import org.janelia.oct.tile.Tile;
import org.janelia.oct.util.FileUtil;
import org.janelia.oct.volume.InMemoryVolumeSink;
import org.janelia.oct.volume.ReconstructedVolume;
import org.janelia.oct.volume.VolumeHandle;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the {@link TiledScanStitchClient} class.
 *
 * @author Eric Trautman
 */
public class TiledScanStitchClientTest {

    private static final int DEPTH_COUNT = 32;
    private static final int X_COUNT = 8;
    private static final int Y_COUNT = 4;

    private File testFolder;

    @Before
    public void setup() {
        testFolder = new File("target/stitch_client_" + new SimpleDateFormat("yyyyMMddHHmmssSSS").format(new Date()));
    }

    @After
    public void tearDown() {
        if (testFolder.exists()) {
            FileUtil.deleteRecursive(testFolder);
        }
    }

    @Test
    public void testParameterParsing() throws Exception {
        CommandLineParameters.parseHelp(new TiledScanStitchClient.Parameters());
    }

    @Test
    public void testParameterValues() {
        final TiledScanStitchClient.Parameters parameters = new TiledScanStitchClient.Parameters();
        parameters.parse(new String[] {
                "--scanFolder", "/scan",
                "--outputFolder", "/volume",
                "--focusPositionInImageZpix", "10", "12",
                "--cropZAroundFocusArea", "false",
                "--band", "850", "950",
                "--numberOfThreads", "4",
                "--outputScale", "AMPLITUDE"
        }, TiledScanStitchClient.class, false);

        Assert.assertEquals("invalid scan folder", "/scan", parameters.scanFolder);
        Assert.assertEquals("invalid focus count", 2, parameters.lattice.focusPositionInImageZpix.size());
        Assert.assertFalse("crop should be disabled", parameters.lattice.buildLatticeParameters().isCropZAroundFocusArea());
        Assert.assertArrayEquals("invalid band",
                                 new double[] { 850.0, 950.0 },
                                 parameters.reconstruction.buildTransformParameters().getBand(), 0.0);
        Assert.assertEquals("invalid thread count", 4, parameters.stitch.buildStitchParameters().getNumberOfThreads());
        Assert.assertEquals("invalid scale", OutputScale.AMPLITUDE, parameters.stitch.outputScale);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingRequiredParameter() {
        new TiledScanStitchClient.Parameters().parse(new String[] { "--scanFolder", "/scan" },
                                                     TiledScanStitchClient.class,
                                                     false);
    }

    @Test
    public void testStitchSimulatedScan() throws Exception {

        final File scanFolder = new File(testFolder, "scan");
        final File volumeFolder = new File(testFolder, "volume");

        final SimulatedInterferogram interferogram = buildInterferogram();
        final ScanConfiguration scanConfiguration = buildScanConfiguration();

        new SimulatedTileScanWriter(scanFolder).write(scanConfiguration, tile -> interferogram);

        final TiledScanStitchClient.Parameters parameters = new TiledScanStitchClient.Parameters();
        parameters.scanFolder = scanFolder.getPath();
        parameters.outputFolder = volumeFolder.getPath();
        parameters.reconstruction.dispersionQuadraticTerm = 0.0;
        parameters.stitch.outputScale = OutputScale.AMPLITUDE;
        parameters.stitch.numberOfThreads = 2;

        final VolumeHandle handle = new TiledScanStitchClient(parameters).stitch();

        Assert.assertEquals("invalid location", volumeFolder.getAbsolutePath(), handle.getLocation());
        Assert.assertEquals("all rows should be complete", Y_COUNT, handle.countCompletedRows());

        final DirectoryVolumeReader reader = new DirectoryVolumeReader(volumeFolder);
        final DimensionSet dimensions = reader.readDimensions();
        final ReconstructedVolume fromFiles = reader.readVolume();

        // stitch the same interferogram directly from memory
        final StitchContext context = StitchContext.build(scanConfiguration,
                                                          parameters.reconstruction.buildTransformParameters(),
                                                          parameters.lattice.buildLatticeParameters(),
                                                          parameters.stitch.buildStitchParameters(),
                                                          new InMemoryLoader(interferogram),
                                                          null);
        final InMemoryVolumeSink sink = new InMemoryVolumeSink();
        new TiledScanStitcher(context).stitch(sink);
        final ReconstructedVolume fromMemory = sink.getLastHandle().toVolume();

        Assert.assertEquals("invalid z count", context.getOutputDimensions().getZ().size(), dimensions.getZ().size());
        Assert.assertEquals("invalid x count", X_COUNT, fromFiles.getXCount());
        Assert.assertEquals("invalid y count", Y_COUNT, fromFiles.getYCount());
        Assert.assertEquals("invalid depth count", fromMemory.getDepthCount(), fromFiles.getDepthCount());

        double maxAmplitude = 0;
        for (int y = 0; y < Y_COUNT; y++) {
            for (int x = 0; x < X_COUNT; x++) {
                for (int z = 0; z < fromMemory.getDepthCount(); z++) {
                    maxAmplitude = Math.max(maxAmplitude, fromMemory.getRawValue(z, x, y));
                }
            }
        }
        Assert.assertTrue("stitched volume should not be empty", maxAmplitude > 0);

        // file data is float32 so allow for rounding
        final double tolerance = 1.0e-4 * maxAmplitude;
        int definedCount = 0;
        for (int y = 0; y < Y_COUNT; y++) {
            for (int x = 0; x < X_COUNT; x++) {
                for (int z = 0; z < fromMemory.getDepthCount(); z++) {
                    final String voxel = "(" + z + ", " + x + ", " + y + ")";
                    Assert.assertEquals("defined status differs for " + voxel,
                                        fromMemory.isDefined(z, x, y), fromFiles.isDefined(z, x, y));
                    if (fromMemory.isDefined(z, x, y)) {
                        Assert.assertEquals("value differs for " + voxel,
                                            fromMemory.getRawValue(z, x, y), fromFiles.getRawValue(z, x, y),
                                            tolerance);
                        definedCount++;
                    }
                }
            }
        }
        Assert.assertTrue("some voxels should be defined", definedCount > 0);
    }

    @Test
    public void testMissingTileDataIsSkipped() throws Exception {

        final File scanFolder = new File(testFolder, "scan");
        final File volumeFolder = new File(testFolder, "volume");

        final SimulatedInterferogram interferogram = buildInterferogram();
        new SimulatedTileScanWriter(scanFolder).write(buildScanConfiguration(), tile -> interferogram);

        final File dataFile = new File(new File(scanFolder, String.format(ScanConfiguration.DEFAULT_FOLDER_FORMAT, 1)),
                                       SimulatedTileScanWriter.INTERFEROGRAM_FILE_NAME);
        Assert.assertTrue("failed to delete " + dataFile, dataFile.delete());

        final TiledScanStitchClient.Parameters parameters = new TiledScanStitchClient.Parameters();
        parameters.scanFolder = scanFolder.getPath();
        parameters.outputFolder = volumeFolder.getPath();
        parameters.reconstruction.dispersionQuadraticTerm = 0.0;

        final VolumeHandle handle = new TiledScanStitchClient(parameters).stitch();
        Assert.assertEquals("all rows should be complete even without tile data", Y_COUNT, handle.countCompletedRows());

        final ReconstructedVolume volume = new DirectoryVolumeReader(volumeFolder).readVolume();
        for (int z = 0; z < volume.getDepthCount(); z++) {
            Assert.assertFalse("voxel (" + z + ", 0, 0) without data should be undefined", volume.isDefined(z, 0, 0));
        }
    }

    static SimulatedInterferogram buildInterferogram() {
        final Random random = new Random(7);
        final double[] data = new double[DEPTH_COUNT * X_COUNT * Y_COUNT];
        for (int i = 0; i < data.length; i++) {
            data[i] = 1.0 + random.nextDouble();
        }
        return InterferogramSimulator.simulateCore(data, DEPTH_COUNT, X_COUNT, Y_COUNT, 1.0,
                                                   new double[] { 800.0, 1000.0 });
    }

    /**
     * @return single tile scan with 1 micron pixels.
     */
    static ScanConfiguration buildScanConfiguration() {
        return new ScanConfiguration(new double[] { 0.0 },
                                     new double[] { 0.0 },
                                     new double[] { 0.0 },
                                     X_COUNT,
                                     Y_COUNT,
                                     0.001 * X_COUNT,
                                     0.001 * Y_COUNT);
    }

    private static class InMemoryLoader
            implements RawFrameLoader {

        private final SimulatedInterferogram interferogram;

        InMemoryLoader(final SimulatedInterferogram interferogram) {
            this.interferogram = interferogram;
        }

        @Override
        public DimensionSet loadDimensions(final Tile tile) {
            return interferogram.getDimensions();
        }

        @Override
        public LoadedFrame load(final Tile tile,
                                final DimensionSet tileDimensions,
                                final int yIndexInTile) {
            return new LoadedFrame(interferogram.getFrame(yIndexInTile),
                                   tileDimensions.withLambda(interferogram.getDimensions().getLambda()));
        }
    }
}
