package org.janelia.oct.client;

import java.io.BufferedOutputStream;
import java.io.DataOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.util.function.Function;

import org.janelia.oct.simulation.SimulatedInterferogram;
import org.janelia.oct.tile.ScanConfiguration;
import org.janelia.oct.tile.ScanGrid;
import org.janelia.oct.tile.Tile;
import org.janelia.oct.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes simulated interferograms as a scan folder that {@link SimulatedRawFrameLoader} can read.
 *
 * Each tile folder holds a {@value #DIMENSIONS_FILE_NAME} file with the tile's dimension set and an
 * {@value #INTERFEROGRAM_FILE_NAME} file with big endian float32 values ordered lambda fastest,
 * then column, then y.
 *
 * @author Eric Trautman
 */
public class SimulatedTileScanWriter {

    public static final String DIMENSIONS_FILE_NAME = "dimensions.json";
    public static final String INTERFEROGRAM_FILE_NAME = "interferogram.bin";

    private final File scanFolder;

    public SimulatedTileScanWriter(final File scanFolder) {
        this.scanFolder = scanFolder.getAbsoluteFile();
    }

    public void writeScanConfiguration(final ScanConfiguration configuration)
            throws IOException {
        ensureFolder(scanFolder);
        final File file = new File(scanFolder, ScanConfiguration.FILE_NAME);
        FileUtil.saveJsonFile(file.getAbsolutePath(), configuration);
        LOG.info("writeScanConfiguration: saved {}", file);
    }

    public void writeTile(final Tile tile,
                          final SimulatedInterferogram interferogram)
            throws IOException {

        final File tileFolder = new File(scanFolder, tile.getRawFolderRef());
        ensureFolder(tileFolder);

        FileUtil.saveJsonFile(new File(tileFolder, DIMENSIONS_FILE_NAME).getAbsolutePath(),
                              interferogram.getDimensions());

        final File dataFile = new File(tileFolder, INTERFEROGRAM_FILE_NAME);
        try (final DataOutputStream out =
                     new DataOutputStream(new BufferedOutputStream(new FileOutputStream(dataFile)))) {
            for (int y = 0; y < interferogram.getYCount(); y++) {
                for (int x = 0; x < interferogram.getXCount(); x++) {
                    for (int l = 0; l < interferogram.getLambdaCount(); l++) {
                        out.writeFloat((float) interferogram.getValue(l, x, y));
                    }
                }
            }
        }

        LOG.debug("writeTile: saved {}", dataFile);
    }

    /**
     * Writes the scan configuration and one interferogram for every enabled tile.
     *
     * @param  source  provides the interferogram for each tile.
     */
    public void write(final ScanConfiguration configuration,
                      final Function<Tile, SimulatedInterferogram> source)
            throws IOException {

        final ScanGrid scanGrid = new ScanGrid(configuration);

        LOG.info("write: entry, writing {} tiles to {}", scanGrid.getTiles().size(), scanFolder);

        writeScanConfiguration(configuration);
        for (final Tile tile : scanGrid.getTiles()) {
            writeTile(tile, source.apply(tile));
        }
    }

    private static void ensureFolder(final File folder)
            throws IOException {
        try {
            FileUtil.ensureWritableDirectory(folder);
        } catch (final IllegalArgumentException e) {
            throw new IOException(e.getMessage(), e);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(SimulatedTileScanWriter.class);
}
