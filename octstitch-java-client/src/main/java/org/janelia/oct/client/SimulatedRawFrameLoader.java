package org.janelia.oct.client;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.FloatBuffer;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.janelia.oct.dimension.DimensionSet;
import org.janelia.oct.json.JsonUtils;
import org.janelia.oct.spectral.RawFrame;
import org.janelia.oct.tile.LoadedFrame;
import org.janelia.oct.tile.RawFrameLoader;
import org.janelia.oct.tile.Tile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads frames from scan folders written by {@link SimulatedTileScanWriter}.
 * Missing or truncated tile data is reported as an invalid frame.
 *
 * @author Eric Trautman
 */
public class SimulatedRawFrameLoader
        implements RawFrameLoader {

    private final File scanFolder;
    private final Map<String, DimensionSet> folderToDimensions;

    public SimulatedRawFrameLoader(final File scanFolder) {
        this.scanFolder = scanFolder.getAbsoluteFile();
        this.folderToDimensions = new ConcurrentHashMap<>();
    }

    @Override
    public DimensionSet loadDimensions(final Tile tile)
            throws IOException {
        final String folderRef = tile.getRawFolderRef();
        DimensionSet dimensions = folderToDimensions.get(folderRef);
        if (dimensions == null) {
            final File file = new File(getTileFolder(tile), SimulatedTileScanWriter.DIMENSIONS_FILE_NAME);
            dimensions = DIMENSIONS_JSON_HELPER.fromJsonFile(file);
            if (dimensions.getLambda() == null) {
                throw new IOException(file + " does not define a lambda axis");
            }
            folderToDimensions.put(folderRef, dimensions);
        }
        return dimensions;
    }

    @Override
    public LoadedFrame load(final Tile tile,
                            final DimensionSet tileDimensions,
                            final int yIndexInTile) {

        final int xCount = tileDimensions.getX().size();
        final int averagingCount = tileDimensions.getAux().getAveragingCount();
        int lambdaCount = tileDimensions.getLambda().size();

        try {
            final DimensionSet fileDimensions = loadDimensions(tile);
            lambdaCount = fileDimensions.getLambda().size();
            final RawFrame frame = readFrame(new File(getTileFolder(tile), SimulatedTileScanWriter.INTERFEROGRAM_FILE_NAME),
                                             lambdaCount,
                                             xCount,
                                             averagingCount,
                                             yIndexInTile);
            return new LoadedFrame(frame, tileDimensions.withLambda(fileDimensions.getLambda()));
        } catch (final IOException | IllegalArgumentException e) {
            LOG.warn("load: failed to load y index " + yIndexInTile + " of " + tile + ", treating frame as invalid", e);
            return new LoadedFrame(RawFrame.invalid(lambdaCount, xCount, averagingCount), tileDimensions);
        }
    }

    private File getTileFolder(final Tile tile) {
        return new File(scanFolder, tile.getRawFolderRef());
    }

    static RawFrame readFrame(final File dataFile,
                              final int lambdaCount,
                              final int xCount,
                              final int averagingCount,
                              final int yIndex)
            throws IOException {

        final int frameSize = lambdaCount * xCount * averagingCount;
        final long offset = 4L * frameSize * yIndex;
        final byte[] bytes = new byte[4 * frameSize];

        try (final RandomAccessFile file = new RandomAccessFile(dataFile, "r")) {
            if (file.length() < offset + bytes.length) {
                throw new IOException(dataFile + " has " + file.length() + " bytes which is too short for y index " +
                                      yIndex);
            }
            file.seek(offset);
            file.readFully(bytes);
        }

        final FloatBuffer floats = ByteBuffer.wrap(bytes).order(ByteOrder.BIG_ENDIAN).asFloatBuffer();
        final double[] data = new double[frameSize];
        for (int i = 0; i < frameSize; i++) {
            data[i] = floats.get(i);
        }
        return new RawFrame(lambdaCount, xCount, averagingCount, data, true);
    }

    private static final JsonUtils.Helper<DimensionSet> DIMENSIONS_JSON_HELPER =
            new JsonUtils.Helper<>(DimensionSet.class);

    private static final Logger LOG = LoggerFactory.getLogger(SimulatedRawFrameLoader.class);
}
