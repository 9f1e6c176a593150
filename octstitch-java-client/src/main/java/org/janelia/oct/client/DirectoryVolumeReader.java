package org.janelia.oct.client;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

import org.janelia.oct.dimension.DimensionSet;
import org.janelia.oct.json.JsonUtils;
import org.janelia.oct.stitch.RowData;
import org.janelia.oct.util.FileUtil;
import org.janelia.oct.volume.ReconstructedVolume;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads volumes written by {@link DirectoryVolumeSink}.
 *
 * @author Eric Trautman
 */
public class DirectoryVolumeReader {

    private final File volumeFolder;

    public DirectoryVolumeReader(final File volumeFolder) {
        this.volumeFolder = volumeFolder.getAbsoluteFile();
    }

    /**
     * @throws IOException
     *   if the volume has not been finalized or its dimensions cannot be parsed.
     */
    public DimensionSet readDimensions()
            throws IOException {
        final File dimensionsFile = new File(volumeFolder, DirectoryVolumeSink.DIMENSIONS_FILE_NAME);
        if (! dimensionsFile.exists()) {
            throw new IOException(dimensionsFile + " is missing, was stitching of " + volumeFolder + " finished?");
        }
        try (final Reader reader = FileUtil.DEFAULT_INSTANCE.getExtensionBasedReader(dimensionsFile.getPath())) {
            return DimensionSet.fromJson(reader);
        } catch (final IllegalArgumentException e) {
            throw new IOException("failed to parse " + dimensionsFile, e);
        }
    }

    public RowData readRow(final int rowIndex)
            throws IOException {
        final File rowFile = DirectoryVolumeSink.getRowFile(volumeFolder, rowIndex);
        return ROW_JSON_HELPER.fromJsonFile(rowFile).toRowData();
    }

    public ReconstructedVolume readVolume()
            throws IOException {

        final DimensionSet dimensions = readDimensions();
        final int rowCount = dimensions.getY().size();

        LOG.info("readVolume: entry, reading {} rows from {}", rowCount, volumeFolder);

        final List<RowData> rows = new ArrayList<>(rowCount);
        for (int y = 0; y < rowCount; y++) {
            rows.add(readRow(y));
        }
        return ReconstructedVolume.fromRows(rows);
    }

    private static final JsonUtils.Helper<RowFile> ROW_JSON_HELPER =
            new JsonUtils.Helper<>(JsonUtils.FAST_MAPPER, RowFile.class);

    private static final Logger LOG = LoggerFactory.getLogger(DirectoryVolumeReader.class);
}
