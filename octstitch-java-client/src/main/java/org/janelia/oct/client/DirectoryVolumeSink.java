package org.janelia.oct.client;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.janelia.oct.dimension.DimensionSet;
import org.janelia.oct.json.JsonUtils;
import org.janelia.oct.stitch.RowData;
import org.janelia.oct.util.FileUtil;
import org.janelia.oct.volume.VolumeHandle;
import org.janelia.oct.volume.VolumeSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each stitched row to its own JSON file in a volume folder.
 *
 * Row files are written to a temporary name and then renamed, after which an empty marker
 * file records completion.  Completed rows are counted from the markers and listed from
 * the row files, so the two sources can be compared when a run looks incomplete.
 * Rewriting a row replaces its file.
 *
 * @author Eric Trautman
 */
public class DirectoryVolumeSink
        implements VolumeSink {

    public static final String DIMENSIONS_FILE_NAME = "dimensions.json";
    public static final String ROW_FILE_FORMAT = "row_%06d.json";
    public static final String DONE_MARKER_SUFFIX = ".done";

    private static final Pattern ROW_FILE_PATTERN = Pattern.compile("row_(\\d+)\\.json");
    private static final Pattern STALE_FILE_PATTERN =
            Pattern.compile("row_\\d+\\.json(\\" + DONE_MARKER_SUFFIX + "|\\" + FileUtil.IN_PROGRESS_SUFFIX + ")?");

    private final File volumeFolder;

    public DirectoryVolumeSink(final File volumeFolder) {
        this.volumeFolder = volumeFolder.getAbsoluteFile();
    }

    @Override
    public VolumeHandle open(final int expectedRowCount)
            throws IOException {
        try {
            FileUtil.ensureWritableDirectory(volumeFolder);
        } catch (final IllegalArgumentException e) {
            throw new IOException(e.getMessage(), e);
        }
        removeStaleFiles(volumeFolder);
        LOG.info("open: writing {} rows to {}", expectedRowCount, volumeFolder);
        return new Handle(volumeFolder, expectedRowCount);
    }

    /**
     * Removes rows, markers and dimensions left in the folder by an earlier run
     * so that completion counts only reflect rows written through the new handle.
     *
     * @return number of removed files.
     *
     * @throws IOException
     *   if the folder cannot be listed or a stale file cannot be deleted.
     */
    static int removeStaleFiles(final File volumeFolder)
            throws IOException {

        final File[] staleFiles = volumeFolder.listFiles(
                (dir, name) -> DIMENSIONS_FILE_NAME.equals(name) || STALE_FILE_PATTERN.matcher(name).matches());
        if (staleFiles == null) {
            throw new IOException("failed to list " + volumeFolder);
        }

        for (final File staleFile : staleFiles) {
            Files.delete(staleFile.toPath());
        }

        if (staleFiles.length > 0) {
            LOG.warn("removeStaleFiles: removed {} files left by an earlier run from {}",
                     staleFiles.length, volumeFolder);
        }

        return staleFiles.length;
    }

    public static File getRowFile(final File volumeFolder,
                                  final int rowIndex) {
        return new File(volumeFolder, String.format(ROW_FILE_FORMAT, rowIndex));
    }

    public static class Handle
            implements VolumeHandle {

        private final File volumeFolder;
        private final int expectedRowCount;

        Handle(final File volumeFolder,
               final int expectedRowCount) {
            this.volumeFolder = volumeFolder;
            this.expectedRowCount = expectedRowCount;
        }

        @Override
        public void writeRow(final int rowIndex,
                             final RowData row)
                throws IllegalArgumentException, IOException {

            if ((rowIndex < 0) || (rowIndex >= expectedRowCount)) {
                throw new IllegalArgumentException("row index " + rowIndex + " is outside [0, " +
                                                   expectedRowCount + ")");
            }

            final File rowFile = getRowFile(volumeFolder, rowIndex);
            FileUtil.saveJsonFile(rowFile.getAbsolutePath(), RowFile.fromRowData(row), JsonUtils.FAST_MAPPER);

            final File marker = new File(rowFile.getAbsolutePath() + DONE_MARKER_SUFFIX);
            Files.write(marker.toPath(), new byte[0],
                        StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        }

        @Override
        public void finalizeVolume(final DimensionSet dimensions)
                throws IOException {
            final File dimensionsFile = new File(volumeFolder, DIMENSIONS_FILE_NAME);
            FileUtil.saveJsonFile(dimensionsFile.getAbsolutePath(), dimensions);
            LOG.info("finalizeVolume: saved {}", dimensionsFile);
        }

        @Override
        public int countCompletedRows()
                throws IOException {
            final File[] markers = volumeFolder.listFiles((dir, name) -> name.endsWith(DONE_MARKER_SUFFIX));
            if (markers == null) {
                throw new IOException("failed to list " + volumeFolder);
            }
            return markers.length;
        }

        @Override
        public List<Integer> listCompletedRows()
                throws IOException {
            final String[] names = volumeFolder.list();
            if (names == null) {
                throw new IOException("failed to list " + volumeFolder);
            }
            final List<Integer> rows = new ArrayList<>();
            for (final String name : names) {
                final Matcher m = ROW_FILE_PATTERN.matcher(name);
                if (m.matches()) {
                    rows.add(Integer.parseInt(m.group(1)));
                }
            }
            rows.sort(Integer::compareTo);
            return rows;
        }

        @Override
        public String getLocation() {
            return volumeFolder.getAbsolutePath();
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(DirectoryVolumeSink.class);
}
