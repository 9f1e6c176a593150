package org.janelia.oct.stitch;

import ij.ImagePlus;
import ij.io.FileSaver;
import ij.process.FloatProcessor;

import java.io.File;
import java.io.IOException;
import java.util.Set;
import java.util.TreeSet;

import org.janelia.oct.tile.Tile;
import org.janelia.oct.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Saves per tile decibel frames and accumulated weights for a few evenly spaced output rows
 * so that stitching can be inspected.  Images are (x, z) 32-bit TIFFs.
 *
 * @author Eric Trautman
 */
public class YPlaneWriter {

    /** Every n-th column of the focus row is marked in saved tile frames. */
    public static final int FOCUS_MARK_COLUMN_STEP = 20;

    private final File folder;
    private final Set<Integer> selectedRows;

    public YPlaneWriter(final File folder,
                        final int rowCount,
                        final int howManyYPlanes)
            throws IOException {

        try {
            FileUtil.ensureWritableDirectory(folder);
        } catch (final IllegalArgumentException e) {
            throw new IOException(e.getMessage(), e);
        }

        this.folder = folder;
        this.selectedRows = selectRows(rowCount, howManyYPlanes);

        LOG.info("YPlaneWriter: will save rows {} to {}", selectedRows, folder.getAbsolutePath());
    }

    /**
     * @return {@code round(linspace(0, rowCount - 1, howMany))}.
     */
    static Set<Integer> selectRows(final int rowCount,
                                   final int howMany) {
        final Set<Integer> rows = new TreeSet<>();
        if (howMany == 1) {
            rows.add(rowCount - 1);
        } else {
            for (int i = 0; i < howMany; i++) {
                rows.add((int) Math.round((double) i * (rowCount - 1) / (howMany - 1)));
            }
        }
        return rows;
    }

    public boolean isSelected(final int rowIndex) {
        return selectedRows.contains(rowIndex);
    }

    public Set<Integer> getSelectedRows() {
        return selectedRows;
    }

    /**
     * Saves the tile's amplitude frame in decibels with the focus row marked.
     *
     * @param  amplitude   values stored z fastest: {@code [z + depthCount * x]}.
     * @param  focusIndex  focus depth pixel, or null if unknown.
     */
    public File saveTileFrame(final int rowIndex,
                              final Tile tile,
                              final double[] amplitude,
                              final int depthCount,
                              final int xCount,
                              final Integer focusIndex)
            throws IOException {

        final float[] pixels = new float[depthCount * xCount];
        float min = Float.MAX_VALUE;
        for (int x = 0; x < xCount; x++) {
            for (int z = 0; z < depthCount; z++) {
                final float value = (float) (20.0 * Math.log10(amplitude[z + depthCount * x]));
                pixels[x + xCount * z] = value;
                if (value < min) {
                    min = value;
                }
            }
        }

        if ((focusIndex != null) && (focusIndex >= 0) && (focusIndex < depthCount)) {
            for (int x = 0; x < xCount; x += FOCUS_MARK_COLUMN_STEP) {
                pixels[x + xCount * focusIndex] = min;
            }
        }

        final String name = String.format("y%04d_xtile%04d_ztile%04d.tif",
                                          rowIndex, tile.getXIndex(), tile.getZIndex());
        return save(new FloatProcessor(xCount, depthCount, pixels), name);
    }

    /**
     * Saves the summed weights of a row.
     *
     * @param  totalWeights  values stored z fastest: {@code [z + depthCount * x]}.
     */
    public File saveTotalWeights(final int rowIndex,
                                 final double[] totalWeights,
                                 final int depthCount,
                                 final int xCount)
            throws IOException {
        final float[] pixels = new float[depthCount * xCount];
        for (int x = 0; x < xCount; x++) {
            for (int z = 0; z < depthCount; z++) {
                pixels[x + xCount * z] = (float) totalWeights[z + depthCount * x];
            }
        }
        return save(new FloatProcessor(xCount, depthCount, pixels),
                    String.format("y%04d_totalWeights.tif", rowIndex));
    }

    private File save(final FloatProcessor processor,
                      final String name)
            throws IOException {

        final File file = new File(folder, name);
        final ImagePlus imagePlus = new ImagePlus(name, processor);

        if (! new FileSaver(imagePlus).saveAsTiff(file.getAbsolutePath())) {
            throw new IOException("failed to save " + file.getAbsolutePath());
        }

        LOG.debug("save: saved {}", file.getAbsolutePath());

        return file;
    }

    private static final Logger LOG = LoggerFactory.getLogger(YPlaneWriter.class);
}
