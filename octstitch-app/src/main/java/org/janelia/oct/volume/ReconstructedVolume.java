package org.janelia.oct.volume;

import java.util.BitSet;
import java.util.List;

import org.janelia.oct.stitch.RowData;

/**
 * A (z, x, y) volume of float values with an explicit bitmap of defined voxels.
 * Values are stored z fastest: {@code index = z + depthCount * (x + xCount * y)}.
 *
 * @author Eric Trautman
 */
public class ReconstructedVolume {

    private final int depthCount;
    private final int xCount;
    private final int yCount;
    private final float[] values;
    private final BitSet defined;

    /**
     * Creates a volume with all voxels undefined.
     */
    public ReconstructedVolume(final int depthCount,
                               final int xCount,
                               final int yCount) {
        final long size = (long) depthCount * xCount * yCount;
        if (size > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("volume (" + depthCount + ", " + xCount + ", " + yCount +
                                               ") is too large to hold in memory");
        }
        this.depthCount = depthCount;
        this.xCount = xCount;
        this.yCount = yCount;
        this.values = new float[(int) size];
        this.defined = new BitSet((int) size);
    }

    /**
     * @return volume assembled from rows ordered by y index.
     */
    public static ReconstructedVolume fromRows(final List<RowData> rows)
            throws IllegalArgumentException {
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("at least one row is required");
        }
        final RowData first = rows.get(0);
        final ReconstructedVolume volume = new ReconstructedVolume(first.getDepthCount(),
                                                                   first.getXCount(),
                                                                   rows.size());
        for (int y = 0; y < rows.size(); y++) {
            volume.setRow(y, rows.get(y));
        }
        return volume;
    }

    public int getDepthCount() {
        return depthCount;
    }

    public int getXCount() {
        return xCount;
    }

    public int getYCount() {
        return yCount;
    }

    public boolean isDefined(final int z,
                             final int x,
                             final int y) {
        return defined.get(index(z, x, y));
    }

    /**
     * @return value of the voxel or null if it is undefined.
     */
    public Float getValue(final int z,
                          final int x,
                          final int y) {
        final int i = index(z, x, y);
        return defined.get(i) ? values[i] : null;
    }

    /**
     * @return stored value (0 for undefined voxels).
     */
    public float getRawValue(final int z,
                             final int x,
                             final int y) {
        return values[index(z, x, y)];
    }

    public void setValue(final int z,
                         final int x,
                         final int y,
                         final float value) {
        final int i = index(z, x, y);
        values[i] = value;
        defined.set(i);
    }

    public void setUndefined(final int z,
                             final int x,
                             final int y) {
        final int i = index(z, x, y);
        values[i] = 0;
        defined.clear(i);
    }

    public void setRow(final int y,
                       final RowData row)
            throws IllegalArgumentException {

        if ((row.getDepthCount() != depthCount) || (row.getXCount() != xCount)) {
            throw new IllegalArgumentException("row " + y + " has shape (" + row.getDepthCount() + ", " +
                                               row.getXCount() + ") but volume rows are (" + depthCount +
                                               ", " + xCount + ")");
        }
        final int offset = depthCount * xCount * y;
        final float[] rowValues = row.getValues();
        final BitSet rowDefined = row.getDefined();
        for (int i = 0; i < rowValues.length; i++) {
            if (rowDefined.get(i)) {
                values[offset + i] = rowValues[i];
                defined.set(offset + i);
            } else {
                values[offset + i] = 0;
                defined.clear(offset + i);
            }
        }
    }

    public RowData getRow(final int y) {
        final int rowSize = depthCount * xCount;
        final int offset = rowSize * y;
        final float[] rowValues = new float[rowSize];
        System.arraycopy(values, offset, rowValues, 0, rowSize);
        return new RowData(depthCount, xCount, rowValues, defined.get(offset, offset + rowSize));
    }

    private int index(final int z,
                      final int x,
                      final int y) {
        return z + depthCount * (x + xCount * y);
    }

    @Override
    public String toString() {
        return "(" + depthCount + ", " + xCount + ", " + yCount + ")";
    }
}
