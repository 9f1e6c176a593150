package org.janelia.oct.client;

import java.util.BitSet;

import org.janelia.oct.stitch.RowData;

/**
 * JSON form of one stitched row, with null marking undefined pixels.
 *
 * @author Eric Trautman
 */
public class RowFile {

    private final int depthCount;
    private final int xCount;

    /** Values stored z fastest: {@code [z + depthCount * x]}. */
    private final Float[] values;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private RowFile() {
        this(0, 0, new Float[0]);
    }

    public RowFile(final int depthCount,
                   final int xCount,
                   final Float[] values) {
        this.depthCount = depthCount;
        this.xCount = xCount;
        this.values = values;
    }

    public static RowFile fromRowData(final RowData row) {
        final float[] rowValues = row.getValues();
        final BitSet defined = row.getDefined();
        final Float[] values = new Float[rowValues.length];
        for (int i = 0; i < rowValues.length; i++) {
            values[i] = defined.get(i) ? rowValues[i] : null;
        }
        return new RowFile(row.getDepthCount(), row.getXCount(), values);
    }

    public RowData toRowData()
            throws IllegalArgumentException {
        final float[] rowValues = new float[values.length];
        final BitSet defined = new BitSet(values.length);
        for (int i = 0; i < values.length; i++) {
            if (values[i] != null) {
                rowValues[i] = values[i];
                defined.set(i);
            }
        }
        return new RowData(depthCount, xCount, rowValues, defined);
    }
}
