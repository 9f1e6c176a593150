package org.janelia.oct.stitch;

import java.util.Arrays;
import java.util.BitSet;

/**
 * One finished output y row: values indexed (z, x), stored z fastest, with an explicit
 * bitmap of defined pixels.  Values of undefined pixels are stored as 0.
 *
 * @author Eric Trautman
 */
public class RowData {

    private final int depthCount;
    private final int xCount;
    private final float[] values;
    private final BitSet defined;

    public RowData(final int depthCount,
                   final int xCount,
                   final float[] values,
                   final BitSet defined) {
        if (values.length != depthCount * xCount) {
            throw new IllegalArgumentException("row has " + values.length + " values but " + depthCount +
                                               " x " + xCount + " are expected");
        }
        this.depthCount = depthCount;
        this.xCount = xCount;
        this.values = values;
        this.defined = defined;
    }

    public int getDepthCount() {
        return depthCount;
    }

    public int getXCount() {
        return xCount;
    }

    public boolean isDefined(final int z,
                             final int x) {
        return defined.get(z + depthCount * x);
    }

    /**
     * @return value for the pixel or null if it is undefined.
     */
    public Float getValue(final int z,
                          final int x) {
        final int i = z + depthCount * x;
        return defined.get(i) ? values[i] : null;
    }

    public int getDefinedCount() {
        return defined.cardinality();
    }

    /**
     * @return backing value array (not a copy).
     */
    public float[] getValues() {
        return values;
    }

    /**
     * @return copy of the defined pixel bitmap.
     */
    public BitSet getDefined() {
        return (BitSet) defined.clone();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final RowData that = (RowData) o;
        return (depthCount == that.depthCount) && (xCount == that.xCount) &&
               Arrays.equals(values, that.values) && defined.equals(that.defined);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(values) + defined.hashCode();
    }
}
