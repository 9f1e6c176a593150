package org.janelia.oct.spectral;

import java.util.Arrays;

/**
 * Interferogram values for one y position of one tile at one depth.
 * Values are stored lambda fastest, then x, then averaging:
 * {@code data[lambda + lambdaCount * (x + xCount * averaging)]}.
 *
 * @author Eric Trautman
 */
public class RawFrame {

    private final int lambdaCount;
    private final int xCount;
    private final int averagingCount;
    private final double[] data;
    private final boolean valid;

    public RawFrame(final int lambdaCount,
                    final int xCount,
                    final int averagingCount,
                    final double[] data,
                    final boolean valid)
            throws IllegalArgumentException {

        if ((lambdaCount < 1) || (xCount < 1) || (averagingCount < 1)) {
            throw new IllegalArgumentException("frame sizes must be positive but are (" + lambdaCount + ", " +
                                               xCount + ", " + averagingCount + ")");
        }
        final long expectedLength = (long) lambdaCount * xCount * averagingCount;
        if (data.length != expectedLength) {
            throw new IllegalArgumentException("frame data has " + data.length + " values but " +
                                               expectedLength + " are expected");
        }
        this.lambdaCount = lambdaCount;
        this.xCount = xCount;
        this.averagingCount = averagingCount;
        this.data = data;
        this.valid = valid;
    }

    /**
     * @return a frame flagged as invalid with all values set to NaN.
     */
    public static RawFrame invalid(final int lambdaCount,
                                   final int xCount,
                                   final int averagingCount) {
        final double[] data = new double[lambdaCount * xCount * averagingCount];
        Arrays.fill(data, Double.NaN);
        return new RawFrame(lambdaCount, xCount, averagingCount, data, false);
    }

    public int getLambdaCount() {
        return lambdaCount;
    }

    public int getXCount() {
        return xCount;
    }

    public int getAveragingCount() {
        return averagingCount;
    }

    /**
     * @return number of A-scans (x positions times averaging repeats) in this frame.
     */
    public int getColumnCount() {
        return xCount * averagingCount;
    }

    public boolean isValid() {
        return valid;
    }

    public double getValue(final int lambdaIndex,
                           final int column) {
        return data[lambdaIndex + lambdaCount * column];
    }

    /**
     * @return backing array (not a copy).
     */
    public double[] getData() {
        return data;
    }

    @Override
    public String toString() {
        return "{lambdaCount: " + lambdaCount + ", xCount: " + xCount + ", averagingCount: " + averagingCount +
               ", valid: " + valid + "}";
    }
}
