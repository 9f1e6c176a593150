package org.janelia.oct.spectral;

/**
 * Complex depth profiles for every A-scan of a frame, stored z fastest:
 * {@code real[z + depthCount * column]}.
 *
 * @author Eric Trautman
 */
public class ComplexDepthProfile {

    private final int depthCount;
    private final int columnCount;
    private final double[] real;
    private final double[] imaginary;

    public ComplexDepthProfile(final int depthCount,
                               final int columnCount,
                               final double[] real,
                               final double[] imaginary) {
        if ((real.length != imaginary.length) || (real.length != depthCount * columnCount)) {
            throw new IllegalArgumentException("profile arrays do not match " + depthCount + " x " + columnCount);
        }
        this.depthCount = depthCount;
        this.columnCount = columnCount;
        this.real = real;
        this.imaginary = imaginary;
    }

    public int getDepthCount() {
        return depthCount;
    }

    public int getColumnCount() {
        return columnCount;
    }

    public double getReal(final int z,
                          final int column) {
        return real[z + depthCount * column];
    }

    public double getImaginary(final int z,
                               final int column) {
        return imaginary[z + depthCount * column];
    }

    public double getAmplitude(final int z,
                               final int column) {
        final int i = z + depthCount * column;
        return Math.hypot(real[i], imaginary[i]);
    }

    /**
     * Averages amplitudes over repeated A-scans.
     * Columns are expected to be ordered x fastest, then averaging repeat.
     *
     * @return mean amplitude array stored z fastest: {@code [z + depthCount * x]}.
     */
    public double[] getMeanAmplitude(final int xCount)
            throws IllegalArgumentException {

        if ((xCount < 1) || (columnCount % xCount != 0)) {
            throw new IllegalArgumentException(columnCount + " columns cannot be split into " + xCount +
                                               " x positions");
        }

        final int averagingCount = columnCount / xCount;
        final double[] mean = new double[depthCount * xCount];
        for (int a = 0; a < averagingCount; a++) {
            for (int x = 0; x < xCount; x++) {
                final int column = x + xCount * a;
                for (int z = 0; z < depthCount; z++) {
                    mean[z + depthCount * x] += getAmplitude(z, column);
                }
            }
        }
        if (averagingCount > 1) {
            for (int i = 0; i < mean.length; i++) {
                mean[i] /= averagingCount;
            }
        }
        return mean;
    }
}
