package org.janelia.oct.surface;

/**
 * Otsu's method on a 256 bin histogram of values normalized to [0, 1].
 * When several thresholds maximize the between class variance, the mean of their bins is used.
 *
 * @author Eric Trautman
 */
public class OtsuThreshold {

    public static final int BIN_COUNT = 256;

    private static final double EMPTY_CLASS = 1.0e-12;

    /**
     * @param  normalizedValues  values within [0, 1] (values outside are clamped).
     *
     * @return normalized threshold level within [0, 1] (0 if no level separates the values).
     */
    public static double level(final double[] normalizedValues) {

        if (normalizedValues.length == 0) {
            return 0.0;
        }

        final int lastBin = BIN_COUNT - 1;
        final double[] histogram = new double[BIN_COUNT];
        for (final double value : normalizedValues) {
            final double clamped = Math.max(0.0, Math.min(1.0, value));
            histogram[(int) Math.round(clamped * lastBin)]++;
        }

        double totalMean = 0;
        for (int bin = 0; bin < BIN_COUNT; bin++) {
            histogram[bin] = histogram[bin] / normalizedValues.length;
            totalMean += histogram[bin] * (bin + 1);
        }

        final double[] betweenClassVariance = new double[BIN_COUNT];
        double maxVariance = Double.NaN;
        double omega = 0;
        double mu = 0;
        for (int bin = 0; bin < BIN_COUNT; bin++) {
            omega += histogram[bin];
            mu += histogram[bin] * (bin + 1);
            final double numerator = totalMean * omega - mu;
            final double variance = (omega < EMPTY_CLASS) || (omega > 1.0 - EMPTY_CLASS) ?
                                    Double.NaN : (numerator * numerator) / (omega * (1.0 - omega));
            betweenClassVariance[bin] = variance;
            if (Double.isFinite(variance) && (Double.isNaN(maxVariance) || (variance > maxVariance))) {
                maxVariance = variance;
            }
        }

        if (Double.isNaN(maxVariance)) {
            return 0.0;
        }

        double binSum = 0;
        int binCount = 0;
        for (int bin = 0; bin < BIN_COUNT; bin++) {
            if (betweenClassVariance[bin] == maxVariance) {
                binSum += bin;
                binCount++;
            }
        }

        return (binSum / binCount) / lastBin;
    }
}
