package org.janelia.oct.stitch;

/**
 * Depth weights that blend tiles acquired at different focal depths.
 *
 * <pre>
 *   weight(z) = exp(-(z - focus)² / (2σ)²) + [z > focus] · exp(-c² / 2)
 * </pre>
 *
 * where c is {@link #CUTOFF_SIGMA}.  The floor below focus keeps deep samples (imaged by only one
 * tile) from vanishing.  All values are in depth pixels.
 *
 * @author Eric Trautman
 */
public class FocusWeightFunction {

    /** How many sigmas from focus before the signal is cut off. */
    public static final double CUTOFF_SIGMA = 3.0;

    /** Smallest total weight that still yields a stable weighted mean. */
    public static final double MIN_TOTAL_WEIGHT = Math.exp(-CUTOFF_SIGMA * CUTOFF_SIGMA / 2.0);

    /**
     * @param  z      depth pixel.
     * @param  focus  focus depth pixel, or null if unknown.
     * @param  sigma  focus width in pixels.
     *
     * @return weight for the specified depth (1 when focus is unknown).
     */
    public static double weight(final double z,
                                final Double focus,
                                final double sigma) {
        if (focus == null) {
            return 1.0;
        }
        final double delta = z - focus;
        final double twoSigma = 2.0 * sigma;
        double weight = Math.exp(-(delta * delta) / (twoSigma * twoSigma));
        if (z > focus) {
            weight += MIN_TOTAL_WEIGHT;
        }
        return weight;
    }

    /**
     * @return weights for depth pixels {@code 0 .. depthCount - 1}.
     */
    public static double[] weights(final int depthCount,
                                   final Double focus,
                                   final double sigma) {
        final double[] weights = new double[depthCount];
        for (int z = 0; z < depthCount; z++) {
            weights[z] = weight(z, focus, sigma);
        }
        return weights;
    }
}
