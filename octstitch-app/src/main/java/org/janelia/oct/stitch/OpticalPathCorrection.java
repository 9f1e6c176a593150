package org.janelia.oct.stitch;

import java.util.BitSet;

/**
 * Result of an {@link OpticalPathCorrector}.
 *
 * @author Eric Trautman
 */
public class OpticalPathCorrection {

    private final double[] amplitude;
    private final BitSet validMask;

    public OpticalPathCorrection(final double[] amplitude,
                                 final BitSet validMask) {
        this.amplitude = amplitude;
        this.validMask = validMask;
    }

    public double[] getAmplitude() {
        return amplitude;
    }

    /**
     * @return set bits mark samples that can be used for stitching.
     */
    public BitSet getValidMask() {
        return validMask;
    }
}
