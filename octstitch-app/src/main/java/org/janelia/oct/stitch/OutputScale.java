package org.janelia.oct.stitch;

/**
 * Scale of stitched output values.
 */
public enum OutputScale {

    /** 20·log10(amplitude), undefined for non-positive amplitudes. */
    DECIBEL,

    /** Linear amplitude. */
    AMPLITUDE;

    /**
     * @return scaled value or NaN if the amplitude cannot be expressed in this scale.
     */
    public double apply(final double amplitude) {
        if (this == DECIBEL) {
            return amplitude > 0 ? 20.0 * Math.log10(amplitude) : Double.NaN;
        }
        return amplitude;
    }
}
