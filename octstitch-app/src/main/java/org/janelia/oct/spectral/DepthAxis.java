package org.janelia.oct.spectral;

import org.janelia.oct.dimension.DimensionAxis;
import org.janelia.oct.dimension.LengthUnit;

/**
 * Depth (z) positions of the samples produced by transforming an interferogram.
 * z = 0 is where reference and sample arm lengths match, z increases with depth.
 *
 * @author Eric Trautman
 */
public class DepthAxis {

    public static final String ORIGIN = "z=0 matches reference arm";

    /**
     * @return depth axis in microns (in medium) for an unpadded interferogram of {@code n} samples.
     */
    public static DimensionAxis compute(final double lambdaMin_nm,
                                        final double lambdaMax_nm,
                                        final int n,
                                        final double refractiveIndex) {
        return compute(lambdaMin_nm, lambdaMax_nm, n, getPaddedLength(n), refractiveIndex);
    }

    /**
     * Computes {@code z[i] = i * (λ0² / (2Δλ)) / n * (spectralLength / paddedLength)} for
     * {@code i = 0 .. paddedLength/2 - 1}, where λ0 is the band center and Δλ the band width.
     *
     * @return depth axis in microns (in medium).
     */
    public static DimensionAxis compute(final double lambdaMin_nm,
                                        final double lambdaMax_nm,
                                        final int spectralLength,
                                        final int paddedLength,
                                        final double refractiveIndex)
            throws IllegalArgumentException {

        final double low = Math.min(lambdaMin_nm, lambdaMax_nm) / 1.0e3;
        final double high = Math.max(lambdaMin_nm, lambdaMax_nm) / 1.0e3;
        if (! (high > low)) {
            throw new IllegalArgumentException("wavelength range [" + lambdaMin_nm + ", " + lambdaMax_nm +
                                               "] nm must not be empty");
        }
        if (paddedLength < spectralLength) {
            throw new IllegalArgumentException("padded length " + paddedLength + " is less than spectral length " +
                                               spectralLength);
        }

        final double lambda0_um = (low + high) / 2.0;
        final double deltaLambda_um = high - low;
        final double stepInAir = 0.5 * lambda0_um * lambda0_um / deltaLambda_um;
        final double step = stepInAir / refractiveIndex * spectralLength / paddedLength;

        return DimensionAxis.uniform(0.0, step, paddedLength / 2, LengthUnit.MICRONS, ORIGIN);
    }

    /**
     * @return smallest power of two that is greater than or equal to the specified length.
     */
    public static int getPaddedLength(final int length) {
        if (length < 1) {
            throw new IllegalArgumentException("length must be positive but is " + length);
        }
        return Integer.highestOneBit(length) == length ? length : Integer.highestOneBit(length) << 1;
    }
}
