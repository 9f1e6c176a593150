package org.janelia.oct.spectral;

import java.io.Serializable;
import java.util.Arrays;

import org.janelia.oct.ConfigurationException;

/**
 * Options for converting interferograms into complex depth profiles.
 *
 * @author Eric Trautman
 */
public class SpectralTransformParameters
        implements Serializable {

    public static final double DEFAULT_REFRACTIVE_INDEX = 1.33;

    /** Quadratic dispersion phase correction in nm²/rad. */
    private final Double dispersionQuadraticTerm;

    /** Optional [min, max] sub-band in nm for the Hann filter. */
    private final double[] band;

    private final InterpolationMethod interpolationMethod;

    /** Medium refractive index. */
    private final double refractiveIndex;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private SpectralTransformParameters() {
        this(null, null, InterpolationMethod.LINEAR, DEFAULT_REFRACTIVE_INDEX);
    }

    public SpectralTransformParameters(final Double dispersionQuadraticTerm) {
        this(dispersionQuadraticTerm, null, InterpolationMethod.LINEAR, DEFAULT_REFRACTIVE_INDEX);
    }

    public SpectralTransformParameters(final Double dispersionQuadraticTerm,
                                       final double[] band,
                                       final InterpolationMethod interpolationMethod,
                                       final double refractiveIndex) {
        this.dispersionQuadraticTerm = dispersionQuadraticTerm;
        this.band = band == null ? null : band.clone();
        this.interpolationMethod = interpolationMethod;
        this.refractiveIndex = refractiveIndex;
    }

    public boolean hasDispersionQuadraticTerm() {
        return dispersionQuadraticTerm != null;
    }

    /**
     * @return copy of these parameters with the specified dispersion term and refractive index.
     */
    public SpectralTransformParameters withScanValues(final Double dispersionQuadraticTerm,
                                                      final double refractiveIndex) {
        return new SpectralTransformParameters(dispersionQuadraticTerm, band, interpolationMethod, refractiveIndex);
    }

    public double getDispersionQuadraticTerm() {
        return dispersionQuadraticTerm;
    }

    public boolean hasBand() {
        return band != null;
    }

    public double[] getBand() {
        return band == null ? null : band.clone();
    }

    public InterpolationMethod getInterpolationMethod() {
        return interpolationMethod == null ? InterpolationMethod.LINEAR : interpolationMethod;
    }

    public double getRefractiveIndex() {
        return refractiveIndex;
    }

    /**
     * @throws ConfigurationException
     *   if any parameter is missing or out of range.
     */
    public void validate()
            throws ConfigurationException {

        if (dispersionQuadraticTerm == null) {
            throw new ConfigurationException("dispersionQuadraticTerm must be defined");
        }
        if (! Double.isFinite(dispersionQuadraticTerm)) {
            throw new ConfigurationException("dispersionQuadraticTerm must be finite but is " +
                                             dispersionQuadraticTerm);
        }
        if (band != null) {
            if ((band.length != 2) || (! (band[0] < band[1]))) {
                throw new ConfigurationException("band must be specified as [min, max] with min < max but is " +
                                                 Arrays.toString(band));
            }
        }
        if (! (refractiveIndex > 0)) {
            throw new ConfigurationException("refractiveIndex must be positive but is " + refractiveIndex);
        }
    }

    @Override
    public String toString() {
        return "{dispersionQuadraticTerm: " + dispersionQuadraticTerm +
               ", band: " + Arrays.toString(band) +
               ", interpolationMethod: " + getInterpolationMethod() +
               ", refractiveIndex: " + refractiveIndex + "}";
    }
}
