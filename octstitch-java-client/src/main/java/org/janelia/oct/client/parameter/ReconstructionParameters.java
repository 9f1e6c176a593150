package org.janelia.oct.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.Serializable;
import java.util.List;

import org.janelia.oct.spectral.InterpolationMethod;
import org.janelia.oct.spectral.SpectralTransformParameters;

/**
 * Parameters for converting interferograms into depth profiles.
 *
 * @author Eric Trautman
 */
public class ReconstructionParameters
        implements Serializable {

    @Parameter(
            names = "--dispersionQuadraticTerm",
            description = "Quadratic dispersion correction in nm^2/rad (omit to use the scan's default)")
    public Double dispersionQuadraticTerm;

    @Parameter(
            names = "--band",
            description = "Wavelength sub-band [min max] in nm for the Hann filter (omit to use the full band)",
            arity = 2)
    public List<Double> band;

    @Parameter(
            names = "--interpolationMethod",
            description = "Method for resampling interferograms that are not equispaced in k")
    public InterpolationMethod interpolationMethod = InterpolationMethod.LINEAR;

    /**
     * @return transform parameters (the scan's refractive index is applied when the stitch context is built).
     */
    public SpectralTransformParameters buildTransformParameters() {
        double[] bandArray = null;
        if (band != null) {
            bandArray = new double[] { band.get(0), band.get(1) };
        }
        return new SpectralTransformParameters(dispersionQuadraticTerm,
                                               bandArray,
                                               interpolationMethod,
                                               SpectralTransformParameters.DEFAULT_REFRACTIVE_INDEX);
    }
}
