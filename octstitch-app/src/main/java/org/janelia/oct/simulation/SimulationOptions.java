package org.janelia.oct.simulation;

import java.io.Serializable;
import java.util.Arrays;

/**
 * Sample, scanner and probe parameters for interferogram simulation.
 *
 * @author Eric Trautman
 */
public class SimulationOptions
        implements Serializable {

    public static final double DEFAULT_PIXEL_SIZE_UM = 1.0;
    public static final double DEFAULT_REFRACTIVE_INDEX = 1.33;
    public static final double[] DEFAULT_LAMBDA_RANGE_NM = {800.0, 1000.0};
    public static final int DEFAULT_NUMBER_OF_SPECTRAL_BANDS = 2048;
    public static final double DEFAULT_FOCUS_SIGMA = 20.0;

    /** Size (microns) of each sample volume pixel in x, y and z. */
    private double pixelSize_um;

    /** Refractive index of the medium. */
    private double refractiveIndex;

    /** Scanner wavelength range [min, max] in nm. */
    private double[] lambdaRange_nm;

    private int numberOfSpectralBands;

    /** Depth (microns) of the sample volume placed at scanner z = 0. */
    private double referenceArmZOffset_um;

    /** Zero based scanner depth pixel in focus (null disables focus attenuation). */
    private Double focusPositionInImageZpix;

    /** Focus width in pixels. */
    private double focusSigma;

    public SimulationOptions() {
        this.pixelSize_um = DEFAULT_PIXEL_SIZE_UM;
        this.refractiveIndex = DEFAULT_REFRACTIVE_INDEX;
        this.lambdaRange_nm = DEFAULT_LAMBDA_RANGE_NM.clone();
        this.numberOfSpectralBands = DEFAULT_NUMBER_OF_SPECTRAL_BANDS;
        this.referenceArmZOffset_um = 0.0;
        this.focusPositionInImageZpix = null;
        this.focusSigma = DEFAULT_FOCUS_SIGMA;
    }

    public double getPixelSize_um() {
        return pixelSize_um;
    }

    public double getRefractiveIndex() {
        return refractiveIndex;
    }

    public double[] getLambdaRange_nm() {
        return lambdaRange_nm.clone();
    }

    public int getNumberOfSpectralBands() {
        return numberOfSpectralBands;
    }

    public double getReferenceArmZOffset_um() {
        return referenceArmZOffset_um;
    }

    public Double getFocusPositionInImageZpix() {
        return focusPositionInImageZpix;
    }

    public double getFocusSigma() {
        return focusSigma;
    }

    public SimulationOptions withPixelSize_um(final double pixelSize_um) {
        this.pixelSize_um = pixelSize_um;
        return this;
    }

    public SimulationOptions withRefractiveIndex(final double refractiveIndex) {
        this.refractiveIndex = refractiveIndex;
        return this;
    }

    public SimulationOptions withLambdaRange_nm(final double min,
                                                final double max) {
        this.lambdaRange_nm = new double[] {min, max};
        return this;
    }

    public SimulationOptions withNumberOfSpectralBands(final int numberOfSpectralBands) {
        this.numberOfSpectralBands = numberOfSpectralBands;
        return this;
    }

    public SimulationOptions withReferenceArmZOffset_um(final double referenceArmZOffset_um) {
        this.referenceArmZOffset_um = referenceArmZOffset_um;
        return this;
    }

    public SimulationOptions withFocus(final Double focusPositionInImageZpix,
                                       final double focusSigma) {
        this.focusPositionInImageZpix = focusPositionInImageZpix;
        this.focusSigma = focusSigma;
        return this;
    }

    public void validate()
            throws IllegalArgumentException {
        if (! (pixelSize_um > 0)) {
            throw new IllegalArgumentException("pixelSize_um must be positive but is " + pixelSize_um);
        }
        if (! (refractiveIndex > 0)) {
            throw new IllegalArgumentException("refractiveIndex must be positive but is " + refractiveIndex);
        }
        if ((lambdaRange_nm == null) || (lambdaRange_nm.length != 2) ||
            (! (lambdaRange_nm[0] > 0)) || (! (lambdaRange_nm[1] > lambdaRange_nm[0]))) {
            throw new IllegalArgumentException("lambdaRange_nm must be [min, max] with 0 < min < max but is " +
                                               Arrays.toString(lambdaRange_nm));
        }
        if ((numberOfSpectralBands < 2) || (numberOfSpectralBands % 2 != 0)) {
            throw new IllegalArgumentException("numberOfSpectralBands must be a positive even number but is " +
                                               numberOfSpectralBands);
        }
        if (! (focusSigma > 0)) {
            throw new IllegalArgumentException("focusSigma must be positive but is " + focusSigma);
        }
    }

    @Override
    public String toString() {
        return "{pixelSize_um: " + pixelSize_um +
               ", refractiveIndex: " + refractiveIndex +
               ", lambdaRange_nm: " + Arrays.toString(lambdaRange_nm) +
               ", numberOfSpectralBands: " + numberOfSpectralBands +
               ", referenceArmZOffset_um: " + referenceArmZOffset_um +
               ", focusPositionInImageZpix: " + focusPositionInImageZpix +
               ", focusSigma: " + focusSigma + "}";
    }
}
