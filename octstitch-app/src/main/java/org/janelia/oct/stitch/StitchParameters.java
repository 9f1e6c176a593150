package org.janelia.oct.stitch;

import java.io.Serializable;

import org.janelia.oct.ConfigurationException;

/**
 * Options for stitching the rows of a tiled scan.
 *
 * @author Eric Trautman
 */
public class StitchParameters
        implements Serializable {

    public static final double DEFAULT_FOCUS_SIGMA = 20.0;
    public static final int DEFAULT_HOW_MANY_Y_PLANES = 3;

    /** Focus width in depth pixels. */
    private double focusSigma;

    private boolean applyPathLengthCorrection;
    private int numberOfThreads;
    private OutputScale outputScale;

    /** Folder for debug y plane images, null to skip them. */
    private String yPlanesOutputFolder;

    private int howManyYPlanes;

    public StitchParameters() {
        this.focusSigma = DEFAULT_FOCUS_SIGMA;
        this.applyPathLengthCorrection = true;
        this.numberOfThreads = 1;
        this.outputScale = OutputScale.DECIBEL;
        this.yPlanesOutputFolder = null;
        this.howManyYPlanes = DEFAULT_HOW_MANY_Y_PLANES;
    }

    public double getFocusSigma() {
        return focusSigma;
    }

    public StitchParameters withFocusSigma(final double focusSigma) {
        this.focusSigma = focusSigma;
        return this;
    }

    public boolean isApplyPathLengthCorrection() {
        return applyPathLengthCorrection;
    }

    public StitchParameters withApplyPathLengthCorrection(final boolean applyPathLengthCorrection) {
        this.applyPathLengthCorrection = applyPathLengthCorrection;
        return this;
    }

    public int getNumberOfThreads() {
        return numberOfThreads;
    }

    public StitchParameters withNumberOfThreads(final int numberOfThreads) {
        this.numberOfThreads = numberOfThreads;
        return this;
    }

    public OutputScale getOutputScale() {
        return outputScale;
    }

    public StitchParameters withOutputScale(final OutputScale outputScale) {
        this.outputScale = outputScale;
        return this;
    }

    public String getYPlanesOutputFolder() {
        return yPlanesOutputFolder;
    }

    public int getHowManyYPlanes() {
        return howManyYPlanes;
    }

    public StitchParameters withYPlanes(final String yPlanesOutputFolder,
                                        final int howManyYPlanes) {
        this.yPlanesOutputFolder = yPlanesOutputFolder;
        this.howManyYPlanes = howManyYPlanes;
        return this;
    }

    public boolean isSaveSomeYPlanes() {
        return (yPlanesOutputFolder != null) && (! yPlanesOutputFolder.isEmpty()) && (howManyYPlanes > 0);
    }

    public void validate()
            throws ConfigurationException {
        if (! (focusSigma > 0)) {
            throw new ConfigurationException("focusSigma must be positive but is " + focusSigma);
        }
        if (numberOfThreads < 1) {
            throw new ConfigurationException("numberOfThreads must be positive but is " + numberOfThreads);
        }
        if (outputScale == null) {
            throw new ConfigurationException("outputScale must be defined");
        }
    }

    @Override
    public String toString() {
        return "{focusSigma: " + focusSigma +
               ", applyPathLengthCorrection: " + applyPathLengthCorrection +
               ", numberOfThreads: " + numberOfThreads +
               ", outputScale: " + outputScale +
               ", yPlanesOutputFolder: " + yPlanesOutputFolder +
               ", howManyYPlanes: " + howManyYPlanes + "}";
    }
}
