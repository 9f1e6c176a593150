package org.janelia.oct.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

import org.janelia.oct.stitch.OutputScale;
import org.janelia.oct.stitch.StitchParameters;

/**
 * Parameters for a stitching run.
 *
 * @author Eric Trautman
 */
public class StitchRunParameters
        implements Serializable {

    @Parameter(
            names = "--focusSigma",
            description = "Focus gaussian sigma in depth pixels")
    public double focusSigma = StitchParameters.DEFAULT_FOCUS_SIGMA;

    @Parameter(
            names = "--applyPathLengthCorrection",
            description = "Correct for the probe's optical path length differences when correction data is available",
            arity = 1)
    public boolean applyPathLengthCorrection = true;

    @Parameter(
            names = "--numberOfThreads",
            description = "Number of rows to process concurrently")
    public int numberOfThreads = 1;

    @Parameter(
            names = "--outputScale",
            description = "Scale of stitched values")
    public OutputScale outputScale = OutputScale.DECIBEL;

    @Parameter(
            names = "--yPlanesOutputFolder",
            description = "Folder for debug images of evenly spaced rows (omit to skip them)")
    public String yPlanesOutputFolder;

    @Parameter(
            names = "--howManyYPlanes",
            description = "Number of debug rows to save")
    public int howManyYPlanes = StitchParameters.DEFAULT_HOW_MANY_Y_PLANES;

    public StitchParameters buildStitchParameters() {
        return new StitchParameters()
                .withFocusSigma(focusSigma)
                .withApplyPathLengthCorrection(applyPathLengthCorrection)
                .withNumberOfThreads(numberOfThreads)
                .withOutputScale(outputScale)
                .withYPlanes(yPlanesOutputFolder, howManyYPlanes);
    }
}
