package org.janelia.oct.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.Serializable;
import java.util.List;

import org.janelia.oct.surface.SurfaceEstimatorParameters;
import org.janelia.oct.surface.SurfaceFocusAnalyzer;

/**
 * Parameters for estimating the tissue surface and checking whether it is in focus.
 *
 * @author Eric Trautman
 */
public class SurfaceParameters
        implements Serializable {

    @Parameter(
            names = "--constantThreshold",
            description = "Use this intensity threshold instead of computing one per tile")
    public Double constantThreshold;

    @Parameter(
            names = "--octProbeFOV_mm",
            description = "Probe field of view in mm, used to split x into tiles with separate thresholds")
    public Double octProbeFOV_mm;

    @Parameter(
            names = "--assessFocus",
            description = "Check that the estimated surface is flat and in focus")
    public boolean assessFocus = false;

    @Parameter(
            names = "--acceptableRange_mm",
            description = "Maximum distance of the surface from z = 0 (and from its median) in mm")
    public double acceptableRange_mm = SurfaceFocusAnalyzer.DEFAULT_ACCEPTABLE_RANGE_MM;

    @Parameter(
            names = "--focusRoi",
            description = "Region [x y width height] in mm to assess (omit to use the whole surface)",
            arity = 4)
    public List<Double> focusRoi;

    @Parameter(
            names = "--throwErrorIfOutOfFocus",
            description = "Fail when the surface is out of focus instead of only reporting the correction",
            arity = 1)
    public boolean throwErrorIfOutOfFocus = true;

    public SurfaceEstimatorParameters buildEstimatorParameters() {
        return new SurfaceEstimatorParameters(constantThreshold, octProbeFOV_mm);
    }

    public SurfaceFocusAnalyzer buildFocusAnalyzer() {
        double[] roi = null;
        if (focusRoi != null) {
            roi = new double[focusRoi.size()];
            for (int i = 0; i < roi.length; i++) {
                roi[i] = focusRoi.get(i);
            }
        }
        return new SurfaceFocusAnalyzer(acceptableRange_mm, roi, throwErrorIfOutOfFocus);
    }
}
