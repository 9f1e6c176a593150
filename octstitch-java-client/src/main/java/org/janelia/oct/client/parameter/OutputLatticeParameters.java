package org.janelia.oct.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.Serializable;
import java.util.List;

import org.janelia.oct.tile.LatticeParameters;

/**
 * Parameters for placing stitched data on the output lattice.
 *
 * @author Eric Trautman
 */
public class OutputLatticeParameters
        implements Serializable {

    @Parameter(
            names = "--focusPositionInImageZpix",
            description = "Zero based focus depth pixel in tile images, one value for all depths or one per depth",
            variableArity = true)
    public List<Double> focusPositionInImageZpix;

    @Parameter(
            names = "--outputFilePixelSize_um",
            description = "Output pixel size in microns, must match the scanned lateral pixel size")
    public Double outputFilePixelSize_um = LatticeParameters.DEFAULT_OUTPUT_FILE_PIXEL_SIZE_UM;

    @Parameter(
            names = "--keepNativeDepthSampling",
            description = "Keep the reconstructed depth spacing instead of resampling to the output pixel size")
    public boolean keepNativeDepthSampling = false;

    @Parameter(
            names = "--cropZAroundFocusArea",
            description = "Only keep depths between the first and last focus positions",
            arity = 1)
    public boolean cropZAroundFocusArea = true;

    public LatticeParameters buildLatticeParameters() {
        double[] focus = null;
        if ((focusPositionInImageZpix != null) && (focusPositionInImageZpix.size() > 0)) {
            focus = new double[focusPositionInImageZpix.size()];
            for (int i = 0; i < focus.length; i++) {
                focus[i] = focusPositionInImageZpix.get(i);
            }
        }
        return new LatticeParameters(focus,
                                     keepNativeDepthSampling ? null : outputFilePixelSize_um,
                                     cropZAroundFocusArea);
    }
}
