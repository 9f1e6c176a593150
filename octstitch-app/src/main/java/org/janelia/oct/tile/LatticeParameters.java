package org.janelia.oct.tile;

import java.io.Serializable;
import java.util.Arrays;

import org.janelia.oct.ConfigurationException;

/**
 * Options for building the output lattice of a tiled scan.
 *
 * @author Eric Trautman
 */
public class LatticeParameters
        implements Serializable {

    public static final double DEFAULT_OUTPUT_FILE_PIXEL_SIZE_UM = 1.0;

    /**
     * Zero based depth pixel at focus for each scan depth
     * (or a single value shared by all depths, or null when unknown).
     */
    private final double[] focusPositionInImageZpix;

    /** Isotropic output pixel size in microns, null to keep the native resolution. */
    private final Double outputFilePixelSize_um;

    private final boolean cropZAroundFocusArea;

    public LatticeParameters() {
        this(null, DEFAULT_OUTPUT_FILE_PIXEL_SIZE_UM, true);
    }

    public LatticeParameters(final double[] focusPositionInImageZpix,
                             final Double outputFilePixelSize_um,
                             final boolean cropZAroundFocusArea) {
        this.focusPositionInImageZpix = focusPositionInImageZpix == null ? null : focusPositionInImageZpix.clone();
        this.outputFilePixelSize_um = outputFilePixelSize_um;
        this.cropZAroundFocusArea = cropZAroundFocusArea;
    }

    public boolean hasFocusPosition() {
        if ((focusPositionInImageZpix == null) || (focusPositionInImageZpix.length == 0)) {
            return false;
        }
        for (final double value : focusPositionInImageZpix) {
            if (Double.isNaN(value)) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return focus pixel for the specified depth index, or null if focus is unknown.
     */
    public Double getFocusPosition(final int depthIndex) {
        if (! hasFocusPosition()) {
            return null;
        }
        return focusPositionInImageZpix.length == 1 ? focusPositionInImageZpix[0] :
               focusPositionInImageZpix[depthIndex];
    }

    public Double getOutputFilePixelSize_um() {
        return outputFilePixelSize_um;
    }

    public boolean isCropZAroundFocusArea() {
        return cropZAroundFocusArea;
    }

    /**
     * @throws ConfigurationException
     *   if the parameters do not fit a scan with the specified number of depths.
     */
    public void validate(final int depthCount)
            throws ConfigurationException {

        if (hasFocusPosition()) {
            if ((focusPositionInImageZpix.length != 1) && (focusPositionInImageZpix.length != depthCount)) {
                throw new ConfigurationException(
                        "focusPositionInImageZpix must have 1 or " + depthCount + " values but has " +
                        focusPositionInImageZpix.length);
            }
            for (final double value : focusPositionInImageZpix) {
                if (value < 0) {
                    throw new ConfigurationException("focusPositionInImageZpix values must not be negative but are " +
                                                     Arrays.toString(focusPositionInImageZpix));
                }
            }
        }
        if ((outputFilePixelSize_um != null) && (! (outputFilePixelSize_um > 0))) {
            throw new ConfigurationException("outputFilePixelSize_um must be positive but is " +
                                             outputFilePixelSize_um);
        }
    }

    @Override
    public String toString() {
        return "{focusPositionInImageZpix: " + Arrays.toString(focusPositionInImageZpix) +
               ", outputFilePixelSize_um: " + outputFilePixelSize_um +
               ", cropZAroundFocusArea: " + cropZAroundFocusArea + "}";
    }
}
