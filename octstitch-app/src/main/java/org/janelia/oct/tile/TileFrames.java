package org.janelia.oct.tile;

import org.janelia.oct.dimension.DimensionSet;

/**
 * Dimensions (in mm) of a single tile and of the stitched output lattice.
 *
 * @author Eric Trautman
 */
public class TileFrames {

    private final DimensionSet oneTileDimensions;
    private final DimensionSet outputDimensions;

    public TileFrames(final DimensionSet oneTileDimensions,
                      final DimensionSet outputDimensions) {
        this.oneTileDimensions = oneTileDimensions;
        this.outputDimensions = outputDimensions;
    }

    /**
     * @return tile local dimensions where x and y are relative to the tile center and
     *         z = 0 is the focus position (when known).
     */
    public DimensionSet getOneTileDimensions() {
        return oneTileDimensions;
    }

    /**
     * @return output lattice dimensions where z = 0 is the tissue interface.
     */
    public DimensionSet getOutputDimensions() {
        return outputDimensions;
    }

    @Override
    public String toString() {
        return "{oneTile: " + oneTileDimensions + ", output: " + outputDimensions + "}";
    }
}
