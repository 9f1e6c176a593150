package org.janelia.oct.tile;

import java.io.IOException;

import org.janelia.oct.dimension.DimensionSet;

/**
 * Source of raw interferogram frames for the tiles of a scan.
 * Implementations must be safe for concurrent use by multiple row workers.
 */
public interface RawFrameLoader {

    /**
     * @return dimensions (at least the lambda axis and scan geometry) recorded for the specified tile.
     *
     * @throws IOException
     *   if the tile's metadata cannot be read.
     */
    DimensionSet loadDimensions(final Tile tile)
            throws IOException;

    /**
     * Loads the interferogram for one y position of a tile.
     * Missing or corrupt data is reported with an invalid frame instead of an exception.
     *
     * @param  tile            tile to load.
     * @param  tileDimensions  tile local dimensions (in mm).
     * @param  yIndexInTile    zero based y index within the tile.
     *
     * @return the frame with its dimensions.
     */
    LoadedFrame load(final Tile tile,
                     final DimensionSet tileDimensions,
                     final int yIndexInTile);
}
