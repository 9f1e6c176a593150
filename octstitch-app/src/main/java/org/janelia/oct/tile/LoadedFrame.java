package org.janelia.oct.tile;

import org.janelia.oct.dimension.DimensionSet;
import org.janelia.oct.spectral.RawFrame;

/**
 * A raw frame together with the dimensions it was recorded with.
 *
 * @author Eric Trautman
 */
public class LoadedFrame {

    private final RawFrame frame;
    private final DimensionSet dimensions;

    public LoadedFrame(final RawFrame frame,
                       final DimensionSet dimensions) {
        this.frame = frame;
        this.dimensions = dimensions;
    }

    public RawFrame getFrame() {
        return frame;
    }

    public DimensionSet getDimensions() {
        return dimensions;
    }

    public boolean isValid() {
        return frame.isValid();
    }
}
