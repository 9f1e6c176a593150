package org.janelia.oct.stitch;

import org.janelia.oct.dimension.DimensionSet;
import org.janelia.oct.tile.ScanConfiguration;

/**
 * Corrects depth profiles for the probe's lateral optical path length differences.
 */
public interface OpticalPathCorrector {

    /**
     * @param  amplitude        mean amplitudes stored z fastest: {@code [z + depthCount * x]}.
     * @param  frameDimensions  dimensions of the frame (in mm).
     * @param  probeGeometry    scan configuration providing the probe field of view and tile ranges.
     *
     * @return corrected amplitudes with a mask of samples that hold measured (not extrapolated) data.
     */
    OpticalPathCorrection correct(final double[] amplitude,
                                  final DimensionSet frameDimensions,
                                  final ScanConfiguration probeGeometry);
}
