package org.janelia.oct.volume;

import java.io.IOException;

/**
 * Destination for stitched volumes.
 */
public interface VolumeSink {

    /**
     * @param  expectedRowCount  number of y rows the volume will hold.
     *
     * @return handle for writing rows.
     */
    VolumeHandle open(final int expectedRowCount)
            throws IOException;
}
