package org.janelia.oct.volume;

import java.io.IOException;
import java.util.List;

import org.janelia.oct.dimension.DimensionSet;
import org.janelia.oct.stitch.RowData;

/**
 * An open output volume that accepts rows in any order.
 * Implementations must accept concurrent writes of distinct rows, and rewriting a row
 * with identical data must leave the volume unchanged.
 */
public interface VolumeHandle {

    void writeRow(final int rowIndex,
                  final RowData row)
            throws IOException;

    /**
     * Completes the volume after all rows have been written.
     *
     * @param  dimensions  output lattice dimensions stored with the volume.
     */
    void finalizeVolume(final DimensionSet dimensions)
            throws IOException;

    /**
     * @return number of rows recorded as complete.
     */
    int countCompletedRows()
            throws IOException;

    /**
     * @return indexes of stored rows, determined independently of {@link #countCompletedRows()} where possible.
     */
    List<Integer> listCompletedRows()
            throws IOException;

    /**
     * @return description of where the volume is stored.
     */
    String getLocation();
}
