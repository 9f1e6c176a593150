package org.janelia.oct.volume;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.janelia.oct.dimension.DimensionSet;
import org.janelia.oct.stitch.RowData;

/**
 * Keeps stitched rows in memory.  Intended for tests and for volumes small enough to fit in the heap.
 *
 * @author Eric Trautman
 */
public class InMemoryVolumeSink
        implements VolumeSink {

    private Handle lastHandle;

    @Override
    public synchronized VolumeHandle open(final int expectedRowCount) {
        lastHandle = new Handle(expectedRowCount);
        return lastHandle;
    }

    /**
     * @return handle returned by the most recent {@link #open} call (or null if never opened).
     */
    public synchronized Handle getLastHandle() {
        return lastHandle;
    }

    public static class Handle
            implements VolumeHandle {

        private final int expectedRowCount;
        private final Map<Integer, RowData> rows;
        private DimensionSet dimensions;

        Handle(final int expectedRowCount) {
            this.expectedRowCount = expectedRowCount;
            this.rows = new ConcurrentHashMap<>();
        }

        @Override
        public void writeRow(final int rowIndex,
                             final RowData row)
                throws IllegalArgumentException {
            if ((rowIndex < 0) || (rowIndex >= expectedRowCount)) {
                throw new IllegalArgumentException("row index " + rowIndex + " is outside [0, " +
                                                   expectedRowCount + ")");
            }
            rows.put(rowIndex, row);
        }

        @Override
        public void finalizeVolume(final DimensionSet dimensions) {
            this.dimensions = dimensions;
        }

        @Override
        public int countCompletedRows() {
            return rows.size();
        }

        @Override
        public List<Integer> listCompletedRows() {
            final List<Integer> list = new ArrayList<>(rows.keySet());
            list.sort(Integer::compareTo);
            return list;
        }

        @Override
        public String getLocation() {
            return "memory";
        }

        public RowData getRow(final int rowIndex) {
            return rows.get(rowIndex);
        }

        public DimensionSet getDimensions() {
            return dimensions;
        }

        public boolean isFinalized() {
            return dimensions != null;
        }

        /**
         * @return volume assembled from all rows.
         *
         * @throws IllegalStateException
         *   if any row is missing.
         */
        public ReconstructedVolume toVolume()
                throws IllegalStateException {
            final List<RowData> orderedRows = new ArrayList<>(expectedRowCount);
            for (int y = 0; y < expectedRowCount; y++) {
                final RowData row = rows.get(y);
                if (row == null) {
                    throw new IllegalStateException("row " + y + " has not been written");
                }
                orderedRows.add(row);
            }
            return ReconstructedVolume.fromRows(orderedRows);
        }
    }
}
