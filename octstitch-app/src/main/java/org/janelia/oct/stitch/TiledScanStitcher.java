package org.janelia.oct.stitch;

import java.io.IOException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.janelia.oct.dimension.DimensionSet;
import org.janelia.oct.util.ProgressTracker;
import org.janelia.oct.volume.VolumeHandle;
import org.janelia.oct.volume.VolumeSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stitches every output row of a tiled scan on a bounded worker pool and streams the rows into a sink.
 *
 * @author Eric Trautman
 */
public class TiledScanStitcher {

    private final StitchContext context;
    private final StitchAccumulator accumulator;

    public TiledScanStitcher(final StitchContext context) {
        this.context = context;
        this.accumulator = new StitchAccumulator(context);
    }

    /**
     * Processes all rows, verifies that the sink holds every row, and finalizes the volume.
     * Processing stops at the first failed row; rows written before the failure are kept.
     *
     * @return handle for the finalized volume.
     *
     * @throws RowProcessingException
     *   if any row fails.
     *
     * @throws RowCountMismatchException
     *   if the sink does not hold every row after processing.
     *
     * @throws IOException
     *   if the sink cannot be opened or finalized.
     */
    public VolumeHandle stitch(final VolumeSink sink)
            throws RowProcessingException, RowCountMismatchException, IOException {

        final DimensionSet outputDimensions = context.getOutputDimensions();
        final int rowCount = outputDimensions.getY().size();
        final int numberOfThreads = context.getStitchParameters().getNumberOfThreads();

        LOG.info("stitch: entry, stitching {} rows of ({}, {}) pixels with {} threads",
                 rowCount, outputDimensions.getZ().size(), outputDimensions.getX().size(), numberOfThreads);

        final VolumeHandle handle = sink.open(rowCount);

        final ProgressTracker progress = new ProgressTracker(rowCount);
        final ExecutorService executor = (numberOfThreads == 1) ?
                                         Executors.newSingleThreadExecutor() :
                                         Executors.newFixedThreadPool(numberOfThreads);
        final CompletionService<Integer> completionService = new ExecutorCompletionService<>(executor);
        for (int yIndex = 0; yIndex < rowCount; yIndex++) {
            final int rowIndex = yIndex;
            completionService.submit(() -> processAndWriteRow(rowIndex, handle));
        }

        try {
            for (int i = 0; i < rowCount; i++) {
                completionService.take().get();
                if (progress.increment()) {
                    LOG.info("stitch: completed rows so far: {}", progress);
                }
            }
            executor.shutdown();
        } catch (final ExecutionException e) {
            executor.shutdownNow();
            final Throwable cause = e.getCause();
            if (cause instanceof RowProcessingException) {
                throw (RowProcessingException) cause;
            }
            throw new RowProcessingException(-1, cause);
        } catch (final InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
            throw new RowProcessingException(-1, e);
        }

        LOG.info("stitch: done stitching after {}, verifying all rows are there", progress);

        verifyRowCount(handle, rowCount);

        handle.finalizeVolume(outputDimensions);

        LOG.info("stitch: exit, finalized volume at {}", handle.getLocation());

        return handle;
    }

    private Integer processAndWriteRow(final int rowIndex,
                                       final VolumeHandle handle)
            throws RowProcessingException {
        try {
            final RowData row = accumulator.processRow(rowIndex);
            handle.writeRow(rowIndex, row);
        } catch (final Throwable t) {
            LOG.error("processAndWriteRow: failed to process row " + rowIndex, t);
            throw new RowProcessingException(rowIndex, t);
        }
        return rowIndex;
    }

    /**
     * @throws RowCountMismatchException
     *   if both counting sources disagree with the expected count.
     */
    static void verifyRowCount(final VolumeHandle handle,
                               final int expectedCount)
            throws RowCountMismatchException, IOException {

        final int countedCount = handle.countCompletedRows();
        if (countedCount != expectedCount) {
            final int listedCount = handle.listCompletedRows().size();
            LOG.info("verifyRowCount: location={}, expected={}, counted={}, listed={}",
                     handle.getLocation(), expectedCount, countedCount, listedCount);
            if (listedCount != expectedCount) {
                throw new RowCountMismatchException(handle.getLocation(), expectedCount, countedCount, listedCount);
            } else {
                LOG.warn("verifyRowCount: completed row count {} differs from the {} rows listed in {}, " +
                         "the listing matches the expected count so processing continues",
                         countedCount, listedCount, handle.getLocation());
            }
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(TiledScanStitcher.class);
}
