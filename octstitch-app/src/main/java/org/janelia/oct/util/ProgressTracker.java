package org.janelia.oct.util;

/**
 * Tracks completion of a fixed number of work items and decides when progress should be reported.
 * Reports are due every {@code max(floor(total / reportCount), 1)} completed items.
 * Thread safe.
 *
 * @author Eric Trautman
 */
public class ProgressTracker {

    public static final int DEFAULT_REPORT_COUNT = 20;

    private final int total;
    private final int reportInterval;
    private final long start;
    private int completed;

    public ProgressTracker(final int total) {
        this(total, DEFAULT_REPORT_COUNT);
    }

    public ProgressTracker(final int total,
                           final int reportCount) {
        this.total = total;
        this.reportInterval = Math.max(total / Math.max(reportCount, 1), 1);
        this.start = System.currentTimeMillis();
        this.completed = 0;
    }

    /**
     * Records one completed item.
     *
     * @return true if a progress report is due.
     */
    public synchronized boolean increment() {
        completed++;
        return (completed % reportInterval) == 0;
    }

    public synchronized int getCompleted() {
        return completed;
    }

    public int getTotal() {
        return total;
    }

    public int getReportInterval() {
        return reportInterval;
    }

    public synchronized double getPercentComplete() {
        return total == 0 ? 100.0 : 100.0 * completed / total;
    }

    public long getElapsedSeconds() {
        return (System.currentTimeMillis() - start) / 1000;
    }

    @Override
    public String toString() {
        final long totalSeconds = getElapsedSeconds();
        final long totalMinutes = totalSeconds / 60;
        return String.format("%d/%d (%.1f%%) after %d minutes, %d seconds",
                             getCompleted(), total, getPercentComplete(), totalMinutes, totalSeconds % 60);
    }
}
