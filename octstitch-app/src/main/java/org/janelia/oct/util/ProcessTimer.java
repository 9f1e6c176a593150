package org.janelia.oct.util;

/**
 * Tracks elapsed time of a command line process.
 *
 * @author Eric Trautman
 */
public class ProcessTimer {

    private final long start;

    public ProcessTimer() {
        this.start = System.currentTimeMillis();
    }

    public long getElapsedMilliseconds() {
        return System.currentTimeMillis() - start;
    }

    public long getElapsedSeconds() {
        return getElapsedMilliseconds() / 1000;
    }

    @Override
    public String toString() {
        final long totalSeconds = getElapsedSeconds();
        final long totalMinutes = totalSeconds / 60;
        final long hours = totalMinutes / 60;
        final long minutes = totalMinutes % 60;
        final long seconds = totalSeconds % 60;
        return hours + " hours, " + minutes + " minutes, " + seconds + " seconds";
    }
}
