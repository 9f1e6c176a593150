package org.janelia.oct.stitch;

/**
 * Indicates that a finished volume does not contain every expected row.
 * Rows that were written are left in place for troubleshooting.
 *
 * @author Eric Trautman
 */
public class RowCountMismatchException
        extends RuntimeException {

    private final String location;
    private final int expectedCount;
    private final int countedCount;
    private final int listedCount;

    public RowCountMismatchException(final String location,
                                     final int expectedCount,
                                     final int countedCount,
                                     final int listedCount) {
        super("please review " + location + ", expected " + expectedCount + " rows but counted " +
              countedCount + " (" + listedCount + " listed), written rows were not removed so they can be debugged");
        this.location = location;
        this.expectedCount = expectedCount;
        this.countedCount = countedCount;
        this.listedCount = listedCount;
    }

    public String getLocation() {
        return location;
    }

    public int getExpectedCount() {
        return expectedCount;
    }

    public int getCountedCount() {
        return countedCount;
    }

    public int getListedCount() {
        return listedCount;
    }
}
