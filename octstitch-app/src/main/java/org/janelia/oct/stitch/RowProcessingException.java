package org.janelia.oct.stitch;

/**
 * Wraps the failure that stopped processing of one output row.
 *
 * @author Eric Trautman
 */
public class RowProcessingException
        extends RuntimeException {

    private final int rowIndex;

    public RowProcessingException(final int rowIndex,
                                  final Throwable cause) {
        super("failed to process row " + rowIndex + ": " + cause.getMessage(), cause);
        this.rowIndex = rowIndex;
    }

    public int getRowIndex() {
        return rowIndex;
    }
}
