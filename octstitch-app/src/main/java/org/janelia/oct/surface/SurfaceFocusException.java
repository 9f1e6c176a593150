package org.janelia.oct.surface;

/**
 * Thrown when a tissue surface fails one of the focus assertions.
 *
 * @author Eric Trautman
 */
public class SurfaceFocusException
        extends IllegalStateException {

    public enum Reason {
        /** Too many surface positions in the region of interest are undefined. */
        CANNOT_BE_ESTIMATED,
        /** The surface is not flat enough to be in focus everywhere. */
        CANNOT_BE_IN_FOCUS,
        /** The median surface position is too far from the focus. */
        OUT_OF_FOCUS
    }

    private final Reason reason;

    public SurfaceFocusException(final Reason reason,
                                 final String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

}
