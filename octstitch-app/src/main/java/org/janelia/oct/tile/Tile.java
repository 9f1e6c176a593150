package org.janelia.oct.tile;

import java.io.Serializable;

/**
 * One acquisition at a lateral (x, y) position and focal depth (z) of a tiled scan.
 *
 * @author Eric Trautman
 */
public class Tile
        implements Serializable {

    private final int xIndex;
    private final int yIndex;
    private final int zIndex;
    private final double xCenter_mm;
    private final double yCenter_mm;
    private final double zDepth_mm;
    private final String rawFolderRef;

    public Tile(final int xIndex,
                final int yIndex,
                final int zIndex,
                final double xCenter_mm,
                final double yCenter_mm,
                final double zDepth_mm,
                final String rawFolderRef) {
        this.xIndex = xIndex;
        this.yIndex = yIndex;
        this.zIndex = zIndex;
        this.xCenter_mm = xCenter_mm;
        this.yCenter_mm = yCenter_mm;
        this.zDepth_mm = zDepth_mm;
        this.rawFolderRef = rawFolderRef;
    }

    public int getXIndex() {
        return xIndex;
    }

    public int getYIndex() {
        return yIndex;
    }

    public int getZIndex() {
        return zIndex;
    }

    public double getXCenter_mm() {
        return xCenter_mm;
    }

    public double getYCenter_mm() {
        return yCenter_mm;
    }

    public double getZDepth_mm() {
        return zDepth_mm;
    }

    /**
     * @return reference (typically a folder name relative to the scan folder) for this tile's raw data.
     */
    public String getRawFolderRef() {
        return rawFolderRef;
    }

    @Override
    public String toString() {
        return "tile(" + xIndex + "," + yIndex + "," + zIndex + ")@" + rawFolderRef;
    }
}
