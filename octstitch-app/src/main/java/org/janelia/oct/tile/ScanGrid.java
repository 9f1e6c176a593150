package org.janelia.oct.tile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.janelia.oct.ConfigurationException;

/**
 * Immutable set of tiles formed by the cross product of a scan's x centers, y centers and depths,
 * excluding disabled lateral positions.
 *
 * @author Eric Trautman
 */
public class ScanGrid {

    /** Maximum distance (mm) of the closest depth from 0. */
    public static final double ZERO_DEPTH_TOLERANCE_MM = 0.001;

    private final double[] xCenters_mm;
    private final double[] yCenters_mm;
    private final double[] zDepths_mm;
    private final List<Tile> tiles;
    private final List<List<Tile>> tilesByYIndex;

    /**
     * @throws ConfigurationException
     *   if the configuration is invalid or the depths do not include 0.
     */
    public ScanGrid(final ScanConfiguration configuration)
            throws ConfigurationException {

        configuration.validate();

        this.xCenters_mm = configuration.getXCenters_mm();
        this.yCenters_mm = configuration.getYCenters_mm();
        this.zDepths_mm = configuration.getZDepths();

        double minAbsDepth = Double.MAX_VALUE;
        for (final double depth : zDepths_mm) {
            minAbsDepth = Math.min(minAbsDepth, Math.abs(depth));
        }
        if (minAbsDepth > ZERO_DEPTH_TOLERANCE_MM) {
            throw new ConfigurationException(
                    "scan depths must include 0 (within " + ZERO_DEPTH_TOLERANCE_MM + " mm) so that z = 0 can " +
                    "be placed at the tissue interface, but the closest depth is " + minAbsDepth + " mm away");
        }

        final List<Tile> allTiles = new ArrayList<>();
        final List<List<Tile>> byY = new ArrayList<>();
        for (int yIndex = 0; yIndex < yCenters_mm.length; yIndex++) {
            final List<Tile> rowTiles = new ArrayList<>();
            for (int xIndex = 0; xIndex < xCenters_mm.length; xIndex++) {
                if (configuration.isDisabled(xIndex, yIndex)) {
                    continue;
                }
                for (int zIndex = 0; zIndex < zDepths_mm.length; zIndex++) {
                    rowTiles.add(new Tile(xIndex, yIndex, zIndex,
                                          xCenters_mm[xIndex], yCenters_mm[yIndex], zDepths_mm[zIndex],
                                          configuration.getOctFolder(xIndex, yIndex, zIndex)));
                }
            }
            allTiles.addAll(rowTiles);
            byY.add(Collections.unmodifiableList(rowTiles));
        }

        this.tiles = Collections.unmodifiableList(allTiles);
        this.tilesByYIndex = Collections.unmodifiableList(byY);
    }

    public double[] getXCenters_mm() {
        return xCenters_mm.clone();
    }

    public double[] getYCenters_mm() {
        return yCenters_mm.clone();
    }

    public double[] getZDepths_mm() {
        return zDepths_mm.clone();
    }

    public int getDepthCount() {
        return zDepths_mm.length;
    }

    /**
     * @return all enabled tiles ordered by y, then x, then depth.
     */
    public List<Tile> getTiles() {
        return tiles;
    }

    /**
     * @return enabled tiles at the specified y center ordered by x, then depth.
     */
    public List<Tile> getTilesForYIndex(final int yIndex) {
        return tilesByYIndex.get(yIndex);
    }

    public double getMinDepth() {
        double min = Double.MAX_VALUE;
        for (final double depth : zDepths_mm) {
            min = Math.min(min, depth);
        }
        return min;
    }

    public double getMaxDepth() {
        double max = -Double.MAX_VALUE;
        for (final double depth : zDepths_mm) {
            max = Math.max(max, depth);
        }
        return max;
    }

    @Override
    public String toString() {
        return "{xCount: " + xCenters_mm.length + ", yCount: " + yCenters_mm.length +
               ", depthCount: " + zDepths_mm.length + ", enabledTileCount: " + tiles.size() + "}";
    }
}
