package org.janelia.oct.surface;

import java.io.Serializable;

import org.janelia.oct.json.JsonUtils;

/**
 * Estimated tissue surface depth (mm, larger is deeper) for each (y, x) position of a volume.
 * Positions where no surface was found are null.
 *
 * @author Eric Trautman
 */
public class SurfaceMap
        implements Serializable {

    private final Double[][] surfacePosition_mm;
    private final double[] x_mm;
    private final double[] y_mm;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private SurfaceMap() {
        this(new Double[0][0], new double[0], new double[0]);
    }

    public SurfaceMap(final Double[][] surfacePosition_mm,
                      final double[] x_mm,
                      final double[] y_mm)
            throws IllegalArgumentException {
        if (surfacePosition_mm.length != y_mm.length) {
            throw new IllegalArgumentException("surface has " + surfacePosition_mm.length + " rows but there are " +
                                               y_mm.length + " y positions");
        }
        for (final Double[] row : surfacePosition_mm) {
            if (row.length != x_mm.length) {
                throw new IllegalArgumentException("surface row has " + row.length + " values but there are " +
                                                   x_mm.length + " x positions");
            }
        }
        this.surfacePosition_mm = surfacePosition_mm;
        this.x_mm = x_mm;
        this.y_mm = y_mm;
    }

    public Double getSurfacePosition(final int yIndex,
                                     final int xIndex) {
        return surfacePosition_mm[yIndex][xIndex];
    }

    public double[] getX_mm() {
        return x_mm.clone();
    }

    public double[] getY_mm() {
        return y_mm.clone();
    }

    public int getXCount() {
        return x_mm.length;
    }

    public int getYCount() {
        return y_mm.length;
    }

    /**
     * @return copy of this map with every defined position shifted by the specified offset.
     */
    public SurfaceMap withOffset(final double offset_mm) {
        final Double[][] shifted = new Double[y_mm.length][x_mm.length];
        for (int y = 0; y < y_mm.length; y++) {
            for (int x = 0; x < x_mm.length; x++) {
                final Double value = surfacePosition_mm[y][x];
                shifted[y][x] = value == null ? null : value + offset_mm;
            }
        }
        return new SurfaceMap(shifted, x_mm, y_mm);
    }

    /**
     * @return mean of all defined positions or NaN if none are defined.
     */
    public double getMeanPosition() {
        double sum = 0;
        int count = 0;
        for (final Double[] row : surfacePosition_mm) {
            for (final Double value : row) {
                if (value != null) {
                    sum += value;
                    count++;
                }
            }
        }
        return count == 0 ? Double.NaN : sum / count;
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    private static final JsonUtils.Helper<SurfaceMap> JSON_HELPER =
            new JsonUtils.Helper<>(SurfaceMap.class);
}
