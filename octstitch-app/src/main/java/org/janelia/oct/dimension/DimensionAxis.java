package org.janelia.oct.dimension;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.Arrays;

/**
 * Physical coordinates for each index of one axis of a data set.
 * Indices are implicit and zero based, so the axis always has exactly one value per index.
 * Instances are immutable.
 *
 * @author Eric Trautman
 */
public class DimensionAxis
        implements Serializable {

    private double[] values;
    private LengthUnit units;
    private String origin;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private DimensionAxis() {
        this(new double[0], LengthUnit.MM, null);
    }

    public DimensionAxis(final double[] values,
                         final LengthUnit units,
                         final String origin) {
        if (values == null) {
            throw new IllegalArgumentException("axis values must be defined");
        }
        if (units == null) {
            throw new IllegalArgumentException("axis units must be defined");
        }
        this.values = values.clone();
        this.units = units;
        this.origin = origin;
    }

    /**
     * @return axis with values {@code start + i * step} for {@code i = 0 .. count - 1}.
     */
    public static DimensionAxis uniform(final double start,
                                        final double step,
                                        final int count,
                                        final LengthUnit units,
                                        final String origin) {
        final double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = start + i * step;
        }
        return new DimensionAxis(values, units, origin);
    }

    /**
     * Mimics a colon range: {@code start, start + step, ...} while the value does not exceed {@code end}.
     *
     * @throws IllegalArgumentException
     *   if the step is not positive.
     */
    public static double[] range(final double start,
                                 final double step,
                                 final double end)
            throws IllegalArgumentException {
        if (! (step > 0)) {
            throw new IllegalArgumentException("range step must be positive but is " + step);
        }
        if (end < start) {
            return new double[0];
        }
        final int count = (int) Math.floor((end - start) / step + 1.0e-10) + 1;
        final double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = start + i * step;
        }
        return values;
    }

    /**
     * @return {@code count} evenly spaced values from {@code first} to {@code last} inclusive.
     */
    public static double[] linspace(final double first,
                                    final double last,
                                    final int count) {
        final double[] values = new double[count];
        if (count == 1) {
            values[0] = last;
        } else {
            final double step = (last - first) / (count - 1);
            for (int i = 0; i < count; i++) {
                values[i] = first + i * step;
            }
            values[count - 1] = last;
        }
        return values;
    }

    @JsonIgnore
    public int size() {
        return values.length;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return values.length == 0;
    }

    public double getValue(final int index) {
        return values[index];
    }

    /**
     * @return copy of this axis' values.
     */
    public double[] getValues() {
        return values.clone();
    }

    @JsonIgnore
    public double getFirst() {
        return values[0];
    }

    @JsonIgnore
    public double getLast() {
        return values[values.length - 1];
    }

    /**
     * @return distance between the first two values (or 0 for axes with fewer than two values).
     */
    @JsonIgnore
    public double getSpacing() {
        return values.length < 2 ? 0.0 : values[1] - values[0];
    }

    /**
     * @return mean distance between consecutive values (or 0 for axes with fewer than two values).
     */
    @JsonIgnore
    public double getMeanSpacing() {
        return values.length < 2 ? 0.0 : (getLast() - getFirst()) / (values.length - 1);
    }

    public LengthUnit getUnits() {
        return units;
    }

    public String getOrigin() {
        return origin;
    }

    /**
     * @return index of the value closest to the specified value (ties resolve to the lower index).
     */
    public int getNearestIndex(final double value) {
        int nearestIndex = -1;
        double nearestDistance = Double.MAX_VALUE;
        for (int i = 0; i < values.length; i++) {
            final double distance = Math.abs(values[i] - value);
            if (distance < nearestDistance) {
                nearestDistance = distance;
                nearestIndex = i;
            }
        }
        return nearestIndex;
    }

    public DimensionAxis toUnits(final LengthUnit toUnits) {
        if (toUnits == units) {
            return this;
        }
        final double factor = units.getConversionFactor(toUnits);
        final double[] converted = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            converted[i] = values[i] * factor;
        }
        return new DimensionAxis(converted, toUnits, origin);
    }

    public DimensionAxis withOffset(final double offset) {
        final double[] shifted = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            shifted[i] = values[i] + offset;
        }
        return new DimensionAxis(shifted, units, origin);
    }

    public DimensionAxis withValues(final double[] newValues) {
        return new DimensionAxis(newValues, units, origin);
    }

    public DimensionAxis withOrigin(final String newOrigin) {
        return new DimensionAxis(values, units, newOrigin);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final DimensionAxis that = (DimensionAxis) o;
        return Arrays.equals(values, that.values) && (units == that.units);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(values) + units.hashCode();
    }

    @Override
    public String toString() {
        if (values.length == 0) {
            return "{size: 0, units: " + units + "}";
        }
        return String.format("{size: %d, first: %.6f, last: %.6f, units: %s}",
                             values.length, getFirst(), getLast(), units);
    }
}
