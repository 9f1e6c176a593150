package org.janelia.oct.dimension;

/**
 * Physical length units used by dimension axes.
 *
 * @author Eric Trautman
 */
public enum LengthUnit {

    NM(1.0e-6),
    MICRONS(1.0e-3),
    MM(1.0);

    private final double millimetersPerUnit;

    LengthUnit(final double millimetersPerUnit) {
        this.millimetersPerUnit = millimetersPerUnit;
    }

    public double getMillimetersPerUnit() {
        return millimetersPerUnit;
    }

    /**
     * @return factor that converts values expressed in this unit to the specified unit.
     */
    public double getConversionFactor(final LengthUnit toUnit) {
        if (this == toUnit) {
            return 1.0;
        }
        return millimetersPerUnit / toUnit.millimetersPerUnit;
    }

    public double convert(final double value,
                          final LengthUnit toUnit) {
        return value * getConversionFactor(toUnit);
    }
}
