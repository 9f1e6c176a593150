package org.janelia.oct.surface;

import java.io.Serializable;

import org.janelia.oct.json.JsonUtils;

/**
 * Outcome of a focus check: how far (mm) the median tissue surface is from the focus
 * and whether that distance is acceptable.
 *
 * @author Eric Trautman
 */
public class FocusAssessment
        implements Serializable {

    private final double zOffsetCorrection_mm;
    private final boolean surfaceInFocus;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private FocusAssessment() {
        this(Double.NaN, false);
    }

    public FocusAssessment(final double zOffsetCorrection_mm,
                           final boolean surfaceInFocus) {
        this.zOffsetCorrection_mm = zOffsetCorrection_mm;
        this.surfaceInFocus = surfaceInFocus;
    }

    /**
     * @return distance to move the stage; positive values mean the stage needs to move up.
     */
    public double getZOffsetCorrection_mm() {
        return zOffsetCorrection_mm;
    }

    public boolean isSurfaceInFocus() {
        return surfaceInFocus;
    }

    /**
     * @return human readable instructions for bringing the surface into focus.
     */
    public String getInstructions() {
        if (surfaceInFocus) {
            return String.format("The average distance of the surface (%.3f mm) is within the acceptable range.",
                                 zOffsetCorrection_mm);
        }
        final String direction = zOffsetCorrection_mm > 0 ? "increase" : "decrease";
        return String.format("Surface out of focus by %.3f mm: please %s the stage Z position by %.3f mm " +
                             "to bring the tissue surface into focus.",
                             zOffsetCorrection_mm, direction, Math.abs(zOffsetCorrection_mm));
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    @Override
    public String toString() {
        return "{zOffsetCorrection_mm: " + zOffsetCorrection_mm + ", surfaceInFocus: " + surfaceInFocus + "}";
    }

    private static final JsonUtils.Helper<FocusAssessment> JSON_HELPER =
            new JsonUtils.Helper<>(FocusAssessment.class);
}
