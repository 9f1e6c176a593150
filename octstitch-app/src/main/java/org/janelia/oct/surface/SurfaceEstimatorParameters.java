package org.janelia.oct.surface;

import java.io.Serializable;

/**
 * Options and calibration constants for tissue surface estimation.
 *
 * @author Eric Trautman
 */
public class SurfaceEstimatorParameters
        implements Serializable {

    /** Consecutive samples below a candidate that must stay bright to confirm the surface. */
    public static final int BASE_CONFIRMATIONS_REQUIRED = 12;

    /** How much the confirmation count may be lowered when no surface is found. */
    public static final int ADJUSTABLE_DECREASE = 1;

    /** Volumes deeper than this many pixels skip their top (reflection prone) samples. */
    public static final int Z_SIZE_THRESHOLD = 1000;

    /** Start depth (zero based pixel) for shallow volumes. */
    public static final int LOW_Z_START = 0;

    /** Start depth (zero based pixel) for deep volumes. */
    public static final int HIGH_Z_START = 299;

    /** Sigma (pixels) of the Gaussian that smooths the surface map. */
    public static final double SMOOTHING_SIGMA = 1.5;

    /** Sigma (pixels) of the Gaussian applied to threshold regions of interest. */
    public static final double ROI_BLUR_SIGMA = 1.0;

    /** Radius of the median filter applied to threshold regions of interest (3x3 kernel). */
    public static final double ROI_MEDIAN_RADIUS = 1.0;

    /** Fraction of the tile width used on each side of the tile center for threshold regions. */
    public static final double ROI_HALF_WIDTH_FRACTION = 0.02;

    public static final int MIN_ROI_HALF_WIDTH = 3;

    /** Confirmation offset is this fraction of the region's intensity range, clamped to the limits below. */
    public static final double OFFSET_RANGE_FRACTION = 0.1;
    public static final double MIN_OFFSET = 0.1;
    public static final double MAX_OFFSET = 2.0;

    /** Threshold and offset used when a region of interest holds no defined values. */
    public static final double EMPTY_ROI_THRESHOLD = -10.0;
    public static final double EMPTY_ROI_OFFSET = -12.0;

    /** Fixed intensity threshold that replaces Otsu detection (null for automatic). */
    private final Double constantThreshold;

    /** Physical field of view (mm) of one stitched tile (null to treat the full x range as one tile). */
    private final Double octProbeFOV_mm;

    public SurfaceEstimatorParameters() {
        this(null, null);
    }

    public SurfaceEstimatorParameters(final Double constantThreshold,
                                      final Double octProbeFOV_mm) {
        if ((octProbeFOV_mm != null) && (! (octProbeFOV_mm > 0))) {
            throw new IllegalArgumentException("octProbeFOV_mm must be positive but is " + octProbeFOV_mm);
        }
        this.constantThreshold = constantThreshold;
        this.octProbeFOV_mm = octProbeFOV_mm;
    }

    public Double getConstantThreshold() {
        return constantThreshold;
    }

    public Double getOctProbeFOV_mm() {
        return octProbeFOV_mm;
    }

    public static int getStartDepth(final int depthCount) {
        return depthCount > Z_SIZE_THRESHOLD ? HIGH_Z_START : LOW_Z_START;
    }

    @Override
    public String toString() {
        return "{constantThreshold: " + constantThreshold + ", octProbeFOV_mm: " + octProbeFOV_mm + "}";
    }
}
