package org.janelia.oct.surface;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the offset between the estimated tissue surface and the focus (depth 0)
 * and asserts that the surface can be imaged in focus.
 *
 * @author Eric Trautman
 */
public class SurfaceFocusAnalyzer {

    public static final double DEFAULT_ACCEPTABLE_RANGE_MM = 0.025;

    /** Fraction of undefined surface positions that makes the surface unusable. */
    public static final double MAX_UNDEFINED_FRACTION = 0.2;

    /** Percentile of distances from the median surface that must be within the acceptable range. */
    public static final double FLATNESS_PERCENTILE = 80.0;

    private final double acceptableRange_mm;
    private final double[] roi;
    private final boolean throwErrorIfOutOfFocus;

    public SurfaceFocusAnalyzer() {
        this(DEFAULT_ACCEPTABLE_RANGE_MM, null, true);
    }

    /**
     * @param  acceptableRange_mm      how far the surface may be from focus and still be considered in focus.
     * @param  roi                     region {@code [x, y, width, height]} in mm to check or null for the full map.
     * @param  throwErrorIfOutOfFocus  if false, an out of focus surface is reported instead of raising an error.
     *
     * @throws IllegalArgumentException
     *   if the range is not positive or the region is malformed.
     */
    public SurfaceFocusAnalyzer(final double acceptableRange_mm,
                                final double[] roi,
                                final boolean throwErrorIfOutOfFocus)
            throws IllegalArgumentException {

        if (! (acceptableRange_mm > 0)) {
            throw new IllegalArgumentException("acceptableRange_mm must be positive but is " + acceptableRange_mm);
        }
        if ((roi != null) && ((roi.length != 4) || (! (roi[2] > 0)) || (! (roi[3] > 0)))) {
            throw new IllegalArgumentException("roi must be [x, y, width, height] with positive width and height " +
                                               "but is " + Arrays.toString(roi));
        }

        this.acceptableRange_mm = acceptableRange_mm;
        this.roi = roi == null ? null : roi.clone();
        this.throwErrorIfOutOfFocus = throwErrorIfOutOfFocus;
    }

    /**
     * @throws SurfaceFocusException
     *   if the surface cannot be estimated, is too uneven to be in focus,
     *   or (when configured to throw) is out of focus.
     */
    public FocusAssessment assess(final SurfaceMap surfaceMap)
            throws SurfaceFocusException {

        final List<Double> roiValues = new ArrayList<>();
        final double[] x = surfaceMap.getX_mm();
        final double[] y = surfaceMap.getY_mm();
        for (int yIndex = 0; yIndex < y.length; yIndex++) {
            if (isInRange(y[yIndex], 1)) {
                for (int xIndex = 0; xIndex < x.length; xIndex++) {
                    if (isInRange(x[xIndex], 0)) {
                        roiValues.add(surfaceMap.getSurfacePosition(yIndex, xIndex));
                    }
                }
            }
        }

        final double[] defined = roiValues.stream()
                .filter(v -> (v != null) && Double.isFinite(v))
                .mapToDouble(Double::doubleValue)
                .toArray();

        final int undefinedCount = roiValues.size() - defined.length;
        if ((defined.length == 0) || ((double) undefinedCount / roiValues.size() >= MAX_UNDEFINED_FRACTION)) {
            throw new SurfaceFocusException(SurfaceFocusException.Reason.CANNOT_BE_ESTIMATED,
                                            "Large part of the surface position cannot be estimated (" +
                                            undefinedCount + " of " + roiValues.size() +
                                            " positions are undefined).");
        }

        final double median = percentile(defined, 50.0);

        final double[] distances = new double[defined.length];
        for (int i = 0; i < defined.length; i++) {
            distances[i] = Math.abs(defined[i] - median);
        }
        final double distanceFromSurface = percentile(distances, FLATNESS_PERCENTILE);
        if (distanceFromSurface > acceptableRange_mm) {
            throw new SurfaceFocusException(SurfaceFocusException.Reason.CANNOT_BE_IN_FOCUS,
                                            "Tissue's shape is not flat, therefore it cannot all be in focus (" +
                                            FLATNESS_PERCENTILE + "th percentile distance from median is " +
                                            distanceFromSurface + " mm).");
        }

        final FocusAssessment assessment = new FocusAssessment(median, Math.abs(median) <= acceptableRange_mm);

        if (assessment.isSurfaceInFocus()) {
            LOG.info("assess: {}", assessment.getInstructions());
        } else if (throwErrorIfOutOfFocus) {
            throw new SurfaceFocusException(SurfaceFocusException.Reason.OUT_OF_FOCUS,
                                            assessment.getInstructions());
        } else {
            LOG.warn("assess: {}", assessment.getInstructions());
        }

        return assessment;
    }

    private boolean isInRange(final double value,
                              final int roiIndex) {
        return (roi == null) || ((value >= roi[roiIndex]) && (value <= roi[roiIndex] + roi[roiIndex + 2]));
    }

    /**
     * Percentile with linear interpolation between sorted samples placed at
     * {@code 100 * (i + 0.5) / n}, clamped to the smallest and largest sample outside that range.
     */
    static double percentile(final double[] values,
                             final double p) {
        final double[] sorted = values.clone();
        Arrays.sort(sorted);
        final int n = sorted.length;
        final double position = p * n / 100.0 - 0.5;
        if (position <= 0) {
            return sorted[0];
        } else if (position >= n - 1) {
            return sorted[n - 1];
        }
        final int lower = (int) Math.floor(position);
        final double fraction = position - lower;
        return sorted[lower] + fraction * (sorted[lower + 1] - sorted[lower]);
    }

    private static final Logger LOG = LoggerFactory.getLogger(SurfaceFocusAnalyzer.class);
}
