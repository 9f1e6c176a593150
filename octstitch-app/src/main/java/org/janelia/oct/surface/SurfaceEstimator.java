package org.janelia.oct.surface;

import ij.plugin.filter.GaussianBlur;
import ij.plugin.filter.RankFilters;
import ij.process.FloatProcessor;

import java.util.ArrayList;
import java.util.List;

import org.janelia.oct.dimension.DimensionAxis;
import org.janelia.oct.dimension.DimensionSet;
import org.janelia.oct.dimension.LengthUnit;
import org.janelia.oct.volume.ReconstructedVolume;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the tissue surface in a reconstructed log-amplitude volume.
 *
 * For every y slice, an intensity threshold is derived for each lateral tile from a narrow
 * region around the tile center (median filter, Gaussian blur, Otsu).  Each column is then
 * scanned from the start depth for the first sample above the threshold that is followed by
 * a run of bright samples.  The resulting surface map is smoothed with a Gaussian that ignores
 * undefined positions.
 *
 * @author Eric Trautman
 */
public class SurfaceEstimator {

    private final SurfaceEstimatorParameters parameters;

    public SurfaceEstimator(final SurfaceEstimatorParameters parameters) {
        this.parameters = parameters;
    }

    /**
     * @param  volume      log-amplitude volume.
     * @param  dimensions  physical axes of the volume (any length units).
     *
     * @return surface map in mm.
     *
     * @throws IllegalArgumentException
     *   if the dimensions lack x, y, or z values or do not match the volume.
     */
    public SurfaceMap estimate(final ReconstructedVolume volume,
                               final DimensionSet dimensions)
            throws IllegalArgumentException {

        if ((dimensions == null) || (! dimensions.hasSpatialValues())) {
            throw new IllegalArgumentException(
                    "valid x, y and z dimension values are required to map surface depths to physical units");
        }

        final DimensionSet dimensions_mm = dimensions.toSpatialUnits(LengthUnit.MM);
        final DimensionAxis x = dimensions_mm.getX();
        final DimensionAxis y = dimensions_mm.getY();
        final DimensionAxis z = dimensions_mm.getZ();

        final int depthCount = volume.getDepthCount();
        final int xCount = volume.getXCount();
        final int yCount = volume.getYCount();
        if ((z.size() != depthCount) || (x.size() != xCount) || (y.size() != yCount)) {
            throw new IllegalArgumentException("volume " + volume + " does not match dimensions (" + z.size() +
                                               ", " + x.size() + ", " + y.size() + ")");
        }

        final int startDepth = Math.min(SurfaceEstimatorParameters.getStartDepth(depthCount), depthCount - 1);
        final List<TileSpan> tiles = buildTileSpans(xCount, x.size() >= 2 ? Math.abs(x.getSpacing()) : null);

        LOG.info("estimate: entry, volume={}, startDepth={}, tileCount={}, parameters={}",
                 volume, startDepth, tiles.size(), parameters);

        final double[][] surfaceIndex = new double[yCount][xCount];
        final boolean[][] found = new boolean[yCount][xCount];
        final double[] column = new double[depthCount];

        for (int yIndex = 0; yIndex < yCount; yIndex++) {
            for (final TileSpan tile : tiles) {
                final Threshold threshold = computeThreshold(volume, yIndex, tile, startDepth);
                for (int xIndex = tile.start; xIndex <= tile.end; xIndex++) {
                    for (int zIndex = 0; zIndex < depthCount; zIndex++) {
                        column[zIndex] = volume.isDefined(zIndex, xIndex, yIndex) ?
                                         volume.getRawValue(zIndex, xIndex, yIndex) : Double.NaN;
                    }
                    final int detected = detectSurface(column, startDepth, threshold);
                    if (detected >= 0) {
                        surfaceIndex[yIndex][xIndex] = detected;
                        found[yIndex][xIndex] = true;
                    }
                }
            }
        }

        final Double[][] smoothedIndex = smooth(surfaceIndex, found, SurfaceEstimatorParameters.SMOOTHING_SIGMA);

        final Double[][] surfacePosition_mm = new Double[yCount][xCount];
        for (int yIndex = 0; yIndex < yCount; yIndex++) {
            for (int xIndex = 0; xIndex < xCount; xIndex++) {
                final Double value = smoothedIndex[yIndex][xIndex];
                if (value != null) {
                    final long zIndex = Math.round(value);
                    if ((zIndex >= 0) && (zIndex < depthCount)) {
                        surfacePosition_mm[yIndex][xIndex] = z.getValue((int) zIndex);
                    }
                }
            }
        }

        final SurfaceMap surfaceMap = new SurfaceMap(surfacePosition_mm, x.getValues(), y.getValues());

        LOG.info("estimate: exit, mean surface position is {} mm", surfaceMap.getMeanPosition());

        return surfaceMap;
    }

    /**
     * Splits the x range into tiles that are {@code round(FOV / pixelSize)} columns wide.
     * A trailing partial tile at least half a tile wide becomes its own tile,
     * a narrower remainder is merged into the last full tile.
     */
    List<TileSpan> buildTileSpans(final int xCount,
                                  final Double pixelSize_mm) {

        final Double fov = parameters.getOctProbeFOV_mm();
        final List<TileSpan> tiles = new ArrayList<>();

        if ((fov == null) || (pixelSize_mm == null) || (! (pixelSize_mm > 0))) {
            LOG.info("buildTileSpans: octProbeFOV_mm or pixel size is unknown, treating the full x range as one tile");
            tiles.add(new TileSpan(0, xCount - 1, xCount));
            return tiles;
        }

        final int tileWidth = Math.max(1, (int) Math.round(fov / pixelSize_mm));
        final int fullTileCount = Math.max(1, xCount / tileWidth);
        for (int i = 0; i < fullTileCount; i++) {
            final int start = i * tileWidth;
            tiles.add(new TileSpan(start, Math.min(start + tileWidth - 1, xCount - 1), tileWidth));
        }

        final int remainderStart = fullTileCount * tileWidth;
        final int remainder = xCount - remainderStart;
        if (remainder > 0) {
            if (2 * remainder >= tileWidth) {
                tiles.add(new TileSpan(remainderStart, xCount - 1, tileWidth));
            } else {
                final TileSpan last = tiles.remove(tiles.size() - 1);
                tiles.add(new TileSpan(last.start, xCount - 1, tileWidth));
            }
        }

        return tiles;
    }

    Threshold computeThreshold(final ReconstructedVolume volume,
                               final int yIndex,
                               final TileSpan tile,
                               final int startDepth) {

        final double[] roi = extractFilteredRoi(volume, yIndex, tile, startDepth);

        final Threshold threshold;
        if (roi.length == 0) {
            LOG.warn("computeThreshold: region of interest for y {} columns {} is empty, " +
                     "surface identification may be inaccurate", yIndex, tile);
            threshold = new Threshold(SurfaceEstimatorParameters.EMPTY_ROI_THRESHOLD,
                                      SurfaceEstimatorParameters.EMPTY_ROI_OFFSET);
        } else {
            double min = Double.MAX_VALUE;
            double max = -Double.MAX_VALUE;
            for (final double value : roi) {
                min = Math.min(min, value);
                max = Math.max(max, value);
            }
            final double range = max - min;
            if (range > Math.ulp(1.0)) {
                final double[] normalized = new double[roi.length];
                for (int i = 0; i < roi.length; i++) {
                    normalized[i] = (roi[i] - min) / range;
                }
                final double level = OtsuThreshold.level(normalized);
                final double offset = Math.max(SurfaceEstimatorParameters.MIN_OFFSET,
                                               Math.min(SurfaceEstimatorParameters.MAX_OFFSET,
                                                        SurfaceEstimatorParameters.OFFSET_RANGE_FRACTION * range));
                threshold = new Threshold(level * range + min, offset);
            } else {
                LOG.warn("computeThreshold: region of interest for y {} columns {} is nearly constant, " +
                         "threshold set to {}, surface identification may be inaccurate", yIndex, tile, min);
                threshold = new Threshold(min, min);
            }
        }

        final Double constantThreshold = parameters.getConstantThreshold();
        if (constantThreshold != null) {
            return new Threshold(constantThreshold, threshold.offset);
        }
        return threshold;
    }

    private double[] extractFilteredRoi(final ReconstructedVolume volume,
                                        final int yIndex,
                                        final TileSpan tile,
                                        final int startDepth) {

        final int xCount = volume.getXCount();
        final int center = (tile.start + tile.end) / 2;
        final int halfWidth = Math.max(SurfaceEstimatorParameters.MIN_ROI_HALF_WIDTH,
                                       (int) Math.floor(SurfaceEstimatorParameters.ROI_HALF_WIDTH_FRACTION *
                                                        tile.nominalWidth));
        final int left = Math.max(0, center - halfWidth);
        final int right = Math.min(xCount - 1, center + halfWidth);

        final int width = right - left + 1;
        final int height = volume.getDepthCount() - startDepth;
        final float[] pixels = new float[width * height];
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                final int zIndex = startDepth + row;
                final int xIndex = left + col;
                pixels[col + width * row] = volume.isDefined(zIndex, xIndex, yIndex) ?
                                            volume.getRawValue(zIndex, xIndex, yIndex) : Float.NaN;
            }
        }

        final FloatProcessor roi = new FloatProcessor(width, height, pixels);
        new RankFilters().rank(roi, SurfaceEstimatorParameters.ROI_MEDIAN_RADIUS, RankFilters.MEDIAN);
        new GaussianBlur().blurFloat(roi,
                                     SurfaceEstimatorParameters.ROI_BLUR_SIGMA,
                                     SurfaceEstimatorParameters.ROI_BLUR_SIGMA,
                                     0.01);

        final float[] filtered = (float[]) roi.getPixels();
        int finiteCount = 0;
        for (final float value : filtered) {
            if (Float.isFinite(value)) {
                finiteCount++;
            }
        }
        final double[] values = new double[finiteCount];
        int i = 0;
        for (final float value : filtered) {
            if (Float.isFinite(value)) {
                values[i++] = value;
            }
        }
        return values;
    }

    /**
     * @param  column  values for one (x, y) position with NaN for undefined samples.
     *
     * @return zero based surface depth index or -1 if no surface was confirmed.
     */
    static int detectSurface(final double[] column,
                             final int startDepth,
                             final Threshold threshold) {

        final int lastIndex = column.length - 1;
        final double confirmLevel = threshold.threshold - threshold.offset;
        final int minConfirmations = SurfaceEstimatorParameters.BASE_CONFIRMATIONS_REQUIRED -
                                     SurfaceEstimatorParameters.ADJUSTABLE_DECREASE;

        for (int confirmations = SurfaceEstimatorParameters.BASE_CONFIRMATIONS_REQUIRED;
             confirmations >= minConfirmations;
             confirmations--) {

            for (int z = startDepth; z + confirmations <= lastIndex; z++) {
                if (column[z] >= threshold.threshold) {
                    boolean confirmed = true;
                    for (int i = z + 1; i <= z + confirmations; i++) {
                        if (! (column[i] > confirmLevel)) {
                            confirmed = false;
                            break;
                        }
                    }
                    if (confirmed) {
                        return z;
                    }
                }
            }
        }

        return -1;
    }

    /**
     * Smooths defined values with a normalized Gaussian kernel of size {@code ceil(3σ) * 2 + 1},
     * dividing by the kernel weight that fell on defined values.
     *
     * @return smoothed values, null where no defined value is within the kernel.
     */
    static Double[][] smooth(final double[][] values,
                             final boolean[][] defined,
                             final double sigma) {

        final int radius = (int) Math.ceil(sigma * 3);
        final int size = 2 * radius + 1;
        final double[][] kernel = new double[size][size];
        double kernelSum = 0;
        for (int i = 0; i < size; i++) {
            for (int j = 0; j < size; j++) {
                final int di = i - radius;
                final int dj = j - radius;
                kernel[i][j] = Math.exp(-(di * di + dj * dj) / (2.0 * sigma * sigma));
                kernelSum += kernel[i][j];
            }
        }

        final int rows = values.length;
        final int cols = rows == 0 ? 0 : values[0].length;
        final Double[][] smoothed = new Double[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                double weightedSum = 0;
                double weight = 0;
                for (int i = 0; i < size; i++) {
                    final int rr = r + i - radius;
                    if ((rr < 0) || (rr >= rows)) {
                        continue;
                    }
                    for (int j = 0; j < size; j++) {
                        final int cc = c + j - radius;
                        if ((cc >= 0) && (cc < cols) && defined[rr][cc]) {
                            final double k = kernel[i][j] / kernelSum;
                            weightedSum += k * values[rr][cc];
                            weight += k;
                        }
                    }
                }
                if (weight > 0) {
                    smoothed[r][c] = weightedSum / weight;
                }
            }
        }
        return smoothed;
    }

    /** Inclusive column span of one lateral tile. */
    static class TileSpan {

        final int start;
        final int end;
        final int nominalWidth;

        TileSpan(final int start,
                 final int end,
                 final int nominalWidth) {
            this.start = start;
            this.end = end;
            this.nominalWidth = nominalWidth;
        }

        @Override
        public String toString() {
            return "[" + start + ", " + end + "]";
        }
    }

    static class Threshold {

        final double threshold;
        final double offset;

        Threshold(final double threshold,
                  final double offset) {
            this.threshold = threshold;
            this.offset = offset;
        }

        @Override
        public String toString() {
            return "{threshold: " + threshold + ", offset: " + offset + "}";
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(SurfaceEstimator.class);
}
