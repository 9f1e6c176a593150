package org.janelia.oct.stitch;

import java.io.IOException;
import java.util.BitSet;
import java.util.List;

import net.imglib2.RandomAccessible;
import net.imglib2.RealRandomAccess;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.interpolation.randomaccess.NLinearInterpolatorFactory;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;

import org.janelia.oct.dimension.DimensionAxis;
import org.janelia.oct.dimension.DimensionSet;
import org.janelia.oct.dimension.LengthUnit;
import org.janelia.oct.spectral.ComplexDepthProfile;
import org.janelia.oct.spectral.RawFrame;
import org.janelia.oct.tile.LoadedFrame;
import org.janelia.oct.tile.Tile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds one output y row by transforming every contributing tile frame, weighting it by
 * distance from focus, and resampling it onto the output (z, x) lattice.
 *
 * Each call to {@link #processRow} owns its accumulation buffers, so one instance can serve
 * many concurrent row workers.
 *
 * @author Eric Trautman
 */
public class StitchAccumulator {

    /** Tolerance (mm) added to tile edges so that lattice points on an edge are not lost to rounding. */
    public static final double EDGE_TOLERANCE = 1.0e-10;

    private final StitchContext context;
    private final DimensionAxis outputX;
    private final DimensionAxis outputY;
    private final DimensionAxis outputZ;
    private final DimensionSet tileDimensions;

    public StitchAccumulator(final StitchContext context) {
        this.context = context;
        final DimensionSet output = context.getOutputDimensions().toSpatialUnits(LengthUnit.MM);
        this.outputX = output.getX();
        this.outputY = output.getY();
        this.outputZ = output.getZ();
        this.tileDimensions = context.getTileFrames().getOneTileDimensions().toSpatialUnits(LengthUnit.MM);
    }

    /**
     * @param  yIndex  zero based output row index.
     *
     * @return stitched row with undefined pixels where too little weight was accumulated.
     *
     * @throws IOException
     *   if a debug plane cannot be saved.
     */
    public RowData processRow(final int yIndex)
            throws IOException {

        final int depthCount = outputZ.size();
        final int xCount = outputX.size();
        final double[] weightedSum = new double[depthCount * xCount];
        final double[] weightTotal = new double[depthCount * xCount];

        final YPlaneWriter yPlaneWriter = context.getYPlaneWriter();
        final boolean saveYPlane = (yPlaneWriter != null) && yPlaneWriter.isSelected(yIndex);

        final double yOut = outputY.getValue(yIndex);
        final double[] yCenters = context.getScanGrid().getYCenters_mm();
        int contributingCount = 0;

        for (int yCenterIndex = 0; yCenterIndex < yCenters.length; yCenterIndex++) {
            final int yIndexInTile = findIndexInTile(yOut - yCenters[yCenterIndex]);
            if (yIndexInTile < 0) {
                continue;
            }
            final List<Tile> tiles = context.getScanGrid().getTilesForYIndex(yCenterIndex);
            for (final Tile tile : tiles) {
                if (accumulateTile(tile, yIndex, yIndexInTile, weightedSum, weightTotal, saveYPlane)) {
                    contributingCount++;
                }
            }
        }

        if (saveYPlane) {
            yPlaneWriter.saveTotalWeights(yIndex, weightTotal, depthCount, xCount);
        }

        LOG.debug("processRow: row {} accumulated {} tile frames", yIndex, contributingCount);

        return buildRow(weightedSum, weightTotal, depthCount, xCount, context.getStitchParameters().getOutputScale());
    }

    /**
     * @return index of the tile local y sample within half a pixel of the specified local y, or -1.
     */
    int findIndexInTile(final double localY) {
        final DimensionAxis tileY = tileDimensions.getY();
        final int nearestIndex = tileY.getNearestIndex(localY);
        final double halfPixel = Math.abs(tileY.getSpacing()) / 2.0;
        if (Math.abs(tileY.getValue(nearestIndex) - localY) <= halfPixel + EDGE_TOLERANCE) {
            return nearestIndex;
        }
        return -1;
    }

    private boolean accumulateTile(final Tile tile,
                                   final int yIndex,
                                   final int yIndexInTile,
                                   final double[] weightedSum,
                                   final double[] weightTotal,
                                   final boolean saveYPlane)
            throws IOException {

        final LoadedFrame loadedFrame = context.getFrameLoader().load(tile, tileDimensions, yIndexInTile);
        if (! loadedFrame.isValid()) {
            LOG.warn("accumulateTile: skipping invalid frame for {} at tile y index {} (output row {})",
                     tile, yIndexInTile, yIndex);
            return false;
        }

        final RawFrame frame = loadedFrame.getFrame();
        final DimensionSet frameDimensions = loadedFrame.getDimensions() == null ?
                                             tileDimensions : loadedFrame.getDimensions();

        final ComplexDepthProfile profile = context.getSpectralTransform().transform(frame, frameDimensions);
        double[] amplitude = profile.getMeanAmplitude(frame.getXCount());

        final DimensionAxis tileX = tileDimensions.getX();
        final DimensionAxis tileZ = tileDimensions.getZ();
        final int tileDepthCount = tileZ.size();
        final int tileXCount = tileX.size();
        if ((profile.getDepthCount() != tileDepthCount) || (frame.getXCount() != tileXCount)) {
            throw new IllegalArgumentException("transformed frame for " + tile + " has shape (" +
                                               profile.getDepthCount() + ", " + frame.getXCount() +
                                               ") but tile lattice is (" + tileDepthCount + ", " + tileXCount + ")");
        }

        BitSet validMask = null;
        final OpticalPathCorrector pathCorrector = context.getPathCorrector();
        if (pathCorrector != null) {
            final OpticalPathCorrection correction = pathCorrector.correct(amplitude,
                                                                                tileDimensions,
                                                                                context.getScanConfiguration());
            amplitude = correction.getAmplitude();
            validMask = correction.getValidMask();
        }

        final Double focus = context.getLatticeParameters().getFocusPosition(tile.getZIndex());
        final double[] depthWeights = FocusWeightFunction.weights(tileDepthCount,
                                                                  focus,
                                                                  context.getStitchParameters().getFocusSigma());

        final double[] weightedValues = new double[amplitude.length];
        final double[] weights = new double[amplitude.length];
        for (int x = 0; x < tileXCount; x++) {
            for (int z = 0; z < tileDepthCount; z++) {
                final int i = z + tileDepthCount * x;
                final boolean usable = Double.isFinite(amplitude[i]) && ((validMask == null) || validMask.get(i));
                if (usable) {
                    weights[i] = depthWeights[z];
                    weightedValues[i] = amplitude[i] * depthWeights[z];
                }
            }
        }

        resampleOntoOutput(weightedValues, weights, tileDepthCount, tileXCount,
                           tileX.withOffset(tile.getXCenter_mm()),
                           tileZ.withOffset(tile.getZDepth_mm()),
                           weightedSum, weightTotal);

        if (saveYPlane) {
            context.getYPlaneWriter().saveTileFrame(yIndex, tile, amplitude, tileDepthCount, tileXCount,
                                                    focus == null ? null : (int) Math.round(focus));
        }

        return true;
    }

    /**
     * Bilinearly resamples tile values onto the output lattice, adding them to the accumulation buffers.
     * Output points outside the tile (beyond {@link #EDGE_TOLERANCE}) receive nothing.
     */
    private void resampleOntoOutput(final double[] weightedValues,
                                    final double[] weights,
                                    final int tileDepthCount,
                                    final int tileXCount,
                                    final DimensionAxis stageX,
                                    final DimensionAxis stageZ,
                                    final double[] weightedSum,
                                    final double[] weightTotal) {

        final double[] xPositions = toTilePositions(outputX, stageX);
        final double[] zPositions = toTilePositions(outputZ, stageZ);

        final ArrayImg<DoubleType, DoubleArray> valueImg = ArrayImgs.doubles(weightedValues, tileDepthCount, tileXCount);
        final ArrayImg<DoubleType, DoubleArray> weightImg = ArrayImgs.doubles(weights, tileDepthCount, tileXCount);
        final RandomAccessible<DoubleType> extendedValues = Views.extendBorder(valueImg);
        final RandomAccessible<DoubleType> extendedWeights = Views.extendBorder(weightImg);
        final RealRandomAccess<DoubleType> valueAccess =
                Views.interpolate(extendedValues, new NLinearInterpolatorFactory<DoubleType>()).realRandomAccess();
        final RealRandomAccess<DoubleType> weightAccess =
                Views.interpolate(extendedWeights, new NLinearInterpolatorFactory<DoubleType>()).realRandomAccess();

        final int outputDepthCount = zPositions.length;
        for (int x = 0; x < xPositions.length; x++) {
            if (xPositions[x] < 0) {
                continue;
            }
            valueAccess.setPosition(xPositions[x], 1);
            weightAccess.setPosition(xPositions[x], 1);
            for (int z = 0; z < outputDepthCount; z++) {
                if (zPositions[z] < 0) {
                    continue;
                }
                valueAccess.setPosition(zPositions[z], 0);
                weightAccess.setPosition(zPositions[z], 0);
                final int i = z + outputDepthCount * x;
                weightedSum[i] += valueAccess.get().getRealDouble();
                weightTotal[i] += weightAccess.get().getRealDouble();
            }
        }
    }

    /**
     * Maps each output coordinate to a fractional index of the (uniform) tile axis.
     *
     * @return fractional indexes with -1 marking coordinates outside the tile.
     */
    static double[] toTilePositions(final DimensionAxis outputAxis,
                                    final DimensionAxis tileAxis) {
        final double first = tileAxis.getFirst();
        final double last = tileAxis.getLast();
        final double low = Math.min(first, last) - EDGE_TOLERANCE;
        final double high = Math.max(first, last) + EDGE_TOLERANCE;
        final int lastIndex = tileAxis.size() - 1;
        final double step = lastIndex == 0 ? 0 : (last - first) / lastIndex;

        final double[] positions = new double[outputAxis.size()];
        for (int i = 0; i < positions.length; i++) {
            final double value = outputAxis.getValue(i);
            if ((value < low) || (value > high)) {
                positions[i] = -1;
            } else if (step == 0) {
                positions[i] = 0;
            } else {
                positions[i] = Math.max(0, Math.min(lastIndex, (value - first) / step));
            }
        }
        return positions;
    }

    static RowData buildRow(final double[] weightedSum,
                            final double[] weightTotal,
                            final int depthCount,
                            final int xCount,
                            final OutputScale outputScale) {
        final float[] values = new float[weightedSum.length];
        final BitSet defined = new BitSet(weightedSum.length);
        for (int i = 0; i < weightedSum.length; i++) {
            if (weightTotal[i] >= FocusWeightFunction.MIN_TOTAL_WEIGHT) {
                final double value = outputScale.apply(weightedSum[i] / weightTotal[i]);
                if (Double.isFinite(value)) {
                    values[i] = (float) value;
                    defined.set(i);
                }
            }
        }
        return new RowData(depthCount, xCount, values, defined);
    }

    private static final Logger LOG = LoggerFactory.getLogger(StitchAccumulator.class);
}
