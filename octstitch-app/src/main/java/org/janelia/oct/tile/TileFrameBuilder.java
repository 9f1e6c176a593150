package org.janelia.oct.tile;

import org.janelia.oct.ConfigurationException;
import org.janelia.oct.dimension.DimensionAxis;
import org.janelia.oct.dimension.DimensionSet;
import org.janelia.oct.dimension.LengthUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives the dimensions of a single tile and of the global output lattice for a tiled scan.
 *
 * @author Eric Trautman
 */
public class TileFrameBuilder {

    public static final String TILE_X_ORIGIN = "x=0 is under objective's principal";
    public static final String TILE_Y_ORIGIN = "y=0 is under objective's principal";
    public static final String TILE_Z_ORIGIN = "z=0 is focus position";
    public static final String OUTPUT_X_ORIGIN = "x=0 is scanner origin when the xCenters=0 scan was taken";
    public static final String OUTPUT_Y_ORIGIN = "y=0 is scanner origin when the yCenters=0 scan was taken";
    public static final String OUTPUT_Z_ORIGIN = "z=0 is tissue interface";

    /** Maximum distance (mm) between the crop start and the closest lattice depth. */
    public static final double MAX_CROP_FALLBACK_DISTANCE_MM = 1.0e-3;

    private static final double CROP_TOLERANCE_MM = 1.0e-10;

    private final ScanConfiguration configuration;
    private final LatticeParameters latticeParameters;

    public TileFrameBuilder(final ScanConfiguration configuration,
                            final LatticeParameters latticeParameters) {
        this.configuration = configuration;
        this.latticeParameters = latticeParameters;
    }

    /**
     * @param  probeDimensions  dimensions of one raw tile with lambda and z (depth) axes,
     *                          typically from {@link org.janelia.oct.spectral.SpectralTransform#computeDepthDimensions}.
     *
     * @return tile and output dimensions in mm.
     *
     * @throws ConfigurationException
     *   if the scan cannot be placed on a consistent lattice.
     */
    public TileFrames build(final DimensionSet probeDimensions)
            throws ConfigurationException {

        LOG.info("build: entry, latticeParameters={}", latticeParameters);

        final ScanGrid scanGrid = new ScanGrid(configuration);
        latticeParameters.validate(scanGrid.getDepthCount());

        if ((probeDimensions.getZ() == null) || (probeDimensions.getZ().size() < 2)) {
            throw new ConfigurationException("probe dimensions must include a z axis with at least 2 values");
        }

        final boolean hasFocus = latticeParameters.hasFocusPosition();
        boolean crop = latticeParameters.isCropZAroundFocusArea();
        if (crop && (! hasFocus)) {
            LOG.warn("build: no focus position was set so cropZAroundFocusArea is changed to false");
            crop = false;
        }

        final DimensionSet oneTile = buildOneTileDimensions(probeDimensions.toSpatialUnits(LengthUnit.MM), hasFocus);
        final DimensionAxis tileX = oneTile.getX();
        final DimensionAxis tileY = oneTile.getY();
        final DimensionAxis tileZ = oneTile.getZ();

        final double dx = tileX.getSpacing();
        final double dy = tileY.getSpacing();
        final double dz = tileZ.getSpacing();

        final double[] xCenters = scanGrid.getXCenters_mm();
        final double[] yCenters = scanGrid.getYCenters_mm();

        DimensionAxis outputX;
        if (xCenters.length == 1) {
            outputX = tileX.withOffset(xCenters[0]);
        } else {
            outputX = new DimensionAxis(DimensionAxis.range(min(xCenters) + tileX.getFirst(),
                                                            dx,
                                                            max(xCenters) + tileX.getLast() + dx / 2),
                                        LengthUnit.MM, null);
        }
        outputX = outputX.withOrigin(OUTPUT_X_ORIGIN);

        DimensionAxis outputY;
        if (yCenters.length == 1) {
            outputY = tileY.withOffset(yCenters[0]);
        } else {
            outputY = new DimensionAxis(DimensionAxis.range(min(yCenters) + tileY.getFirst(),
                                                            dy,
                                                            max(yCenters) + tileY.getLast() + dy / 2),
                                        LengthUnit.MM, null);
        }
        outputY = outputY.withOrigin(OUTPUT_Y_ORIGIN);

        double[] outputZ = DimensionAxis.range(scanGrid.getMinDepth() + tileZ.getFirst(),
                                               dz,
                                               scanGrid.getMaxDepth() + tileZ.getLast() + dz / 2);
        outputZ = anchorAtZero(outputZ, dz);

        final Double pixelSize_um = latticeParameters.getOutputFilePixelSize_um();
        if (pixelSize_um != null) {
            checkIsotropicPixels(outputX, outputY, pixelSize_um);
            final double step = pixelSize_um * 1.0e-3;
            outputZ = anchorAtZero(DimensionAxis.range(outputZ[0], step, max(outputZ)), step);
        }

        if (crop) {
            outputZ = cropAroundFocus(outputZ, scanGrid, tileZ);
        }

        final DimensionSet output = new DimensionSet(oneTile.getLambda(),
                                                     outputX,
                                                     outputY,
                                                     new DimensionAxis(outputZ, LengthUnit.MM, OUTPUT_Z_ORIGIN),
                                                     oneTile.getAux());

        LOG.info("build: exit, output lattice x={}, y={}, z={}", output.getX(), output.getY(), output.getZ());

        return new TileFrames(oneTile, output);
    }

    private DimensionSet buildOneTileDimensions(final DimensionSet probe_mm,
                                                final boolean hasFocus)
            throws ConfigurationException {

        final DimensionAxis x = buildTileLateralAxis(configuration.getXOffset(),
                                                     configuration.getTileRangeX_mm(),
                                                     configuration.getNXPixels(),
                                                     TILE_X_ORIGIN);
        final DimensionAxis y = buildTileLateralAxis(configuration.getYOffset(),
                                                     configuration.getTileRangeY_mm(),
                                                     configuration.getNYPixels(),
                                                     TILE_Y_ORIGIN);

        DimensionAxis z = probe_mm.getZ();
        if (hasFocus) {
            final int depthCount = configuration.getZDepths().length;
            final double focus = latticeParameters.getFocusPosition(0);
            for (int i = 1; i < depthCount; i++) {
                if (latticeParameters.getFocusPosition(i) != focus) {
                    throw new ConfigurationException(
                            "different focus positions for different depths are not supported, " +
                            "use the same focusPositionInImageZpix for all depths");
                }
            }
            final int focusIndex = getFocusIndex(focus, z);
            z = z.withOffset(-z.getValue(focusIndex)).withOrigin(TILE_Z_ORIGIN);
        }

        return new DimensionSet(probe_mm.getLambda(), x, y, z, probe_mm.getAux());
    }

    /**
     * @return {@code offset + range * linspace(-0.5, 0.5, n + 1)} without the last sample.
     */
    static DimensionAxis buildTileLateralAxis(final double offset,
                                              final double range,
                                              final int n,
                                              final String origin) {
        final double[] edges = DimensionAxis.linspace(-0.5, 0.5, n + 1);
        final double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = offset + range * edges[i];
        }
        return new DimensionAxis(values, LengthUnit.MM, origin);
    }

    static void checkIsotropicPixels(final DimensionAxis x,
                                     final DimensionAxis y,
                                     final double requestedPixelSize_um)
            throws ConfigurationException {

        final double pixelSizeX_um = roundPixelSize(x.getMeanSpacing());
        double pixelSizeY_um = pixelSizeX_um;
        if (y.size() >= 2) {
            pixelSizeY_um = roundPixelSize(y.getMeanSpacing());
            if (! sameSize(pixelSizeX_um, pixelSizeY_um)) {
                throw new ConfigurationException("x pixel size " + pixelSizeX_um + " um should match y pixel size " +
                                                 pixelSizeY_um + " um");
            }
        }
        if (! (sameSize(requestedPixelSize_um, pixelSizeX_um) && sameSize(requestedPixelSize_um, pixelSizeY_um))) {
            throw new ConfigurationException(
                    "scanned pixel size " + pixelSizeX_um + " um differs from outputFilePixelSize_um " +
                    requestedPixelSize_um + " um, specify an outputFilePixelSize_um that matches the scan");
        }
    }

    /**
     * @return mean spacing (mm) converted to microns and rounded to 0.01 um.
     */
    static double roundPixelSize(final double spacing_mm) {
        return Math.round(spacing_mm * 1.0e3 * 100) / 100.0;
    }

    /**
     * Shifts the values so that the sample closest to 0 is exactly 0.
     */
    static double[] anchorAtZero(final double[] values,
                                 final double step) {
        int zeroIndex = 0;
        for (int i = 1; i < values.length; i++) {
            if (Math.abs(values[i]) < Math.abs(values[zeroIndex])) {
                zeroIndex = i;
            }
        }
        final double[] anchored = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            anchored[i] = step * (i - zeroIndex);
        }
        return anchored;
    }

    private double[] cropAroundFocus(final double[] outputZ,
                                     final ScanGrid scanGrid,
                                     final DimensionAxis tileZ)
            throws ConfigurationException {

        final int depthCount = scanGrid.getDepthCount();
        final int firstFocusIndex = getFocusIndex(latticeParameters.getFocusPosition(0), tileZ);
        final int lastFocusIndex = getFocusIndex(latticeParameters.getFocusPosition(depthCount - 1), tileZ);

        final double lower = scanGrid.getMinDepth() + tileZ.getValue(firstFocusIndex);
        final double upper = scanGrid.getMaxDepth() + tileZ.getValue(lastFocusIndex);

        int keepCount = 0;
        for (final double z : outputZ) {
            if ((z >= lower - CROP_TOLERANCE_MM) && (z <= upper + CROP_TOLERANCE_MM)) {
                keepCount++;
            }
        }

        final double[] cropped;
        if (keepCount > 0) {
            cropped = new double[keepCount];
            int i = 0;
            for (final double z : outputZ) {
                if ((z >= lower - CROP_TOLERANCE_MM) && (z <= upper + CROP_TOLERANCE_MM)) {
                    cropped[i++] = z;
                }
            }
        } else {
            int closestIndex = 0;
            for (int i = 1; i < outputZ.length; i++) {
                if (Math.abs(outputZ[i] - lower) < Math.abs(outputZ[closestIndex] - lower)) {
                    closestIndex = i;
                }
            }
            final double distance = Math.abs(outputZ[closestIndex] - lower);
            if (! (distance < MAX_CROP_FALLBACK_DISTANCE_MM)) {
                throw new ConfigurationException("closest lattice depth " + outputZ[closestIndex] +
                                                 " mm is " + distance + " mm away from crop start " + lower +
                                                 " mm, too far");
            }
            cropped = new double[] { outputZ[closestIndex] };
        }

        LOG.info("cropAroundFocus: kept {} of {} depths between {} and {} mm",
                 cropped.length, outputZ.length, lower, upper);

        return cropped;
    }

    private static int getFocusIndex(final double focusPosition,
                                     final DimensionAxis z)
            throws ConfigurationException {
        final int focusIndex = (int) Math.round(focusPosition);
        if ((focusIndex < 0) || (focusIndex >= z.size())) {
            throw new ConfigurationException("focus position " + focusPosition + " is outside the " + z.size() +
                                             " pixel depth range of a tile");
        }
        return focusIndex;
    }

    private static boolean sameSize(final double a,
                                    final double b) {
        return Math.abs(a - b) < 1.0e-9;
    }

    private static double min(final double[] values) {
        double min = Double.MAX_VALUE;
        for (final double value : values) {
            min = Math.min(min, value);
        }
        return min;
    }

    private static double max(final double[] values) {
        double max = -Double.MAX_VALUE;
        for (final double value : values) {
            max = Math.max(max, value);
        }
        return max;
    }

    private static final Logger LOG = LoggerFactory.getLogger(TileFrameBuilder.class);
}
