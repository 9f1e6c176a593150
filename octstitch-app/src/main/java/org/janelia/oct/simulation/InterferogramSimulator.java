package org.janelia.oct.simulation;

import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.janelia.oct.dimension.DimensionAxis;
import org.janelia.oct.dimension.DimensionSet;
import org.janelia.oct.dimension.LengthUnit;
import org.janelia.oct.dimension.ScanGeometry;
import org.janelia.oct.spectral.DepthAxis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates interferograms that reconstruct to a given (z, x, y) reflectance volume.
 *
 * @author Eric Trautman
 */
public class InterferogramSimulator {

    private final SimulationOptions options;

    public InterferogramSimulator(final SimulationOptions options)
            throws IllegalArgumentException {
        options.validate();
        this.options = options;
    }

    /**
     * Projects the sample onto the scanner's depth axis (shifted by the reference arm offset,
     * zero outside the sample), applies focus attenuation and simulates the interferogram.
     *
     * @param  data        sample reflectance stored z fastest, then x, then y.
     * @param  depthCount  number of sample z pixels.
     * @param  xCount      number of sample x pixels.
     * @param  yCount      number of sample y pixels.
     */
    public SimulatedInterferogram simulate(final double[] data,
                                           final int depthCount,
                                           final int xCount,
                                           final int yCount)
            throws IllegalArgumentException {

        validateShape(data, depthCount, xCount, yCount);

        final int bandCount = options.getNumberOfSpectralBands();
        final double[] lambdaRange = options.getLambdaRange_nm();
        final DimensionAxis scannerZ = DepthAxis.compute(lambdaRange[0],
                                                         lambdaRange[1],
                                                         bandCount,
                                                         bandCount,
                                                         options.getRefractiveIndex());
        final int scannerDepthCount = scannerZ.size();
        final double pixelSize = options.getPixelSize_um();
        final double zOffset = options.getReferenceArmZOffset_um();
        final Double focus = options.getFocusPositionInImageZpix();

        LOG.info("simulate: entry, sample=({}, {}, {}), scannerDepthCount={}, options={}",
                 depthCount, xCount, yCount, scannerDepthCount, options);

        final double[] focusFactor = new double[scannerDepthCount];
        for (int z = 0; z < scannerDepthCount; z++) {
            if (focus == null) {
                focusFactor[z] = 1.0;
            } else {
                final double distance = z - focus;
                final double twoSigma = 2 * options.getFocusSigma();
                focusFactor[z] = Math.exp(-(distance * distance) / (twoSigma * twoSigma));
            }
        }

        final double[] projected = new double[scannerDepthCount * xCount * yCount];
        for (int column = 0; column < xCount * yCount; column++) {
            final int sourceOffset = depthCount * column;
            final int targetOffset = scannerDepthCount * column;
            for (int z = 0; z < scannerDepthCount; z++) {
                // sample pixel position of this scanner depth
                final double position = (scannerZ.getValue(z) + zOffset) / pixelSize;
                projected[targetOffset + z] =
                        interpolate(data, sourceOffset, depthCount, position) * focusFactor[z];
            }
        }

        return simulateCore(projected, scannerDepthCount, xCount, yCount, pixelSize, lambdaRange);
    }

    /**
     * Simulates the interferogram of data whose depth axis is assumed to match k-space.
     * The data is zero padded to twice its depth, so the interferogram has {@code 2 * depthCount}
     * spectral samples equispaced in k with wavelengths in descending order.
     *
     * @param  data             values stored z fastest, then x, then y.
     * @param  pixelSizeXY_um   lateral pixel size in microns.
     * @param  lambdaRange_nm   wavelength range [min, max] in nm.
     */
    public static SimulatedInterferogram simulateCore(final double[] data,
                                                      final int depthCount,
                                                      final int xCount,
                                                      final int yCount,
                                                      final double pixelSizeXY_um,
                                                      final double[] lambdaRange_nm)
            throws IllegalArgumentException {

        validateShape(data, depthCount, xCount, yCount);

        final int lambdaCount = 2 * depthCount;
        final double kMax = 2 * Math.PI / Math.min(lambdaRange_nm[0], lambdaRange_nm[1]);
        final double kMin = 2 * Math.PI / Math.max(lambdaRange_nm[0], lambdaRange_nm[1]);
        final double[] k = DimensionAxis.linspace(kMin, kMax, lambdaCount);
        final double[] lambda = new double[lambdaCount];
        for (int i = 0; i < lambdaCount; i++) {
            lambda[i] = 2 * Math.PI / k[i];
        }

        final boolean powerOfTwo = Integer.bitCount(lambdaCount) == 1;
        final double[] interferogram = new double[lambdaCount * xCount * yCount];
        final double[][] dataRI = new double[2][lambdaCount];

        for (int column = 0; column < xCount * yCount; column++) {
            final int sourceOffset = depthCount * column;
            final int targetOffset = lambdaCount * column;
            if (powerOfTwo) {
                for (int i = 0; i < lambdaCount; i++) {
                    dataRI[0][i] = i < depthCount ? data[sourceOffset + i] : 0.0;
                    dataRI[1][i] = 0.0;
                }
                FastFourierTransformer.transformInPlace(dataRI, DftNormalization.STANDARD, TransformType.FORWARD);
                for (int i = 0; i < lambdaCount; i++) {
                    interferogram[targetOffset + i] = 2 * dataRI[0][i];
                }
            } else {
                for (int i = 0; i < lambdaCount; i++) {
                    double sum = 0;
                    for (int z = 0; z < depthCount; z++) {
                        sum += data[sourceOffset + z] * Math.cos(2 * Math.PI * ((long) i * z % lambdaCount) /
                                                                 lambdaCount);
                    }
                    interferogram[targetOffset + i] = 2 * sum;
                }
            }
        }

        final DimensionSet dimensions =
                new DimensionSet(new DimensionAxis(lambda, LengthUnit.NM, null),
                                 DimensionAxis.uniform(0.0, pixelSizeXY_um, xCount, LengthUnit.MICRONS, UNKNOWN_ORIGIN),
                                 DimensionAxis.uniform(0.0, pixelSizeXY_um, yCount, LengthUnit.MICRONS, UNKNOWN_ORIGIN),
                                 null,
                                 new ScanGeometry(1, 1, lambdaCount));

        return new SimulatedInterferogram(lambdaCount, xCount, yCount, interferogram, dimensions);
    }

    /**
     * @return linear interpolation of the column at the fractional position or 0 outside the column.
     */
    private static double interpolate(final double[] data,
                                      final int offset,
                                      final int length,
                                      final double position) {
        if ((position < 0) || (position > length - 1)) {
            return 0.0;
        }
        final int lower = (int) Math.floor(position);
        if (lower >= length - 1) {
            return data[offset + length - 1];
        }
        final double fraction = position - lower;
        return data[offset + lower] * (1 - fraction) + data[offset + lower + 1] * fraction;
    }

    private static void validateShape(final double[] data,
                                      final int depthCount,
                                      final int xCount,
                                      final int yCount)
            throws IllegalArgumentException {
        if ((depthCount < 1) || (xCount < 1) || (yCount < 1)) {
            throw new IllegalArgumentException("volume sizes must be positive but are (" + depthCount + ", " +
                                               xCount + ", " + yCount + ")");
        }
        if (data.length != (long) depthCount * xCount * yCount) {
            throw new IllegalArgumentException("volume has " + data.length + " values but (" + depthCount + ", " +
                                               xCount + ", " + yCount + ") is specified");
        }
    }

    private static final String UNKNOWN_ORIGIN = "Unknown";

    private static final Logger LOG = LoggerFactory.getLogger(InterferogramSimulator.class);
}
