package org.janelia.oct.spectral;

import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.janelia.oct.ConfigurationException;
import org.janelia.oct.dimension.DimensionAxis;
import org.janelia.oct.dimension.DimensionSet;
import org.janelia.oct.dimension.LengthUnit;

/**
 * Converts interferograms into complex depth profiles:
 * k-space equispacing, Hann filtering, dispersion phase correction and inverse Fourier transform.
 *
 * Instances are immutable and can be shared across threads.
 *
 * @author Eric Trautman
 */
public class SpectralTransform {

    private final SpectralTransformParameters parameters;
    private final KSpaceResampler resampler;

    /**
     * @throws ConfigurationException
     *   if the parameters are invalid.
     */
    public SpectralTransform(final SpectralTransformParameters parameters)
            throws ConfigurationException {
        parameters.validate();
        this.parameters = parameters;
        this.resampler = new KSpaceResampler(parameters.getInterpolationMethod());
    }

    public SpectralTransformParameters getParameters() {
        return parameters;
    }

    /**
     * @param  frame       interferogram for one y position.
     * @param  dimensions  dimensions of the frame (the lambda axis must match the frame's spectral samples).
     *
     * @return complex depth profile for every A-scan in the frame.
     *
     * @throws IllegalArgumentException
     *   if the frame does not match the dimensions.
     */
    public ComplexDepthProfile transform(final RawFrame frame,
                                         final DimensionSet dimensions)
            throws IllegalArgumentException {

        final DimensionAxis lambdaAxis = getLambdaAxis(dimensions);
        double[] lambda = lambdaAxis.getValues();
        if (lambda.length != frame.getLambdaCount()) {
            throw new IllegalArgumentException("frame has " + frame.getLambdaCount() +
                                               " spectral samples but lambda axis has " + lambda.length);
        }

        RawFrame equispacedFrame = frame;
        if (! KSpaceResampler.isEquispacedInK(lambda)) {
            final double[] equispacedLambda = KSpaceResampler.equispacedLambda(lambda);
            equispacedFrame = resampler.resample(frame, lambda, equispacedLambda);
            lambda = equispacedLambda;
        }

        final double[] window = SpectralWindow.create(lambda, parameters.getBand());

        // combined filter: window * exp(i * dispersionPhase)
        final double[] k = KSpaceResampler.toWavenumbers(lambda);
        double meanK = 0;
        for (final double value : k) {
            meanK += value;
        }
        meanK = meanK / k.length;

        final double dispersion = parameters.getDispersionQuadraticTerm();
        final double[] filterReal = new double[k.length];
        final double[] filterImaginary = new double[k.length];
        for (int i = 0; i < k.length; i++) {
            final double deltaK = k[i] - meanK;
            final double phase = -dispersion * deltaK * deltaK;
            filterReal[i] = window[i] * Math.cos(phase);
            filterImaginary[i] = window[i] * Math.sin(phase);
        }

        final int spectralLength = lambda.length;
        final int paddedLength = DepthAxis.getPaddedLength(spectralLength);
        final int depthCount = paddedLength / 2;
        final double paddingScale = (double) paddedLength / spectralLength;
        final int columnCount = equispacedFrame.getColumnCount();

        final double[] real = new double[depthCount * columnCount];
        final double[] imaginary = new double[depthCount * columnCount];
        final double[][] dataRI = new double[2][paddedLength];

        for (int column = 0; column < columnCount; column++) {

            for (int i = 0; i < spectralLength; i++) {
                final double value = equispacedFrame.getValue(i, column);
                dataRI[0][i] = value * filterReal[i];
                dataRI[1][i] = value * filterImaginary[i];
            }
            for (int i = spectralLength; i < paddedLength; i++) {
                dataRI[0][i] = 0;
                dataRI[1][i] = 0;
            }

            FastFourierTransformer.transformInPlace(dataRI, DftNormalization.STANDARD, TransformType.INVERSE);

            final int offset = depthCount * column;
            for (int z = 0; z < depthCount; z++) {
                real[offset + z] = dataRI[0][z] * paddingScale;
                imaginary[offset + z] = dataRI[1][z] * paddingScale;
            }
        }

        return new ComplexDepthProfile(depthCount, columnCount, real, imaginary);
    }

    /**
     * Derives the depth axis produced by {@link #transform} without transforming any data.
     *
     * @return copy of the specified dimensions with a z axis in microns.
     */
    public DimensionSet computeDepthDimensions(final DimensionSet dimensions) {
        final DimensionAxis lambdaAxis = getLambdaAxis(dimensions);
        final int spectralLength = lambdaAxis.size();
        final DimensionAxis z = DepthAxis.compute(lambdaAxis.getFirst(),
                                                  lambdaAxis.getLast(),
                                                  spectralLength,
                                                  parameters.getRefractiveIndex());
        return dimensions.withZ(z);
    }

    private static DimensionAxis getLambdaAxis(final DimensionSet dimensions)
            throws IllegalArgumentException {
        final DimensionAxis lambdaAxis = dimensions.getLambda();
        if ((lambdaAxis == null) || (lambdaAxis.size() < 2)) {
            throw new IllegalArgumentException("dimensions must include a lambda axis with at least 2 values");
        }
        if (lambdaAxis.getUnits() != LengthUnit.NM) {
            throw new IllegalArgumentException("lambda axis must be expressed in nm");
        }
        return lambdaAxis;
    }
}
