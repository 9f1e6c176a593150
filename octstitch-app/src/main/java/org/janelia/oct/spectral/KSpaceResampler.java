package org.janelia.oct.spectral;

import net.imglib2.RandomAccessible;
import net.imglib2.RealRandomAccess;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.interpolation.InterpolatorFactory;
import net.imglib2.interpolation.randomaccess.LanczosInterpolatorFactory;
import net.imglib2.interpolation.randomaccess.NLinearInterpolatorFactory;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;

/**
 * Resamples interferograms recorded on an arbitrary wavelength axis onto an axis
 * that is equispaced in wavenumber (k = 2π/λ).
 *
 * @author Eric Trautman
 */
public class KSpaceResampler {

    /** Relative tolerance for treating a wavenumber axis as equispaced. */
    public static final double EQUISPACED_TOLERANCE = 1.0e-10;

    private final InterpolationMethod method;

    public KSpaceResampler(final InterpolationMethod method) {
        this.method = method == null ? InterpolationMethod.LINEAR : method;
    }

    public static double[] toWavenumbers(final double[] lambda) {
        final double[] k = new double[lambda.length];
        for (int i = 0; i < lambda.length; i++) {
            k[i] = 2.0 * Math.PI / lambda[i];
        }
        return k;
    }

    /**
     * @return true if {@code |max(Δk) - min(Δk)| / max(k)} does not exceed {@link #EQUISPACED_TOLERANCE}.
     */
    public static boolean isEquispacedInK(final double[] lambda) {
        if (lambda.length < 3) {
            return true;
        }
        final double[] k = toWavenumbers(lambda);
        double minDelta = Double.MAX_VALUE;
        double maxDelta = -Double.MAX_VALUE;
        double maxK = -Double.MAX_VALUE;
        for (int i = 0; i < k.length; i++) {
            maxK = Math.max(maxK, k[i]);
            if (i > 0) {
                final double delta = k[i] - k[i - 1];
                minDelta = Math.min(minDelta, delta);
                maxDelta = Math.max(maxDelta, delta);
            }
        }
        return Math.abs((maxDelta - minDelta) / maxK) <= EQUISPACED_TOLERANCE;
    }

    /**
     * @return wavelengths (nm) whose wavenumbers are evenly spaced between the
     *         wavenumbers of the first and last specified wavelengths.
     */
    public static double[] equispacedLambda(final double[] lambda) {
        final int n = lambda.length;
        final double firstK = 2.0 * Math.PI / lambda[0];
        final double lastK = 2.0 * Math.PI / lambda[n - 1];
        final double[] result = new double[n];
        for (int i = 0; i < n; i++) {
            final double k = n == 1 ? lastK : firstK + (lastK - firstK) * i / (n - 1);
            result[i] = 2.0 * Math.PI / k;
        }
        result[0] = lambda[0];
        result[n - 1] = lambda[n - 1];
        return result;
    }

    /**
     * Resamples every A-scan of the frame from the source wavelengths to the target wavelengths.
     *
     * @param  frame         frame recorded at the source wavelengths.
     * @param  sourceLambda  monotonic wavelengths (nm) of the frame.
     * @param  targetLambda  wavelengths (nm) to sample.
     *
     * @return resampled frame with the same validity flag.
     */
    public RawFrame resample(final RawFrame frame,
                             final double[] sourceLambda,
                             final double[] targetLambda)
            throws IllegalArgumentException {

        final int lambdaCount = frame.getLambdaCount();
        if (sourceLambda.length != lambdaCount) {
            throw new IllegalArgumentException("frame has " + lambdaCount + " spectral samples but axis has " +
                                               sourceLambda.length);
        }

        final double[] fractionalIndexes = toFractionalIndexes(toWavenumbers(sourceLambda),
                                                               toWavenumbers(targetLambda));
        final int columnCount = frame.getColumnCount();

        final ArrayImg<DoubleType, DoubleArray> sourceImg =
                ArrayImgs.doubles(frame.getData(), lambdaCount, columnCount);
        final InterpolatorFactory<DoubleType, RandomAccessible<DoubleType>> factory = buildFactory();

        final int targetCount = targetLambda.length;
        final double[] resampled = new double[targetCount * columnCount];
        final double[] position = new double[1];
        for (int column = 0; column < columnCount; column++) {
            // interpolate along lambda only, one A-scan at a time
            final RandomAccessible<DoubleType> aScan = Views.extendBorder(Views.hyperSlice(sourceImg, 1, column));
            final RealRandomAccess<DoubleType> access = Views.interpolate(aScan, factory).realRandomAccess();
            for (int i = 0; i < targetCount; i++) {
                position[0] = fractionalIndexes[i];
                access.setPosition(position);
                resampled[i + targetCount * column] = access.get().getRealDouble();
            }
        }

        return new RawFrame(targetCount, frame.getXCount(), frame.getAveragingCount(), resampled, frame.isValid());
    }

    private InterpolatorFactory<DoubleType, RandomAccessible<DoubleType>> buildFactory() {
        if (method == InterpolationMethod.SINC5) {
            return new LanczosInterpolatorFactory<>(5, false);
        }
        return new NLinearInterpolatorFactory<>();
    }

    /**
     * Maps each target wavenumber to a (fractional) index of the monotonic source wavenumbers
     * so that interpolation in index space is linear in k between neighboring samples.
     */
    static double[] toFractionalIndexes(final double[] sourceK,
                                        final double[] targetK) {
        final int last = sourceK.length - 1;
        final boolean ascending = sourceK[last] >= sourceK[0];
        final double[] indexes = new double[targetK.length];
        for (int t = 0; t < targetK.length; t++) {
            final double k = targetK[t];
            int low = 0;
            int high = last;
            while (high - low > 1) {
                final int mid = (low + high) >>> 1;
                if ((sourceK[mid] <= k) == ascending) {
                    low = mid;
                } else {
                    high = mid;
                }
            }
            if (last == 0) {
                indexes[t] = 0;
            } else {
                final double span = sourceK[high] - sourceK[low];
                indexes[t] = span == 0 ? low : low + (k - sourceK[low]) / span;
            }
        }
        return indexes;
    }
}
