package org.janelia.oct.spectral;

import java.util.Arrays;

import org.janelia.oct.ConfigurationException;
import org.janelia.oct.dimension.DimensionAxis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hann spectral filters scaled to unit RMS.
 *
 * @author Eric Trautman
 */
public class SpectralWindow {

    /**
     * @return symmetric Hann window of the specified length.
     */
    public static double[] hann(final int length) {
        final double[] window = new double[length];
        if (length == 1) {
            window[0] = 1.0;
        } else {
            for (int i = 0; i < length; i++) {
                window[i] = 0.5 * (1.0 - Math.cos(2.0 * Math.PI * i / (length - 1)));
            }
        }
        return window;
    }

    /**
     * Builds the filter for the specified wavelengths.
     * Without a band, a Hann window covers the whole spectrum.
     * With a band, a Hann window is laid over [bandMin, bandMax] and linearly
     * interpolated onto the wavelengths with 0 outside the band.
     *
     * @param  lambda  wavelengths in nm.
     * @param  band    optional [min, max] band in nm.
     *
     * @return filter scaled so that its RMS is 1.
     *
     * @throws ConfigurationException
     *   if the band does not overlap the wavelengths.
     */
    public static double[] create(final double[] lambda,
                                  final double[] band)
            throws ConfigurationException {

        final double[] window;
        if (band == null) {
            window = hann(lambda.length);
        } else {
            final double[] clampedBand = clampBand(lambda, band);
            final double[] bandLambda = DimensionAxis.linspace(clampedBand[0], clampedBand[1], lambda.length);
            final double[] bandValues = hann(lambda.length);
            window = new double[lambda.length];
            for (int i = 0; i < lambda.length; i++) {
                window[i] = interpolate(bandLambda, bandValues, lambda[i]);
            }
        }

        double sumOfSquares = 0.0;
        for (final double value : window) {
            sumOfSquares += value * value;
        }
        final double rms = Math.sqrt(sumOfSquares / window.length);
        if (! (rms > 0)) {
            throw new ConfigurationException("spectral window for band " + Arrays.toString(band) +
                                             " has no energy within the recorded wavelengths");
        }

        for (int i = 0; i < window.length; i++) {
            window[i] = window[i] / rms;
        }

        return window;
    }

    static double[] clampBand(final double[] lambda,
                              final double[] band) {
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (final double value : lambda) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }

        if ((band[0] >= min) && (band[1] <= max)) {
            return band;
        }

        final double[] clamped = { Math.max(band[0], min), Math.min(band[1], max) };
        LOG.warn("clampBand: requested band [{}, {}] nm is outside data range [{}, {}] nm, shrinking it to [{}, {}] nm",
                 band[0], band[1], min, max, clamped[0], clamped[1]);

        if (! (clamped[0] < clamped[1])) {
            throw new ConfigurationException("requested band [" + band[0] + ", " + band[1] +
                                             "] nm does not overlap data range [" + min + ", " + max + "] nm");
        }
        return clamped;
    }

    /**
     * Linear interpolation on ascending sample positions, 0 outside.
     */
    private static double interpolate(final double[] positions,
                                      final double[] values,
                                      final double at) {
        final int last = positions.length - 1;
        if ((at < positions[0]) || (at > positions[last])) {
            return 0.0;
        }
        if (last == 0) {
            return values[0];
        }
        final double step = (positions[last] - positions[0]) / last;
        int i = (int) Math.floor((at - positions[0]) / step);
        i = Math.max(0, Math.min(last - 1, i));
        final double fraction = (at - positions[i]) / (positions[i + 1] - positions[i]);
        return values[i] + fraction * (values[i + 1] - values[i]);
    }

    private static final Logger LOG = LoggerFactory.getLogger(SpectralWindow.class);
}
