package org.janelia.oct.spectral;

/**
 * Kernels available for resampling interferograms onto an equispaced wavenumber axis.
 */
public enum InterpolationMethod {

    /** Linear interpolation between neighboring samples. */
    LINEAR,

    /** Windowed sinc (Lanczos) interpolation with a support of 5 samples on each side. */
    SINC5
}
