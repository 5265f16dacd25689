package org.synphot.core;

/**
 * How {@link Spectrum#resample} fills wavelengths outside the sampled range.
 *
 * <p>The default from {@code synphot.yml} is {@link #CONSTANT}, which holds
 * the end values rather than extending the curve; renormalization warnings
 * describe the spectrum as extrapolated at constant value on that basis.
 * Select {@link #LINEAR} to extrapolate along the end segments instead.
 */
public enum Extrapolation {
    /** Hold the first and last values. */
    CONSTANT,
    /** Extend the first and last line segments. May produce negative values. */
    LINEAR,
    /** Treat the spectrum as zero outside its range. */
    ZERO
}
