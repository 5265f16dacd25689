package org.synphot.units;

/**
 * Physical type of a spectral axis.
 */
public enum WaveType {
    LENGTH,
    FREQUENCY,
    WAVENUMBER
}
