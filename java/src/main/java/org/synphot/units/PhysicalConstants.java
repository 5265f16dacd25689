package org.synphot.units;

/**
 * CGS constants used by the flux conversions. Lengths are in Angstrom.
 */
public final class PhysicalConstants {

    /** Speed of light in Angstrom per second. */
    public static final double C_ANGSTROM = 2.99792458e18;

    /** Planck constant in erg s. */
    public static final double H = 6.62607015e-27;

    /** h * c in erg Angstrom. */
    public static final double HC = H * C_ANGSTROM;

    /** Angstrom per centimeter. */
    public static final double ANGSTROM_PER_CM = 1e8;

    private PhysicalConstants() {
    }
}
