package org.synphot.units;

import org.synphot.core.SynphotException;

/**
 * Units of the spectral axis.
 *
 * <p>Every unit converts to and from Angstrom using the spectral equivalence,
 * so any two units can be converted into each other. Frequency and wavenumber
 * grids reverse the order of the values when converted to a length.
 */
public enum WaveUnit {
    ANGSTROM("Angstrom", WaveType.LENGTH, 1.0, "AA", "A"),
    NANOMETER("nm", WaveType.LENGTH, 10.0),
    MICRON("um", WaveType.LENGTH, 1e4, "micron"),
    MILLIMETER("mm", WaveType.LENGTH, 1e7),
    CENTIMETER("cm", WaveType.LENGTH, 1e8),
    METER("m", WaveType.LENGTH, 1e10),
    HERTZ("Hz", WaveType.FREQUENCY, 1.0),
    KILOHERTZ("kHz", WaveType.FREQUENCY, 1e3),
    MEGAHERTZ("MHz", WaveType.FREQUENCY, 1e6),
    GIGAHERTZ("GHz", WaveType.FREQUENCY, 1e9),
    TERAHERTZ("THz", WaveType.FREQUENCY, 1e12),
    INVERSE_CENTIMETER("1/cm", WaveType.WAVENUMBER, 1.0, "cm-1"),
    INVERSE_METER("1/m", WaveType.WAVENUMBER, 1e-2, "m-1");

    private final String symbol;
    private final WaveType type;
    // Angstrom, Hz or 1/cm per unit, depending on type
    private final double scale;
    private final String[] aliases;

    WaveUnit(String symbol, WaveType type, double scale, String... aliases) {
        this.symbol = symbol;
        this.type = type;
        this.scale = scale;
        this.aliases = aliases;
    }

    public String getSymbol() { return symbol; }
    public WaveType getType() { return type; }

    public boolean isLength() {
        return type == WaveType.LENGTH;
    }

    /**
     * Convert a single value in this unit to Angstrom.
     */
    public double toAngstrom(double value) {
        switch (type) {
            case LENGTH:
                return value * scale;
            case FREQUENCY:
                return PhysicalConstants.C_ANGSTROM / (value * scale);
            case WAVENUMBER:
                return PhysicalConstants.ANGSTROM_PER_CM / (value * scale);
            default:
                throw new IllegalStateException("Unhandled wave type " + type);
        }
    }

    /**
     * Convert a single value in Angstrom to this unit.
     */
    public double fromAngstrom(double angstrom) {
        switch (type) {
            case LENGTH:
                return angstrom / scale;
            case FREQUENCY:
                return PhysicalConstants.C_ANGSTROM / angstrom / scale;
            case WAVENUMBER:
                return PhysicalConstants.ANGSTROM_PER_CM / angstrom / scale;
            default:
                throw new IllegalStateException("Unhandled wave type " + type);
        }
    }

    /**
     * Convert a value in this unit to another unit.
     */
    public double convert(double value, WaveUnit target) {
        if (target == this) return value;
        return target.fromAngstrom(toAngstrom(value));
    }

    public double[] convert(double[] values, WaveUnit target) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = convert(values[i], target);
        }
        return out;
    }

    public static WaveUnit fromName(String name) {
        if (name == null) {
            throw new SynphotException("Wavelength unit is missing");
        }
        String trimmed = name.trim();
        for (WaveUnit u : values()) {
            if (u.symbol.equalsIgnoreCase(trimmed) || u.name().equalsIgnoreCase(trimmed)) return u;
            for (String alias : u.aliases) {
                if (alias.equalsIgnoreCase(trimmed)) return u;
            }
        }
        throw new SynphotException(trimmed + " is not a valid wavelength unit");
    }

    @Override
    public String toString() {
        return symbol;
    }
}
