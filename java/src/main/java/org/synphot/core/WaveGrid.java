package org.synphot.core;

import org.synphot.units.WaveUnit;

import java.util.*;

/**
 * A validated, immutable set of wavelengths with their unit.
 */
public final class WaveGrid {
    private final double[] values;
    private final WaveUnit unit;

    private WaveGrid(double[] values, WaveUnit unit) {
        this.values = values;
        this.unit = unit;
    }

    /**
     * @throws WavelengthException if the values are not strictly monotonic and positive
     */
    public static WaveGrid of(double[] values, WaveUnit unit) {
        if (unit == null) {
            throw new SynphotException("Wavelength unit is missing");
        }
        if (values.length == 0) {
            throw new SynphotException("Wavelength array is empty");
        }
        double[] copy = values.clone();
        SpectrumUtils.validateWavelengths(copy);
        return new WaveGrid(copy, unit);
    }

    public static WaveGrid of(double... angstrom) {
        return of(angstrom, WaveUnit.ANGSTROM);
    }

    public int size() { return values.length; }
    public WaveUnit getUnit() { return unit; }

    public double[] getValues() { return values.clone(); }
    public double get(int i) { return values[i]; }

    public double getMin() { return SpectrumUtils.min(values); }
    public double getMax() { return SpectrumUtils.max(values); }

    public boolean isAscending() {
        return SpectrumUtils.isAscending(values);
    }

    /**
     * Convert to another unit using the spectral equivalence.
     */
    public WaveGrid to(WaveUnit target) {
        if (target == unit) return this;
        return new WaveGrid(unit.convert(values, target), target);
    }

    /**
     * This grid if it is a length, otherwise the same grid in Angstrom.
     */
    public WaveGrid toLength() {
        return unit.isLength() ? this : to(WaveUnit.ANGSTROM);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WaveGrid)) return false;
        WaveGrid other = (WaveGrid) o;
        return unit == other.unit && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(values) + unit.hashCode();
    }

    @Override
    public String toString() {
        return String.format("WaveGrid(size=%d, unit=%s, range=[%.4g, %.4g])",
            values.length, unit, getMin(), getMax());
    }
}
