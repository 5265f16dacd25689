package org.synphot.analytic;

import org.synphot.core.Metadata;
import org.synphot.core.Spectrum;
import org.synphot.core.SpectrumKind;
import org.synphot.core.SynphotException;
import org.synphot.core.WaveGrid;
import org.synphot.units.FluxConverter;
import org.synphot.units.FluxUnit;

import java.util.*;

/**
 * A source that is constant in a given flux unit.
 *
 * Magnitude and count units are sampled in their own unit and then expressed
 * in PHOTLAM, since a source spectrum only holds flux densities.
 */
public class FlatSpectrum {
    private final double amplitude;
    private final FluxUnit unit;

    public FlatSpectrum(double amplitude, FluxUnit unit) {
        if (!Double.isFinite(amplitude)) {
            throw new SynphotException("Amplitude must be a number, got " + amplitude);
        }
        if (unit == null || unit.isDimensionless() || unit == FluxUnit.VEGAMAG) {
            throw new SynphotException("Cannot build a flat spectrum in " + unit);
        }
        this.amplitude = amplitude;
        this.unit = unit;
    }

    /**
     * Flat spectrum at the zero point of {@code unit}: 1 for linear units,
     * 0 for magnitudes.
     */
    public static FlatSpectrum of(FluxUnit unit) {
        return new FlatSpectrum(unit != null && unit.isMagnitude() ? 0.0 : 1.0, unit);
    }

    public double getAmplitude() { return amplitude; }
    public FluxUnit getUnit() { return unit; }

    /**
     * Sample on {@code grid}.
     *
     * @param area collecting area in cm2, needed for count units
     */
    public Spectrum toSpectrum(WaveGrid grid, Double area) {
        double[] values = new double[grid.size()];
        Arrays.fill(values, amplitude);

        FluxUnit target = unit;
        if (!unit.isDensity()) {
            values = FluxConverter.convert(grid.getValues(), grid.getUnit(), values, unit, FluxUnit.PHOTLAM, area);
            target = FluxUnit.PHOTLAM;
        }

        return Spectrum.builder(SpectrumKind.SOURCE)
            .wavelengths(grid)
            .values(values, target)
            .area(area)
            .metadata(Metadata.of(String.format("Flat(%s %s)", amplitude, unit)))
            .build();
    }

    @Override
    public String toString() {
        return String.format("FlatSpectrum(amplitude=%s, unit=%s)", amplitude, unit);
    }
}
