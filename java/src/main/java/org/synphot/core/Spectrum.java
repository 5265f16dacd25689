package org.synphot.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.synphot.config.SynphotConfig;
import org.synphot.units.FluxConverter;
import org.synphot.units.FluxUnit;
import org.synphot.units.WaveUnit;

import java.util.*;

/**
 * A spectrum: values sampled on a wavelength grid.
 *
 * <p>A {@link SpectrumKind#SOURCE} spectrum carries flux density, a
 * {@link SpectrumKind#PASSBAND} spectrum carries dimensionless throughput.
 * Instances are immutable; every operation returns a new spectrum. Use a
 * {@link SpectrumHandle} for in-place unit conversion and tapering.
 */
public final class Spectrum {
    private static final Logger log = LoggerFactory.getLogger(Spectrum.class);

    private final SpectrumKind kind;
    private final WaveGrid wave;
    private final double[] values;
    private final FluxUnit fluxUnit;
    private final Double area;
    private final Metadata metadata;
    private final Map<String, String> warnings;

    private Spectrum(SpectrumKind kind, WaveGrid wave, double[] values, FluxUnit fluxUnit,
                     Double area, Metadata metadata, Map<String, String> warnings) {
        this.kind = kind;
        this.wave = wave;
        this.values = values;
        this.fluxUnit = fluxUnit;
        this.area = area;
        this.metadata = metadata.withDefaultExpr(kind.getTypeName());
        this.warnings = Collections.unmodifiableMap(new LinkedHashMap<>(warnings));
    }

    public static Builder builder(SpectrumKind kind) {
        return new Builder(kind);
    }

    /**
     * Source spectrum in FLAM on an Angstrom grid.
     */
    public static Spectrum source(double[] wave, double[] flux) {
        return source(wave, WaveUnit.ANGSTROM, flux, FluxUnit.FLAM);
    }

    public static Spectrum source(double[] wave, WaveUnit waveUnit, double[] flux, FluxUnit fluxUnit) {
        return builder(SpectrumKind.SOURCE).wavelengths(wave, waveUnit).values(flux, fluxUnit).build();
    }

    /**
     * Passband on an Angstrom grid.
     */
    public static Spectrum passband(double[] wave, double[] throughput) {
        return passband(wave, WaveUnit.ANGSTROM, throughput);
    }

    public static Spectrum passband(double[] wave, WaveUnit waveUnit, double[] throughput) {
        return builder(SpectrumKind.PASSBAND).wavelengths(wave, waveUnit)
            .values(throughput, FluxUnit.THROUGHPUT).build();
    }

    // Getters
    public SpectrumKind getKind() { return kind; }
    public boolean isSource() { return kind == SpectrumKind.SOURCE; }
    public boolean isPassband() { return kind == SpectrumKind.PASSBAND; }

    public int size() { return values.length; }

    public WaveGrid getWave() { return wave; }
    public double[] getWaveValues() { return wave.getValues(); }
    public WaveUnit getWaveUnit() { return wave.getUnit(); }

    public double[] getValues() { return values.clone(); }
    public double getValueAt(int i) { return values[i]; }
    public FluxUnit getFluxUnit() { return fluxUnit; }

    /**
     * Collecting area in cm2, or null if undefined.
     */
    public Double getArea() { return area; }
    public boolean hasArea() { return area != null; }

    public Metadata getMetadata() { return metadata; }
    public String getExpr() { return metadata.getExpr(); }

    public Map<String, String> getWarnings() { return warnings; }

    double[] values() { return values; }

    /**
     * Union of this grid and {@code other}'s grid, in this wavelength unit.
     */
    public WaveGrid mergeWave(Spectrum other) {
        return mergeWave(other, MergeOptions.defaults().threshold(SynphotConfig.getDefault().mergeThreshold));
    }

    public WaveGrid mergeWave(Spectrum other, MergeOptions options) {
        double[] otherWave = other.wave.to(wave.getUnit()).getValues();
        double[] merged = SpectrumUtils.mergeWavelengths(wave.getValues(), otherWave, options);
        return WaveGrid.of(merged, wave.getUnit());
    }

    /**
     * Values interpolated onto {@code target}, in {@link #getFluxUnit()}.
     * The result follows the order of {@code target} and is not checked for
     * negative values.
     */
    public double[] resample(WaveGrid target) {
        return resample(target, SynphotConfig.getDefault().extrapolation);
    }

    public double[] resample(WaveGrid target, Extrapolation extrapolation) {
        // Interpolate in the caller's unit, not ours
        double[] own = wave.to(target.getUnit()).getValues();
        double[] newWave = target.getValues();

        boolean newAscending = SpectrumUtils.isAscending(newWave);
        if (!newAscending) newWave = SpectrumUtils.reverse(newWave);

        double[] x = own;
        double[] y = values;
        if (!SpectrumUtils.isAscending(own)) {
            x = SpectrumUtils.reverse(own);
            y = SpectrumUtils.reverse(values);
        }

        double[] result = interpolate(newWave, x, y, extrapolation);
        return newAscending ? result : SpectrumUtils.reverse(result);
    }

    /**
     * Values interpolated onto wavelengths given in this wavelength unit.
     */
    public double[] resample(double[] wavelengths) {
        return resample(WaveGrid.of(wavelengths, wave.getUnit()));
    }

    public double resample(double wavelength) {
        return resample(new double[]{wavelength})[0];
    }

    private static double[] interpolate(double[] xq, double[] x, double[] y, Extrapolation extrapolation) {
        int n = x.length;
        double[] out = new double[xq.length];
        int outside = 0;

        for (int i = 0; i < xq.length; i++) {
            double q = xq[i];
            if (q < x[0] || q > x[n - 1]) {
                outside++;
                out[i] = extrapolate(q, x, y, extrapolation);
                continue;
            }
            if (n == 1) {
                out[i] = y[0];
                continue;
            }
            int j = Arrays.binarySearch(x, q);
            if (j >= 0) {
                out[i] = y[j];
            } else {
                int hi = -j - 1;
                int lo = hi - 1;
                double t = (q - x[lo]) / (x[hi] - x[lo]);
                out[i] = y[lo] + t * (y[hi] - y[lo]);
            }
        }

        if (outside > 0) {
            log.debug("{} of {} wavelengths outside [{}, {}], extrapolated with {}",
                outside, xq.length, x[0], x[n - 1], extrapolation);
        }
        return out;
    }

    private static double extrapolate(double q, double[] x, double[] y, Extrapolation extrapolation) {
        int n = x.length;
        boolean below = q < x[0];
        switch (extrapolation) {
            case ZERO:
                return 0.0;
            case LINEAR:
                if (n > 1) {
                    int lo = below ? 0 : n - 2;
                    double slope = (y[lo + 1] - y[lo]) / (x[lo + 1] - x[lo]);
                    return y[lo] + slope * (q - x[lo]);
                }
                return y[0];
            case CONSTANT:
            default:
                return below ? y[0] : y[n - 1];
        }
    }

    /**
     * Trapezoid integral over the whole grid, in flux unit times wave unit.
     */
    public double integrate() {
        return SpectrumUtils.trapezoid(wave.getValues(), values);
    }

    /**
     * Trapezoid integral after resampling onto {@code grid}.
     */
    public double integrate(WaveGrid grid) {
        return SpectrumUtils.trapezoid(grid.getValues(), resample(grid));
    }

    /**
     * Spectrum restricted to an inclusive wavelength window in this unit.
     */
    public Spectrum trim(double minWave, double maxWave) {
        return trim(minWave, maxWave, wave.getUnit());
    }

    public Spectrum trim(double minWave, double maxWave, WaveUnit unit) {
        double a = unit.convert(minWave, wave.getUnit());
        double b = unit.convert(maxWave, wave.getUnit());
        double low = Math.min(a, b);
        double high = Math.max(a, b);

        List<Double> newWave = new ArrayList<>();
        List<Double> newValues = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            double w = wave.get(i);
            if (w >= low && w <= high) {
                newWave.add(w);
                newValues.add(values[i]);
            }
        }
        if (newWave.isEmpty()) {
            throw new SynphotException(String.format(
                "No wavelengths between %s and %s %s", minWave, maxWave, unit));
        }

        return builder(kind)
            .wavelengths(newWave.stream().mapToDouble(Double::doubleValue).toArray(), wave.getUnit())
            .values(newValues.stream().mapToDouble(Double::doubleValue).toArray(), fluxUnit)
            .area(area)
            .metadata(metadata)
            .build();
    }

    /**
     * Same spectrum with the grid in another wavelength unit.
     */
    public Spectrum withWaveUnit(WaveUnit unit) {
        if (unit == wave.getUnit()) return this;
        return new Spectrum(kind, wave.to(unit), values, fluxUnit, area, metadata, warnings);
    }

    /**
     * Same spectrum with values in another flux unit. Throughput cannot be
     * converted, so a passband is returned unchanged.
     */
    public Spectrum withFluxUnit(FluxUnit unit) {
        if (isPassband() || unit == fluxUnit) return this;
        kind.validateUnit(unit);
        double[] converted = FluxConverter.convert(
            wave.getValues(), wave.getUnit(), values, fluxUnit, unit, area);
        return new Spectrum(kind, wave, converted, unit, area, metadata, warnings);
    }

    /**
     * Spectrum with a zero point added at each end that is not already zero.
     * The new end wavelengths keep the ratio of the two points next to them.
     */
    public Spectrum tapered() {
        int n = values.length;
        boolean taperStart = values[0] != 0;
        boolean taperEnd = values[n - 1] != 0;
        if (!taperStart && !taperEnd) return this;
        if (n < 2) {
            throw new SynphotException("Cannot taper a spectrum with fewer than 2 points");
        }

        double[] w = wave.getValues();
        int size = n + (taperStart ? 1 : 0) + (taperEnd ? 1 : 0);
        double[] newWave = new double[size];
        double[] newValues = new double[size];
        int offset = taperStart ? 1 : 0;

        System.arraycopy(w, 0, newWave, offset, n);
        System.arraycopy(values, 0, newValues, offset, n);
        if (taperStart) {
            newWave[0] = w[0] * w[0] / w[1];
        }
        if (taperEnd) {
            newWave[size - 1] = w[n - 1] * w[n - 1] / w[n - 2];
        }
        return new Spectrum(kind, WaveGrid.of(newWave, wave.getUnit()), newValues,
            fluxUnit, area, metadata, warnings);
    }

    // Arithmetic

    public Spectrum add(Spectrum other) {
        return SpectrumArithmetic.apply(this, other, ArithmeticOperator.ADD);
    }

    public Spectrum add(double scalar) {
        return SpectrumArithmetic.apply(this, scalar, ArithmeticOperator.ADD);
    }

    public Spectrum subtract(Spectrum other) {
        return SpectrumArithmetic.apply(this, other, ArithmeticOperator.SUBTRACT);
    }

    public Spectrum subtract(double scalar) {
        return SpectrumArithmetic.apply(this, scalar, ArithmeticOperator.SUBTRACT);
    }

    /**
     * A passband times a source spectrum gives a source spectrum.
     */
    public Spectrum multiply(Spectrum other) {
        if (isPassband() && other.isSource()) {
            return other.multiply(this);
        }
        return SpectrumArithmetic.apply(this, other, ArithmeticOperator.MULTIPLY);
    }

    public Spectrum multiply(double scalar) {
        return SpectrumArithmetic.apply(this, scalar, ArithmeticOperator.MULTIPLY);
    }

    public Spectrum divide(Spectrum other) {
        return SpectrumArithmetic.apply(this, other, ArithmeticOperator.DIVIDE);
    }

    public Spectrum divide(double scalar) {
        return SpectrumArithmetic.apply(this, scalar, ArithmeticOperator.DIVIDE);
    }

    // Overlap

    public OverlapStatus checkOverlap(Spectrum other) {
        return OverlapAnalyzer.checkOverlap(this, other, SynphotConfig.getDefault().overlapThreshold);
    }

    public OverlapStatus checkOverlap(Spectrum other, double threshold) {
        return OverlapAnalyzer.checkOverlap(this, other, threshold);
    }

    // Source spectrum operations

    /**
     * Brighten or dim by {@code mag} magnitudes.
     */
    public Spectrum addMag(double mag) {
        requireSource("addMag");
        if (!Double.isFinite(mag)) {
            throw new SynphotException(mag + " cannot be added to spectrum");
        }
        if (fluxUnit.isMagnitude()) {
            return add(mag);
        }
        return multiply(Math.pow(10, -0.4 * mag));
    }

    /**
     * @throws SynphotException if {@code unit} is not a magnitude unit
     */
    public Spectrum addMag(double mag, FluxUnit unit) {
        if (unit == null || !unit.isMagnitude()) {
            throw new SynphotException(mag + " " + unit + " cannot be added to spectrum");
        }
        return addMag(mag);
    }

    /**
     * Spectrum shifted to redshift {@code z}. Lengths are stretched by
     * {@code 1+z}, frequencies and wavenumbers are divided by it.
     */
    public Spectrum applyRedshift(double z) {
        requireSource("applyRedshift");
        if (!Double.isFinite(z)) {
            throw new SynphotException("Redshift must be a number.");
        }
        double factor = 1.0 + z;
        double[] w = wave.getValues();
        double[] shifted = new double[w.length];
        for (int i = 0; i < w.length; i++) {
            shifted[i] = wave.getUnit().isLength() ? w[i] * factor : w[i] / factor;
        }

        return builder(kind)
            .wavelengths(shifted, wave.getUnit())
            .values(values, fluxUnit)
            .area(area)
            .metadata(metadata.withExpr(getExpr() + " at z=" + z))
            .build();
    }

    /**
     * Renormalize to {@code value} in this spectrum's flux unit.
     */
    public Spectrum renorm(double value, Spectrum band) {
        return renorm(value, fluxUnit, band, false, null);
    }

    public Spectrum renorm(double value, FluxUnit unit, Spectrum band) {
        return renorm(value, unit, band, false, null);
    }

    public Spectrum renorm(double value, FluxUnit unit, Spectrum band, boolean force) {
        return renorm(value, unit, band, force, null);
    }

    /**
     * Rescale so that the flux through {@code band} equals {@code value}.
     *
     * @param force proceed even if most of the band lies outside the spectrum
     * @param vega  reference spectrum, required for VEGAMAG
     */
    public Spectrum renorm(double value, FluxUnit unit, Spectrum band, boolean force, Spectrum vega) {
        requireSource("renorm");
        return new Renormalizer(SynphotConfig.getDefault()).renorm(this, value, unit, band, force, vega);
    }

    Spectrum withWarnings(Map<String, String> extra) {
        if (extra.isEmpty()) return this;
        Map<String, String> merged = new LinkedHashMap<>(warnings);
        merged.putAll(extra);
        return new Spectrum(kind, wave, values, fluxUnit, area, metadata, merged);
    }

    private void requireSource(String operation) {
        if (!isSource()) {
            throw new SynphotException(operation + " is only defined for source spectra");
        }
    }

    @Override
    public String toString() {
        return String.format("%s(expr=%s, size=%d, wave=[%.4g, %.4g] %s, unit=%s)",
            kind.getTypeName(), getExpr(), size(), wave.getMin(), wave.getMax(), wave.getUnit(), fluxUnit);
    }

    /**
     * Collects the parts of a spectrum and validates them in {@link #build()}.
     */
    public static final class Builder {
        private final SpectrumKind kind;
        private double[] wave;
        private WaveUnit waveUnit = WaveUnit.ANGSTROM;
        private double[] values;
        private FluxUnit fluxUnit;
        private Double area;
        private Metadata metadata = Metadata.empty();

        private Builder(SpectrumKind kind) {
            if (kind == null) {
                throw new SynphotException("Spectrum kind is missing");
            }
            this.kind = kind;
            this.fluxUnit = kind.getDefaultUnit();
        }

        public Builder wavelengths(double[] wave, WaveUnit unit) {
            this.wave = wave;
            this.waveUnit = unit;
            return this;
        }

        public Builder wavelengths(WaveGrid grid) {
            return wavelengths(grid.getValues(), grid.getUnit());
        }

        public Builder values(double[] values, FluxUnit unit) {
            this.values = values;
            this.fluxUnit = unit;
            return this;
        }

        /**
         * Collecting area in cm2; null for none.
         */
        public Builder area(Double area) {
            this.area = area;
            return this;
        }

        public Builder metadata(Metadata metadata) {
            this.metadata = metadata == null ? Metadata.empty() : metadata;
            return this;
        }

        public Builder header(Map<String, String> header) {
            return metadata(Metadata.fromHeader(header));
        }

        public Spectrum build() {
            if (wave == null || values == null) {
                throw new SynphotException("Wavelengths and values are required");
            }
            if (area != null && !(area > 0 && Double.isFinite(area))) {
                throw new SynphotException("Area must be a positive number, got " + area);
            }
            WaveGrid grid = WaveGrid.of(wave, waveUnit);
            ValidationResult result = SpectrumValidator.validate(kind, grid, values, fluxUnit);
            return new Spectrum(kind, grid, result.values(), fluxUnit, area, metadata, result.getWarnings());
        }
    }
}
