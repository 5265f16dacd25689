package org.synphot.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.synphot.analytic.FlatSpectrum;
import org.synphot.config.SynphotConfig;
import org.synphot.units.FluxConverter;
import org.synphot.units.FluxUnit;
import org.synphot.units.WaveUnit;

import java.util.*;

/**
 * Rescales a source spectrum so that its flux through a passband matches a
 * requested value.
 */
public class Renormalizer {
    private static final Logger log = LoggerFactory.getLogger(Renormalizer.class);

    public static final String PARTIAL_RENORM = "PartialRenorm";

    private final double overlapThreshold;

    public Renormalizer(SynphotConfig config) {
        this(config.renormOverlapThreshold);
    }

    public Renormalizer(double overlapThreshold) {
        if (!Double.isFinite(overlapThreshold)) {
            throw new SynphotException(overlapThreshold + " is not a valid threshold");
        }
        this.overlapThreshold = overlapThreshold;
    }

    public double getOverlapThreshold() { return overlapThreshold; }

    /**
     * Renormalize {@code spectrum} through {@code band}.
     *
     * @param value target flux through the band
     * @param unit  unit of {@code value}; null means the spectrum's own unit
     * @param force go ahead when less than the threshold fraction of the band
     *              is covered by the spectrum
     * @param vega  reference spectrum, required when {@code unit} is VEGAMAG
     * @return new spectrum carrying any partial-overlap warning
     * @throws DisjointException       if spectrum and band do not overlap
     * @throws PartialOverlapException if the overlap is too small and not forced
     * @throws SynphotException        for an invalid band, value or integrated flux
     */
    public Spectrum renorm(Spectrum spectrum, double value, FluxUnit unit, Spectrum band,
                           boolean force, Spectrum vega) {
        if (!spectrum.isSource()) {
            throw new SynphotException("Only source spectra can be renormalized.");
        }
        if (band == null || !band.isPassband()) {
            throw new SynphotException("Renormalization passband must be a SpectralElement.");
        }
        if (!Double.isFinite(value)) {
            throw new SynphotException(value + " is not a valid renormalization value");
        }
        if (unit == null) {
            unit = spectrum.getFluxUnit();
        }
        if (unit.isDimensionless()) {
            throw new SynphotException("Cannot renormalize in " + unit);
        }

        Map<String, String> warnings = checkOverlap(spectrum, band, force);

        // Flux of the spectrum through the passband
        Spectrum sp = spectrum.multiply(band);

        double totalFlux;
        double stdFlux;
        if (unit.isCountLike()) {
            stdFlux = 1.0;
            double[] counts = FluxConverter.convert(sp.getWaveValues(), sp.getWaveUnit(), sp.values(),
                sp.getFluxUnit(), FluxUnit.COUNT, sp.getArea());
            totalFlux = Arrays.stream(counts).sum();
        } else {
            // Both integrals over Angstrom, whatever the units of the two grids
            totalFlux = sp.withWaveUnit(WaveUnit.ANGSTROM).integrate();
            Spectrum standard = standardSpectrum(unit, band, spectrum.getArea(), vega);
            Spectrum up = standard.multiply(band).withFluxUnit(sp.getFluxUnit());
            stdFlux = up.withWaveUnit(WaveUnit.ANGSTROM).integrate();
        }

        SpectrumUtils.validateTotalFlux(totalFlux);

        Spectrum result;
        if (unit.isMagnitude()) {
            double mag = value + 2.5 * Math.log10(totalFlux / stdFlux);
            log.debug("Renormalizing {} to {} {}: adding {} mag", spectrum.getExpr(), value, unit, mag);
            result = spectrum.addMag(mag);
        } else {
            double factor = value * (stdFlux / totalFlux);
            log.debug("Renormalizing {} to {} {}: scaling by {}", spectrum.getExpr(), value, unit, factor);
            result = spectrum.multiply(factor);
        }
        return result.withWarnings(warnings);
    }

    private Map<String, String> checkOverlap(Spectrum spectrum, Spectrum band, boolean force) {
        Map<String, String> warnings = new LinkedHashMap<>();
        OverlapStatus status = band.checkOverlap(spectrum, overlapThreshold);
        int percent = (int) Math.round(100 * (1 - overlapThreshold));

        switch (status) {
            case NONE:
                throw new DisjointException("Spectrum and renormalization band are disjoint.");
            case PARTIAL_MOST:
                warnings.put(PARTIAL_RENORM, String.format(
                    "Spectrum is not defined everywhere in renormalization passband. At least %d%% of the "
                        + "band throughput has data. Spectrum will be extrapolated at constant value.", percent));
                break;
            case PARTIAL_NOTMOST:
                if (!force) {
                    throw new PartialOverlapException("Spectrum and renormalization band do not fully overlap. "
                        + "You may use force=true to force the renormalization to proceed.");
                }
                warnings.put(PARTIAL_RENORM, String.format(
                    "Spectrum is not defined everywhere in renormalization passband. Less than %d%% of the "
                        + "band throughput has data. Spectrum will be extrapolated at constant value.", percent));
                break;
            case FULL:
            default:
                break;
        }
        for (String warning : warnings.values()) {
            log.warn(warning);
        }
        return warnings;
    }

    private static Spectrum standardSpectrum(FluxUnit unit, Spectrum band, Double area, Spectrum vega) {
        if (unit == FluxUnit.VEGAMAG) {
            if (vega == null || !vega.isSource()) {
                throw new SynphotException("Vega spectrum is missing.");
            }
            return vega;
        }
        return FlatSpectrum.of(unit).toSpectrum(band.getWave(), area);
    }
}
