package org.synphot.core;

import org.synphot.units.FluxUnit;
import org.synphot.units.WaveUnit;

/**
 * Mutable holder for a spectrum that is converted or tapered in place.
 *
 * <p>Each operation builds the replacement first and swaps it in only when it
 * succeeded, so a failure leaves the held spectrum untouched. Not thread-safe:
 * callers sharing a handle must not mutate it concurrently with other reads.
 */
public class SpectrumHandle {
    private Spectrum spectrum;

    public SpectrumHandle(Spectrum spectrum) {
        if (spectrum == null) {
            throw new SynphotException("Spectrum is missing");
        }
        this.spectrum = spectrum;
    }

    /**
     * The spectrum currently held. It is immutable and stays valid after
     * later changes to this handle.
     */
    public Spectrum get() { return spectrum; }

    public void convertWave(WaveUnit unit) {
        spectrum = spectrum.withWaveUnit(unit);
    }

    /**
     * No-op for a passband, whose throughput has no other unit.
     */
    public void convertFlux(FluxUnit unit) {
        spectrum = spectrum.withFluxUnit(unit);
    }

    public void taper() {
        spectrum = spectrum.tapered();
    }

    @Override
    public String toString() {
        return "SpectrumHandle(" + spectrum + ")";
    }
}
