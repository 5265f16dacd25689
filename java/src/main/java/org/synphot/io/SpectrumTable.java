package org.synphot.io;

import org.synphot.units.FluxUnit;
import org.synphot.units.WaveUnit;

import java.util.*;

/**
 * Raw columns and header read from a spectrum file, before validation.
 */
public class SpectrumTable {
    private final Map<String, String> header;
    private final double[] wave;
    private final double[] values;
    private final WaveUnit waveUnit;
    private final FluxUnit fluxUnit;

    public SpectrumTable(Map<String, String> header, double[] wave, double[] values,
                         WaveUnit waveUnit, FluxUnit fluxUnit) {
        this.header = Collections.unmodifiableMap(new LinkedHashMap<>(header));
        this.wave = wave.clone();
        this.values = values.clone();
        this.waveUnit = waveUnit;
        this.fluxUnit = fluxUnit;
    }

    public Map<String, String> getHeader() { return header; }
    public double[] getWave() { return wave.clone(); }
    public double[] getValues() { return values.clone(); }
    public int size() { return wave.length; }

    /**
     * Unit named in the file, or null if the file does not say.
     */
    public WaveUnit getWaveUnit() { return waveUnit; }

    /**
     * Unit named in the file, or null if the file does not say.
     */
    public FluxUnit getFluxUnit() { return fluxUnit; }

    @Override
    public String toString() {
        return String.format("SpectrumTable(size=%d, waveUnit=%s, fluxUnit=%s)", wave.length, waveUnit, fluxUnit);
    }
}
