package org.synphot.io;

import org.synphot.core.Spectrum;
import org.synphot.core.SpectrumKind;
import org.synphot.units.FluxUnit;
import org.synphot.units.WaveUnit;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Builds spectra from files and writes them back, choosing the format from
 * the file extension.
 */
public final class SpectrumFiles {

    private SpectrumFiles() {
    }

    public static SpectrumReader readerFor(Path path) throws IOException {
        String name = path.getFileName().toString().toLowerCase();
        if (isAscii(name)) {
            return new AsciiSpectrumReader();
        }
        throw new IOException("Unsupported file format: " + path.getFileName() + ". Use .txt, .dat or .csv");
    }

    public static SpectrumWriter writerFor(Path path) throws IOException {
        String name = path.getFileName().toString().toLowerCase();
        if (isAscii(name)) {
            return new AsciiSpectrumWriter();
        }
        throw new IOException("Unsupported file format: " + path.getFileName() + ". Use .txt, .dat or .csv");
    }

    /**
     * Source spectrum from a file. Units default to Angstrom and FLAM when
     * the file does not name them.
     *
     * @param area collecting area in cm2, or null
     */
    public static Spectrum readSource(Path path, Double area) throws IOException {
        return read(path, SpectrumKind.SOURCE, area);
    }

    /**
     * Passband from a file. Wavelengths default to Angstrom.
     */
    public static Spectrum readPassband(Path path, Double area) throws IOException {
        return read(path, SpectrumKind.PASSBAND, area);
    }

    public static Spectrum read(Path path, SpectrumKind kind, Double area) throws IOException {
        SpectrumTable table = readerFor(path).read(path);
        WaveUnit waveUnit = table.getWaveUnit() != null ? table.getWaveUnit() : WaveUnit.ANGSTROM;
        FluxUnit fluxUnit = table.getFluxUnit() != null ? table.getFluxUnit() : kind.getDefaultUnit();

        return Spectrum.builder(kind)
            .wavelengths(table.getWave(), waveUnit)
            .values(table.getValues(), fluxUnit)
            .area(area)
            .header(table.getHeader())
            .build();
    }

    public static void write(Path path, Spectrum spectrum) throws IOException {
        writerFor(path).write(path, spectrum);
    }

    private static boolean isAscii(String name) {
        return name.endsWith(".txt") || name.endsWith(".dat") || name.endsWith(".csv") || name.endsWith(".ascii");
    }
}
