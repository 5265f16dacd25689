package org.synphot.io;

import org.synphot.core.Spectrum;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Writes spectra in the format read by {@link AsciiSpectrumReader}.
 */
public class AsciiSpectrumWriter implements SpectrumWriter {

    @Override
    public void write(Path path, Spectrum spectrum) throws IOException {
        try (PrintWriter writer = new PrintWriter(Files.newBufferedWriter(path, StandardCharsets.UTF_8))) {
            write(writer, spectrum);
        }
    }

    public void write(PrintWriter writer, Spectrum spectrum) {
        for (Map.Entry<String, String> entry : spectrum.getMetadata().toHeader().entrySet()) {
            writer.println("# " + entry.getKey() + " = " + entry.getValue());
        }
        writer.println("# " + AsciiSpectrumReader.WAVE_UNIT_KEY + " = " + spectrum.getWaveUnit().getSymbol());
        writer.println("# " + AsciiSpectrumReader.FLUX_UNIT_KEY + " = " + spectrum.getFluxUnit().getSymbol());

        double[] wave = spectrum.getWaveValues();
        double[] values = spectrum.getValues();
        for (int i = 0; i < wave.length; i++) {
            writer.printf(Locale.ROOT, "%.15G %.15G%n", wave[i], values[i]);
        }
    }
}
