package org.synphot.io;

import org.synphot.core.SynphotException;
import org.synphot.units.FluxUnit;
import org.synphot.units.WaveUnit;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Reader for two-column ASCII spectra.
 *
 * <p>Columns are separated by whitespace or commas. Lines starting with
 * {@code #} are comments; a comment of the form {@code # key = value} becomes
 * a header entry. The keys {@code wave_unit} and {@code flux_unit} name the
 * column units.
 */
public class AsciiSpectrumReader implements SpectrumReader {
    public static final String WAVE_UNIT_KEY = "wave_unit";
    public static final String FLUX_UNIT_KEY = "flux_unit";

    @Override
    public SpectrumTable read(Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.toString());
        }
    }

    public SpectrumTable read(BufferedReader reader, String source) throws IOException {
        Map<String, String> header = new LinkedHashMap<>();
        List<Double> wave = new ArrayList<>();
        List<Double> values = new ArrayList<>();

        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String trimmed = line.trim();
            if (trimmed.isEmpty()) continue;

            if (trimmed.startsWith("#")) {
                parseComment(trimmed.substring(1), header);
                continue;
            }

            String[] fields = trimmed.split("[\\s,]+");
            if (fields.length < 2) {
                throw new IOException(String.format("%s:%d: expected 2 columns, found %d",
                    source, lineNumber, fields.length));
            }
            try {
                wave.add(Double.parseDouble(fields[0]));
                values.add(Double.parseDouble(fields[1]));
            } catch (NumberFormatException e) {
                throw new IOException(String.format("%s:%d: invalid number", source, lineNumber), e);
            }
        }

        WaveUnit waveUnit = null;
        FluxUnit fluxUnit = null;
        try {
            if (header.containsKey(WAVE_UNIT_KEY)) waveUnit = WaveUnit.fromName(header.remove(WAVE_UNIT_KEY));
            if (header.containsKey(FLUX_UNIT_KEY)) fluxUnit = FluxUnit.fromName(header.remove(FLUX_UNIT_KEY));
        } catch (SynphotException e) {
            throw new IOException(source + ": " + e.getMessage(), e);
        }

        return new SpectrumTable(header,
            wave.stream().mapToDouble(Double::doubleValue).toArray(),
            values.stream().mapToDouble(Double::doubleValue).toArray(),
            waveUnit, fluxUnit);
    }

    private void parseComment(String comment, Map<String, String> header) {
        int eq = comment.indexOf('=');
        if (eq <= 0) return;
        String key = comment.substring(0, eq).trim();
        String value = comment.substring(eq + 1).trim();
        if (!key.isEmpty() && !key.contains(" ")) {
            header.put(key, value);
        }
    }
}
