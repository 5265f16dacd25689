package org.synphot.io;

import org.synphot.core.Spectrum;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes a spectrum with its metadata to a file.
 */
public interface SpectrumWriter {

    void write(Path path, Spectrum spectrum) throws IOException;
}
