package org.synphot.io;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads the header and the two columns of a spectrum file.
 */
public interface SpectrumReader {

    SpectrumTable read(Path path) throws IOException;
}
