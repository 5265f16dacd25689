package org.synphot.tools;

import org.synphot.core.Spectrum;
import org.synphot.io.SpectrumFiles;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.util.concurrent.Callable;

/**
 * Redshift a source spectrum.
 */
@Command(
    name = "redshift",
    description = "Apply a redshift to a source spectrum"
)
public class RedshiftCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Source spectrum file")
    private File sourceFile;

    @Parameters(index = "1", description = "Redshift z")
    private double z;

    @Parameters(index = "2", description = "Output file")
    private File outputFile;

    @Override
    public Integer call() throws Exception {
        if (!sourceFile.exists()) {
            System.err.println("Error: Input file not found: " + sourceFile);
            return 1;
        }

        try {
            Spectrum shifted = SpectrumFiles.readSource(sourceFile.toPath(), null).applyRedshift(z);
            SpectrumFiles.write(outputFile.toPath(), shifted);
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }

        System.out.println("Results written to: " + outputFile);
        return 0;
    }
}
