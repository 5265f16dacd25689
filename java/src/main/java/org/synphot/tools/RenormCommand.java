package org.synphot.tools;

import org.synphot.core.Spectrum;
import org.synphot.io.SpectrumFiles;
import org.synphot.units.FluxUnit;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Renormalize a source spectrum through a passband.
 */
@Command(
    name = "renorm",
    description = "Renormalize a spectrum to a given flux through a passband"
)
public class RenormCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Source spectrum file")
    private File sourceFile;

    @Parameters(index = "1", description = "Passband file")
    private File bandFile;

    @Parameters(index = "2", description = "Target flux or magnitude")
    private double value;

    @Parameters(index = "3", description = "Output file")
    private File outputFile;

    @Option(names = {"-u", "--unit"}, description = "Unit of the target value (default: unit of the spectrum)")
    private String unit;

    @Option(names = {"-f", "--force"}, description = "Proceed when the spectrum covers too little of the band")
    private boolean force;

    @Option(names = {"--vega"}, description = "Vega spectrum file, required for VEGAMAG")
    private File vegaFile;

    @Option(names = {"--area"}, description = "Collecting area in cm2, required for count units")
    private Double area;

    @Override
    public Integer call() throws Exception {
        for (File f : new File[]{sourceFile, bandFile, vegaFile}) {
            if (f != null && !f.exists()) {
                System.err.println("Error: Input file not found: " + f);
                return 1;
            }
        }

        Spectrum result;
        try {
            Spectrum source = SpectrumFiles.readSource(sourceFile.toPath(), area);
            Spectrum band = SpectrumFiles.readPassband(bandFile.toPath(), area);
            Spectrum vega = vegaFile != null ? SpectrumFiles.readSource(vegaFile.toPath(), area) : null;
            FluxUnit target = unit != null ? FluxUnit.fromName(unit) : source.getFluxUnit();

            result = source.renorm(value, target, band, force, vega);
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }

        for (Map.Entry<String, String> warning : result.getWarnings().entrySet()) {
            System.err.printf("Warning (%s): %s%n", warning.getKey(), warning.getValue());
        }

        try {
            SpectrumFiles.write(outputFile.toPath(), result);
        } catch (Exception e) {
            System.err.println("Error writing file: " + e.getMessage());
            return 1;
        }

        System.out.println("Results written to: " + outputFile);
        return 0;
    }
}
