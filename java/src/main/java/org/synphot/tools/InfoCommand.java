package org.synphot.tools;

import org.synphot.core.Spectrum;
import org.synphot.core.SpectrumKind;
import org.synphot.io.SpectrumFiles;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Display information about a spectrum file.
 */
@Command(
    name = "info",
    description = "Display information about a spectrum or passband file"
)
public class InfoCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Input file (.txt, .dat or .csv)")
    private File inputFile;

    @Option(names = {"-p", "--passband"}, description = "Read the file as a passband")
    private boolean passband;

    @Option(names = {"--area"}, description = "Collecting area in cm2")
    private Double area;

    @Override
    public Integer call() throws Exception {
        if (!inputFile.exists()) {
            System.err.println("Error: File not found: " + inputFile);
            return 1;
        }

        Spectrum spectrum;
        try {
            spectrum = SpectrumFiles.read(inputFile.toPath(),
                passband ? SpectrumKind.PASSBAND : SpectrumKind.SOURCE, area);
        } catch (Exception e) {
            System.err.println("Error reading file: " + e.getMessage());
            return 1;
        }

        System.out.println("=== Spectrum Information ===");
        System.out.println("File: " + inputFile.getAbsolutePath());
        System.out.println("Type: " + spectrum.getKind().getTypeName());
        System.out.println("Expression: " + spectrum.getExpr());
        if (spectrum.hasArea()) {
            System.out.printf("Area: %.4g cm2%n", spectrum.getArea());
        }

        System.out.println();
        System.out.println("=== Data Summary ===");
        System.out.println("Points: " + spectrum.size());
        System.out.printf("Wavelength: %.6g - %.6g %s (%s)%n",
            spectrum.getWave().getMin(), spectrum.getWave().getMax(), spectrum.getWaveUnit(),
            spectrum.getWave().isAscending() ? "ascending" : "descending");
        System.out.println("Flux unit: " + spectrum.getFluxUnit());
        System.out.printf("Integrated: %.6g %s %s%n",
            spectrum.integrate(), spectrum.getFluxUnit(), spectrum.getWaveUnit());

        if (!spectrum.getMetadata().getExtras().isEmpty()) {
            System.out.println();
            System.out.println("=== Header ===");
            for (Map.Entry<String, String> entry : spectrum.getMetadata().getExtras().entrySet()) {
                System.out.printf("  %s = %s%n", entry.getKey(), entry.getValue());
            }
        }

        if (!spectrum.getWarnings().isEmpty()) {
            System.out.println();
            System.out.println("=== Warnings ===");
            for (Map.Entry<String, String> entry : spectrum.getWarnings().entrySet()) {
                System.out.printf("  %s: %s%n", entry.getKey(), entry.getValue());
            }
        }

        return 0;
    }
}
