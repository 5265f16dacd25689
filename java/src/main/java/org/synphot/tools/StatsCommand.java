package org.synphot.tools;

import org.synphot.core.PassbandStatistics;
import org.synphot.core.PassbandSummary;
import org.synphot.core.Spectrum;
import org.synphot.io.SpectrumFiles;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.util.concurrent.Callable;

/**
 * Print the photometric properties of a passband.
 */
@Command(
    name = "stats",
    description = "Compute passband statistics"
)
public class StatsCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Passband file")
    private File bandFile;

    @Option(names = {"--area"}, description = "Collecting area in cm2, enables unit response")
    private Double area;

    @Option(names = {"-t", "--threshold"}, description = "Throughput threshold for the width statistics")
    private Double threshold;

    @Override
    public Integer call() throws Exception {
        if (!bandFile.exists()) {
            System.err.println("Error: File not found: " + bandFile);
            return 1;
        }

        PassbandStatistics stats;
        PassbandSummary summary;
        try {
            Spectrum band = SpectrumFiles.readPassband(bandFile.toPath(), area);
            stats = new PassbandStatistics(band);
            summary = stats.summary();
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }

        String unit = summary.getWaveUnit().getSymbol();
        System.out.println("=== Passband Statistics ===");
        System.out.println("File: " + bandFile.getAbsolutePath());
        System.out.printf("Pivot wavelength: %.4f %s%n", summary.getPivot(), unit);
        System.out.printf("Average wavelength: %.4f %s%n", summary.getAvgWave(), unit);
        System.out.printf("Barlam: %.4f %s%n", summary.getBarlam(), unit);
        System.out.printf("Peak throughput: %.6f at %.4f %s%n", summary.getTpeak(), summary.getWpeak(), unit);
        System.out.printf("Throughput at average wavelength: %.6f%n", summary.getTlambda());
        System.out.printf("Equivalent width: %.4f %s%n", summary.getEquivWidth(), unit);
        System.out.printf("Rectangular width: %.4f %s%n", summary.getRectWidth(), unit);
        System.out.printf("Efficiency: %.6f%n", summary.getEfficiency());

        try {
            System.out.printf("RMS width: %.4f %s%n", stats.rmsWidth(threshold), unit);
            System.out.printf("Photometric bandwidth: %.4f %s%n", stats.photbw(threshold), unit);
            System.out.printf("FWHM: %.4f %s%n", stats.fwhm(threshold), unit);
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }

        if (summary.getUnitResponse() != null) {
            System.out.printf("Unit response: %.6e FLAM%n", summary.getUnitResponse());
            System.out.printf("Equivalent monochromatic flux: %.6e FLAM%n", summary.getEmflx());
        }
        return 0;
    }
}
