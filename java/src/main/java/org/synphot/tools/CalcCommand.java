package org.synphot.tools;

import org.synphot.core.ArithmeticOperator;
import org.synphot.core.Spectrum;
import org.synphot.core.SpectrumKind;
import org.synphot.io.SpectrumFiles;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Combine a spectrum with another spectrum or a number.
 */
@Command(
    name = "calc",
    description = "Add, subtract, multiply or divide spectra"
)
public class CalcCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Left operand file")
    private File leftFile;

    @Parameters(index = "1", description = "Operator: + - * /")
    private String operator;

    @Parameters(index = "2", description = "Right operand: file or number")
    private String right;

    @Parameters(index = "3", description = "Output file")
    private File outputFile;

    @Option(names = {"--left-passband"}, description = "Read the left operand as a passband")
    private boolean leftPassband;

    @Option(names = {"--right-passband"}, description = "Read the right operand as a passband")
    private boolean rightPassband;

    @Option(names = {"--area"}, description = "Collecting area in cm2 for both operands")
    private Double area;

    @Override
    public Integer call() throws Exception {
        if (!leftFile.exists()) {
            System.err.println("Error: Input file not found: " + leftFile);
            return 1;
        }

        Spectrum result;
        try {
            ArithmeticOperator op = ArithmeticOperator.fromSymbol(operator);
            Spectrum left = SpectrumFiles.read(leftFile.toPath(), kind(leftPassband), area);

            Double scalar = parseNumber(right);
            if (scalar != null) {
                result = apply(left, scalar, op);
            } else {
                Path rightPath = Path.of(right);
                if (!rightPath.toFile().exists()) {
                    System.err.println("Error: Input file not found: " + right);
                    return 1;
                }
                result = apply(left, SpectrumFiles.read(rightPath, kind(rightPassband), area), op);
            }
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }

        try {
            SpectrumFiles.write(outputFile.toPath(), result);
        } catch (Exception e) {
            System.err.println("Error writing file: " + e.getMessage());
            return 1;
        }

        System.out.printf("Wrote %s with %d points to %s%n", result.getKind().getTypeName(), result.size(), outputFile);
        return 0;
    }

    private static Spectrum apply(Spectrum left, Spectrum right, ArithmeticOperator op) {
        switch (op) {
            case ADD: return left.add(right);
            case SUBTRACT: return left.subtract(right);
            case MULTIPLY: return left.multiply(right);
            case DIVIDE: return left.divide(right);
            default: throw new IllegalStateException("Unhandled operator " + op);
        }
    }

    private static Spectrum apply(Spectrum left, double right, ArithmeticOperator op) {
        switch (op) {
            case ADD: return left.add(right);
            case SUBTRACT: return left.subtract(right);
            case MULTIPLY: return left.multiply(right);
            case DIVIDE: return left.divide(right);
            default: throw new IllegalStateException("Unhandled operator " + op);
        }
    }

    private static SpectrumKind kind(boolean passband) {
        return passband ? SpectrumKind.PASSBAND : SpectrumKind.SOURCE;
    }

    private static Double parseNumber(String text) {
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
