package org.synphot.core;

import java.util.*;

/**
 * Array helpers shared by spectra: wavelength validation, merging,
 * trapezoid integration and throughput-weighted means.
 */
public final class SpectrumUtils {

    private SpectrumUtils() {
    }

    /**
     * Check that wavelengths are strictly monotonic, positive and finite.
     *
     * @throws UnsortedWavelengthException  if not monotonic
     * @throws ZeroWavelengthException      if a value is zero, negative or infinite
     * @throws DuplicateWavelengthException if a value repeats
     */
    public static void validateWavelengths(double[] wave) {
        double[] sorted = wave.clone();
        Arrays.sort(sorted);

        if (!Arrays.equals(sorted, wave) && !isReverseOf(sorted, wave)) {
            List<Integer> rows = new ArrayList<>();
            for (int i = 0; i < wave.length; i++) {
                if (Double.compare(sorted[i], wave[i]) != 0) rows.add(i);
            }
            throw new UnsortedWavelengthException("Wavelength array is not monotonic", toArray(rows));
        }

        List<Integer> nonPositive = new ArrayList<>();
        for (int i = 0; i < wave.length; i++) {
            if (!(wave[i] > 0) || Double.isInfinite(wave[i])) nonPositive.add(i);
        }
        if (!nonPositive.isEmpty()) {
            throw new ZeroWavelengthException(
                "Negative, zero or infinite wavelength occurs in wavelength array", toArray(nonPositive));
        }

        List<Integer> duplicates = new ArrayList<>();
        for (int i = 1; i < sorted.length; i++) {
            if (sorted[i] == sorted[i - 1]) duplicates.add(i - 1);
        }
        if (!duplicates.isEmpty()) {
            throw new DuplicateWavelengthException(
                "Wavelength array contains duplicate entries", toArray(duplicates));
        }
    }

    private static boolean isReverseOf(double[] sorted, double[] wave) {
        int n = wave.length;
        for (int i = 0; i < n; i++) {
            if (Double.compare(sorted[n - 1 - i], wave[i]) != 0) return false;
        }
        return true;
    }

    private static int[] toArray(List<Integer> rows) {
        return rows.stream().mapToInt(Integer::intValue).toArray();
    }

    public static boolean isAscending(double[] wave) {
        return wave.length < 2 || wave[0] < wave[wave.length - 1];
    }

    public static double[] reverse(double[] values) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[values.length - 1 - i];
        }
        return out;
    }

    public static double min(double[] values) {
        double m = Double.POSITIVE_INFINITY;
        for (double v : values) if (v < m) m = v;
        return m;
    }

    public static double max(double[] values) {
        double m = Double.NEGATIVE_INFINITY;
        for (double v : values) if (v > m) m = v;
        return m;
    }

    /**
     * Union of two wavelength sets, in the same unit.
     */
    public static double[] mergeWavelengths(double[] a, double[] b, MergeOptions options) {
        if (a == null && b == null) {
            throw new SynphotException("No wavelengths to merge");
        }
        TreeSet<Double> union = new TreeSet<>();
        if (a != null) for (double w : a) union.add(w);
        if (b != null) for (double w : b) union.add(w);

        if (options.isOverlapOnly() && a != null && b != null) {
            double low = Math.max(min(a), min(b));
            double high = Math.min(max(a), max(b));
            if (low > high) {
                throw new SynphotException("Wavelength sets do not overlap");
            }
            union = new TreeSet<>(union.subSet(low, true, high, true));
        }

        double[] sorted = union.stream().mapToDouble(Double::doubleValue).toArray();
        if (sorted.length == 0) {
            throw new SynphotException("No wavelengths to merge");
        }

        // Drop points too close to their successor
        List<Double> kept = new ArrayList<>();
        for (int i = 0; i < sorted.length - 1; i++) {
            if (sorted[i + 1] - sorted[i] > options.getThreshold()) kept.add(sorted[i]);
        }
        kept.add(sorted[sorted.length - 1]);

        double[] merged = kept.stream().mapToDouble(Double::doubleValue).toArray();
        return options.isDescending() ? reverse(merged) : merged;
    }

    /**
     * Trapezoid rule. The result is positive for a positive integrand,
     * whichever direction {@code x} runs in.
     */
    public static double trapezoid(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new SynphotException("x and y arrays must have same length");
        }
        if (x.length < 2) return 0;

        double area = 0;
        for (int i = 1; i < x.length; i++) {
            area += 0.5 * (y[i] + y[i - 1]) * (x[i] - x[i - 1]);
        }
        return x[x.length - 1] < x[0] ? -area : area;
    }

    /**
     * @throws SynphotException unless the flux is finite and positive
     */
    public static void validateTotalFlux(double totalFlux) {
        if (Double.isNaN(totalFlux)) {
            throw new SynphotException("Integrated flux is NaN");
        }
        if (Double.isInfinite(totalFlux)) {
            throw new SynphotException("Integrated flux is infinite");
        }
        if (totalFlux <= 0) {
            throw new SynphotException("Integrated flux is <= 0");
        }
    }

    /**
     * Throughput-weighted mean wavelength, or 0 for a zero throughput.
     */
    public static double avgWavelength(double[] wave, double[] thru) {
        double[] weighted = new double[wave.length];
        for (int i = 0; i < wave.length; i++) weighted[i] = thru[i] * wave[i];

        double num = trapezoid(wave, weighted);
        double den = trapezoid(wave, thru);
        return den == 0 ? 0 : num / den;
    }

    /**
     * Mean log wavelength weighted by {@code thru / wave}, or 0 if undefined.
     */
    public static double barlam(double[] wave, double[] thru) {
        double[] numY = new double[wave.length];
        double[] denY = new double[wave.length];
        for (int i = 0; i < wave.length; i++) {
            numY[i] = thru[i] * Math.log(wave[i]) / wave[i];
            denY[i] = thru[i] / wave[i];
        }
        double num = trapezoid(wave, numY);
        double den = trapezoid(wave, denY);
        if (num == 0 || den == 0) return 0;
        return Math.exp(num / den);
    }
}
