package org.synphot.core;

import java.util.*;

/**
 * Classifies how the wavelength range of one spectrum relates to another's.
 * Only wavelengths with non-zero values take part.
 */
public final class OverlapAnalyzer {

    private OverlapAnalyzer() {
    }

    /**
     * @param threshold if less than this fraction of {@code self}'s flux falls
     *                  outside {@code other}'s range, a partial overlap is
     *                  {@link OverlapStatus#PARTIAL_MOST}
     * @throws SynphotException if the threshold is not a finite number, or the
     *                          total flux of {@code self} is not positive when
     *                          the overlap is partial
     */
    public static OverlapStatus checkOverlap(Spectrum self, Spectrum other, double threshold) {
        if (!Double.isFinite(threshold)) {
            throw new SynphotException(threshold + " is not a valid threshold");
        }

        double[] a = nonZeroWave(self);
        double[] b = other.getWave().getUnit().convert(nonZeroWave(other), self.getWaveUnit());
        if (a.length == 0 || b.length == 0) {
            return OverlapStatus.NONE;
        }

        double aMin = SpectrumUtils.min(a), aMax = SpectrumUtils.max(a);
        double bMin = SpectrumUtils.min(b), bMax = SpectrumUtils.max(b);

        if (aMin >= bMin && aMax <= bMax) return OverlapStatus.FULL;
        if (aMax < bMin || bMax < aMin) return OverlapStatus.NONE;

        double totalFlux = self.integrate();
        SpectrumUtils.validateTotalFlux(totalFlux);

        double excluded = 0.0;
        if (aMin < bMin) {
            excluded += self.integrate(WaveGrid.of(new double[]{aMin, bMin}, self.getWaveUnit()));
        }
        if (aMax > bMax) {
            excluded += self.integrate(WaveGrid.of(new double[]{bMax, aMax}, self.getWaveUnit()));
        }

        return excluded / totalFlux < threshold ? OverlapStatus.PARTIAL_MOST : OverlapStatus.PARTIAL_NOTMOST;
    }

    private static double[] nonZeroWave(Spectrum spectrum) {
        List<Double> wave = new ArrayList<>();
        for (int i = 0; i < spectrum.size(); i++) {
            if (spectrum.getValueAt(i) != 0) wave.add(spectrum.getWave().get(i));
        }
        return wave.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
