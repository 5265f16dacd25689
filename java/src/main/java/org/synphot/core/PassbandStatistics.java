package org.synphot.core;

import org.synphot.units.PhysicalConstants;
import org.synphot.units.WaveUnit;

import java.util.*;

/**
 * Photometric properties of a passband, computed with the trapezoid rule.
 *
 * <p>Wavelength-valued results are in {@link #getWaveUnit()}: the passband's
 * own unit if it is a length, Angstrom otherwise.
 */
public class PassbandStatistics {
    private static final double FWHM_PER_SIGMA = Math.sqrt(8 * Math.log(2));

    private final Spectrum band;
    private final WaveGrid lengthGrid;
    private final double[] wave;
    private final double[] thru;

    public PassbandStatistics(Spectrum band) {
        if (band == null || !band.isPassband()) {
            throw new SynphotException("Passband statistics need a SpectralElement");
        }
        this.band = band;
        this.lengthGrid = band.getWave().toLength();
        this.wave = lengthGrid.getValues();
        this.thru = band.getValues();
    }

    public Spectrum getBand() { return band; }
    public WaveUnit getWaveUnit() { return lengthGrid.getUnit(); }

    /**
     * Flux density in FLAM that gives one photon per second through the band.
     *
     * @throws SynphotException if the passband has no collecting area
     */
    public double unitResponse() {
        if (!band.hasArea()) {
            throw new SynphotException("Area is undefined.");
        }
        double[] angstrom = band.getWave().to(WaveUnit.ANGSTROM).getValues();
        double integral = SpectrumUtils.trapezoid(angstrom, multiply(thru, angstrom));
        return PhysicalConstants.HC / (band.getArea() * integral);
    }

    /**
     * Pivot wavelength, or 0 if undefined.
     */
    public double pivot() {
        double num = SpectrumUtils.trapezoid(wave, multiply(thru, wave));
        double den = SpectrumUtils.trapezoid(wave, divide(thru, wave));
        return safeSqrt(num, den);
    }

    public double avgWave() {
        return SpectrumUtils.avgWavelength(wave, thru);
    }

    /**
     * Mean log wavelength, weighted by throughput over wavelength.
     */
    public double barlam() {
        return SpectrumUtils.barlam(wave, thru);
    }

    public double rmsWidth() {
        return rmsWidth(null);
    }

    /**
     * RMS width about the average wavelength.
     *
     * @param threshold bins with throughput below this are left out; null keeps all
     */
    public double rmsWidth(Double threshold) {
        double[][] kept = applyThreshold(threshold);
        double[] w = kept[0];
        double[] t = kept[1];

        double avg = avgWave();
        double[] y = new double[w.length];
        for (int i = 0; i < w.length; i++) {
            y[i] = (w[i] - avg) * (w[i] - avg) * t[i];
        }
        double num = SpectrumUtils.trapezoid(w, y);
        double den = SpectrumUtils.trapezoid(w, t);
        return safeSqrt(num, den);
    }

    public double photbw() {
        return photbw(null);
    }

    /**
     * Bandwidth as defined by the historical photometry package, the RMS of
     * {@code log(wave / barlam)} scaled by {@code barlam}.
     */
    public double photbw(Double threshold) {
        double avg = barlam();
        if (avg == 0) return 0;

        double[][] kept = applyThreshold(threshold);
        double[] w = kept[0];
        double[] t = kept[1];

        double[] numY = new double[w.length];
        for (int i = 0; i < w.length; i++) {
            double log = Math.log(w[i] / avg);
            numY[i] = t[i] * log * log / w[i];
        }
        double num = SpectrumUtils.trapezoid(w, numY);
        double den = SpectrumUtils.trapezoid(w, divide(t, w));
        return avg * safeSqrt(num, den);
    }

    public double fwhm() {
        return fwhm(null);
    }

    /**
     * FWHM of a gaussian with the {@link #photbw(Double)} width.
     */
    public double fwhm(Double threshold) {
        return FWHM_PER_SIGMA * photbw(threshold);
    }

    /**
     * Throughput at the average wavelength.
     */
    public double tlambda() {
        double avg = avgWave();
        if (avg <= 0) return 0;
        return band.resample(WaveGrid.of(new double[]{avg}, getWaveUnit()))[0];
    }

    public double tpeak() {
        return SpectrumUtils.max(thru);
    }

    /**
     * First wavelength where the throughput peaks.
     */
    public double wpeak() {
        double peak = tpeak();
        for (int i = 0; i < thru.length; i++) {
            if (thru[i] == peak) return wave[i];
        }
        throw new IllegalStateException("Peak throughput not found");
    }

    public double equivWidth() {
        return SpectrumUtils.trapezoid(wave, thru);
    }

    /**
     * Width of a rectangle with the peak throughput and the same area, or 0
     * if the peak is 0.
     */
    public double rectWidth() {
        double peak = tpeak();
        return peak == 0 ? 0 : equivWidth() / peak;
    }

    /**
     * Dimensionless efficiency, the integral of throughput over wavelength.
     */
    public double efficiency() {
        return SpectrumUtils.trapezoid(wave, divide(thru, wave));
    }

    /**
     * Equivalent monochromatic flux in FLAM, or 0 if the throughput at the
     * average wavelength is 0.
     */
    public double emflx() {
        double tLambda = tlambda();
        if (tLambda == 0) return 0;
        return unitResponse() * rectWidth() * (tpeak() / tLambda);
    }

    public PassbandSummary summary() {
        Double uresp = band.hasArea() ? unitResponse() : null;
        Double em = band.hasArea() ? emflx() : null;
        return new PassbandSummary(getWaveUnit(), uresp, pivot(), avgWave(), barlam(), rmsWidth(),
            photbw(), fwhm(), tlambda(), tpeak(), wpeak(), equivWidth(), rectWidth(), efficiency(), em);
    }

    private double[][] applyThreshold(Double threshold) {
        if (threshold == null) {
            return new double[][]{wave, thru};
        }
        if (!Double.isFinite(threshold)) {
            throw new SynphotException(threshold + " is not a valid threshold");
        }
        List<Double> w = new ArrayList<>();
        List<Double> t = new ArrayList<>();
        for (int i = 0; i < thru.length; i++) {
            if (thru[i] >= threshold) {
                w.add(wave[i]);
                t.add(thru[i]);
            }
        }
        return new double[][]{
            w.stream().mapToDouble(Double::doubleValue).toArray(),
            t.stream().mapToDouble(Double::doubleValue).toArray()
        };
    }

    private static double safeSqrt(double num, double den) {
        if (den == 0) return 0;
        double val = num / den;
        return val < 0 ? 0 : Math.sqrt(val);
    }

    private static double[] multiply(double[] a, double[] b) {
        double[] out = new double[a.length];
        for (int i = 0; i < a.length; i++) out[i] = a[i] * b[i];
        return out;
    }

    private static double[] divide(double[] a, double[] b) {
        double[] out = new double[a.length];
        for (int i = 0; i < a.length; i++) out[i] = a[i] / b[i];
        return out;
    }
}
