package org.synphot.core;

import org.synphot.units.WaveUnit;

/**
 * Snapshot of all passband statistics. Unit response and equivalent
 * monochromatic flux are null when the passband has no collecting area.
 */
public final class PassbandSummary {
    private final WaveUnit waveUnit;
    private final Double unitResponse;
    private final double pivot;
    private final double avgWave;
    private final double barlam;
    private final double rmsWidth;
    private final double photbw;
    private final double fwhm;
    private final double tlambda;
    private final double tpeak;
    private final double wpeak;
    private final double equivWidth;
    private final double rectWidth;
    private final double efficiency;
    private final Double emflx;

    PassbandSummary(WaveUnit waveUnit, Double unitResponse, double pivot, double avgWave, double barlam,
                    double rmsWidth, double photbw, double fwhm, double tlambda, double tpeak, double wpeak,
                    double equivWidth, double rectWidth, double efficiency, Double emflx) {
        this.waveUnit = waveUnit;
        this.unitResponse = unitResponse;
        this.pivot = pivot;
        this.avgWave = avgWave;
        this.barlam = barlam;
        this.rmsWidth = rmsWidth;
        this.photbw = photbw;
        this.fwhm = fwhm;
        this.tlambda = tlambda;
        this.tpeak = tpeak;
        this.wpeak = wpeak;
        this.equivWidth = equivWidth;
        this.rectWidth = rectWidth;
        this.efficiency = efficiency;
        this.emflx = emflx;
    }

    public WaveUnit getWaveUnit() { return waveUnit; }
    public Double getUnitResponse() { return unitResponse; }
    public double getPivot() { return pivot; }
    public double getAvgWave() { return avgWave; }
    public double getBarlam() { return barlam; }
    public double getRmsWidth() { return rmsWidth; }
    public double getPhotbw() { return photbw; }
    public double getFwhm() { return fwhm; }
    public double getTlambda() { return tlambda; }
    public double getTpeak() { return tpeak; }
    public double getWpeak() { return wpeak; }
    public double getEquivWidth() { return equivWidth; }
    public double getRectWidth() { return rectWidth; }
    public double getEfficiency() { return efficiency; }
    public Double getEmflx() { return emflx; }

    @Override
    public String toString() {
        return String.format("PassbandSummary(pivot=%.4f %s, avgWave=%.4f, equivWidth=%.4f, tpeak=%.4f)",
            pivot, waveUnit, avgWave, equivWidth, tpeak);
    }
}
