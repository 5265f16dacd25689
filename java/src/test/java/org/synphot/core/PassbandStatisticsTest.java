package org.synphot.core;

import org.junit.jupiter.api.Test;
import org.synphot.units.PhysicalConstants;
import org.synphot.units.WaveUnit;

import static org.assertj.core.api.Assertions.*;

class PassbandStatisticsTest {

    private static final Spectrum BOX = Spectrum.passband(new double[]{4000, 5000}, new double[]{1, 1});

    private static Spectrum withArea(Spectrum band, double area) {
        return Spectrum.builder(SpectrumKind.PASSBAND)
            .wavelengths(band.getWave())
            .values(band.getValues(), band.getFluxUnit())
            .area(area)
            .build();
    }

    @Test
    void boxFilterStatistics() {
        PassbandStatistics stats = new PassbandStatistics(BOX);

        assertThat(stats.getWaveUnit()).isEqualTo(WaveUnit.ANGSTROM);
        assertThat(stats.equivWidth()).isCloseTo(1000, within(1e-9));
        assertThat(stats.rectWidth()).isCloseTo(1000, within(1e-9));
        assertThat(stats.tpeak()).isEqualTo(1.0);
        assertThat(stats.wpeak()).isEqualTo(4000.0);
        assertThat(stats.avgWave()).isCloseTo(4500, within(1e-9));
        assertThat(stats.pivot()).isCloseTo(Math.sqrt(2e7), within(1e-6));
        assertThat(stats.efficiency()).isCloseTo(0.225, within(1e-12));
        assertThat(stats.tlambda()).isEqualTo(1.0);
        assertThat(stats.rmsWidth()).isCloseTo(500, within(1e-9));
    }

    @Test
    void barlamAndBandwidth() {
        PassbandStatistics stats = new PassbandStatistics(BOX);

        double num = 0.5 * (Math.log(4000) / 4000 + Math.log(5000) / 5000) * 1000;
        double expected = Math.exp(num / 0.225);
        assertThat(stats.barlam()).isCloseTo(expected, within(1e-6));
        assertThat(stats.photbw()).isPositive();
        assertThat(stats.fwhm()).isCloseTo(Math.sqrt(8 * Math.log(2)) * stats.photbw(), within(1e-9));
    }

    @Test
    void thresholdLeavesOutLowBins() {
        PassbandStatistics stats = new PassbandStatistics(BOX);

        assertThat(stats.rmsWidth(0.5)).isCloseTo(stats.rmsWidth(), within(1e-9));
        assertThat(stats.rmsWidth(2.0)).isEqualTo(0.0);
        assertThat(stats.photbw(2.0)).isEqualTo(0.0);
        assertThatThrownBy(() -> stats.rmsWidth(Double.NaN)).isInstanceOf(SynphotException.class);
    }

    @Test
    void unitResponseNeedsArea() {
        assertThatThrownBy(() -> new PassbandStatistics(BOX).unitResponse())
            .isInstanceOf(SynphotException.class)
            .hasMessageContaining("Area");

        PassbandStatistics stats = new PassbandStatistics(withArea(BOX, 100.0));
        double expected = PhysicalConstants.HC / (100.0 * 4.5e6);
        assertThat(stats.unitResponse()).isCloseTo(expected, withinPercentage(1e-9));
        assertThat(stats.emflx()).isCloseTo(expected * 1000, withinPercentage(1e-9));
    }

    @Test
    void frequencyGridIsMeasuredInAngstrom() {
        double[] hz = WaveUnit.ANGSTROM.convert(new double[]{4000, 5000}, WaveUnit.HERTZ);
        PassbandStatistics stats = new PassbandStatistics(
            Spectrum.passband(hz, WaveUnit.HERTZ, new double[]{1, 1}));

        assertThat(stats.getWaveUnit()).isEqualTo(WaveUnit.ANGSTROM);
        assertThat(stats.equivWidth()).isCloseTo(1000, within(1e-6));
        assertThat(stats.pivot()).isCloseTo(Math.sqrt(2e7), within(1e-6));
        assertThat(stats.tlambda()).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void lengthUnitIsKept() {
        PassbandStatistics stats = new PassbandStatistics(BOX.withWaveUnit(WaveUnit.NANOMETER));

        assertThat(stats.getWaveUnit()).isEqualTo(WaveUnit.NANOMETER);
        assertThat(stats.avgWave()).isCloseTo(450, within(1e-9));
    }

    @Test
    void summaryWithoutArea() {
        PassbandSummary summary = new PassbandStatistics(BOX).summary();

        assertThat(summary.getUnitResponse()).isNull();
        assertThat(summary.getEmflx()).isNull();
        assertThat(summary.getEquivWidth()).isCloseTo(1000, within(1e-9));
        assertThat(summary.toString()).contains("pivot=");
    }

    @Test
    void sourceIsRejected() {
        assertThatThrownBy(() -> new PassbandStatistics(Spectrum.source(new double[]{1, 2}, new double[]{1, 1})))
            .isInstanceOf(SynphotException.class);
    }
}
