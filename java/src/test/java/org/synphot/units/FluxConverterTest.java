package org.synphot.units;

import org.junit.jupiter.api.Test;
import org.synphot.core.SynphotException;

import static org.assertj.core.api.Assertions.*;

class FluxConverterTest {

    private static final double[] WAVE = {4000, 5000, 6000};

    @Test
    void flamToPhotlamDividesByPhotonEnergy() {
        double[] photlam = FluxConverter.convert(WAVE, WaveUnit.ANGSTROM, new double[]{1, 1, 1},
            FluxUnit.FLAM, FluxUnit.PHOTLAM, null);
        assertThat(photlam[1]).isCloseTo(5000 / PhysicalConstants.HC, withinPercentage(1e-10));
    }

    @Test
    void linearUnitsRoundTrip() {
        double[] flam = {1e-15, 2e-15, 3e-15};
        for (FluxUnit unit : new FluxUnit[]{FluxUnit.PHOTLAM, FluxUnit.PHOTNU, FluxUnit.FNU, FluxUnit.JY, FluxUnit.MJY}) {
            double[] there = FluxConverter.convert(WAVE, WaveUnit.ANGSTROM, flam, FluxUnit.FLAM, unit, null);
            double[] back = FluxConverter.convert(WAVE, WaveUnit.ANGSTROM, there, unit, FluxUnit.FLAM, null);
            for (int i = 0; i < flam.length; i++) {
                assertThat(back[i]).as(unit.name()).isCloseTo(flam[i], withinPercentage(1e-9));
            }
        }
    }

    @Test
    void conversionDoesNotDependOnWaveUnit() {
        double[] nm = {400, 500, 600};
        double[] a = FluxConverter.convert(WAVE, WaveUnit.ANGSTROM, new double[]{1, 1, 1},
            FluxUnit.FLAM, FluxUnit.FNU, null);
        double[] b = FluxConverter.convert(nm, WaveUnit.NANOMETER, new double[]{1, 1, 1},
            FluxUnit.FLAM, FluxUnit.FNU, null);
        assertThat(b[2]).isCloseTo(a[2], withinPercentage(1e-9));
    }

    @Test
    void stmagZeroPointIs21Point1() {
        double flam = Math.pow(10, -0.4 * 21.1);
        double[] mag = FluxConverter.convert(WAVE, WaveUnit.ANGSTROM, new double[]{flam, flam, flam},
            FluxUnit.FLAM, FluxUnit.STMAG, null);
        assertThat(mag).containsExactly(new double[]{0, 0, 0}, within(1e-9));
    }

    @Test
    void abmagOf3631JanskyIsNearZero() {
        double[] mag = FluxConverter.convert(WAVE, WaveUnit.ANGSTROM, new double[]{3631, 3631, 3631},
            FluxUnit.JY, FluxUnit.ABMAG, null);
        assertThat(mag[0]).isCloseTo(0.0, within(1e-3));
    }

    @Test
    void countsUseAreaAndBinWidth() {
        double[] counts = FluxConverter.convert(new double[]{1000, 2000, 3000}, WaveUnit.ANGSTROM,
            new double[]{1, 1, 1}, FluxUnit.PHOTLAM, FluxUnit.COUNT, 10.0);
        assertThat(counts).containsExactly(new double[]{10000, 10000, 10000}, within(1e-6));
    }

    @Test
    void countsWithoutAreaFail() {
        assertThatThrownBy(() -> FluxConverter.convert(WAVE, WaveUnit.ANGSTROM, new double[]{1, 1, 1},
            FluxUnit.PHOTLAM, FluxUnit.COUNT, null))
            .isInstanceOf(SynphotException.class)
            .hasMessageContaining("Area");
    }

    @Test
    void vegamagNeedsVegaFlux() {
        assertThatThrownBy(() -> FluxConverter.convert(WAVE, WaveUnit.ANGSTROM, new double[]{1, 1, 1},
            FluxUnit.PHOTLAM, FluxUnit.VEGAMAG, null))
            .isInstanceOf(SynphotException.class);

        double[] mag = FluxConverter.convert(WAVE, WaveUnit.ANGSTROM, new double[]{1, 1, 1},
            FluxUnit.PHOTLAM, FluxUnit.VEGAMAG, null, new double[]{1, 1, 1});
        assertThat(mag).containsExactly(new double[]{0, 0, 0}, within(1e-12));
    }

    @Test
    void throughputCannotBeConverted() {
        assertThatThrownBy(() -> FluxConverter.convert(WAVE, WaveUnit.ANGSTROM, new double[]{1, 1, 1},
            FluxUnit.THROUGHPUT, FluxUnit.FLAM, null))
            .isInstanceOf(SynphotException.class);
    }

    @Test
    void binEdgesMirrorOuterHalfWidths() {
        assertThat(FluxConverter.binEdges(new double[]{1, 2, 4}))
            .containsExactly(0.5, 1.5, 3.0, 5.0);
        assertThat(FluxConverter.binWidths(new double[]{4, 2, 1}))
            .containsExactly(2.0, 1.5, 1.0);
    }
}
