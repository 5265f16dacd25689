package org.synphot.analytic;

import org.junit.jupiter.api.Test;
import org.synphot.core.Spectrum;
import org.synphot.core.SynphotException;
import org.synphot.core.WaveGrid;
import org.synphot.units.FluxConverter;
import org.synphot.units.FluxUnit;

import static org.assertj.core.api.Assertions.*;

class FlatSpectrumTest {

    private static final WaveGrid GRID = WaveGrid.of(4000, 5000, 6000);

    @Test
    void zeroPointAmplitude() {
        assertThat(FlatSpectrum.of(FluxUnit.FLAM).getAmplitude()).isEqualTo(1.0);
        assertThat(FlatSpectrum.of(FluxUnit.ABMAG).getAmplitude()).isEqualTo(0.0);
    }

    @Test
    void densityUnitIsKept() {
        Spectrum sp = FlatSpectrum.of(FluxUnit.FNU).toSpectrum(GRID, null);

        assertThat(sp.getFluxUnit()).isEqualTo(FluxUnit.FNU);
        assertThat(sp.getValues()).containsOnly(1.0);
        assertThat(sp.getExpr()).isEqualTo("Flat(1.0 FNU)");
    }

    @Test
    void magnitudeIsExpressedInPhotlam() {
        Spectrum sp = FlatSpectrum.of(FluxUnit.STMAG).toSpectrum(GRID, null);

        assertThat(sp.getFluxUnit()).isEqualTo(FluxUnit.PHOTLAM);
        double[] back = FluxConverter.convert(sp.getWaveValues(), sp.getWaveUnit(), sp.getValues(),
            FluxUnit.PHOTLAM, FluxUnit.STMAG, null);
        assertThat(back).containsExactly(new double[]{0, 0, 0}, within(1e-9));
    }

    @Test
    void countsNeedArea() {
        assertThatThrownBy(() -> FlatSpectrum.of(FluxUnit.COUNT).toSpectrum(GRID, null))
            .isInstanceOf(SynphotException.class);
        assertThat(FlatSpectrum.of(FluxUnit.COUNT).toSpectrum(GRID, 10.0).getArea()).isEqualTo(10.0);
    }

    @Test
    void rejectsUnitsWithoutZeroPoint() {
        assertThatThrownBy(() -> FlatSpectrum.of(FluxUnit.VEGAMAG)).isInstanceOf(SynphotException.class);
        assertThatThrownBy(() -> FlatSpectrum.of(FluxUnit.THROUGHPUT)).isInstanceOf(SynphotException.class);
        assertThatThrownBy(() -> new FlatSpectrum(Double.NaN, FluxUnit.FLAM)).isInstanceOf(SynphotException.class);
    }
}
