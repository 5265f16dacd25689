package org.synphot.core;

import org.junit.jupiter.api.Test;
import org.synphot.units.FluxUnit;
import org.synphot.units.WaveUnit;

import static org.assertj.core.api.Assertions.*;

class SpectrumHandleTest {

    @Test
    void conversionsReplaceHeldSpectrum() {
        Spectrum original = Spectrum.source(new double[]{1000, 2000}, new double[]{1, 1});
        SpectrumHandle handle = new SpectrumHandle(original);

        handle.convertWave(WaveUnit.NANOMETER);
        handle.convertFlux(FluxUnit.PHOTLAM);

        assertThat(handle.get().getWaveUnit()).isEqualTo(WaveUnit.NANOMETER);
        assertThat(handle.get().getFluxUnit()).isEqualTo(FluxUnit.PHOTLAM);
        assertThat(original.getWaveUnit()).isEqualTo(WaveUnit.ANGSTROM);
        assertThat(original.getFluxUnit()).isEqualTo(FluxUnit.FLAM);
    }

    @Test
    void failedConversionLeavesSpectrumUntouched() {
        Spectrum original = Spectrum.source(new double[]{1000, 2000}, new double[]{1, 1});
        SpectrumHandle handle = new SpectrumHandle(original);

        assertThatThrownBy(() -> handle.convertFlux(FluxUnit.THROUGHPUT)).isInstanceOf(SynphotException.class);
        assertThat(handle.get()).isSameAs(original);
    }

    @Test
    void taperInPlace() {
        SpectrumHandle handle = new SpectrumHandle(Spectrum.passband(new double[]{2000, 3000}, new double[]{1, 1}));

        handle.taper();

        assertThat(handle.get().size()).isEqualTo(4);
        assertThat(handle.get().getValueAt(0)).isEqualTo(0.0);
    }

    @Test
    void requiresSpectrum() {
        assertThatThrownBy(() -> new SpectrumHandle(null)).isInstanceOf(SynphotException.class);
    }
}
