package org.synphot.core;

import org.junit.jupiter.api.Test;
import org.synphot.units.FluxConverter;
import org.synphot.units.FluxUnit;
import org.synphot.units.WaveUnit;

import java.util.*;

import static org.assertj.core.api.Assertions.*;

class SpectrumArithmeticTest {

    private static final double[] WAVE = {1000, 2000, 3000};

    private static Spectrum source(double value) {
        return Spectrum.source(WAVE, new double[]{value, value, value});
    }

    private static Spectrum band(double value) {
        return Spectrum.passband(WAVE, new double[]{value, value, value});
    }

    private static Map<String, String> map(String... keyValues) {
        Map<String, String> m = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            m.put(keyValues[i], keyValues[i + 1]);
        }
        return m;
    }

    @Test
    void identityOperations() {
        Spectrum sp = Spectrum.source(WAVE, new double[]{1, 2, 3});

        assertThat(sp.add(0).getValues()).containsExactly(1, 2, 3);
        assertThat(sp.subtract(0).getValues()).containsExactly(1, 2, 3);
        assertThat(sp.multiply(1).getValues()).containsExactly(1, 2, 3);
        assertThat(sp.divide(1).getValues()).containsExactly(1, 2, 3);
        assertThat(sp.add(0).getWaveValues()).containsExactly(WAVE);
    }

    @Test
    void addOnMergedGrid() {
        Spectrum a = source(1);
        Spectrum b = Spectrum.source(new double[]{1500, 2500}, new double[]{2, 2});

        Spectrum sum = a.add(b);

        assertThat(sum.getWaveValues()).containsExactly(1000, 1500, 2000, 2500, 3000);
        assertThat(sum.getValues()).containsOnly(3.0);
    }

    @Test
    void additiveOperandIsConvertedToLeftUnit() {
        double[] photlam = FluxConverter.convert(WAVE, WaveUnit.ANGSTROM, new double[]{1, 1, 1},
            FluxUnit.FLAM, FluxUnit.PHOTLAM, null);
        Spectrum b = Spectrum.source(WAVE, WaveUnit.ANGSTROM, photlam, FluxUnit.PHOTLAM);

        Spectrum sum = source(1).add(b);

        assertThat(sum.getFluxUnit()).isEqualTo(FluxUnit.FLAM);
        assertThat(sum.getValues()).containsExactly(new double[]{2, 2, 2}, within(1e-9));
    }

    @Test
    void sourceTimesPassbandIsSource() {
        Spectrum product = source(2).multiply(band(0.5));

        assertThat(product.getKind()).isEqualTo(SpectrumKind.SOURCE);
        assertThat(product.getFluxUnit()).isEqualTo(FluxUnit.FLAM);
        assertThat(product.getValues()).containsExactly(1, 1, 1);
    }

    @Test
    void passbandTimesSourceIsSource() {
        Spectrum product = band(0.5).multiply(source(2));

        assertThat(product.getKind()).isEqualTo(SpectrumKind.SOURCE);
        assertThat(product.getValues()).containsExactly(1, 1, 1);
    }

    @Test
    void passbandTimesPassbandIsPassband() {
        Spectrum product = band(0.5).multiply(band(0.5));

        assertThat(product.getKind()).isEqualTo(SpectrumKind.PASSBAND);
        assertThat(product.getValues()).containsExactly(0.25, 0.25, 0.25);
    }

    @Test
    void sourceDividedByPassband() {
        assertThat(source(2).divide(band(0.5)).getValues()).containsExactly(4, 4, 4);
    }

    @Test
    void incompatibleCombinationsAreRejected() {
        assertThatThrownBy(() -> source(1).multiply(source(1))).isInstanceOf(IncompatibleSourcesException.class);
        assertThatThrownBy(() -> source(1).divide(source(1))).isInstanceOf(IncompatibleSourcesException.class);
        assertThatThrownBy(() -> source(1).add(band(1))).isInstanceOf(IncompatibleSourcesException.class);
        assertThatThrownBy(() -> band(1).subtract(source(1))).isInstanceOf(IncompatibleSourcesException.class);
        assertThatThrownBy(() -> band(1).divide(source(1))).isInstanceOf(IncompatibleSourcesException.class);
    }

    @Test
    void areasMustMatch() {
        Spectrum withArea = Spectrum.builder(SpectrumKind.SOURCE)
            .wavelengths(WAVE, WaveUnit.ANGSTROM)
            .values(new double[]{1, 1, 1}, FluxUnit.FLAM)
            .area(10.0)
            .build();

        assertThatThrownBy(() -> withArea.add(source(1)))
            .isInstanceOf(IncompatibleSourcesException.class)
            .hasMessageContaining("Areas");
        assertThat(withArea.multiply(2).getArea()).isEqualTo(10.0);
    }

    @Test
    void nonFiniteScalarIsRejected() {
        assertThatThrownBy(() -> source(1).multiply(Double.NaN)).isInstanceOf(IncompatibleSourcesException.class);
        assertThatThrownBy(() -> source(1).add(Double.POSITIVE_INFINITY))
            .isInstanceOf(IncompatibleSourcesException.class);
    }

    @Test
    void leftMetadataWinsAndLabelIsReset() {
        Spectrum left = Spectrum.builder(SpectrumKind.SOURCE)
            .wavelengths(WAVE, WaveUnit.ANGSTROM)
            .values(new double[]{1, 1, 1}, FluxUnit.FLAM)
            .metadata(Metadata.of("left", map("a", "1", "shared", "left")))
            .build();
        Spectrum right = Spectrum.builder(SpectrumKind.SOURCE)
            .wavelengths(WAVE, WaveUnit.ANGSTROM)
            .values(new double[]{1, 1, 1}, FluxUnit.FLAM)
            .metadata(Metadata.of("right", map("b", "2", "shared", "right")))
            .build();

        Spectrum sum = left.add(right);

        assertThat(sum.getExpr()).isEqualTo("SourceSpectrum");
        assertThat(sum.getMetadata().getExtras())
            .containsOnly(entry("a", "1"), entry("b", "2"), entry("shared", "left"));
    }

    @Test
    void scalarKeepsLeftMetadata() {
        Spectrum left = Spectrum.builder(SpectrumKind.SOURCE)
            .wavelengths(WAVE, WaveUnit.ANGSTROM)
            .values(new double[]{1, 1, 1}, FluxUnit.FLAM)
            .metadata(Metadata.of("left", map("a", "1")))
            .build();

        assertThat(left.multiply(3).getMetadata().getExtras()).containsOnly(entry("a", "1"));
    }

    @Test
    void resultDoesNotInheritWarnings() {
        Spectrum clamped = Spectrum.source(WAVE, new double[]{-1, 1, 1});
        assertThat(clamped.getWarnings()).isNotEmpty();

        assertThat(clamped.add(source(2)).getWarnings()).isEmpty();
    }

    @Test
    void negativeResultIsClamped() {
        Spectrum diff = source(1).subtract(5);

        assertThat(diff.getValues()).containsOnly(0.0);
        assertThat(diff.getWarnings()).containsKey(SpectrumValidator.NEGATIVE_FLUX);
    }

    @Test
    void operandsAreNotModified() {
        Spectrum a = source(1);
        Spectrum b = Spectrum.source(new double[]{1500, 2500}, new double[]{2, 2});

        a.add(b);

        assertThat(a.getWaveValues()).containsExactly(WAVE);
        assertThat(b.getValues()).containsExactly(2, 2);
    }

    @Test
    void operatorLookup() {
        assertThat(ArithmeticOperator.fromSymbol("+")).isEqualTo(ArithmeticOperator.ADD);
        assertThat(ArithmeticOperator.fromSymbol("/")).isEqualTo(ArithmeticOperator.DIVIDE);
        assertThat(ArithmeticOperator.fromSymbol("multiply")).isEqualTo(ArithmeticOperator.MULTIPLY);
        assertThatThrownBy(() -> ArithmeticOperator.fromSymbol("%")).isInstanceOf(SynphotException.class);
    }
}
