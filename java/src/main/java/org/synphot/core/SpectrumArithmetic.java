package org.synphot.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.synphot.units.FluxUnit;

import java.util.*;

/**
 * Binary operations between a spectrum and another spectrum or a scalar.
 *
 * <p>The result has the variant, units and area of the left operand. Its
 * metadata is the right operand's overlaid with the left's, with a fresh
 * label, and it starts without warnings.
 */
final class SpectrumArithmetic {
    private static final Logger log = LoggerFactory.getLogger(SpectrumArithmetic.class);

    private SpectrumArithmetic() {
    }

    static Spectrum apply(Spectrum left, Spectrum right, ArithmeticOperator op) {
        checkCompatible(left, right, op);

        WaveGrid merged = left.mergeWave(right);
        double[] a = left.resample(merged);
        double[] b;
        if (op.isAdditive()) {
            b = right.withFluxUnit(left.getFluxUnit()).resample(merged);
        } else {
            b = right.resample(merged);
        }

        double[] result = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            result[i] = op.apply(a[i], b[i]);
        }
        log.debug("{} {} {} on {} merged wavelengths", left.getExpr(), op, right.getExpr(), merged.size());

        return build(left, merged, result, left.getMetadata().mergeOver(right.getMetadata()));
    }

    static Spectrum apply(Spectrum left, double scalar, ArithmeticOperator op) {
        if (!Double.isFinite(scalar)) {
            throw new IncompatibleSourcesException(scalar + " is not a finite number");
        }
        double[] a = left.values();
        double[] result = new double[a.length];
        // Additive scalars are read in the left unit, multiplicative ones are bare numbers
        for (int i = 0; i < a.length; i++) {
            result[i] = op.apply(a[i], scalar);
        }
        return build(left, left.getWave(), result, left.getMetadata().mergeOver(null));
    }

    private static Spectrum build(Spectrum left, WaveGrid wave, double[] values, Metadata metadata) {
        return Spectrum.builder(left.getKind())
            .wavelengths(wave)
            .values(values, left.getFluxUnit())
            .area(left.getArea())
            .metadata(metadata)
            .build();
    }

    /**
     * @throws IncompatibleSourcesException if the operands cannot be combined with {@code op}
     */
    static void checkCompatible(Spectrum left, Spectrum right, ArithmeticOperator op) {
        if (!Objects.equals(left.getArea(), right.getArea())) {
            throw new IncompatibleSourcesException(String.format(
                "Areas covered by flux are not the same: %s, %s", left.getArea(), right.getArea()));
        }

        FluxUnit u1 = left.getFluxUnit();
        FluxUnit u2 = right.getFluxUnit();

        if (op == ArithmeticOperator.DIVIDE && !u2.isDimensionless()) {
            throw new IncompatibleSourcesException("The other spectrum must be dimensionless in / op");
        }
        if (op == ArithmeticOperator.MULTIPLY && !u1.isDimensionless() && !u2.isDimensionless()) {
            throw new IncompatibleSourcesException("One of the spectra must be dimensionless in * op");
        }
        if (op.isAdditive() && left.getKind() != right.getKind()) {
            throw new IncompatibleSourcesException(String.format("Cannot perform %s between %s and %s",
                op, left.getKind().getTypeName(), right.getKind().getTypeName()));
        }
        if ((u1.isMagnitude() && !u2.isDimensionless() && !u2.isMagnitude())
                || (!u1.isMagnitude() && u2.isMagnitude())) {
            throw new IncompatibleSourcesException("Operation between mag and linear flux is not allowed");
        }
    }
}
