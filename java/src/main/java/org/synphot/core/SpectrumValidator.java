package org.synphot.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.synphot.units.FluxUnit;

import java.util.*;

/**
 * Checks the values of a spectrum before it is built.
 */
public final class SpectrumValidator {
    private static final Logger log = LoggerFactory.getLogger(SpectrumValidator.class);

    public static final String NEGATIVE_FLUX = "NegativeFlux";

    private SpectrumValidator() {
    }

    /**
     * Validate values against a grid for the given variant.
     *
     * <p>Negative values are set to zero unless {@code unit} is a magnitude;
     * this is reported as a {@value #NEGATIVE_FLUX} warning and never fails.
     *
     * @throws SynphotException if the lengths differ or the unit is illegal
     */
    public static ValidationResult validate(SpectrumKind kind, WaveGrid wave, double[] values, FluxUnit unit) {
        if (wave.size() != values.length) {
            throw new SynphotException(String.format(
                "Fluxes expected to have length of %d but has length of %d", wave.size(), values.length));
        }
        kind.validateUnit(unit);

        double[] accepted = values.clone();
        Map<String, String> warnings = new LinkedHashMap<>();

        if (!unit.isMagnitude()) {
            int negative = 0;
            for (int i = 0; i < accepted.length; i++) {
                if (accepted[i] < 0) {
                    accepted[i] = 0.0;
                    negative++;
                }
            }
            if (negative > 0) {
                String message = String.format(
                    "%d of %d bins contained negative flux or throughput; they have been set to zero.",
                    negative, accepted.length);
                warnings.put(NEGATIVE_FLUX, message);
                log.warn(message);
            }
        }
        return new ValidationResult(accepted, warnings);
    }
}
