package org.synphot.core;

import java.util.*;

/**
 * Values accepted for a spectrum together with the non-fatal advisories
 * raised while checking them.
 */
public final class ValidationResult {
    private final double[] values;
    private final Map<String, String> warnings;

    ValidationResult(double[] values, Map<String, String> warnings) {
        this.values = values;
        this.warnings = Collections.unmodifiableMap(new LinkedHashMap<>(warnings));
    }

    public double[] getValues() { return values.clone(); }
    public Map<String, String> getWarnings() { return warnings; }
    public boolean hasWarnings() { return !warnings.isEmpty(); }

    double[] values() { return values; }
}
