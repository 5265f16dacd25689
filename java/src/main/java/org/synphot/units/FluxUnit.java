package org.synphot.units;

import org.synphot.core.SynphotException;

/**
 * Units for the value axis of a spectrum.
 */
public enum FluxUnit {
    PHOTLAM("PHOTLAM", FluxKind.DENSITY, true),     // photon / (s cm2 Angstrom)
    PHOTNU("PHOTNU", FluxKind.DENSITY, true),       // photon / (s cm2 Hz)
    FLAM("FLAM", FluxKind.DENSITY, false),          // erg / (s cm2 Angstrom)
    FNU("FNU", FluxKind.DENSITY, false),            // erg / (s cm2 Hz)
    JY("Jy", FluxKind.DENSITY, false),
    MJY("mJy", FluxKind.DENSITY, false),
    COUNT("count", FluxKind.COUNT, false),
    OBMAG("OBMAG", FluxKind.MAGNITUDE, false),
    STMAG("STMAG", FluxKind.MAGNITUDE, false),
    ABMAG("ABMAG", FluxKind.MAGNITUDE, false),
    VEGAMAG("VEGAMAG", FluxKind.MAGNITUDE, false),
    THROUGHPUT("THROUGHPUT", FluxKind.DIMENSIONLESS, false);

    private final String symbol;
    private final FluxKind kind;
    private final boolean legacy;

    FluxUnit(String symbol, FluxKind kind, boolean legacy) {
        this.symbol = symbol;
        this.kind = kind;
        this.legacy = legacy;
    }

    public String getSymbol() { return symbol; }
    public FluxKind getKind() { return kind; }

    /**
     * Historical photon units without a standard physical type. They are
     * only ever interpreted as flux densities.
     */
    public boolean isLegacy() { return legacy; }

    public boolean isMagnitude() {
        return kind == FluxKind.MAGNITUDE;
    }

    public boolean isDimensionless() {
        return kind == FluxKind.DIMENSIONLESS;
    }

    public boolean isDensity() {
        return kind == FluxKind.DENSITY;
    }

    /**
     * Units that renormalize against a discrete photon count rather than an
     * integrated flux.
     */
    public boolean isCountLike() {
        return this == COUNT || this == OBMAG;
    }

    public static FluxUnit fromName(String name) {
        if (name == null) {
            throw new SynphotException("Flux unit is missing");
        }
        String trimmed = name.trim();
        for (FluxUnit u : values()) {
            if (u.symbol.equalsIgnoreCase(trimmed) || u.name().equalsIgnoreCase(trimmed)) return u;
        }
        if (trimmed.equalsIgnoreCase("counts") || trimmed.equalsIgnoreCase("ct")) return COUNT;
        if (trimmed.isEmpty() || trimmed.equalsIgnoreCase("dimensionless")) return THROUGHPUT;
        throw new SynphotException(trimmed + " is not a valid flux unit");
    }

    @Override
    public String toString() {
        return symbol;
    }
}
