package org.synphot.core;

import org.synphot.units.FluxUnit;

/**
 * The two variants of spectrum. The variant decides which value units are
 * legal and which arithmetic combinations are allowed.
 */
public enum SpectrumKind {
    SOURCE("SourceSpectrum", FluxUnit.FLAM),
    PASSBAND("SpectralElement", FluxUnit.THROUGHPUT);

    private final String typeName;
    private final FluxUnit defaultUnit;

    SpectrumKind(String typeName, FluxUnit defaultUnit) {
        this.typeName = typeName;
        this.defaultUnit = defaultUnit;
    }

    /**
     * Name used as the default descriptive label of a spectrum.
     */
    public String getTypeName() { return typeName; }

    public FluxUnit getDefaultUnit() { return defaultUnit; }

    public boolean accepts(FluxUnit unit) {
        if (this == SOURCE) {
            return unit.isDensity();
        }
        return unit.isDimensionless();
    }

    /**
     * @throws SynphotException if {@code unit} is not legal for this variant
     */
    public void validateUnit(FluxUnit unit) {
        if (unit == null) {
            throw new SynphotException("Flux unit is missing");
        }
        if (accepts(unit)) return;
        if (this == SOURCE) {
            throw new SynphotException("Source spectrum cannot operate in " + unit
                + ", convert flux to PHOTLAM, PHOTNU, FLAM, FNU, or Jy first.");
        }
        throw new SynphotException("Throughput unit " + unit + " is not dimensionless");
    }
}
