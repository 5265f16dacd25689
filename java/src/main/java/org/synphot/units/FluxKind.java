package org.synphot.units;

/**
 * Kind of quantity carried by a flux unit.
 */
public enum FluxKind {
    DENSITY,        // linear flux density
    COUNT,          // detector counts, needs a collecting area
    MAGNITUDE,      // logarithmic flux scale
    DIMENSIONLESS   // throughput
}
