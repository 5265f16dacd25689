package org.synphot.core;

/**
 * Relation between the wavelength ranges of two spectra.
 */
public enum OverlapStatus {
    FULL("full"),                       // within or same as the other range
    PARTIAL_MOST("partial_most"),       // lack of overlap is insignificant
    PARTIAL_NOTMOST("partial_notmost"),
    NONE("none");

    private final String label;

    OverlapStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
