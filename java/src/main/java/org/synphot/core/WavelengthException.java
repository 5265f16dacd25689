package org.synphot.core;

/**
 * Invalid wavelength array. Carries the offending row indices.
 */
public class WavelengthException extends SynphotException {
    private final int[] rows;

    public WavelengthException(String message, int[] rows) {
        super(message);
        this.rows = rows.clone();
    }

    public int[] getRows() { return rows.clone(); }
}
