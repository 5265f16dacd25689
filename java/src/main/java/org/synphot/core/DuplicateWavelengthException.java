package org.synphot.core;

public class DuplicateWavelengthException extends WavelengthException {

    public DuplicateWavelengthException(String message, int[] rows) {
        super(message, rows);
    }
}
