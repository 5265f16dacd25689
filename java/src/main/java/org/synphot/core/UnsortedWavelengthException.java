package org.synphot.core;

public class UnsortedWavelengthException extends WavelengthException {

    public UnsortedWavelengthException(String message, int[] rows) {
        super(message, rows);
    }
}
