package org.synphot.core;

public class ZeroWavelengthException extends WavelengthException {

    public ZeroWavelengthException(String message, int[] rows) {
        super(message, rows);
    }
}
