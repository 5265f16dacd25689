package org.synphot.core;

/**
 * Base class for all spectrum errors. Also used directly for invalid
 * arguments and failed numeric preconditions.
 */
public class SynphotException extends IllegalArgumentException {

    public SynphotException(String message) {
        super(message);
    }

    public SynphotException(String message, Throwable cause) {
        super(message, cause);
    }
}
