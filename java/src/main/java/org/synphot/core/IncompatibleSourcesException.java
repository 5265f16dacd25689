package org.synphot.core;

/**
 * Two operands cannot be combined arithmetically.
 */
public class IncompatibleSourcesException extends SynphotException {

    public IncompatibleSourcesException(String message) {
        super(message);
    }
}
