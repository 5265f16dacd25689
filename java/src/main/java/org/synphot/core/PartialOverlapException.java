package org.synphot.core;

/**
 * Spectrum covers too little of a passband. Renormalization may be forced.
 */
public class PartialOverlapException extends SynphotException {

    public PartialOverlapException(String message) {
        super(message);
    }
}
