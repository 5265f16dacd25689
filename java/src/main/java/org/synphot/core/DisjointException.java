package org.synphot.core;

/**
 * Spectrum and passband do not overlap at all.
 */
public class DisjointException extends SynphotException {

    public DisjointException(String message) {
        super(message);
    }
}
