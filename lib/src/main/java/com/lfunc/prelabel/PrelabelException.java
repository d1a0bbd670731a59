package com.lfunc.prelabel;

/**
 * Checked exception signalling that a record cannot be labeled. Subclasses name the stage that
 * rejected the record; callers of the per-record pipeline decide whether to skip or abort.
 */
public class PrelabelException extends Exception {
    public PrelabelException(String message) {
        super(message);
    }

    public PrelabelException(String message, Throwable cause) {
        super(message, cause);
    }
}
