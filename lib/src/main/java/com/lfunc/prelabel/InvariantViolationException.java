package com.lfunc.prelabel;

/**
 * Raised when a record is structurally inconsistent, for instance when the degree does not match
 * the gamma-factor data. The record must not be labeled.
 */
public final class InvariantViolationException extends PrelabelException {
    public InvariantViolationException(String message) {
        super(message);
    }

    public InvariantViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
