package com.lfunc.prelabel.literal;

import com.lfunc.prelabel.PrelabelException;

/** Raised when text is not a valid real or complex literal. */
public final class LiteralFormatException extends PrelabelException {
    private final String text;

    public LiteralFormatException(String text, String message) {
        super("'" + text + "' is not a valid literal: " + message);
        this.text = text;
    }

    public LiteralFormatException(String text, String message, Throwable cause) {
        super("'" + text + "' is not a valid literal: " + message, cause);
        this.text = text;
    }

    public String getText() {
        return text;
    }
}
