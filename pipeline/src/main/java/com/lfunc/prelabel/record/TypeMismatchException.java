package com.lfunc.prelabel.record;

import com.lfunc.prelabel.PrelabelException;

/** A field value cannot be converted to or from the type its column declares. */
public final class TypeMismatchException extends PrelabelException {
    private final String field;
    private final String rawValue;

    public TypeMismatchException(String field, String rawValue, String reason) {
        super("field '" + field + "' cannot hold '" + rawValue + "': " + reason);
        this.field = field;
        this.rawValue = rawValue;
    }

    public TypeMismatchException(String field, String rawValue, String reason, Throwable cause) {
        super("field '" + field + "' cannot hold '" + rawValue + "': " + reason, cause);
        this.field = field;
        this.rawValue = rawValue;
    }

    public String getField() {
        return field;
    }

    public String getRawValue() {
        return rawValue;
    }
}
