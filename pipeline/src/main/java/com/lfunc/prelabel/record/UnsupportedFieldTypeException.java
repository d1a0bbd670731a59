package com.lfunc.prelabel.record;

/** A column declares a SQL type the codec has no {@link FieldType} for. */
public final class UnsupportedFieldTypeException extends IllegalStateException {
    public UnsupportedFieldTypeException(String field, String sqlType) {
        super("no codec for column '" + field + "' of type '" + sqlType + "'");
    }
}
