package com.lfunc.prelabel.record;

import com.lfunc.prelabel.PrelabelException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Converts between {@code |}-delimited text lines and field maps for one {@link RecordLayout}.
 * The marker {@code \N} stands for a null value in both directions.
 */
public final class RecordCodec {
    public static final char DELIMITER = '|';
    public static final String NULL_MARKER = "\\N";

    private final RecordLayout layout;

    public RecordCodec(RecordLayout layout) {
        this.layout = Objects.requireNonNull(layout, "layout");
    }

    public RecordLayout getLayout() {
        return layout;
    }

    /**
     * Splits a line into typed values keyed by column name, in column order.
     *
     * @throws TypeMismatchException if the field count differs from the layout or a value does not
     *     fit its column.
     * @throws com.lfunc.prelabel.literal.LiteralFormatException if a numeric or gamma literal is
     *     malformed.
     */
    public Map<String, Object> decode(String line) throws PrelabelException {
        String[] raw = line.split("\\|", -1);
        if (raw.length != layout.size()) {
            throw new TypeMismatchException(
                    layout.getName(),
                    line,
                    "expected " + layout.size() + " fields but found " + raw.length);
        }
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < raw.length; i++) {
            FieldDescriptor field = layout.getFields().get(i);
            if (NULL_MARKER.equals(raw[i])) {
                values.put(field.getName(), null);
            } else {
                values.put(field.getName(), field.getType().decode(field.getName(), raw[i]));
            }
        }
        return Collections.unmodifiableMap(values);
    }

    /** Joins the values of every layout column; absent or null values print as {@code \N}. */
    public String encode(Map<String, ?> values) throws TypeMismatchException {
        StringBuilder line = new StringBuilder();
        for (FieldDescriptor field : layout.getFields()) {
            if (field != layout.getFields().get(0)) {
                line.append(DELIMITER);
            }
            Object value = values.get(field.getName());
            line.append(
                    value == null
                            ? NULL_MARKER
                            : field.getType().encode(field.getName(), value));
        }
        return line.toString();
    }
}
