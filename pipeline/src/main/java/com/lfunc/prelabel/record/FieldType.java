package com.lfunc.prelabel.record;

import com.lfunc.prelabel.PrelabelException;
import com.lfunc.prelabel.gamma.GammaData;
import com.lfunc.prelabel.literal.LiteralParser;
import com.lfunc.prelabel.number.ExactReal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Text codec for one column type of a record line. Null handling ({@code \N}) belongs to
 * {@link RecordCodec}; the constants here only see present values.
 */
public enum FieldType {
    TEXT {
        @Override
        Object decodeValue(String field, String raw) {
            return raw;
        }

        @Override
        String encodeValue(String field, Object value) throws TypeMismatchException {
            String text = cast(field, value, String.class);
            if (text.indexOf(RecordCodec.DELIMITER) >= 0 || text.indexOf('\n') >= 0) {
                throw new TypeMismatchException(field, text, "text contains a field delimiter");
            }
            return text;
        }
    },
    BOOLEAN {
        @Override
        Object decodeValue(String field, String raw) throws TypeMismatchException {
            return switch (raw) {
                case "t", "true" -> Boolean.TRUE;
                case "f", "false" -> Boolean.FALSE;
                default -> throw new TypeMismatchException(field, raw, "not a boolean");
            };
        }

        @Override
        String encodeValue(String field, Object value) throws TypeMismatchException {
            return cast(field, value, Boolean.class) ? "t" : "f";
        }
    },
    SMALLINT {
        @Override
        Object decodeValue(String field, String raw) throws TypeMismatchException {
            return (int) smallint(field, raw);
        }

        @Override
        String encodeValue(String field, Object value) throws TypeMismatchException {
            return cast(field, value, Integer.class).toString();
        }
    },
    BIGINT {
        @Override
        Object decodeValue(String field, String raw) throws TypeMismatchException {
            try {
                return Long.parseLong(raw);
            } catch (NumberFormatException ex) {
                throw new TypeMismatchException(field, raw, "not a 64-bit integer", ex);
            }
        }

        @Override
        String encodeValue(String field, Object value) throws TypeMismatchException {
            return cast(field, value, Long.class).toString();
        }
    },
    /** Arbitrary-size integer held in a {@code numeric} column. */
    BIG_INTEGER {
        @Override
        Object decodeValue(String field, String raw) throws TypeMismatchException {
            return bigInteger(field, raw);
        }

        @Override
        String encodeValue(String field, Object value) throws TypeMismatchException {
            return cast(field, value, BigInteger.class).toString();
        }
    },
    /** Decimal literal kept exactly as written. */
    REAL_LITERAL {
        @Override
        Object decodeValue(String field, String raw) throws PrelabelException {
            return LiteralParser.parseReal(raw);
        }

        @Override
        String encodeValue(String field, Object value) throws TypeMismatchException {
            return cast(field, value, ExactReal.class).render();
        }
    },
    DOUBLE {
        @Override
        Object decodeValue(String field, String raw) throws TypeMismatchException {
            try {
                return Double.parseDouble(raw);
            } catch (NumberFormatException ex) {
                throw new TypeMismatchException(field, raw, "not a floating point number", ex);
            }
        }

        @Override
        String encodeValue(String field, Object value) throws TypeMismatchException {
            return cast(field, value, Double.class).toString();
        }
    },
    GAMMA_FACTORS {
        @Override
        Object decodeValue(String field, String raw) throws PrelabelException {
            return LiteralParser.parseGammaFactors(raw);
        }

        @Override
        String encodeValue(String field, Object value) throws TypeMismatchException {
            return cast(field, value, GammaData.class).render();
        }
    },
    SMALLINT_ARRAY {
        @Override
        Object decodeValue(String field, String raw) throws TypeMismatchException {
            List<Integer> values = new ArrayList<>();
            for (String element : elements(field, raw)) {
                values.add((int) smallint(field, element));
            }
            return List.copyOf(values);
        }

        @Override
        String encodeValue(String field, Object value) throws TypeMismatchException {
            return array(field, value, Integer.class);
        }
    },
    BIGINT_ARRAY {
        @Override
        Object decodeValue(String field, String raw) throws TypeMismatchException {
            List<BigInteger> values = new ArrayList<>();
            for (String element : elements(field, raw)) {
                values.add(bigInteger(field, element));
            }
            return List.copyOf(values);
        }

        @Override
        String encodeValue(String field, Object value) throws TypeMismatchException {
            return array(field, value, Number.class);
        }
    },
    NUMERIC_ARRAY {
        @Override
        Object decodeValue(String field, String raw) throws PrelabelException {
            List<ExactReal> values = new ArrayList<>();
            for (String element : elements(field, raw)) {
                values.add(LiteralParser.parseReal(element));
            }
            return List.copyOf(values);
        }

        @Override
        String encodeValue(String field, Object value) throws TypeMismatchException {
            List<?> list = cast(field, value, List.class);
            StringBuilder out = new StringBuilder("{");
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) {
                    out.append(',');
                }
                out.append(cast(field, list.get(i), ExactReal.class).render());
            }
            return out.append('}').toString();
        }
    };

    private static final Map<String, FieldType> BY_SQL_TYPE =
            Map.of(
                    "text", TEXT,
                    "boolean", BOOLEAN,
                    "smallint", SMALLINT,
                    "bigint", BIGINT,
                    "numeric", REAL_LITERAL,
                    "double precision", REAL_LITERAL,
                    "smallint[]", SMALLINT_ARRAY,
                    "bigint[]", BIGINT_ARRAY,
                    "numeric[]", NUMERIC_ARRAY);

    /** Columns whose values need a different codec than their SQL type alone implies. */
    private static final Map<String, FieldType> BY_NAME =
            Map.of(
                    "conductor", BIG_INTEGER,
                    "gamma_factors", GAMMA_FACTORS,
                    "analytic_conductor", DOUBLE);

    /**
     * Resolves the codec for a column.
     *
     * @throws UnsupportedFieldTypeException if neither the name nor the SQL type is known.
     */
    public static FieldType forColumn(String name, String sqlType) {
        FieldType byName = BY_NAME.get(name);
        if (byName != null) {
            return byName;
        }
        FieldType byType = BY_SQL_TYPE.get(sqlType.trim().toLowerCase(Locale.ROOT));
        if (byType == null) {
            throw new UnsupportedFieldTypeException(name, sqlType);
        }
        return byType;
    }

    public Object decode(String field, String raw) throws PrelabelException {
        return decodeValue(field, raw);
    }

    public String encode(String field, Object value) throws TypeMismatchException {
        return encodeValue(field, value);
    }

    abstract Object decodeValue(String field, String raw) throws PrelabelException;

    abstract String encodeValue(String field, Object value) throws TypeMismatchException;

    private static <T> T cast(String field, Object value, Class<T> type)
            throws TypeMismatchException {
        if (!type.isInstance(value)) {
            throw new TypeMismatchException(
                    field,
                    String.valueOf(value),
                    "expected " + type.getSimpleName() + " but got "
                            + value.getClass().getSimpleName());
        }
        return type.cast(value);
    }

    private static short smallint(String field, String raw) throws TypeMismatchException {
        try {
            return Short.parseShort(raw);
        } catch (NumberFormatException ex) {
            throw new TypeMismatchException(field, raw, "not a 16-bit integer", ex);
        }
    }

    private static BigInteger bigInteger(String field, String raw) throws TypeMismatchException {
        try {
            return new BigInteger(raw);
        } catch (NumberFormatException ex) {
            throw new TypeMismatchException(field, raw, "not an integer", ex);
        }
    }

    private static List<String> elements(String field, String raw) throws TypeMismatchException {
        if (raw.length() < 2 || raw.charAt(0) != '{' || raw.charAt(raw.length() - 1) != '}') {
            throw new TypeMismatchException(field, raw, "not an array literal");
        }
        String body = raw.substring(1, raw.length() - 1).trim();
        List<String> elements = new ArrayList<>();
        if (body.isEmpty()) {
            return elements;
        }
        for (String element : body.split(",", -1)) {
            elements.add(element.trim());
        }
        return elements;
    }

    private static String array(String field, Object value, Class<?> elementType)
            throws TypeMismatchException {
        List<?> list = cast(field, value, List.class);
        StringBuilder out = new StringBuilder("{");
        for (int i = 0; i < list.size(); i++) {
            if (i > 0) {
                out.append(',');
            }
            out.append(cast(field, list.get(i), elementType));
        }
        return out.append('}').toString();
    }
}
