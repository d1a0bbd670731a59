package com.lfunc.prelabel.record;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.lfunc.prelabel.literal.LiteralFormatException;
import com.lfunc.prelabel.number.ExactReal;
import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.Test;

final class FieldTypeTest {

    @Test
    void resolvesBySqlTypeAndColumnName() {
        assertEquals(FieldType.TEXT, FieldType.forColumn("origin", "text"));
        assertEquals(FieldType.SMALLINT, FieldType.forColumn("degree", "smallint"));
        assertEquals(FieldType.REAL_LITERAL, FieldType.forColumn("z1", "numeric"));
        assertEquals(FieldType.REAL_LITERAL, FieldType.forColumn("root_angle", "double precision"));
        assertEquals(FieldType.BIG_INTEGER, FieldType.forColumn("conductor", "numeric"));
        assertEquals(FieldType.GAMMA_FACTORS, FieldType.forColumn("gamma_factors", "jsonb"));
        assertEquals(FieldType.DOUBLE, FieldType.forColumn("analytic_conductor", "double precision"));
        assertEquals(FieldType.BIGINT_ARRAY, FieldType.forColumn("bad_primes", "bigint[]"));
    }

    @Test
    void unknownSqlTypeIsUnsupported() {
        assertThrows(
                UnsupportedFieldTypeException.class, () -> FieldType.forColumn("extra", "jsonb"));
        assertThrows(
                UnsupportedFieldTypeException.class, () -> FieldType.forColumn("when", "timestamp"));
    }

    @Test
    void decodesScalars() throws Exception {
        assertEquals(Boolean.TRUE, FieldType.BOOLEAN.decode("primitive", "t"));
        assertEquals(Boolean.FALSE, FieldType.BOOLEAN.decode("primitive", "f"));
        assertEquals(2, FieldType.SMALLINT.decode("degree", "2"));
        assertEquals(1234567890123L, FieldType.BIGINT.decode("id", "1234567890123"));
        assertEquals(
                new BigInteger("123456789012345678901234567890"),
                FieldType.BIG_INTEGER.decode("conductor", "123456789012345678901234567890"));
    }

    @Test
    void smallintIsRangeChecked() {
        TypeMismatchException ex =
                assertThrows(
                        TypeMismatchException.class, () -> FieldType.SMALLINT.decode("degree", "70000"));
        assertEquals("degree", ex.getField());
        assertEquals("70000", ex.getRawValue());
        assertThrows(TypeMismatchException.class, () -> FieldType.BOOLEAN.decode("algebraic", "yes"));
    }

    @Test
    void realLiteralsKeepTheirText() throws Exception {
        Object value = FieldType.REAL_LITERAL.decode("z1", "6.3626138947130800");
        assertEquals("6.3626138947130800", FieldType.REAL_LITERAL.encode("z1", value));
        assertThrows(LiteralFormatException.class, () -> FieldType.REAL_LITERAL.decode("z1", "NaN"));
    }

    @Test
    void arraysUseBraces() throws Exception {
        assertEquals(List.of(1, -2), FieldType.SMALLINT_ARRAY.decode("mu_real", "{1,-2}"));
        assertEquals(List.of(), FieldType.SMALLINT_ARRAY.decode("mu_real", "{}"));
        assertEquals("{1,-2}", FieldType.SMALLINT_ARRAY.encode("mu_real", List.of(1, -2)));
        assertEquals(
                "{2,3}",
                FieldType.BIGINT_ARRAY.encode(
                        "bad_primes", List.of(BigInteger.TWO, BigInteger.valueOf(3))));
        assertEquals(
                "{-4,0.5}",
                FieldType.NUMERIC_ARRAY.encode(
                        "mu_imag", List.of(ExactReal.of(-4), ExactReal.ofLiteral("0.5", 53))));
        assertThrows(
                TypeMismatchException.class, () -> FieldType.SMALLINT_ARRAY.decode("mu_real", "1,2"));
    }

    @Test
    void encodeRejectsWrongJavaType() {
        assertThrows(TypeMismatchException.class, () -> FieldType.SMALLINT.encode("degree", "2"));
        assertThrows(
                TypeMismatchException.class,
                () -> FieldType.NUMERIC_ARRAY.encode("mu_imag", List.of(1)));
        assertThrows(TypeMismatchException.class, () -> FieldType.TEXT.encode("origin", "a|b"));
    }
}
