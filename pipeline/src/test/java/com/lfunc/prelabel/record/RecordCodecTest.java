package com.lfunc.prelabel.record;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.lfunc.prelabel.gamma.GammaData;
import com.lfunc.prelabel.literal.LiteralFormatException;
import java.math.BigInteger;
import java.util.Map;
import org.junit.jupiter.api.Test;

final class RecordCodecTest {
    static final String LINE =
            "7|ModularForm/GL2/Q/holomorphic/11/2/a/a|t|11|1.1|t|1|112233|2|0|t|6.3626138947"
                    + "|[[],[0]]|987654321|0.0";

    private final RecordCodec codec = new RecordCodec(RecordLayout.INPUT);

    @Test
    void layoutsHaveExpectedWidth() {
        assertEquals(15, RecordLayout.INPUT.size());
        assertEquals(22, RecordLayout.OUTPUT.size());
        assertEquals("bad_primes", RecordLayout.OUTPUT.getFields().get(21).getName());
        assertEquals(FieldType.DOUBLE, RecordLayout.OUTPUT.getFields().get(16).getType());
    }

    @Test
    void decodesTypedValues() throws Exception {
        Map<String, Object> values = codec.decode(LINE);
        assertEquals(7L, values.get("id"));
        assertEquals(BigInteger.valueOf(11), values.get("conductor"));
        assertEquals(1, values.get("motivic_weight"));
        assertEquals("112233", values.get("Lhash"));
        assertEquals(1, ((GammaData) values.get("gamma_factors")).getGc().size());
        assertEquals(RecordLayout.INPUT.size(), values.size());
    }

    @Test
    void lineSurvivesDecodeAndEncode() throws Exception {
        assertEquals(LINE, codec.encode(codec.decode(LINE)));
    }

    @Test
    void nullMarkerBothWays() throws Exception {
        String line = LINE.replace("|112233|", "|\\N|");
        Map<String, Object> values = codec.decode(line);
        assertNull(values.get("Lhash"));
        assertEquals(line, codec.encode(values));
    }

    @Test
    void wrongFieldCountIsTypeMismatch() {
        assertThrows(TypeMismatchException.class, () -> codec.decode("1|2|3"));
        assertThrows(TypeMismatchException.class, () -> codec.decode(LINE + "|extra"));
    }

    @Test
    void malformedGammaFactorsIsFormatError() {
        assertThrows(
                LiteralFormatException.class,
                () -> codec.decode(LINE.replace("[[],[0]]", "[[],[0")));
    }
}
