package com.lfunc.prelabel.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.lfunc.prelabel.InvariantViolationException;
import com.lfunc.prelabel.label.LabelRecord;
import com.lfunc.prelabel.literal.LiteralParser;
import com.lfunc.prelabel.record.TypeMismatchException;
import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.Test;

final class PrelabelPipelineTest {
    static final String ELLIPTIC_CURVE =
            "1|EllipticCurve/Q/11/a|t|11|1.1|t|1|112233|2|0|t|6.36261389471308|[[],[0]]|42|0";

    private final PrelabelPipeline pipeline = PrelabelPipeline.withDefaults();

    @Test
    void labelsEllipticCurveLine() throws Exception {
        String[] fields = pipeline.processLine(ELLIPTIC_CURVE).split("\\|", -1);
        assertEquals(22, fields.length);
        assertEquals("1.1", fields[4]);
        assertEquals("6.36261389471308", fields[11]);
        assertEquals("[[],[0]]", fields[12]);
        assertEquals("2-11-1.1-c1-0", fields[15]);
        double expected = 11 * Math.exp(-2 * 0.5772156649015329) / (4 * Math.PI * Math.PI);
        assertEquals(expected, Double.parseDouble(fields[16]), 1e-12);
        assertEquals("{}", fields[17]);
        assertEquals("{}", fields[18]);
        assertEquals("{1}", fields[19]);
        assertEquals("{0}", fields[20]);
        assertEquals("{11}", fields[21]);
    }

    @Test
    void primitivizesCentralCharacter() throws Exception {
        String line = ELLIPTIC_CURVE.replace("|11|1.1|", "|16|16.9|");
        String[] fields = pipeline.processLine(line).split("\\|", -1);
        assertEquals("8.5", fields[4]);
        assertEquals("2-2e4-8.5-c1-0", fields[15]);
        assertEquals("{2}", fields[21]);
    }

    @Test
    void labelsRecordInPlace() throws Exception {
        LabelRecord record =
                LabelRecord.builder()
                        .id(3L)
                        .conductor(BigInteger.valueOf(11))
                        .centralCharacter("1.1")
                        .motivicWeight(0)
                        .degree(2)
                        .algebraic(true)
                        .gammaFactors(LiteralParser.parseGammaFactors("[[0,1],[]]"))
                        .build();
        LabelRecord labeled = pipeline.process(record);
        assertEquals("2-11-1.1-c0-0", labeled.getPrelabel());
        assertEquals(List.of(BigInteger.valueOf(11)), labeled.getBadPrimes());
        assertTrue(labeled.getAnalyticConductor() > 0);
    }

    @Test
    void missingDegreeIsInvariantViolation() {
        String line = ELLIPTIC_CURVE.replace("|112233|2|", "|112233|\\N|");
        InvariantViolationException ex =
                assertThrows(InvariantViolationException.class, () -> pipeline.processLine(line));
        assertTrue(ex.getMessage().contains("degree"));
    }

    @Test
    void degreeMismatchIsInvariantViolation() {
        String line = ELLIPTIC_CURVE.replace("|112233|2|", "|112233|3|");
        assertThrows(InvariantViolationException.class, () -> pipeline.processLine(line));
    }

    @Test
    void digammaPoleIsInvariantViolation() {
        String line = degreeOneLine("[[-0.5],[]]");
        InvariantViolationException ex =
                assertThrows(InvariantViolationException.class, () -> pipeline.processLine(line));
        assertTrue(ex.getCause() instanceof IllegalArgumentException);
    }

    @Test
    void hugeRealPartIsInvariantViolation() {
        String line = degreeOneLine("[[1e10],[]]");
        InvariantViolationException ex =
                assertThrows(InvariantViolationException.class, () -> pipeline.processLine(line));
        assertTrue(ex.getCause() instanceof ArithmeticException);
    }

    @Test
    void farNegativeRealPartIsInvariantViolation() {
        String line = degreeOneLine("[[-1e15],[]]");
        assertThrows(InvariantViolationException.class, () -> pipeline.processLine(line));
    }

    @Test
    void malformedCharacterIsTypeMismatch() {
        String line = ELLIPTIC_CURVE.replace("|11|1.1|", "|11|4.2|");
        TypeMismatchException ex =
                assertThrows(TypeMismatchException.class, () -> pipeline.processLine(line));
        assertEquals(LabelRecord.CENTRAL_CHARACTER, ex.getField());
        assertEquals("4.2", ex.getRawValue());
    }

    /** Weight 0, degree 1 record carrying the given gamma factors. */
    static String degreeOneLine(String gammaFactors) {
        return ELLIPTIC_CURVE
                .replace("|t|1|112233|2|", "|t|0|112233|1|")
                .replace("[[],[0]]", gammaFactors);
    }
}
