package com.lfunc.prelabel.label;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.lfunc.prelabel.InvariantViolationException;
import com.lfunc.prelabel.gamma.CanonicalSpectralForm;
import com.lfunc.prelabel.gamma.SpectralCanonicalizer;
import com.lfunc.prelabel.literal.LiteralParser;
import com.lfunc.prelabel.number.ExactReal;
import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.Test;

final class LabelBuilderTest {

    private final SpectralCanonicalizer canonicalizer = new SpectralCanonicalizer();
    private final LabelBuilder builder = new LabelBuilder();

    @Test
    void labelsDegreeOneAlgebraicRecord() throws Exception {
        assertEquals("1-11-1.1-r0-0", label(1, 11, true, 1, "[[0],[]]"));
    }

    @Test
    void degreeTwoWithOneRealFactorIsRejected() {
        assertThrows(
                InvariantViolationException.class, () -> label(2, 11, true, 1, "[[0],[]]"));
    }

    @Test
    void labelsEllipticCurve() throws Exception {
        assertEquals("2-11-1.1-c1-0", label(2, 11, true, 1, "[[],[0]]"));
    }

    @Test
    void writesPerfectPowerConductor() {
        assertEquals("2e3", LabelBuilder.conductor(BigInteger.valueOf(8)));
        assertEquals("11", LabelBuilder.conductor(BigInteger.valueOf(11)));
        assertEquals("6e2", LabelBuilder.conductor(BigInteger.valueOf(36)));
        assertEquals("1", LabelBuilder.conductor(BigInteger.ONE));
        assertEquals("2-2e3-1.1", LabelBuilder.beginning(2, BigInteger.valueOf(8), "1.1"));
    }

    @Test
    void fusedPairLabelsAsComplexZero() throws Exception {
        assertEquals("2-11-1.1-c0-0", label(2, 11, true, 0, "[[0,1],[]]"));
    }

    @Test
    void conjugatePairGivesOneTailToken() throws Exception {
        String prelabel = label(4, 11, false, 0, "[[],[0.5+2i,0.5-2i]]");
        assertEquals("4-11-1.1-c1e2-c2.00", prelabel);
        String tail = prelabel.substring(prelabel.lastIndexOf('-') + 1);
        assertEquals(1, tail.split("(?=[cmp])").length);
    }

    @Test
    void selfConjugateRealPairCollapses() throws Exception {
        assertEquals("2-11-1.1-r0e2-c0", label(2, 11, false, 0, "[[0,0],[]]"));
    }

    @Test
    void unpairedTokensUseSignPrefix() throws Exception {
        assertEquals("2-7-1.1-r0r1-m3.25p0", label(2, 7, false, 0, "[[-3.25i,1],[]]"));
    }

    @Test
    void copiesSpectralArraysOntoRecord() throws Exception {
        LabelRecord record = record(2, 11, true);
        CanonicalSpectralForm form =
                canonicalizer.canonicalize(LiteralParser.parseGammaFactors("[[],[0]]"), 1, 2);
        builder.build(record, form);
        assertEquals("2-11-1.1-c1-0", record.getPrelabel());
        assertEquals(List.of(), record.getMuReal());
        assertEquals(List.of(1), record.getDoubleNuReal());
        assertEquals(List.of(ExactReal.zero()), record.getDoubleNuImag());
    }

    private String label(int degree, long conductor, boolean algebraic, int weight, String gamma)
            throws Exception {
        CanonicalSpectralForm form =
                canonicalizer.canonicalize(LiteralParser.parseGammaFactors(gamma), weight, degree);
        return builder.build(record(degree, conductor, algebraic), form);
    }

    private static LabelRecord record(int degree, long conductor, boolean algebraic) {
        return LabelRecord.builder()
                .id(1L)
                .degree(degree)
                .conductor(BigInteger.valueOf(conductor))
                .centralCharacter("1.1")
                .algebraic(algebraic)
                .build();
    }
}
