package com.lfunc.prelabel.gamma;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.lfunc.prelabel.InvariantViolationException;
import com.lfunc.prelabel.literal.LiteralParser;
import com.lfunc.prelabel.number.ExactComplex;
import com.lfunc.prelabel.number.ExactReal;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

final class SpectralCanonicalizerTest {

    private final SpectralCanonicalizer canonicalizer = new SpectralCanonicalizer();

    @Test
    void normalizationShiftsByHalfTheWeight() throws Exception {
        GammaData shifted =
                SpectralCanonicalizer.normalize(LiteralParser.parseGammaFactors("[[0],[1+2i]]"), 1);
        assertEquals(0, shifted.getGr().get(0).real().value().compareTo(new BigDecimal("0.5")));
        assertEquals("0.5", shifted.getGr().get(0).render());
        assertEquals(ExactReal.of(2), shifted.getGc().get(0).imag());
        assertEquals(0, shifted.getGc().get(0).real().value().compareTo(new BigDecimal("1.5")));
    }

    @Test
    void fusesZeroOnePairs() throws Exception {
        GammaData fused =
                SpectralCanonicalizer.fuseRealPairs(LiteralParser.parseGammaFactors("[[0,1],[]]"));
        assertTrue(fused.getGr().isEmpty());
        assertEquals(List.of(ExactComplex.zero()), fused.getGc());
        assertEquals(2, fused.impliedDegree());
    }

    @Test
    void fusionKeepsUnpairedValues() throws Exception {
        GammaData fused =
                SpectralCanonicalizer.fuseRealPairs(
                        LiteralParser.parseGammaFactors("[[1,0,0,1,1],[2]]"));
        assertEquals(1, fused.getGr().size());
        assertEquals(ExactReal.of(1), fused.getGr().get(0).real());
        assertEquals(3, fused.getGc().size());
        assertEquals(7, fused.impliedDegree());
    }

    @Test
    void fusionIsIdempotent() throws Exception {
        GammaData once =
                SpectralCanonicalizer.fuseRealPairs(
                        LiteralParser.parseGammaFactors("[[0,1,1,0.5],[3i]]"));
        GammaData twice = SpectralCanonicalizer.fuseRealPairs(once);
        assertSame(once, twice);
    }

    @Test
    void rejectsDegreeMismatch() throws Exception {
        GammaData gamma = LiteralParser.parseGammaFactors("[[0],[]]");
        InvariantViolationException ex =
                assertThrows(
                        InvariantViolationException.class,
                        () -> canonicalizer.canonicalize(gamma, 1, 2));
        assertTrue(ex.getMessage().contains("degree 2"));
    }

    @Test
    void degreeHoldsAfterFusion() throws Exception {
        CanonicalSpectralForm form =
                canonicalizer.canonicalize(LiteralParser.parseGammaFactors("[[0,1],[]]"), 0, 2);
        assertTrue(form.getGr().isEmpty());
        assertEquals(1, form.getGc().size());
        assertEquals(List.of(0), form.getDoubleNuReal());
    }

    @Test
    void sortsByRealThenAbsoluteImaginaryThenImaginary() throws Exception {
        CanonicalSpectralForm form =
                canonicalizer.canonicalize(
                        LiteralParser.parseGammaFactors("[[],[1+i,0.5+2i,0.5-2i,0.5-i]]"), 0, 8);
        List<String> parts = new ArrayList<>();
        for (ExactComplex nu : form.getGc()) {
            parts.add(nu.real().render() + "," + nu.imag().render());
        }
        assertEquals(List.of("0.5,-1", "0.5,-2", "0.5,2", "1,1"), parts);
    }

    @Test
    void flagsConjugatePairs() throws Exception {
        CanonicalSpectralForm form =
                canonicalizer.canonicalize(
                        LiteralParser.parseGammaFactors("[[],[0.5+2i,0.5-2i]]"), 0, 4);
        assertEquals(List.of(Pairing.CONJUGATE, Pairing.PAIRED), form.getGcPairings());
        assertEquals(List.of(1, 1), form.getDoubleNuReal());
        assertEquals(List.of(ExactReal.of(-4), ExactReal.of(4)), form.getDoubleNuImag());
    }

    @Test
    void everyPairedElementFollowsItsHead() throws Exception {
        CanonicalSpectralForm form =
                canonicalizer.canonicalize(
                        LiteralParser.parseGammaFactors("[[0,0,2i,-2i,3i],[]]"), 0, 5);
        List<Pairing> flags = form.getGrPairings();
        for (int i = 0; i < flags.size(); i++) {
            if (flags.get(i) == Pairing.PAIRED) {
                assertEquals(Pairing.CONJUGATE, flags.get(i - 1));
            }
        }
        assertEquals(
                List.of(
                        Pairing.CONJUGATE,
                        Pairing.PAIRED,
                        Pairing.CONJUGATE,
                        Pairing.PAIRED,
                        Pairing.PLAIN),
                flags);
    }

    @Test
    void extractsBlockFactor() throws Exception {
        CanonicalSpectralForm form =
                canonicalizer.canonicalize(
                        LiteralParser.parseGammaFactors("[[0,0,1,1],[1,1]]"), 0, 8);
        assertEquals(2, form.getBlockFactor());
        assertTrue(form.getReducedGrReals().isEmpty());
        assertEquals(2, form.getReducedGcReals().size());
    }

    @Test
    void blockFactorIsGcdOfMultiplicities() throws Exception {
        CanonicalSpectralForm form =
                canonicalizer.canonicalize(
                        LiteralParser.parseGammaFactors("[[0,0,0,0],[1,1]]"), 0, 8);
        assertEquals(2, form.getBlockFactor());
        assertEquals(2, form.getReducedGrReals().size());
        assertEquals(1, form.getReducedGcReals().size());

        CanonicalSpectralForm single =
                canonicalizer.canonicalize(
                        LiteralParser.parseGammaFactors("[[0,0],[1]]"), 0, 4);
        assertEquals(1, single.getBlockFactor());
    }

    @Test
    void roundsHalfToEven() throws Exception {
        CanonicalSpectralForm form =
                canonicalizer.canonicalize(LiteralParser.parseGammaFactors("[[0,1],[]]"), 1, 2);
        assertEquals(List.of(0, 2), form.getMuReal());
    }
}
