package com.lfunc.prelabel.number;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

final class ExactRealTest {

    @Test
    void equalityIgnoresLiteral() {
        ExactReal one = ExactReal.ofLiteral("1.0", 53);
        ExactReal other = ExactReal.ofLiteral("1", 53);
        assertEquals(one, other);
        assertEquals(one.hashCode(), other.hashCode());
        assertNotEquals(one.render(), other.render());
    }

    @Test
    void derivedValuesGetFreshLiteral() {
        ExactReal shifted = ExactReal.ofLiteral("0", 53).plus(new BigDecimal("0.5"));
        assertEquals("0.5", shifted.render());
        assertEquals("0", ExactReal.zero().render());
        assertEquals("-4", ExactReal.ofLiteral("2.00", 53).times(-2).render());
    }

    @Test
    void ordersByValue() {
        assertTrue(ExactReal.of(-1).compareTo(ExactReal.ofLiteral("0.5", 53)) < 0);
        assertEquals(1, ExactReal.ofLiteral("-2", 53).abs().compareTo(ExactReal.of(1)));
    }

    @Test
    void precisionIsFlooredAtDouble() {
        assertEquals(ExactReal.MIN_PRECISION_BITS, ExactReal.ofLiteral("1", 10).precisionBits());
    }

    @Test
    void complexRenderingOfDerivedValues() {
        ExactComplex z = ExactComplex.of(ExactReal.ofLiteral("0.5", 53), ExactReal.of(-2));
        assertEquals("0.5-2*I", z.render());
        assertEquals("0.5+2*I", z.conjugate().render());
        assertEquals("-2*I", ExactComplex.of(ExactReal.zero(), ExactReal.of(-2)).render());
        assertEquals("0", ExactComplex.zero().render());
    }
}
