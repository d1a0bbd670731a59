package com.lfunc.prelabel.label;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Label-tail token for one spectral parameter, built from its imaginary part: {@code c} for the
 * head of a conjugate pair, {@code m} for a negative value, {@code p} otherwise, followed by the
 * absolute value with two decimals ({@code 0} when it is zero).
 */
public final class SpectralToken {

    private SpectralToken() {}

    public static String of(BigDecimal x, boolean conjugate) {
        String prefix;
        BigDecimal magnitude = x;
        if (conjugate) {
            if (x.signum() > 0) {
                throw new IllegalArgumentException("conjugate pair head must have imag <= 0: " + x);
            }
            magnitude = x.negate();
            prefix = "c";
        } else if (x.signum() < 0) {
            magnitude = x.negate();
            prefix = "m";
        } else {
            prefix = "p";
        }
        if (magnitude.signum() == 0) {
            return prefix + "0";
        }
        return prefix + magnitude.setScale(2, RoundingMode.HALF_EVEN).toPlainString();
    }
}
