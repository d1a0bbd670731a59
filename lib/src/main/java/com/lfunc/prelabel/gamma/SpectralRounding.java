package com.lfunc.prelabel.gamma;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Nearest-integer rounding shared by the {@code mu_real}/{@code double_nu_real} arrays and the
 * {@code r}/{@code c} label tokens. Ties go to the even neighbour.
 */
public final class SpectralRounding {
    public static final RoundingMode MODE = RoundingMode.HALF_EVEN;

    private SpectralRounding() {}

    public static int nearest(BigDecimal value) {
        return value.setScale(0, MODE).intValueExact();
    }
}
