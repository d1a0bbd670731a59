package com.lfunc.prelabel.conductor;

/**
 * Digamma function of a complex argument, in double precision.
 *
 * <p>The argument is moved to {@code Re z >= 10} with {@code psi(z) = psi(z + 1) - 1/z}, where the
 * asymptotic expansion {@code log z - 1/(2z) - sum B_2k / (2k z^2k)} is accurate to double
 * precision. Arguments with {@code Re z < }{@value #MIN_REAL_PART} are rejected rather than
 * shifted.</p>
 */
public final class Digamma {
    public static final double MIN_REAL_PART = -1.0e6;
    private static final double SHIFT_THRESHOLD = 10.0;
    // B_2k / 2k for k = 1..7
    private static final double[] SERIES = {
        1.0 / 12,
        -1.0 / 120,
        1.0 / 252,
        -1.0 / 240,
        1.0 / 132,
        -691.0 / 32760,
        1.0 / 12
    };

    private Digamma() {}

    /** Real part of {@code psi(re + i im)}. */
    public static double realPart(double re, double im) {
        return evaluate(re, im)[0];
    }

    /**
     * Returns {real, imaginary} parts of {@code psi(re + i im)}.
     *
     * @throws IllegalArgumentException at a pole, for a non-finite argument, or when {@code re} is
     *     below {@link #MIN_REAL_PART}.
     */
    public static double[] evaluate(double re, double im) {
        if (!Double.isFinite(re) || !Double.isFinite(im)) {
            throw new IllegalArgumentException("digamma argument is not finite: " + re + ", " + im);
        }
        if (re < MIN_REAL_PART) {
            throw new IllegalArgumentException(
                    "digamma argument too far left of the origin: " + re);
        }
        if (im == 0 && re <= 0 && re == Math.rint(re)) {
            throw new IllegalArgumentException("digamma has a pole at " + re);
        }
        double accRe = 0;
        double accIm = 0;
        double x = re;
        while (x < SHIFT_THRESHOLD) {
            // subtract 1/z
            double denom = x * x + im * im;
            accRe -= x / denom;
            accIm += im / denom;
            x += 1;
        }
        double modulus = Math.hypot(x, im);
        double logRe = Math.log(modulus);
        double logIm = Math.atan2(im, x);

        // w = 1/z
        double denom = x * x + im * im;
        double wRe = x / denom;
        double wIm = -im / denom;
        double resultRe = logRe - wRe / 2;
        double resultIm = logIm - wIm / 2;

        // w2 = 1/z^2, power = 1/z^(2k)
        double w2Re = wRe * wRe - wIm * wIm;
        double w2Im = 2 * wRe * wIm;
        double powerRe = w2Re;
        double powerIm = w2Im;
        for (double coefficient : SERIES) {
            resultRe -= coefficient * powerRe;
            resultIm -= coefficient * powerIm;
            double nextRe = powerRe * w2Re - powerIm * w2Im;
            double nextIm = powerRe * w2Im + powerIm * w2Re;
            powerRe = nextRe;
            powerIm = nextIm;
        }
        return new double[] {resultRe + accRe, resultIm + accIm};
    }
}
