package com.lfunc.prelabel.conductor;

import com.lfunc.prelabel.gamma.CanonicalSpectralForm;
import com.lfunc.prelabel.number.ExactComplex;
import java.math.BigInteger;

/**
 * Analytic conductor from the logarithmic derivatives of the gamma factors at the centre:
 *
 * <pre>
 *   N * prod_mu exp(Re psi((1/2 + mu) / 2)) / pi * prod_nu exp(2 Re psi(1/2 + nu)) / (4 pi^2)
 * </pre>
 *
 * with {@code mu} running over the real and {@code nu} over the complex parameters.
 */
public final class DigammaAnalyticConductor implements AnalyticConductor {

    @Override
    public double compute(BigInteger conductor, CanonicalSpectralForm form) {
        if (conductor.signum() <= 0) {
            throw new IllegalArgumentException("conductor must be positive: " + conductor);
        }
        // Sum logarithms so large conductors and degrees do not overflow before the end.
        double logResult = Math.log(conductor.doubleValue());
        for (ExactComplex mu : form.getGr()) {
            double re = (0.5 + mu.real().toDouble()) / 2;
            double im = mu.imag().toDouble() / 2;
            logResult += Digamma.realPart(re, im) - Math.log(Math.PI);
        }
        for (ExactComplex nu : form.getGc()) {
            double re = 0.5 + nu.real().toDouble();
            double im = nu.imag().toDouble();
            logResult += 2 * Digamma.realPart(re, im) - Math.log(4 * Math.PI * Math.PI);
        }
        return Math.exp(logResult);
    }
}
