package com.lfunc.prelabel.conductor;

import com.lfunc.prelabel.gamma.CanonicalSpectralForm;
import java.math.BigInteger;

/** Computes the analytic conductor of an L-function from its conductor and spectral data. */
@FunctionalInterface
public interface AnalyticConductor {

    /**
     * @param conductor Arithmetic conductor, positive.
     * @param form Canonical spectral form; its parameters are analytically normalized.
     */
    double compute(BigInteger conductor, CanonicalSpectralForm form);
}
