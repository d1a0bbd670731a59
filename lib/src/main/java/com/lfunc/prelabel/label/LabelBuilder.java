package com.lfunc.prelabel.label;

import com.lfunc.prelabel.arith.PerfectPower;
import com.lfunc.prelabel.gamma.CanonicalSpectralForm;
import com.lfunc.prelabel.gamma.Pairing;
import com.lfunc.prelabel.gamma.SpectralRounding;
import com.lfunc.prelabel.number.ExactComplex;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * Renders the prelabel {@code degree-conductor-character-gammas-tail}, for example {@code
 * 2-11-1.1-c1-0} for an elliptic curve of conductor 11, and copies the spectral arrays onto the
 * record.
 */
public final class LabelBuilder {
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    public String build(LabelRecord record, CanonicalSpectralForm form) {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(form, "form");
        String prelabel =
                beginning(record.getDegree(), record.getConductor(), record.getCentralCharacter())
                        + gammas(form)
                        + tail(Boolean.TRUE.equals(record.getAlgebraic()), form);
        record.setPrelabel(prelabel);
        record.setMuReal(form.getMuReal());
        record.setMuImag(form.getMuImag());
        record.setDoubleNuReal(form.getDoubleNuReal());
        record.setDoubleNuImag(form.getDoubleNuImag());
        return prelabel;
    }

    static String beginning(int degree, BigInteger conductor, String centralCharacter) {
        return degree + "-" + conductor(conductor) + "-" + centralCharacter;
    }

    /** {@code b} when the conductor is no perfect power, else {@code b e k} as {@code "{b}e{k}"}. */
    static String conductor(BigInteger conductor) {
        PerfectPower power = PerfectPower.of(conductor);
        if (power.getExponent() == 1) {
            return power.getBase().toString();
        }
        return power.getBase() + "e" + power.getExponent();
    }

    static String gammas(CanonicalSpectralForm form) {
        StringBuilder builder = new StringBuilder("-");
        for (BigDecimal mu : form.getReducedGrReals()) {
            builder.append('r').append(SpectralRounding.nearest(mu));
        }
        for (BigDecimal nu : form.getReducedGcReals()) {
            builder.append('c').append(SpectralRounding.nearest(nu.multiply(TWO)));
        }
        if (form.getBlockFactor() > 1) {
            builder.append('e').append(form.getBlockFactor());
        }
        return builder.toString();
    }

    static String tail(boolean algebraic, CanonicalSpectralForm form) {
        if (algebraic) {
            return "-0";
        }
        StringBuilder builder = new StringBuilder("-");
        appendTokens(builder, form.getGr(), form.getGrPairings());
        appendTokens(builder, form.getGc(), form.getGcPairings());
        return builder.toString();
    }

    private static void appendTokens(
            StringBuilder builder, List<ExactComplex> values, List<Pairing> pairings) {
        for (int i = 0; i < values.size(); i++) {
            Pairing pairing = pairings.get(i);
            if (pairing == Pairing.PAIRED) {
                continue;
            }
            builder.append(
                    SpectralToken.of(values.get(i).imag().value(), pairing == Pairing.CONJUGATE));
        }
    }
}
