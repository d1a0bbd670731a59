package com.lfunc.prelabel.gamma;

import com.lfunc.prelabel.InvariantViolationException;
import com.lfunc.prelabel.number.ExactComplex;
import com.lfunc.prelabel.number.ExactReal;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reduces gamma-factor data to its canonical spectral form.
 *
 * <p>The steps run in a fixed order: analytic normalization by half the motivic weight, fusion of
 * {@code Gamma_R(s) Gamma_R(s+1)} pairs into {@code Gamma_C(s)}, the degree check, sorting,
 * extraction of the numeric arrays, block-factor reduction of the real parts and finally the
 * conjugate-pairing flags used by the label tail.</p>
 */
public final class SpectralCanonicalizer {

    private static final Logger LOGGER = Logger.getLogger(SpectralCanonicalizer.class.getName());
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    /** Orders by real part, then absolute imaginary part, then imaginary part. */
    public static final Comparator<ExactComplex> CANONICAL_ORDER =
            Comparator.comparing((ExactComplex z) -> z.real().value())
                    .thenComparing(z -> z.imag().value().abs())
                    .thenComparing(z -> z.imag().value());

    public CanonicalSpectralForm canonicalize(GammaData gamma, int motivicWeight, int degree)
            throws InvariantViolationException {
        GammaData fused = fuseRealPairs(normalize(gamma, motivicWeight));
        if (fused.impliedDegree() != degree) {
            throw new InvariantViolationException(
                    "degree "
                            + degree
                            + " does not match gamma factors "
                            + fused
                            + " (|GR| + 2|GC| = "
                            + fused.impliedDegree()
                            + ")");
        }

        List<ExactComplex> gr = new ArrayList<>(fused.getGr());
        List<ExactComplex> gc = new ArrayList<>(fused.getGc());
        gr.sort(CANONICAL_ORDER);
        gc.sort(CANONICAL_ORDER);

        List<ExactReal> muImag = new ArrayList<>(gr.size());
        List<Integer> muReal = new ArrayList<>(gr.size());
        for (ExactComplex mu : gr) {
            muImag.add(mu.imag());
            muReal.add(SpectralRounding.nearest(mu.real().value()));
        }
        List<ExactReal> doubleNuImag = new ArrayList<>(gc.size());
        List<Integer> doubleNuReal = new ArrayList<>(gc.size());
        for (ExactComplex nu : gc) {
            doubleNuImag.add(nu.imag().times(2));
            doubleNuReal.add(SpectralRounding.nearest(nu.real().value().multiply(TWO)));
        }

        Map<BigDecimal, Integer> grCounts = countRealParts(gr);
        Map<BigDecimal, Integer> gcCounts = countRealParts(gc);
        int blockFactor = Math.max(1, gcd(gcd(grCounts), gcd(gcCounts)));
        if (blockFactor > 1 && LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Spectral data splits into " + blockFactor + " identical blocks");
        }

        return new CanonicalSpectralForm(
                gr,
                gc,
                pairings(gr),
                pairings(gc),
                reduce(grCounts, blockFactor),
                reduce(gcCounts, blockFactor),
                blockFactor,
                muReal,
                muImag,
                doubleNuReal,
                doubleNuImag);
    }

    /** Shifts every parameter by {@code motivicWeight / 2}. */
    public static GammaData normalize(GammaData gamma, int motivicWeight) {
        BigDecimal shift = BigDecimal.valueOf(motivicWeight).divide(TWO);
        return new GammaData(shift(gamma.getGr(), shift), shift(gamma.getGc(), shift));
    }

    /**
     * Replaces each pair of real parameters {@code 0} and {@code 1} by one complex parameter
     * {@code 0}, as many times as both values remain.
     */
    public static GammaData fuseRealPairs(GammaData gamma) {
        int zeros = 0;
        int ones = 0;
        for (ExactComplex mu : gamma.getGr()) {
            if (isZero(mu)) {
                zeros++;
            } else if (isOne(mu)) {
                ones++;
            }
        }
        int pairs = Math.min(zeros, ones);
        if (pairs == 0) {
            return gamma;
        }
        List<ExactComplex> gr = new ArrayList<>(gamma.getGr().size() - 2 * pairs);
        int zerosLeft = pairs;
        int onesLeft = pairs;
        for (ExactComplex mu : gamma.getGr()) {
            if (zerosLeft > 0 && isZero(mu)) {
                zerosLeft--;
            } else if (onesLeft > 0 && isOne(mu)) {
                onesLeft--;
            } else {
                gr.add(mu);
            }
        }
        List<ExactComplex> gc = new ArrayList<>(gamma.getGc());
        for (int i = 0; i < pairs; i++) {
            gc.add(ExactComplex.zero());
        }
        return new GammaData(gr, gc);
    }

    /**
     * Flags for a sorted list: an element is the {@link Pairing#CONJUGATE} head of a pair when its
     * imaginary part is not positive and the next element is its conjugate, and is {@link
     * Pairing#PAIRED} when its imaginary part is not negative and the previous element is its
     * conjugate.
     */
    static List<Pairing> pairings(List<ExactComplex> sorted) {
        List<Pairing> flags = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            ExactComplex elt = sorted.get(i);
            ExactComplex conjugate = elt.conjugate();
            int sign = elt.imag().signum();
            if (sign <= 0 && i < sorted.size() - 1 && conjugate.equals(sorted.get(i + 1))) {
                flags.add(Pairing.CONJUGATE);
            } else if (sign >= 0 && i > 0 && conjugate.equals(sorted.get(i - 1))) {
                flags.add(Pairing.PAIRED);
            } else {
                flags.add(Pairing.PLAIN);
            }
        }
        return flags;
    }

    private static List<ExactComplex> shift(List<ExactComplex> values, BigDecimal shift) {
        List<ExactComplex> shifted = new ArrayList<>(values.size());
        for (ExactComplex value : values) {
            shifted.add(value.plus(shift));
        }
        return shifted;
    }

    private static boolean isZero(ExactComplex z) {
        return z.isZero();
    }

    private static boolean isOne(ExactComplex z) {
        return z.isReal() && z.real().value().compareTo(BigDecimal.ONE) == 0;
    }

    private static Map<BigDecimal, Integer> countRealParts(List<ExactComplex> values) {
        Map<BigDecimal, Integer> counts = new TreeMap<>();
        for (ExactComplex value : values) {
            counts.merge(value.real().value(), 1, Integer::sum);
        }
        return counts;
    }

    private static List<BigDecimal> reduce(Map<BigDecimal, Integer> counts, int blockFactor) {
        List<BigDecimal> reduced = new ArrayList<>();
        for (Map.Entry<BigDecimal, Integer> entry : counts.entrySet()) {
            for (int i = 0; i < entry.getValue() / blockFactor; i++) {
                reduced.add(entry.getKey());
            }
        }
        return reduced;
    }

    private static int gcd(Map<BigDecimal, Integer> counts) {
        int result = 0;
        for (int count : counts.values()) {
            result = gcd(result, count);
        }
        return result;
    }

    private static int gcd(int a, int b) {
        while (b != 0) {
            int t = a % b;
            a = b;
            b = t;
        }
        return Math.abs(a);
    }
}
