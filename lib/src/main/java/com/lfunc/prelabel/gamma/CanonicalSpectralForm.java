package com.lfunc.prelabel.gamma;

import com.lfunc.prelabel.number.ExactComplex;
import com.lfunc.prelabel.number.ExactReal;
import java.math.BigDecimal;
import java.util.List;

/**
 * Normal form of gamma-factor data: the sorted parameters with their pairing flags, the real parts
 * reduced by the block factor {@code ge}, and the numeric arrays stored next to the label.
 */
public final class CanonicalSpectralForm {
    private final List<ExactComplex> gr;
    private final List<ExactComplex> gc;
    private final List<Pairing> grPairings;
    private final List<Pairing> gcPairings;
    private final List<BigDecimal> reducedGrReals;
    private final List<BigDecimal> reducedGcReals;
    private final int blockFactor;
    private final List<Integer> muReal;
    private final List<ExactReal> muImag;
    private final List<Integer> doubleNuReal;
    private final List<ExactReal> doubleNuImag;

    CanonicalSpectralForm(
            List<ExactComplex> gr,
            List<ExactComplex> gc,
            List<Pairing> grPairings,
            List<Pairing> gcPairings,
            List<BigDecimal> reducedGrReals,
            List<BigDecimal> reducedGcReals,
            int blockFactor,
            List<Integer> muReal,
            List<ExactReal> muImag,
            List<Integer> doubleNuReal,
            List<ExactReal> doubleNuImag) {
        this.gr = List.copyOf(gr);
        this.gc = List.copyOf(gc);
        this.grPairings = List.copyOf(grPairings);
        this.gcPairings = List.copyOf(gcPairings);
        this.reducedGrReals = List.copyOf(reducedGrReals);
        this.reducedGcReals = List.copyOf(reducedGcReals);
        this.blockFactor = blockFactor;
        this.muReal = List.copyOf(muReal);
        this.muImag = List.copyOf(muImag);
        this.doubleNuReal = List.copyOf(doubleNuReal);
        this.doubleNuImag = List.copyOf(doubleNuImag);
    }

    /** Normalized real parameters, sorted by real part, then |imaginary part|, then imaginary part. */
    public List<ExactComplex> getGr() {
        return gr;
    }

    /** Normalized complex parameters, sorted like {@link #getGr()}. */
    public List<ExactComplex> getGc() {
        return gc;
    }

    public List<Pairing> getGrPairings() {
        return grPairings;
    }

    public List<Pairing> getGcPairings() {
        return gcPairings;
    }

    public List<BigDecimal> getReducedGrReals() {
        return reducedGrReals;
    }

    public List<BigDecimal> getReducedGcReals() {
        return reducedGcReals;
    }

    /** Number of identical blocks the real parts split into; at least 1. */
    public int getBlockFactor() {
        return blockFactor;
    }

    public List<Integer> getMuReal() {
        return muReal;
    }

    public List<ExactReal> getMuImag() {
        return muImag;
    }

    public List<Integer> getDoubleNuReal() {
        return doubleNuReal;
    }

    public List<ExactReal> getDoubleNuImag() {
        return doubleNuImag;
    }
}
