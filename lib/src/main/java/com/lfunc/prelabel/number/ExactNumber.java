package com.lfunc.prelabel.number;

/**
 * A numeric value that remembers how it should be printed. Values parsed from text print back the
 * exact text they came from; values derived by arithmetic print a literal computed from the value
 * at the working precision.
 */
public interface ExactNumber {

    /** Working precision in bits; never below {@link ExactReal#MIN_PRECISION_BITS}. */
    int precisionBits();

    /** The printed form of this value. */
    String render();

    boolean isZero();
}
