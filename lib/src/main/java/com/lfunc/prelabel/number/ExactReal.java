package com.lfunc.prelabel.number;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Real number backed by an exact {@link BigDecimal}, carrying the literal it prints as.
 *
 * <p>Equality, hashing and ordering use the numeric value only, so {@code 1.0} equals {@code 1}
 * even though the two render differently.</p>
 */
public final class ExactReal implements ExactNumber, Comparable<ExactReal> {

    public static final int MIN_PRECISION_BITS = 53;

    private static final double LOG10_2 = Math.log10(2);
    private static final ExactReal ZERO = new ExactReal(BigDecimal.ZERO, MIN_PRECISION_BITS, "0");

    private final BigDecimal value;
    private final int precisionBits;
    private final String literal;

    private ExactReal(BigDecimal value, int precisionBits, String literal) {
        this.value = value;
        this.precisionBits = Math.max(MIN_PRECISION_BITS, precisionBits);
        this.literal = literal;
    }

    /**
     * Wraps a decimal literal. Throws {@link NumberFormatException} when the text is not a
     * decimal number.
     */
    public static ExactReal ofLiteral(String literal, int precisionBits) {
        Objects.requireNonNull(literal, "literal");
        return new ExactReal(new BigDecimal(literal), precisionBits, literal);
    }

    /**
     * A parsed value whose printed form is {@code literal} verbatim; {@code value} is the number
     * the literal denotes.
     */
    public static ExactReal parsed(String literal, BigDecimal value, int precisionBits) {
        return new ExactReal(
                Objects.requireNonNull(value, "value"),
                precisionBits,
                Objects.requireNonNull(literal, "literal"));
    }

    /** A value produced by arithmetic; its literal is computed from the value. */
    public static ExactReal derived(BigDecimal value, int precisionBits) {
        Objects.requireNonNull(value, "value");
        int bits = Math.max(MIN_PRECISION_BITS, precisionBits);
        return new ExactReal(value, bits, formatDerived(value, bits));
    }

    public static ExactReal of(long value) {
        return derived(BigDecimal.valueOf(value), MIN_PRECISION_BITS);
    }

    public static ExactReal zero() {
        return ZERO;
    }

    public BigDecimal value() {
        return value;
    }

    @Override
    public int precisionBits() {
        return precisionBits;
    }

    @Override
    public String render() {
        return literal;
    }

    @Override
    public boolean isZero() {
        return value.signum() == 0;
    }

    public int signum() {
        return value.signum();
    }

    public ExactReal plus(BigDecimal shift) {
        return derived(value.add(shift), precisionBits);
    }

    public ExactReal times(int factor) {
        return derived(value.multiply(BigDecimal.valueOf(factor)), precisionBits);
    }

    public ExactReal negate() {
        return derived(value.negate(), precisionBits);
    }

    public ExactReal abs() {
        return value.signum() < 0 ? negate() : this;
    }

    public double toDouble() {
        return value.doubleValue();
    }

    @Override
    public int compareTo(ExactReal other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ExactReal)) {
            return false;
        }
        return value.compareTo(((ExactReal) obj).value) == 0;
    }

    @Override
    public int hashCode() {
        return value.signum() == 0 ? 0 : value.stripTrailingZeros().hashCode();
    }

    @Override
    public String toString() {
        return literal;
    }

    private static int decimalDigits(int bits) {
        return Math.max(1, (int) Math.floor(bits * LOG10_2));
    }

    private static String formatDerived(BigDecimal value, int bits) {
        if (value.signum() == 0) {
            return "0";
        }
        MathContext context = new MathContext(decimalDigits(bits), RoundingMode.HALF_EVEN);
        return value.round(context).stripTrailingZeros().toPlainString();
    }
}
