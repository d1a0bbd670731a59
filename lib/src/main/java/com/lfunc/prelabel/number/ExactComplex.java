package com.lfunc.prelabel.number;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Complex number made of two {@link ExactReal} parts. A value parsed from text keeps the whole
 * source text and renders it unchanged; derived values render as {@code re}, {@code re+im*I},
 * {@code re-im*I} or {@code im*I}.
 */
public final class ExactComplex implements ExactNumber {

    private final ExactReal real;
    private final ExactReal imag;
    private final String source;

    private ExactComplex(ExactReal real, ExactReal imag, String source) {
        this.real = Objects.requireNonNull(real, "real");
        this.imag = Objects.requireNonNull(imag, "imag");
        this.source = source;
    }

    /** A parsed value that prints as {@code source}. */
    public static ExactComplex parsed(ExactReal real, ExactReal imag, String source) {
        return new ExactComplex(real, imag, Objects.requireNonNull(source, "source"));
    }

    public static ExactComplex of(ExactReal real, ExactReal imag) {
        return new ExactComplex(real, imag, null);
    }

    /** A real value viewed as complex; it renders exactly like {@code real}. */
    public static ExactComplex ofReal(ExactReal real) {
        return new ExactComplex(real, ExactReal.zero(), real.render());
    }

    public static ExactComplex zero() {
        return ofReal(ExactReal.zero());
    }

    public ExactReal real() {
        return real;
    }

    public ExactReal imag() {
        return imag;
    }

    public boolean isReal() {
        return imag.isZero();
    }

    @Override
    public boolean isZero() {
        return real.isZero() && imag.isZero();
    }

    @Override
    public int precisionBits() {
        return Math.max(real.precisionBits(), imag.precisionBits());
    }

    /** Adds a real shift; the imaginary part, literal included, is carried over unchanged. */
    public ExactComplex plus(BigDecimal shift) {
        return new ExactComplex(real.plus(shift), imag, null);
    }

    public ExactComplex conjugate() {
        return new ExactComplex(real, imag.negate(), null);
    }

    @Override
    public String render() {
        if (source != null) {
            return source;
        }
        StringBuilder builder = new StringBuilder();
        if (!real.isZero()) {
            builder.append(real.render());
        }
        if (!imag.isZero()) {
            ExactReal y = imag;
            if (builder.length() > 0) {
                if (y.signum() < 0) {
                    builder.append('-');
                    y = y.negate();
                } else {
                    builder.append('+');
                }
            }
            builder.append(y.render()).append("*I");
        }
        if (builder.length() == 0) {
            builder.append(real.render());
        }
        return builder.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ExactComplex)) {
            return false;
        }
        ExactComplex other = (ExactComplex) obj;
        return real.equals(other.real) && imag.equals(other.imag);
    }

    @Override
    public int hashCode() {
        return 31 * real.hashCode() + imag.hashCode();
    }

    @Override
    public String toString() {
        return render();
    }
}
