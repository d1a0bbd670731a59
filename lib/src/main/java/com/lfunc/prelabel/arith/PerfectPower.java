package com.lfunc.prelabel.arith;

import java.math.BigInteger;
import java.util.Objects;

/** Writes a positive integer as {@code base^exponent} with the largest possible exponent. */
public final class PerfectPower {
    private final BigInteger base;
    private final int exponent;

    private PerfectPower(BigInteger base, int exponent) {
        this.base = base;
        this.exponent = exponent;
    }

    public static PerfectPower of(BigInteger n) {
        Objects.requireNonNull(n, "n");
        if (n.signum() <= 0) {
            throw new IllegalArgumentException("perfect power of non-positive integer " + n);
        }
        if (n.equals(BigInteger.ONE)) {
            return new PerfectPower(BigInteger.ONE, 1);
        }
        for (int exponent = n.bitLength() - 1; exponent >= 2; exponent--) {
            BigInteger root = IntegerRoots.floorRoot(n, exponent);
            if (root.pow(exponent).equals(n)) {
                return new PerfectPower(root, exponent);
            }
        }
        return new PerfectPower(n, 1);
    }

    public BigInteger getBase() {
        return base;
    }

    public int getExponent() {
        return exponent;
    }

    @Override
    public String toString() {
        return exponent == 1 ? base.toString() : base + "^" + exponent;
    }
}
