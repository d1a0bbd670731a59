package com.lfunc.prelabel.arith;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Trial-division factorization. Conductors and character moduli are small enough in practice;
 * the remaining cofactor after trial division is confirmed prime with a probable-prime test.
 */
public final class IntegerFactorization {

    private static final BigInteger TWO = BigInteger.valueOf(2);
    private static final int CERTAINTY = 64;

    private IntegerFactorization() {}

    /** Prime factorization of {@code n >= 1} as prime → exponent, primes ascending. */
    public static Map<BigInteger, Integer> factor(BigInteger n) {
        Objects.requireNonNull(n, "n");
        if (n.signum() <= 0) {
            throw new IllegalArgumentException("cannot factor non-positive integer " + n);
        }
        Map<BigInteger, Integer> factors = new TreeMap<>();
        BigInteger remaining = n;
        int twos = remaining.getLowestSetBit();
        if (twos > 0) {
            factors.put(TWO, twos);
            remaining = remaining.shiftRight(twos);
        }
        BigInteger p = BigInteger.valueOf(3);
        while (remaining.compareTo(BigInteger.ONE) > 0 && p.multiply(p).compareTo(remaining) <= 0) {
            if (remaining.isProbablePrime(CERTAINTY)) {
                break;
            }
            int exponent = 0;
            BigInteger[] divRem = remaining.divideAndRemainder(p);
            while (divRem[1].signum() == 0) {
                remaining = divRem[0];
                exponent++;
                divRem = remaining.divideAndRemainder(p);
            }
            if (exponent > 0) {
                factors.put(p, exponent);
            }
            p = p.add(TWO);
        }
        if (remaining.compareTo(BigInteger.ONE) > 0) {
            factors.merge(remaining, 1, Integer::sum);
        }
        return Collections.unmodifiableMap(factors);
    }

    public static Map<Long, Integer> factor(long n) {
        Map<Long, Integer> factors = new TreeMap<>();
        for (Map.Entry<BigInteger, Integer> entry : factor(BigInteger.valueOf(n)).entrySet()) {
            factors.put(entry.getKey().longValueExact(), entry.getValue());
        }
        return Collections.unmodifiableMap(factors);
    }

    /** Distinct prime divisors of {@code n >= 1}, ascending; empty for 1. */
    public static List<BigInteger> primeDivisors(BigInteger n) {
        return List.copyOf(factor(n).keySet());
    }
}
