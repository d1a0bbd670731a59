package com.lfunc.prelabel.arith;

import java.math.BigInteger;

/** Modular helpers on {@code long}, safe from overflow for any positive modulus. */
public final class ModularArithmetic {

    private ModularArithmetic() {}

    public static long multiply(long a, long b, long modulus) {
        long x = Math.floorMod(a, modulus);
        long y = Math.floorMod(b, modulus);
        if (x == 0 || y <= Long.MAX_VALUE / x) {
            return (x * y) % modulus;
        }
        return BigInteger.valueOf(x)
                .multiply(BigInteger.valueOf(y))
                .mod(BigInteger.valueOf(modulus))
                .longValue();
    }

    public static long power(long base, long exponent, long modulus) {
        if (exponent < 0) {
            throw new IllegalArgumentException("negative exponent " + exponent);
        }
        if (modulus == 1) {
            return 0;
        }
        long result = 1;
        long b = Math.floorMod(base, modulus);
        long e = exponent;
        while (e > 0) {
            if ((e & 1) == 1) {
                result = multiply(result, b, modulus);
            }
            b = multiply(b, b, modulus);
            e >>= 1;
        }
        return result;
    }

    public static long gcd(long a, long b) {
        long x = Math.abs(a);
        long y = Math.abs(b);
        while (y != 0) {
            long t = x % y;
            x = y;
            y = t;
        }
        return x;
    }

    public static long inverse(long a, long modulus) {
        return BigInteger.valueOf(a).modInverse(BigInteger.valueOf(modulus)).longValue();
    }

    /** Exponent of the largest power of {@code p} dividing {@code n != 0}. */
    public static int valuation(long n, long p) {
        if (n == 0) {
            throw new IllegalArgumentException("valuation of zero");
        }
        int v = 0;
        long m = Math.abs(n);
        while (m % p == 0) {
            m /= p;
            v++;
        }
        return v;
    }

    /**
     * Combines {@code x ≡ a (mod m)} and {@code x ≡ b (mod n)} for coprime {@code m}, {@code n}
     * into the residue modulo {@code m * n}.
     */
    public static long crt(long a, long m, long b, long n) {
        long mn = Math.multiplyExact(m, n);
        if (m == 1) {
            return Math.floorMod(b, n);
        }
        if (n == 1) {
            return Math.floorMod(a, m);
        }
        // x = a + m * ((b - a) * m^-1 mod n)
        long t = multiply(Math.floorMod(b - a, n), inverse(m, n), n);
        return Math.floorMod(a + multiply(m, t, mn), mn);
    }
}
