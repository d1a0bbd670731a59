package com.lfunc.prelabel.arith;

import java.math.BigInteger;

final class IntegerRoots {

    private IntegerRoots() {}

    /** Largest {@code r} with {@code r^k <= n}, for {@code n >= 0} and {@code k >= 1}. */
    static BigInteger floorRoot(BigInteger n, int k) {
        if (k == 1 || n.signum() == 0 || n.equals(BigInteger.ONE)) {
            return n;
        }
        BigInteger low = BigInteger.ONE;
        BigInteger high = BigInteger.ONE.shiftLeft(n.bitLength() / k + 1);
        while (low.compareTo(high) < 0) {
            BigInteger mid = low.add(high).add(BigInteger.ONE).shiftRight(1);
            if (mid.pow(k).compareTo(n) <= 0) {
                low = mid;
            } else {
                high = mid.subtract(BigInteger.ONE);
            }
        }
        return low;
    }
}
