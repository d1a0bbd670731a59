package com.lfunc.prelabel.character;

import com.lfunc.prelabel.arith.IntegerFactorization;
import com.lfunc.prelabel.arith.ModularArithmetic;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Dirichlet characters modulo {@code q} in Conrey labeling.
 *
 * <p>The character {@code q.n} is the product of its local components {@code p^e.(n mod p^e)}. For
 * odd {@code p} a component is described by the discrete logarithm of {@code n} to the Conrey
 * generator, the least primitive root modulo {@code p^2}; for {@code p = 2} by writing {@code n} as
 * {@code ±5^a}. The conductor and the inducing character follow from those exponents.</p>
 */
public final class DirichletGroup {
    private final long modulus;
    private final List<PrimePowerFactor> factors;

    public DirichletGroup(long modulus) {
        if (modulus < 1) {
            throw new IllegalArgumentException("modulus must be positive: " + modulus);
        }
        this.modulus = modulus;
        List<PrimePowerFactor> local = new ArrayList<>();
        for (Map.Entry<Long, Integer> entry : IntegerFactorization.factor(modulus).entrySet()) {
            local.add(new PrimePowerFactor(entry.getKey(), entry.getValue()));
        }
        this.factors = Collections.unmodifiableList(local);
    }

    public long getModulus() {
        return modulus;
    }

    /** Conrey generator modulo {@code p^e} for odd {@code p} dividing the modulus. */
    public long generator(long p) {
        for (PrimePowerFactor factor : factors) {
            if (factor.prime == p && p != 2) {
                return factor.generator;
            }
        }
        throw new IllegalArgumentException(p + " is not an odd prime dividing " + modulus);
    }

    /** The primitive character inducing {@code modulus.number}. */
    public CharacterLabel primitive(long number) {
        CharacterLabel character = new CharacterLabel(modulus, number);
        long conductor = 1;
        long primitiveNumber = 1;
        for (PrimePowerFactor factor : factors) {
            long[] local = factor.primitive(Math.floorMod(character.getNumber(), factor.primePower));
            primitiveNumber =
                    ModularArithmetic.crt(primitiveNumber, conductor, local[1], local[0]);
            conductor *= local[0];
        }
        if (conductor == 1) {
            return CharacterLabel.TRIVIAL;
        }
        return new CharacterLabel(conductor, primitiveNumber);
    }

    private static final class PrimePowerFactor {
        private final long prime;
        private final int exponent;
        private final long primePower;
        private final long generator;

        PrimePowerFactor(long prime, int exponent) {
            this.prime = prime;
            this.exponent = exponent;
            long power = 1;
            for (int i = 0; i < exponent; i++) {
                power = Math.multiplyExact(power, prime);
            }
            this.primePower = power;
            this.generator = prime == 2 ? 5 : conreyGenerator(prime);
        }

        /** Returns {conductor, number} of the primitive character inducing this component. */
        long[] primitive(long n) {
            return prime == 2 ? primitiveTwo(n) : primitiveOdd(n);
        }

        private long[] primitiveOdd(long n) {
            long phi = primePower / prime * (prime - 1);
            long log = discreteLog(generator, n, primePower, phi);
            if (log == 0) {
                return new long[] {1, 1};
            }
            int v = Math.min(ModularArithmetic.valuation(log, prime), exponent - 1);
            long reducedPower = primePower;
            long divisor = 1;
            for (int i = 0; i < v; i++) {
                reducedPower /= prime;
                divisor *= prime;
            }
            return new long[] {
                reducedPower, ModularArithmetic.power(generator, log / divisor, reducedPower)
            };
        }

        private long[] primitiveTwo(long n) {
            if (exponent == 1 || n == 1) {
                return new long[] {1, 1};
            }
            if (exponent == 2) {
                return new long[] {4, 3};
            }
            boolean negative = n % 4 == 3;
            long positive = negative ? primePower - n : n;
            long order = primePower >> 2;
            long log = discreteLog(5, positive, primePower, order);
            if (log == 0) {
                return new long[] {4, 3};
            }
            int v = ModularArithmetic.valuation(log, 2);
            long reducedPower = primePower >> v;
            long number = ModularArithmetic.power(5, log >> v, reducedPower);
            if (negative) {
                number = reducedPower - number;
            }
            return new long[] {reducedPower, number};
        }

        private static long discreteLog(long base, long target, long modulus, long order) {
            long value = 1;
            for (long k = 0; k < order; k++) {
                if (value == target) {
                    return k;
                }
                value = ModularArithmetic.multiply(value, base, modulus);
            }
            throw new IllegalStateException(
                    target + " is not a power of " + base + " modulo " + modulus);
        }

        private static long conreyGenerator(long p) {
            long square = Math.multiplyExact(p, p);
            long order = square - p;
            List<Long> orderPrimes = new ArrayList<>(IntegerFactorization.factor(order).keySet());
            for (long g = 2; g < square; g++) {
                if (g % p == 0) {
                    continue;
                }
                boolean primitiveRoot = true;
                for (long q : orderPrimes) {
                    if (ModularArithmetic.power(g, order / q, square) == 1) {
                        primitiveRoot = false;
                        break;
                    }
                }
                if (primitiveRoot) {
                    return g;
                }
            }
            throw new IllegalStateException("no primitive root modulo " + square);
        }
    }
}
