package com.lfunc.prelabel.character;

import com.lfunc.prelabel.arith.ModularArithmetic;
import java.util.Objects;

/** A Dirichlet character in Conrey labeling, written {@code "modulus.number"}. */
public final class CharacterLabel {
    public static final CharacterLabel TRIVIAL = new CharacterLabel(1, 1);

    private final long modulus;
    private final long number;

    public CharacterLabel(long modulus, long number) {
        if (modulus < 1) {
            throw new IllegalArgumentException("modulus must be positive: " + modulus);
        }
        if (number < 1) {
            throw new IllegalArgumentException("Conrey number must be positive: " + number);
        }
        if (ModularArithmetic.gcd(number, modulus) != 1) {
            throw new IllegalArgumentException(
                    "Conrey number " + number + " is not coprime to modulus " + modulus);
        }
        this.modulus = modulus;
        this.number = number;
    }

    public static CharacterLabel parse(String label) {
        Objects.requireNonNull(label, "label");
        int dot = label.indexOf('.');
        if (dot <= 0 || dot == label.length() - 1 || label.indexOf('.', dot + 1) >= 0) {
            throw new IllegalArgumentException("character label must look like q.n: " + label);
        }
        try {
            return new CharacterLabel(
                    Long.parseLong(label.substring(0, dot)), Long.parseLong(label.substring(dot + 1)));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("character label must look like q.n: " + label, ex);
        }
    }

    public long getModulus() {
        return modulus;
    }

    public long getNumber() {
        return number;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof CharacterLabel)) {
            return false;
        }
        CharacterLabel other = (CharacterLabel) obj;
        return modulus == other.modulus && number == other.number;
    }

    @Override
    public int hashCode() {
        return Objects.hash(modulus, number);
    }

    @Override
    public String toString() {
        return modulus + "." + number;
    }
}
