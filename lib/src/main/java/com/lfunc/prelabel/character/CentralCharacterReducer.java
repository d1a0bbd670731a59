package com.lfunc.prelabel.character;

/**
 * Reduces a central character to the primitive character inducing it. Implementations must be
 * deterministic, and the modulus of the result divides the modulus of the input.
 */
public interface CentralCharacterReducer {

    /**
     * @param label Character label {@code "modulus.number"}.
     * @return Label of the inducing primitive character.
     * @throws IllegalArgumentException if the label is malformed or names no character.
     */
    String primitivize(String label);
}
