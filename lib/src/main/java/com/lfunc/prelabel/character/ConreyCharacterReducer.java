package com.lfunc.prelabel.character;

import java.util.Objects;

/** Primitivizes characters given by Conrey labels, memoizing through a {@link CharacterCache}. */
public final class ConreyCharacterReducer implements CentralCharacterReducer {
    private final CharacterCache cache;

    public ConreyCharacterReducer(CharacterCache cache) {
        this.cache = Objects.requireNonNull(cache, "cache");
    }

    @Override
    public String primitivize(String label) {
        return cache.primitive(label, this::reduce);
    }

    private String reduce(String label) {
        CharacterLabel character = CharacterLabel.parse(label);
        DirichletGroup group = cache.group(character.getModulus(), DirichletGroup::new);
        return group.primitive(character.getNumber()).toString();
    }
}
