package com.lfunc.prelabel.character;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.LongFunction;

/**
 * Process-wide memo of character groups (by modulus) and primitivizations (by label). Entries are
 * computed once per key and never evicted; concurrent callers block on the first computation.
 */
public final class CharacterCache {
    private final Map<Long, DirichletGroup> groups = new ConcurrentHashMap<>();
    private final Map<String, String> primitives = new ConcurrentHashMap<>();

    DirichletGroup group(long modulus, LongFunction<DirichletGroup> factory) {
        return groups.computeIfAbsent(modulus, factory::apply);
    }

    String primitive(String label, Function<String, String> reducer) {
        return primitives.computeIfAbsent(label, reducer);
    }

    public int groupCount() {
        return groups.size();
    }

    public int primitiveCount() {
        return primitives.size();
    }
}
