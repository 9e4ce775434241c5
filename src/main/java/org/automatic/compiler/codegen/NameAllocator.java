package org.automatic.compiler.codegen;

import java.util.HashMap;
import java.util.Map;

/**
 * Hands out unique IR names. The first request for a base name gets it unchanged, later ones
 * get a numeric suffix: {@code X}, {@code X1}, {@code X2}.
 */
final class NameAllocator {
    private final Map<String, Integer> counters = new HashMap<>();

    /**
     * Marks a name as taken without the suffixing.
     * @param name The name.
     */
    void reserve(String name) {
        counters.putIfAbsent(name, 0);
    }

    /**
     * @param base The preferred name.
     * @return A name not handed out before.
     */
    String fresh(String base) {
        Integer seen = counters.get(base);
        if (seen == null) {
            counters.put(base, 0);
            return base;
        }
        int next = seen + 1;
        while (counters.containsKey(base + next)) {
            next++;
        }
        counters.put(base, next);
        counters.put(base + next, 0);
        return base + next;
    }
}
