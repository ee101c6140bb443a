package io.tsformula.core.engine;

import io.tsformula.core.model.QueryContext;
import java.util.HashMap;
import java.util.Map;

/**
 * Memo of sub-expression values for one top-level evaluation.
 *
 * <p>
 * Keys combine the serialized sub-tree, the serialized query context and the lexical scope id.
 * Values may be pending futures. Not thread-safe: only the orchestrating thread reads and writes
 * it.
 */
public final class EvaluationCache {

    private final Map<String, Object> entries = new HashMap<>();
    private int hits;
    private int misses;

    static String key(String serializedTree, QueryContext context, long scopeId) {
        return serializedTree + "|" + context.serialize() + "|" + scopeId;
    }

    boolean contains(String key) {
        boolean present = entries.containsKey(key);
        if (present) {
            hits++;
        } else {
            misses++;
        }
        return present;
    }

    Object get(String key) {
        return entries.get(key);
    }

    void put(String key, Object value) {
        entries.put(key, value);
    }

    public int size() {
        return entries.size();
    }

    public int hits() {
        return hits;
    }

    public int misses() {
        return misses;
    }
}
