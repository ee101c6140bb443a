package io.tsformula.core.engine;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Lexical scope of {@code let} bindings. Each scope has an id unique within one evaluation,
 * which takes part in cache keys so that equal sub-trees under different bindings never share an
 * entry.
 */
final class Env {

    private final Env parent;
    private final long id;
    private final Map<String, Object> bindings = new HashMap<>();

    Env(Env parent, long id) {
        this.parent = parent;
        this.id = id;
    }

    static Env root() {
        return new Env(null, 0);
    }

    long id() {
        return id;
    }

    void bind(String name, Object value) {
        bindings.put(name, value);
    }

    /** Looks {@code name} up in this scope, then in enclosing scopes. */
    Optional<Object> lookup(String name) {
        for (Env env = this; env != null; env = env.parent) {
            if (env.bindings.containsKey(name)) {
                return Optional.ofNullable(env.bindings.get(name)).or(() -> Optional.of(Nil.VALUE));
            }
        }
        return Optional.empty();
    }

    /** Marker for a symbol bound to nil, distinguishable from an unbound one. */
    enum Nil {
        VALUE
    }
}
