package io.tsformula.core.engine;

import java.util.Set;

/**
 * Knobs of formula expansion.
 *
 * @param stopNames names never inlined
 * @param showNames when non-empty, only branches that can reach one of these names are
 *                  inlined; references to the names themselves are kept
 * @param maxDepth  maximum nesting of inlined references, {@code -1} for unlimited
 * @param scopes    whether argument-scope rewriters run
 */
public record ExpansionOptions(Set<String> stopNames, Set<String> showNames, int maxDepth, boolean scopes) {

    /** Full expansion with rewriters. */
    public static final ExpansionOptions DEFAULT = new ExpansionOptions(Set.of(), Set.of(), -1, true);

    public ExpansionOptions {
        stopNames = stopNames == null ? Set.of() : Set.copyOf(stopNames);
        showNames = showNames == null ? Set.of() : Set.copyOf(showNames);
        if (maxDepth < -1) {
            throw new IllegalArgumentException("maxDepth must be -1 or non-negative, got: " + maxDepth);
        }
    }

    public static ExpansionOptions maxDepth(int depth) {
        return new ExpansionOptions(Set.of(), Set.of(), depth, true);
    }

    public ExpansionOptions withStopNames(Set<String> names) {
        return new ExpansionOptions(names, showNames, maxDepth, scopes);
    }

    public ExpansionOptions withShowNames(Set<String> names) {
        return new ExpansionOptions(stopNames, names, maxDepth, scopes);
    }

    public ExpansionOptions withScopes(boolean enabled) {
        return new ExpansionOptions(stopNames, showNames, maxDepth, enabled);
    }
}
