package io.tsformula.core.store;

import io.tsformula.core.model.Formula;
import io.tsformula.core.spi.FormulaStore;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Heap-backed {@link FormulaStore}. Default store of a
 * {@link io.tsformula.core.engine.FormulaEngine} built without one.
 *
 * <p>
 * Thread-safe: formulas and edges live in {@link ConcurrentHashMap}s. Edge updates for one
 * formula are atomic; a reader may observe the edges of a concurrent registration before its
 * formula row.
 */
public final class InMemoryFormulaStore implements FormulaStore {

    private final Map<String, Formula> formulas = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> needs = new ConcurrentHashMap<>();

    @Override
    public Optional<Formula> find(String name) {
        return Optional.ofNullable(formulas.get(name));
    }

    @Override
    public void save(Formula formula) {
        Objects.requireNonNull(formula, "formula must not be null");
        formulas.put(formula.name(), formula);
    }

    @Override
    public boolean remove(String name) {
        boolean removed = formulas.remove(name) != null;
        needs.remove(name);
        needs.replaceAll((formula, edges) -> edges.contains(name) ? without(edges, name) : edges);
        return removed;
    }

    @Override
    public Collection<String> names() {
        return List.copyOf(formulas.keySet());
    }

    @Override
    public void replaceDependencies(String name, Set<String> needed) {
        Objects.requireNonNull(name, "name must not be null");
        if (needed == null || needed.isEmpty()) {
            needs.remove(name);
        } else {
            needs.put(name, Set.copyOf(needed));
        }
    }

    @Override
    public Set<String> dependenciesOf(String name) {
        return needs.getOrDefault(name, Set.of());
    }

    @Override
    public Set<String> directDependents(String name) {
        return needs.entrySet().stream()
                .filter(e -> e.getValue().contains(name))
                .map(Map.Entry::getKey)
                .collect(Collectors.toUnmodifiableSet());
    }

    private static Set<String> without(Set<String> edges, String name) {
        return edges.stream().filter(e -> !e.equals(name)).collect(Collectors.toUnmodifiableSet());
    }
}
