package io.tsformula.core.spi;

import io.tsformula.core.model.Formula;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence of formula definitions and of the dependency edges between formulas.
 *
 * <p>
 * An edge {@code (formula, needed)} records that {@code formula} directly references the formula
 * {@code needed}. Edges are fully replaced on every registration.
 *
 * <p>
 * Implementations MUST be thread-safe.
 */
public interface FormulaStore {

    Optional<Formula> find(String name);

    /** Inserts or replaces the formula with the same name. */
    void save(Formula formula);

    /**
     * Removes the formula and every edge touching it, in both directions; returns {@code false} if
     * it did not exist.
     */
    boolean remove(String name);

    /** Names of all stored formulas. */
    Collection<String> names();

    /** Replaces all outgoing edges of {@code name}. */
    void replaceDependencies(String name, Set<String> needs);

    /** Formulas directly needed by {@code name}. */
    Set<String> dependenciesOf(String name);

    /** Formulas that directly need {@code name}. */
    Set<String> directDependents(String name);
}
