package io.tsformula.core.spi;

import io.tsformula.core.model.Expr;
import io.tsformula.core.model.QueryContext;
import io.tsformula.core.model.TimeSeries;
import java.util.Optional;

/**
 * Serves named series to the evaluator.
 *
 * <p>
 * The live resolver reads primaries from the store and evaluates formulas recursively. History
 * reconstruction swaps in a resolver answering from precomputed revision maps, so that the same
 * expression can be replayed at any past revision.
 */
public interface SeriesResolver {

    /**
     * Resolves {@code name} under {@code context}.
     *
     * @return the series, or empty if no series of that name is known
     */
    Optional<TimeSeries> series(String name, QueryContext context);

    /**
     * Returns the parsed definition of formula {@code name} when the evaluator should evaluate it
     * in place, or empty to resolve the name through {@link #series(String, QueryContext)}.
     */
    default Optional<Expr> definition(String name) {
        return Optional.empty();
    }

    /**
     * Returns a precomputed value for the autotrophic call site with canonical text {@code site},
     * or empty to let the operator compute it.
     */
    default Optional<TimeSeries> autotrophic(String site, QueryContext context) {
        return Optional.empty();
    }

    /** The catalog the resolver reads from. */
    CatalogView catalog();
}
