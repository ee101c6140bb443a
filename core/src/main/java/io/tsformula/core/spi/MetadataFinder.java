package io.tsformula.core.spi;

import io.tsformula.core.model.Expr;
import io.tsformula.core.model.SeriesMetadata;
import java.util.Map;
import java.util.function.Function;

/**
 * Reports the core metadata of the series below an operator call, keyed by series name. Names
 * whose metadata is unknown are left out.
 *
 * <p>
 * {@code descend} computes the default answer for any sub-expression, so a finder may transform
 * what its arguments report (e.g. forcing tz-naive metadata).
 */
@FunctionalInterface
public interface MetadataFinder {

    Map<String, SeriesMetadata> find(
            CatalogView catalog, Expr.ListExpr node, Function<Expr, Map<String, SeriesMetadata>> descend);
}
