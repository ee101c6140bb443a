package io.tsformula.core.spi;

import io.tsformula.core.model.Expr;
import java.util.Map;

/** Names the series an operator call refers to, each with the node referencing it. */
@FunctionalInterface
public interface SeriesFinder {

    Map<String, Expr.ListExpr> find(CatalogView catalog, Expr.ListExpr node);
}
