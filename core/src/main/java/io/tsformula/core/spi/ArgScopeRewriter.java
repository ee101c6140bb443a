package io.tsformula.core.spi;

import io.tsformula.core.model.Expr;

/**
 * Rewrites an operator call after its arguments were expanded. Must preserve the value the node
 * evaluates to; the expanded form feeds content hashes and history replay.
 */
@FunctionalInterface
public interface ArgScopeRewriter {

    Expr.ListExpr rewrite(Expr.ListExpr expanded);
}
