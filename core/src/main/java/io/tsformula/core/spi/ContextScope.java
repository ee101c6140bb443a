package io.tsformula.core.spi;

import io.tsformula.core.model.QueryContext;

/**
 * Local re-binding of the query context for one argument of an operator.
 *
 * <p>
 * The evaluator evaluates every other argument under the outer context, calls
 * {@link #rebind(OperatorCall)} with them, and evaluates the body argument under the returned
 * context. The outer context is never modified.
 */
public interface ContextScope {

    /** Name of the parameter evaluated under the re-bound context. */
    String bodyParameter();

    /**
     * Computes the body context. {@code call} holds every argument but the body, and
     * {@link OperatorCall#context()} is the outer context.
     */
    QueryContext rebind(OperatorCall call);
}
