package io.tsformula.core.engine;

/** Behavioural flags of an operator, consulted by the evaluator, expander and history replay. */
public enum Capability {

    /** I/O-bound leaf; dispatched to the worker pool and resolved lazily. */
    DEPENDENT,

    /** Produces a series without any named series input. */
    AUTOTROPHIC,

    /** References a named series by its first argument; the unit of inlining. */
    NAMED_REFERENCE,

    /** Pins a revision date instead of inheriting the context's. */
    TIME_TRAVEL
}
