package io.tsformula.core.operators;

import io.tsformula.core.engine.OperatorRegistry;

/** Entry point to the built-in operator library. */
public final class BuiltinOperators {

    private BuiltinOperators() {
        // utility class
    }

    /** Returns a new registry holding every built-in operator. */
    public static OperatorRegistry newRegistry() {
        OperatorRegistry registry = new OperatorRegistry();
        registerAll(registry);
        return registry;
    }

    /** Registers every built-in operator into {@code registry}, replacing same-named entries. */
    public static void registerAll(OperatorRegistry registry) {
        SeriesOperators.register(registry);
        ArithmeticOperators.register(registry);
        AggregationOperators.register(registry);
        TransformOperators.register(registry);
        TimeOperators.register(registry);
        ConstantOperator.register(registry);
    }
}
