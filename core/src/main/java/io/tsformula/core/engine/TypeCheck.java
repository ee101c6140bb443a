package io.tsformula.core.engine;

import io.tsformula.core.types.FormulaType;
import java.util.List;

/** Outcome of type checking an expression. */
public sealed interface TypeCheck {

    boolean ok();

    /** The expression is well typed. */
    record Success(FormulaType type) implements TypeCheck {
        @Override
        public boolean ok() {
            return true;
        }
    }

    /**
     * The expression is ill typed.
     *
     * @param message          human readable explanation
     * @param operator         the operator whose call is at fault, or {@code null}
     * @param argument         the offending parameter, or {@code null}
     * @param expected         display name of the expected type, or {@code null}
     * @param actual           display name of the actual type, or {@code null}
     * @param unknownOperators every unknown operator of the expression (empty for type errors)
     */
    record Failure(
            String message,
            String operator,
            String argument,
            String expected,
            String actual,
            List<String> unknownOperators) implements TypeCheck {
        public Failure {
            unknownOperators = List.copyOf(unknownOperators);
        }

        @Override
        public boolean ok() {
            return false;
        }
    }
}
