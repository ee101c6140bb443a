package io.tsformula.core.error;

/**
 * Thrown when type checking fails: a literal or a sub-expression does not match the declared
 * parameter type, or the formula root does not return a series.
 */
public final class TypeMismatchException extends FormulaRegistrationException {

    private static final long serialVersionUID = 1L;

    private final String operator;
    private final String argument;
    private final String expected;
    private final String actual;

    public TypeMismatchException(
            String message,
            String formulaName,
            String source,
            String operator,
            String argument,
            String expected,
            String actual) {
        super(message, formulaName, source);
        this.operator = operator;
        this.argument = argument;
        this.expected = expected;
        this.actual = actual;
    }

    /** The operator whose argument failed, or {@code null} for a root type failure. */
    public String operator() {
        return operator;
    }

    /** The offending argument (parameter name or index), or {@code null}. */
    public String argument() {
        return argument;
    }

    public String expected() {
        return expected;
    }

    public String actual() {
        return actual;
    }
}
