package io.tsformula.core.error;

/**
 * Abstract base for all formula engine exceptions. Never thrown directly; use the concrete
 * subclasses under {@link FormulaRegistrationException} or {@link FormulaEvalException}, or
 * {@link UnknownSeriesException} which may surface in either phase.
 */
public abstract class FormulaException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        REGISTRATION,
        EVALUATION
    }

    private final String formulaName;
    private final Phase phase;

    protected FormulaException(String message, String formulaName, Phase phase) {
        super(message);
        this.formulaName = formulaName;
        this.phase = phase;
    }

    protected FormulaException(String message, Throwable cause, String formulaName, Phase phase) {
        super(message, cause);
        this.formulaName = formulaName;
        this.phase = phase;
    }

    /** The formula that triggered the error, or {@code null} for anonymous expressions. */
    public String formulaName() {
        return formulaName;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
