package io.tsformula.core.error;

/**
 * Abstract parent for registration-time errors. Thrown by {@code FormulaEngine.register()} and
 * {@code FormulaEngine.rename()} before anything is written. Carries the offending formula text.
 */
public abstract class FormulaRegistrationException extends FormulaException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected FormulaRegistrationException(String message, String formulaName, String source) {
        super(message, formulaName, Phase.REGISTRATION);
        this.source = source;
    }

    protected FormulaRegistrationException(String message, Throwable cause, String formulaName, String source) {
        super(message, cause, formulaName, Phase.REGISTRATION);
        this.source = source;
    }

    /** The formula text that caused the error, or {@code null}. */
    public String source() {
        return source;
    }
}
