package io.tsformula.core.error;

/** Thrown when formula text is malformed. Rejected before anything is written. */
public final class FormulaSyntaxException extends FormulaRegistrationException {

    private static final long serialVersionUID = 1L;

    private final int position;

    public FormulaSyntaxException(String message, String formulaName, String source, int position) {
        super(message, formulaName, source);
        this.position = position;
    }

    public FormulaSyntaxException(String message, Throwable cause, String formulaName, String source, int position) {
        super(message, cause, formulaName, source);
        this.position = position;
    }

    /** Zero-based character offset where parsing failed, or {@code -1}. */
    public int position() {
        return position;
    }
}
