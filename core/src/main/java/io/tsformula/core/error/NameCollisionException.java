package io.tsformula.core.error;

/**
 * Thrown when a name is already taken: a formula would shadow a primary series, or a rename
 * target is already used or referenced.
 */
public final class NameCollisionException extends FormulaRegistrationException {

    private static final long serialVersionUID = 1L;

    public NameCollisionException(String message, String formulaName) {
        super(message, formulaName, null);
    }
}
