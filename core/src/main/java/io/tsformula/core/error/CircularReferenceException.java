package io.tsformula.core.error;

import java.util.List;

/** Thrown when inlining a formula reaches that same formula again. */
public final class CircularReferenceException extends FormulaRegistrationException {

    private static final long serialVersionUID = 1L;

    private final List<String> cycle;

    public CircularReferenceException(String message, String formulaName, List<String> cycle) {
        super(message, formulaName, null);
        this.cycle = List.copyOf(cycle);
    }

    /** The reference path, starting and ending with the same name. */
    public List<String> cycle() {
        return cycle;
    }
}
