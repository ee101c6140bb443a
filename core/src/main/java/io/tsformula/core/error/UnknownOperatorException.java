package io.tsformula.core.error;

import java.util.List;

/** Thrown when a formula refers to operators absent from the registry. Names every one of them. */
public final class UnknownOperatorException extends FormulaRegistrationException {

    private static final long serialVersionUID = 1L;

    private final List<String> operators;

    public UnknownOperatorException(String message, String formulaName, String source, List<String> operators) {
        super(message, formulaName, source);
        this.operators = List.copyOf(operators);
    }

    /** The unknown operator names, in order of first appearance. */
    public List<String> operators() {
        return operators;
    }
}
