package io.tsformula.core.error;

import java.time.Instant;

/**
 * Thrown when an operator fails during evaluation (runtime error in an operator body, failed
 * worker task, interrupted evaluation).
 */
public final class EvaluationFailedException extends FormulaEvalException {

    private static final long serialVersionUID = 1L;

    public EvaluationFailedException(String message, String formulaName, Instant revisionDate) {
        super(message, formulaName, revisionDate);
    }

    public EvaluationFailedException(String message, Throwable cause, String formulaName, Instant revisionDate) {
        super(message, cause, formulaName, revisionDate);
    }
}
