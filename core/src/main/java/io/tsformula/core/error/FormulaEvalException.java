package io.tsformula.core.error;

import java.time.Instant;

/**
 * Abstract parent for evaluation errors. An evaluation failure aborts the whole evaluation: no
 * partial series is ever returned. Carries the revision date being evaluated when the failure
 * happened inside a history reconstruction.
 */
public abstract class FormulaEvalException extends FormulaException {

    private static final long serialVersionUID = 1L;

    private final Instant revisionDate;

    protected FormulaEvalException(String message, String formulaName, Instant revisionDate) {
        super(message, formulaName, Phase.EVALUATION);
        this.revisionDate = revisionDate;
    }

    protected FormulaEvalException(String message, Throwable cause, String formulaName, Instant revisionDate) {
        super(message, cause, formulaName, Phase.EVALUATION);
        this.revisionDate = revisionDate;
    }

    /** The revision date under evaluation, or {@code null} outside history reconstruction. */
    public Instant revisionDate() {
        return revisionDate;
    }
}
