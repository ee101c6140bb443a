package io.tsformula.core.error;

import java.util.List;

/**
 * Thrown when a referenced series does not exist. Raised at registration time (when unknown
 * references are rejected) or at evaluation time.
 */
public final class UnknownSeriesException extends FormulaException {

    private static final long serialVersionUID = 1L;

    private final List<String> seriesNames;

    public UnknownSeriesException(String message, String formulaName, Phase phase, List<String> seriesNames) {
        super(message, formulaName, phase);
        this.seriesNames = List.copyOf(seriesNames);
    }

    /** The unresolved series names. */
    public List<String> seriesNames() {
        return seriesNames;
    }
}
