package io.tsformula.core.error;

import java.util.Map;

/** Thrown when a formula mixes tz-aware and tz-naive series. */
public final class TimezoneIncompatibilityException extends FormulaRegistrationException {

    private static final long serialVersionUID = 1L;

    private final Map<String, String> awareness;

    public TimezoneIncompatibilityException(
            String message, String formulaName, String source, Map<String, String> awareness) {
        super(message, formulaName, source);
        this.awareness = Map.copyOf(awareness);
    }

    /** Series and call path ({@code name:op/op}) to {@code tzaware}, {@code tznaive} or {@code unknown}. */
    public Map<String, String> awareness() {
        return awareness;
    }
}
