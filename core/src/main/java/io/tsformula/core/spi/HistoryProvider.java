package io.tsformula.core.spi;

import io.tsformula.core.model.HistoryQuery;
import io.tsformula.core.model.TimeSeries;
import java.time.Instant;
import java.util.NavigableMap;

/**
 * Revision history of an autotrophic operator call. Call sites whose operator has no provider
 * are timeless: they evaluate to the same value at every revision.
 */
@FunctionalInterface
public interface HistoryProvider {

    NavigableMap<Instant, TimeSeries> history(OperatorCall call, HistoryQuery query);
}
