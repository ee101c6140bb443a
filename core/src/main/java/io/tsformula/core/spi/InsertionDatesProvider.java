package io.tsformula.core.spi;

import java.time.Instant;
import java.util.List;

/** Revision dates of an autotrophic operator call within inclusive bounds. */
@FunctionalInterface
public interface InsertionDatesProvider {

    List<Instant> insertionDates(OperatorCall call, Instant from, Instant to);
}
