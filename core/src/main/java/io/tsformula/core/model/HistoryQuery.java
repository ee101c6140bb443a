package io.tsformula.core.model;

import java.time.Instant;

/**
 * Bounds and mode of a history query.
 *
 * @param fromInsertionDate inclusive lower revision bound, or {@code null}
 * @param toInsertionDate   inclusive upper revision bound, or {@code null}
 * @param fromValueDate     inclusive lower value-date bound, or {@code null}
 * @param toValueDate       inclusive upper value-date bound, or {@code null}
 * @param diffMode          when {@code true}, each snapshot is replaced by its delta against the
 *                          previous one
 */
public record HistoryQuery(
        Instant fromInsertionDate,
        Instant toInsertionDate,
        Instant fromValueDate,
        Instant toValueDate,
        boolean diffMode) {

    private static final HistoryQuery ALL = new HistoryQuery(null, null, null, null, false);

    /** The unbounded, non-diff query. */
    public static HistoryQuery all() {
        return ALL;
    }

    public HistoryQuery withInsertionDates(Instant from, Instant to) {
        return new HistoryQuery(from, to, fromValueDate, toValueDate, diffMode);
    }

    public HistoryQuery withValueDates(Instant from, Instant to) {
        return new HistoryQuery(fromInsertionDate, toInsertionDate, from, to, diffMode);
    }

    public HistoryQuery withDiffMode(boolean diff) {
        return new HistoryQuery(fromInsertionDate, toInsertionDate, fromValueDate, toValueDate, diff);
    }

    /** Returns {@code true} if {@code date} falls inside the insertion-date bounds. */
    public boolean admits(Instant date) {
        if (fromInsertionDate != null && date.isBefore(fromInsertionDate)) {
            return false;
        }
        return toInsertionDate == null || !date.isAfter(toInsertionDate);
    }

    /** The query context reading revision {@code date} within this query's value window. */
    public QueryContext contextAt(Instant date) {
        return new QueryContext(date, fromValueDate, toValueDate);
    }
}
