package io.tsformula.core.model;

import java.time.Instant;

/**
 * Ambient query context of an evaluation: the revision date ("as of") and the value-date window.
 * Every field is nullable; {@code null} means "latest" for the revision date and "unbounded" for
 * the window bounds.
 *
 * <p>
 * Injected at top-level evaluation. Operators that shift time re-bind it for their body only.
 *
 * @param revisionDate  the revision to read, or {@code null} for the latest
 * @param fromValueDate inclusive lower value-date bound, or {@code null}
 * @param toValueDate   inclusive upper value-date bound, or {@code null}
 */
public record QueryContext(Instant revisionDate, Instant fromValueDate, Instant toValueDate) {

    private static final QueryContext LATEST = new QueryContext(null, null, null);

    /** The context reading the latest revision over the whole value range. */
    public static QueryContext latest() {
        return LATEST;
    }

    /** The context reading revision {@code revisionDate} over the whole value range. */
    public static QueryContext asOf(Instant revisionDate) {
        return new QueryContext(revisionDate, null, null);
    }

    public QueryContext withRevisionDate(Instant date) {
        return new QueryContext(date, fromValueDate, toValueDate);
    }

    public QueryContext withValueDates(Instant from, Instant to) {
        return new QueryContext(revisionDate, from, to);
    }

    /**
     * Stable textual form, used as part of evaluation cache keys. Two contexts serialize equally
     * if and only if they are equal.
     */
    public String serialize() {
        return "rev=" + revisionDate + ";from=" + fromValueDate + ";to=" + toValueDate;
    }
}
