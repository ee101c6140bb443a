package io.tsformula.core.spi;

import io.tsformula.core.model.HistoryQuery;
import io.tsformula.core.model.QueryContext;
import io.tsformula.core.model.SeriesMetadata;
import io.tsformula.core.model.TimeSeries;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.NavigableMap;
import java.util.Optional;

/**
 * Storage of primary series and their revision timelines.
 *
 * <p>
 * The formula engine never writes primary values; it reads snapshots, histories and metadata,
 * and forwards rename / delete requests for names it does not own.
 *
 * <p>
 * Implementations MUST be thread-safe: leaf reads are issued from the evaluation worker pool.
 */
public interface SeriesStore {

    /** Returns {@code true} if a primary series named {@code name} exists. */
    boolean exists(String name);

    /**
     * Reads the series as of {@code context.revisionDate()} (latest when {@code null}), restricted
     * to the context's value window.
     *
     * @return the snapshot, empty if the series does not exist; an existing series with no
     *     revision at that date yields an empty {@link TimeSeries}
     */
    Optional<TimeSeries> get(String name, QueryContext context);

    /**
     * Returns one snapshot per revision within the query's insertion-date bounds, each restricted
     * to its value window. Diff mode is resolved by the caller; stores always return full
     * snapshots.
     */
    NavigableMap<Instant, TimeSeries> history(String name, HistoryQuery query);

    /** Revision dates of the series within the inclusive bounds ({@code null} = unbounded). */
    List<Instant> insertionDates(String name, Instant from, Instant to);

    /** Core metadata of the series, empty when the series does not exist. */
    Optional<SeriesMetadata> metadata(String name);

    /** Renames a primary series. */
    void rename(String oldName, String newName);

    /** Deletes a primary series; returns {@code false} if it did not exist. */
    boolean delete(String name);

    /** Names of all primary series. */
    Collection<String> catalog();
}
