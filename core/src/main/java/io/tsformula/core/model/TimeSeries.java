package io.tsformula.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.DoubleUnaryOperator;

/**
 * Immutable time-indexed series of doubles, sorted by value date.
 *
 * <p>
 * A series may carry {@link SeriesOptions} attached by the {@code series} and {@code options}
 * operators. Options never take part in {@link #equals(Object)}.
 *
 * <p>
 * Thread-safe and immutable.
 */
public final class TimeSeries {

    private static final TimeSeries EMPTY = new TimeSeries(new TreeMap<>(), SeriesOptions.NONE);

    private final NavigableMap<Instant, Double> points;
    private final SeriesOptions options;

    private TimeSeries(NavigableMap<Instant, Double> points, SeriesOptions options) {
        this.points = Collections.unmodifiableNavigableMap(points);
        this.options = options;
    }

    /** Returns the empty series. */
    public static TimeSeries empty() {
        return EMPTY;
    }

    /** Creates a series from the given points (defensively copied). */
    public static TimeSeries of(Map<Instant, Double> points) {
        Objects.requireNonNull(points, "points must not be null");
        return new TimeSeries(new TreeMap<>(points), SeriesOptions.NONE);
    }

    /** Creates a single-point series. */
    public static TimeSeries of(Instant date, double value) {
        TreeMap<Instant, Double> map = new TreeMap<>();
        map.put(date, value);
        return new TimeSeries(map, SeriesOptions.NONE);
    }

    /** Returns a builder for incremental construction. */
    public static Builder builder() {
        return new Builder();
    }

    /** Unmodifiable view of the points. */
    public NavigableMap<Instant, Double> points() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    /** Returns the value at {@code date}, or {@code null}. */
    public Double get(Instant date) {
        return points.get(date);
    }

    /** The options attached by the {@code series} or {@code options} operators. */
    public SeriesOptions options() {
        return options;
    }

    /** The weight attached by options, {@code 1.0} by default. */
    public double weight() {
        return options.weight();
    }

    /** Returns a copy carrying the given options. */
    public TimeSeries withOptions(SeriesOptions newOptions) {
        return new TimeSeries(points, newOptions);
    }

    /** Returns a copy without attached options. */
    public TimeSeries withoutOptions() {
        if (options.equals(SeriesOptions.NONE)) {
            return this;
        }
        return new TimeSeries(points, SeriesOptions.NONE);
    }

    /**
     * Restricts the series to the inclusive value-date window. A {@code null} bound is
     * unbounded.
     */
    public TimeSeries slice(Instant from, Instant to) {
        if (from == null && to == null) {
            return this;
        }
        NavigableMap<Instant, Double> view = points;
        if (from != null && to != null) {
            if (from.isAfter(to)) {
                return new TimeSeries(new TreeMap<>(), options);
            }
            view = points.subMap(from, true, to, true);
        } else if (from != null) {
            view = points.tailMap(from, true);
        } else {
            view = points.headMap(to, true);
        }
        return new TimeSeries(new TreeMap<>(view), options);
    }

    /** Applies {@code fn} to every value. */
    public TimeSeries map(DoubleUnaryOperator fn) {
        TreeMap<Instant, Double> out = new TreeMap<>();
        points.forEach((k, v) -> out.put(k, fn.applyAsDouble(v)));
        return new TimeSeries(out, SeriesOptions.NONE);
    }

    /** Shifts every value date by the given amount of seconds. */
    public TimeSeries shift(long seconds) {
        TreeMap<Instant, Double> out = new TreeMap<>();
        points.forEach((k, v) -> out.put(k.plusSeconds(seconds), v));
        return new TimeSeries(out, options);
    }

    /**
     * Computes the points of {@code next} that differ from this series: new or changed values,
     * and {@code NaN} for points that disappeared.
     */
    public TimeSeries diff(TimeSeries next) {
        TreeMap<Instant, Double> out = new TreeMap<>();
        next.points.forEach((k, v) -> {
            Double old = points.get(k);
            if (old == null || Double.compare(old, v) != 0) {
                out.put(k, v);
            }
        });
        points.keySet().forEach(k -> {
            if (!next.points.containsKey(k)) {
                out.put(k, Double.NaN);
            }
        });
        return new TimeSeries(out, SeriesOptions.NONE);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeSeries that)) return false;
        return points.equals(that.points);
    }

    @Override
    public int hashCode() {
        return points.hashCode();
    }

    @Override
    public String toString() {
        return "TimeSeries" + points;
    }

    /** Mutable builder; not thread-safe. */
    public static final class Builder {

        private final TreeMap<Instant, Double> points = new TreeMap<>();

        Builder() {}

        public Builder put(Instant date, double value) {
            points.put(Objects.requireNonNull(date, "date must not be null"), value);
            return this;
        }

        public TimeSeries build() {
            return new TimeSeries(new TreeMap<>(points), SeriesOptions.NONE);
        }
    }
}
