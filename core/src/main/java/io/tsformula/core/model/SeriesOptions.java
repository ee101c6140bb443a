package io.tsformula.core.model;

import java.util.Set;

/**
 * Evaluation options attached to a series by the {@code series} and {@code options} operators.
 *
 * <p>
 * They drive how the series is aligned with others: missing points are filled with
 * {@code fillValue}, or propagated by {@code fillMethod} ({@code ffill} / {@code bfill}) over at
 * most {@code limit} consecutive points. {@code weight} is used by weighted aggregations.
 *
 * @param fillValue  constant fill, or {@code null}
 * @param fillMethod propagation method, or {@code null}
 * @param limit      maximum consecutive points filled by propagation, or {@code null} for no limit
 * @param weight     aggregation weight
 */
public record SeriesOptions(Double fillValue, String fillMethod, Integer limit, double weight) {

    /** No fill, weight 1. */
    public static final SeriesOptions NONE = new SeriesOptions(null, null, null, 1.0);

    private static final Set<String> METHODS = Set.of("ffill", "bfill");

    public SeriesOptions {
        if (fillMethod != null && !METHODS.contains(fillMethod)) {
            throw new IllegalArgumentException("fill must be a number, `ffill` or `bfill`, got: " + fillMethod);
        }
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must not be negative, got: " + limit);
        }
    }

    /**
     * Builds options from an operator argument that is either a number or a method name.
     *
     * @throws IllegalArgumentException for any other fill value
     */
    public static SeriesOptions of(Object fill, Integer limit, Double weight) {
        double w = weight != null ? weight : 1.0;
        if (fill == null) {
            return new SeriesOptions(null, null, limit, w);
        }
        if (fill instanceof Number n) {
            return new SeriesOptions(n.doubleValue(), null, limit, w);
        }
        return new SeriesOptions(null, fill.toString(), limit, w);
    }

    public boolean hasFill() {
        return fillValue != null || fillMethod != null;
    }
}
