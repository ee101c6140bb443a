package io.tsformula.core.operators;

import io.tsformula.core.model.SeriesOptions;
import io.tsformula.core.model.TimeSeries;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Aligns several series on the union of their value dates, filling missing points according to
 * each series' {@link SeriesOptions}.
 */
final class Alignment {

    private final TreeSet<Instant> dates = new TreeSet<>();
    private final List<NavigableMap<Instant, Double>> columns = new ArrayList<>();
    private final List<Double> weights = new ArrayList<>();

    private Alignment() {}

    static Alignment of(List<TimeSeries> series) {
        Alignment a = new Alignment();
        series.forEach(ts -> a.dates.addAll(ts.points().keySet()));
        for (TimeSeries ts : series) {
            a.columns.add(fill(ts, a.dates));
            a.weights.add(ts.weight());
        }
        return a;
    }

    TreeSet<Instant> dates() {
        return dates;
    }

    int width() {
        return columns.size();
    }

    /** The value of column {@code col} at {@code date} after filling, or {@code null}. */
    Double value(int col, Instant date) {
        return columns.get(col).get(date);
    }

    double weight(int col) {
        return weights.get(col);
    }

    private static NavigableMap<Instant, Double> fill(TimeSeries ts, TreeSet<Instant> dates) {
        SeriesOptions opts = ts.options();
        NavigableMap<Instant, Double> out = new TreeMap<>(ts.points());
        if (!opts.hasFill() || ts.isEmpty() && opts.fillValue() == null) {
            return out;
        }
        if (opts.fillValue() != null) {
            for (Instant d : dates) {
                out.putIfAbsent(d, opts.fillValue());
            }
            return out;
        }
        boolean forward = "ffill".equals(opts.fillMethod());
        Iterable<Instant> order = forward ? dates : dates.descendingSet();
        Double carried = null;
        int run = 0;
        for (Instant d : order) {
            Double own = ts.points().get(d);
            if (own != null) {
                carried = own;
                run = 0;
                continue;
            }
            if (carried != null && (opts.limit() == null || run < opts.limit())) {
                out.put(d, carried);
                run++;
            }
        }
        return out;
    }

    /** Points where every column has a value, combined row-wise. */
    static TimeSeries combineComplete(List<TimeSeries> series, Combiner combiner) {
        Alignment a = of(series);
        Map<Instant, Double> out = new TreeMap<>();
        double[] row = new double[a.width()];
        for (Instant d : a.dates()) {
            boolean complete = true;
            for (int c = 0; c < a.width(); c++) {
                Double v = a.value(c, d);
                if (v == null || v.isNaN()) {
                    complete = false;
                    break;
                }
                row[c] = v;
            }
            if (complete) {
                out.put(d, combiner.combine(row));
            }
        }
        return TimeSeries.of(out);
    }

    @FunctionalInterface
    interface Combiner {
        double combine(double[] row);
    }
}
