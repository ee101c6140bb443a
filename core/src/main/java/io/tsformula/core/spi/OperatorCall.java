package io.tsformula.core.spi;

import io.tsformula.core.model.Expr;
import io.tsformula.core.model.QueryContext;
import io.tsformula.core.model.TimeSeries;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One application of an operator: its evaluated arguments bound to parameter names, the node it
 * was evaluated from, the active query context and the resolver serving named series.
 *
 * <p>
 * Omitted defaulted parameters are bound to their default value (possibly {@code null}). A packed
 * parameter is bound to a {@link List}.
 */
public final class OperatorCall {

    private final String operator;
    private final Expr.ListExpr tree;
    private final Map<String, Object> arguments;
    private final QueryContext context;
    private final SeriesResolver resolver;

    public OperatorCall(
            String operator,
            Expr.ListExpr tree,
            Map<String, Object> arguments,
            QueryContext context,
            SeriesResolver resolver) {
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.tree = Objects.requireNonNull(tree, "tree must not be null");
        this.arguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.resolver = resolver;
    }

    public String operator() {
        return operator;
    }

    public Expr.ListExpr tree() {
        return tree;
    }

    public QueryContext context() {
        return context;
    }

    public SeriesResolver resolver() {
        if (resolver == null) {
            throw new IllegalStateException("no series resolver bound to call of `" + operator + "`");
        }
        return resolver;
    }

    /** All bound arguments in declaration order. */
    public Map<String, Object> arguments() {
        return arguments;
    }

    /** Returns {@code true} when {@code param} is bound to a non-nil value. */
    public boolean has(String param) {
        return arguments.get(param) != null;
    }

    public Object get(String param) {
        if (!arguments.containsKey(param)) {
            throw new IllegalArgumentException("operator `" + operator + "` has no argument `" + param + "`");
        }
        return arguments.get(param);
    }

    public TimeSeries series(String param) {
        return as(param, TimeSeries.class);
    }

    /** The packed series bound to {@code param}, nested lists flattened. */
    public List<TimeSeries> seriesList(String param) {
        Object value = get(param);
        List<TimeSeries> out = new ArrayList<>();
        flatten(param, value, out);
        return out;
    }

    public double number(String param) {
        return as(param, Number.class).doubleValue();
    }

    /** The number bound to {@code param}, or {@code null} when nil. */
    public Double numberOrNull(String param) {
        Object value = get(param);
        return value == null ? null : as(param, Number.class).doubleValue();
    }

    public long integer(String param) {
        return as(param, Number.class).longValue();
    }

    public String string(String param) {
        Object value = get(param);
        return value == null ? null : as(param, String.class);
    }

    public Instant timestamp(String param) {
        Object value = get(param);
        return value == null ? null : as(param, Instant.class);
    }

    public boolean bool(String param) {
        return as(param, Boolean.class);
    }

    private <T> T as(String param, Class<T> type) {
        Object value = get(param);
        if (!type.isInstance(value)) {
            String actual = value == null ? "nil" : value.getClass().getSimpleName();
            throw new IllegalArgumentException("argument `" + param + "` of `" + operator + "` must be a "
                    + type.getSimpleName() + ", got " + actual);
        }
        return type.cast(value);
    }

    private void flatten(String param, Object value, List<TimeSeries> out) {
        if (value instanceof TimeSeries ts) {
            out.add(ts);
        } else if (value instanceof List<?> list) {
            for (Object item : list) {
                flatten(param, item, out);
            }
        } else if (value != null) {
            throw new IllegalArgumentException("argument `" + param + "` of `" + operator
                    + "` must hold series, got " + value.getClass().getSimpleName());
        }
    }

    @Override
    public String toString() {
        return "OperatorCall[" + operator + " " + arguments.keySet() + " @ " + context.serialize() + "]";
    }
}
