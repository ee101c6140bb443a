package io.tsformula.core.operators;

import io.tsformula.core.engine.Capability;
import io.tsformula.core.engine.OperatorDescriptor;
import io.tsformula.core.engine.OperatorRegistry;
import io.tsformula.core.engine.Signature;
import io.tsformula.core.model.HistoryQuery;
import io.tsformula.core.model.QueryContext;
import io.tsformula.core.model.TimeSeries;
import io.tsformula.core.spi.OperatorCall;
import io.tsformula.core.types.FormulaType.Base;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code (constant value fromdate todate freq revdate)}: a series holding {@code value} at every
 * {@code freq} step of {@code [fromdate, todate]}, which exists from revision {@code revdate}
 * on.
 *
 * <p>
 * It reads no stored series, so its revision history is served by its own providers: one
 * revision, at {@code revdate}.
 */
final class ConstantOperator {

    private static final Pattern FREQ = Pattern.compile("(\\d*)(D|H|h|min|T|S|s)");

    private ConstantOperator() {}

    static void register(OperatorRegistry registry) {
        registry.register(OperatorDescriptor.builder("constant", ConstantOperator::constant)
                .signature(Signature.builder()
                        .param("value", Base.NUMBER)
                        .param("fromdate", Base.TIMESTAMP)
                        .param("todate", Base.TIMESTAMP)
                        .param("freq", Base.STRING)
                        .param("revdate", Base.TIMESTAMP)
                        .returns(Base.SERIES)
                        .build())
                .capabilities(Capability.AUTOTROPHIC, Capability.DEPENDENT)
                .historyProvider(ConstantOperator::history)
                .insertionDatesProvider((call, from, to) -> {
                    Instant revdate = call.timestamp("revdate");
                    return HistoryQuery.all().withInsertionDates(from, to).admits(revdate) ? List.of(revdate) : List.of();
                })
                .build());
    }

    private static Object constant(OperatorCall call) {
        QueryContext ctx = call.context();
        if (ctx.revisionDate() != null && ctx.revisionDate().isBefore(call.timestamp("revdate"))) {
            return TimeSeries.empty();
        }
        return generate(call).slice(ctx.fromValueDate(), ctx.toValueDate());
    }

    private static NavigableMap<Instant, TimeSeries> history(OperatorCall call, HistoryQuery query) {
        NavigableMap<Instant, TimeSeries> out = new TreeMap<>();
        Instant revdate = call.timestamp("revdate");
        if (query.admits(revdate)) {
            TimeSeries ts = generate(call).slice(query.fromValueDate(), query.toValueDate());
            if (!ts.isEmpty()) {
                out.put(revdate, ts);
            }
        }
        return out;
    }

    private static TimeSeries generate(OperatorCall call) {
        double value = call.number("value");
        Instant from = call.timestamp("fromdate");
        Instant to = call.timestamp("todate");
        Duration step = frequency(call.string("freq"));
        TimeSeries.Builder builder = TimeSeries.builder();
        for (Instant d = from; !d.isAfter(to); d = d.plus(step)) {
            builder.put(d, value);
        }
        return builder.build();
    }

    /** Parses {@code D}, {@code H}, {@code min}/{@code T}, {@code S} (optionally prefixed by a count) or an ISO-8601 duration. */
    static Duration frequency(String freq) {
        Matcher m = FREQ.matcher(freq);
        Duration step;
        if (m.matches()) {
            long count = m.group(1).isEmpty() ? 1 : Long.parseLong(m.group(1));
            step = switch (m.group(2)) {
                case "D" -> Duration.ofDays(count);
                case "H", "h" -> Duration.ofHours(count);
                case "min", "T" -> Duration.ofMinutes(count);
                default -> Duration.ofSeconds(count);
            };
        } else {
            try {
                step = Duration.parse(freq);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("unknown frequency `" + freq + "`", e);
            }
        }
        if (step.isZero() || step.isNegative()) {
            throw new IllegalArgumentException("frequency `" + freq + "` must be positive");
        }
        return step;
    }
}
