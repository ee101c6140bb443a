package io.tsformula.core.operators;

import io.tsformula.core.engine.Capability;
import io.tsformula.core.engine.OperatorDescriptor;
import io.tsformula.core.engine.OperatorRegistry;
import io.tsformula.core.engine.Signature;
import io.tsformula.core.model.Expr;
import io.tsformula.core.model.QueryContext;
import io.tsformula.core.spi.ContextScope;
import io.tsformula.core.spi.OperatorCall;
import io.tsformula.core.types.FormulaType;
import io.tsformula.core.types.FormulaType.Base;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Operators dealing with dates and revisions: {@code date}, {@code asof} and
 * {@code time-shifted}.
 */
final class TimeOperators {

    static final List<String> SHIFT_UNITS = List.of("days", "hours", "minutes");

    private TimeOperators() {}

    static void register(OperatorRegistry registry) {
        registry.register(OperatorDescriptor.builder("date", TimeOperators::date)
                .signature(Signature.builder()
                        .param("strdate", Base.STRING)
                        .keyword("tz", FormulaType.defaulted(Base.STRING, "UTC"))
                        .returns(Base.TIMESTAMP)
                        .build())
                .build());

        registry.register(OperatorDescriptor.builder("asof", call -> call.series("series"))
                .signature(Signature.builder()
                        .param("revision_date", Base.TIMESTAMP)
                        .param("series", Base.SERIES)
                        .returns(Base.SERIES)
                        .build())
                .capabilities(Capability.TIME_TRAVEL)
                .contextScope(new ContextScope() {
                    @Override
                    public String bodyParameter() {
                        return "series";
                    }

                    @Override
                    public QueryContext rebind(OperatorCall call) {
                        return call.context().withRevisionDate(call.timestamp("revision_date"));
                    }
                })
                .build());

        registry.register(OperatorDescriptor.builder("time-shifted", TimeOperators::timeShifted)
                .signature(Signature.builder()
                        .param("series", Base.SERIES)
                        .keyword("days", FormulaType.defaulted(Base.INT, 0))
                        .keyword("hours", FormulaType.defaulted(Base.INT, 0))
                        .keyword("minutes", FormulaType.defaulted(Base.INT, 0))
                        .returns(Base.SERIES)
                        .build())
                .contextScope(new ContextScope() {
                    @Override
                    public String bodyParameter() {
                        return "series";
                    }

                    @Override
                    public QueryContext rebind(OperatorCall call) {
                        Duration delta = shift(call);
                        QueryContext ctx = call.context();
                        return ctx.withValueDates(
                                ctx.fromValueDate() == null ? null : ctx.fromValueDate().minus(delta),
                                ctx.toValueDate() == null ? null : ctx.toValueDate().minus(delta));
                    }
                })
                .argScopeRewriter(TimeOperators::dropZeroShifts)
                .build());
    }

    /**
     * Parses {@code 2020-01-01}, {@code 2020-01-01T06:00[:00]} (local to {@code #:tz}) or a
     * date-time with an explicit offset.
     */
    private static Object date(OperatorCall call) {
        String text = call.string("strdate");
        ZoneId zone = ZoneId.of(call.string("tz"));
        try {
            if (text.length() == 10) {
                return LocalDate.parse(text).atStartOfDay(zone).toInstant();
            }
            if (text.endsWith("Z") || text.matches(".*[+-]\\d\\d:\\d\\d$")) {
                return OffsetDateTime.parse(text).toInstant();
            }
            return LocalDateTime.parse(text).atZone(zone).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("cannot parse date `" + text + "`", e);
        }
    }

    /** The series of the body, moved forward by the shift the body was read with. */
    private static Object timeShifted(OperatorCall call) {
        return call.series("series").shift(shift(call).getSeconds());
    }

    private static Duration shift(OperatorCall call) {
        return Duration.ofDays(call.integer("days"))
                .plusHours(call.integer("hours"))
                .plusMinutes(call.integer("minutes"));
    }

    /** Removes {@code #:days 0}-style keywords, which do not change the value. */
    static Expr.ListExpr dropZeroShifts(Expr.ListExpr node) {
        List<Expr> items = new ArrayList<>();
        items.add(node.items().get(0));
        List<Expr> args = node.args();
        for (int i = 0; i < args.size(); i++) {
            Expr arg = args.get(i);
            if (arg instanceof Expr.Keyword k
                    && SHIFT_UNITS.contains(k.name())
                    && i + 1 < args.size()
                    && args.get(i + 1) instanceof Expr.Int n
                    && n.value() == 0) {
                i++;
                continue;
            }
            items.add(arg);
        }
        return items.size() == node.items().size() ? node : new Expr.ListExpr(items);
    }
}
