package io.tsformula.core.operators;

import io.tsformula.core.engine.OperatorDescriptor;
import io.tsformula.core.engine.OperatorRegistry;
import io.tsformula.core.engine.Signature;
import io.tsformula.core.model.SeriesMetadata;
import io.tsformula.core.model.TimeSeries;
import io.tsformula.core.spi.OperatorCall;
import io.tsformula.core.types.FormulaType;
import io.tsformula.core.types.FormulaType.Base;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/** Single-series transformations: {@code cumsum}, {@code clip} and {@code naive}. */
final class TransformOperators {

    private TransformOperators() {}

    static void register(OperatorRegistry registry) {
        registry.register(OperatorDescriptor.builder("cumsum", TransformOperators::cumsum)
                .signature(Signature.builder()
                        .param("series", Base.SERIES)
                        .returns(Base.SERIES)
                        .build())
                .build());

        registry.register(OperatorDescriptor.builder("clip", TransformOperators::clip)
                .signature(Signature.builder()
                        .param("series", Base.SERIES)
                        .keyword("min", FormulaType.optional(Base.NUMBER))
                        .keyword("max", FormulaType.optional(Base.NUMBER))
                        .keyword("replacewithbounds", FormulaType.defaulted(Base.BOOLEAN, false))
                        .returns(Base.SERIES)
                        .build())
                .build());

        registry.register(OperatorDescriptor.builder("naive", TransformOperators::naive)
                .signature(Signature.builder()
                        .param("series", Base.SERIES)
                        .param("tzone", Base.STRING)
                        .returns(Base.SERIES)
                        .build())
                .metadataFinder((catalog, node, descend) -> {
                    Map<String, SeriesMetadata> out = new LinkedHashMap<>();
                    for (var child : node.positional()) {
                        descend.apply(child).keySet().forEach(name -> out.put(name, SeriesMetadata.NAIVE));
                    }
                    return out;
                })
                .build());
    }

    private static Object cumsum(OperatorCall call) {
        Map<Instant, Double> out = new TreeMap<>();
        double running = 0;
        for (Map.Entry<Instant, Double> point : call.series("series").points().entrySet()) {
            if (point.getValue().isNaN()) {
                continue;
            }
            running += point.getValue();
            out.put(point.getKey(), running);
        }
        return TimeSeries.of(out);
    }

    /** Drops points outside {@code [min, max]}, or moves them onto the bound with {@code #:replacewithbounds}. */
    private static Object clip(OperatorCall call) {
        Double min = call.numberOrNull("min");
        Double max = call.numberOrNull("max");
        boolean replace = call.bool("replacewithbounds");
        Map<Instant, Double> out = new TreeMap<>();
        call.series("series").points().forEach((date, value) -> {
            if (min != null && value < min) {
                if (replace) {
                    out.put(date, min);
                }
            } else if (max != null && value > max) {
                if (replace) {
                    out.put(date, max);
                }
            } else {
                out.put(date, value);
            }
        });
        return TimeSeries.of(out);
    }

    /**
     * Converts value dates to wall-clock time in {@code tzone}, then keeps them as naive dates
     * (encoded as UTC instants).
     */
    private static Object naive(OperatorCall call) {
        ZoneId zone = ZoneId.of(call.string("tzone"));
        Map<Instant, Double> out = new TreeMap<>();
        call.series("series").points().forEach((date, value) -> {
            LocalDateTime local = LocalDateTime.ofInstant(date, zone);
            out.put(local.toInstant(ZoneOffset.UTC), value);
        });
        return TimeSeries.of(out);
    }
}
