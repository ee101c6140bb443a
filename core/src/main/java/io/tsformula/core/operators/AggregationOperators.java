package io.tsformula.core.operators;

import io.tsformula.core.engine.OperatorDescriptor;
import io.tsformula.core.engine.OperatorRegistry;
import io.tsformula.core.engine.Signature;
import io.tsformula.core.model.TimeSeries;
import io.tsformula.core.spi.OperatorCall;
import io.tsformula.core.types.FormulaType;
import io.tsformula.core.types.FormulaType.Base;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** Row-wise aggregations over any number of series. */
final class AggregationOperators {

    private static final Signature PACKED_SERIES = Signature.builder()
            .param("serieslist", FormulaType.packed(Base.SERIES))
            .returns(Base.SERIES)
            .build();

    private AggregationOperators() {}

    static void register(OperatorRegistry registry) {
        registry.register(OperatorDescriptor.builder("add", AggregationOperators::add)
                .signature(PACKED_SERIES)
                .build());
        registry.register(OperatorDescriptor.builder("mul", AggregationOperators::mul)
                .signature(PACKED_SERIES)
                .build());
        registry.register(OperatorDescriptor.builder("priority", AggregationOperators::priority)
                .signature(PACKED_SERIES)
                .build());
        registry.register(OperatorDescriptor.builder("row-mean", AggregationOperators::rowMean)
                .signature(PACKED_SERIES)
                .build());
    }

    /** Sum of the rows where every series has a value (after filling). */
    private static Object add(OperatorCall call) {
        return Alignment.combineComplete(call.seriesList("serieslist"), row -> {
            double sum = 0;
            for (double v : row) {
                sum += v;
            }
            return sum;
        });
    }

    private static Object mul(OperatorCall call) {
        return Alignment.combineComplete(call.seriesList("serieslist"), row -> {
            double product = 1;
            for (double v : row) {
                product *= v;
            }
            return product;
        });
    }

    /** At each date, the value of the first series (in argument order) that has one. */
    private static Object priority(OperatorCall call) {
        List<TimeSeries> series = call.seriesList("serieslist");
        Alignment a = Alignment.of(series);
        Map<Instant, Double> out = new TreeMap<>();
        for (Instant d : a.dates()) {
            for (int c = 0; c < a.width(); c++) {
                Double v = a.value(c, d);
                if (v != null && !v.isNaN()) {
                    out.put(d, v);
                    break;
                }
            }
        }
        return TimeSeries.of(out);
    }

    /** Weighted mean of the values present at each date; weights come from {@code #:weight}. */
    private static Object rowMean(OperatorCall call) {
        Alignment a = Alignment.of(call.seriesList("serieslist"));
        Map<Instant, Double> out = new TreeMap<>();
        for (Instant d : a.dates()) {
            double total = 0;
            double weights = 0;
            for (int c = 0; c < a.width(); c++) {
                Double v = a.value(c, d);
                if (v != null && !v.isNaN()) {
                    total += v * a.weight(c);
                    weights += a.weight(c);
                }
            }
            if (weights != 0) {
                out.put(d, total / weights);
            }
        }
        return TimeSeries.of(out);
    }
}
