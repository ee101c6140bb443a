package io.tsformula.core.operators;

import io.tsformula.core.engine.Capability;
import io.tsformula.core.engine.OperatorDescriptor;
import io.tsformula.core.engine.OperatorRegistry;
import io.tsformula.core.engine.Signature;
import io.tsformula.core.error.FormulaException;
import io.tsformula.core.error.FormulaSyntaxException;
import io.tsformula.core.error.TypeMismatchException;
import io.tsformula.core.error.UnknownSeriesException;
import io.tsformula.core.model.Expr;
import io.tsformula.core.model.SeriesMetadata;
import io.tsformula.core.model.SeriesOptions;
import io.tsformula.core.model.TimeSeries;
import io.tsformula.core.parse.FormulaSerializer;
import io.tsformula.core.spi.CatalogView;
import io.tsformula.core.spi.OperatorCall;
import io.tsformula.core.types.FormulaType;
import io.tsformula.core.types.FormulaType.Base;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Operators reading named series: {@code series}, {@code options} and {@code find-series}.
 */
final class SeriesOperators {

    private SeriesOperators() {}

    static void register(OperatorRegistry registry) {
        registry.register(OperatorDescriptor.builder("series", SeriesOperators::series)
                .signature(Signature.builder()
                        .param("name", Base.SERIES_NAME)
                        .keyword("fill", FormulaType.optional(FormulaType.union(Base.NUMBER, Base.STRING)))
                        .keyword("limit", FormulaType.optional(Base.INT))
                        .keyword("weight", FormulaType.optional(Base.NUMBER))
                        .returns(Base.SERIES)
                        .build())
                .capabilities(Capability.NAMED_REFERENCE, Capability.DEPENDENT)
                .seriesFinder((catalog, node) -> Map.of(nameOf(node), node))
                .metadataFinder((catalog, node, descend) -> metadataOf(catalog, List.of(nameOf(node))))
                .build());

        registry.register(OperatorDescriptor.builder("options", SeriesOperators::options)
                .signature(Signature.builder()
                        .param("series", Base.SERIES)
                        .keyword("fill", FormulaType.optional(FormulaType.union(Base.NUMBER, Base.STRING)))
                        .keyword("limit", FormulaType.optional(Base.INT))
                        .keyword("weight", FormulaType.optional(Base.NUMBER))
                        .returns(Base.SERIES)
                        .build())
                .build());

        registry.register(OperatorDescriptor.builder("find-series", SeriesOperators::findSeries)
                .signature(Signature.builder()
                        .param("pattern", Base.STRING)
                        .returns(FormulaType.listOf(Base.SERIES))
                        .build())
                .capabilities(Capability.DEPENDENT)
                .seriesFinder(SeriesOperators::matching)
                .metadataFinder((catalog, node, descend) -> metadataOf(catalog, matching(catalog, node).keySet()))
                .build());
    }

    private static Object series(OperatorCall call) {
        String name = call.string("name");
        TimeSeries ts = call.resolver()
                .series(name, call.context())
                .orElseThrow(() -> new UnknownSeriesException(
                        "unknown series `" + name + "`", name, FormulaException.Phase.EVALUATION, List.of(name)));
        return ts.withOptions(optionsOf(call));
    }

    private static Object options(OperatorCall call) {
        return call.series("series").withOptions(optionsOf(call));
    }

    private static Object findSeries(OperatorCall call) {
        List<TimeSeries> found = new ArrayList<>();
        for (String name : matching(call.resolver().catalog(), call.tree()).keySet()) {
            call.resolver().series(name, call.context()).ifPresent(found::add);
        }
        return found;
    }

    private static SeriesOptions optionsOf(OperatorCall call) {
        Long limit = call.has("limit") ? call.integer("limit") : null;
        return SeriesOptions.of(
                call.get("fill"), limit == null ? null : limit.intValue(), call.numberOrNull("weight"));
    }

    private static String nameOf(Expr.ListExpr node) {
        List<Expr> positional = node.positional();
        if (!positional.isEmpty() && positional.get(0) instanceof Expr.Str s) {
            return s.value();
        }
        String actual = positional.isEmpty() ? "nothing" : FormulaSerializer.serialize(positional.get(0));
        throw new TypeMismatchException(
                "`series` needs a literal name, got " + actual,
                null,
                FormulaSerializer.serialize(node),
                "series",
                "name",
                "literal string",
                actual);
    }

    /** Catalog names matching the pattern of a {@code find-series} node, each as a series reference. */
    private static Map<String, Expr.ListExpr> matching(CatalogView catalog, Expr.ListExpr node) {
        Map<String, Expr.ListExpr> found = new LinkedHashMap<>();
        List<Expr> positional = node.positional();
        if (positional.isEmpty() || !(positional.get(0) instanceof Expr.Str pattern)) {
            return found;
        }
        Pattern regex;
        try {
            regex = Pattern.compile(pattern.value());
        } catch (PatternSyntaxException e) {
            throw new FormulaSyntaxException(
                    "invalid `find-series` pattern \"" + pattern.value() + "\": " + e.getDescription(),
                    e,
                    null,
                    FormulaSerializer.serialize(node),
                    -1);
        }
        for (String name : catalog.names()) {
            if (regex.matcher(name).find()) {
                found.put(name, Expr.call("series", Expr.str(name)));
            }
        }
        return found;
    }

    private static Map<String, SeriesMetadata> metadataOf(CatalogView catalog, Iterable<String> names) {
        Map<String, SeriesMetadata> out = new LinkedHashMap<>();
        for (String name : names) {
            catalog.metadata(name).ifPresent(meta -> out.put(name, meta));
        }
        return out;
    }
}
