package io.tsformula.core.operators;

import io.tsformula.core.engine.OperatorDescriptor;
import io.tsformula.core.engine.OperatorRegistry;
import io.tsformula.core.engine.Signature;
import io.tsformula.core.model.TimeSeries;
import io.tsformula.core.spi.OperatorCall;
import io.tsformula.core.spi.ReturnTypeNarrower;
import io.tsformula.core.types.FormulaType;
import io.tsformula.core.types.FormulaType.Base;
import java.util.List;
import java.util.function.DoubleBinaryOperator;
import java.util.function.LongBinaryOperator;

/**
 * Binary arithmetic between numbers and series: {@code +}, {@code *} and {@code /}.
 *
 * <p>
 * Two numbers give a number; a number and a series apply the number to every point; two series
 * are combined on their common dates.
 */
final class ArithmeticOperators {

    private static final FormulaType OPERAND = FormulaType.union(Base.NUMBER, Base.SERIES);

    private ArithmeticOperators() {}

    static void register(OperatorRegistry registry) {
        registry.register(binary("+", (a, b) -> a + b, Math::addExact, false));
        registry.register(binary("*", (a, b) -> a * b, Math::multiplyExact, false));
        registry.register(binary("/", (a, b) -> a / b, null, true));
    }

    private static OperatorDescriptor binary(
            String name, DoubleBinaryOperator op, LongBinaryOperator integral, boolean floating) {
        return OperatorDescriptor.builder(name, call -> apply(call, op, integral))
                .signature(Signature.builder()
                        .param("a", OPERAND)
                        .param("b", OPERAND)
                        .returns(OPERAND)
                        .build())
                .returnTypeNarrower(narrower(floating))
                .build();
    }

    /** Series if either operand may be a series; otherwise the numeric join ({@code Float} for division). */
    static ReturnTypeNarrower narrower(boolean floating) {
        return (declared, args) -> {
            FormulaType a = args.get("a");
            FormulaType b = args.get("b");
            if (FormulaType.isSeriesLike(a) || FormulaType.isSeriesLike(b)) {
                return Base.SERIES;
            }
            if (FormulaType.isNumeric(a) && FormulaType.isNumeric(b)) {
                return floating ? Base.FLOAT : FormulaType.numericJoin(a, b);
            }
            return declared;
        };
    }

    private static Object apply(OperatorCall call, DoubleBinaryOperator op, LongBinaryOperator integral) {
        Object a = call.get("a");
        Object b = call.get("b");
        if (a instanceof TimeSeries sa && b instanceof TimeSeries sb) {
            return Alignment.combineComplete(List.of(sa, sb), row -> op.applyAsDouble(row[0], row[1]));
        }
        if (a instanceof TimeSeries sa) {
            double k = call.number("b");
            return sa.map(v -> op.applyAsDouble(v, k));
        }
        if (b instanceof TimeSeries sb) {
            double k = call.number("a");
            return sb.map(v -> op.applyAsDouble(k, v));
        }
        if (integral != null && a instanceof Long la && b instanceof Long lb) {
            return integral.applyAsLong(la, lb);
        }
        return op.applyAsDouble(call.number("a"), call.number("b"));
    }
}
