package io.tsformula.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tsformula.core.error.TypeMismatchException;
import io.tsformula.core.error.UnknownOperatorException;
import io.tsformula.core.operators.BuiltinOperators;
import io.tsformula.core.parse.FormulaParser;
import io.tsformula.core.types.FormulaType;
import io.tsformula.core.types.FormulaType.Base;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link TypeChecker} over the built-in operators. */
@DisplayName("TypeChecker")
class TypeCheckerTest {

    private final TypeChecker checker = new TypeChecker(BuiltinOperators.newRegistry());

    private FormulaType typeOf(String text) {
        TypeCheck result = checker.check(FormulaParser.parse(text));
        assertThat(result.ok()).as("type check of %s: %s", text, result).isTrue();
        return ((TypeCheck.Success) result).type();
    }

    private TypeCheck.Failure failureOf(String text) {
        TypeCheck result = checker.check(FormulaParser.parse(text));
        assertThat(result).isInstanceOf(TypeCheck.Failure.class);
        return (TypeCheck.Failure) result;
    }

    @Nested
    @DisplayName("Inference")
    class Inference {

        @Test
        void seriesReferences() {
            assertThat(typeOf("(series \"a\")")).isEqualTo(Base.SERIES);
            assertThat(typeOf("(add (series \"a\") (series \"b\" #:fill \"ffill\"))")).isEqualTo(Base.SERIES);
        }

        @Test
        void arithmeticIsNarrowed() {
            assertThat(typeOf("(+ 1 2)")).isEqualTo(Base.INT);
            assertThat(typeOf("(* 1 2.5)")).isEqualTo(Base.FLOAT);
            assertThat(typeOf("(/ 4 2)")).isEqualTo(Base.FLOAT);
            assertThat(typeOf("(+ 1 (series \"a\"))")).isEqualTo(Base.SERIES);
            assertThat(typeOf("(* (+ 1 2) (/ (series \"a\") 2))")).isEqualTo(Base.SERIES);
        }

        @Test
        void listsSpreadIntoVariadicParameters() {
            assertThat(typeOf("(add (find-series \"^a\") (series \"b\"))")).isEqualTo(Base.SERIES);
        }

        @Test
        void letBindingsAreTyped() {
            assertThat(typeOf("(let x (series \"a\") y (cumsum x) (add x y))")).isEqualTo(Base.SERIES);
            assertThat(typeOf("(let k 2 (* k 3))")).isEqualTo(Base.INT);
        }

        @Test
        void contextSymbolsAreTimestamps() {
            assertThat(typeOf("(asof revision_date (series \"a\"))")).isEqualTo(Base.SERIES);
            assertThat(typeOf("(asof (date \"2020-01-01\") (series \"a\"))")).isEqualTo(Base.SERIES);
        }

        @Test
        void defaultedArgumentsAcceptNil() {
            assertThat(typeOf("(clip (series \"a\") #:min nil #:max 10)")).isEqualTo(Base.SERIES);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        void wrongArgumentType() {
            TypeCheck.Failure failure = failureOf("(add (series \"a\") 1)");

            assertThat(failure.operator()).isEqualTo("add");
            assertThat(failure.argument()).isEqualTo("serieslist");
            assertThat(failure.expected()).isEqualTo("Series");
            assertThat(failure.actual()).isEqualTo("Integer");
        }

        @Test
        void wrongKeywordType() {
            TypeCheck.Failure failure = failureOf("(series \"a\" #:fill #t)");

            assertThat(failure.argument()).isEqualTo("fill");
            assertThat(failure.message()).contains("`#t`");
        }

        @Test
        void unknownKeyword() {
            assertThat(failureOf("(series \"a\" #:colour 1)").message()).contains("unknown keyword `#:colour`");
        }

        @Test
        void unboundSymbol() {
            assertThat(failureOf("(cumsum x)").message()).contains("unbound symbol `x`");
        }

        @Test
        void unknownOperatorsAreAllReported() {
            TypeCheck.Failure failure = failureOf("(frobnicate (series \"a\") (twiddle 1))");

            assertThat(failure.unknownOperators()).containsExactly("frobnicate", "twiddle");
        }
    }

    @Nested
    @DisplayName("requireType")
    class RequireType {

        @Test
        void rootMustBeASeries() {
            assertThatThrownBy(() -> checker.requireType(FormulaParser.parse("(+ 1 2)"), Base.SERIES, "f", "(+ 1 2)"))
                    .isInstanceOfSatisfying(TypeMismatchException.class, e -> {
                        assertThat(e.getMessage()).isEqualTo("formula `f` must return a `Series`, not `Integer`");
                        assertThat(e.formulaName()).isEqualTo("f");
                        assertThat(e.source()).isEqualTo("(+ 1 2)");
                        assertThat(e.expected()).isEqualTo("Series");
                        assertThat(e.actual()).isEqualTo("Integer");
                    });
        }

        @Test
        void unknownOperatorsRaiseTheirOwnException() {
            assertThatThrownBy(() -> checker.requireType(FormulaParser.parse("(nope 1)"), Base.SERIES, "f", "(nope 1)"))
                    .isInstanceOfSatisfying(
                            UnknownOperatorException.class, e -> assertThat(e.operators()).containsExactly("nope"));
        }

        @Test
        void argumentErrorsCarryTheOperator() {
            assertThatThrownBy(() -> checker.requireType(
                            FormulaParser.parse("(cumsum 3)"), Base.SERIES, "f", "(cumsum 3)"))
                    .isInstanceOfSatisfying(TypeMismatchException.class, e -> {
                        assertThat(e.operator()).isEqualTo("cumsum");
                        assertThat(e.argument()).isEqualTo("series");
                    });
        }

        @Test
        void returnsTheInferredType() {
            assertThat(checker.requireType(FormulaParser.parse("(cumsum (series \"a\"))"), Base.SERIES, "f", null))
                    .isEqualTo(Base.SERIES);
        }
    }
}
