package io.tsformula.core.operators;

import static io.tsformula.core.testkit.TestSeries.daily;
import static io.tsformula.core.testkit.TestSeries.day;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tsformula.core.engine.FormulaEngine;
import io.tsformula.core.error.EvaluationFailedException;
import io.tsformula.core.model.Expr;
import io.tsformula.core.model.QueryContext;
import io.tsformula.core.parse.FormulaParser;
import io.tsformula.core.parse.FormulaSerializer;
import io.tsformula.core.testkit.TestSeriesStore;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("Time operators")
class TimeOperatorsTest {

    private FormulaEngine engine;

    @BeforeEach
    void setUp() {
        TestSeriesStore store = new TestSeriesStore()
                .insert("x", day("2020-01-01"), daily("2020-01-01", 1, 2))
                .insert("x", day("2020-01-03"), daily("2020-01-01", 1, 5, 7));
        engine = FormulaEngine.builder().seriesStore(store).build();
    }

    private Object eval(String text) {
        return engine.evalFormula(text, QueryContext.latest());
    }

    @Nested
    @DisplayName("date")
    class Date {

        @ParameterizedTest(name = "{0}")
        @CsvSource(
                delimiter = '|',
                value = {
                    "(date \"2020-01-01\")|2020-01-01T00:00:00Z",
                    "(date \"2020-01-01\" #:tz \"Europe/Paris\")|2019-12-31T23:00:00Z",
                    "(date \"2020-01-01T06:30\")|2020-01-01T06:30:00Z",
                    "(date \"2020-01-01T06:00:00+02:00\")|2020-01-01T04:00:00Z",
                    "(date \"2020-06-01T12:00:00Z\" #:tz \"Asia/Tokyo\")|2020-06-01T12:00:00Z"
                })
        void parsesDatesAndDateTimes(String text, String expected) {
            assertThat(eval(text)).isEqualTo(Instant.parse(expected));
        }

        @Test
        void unparsableDatesFailTheOperator() {
            assertThatThrownBy(() -> eval("(date \"first of may\")"))
                    .isInstanceOf(EvaluationFailedException.class)
                    .hasMessageContaining("cannot parse date `first of may`")
                    .hasCauseInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("asof")
    class AsOf {

        @Test
        void readsItsBodyAtAnotherRevision() {
            assertThat(eval("(asof (date \"2020-01-02\") (series \"x\"))")).isEqualTo(daily("2020-01-01", 1, 2));
            assertThat(eval("(series \"x\")")).isEqualTo(daily("2020-01-01", 1, 5, 7));
        }

        @Test
        void keepsTheValueWindow() {
            QueryContext window = QueryContext.latest().withValueDates(day("2020-01-02"), null);

            assertThat(engine.evalFormula("(asof (date \"2020-01-02\") (series \"x\"))", window))
                    .isEqualTo(daily("2020-01-02", 2));
        }
    }

    @Nested
    @DisplayName("time-shifted")
    class TimeShifted {

        @Test
        void movesValueDatesForward() {
            assertThat(eval("(time-shifted (series \"x\") #:days 1)")).isEqualTo(daily("2020-01-02", 1, 5, 7));
            assertThat(eval("(time-shifted (series \"x\") #:days -1 #:hours 24)")).isEqualTo(daily("2020-01-01", 1, 5, 7));
        }

        @Test
        void readsTheBodyOverTheShiftedWindow() {
            QueryContext window = QueryContext.latest().withValueDates(day("2020-01-03"), day("2020-01-04"));

            assertThat(engine.evalFormula("(time-shifted (series \"x\") #:days 2)", window))
                    .isEqualTo(daily("2020-01-03", 1, 5));
        }

        @Test
        void zeroShiftsAreDroppedByTheRewriter() {
            Expr.ListExpr node = (Expr.ListExpr) FormulaParser.parse("(time-shifted (series \"x\") #:days 0 #:hours 2)");
            Expr.ListExpr plain = (Expr.ListExpr) FormulaParser.parse("(time-shifted (series \"x\") #:hours 2)");

            assertThat(FormulaSerializer.serialize(TimeOperators.dropZeroShifts(node)))
                    .isEqualTo("(time-shifted (series \"x\") #:hours 2)");
            assertThat(TimeOperators.dropZeroShifts(plain)).isSameAs(plain);
        }
    }
}
