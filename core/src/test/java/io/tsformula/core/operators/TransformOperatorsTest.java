package io.tsformula.core.operators;

import static io.tsformula.core.testkit.TestSeries.daily;
import static io.tsformula.core.testkit.TestSeries.day;
import static org.assertj.core.api.Assertions.assertThat;

import io.tsformula.core.engine.FormulaEngine;
import io.tsformula.core.model.QueryContext;
import io.tsformula.core.model.TimeSeries;
import io.tsformula.core.testkit.TestSeriesStore;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Transform operators")
class TransformOperatorsTest {

    private FormulaEngine engine;

    @BeforeEach
    void setUp() {
        TimeSeries holes = TimeSeries.builder()
                .put(day("2020-01-01"), 1)
                .put(day("2020-01-02"), Double.NaN)
                .put(day("2020-01-03"), 2)
                .build();
        TestSeriesStore store = new TestSeriesStore()
                .insert("x", day("2020-01-01"), daily("2020-01-01", 1, 2, 3))
                .insert("holes", day("2020-01-01"), holes)
                .insert("local", day("2020-01-01"), daily("2020-01-01", 7))
                .tzaware("local", false);
        engine = FormulaEngine.builder().seriesStore(store).build();
    }

    private Object eval(String text) {
        return engine.evalFormula(text, QueryContext.latest());
    }

    @Test
    void cumsumSkipsMissingValues() {
        assertThat(eval("(cumsum (series \"x\"))")).isEqualTo(daily("2020-01-01", 1, 3, 6));
        assertThat(eval("(cumsum (series \"holes\"))"))
                .isEqualTo(TimeSeries.builder()
                        .put(day("2020-01-01"), 1)
                        .put(day("2020-01-03"), 3)
                        .build());
    }

    @Test
    void clipDropsOrClampsOutOfBoundPoints() {
        assertThat(eval("(clip (series \"x\") #:min 2)")).isEqualTo(daily("2020-01-02", 2, 3));
        assertThat(eval("(clip (series \"x\") #:max 2 #:replacewithbounds #t)")).isEqualTo(daily("2020-01-01", 1, 2, 2));
        assertThat(eval("(clip (series \"x\"))")).isEqualTo(daily("2020-01-01", 1, 2, 3));
    }

    @Test
    void naiveMovesDatesToWallClockTime() {
        assertThat(eval("(naive (series \"x\") \"Asia/Tokyo\")"))
                .isEqualTo(TimeSeries.builder()
                        .put(Instant.parse("2020-01-01T09:00:00Z"), 1)
                        .put(Instant.parse("2020-01-02T09:00:00Z"), 2)
                        .put(Instant.parse("2020-01-03T09:00:00Z"), 3)
                        .build());
    }

    @Test
    void naiveFormulasAreNotTimezoneAware() {
        engine.register("tokyo", "(naive (series \"x\") \"Asia/Tokyo\")");
        engine.register("mixed", "(add (series \"local\") (naive (series \"x\") \"UTC\"))");

        assertThat(engine.metadata("tokyo").orElseThrow().get("tzaware").asBoolean()).isFalse();
        assertThat(engine.get("mixed", QueryContext.latest())).hasValue(daily("2020-01-01", 8));
    }
}
