package io.tsformula.core.engine;

import static io.tsformula.core.testkit.TestSeries.daily;
import static io.tsformula.core.testkit.TestSeries.day;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tsformula.core.error.EvaluationFailedException;
import io.tsformula.core.error.FormulaException;
import io.tsformula.core.error.UnknownSeriesException;
import io.tsformula.core.model.HistoryQuery;
import io.tsformula.core.model.QueryContext;
import io.tsformula.core.model.TimeSeries;
import io.tsformula.core.operators.BuiltinOperators;
import io.tsformula.core.testkit.TestSeriesStore;
import io.tsformula.core.types.FormulaType.Base;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.NavigableMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** History reconstruction of formulas, exercised through {@link FormulaEngine#history}. */
@DisplayName("HistoryReconstructor")
class HistoryReconstructorTest {

    private TestSeriesStore store;
    private FormulaEngine engine;

    @BeforeEach
    void setUp() {
        store = new TestSeriesStore()
                .insert("a", day("2020-01-01"), daily("2020-01-01", 1, 2, 3))
                .insert("a", day("2020-01-03"), daily("2020-01-01", 1, 2, 3, 4))
                .insert("a", day("2020-01-05"), daily("2020-01-01", 1, 5, 3, 4))
                .insert("b", day("2020-01-02"), daily("2020-01-01", 10, 20, 30, 40))
                .insert("b", day("2020-01-04"), daily("2020-01-01", 10, 20, 30, 40, 50));
        engine = FormulaEngine.builder()
                .seriesStore(store)
                .config(EngineConfig.DEFAULT.withConcurrency(2))
                .build();
        engine.register("sum", "(add (series \"a\") (series \"b\"))");
    }

    /** Every reconstructed snapshot must equal a direct evaluation as of its date. */
    private void assertConsistentWithGet(String name, HistoryQuery query, NavigableMap<Instant, TimeSeries> history) {
        for (Map.Entry<Instant, TimeSeries> entry : history.entrySet()) {
            assertThat(engine.get(name, query.contextAt(entry.getKey())))
                    .as("%s as of %s", name, entry.getKey())
                    .hasValue(entry.getValue());
        }
    }

    @Nested
    @DisplayName("Snapshots")
    class Snapshots {

        @Test
        void oneSnapshotPerLeafRevisionEmptyOnesPruned() {
            NavigableMap<Instant, TimeSeries> history = engine.history("sum", HistoryQuery.all());

            assertThat(history.keySet())
                    .containsExactly(day("2020-01-02"), day("2020-01-03"), day("2020-01-04"), day("2020-01-05"));
            assertThat(history.get(day("2020-01-02"))).isEqualTo(daily("2020-01-01", 11, 22, 33));
            assertThat(history.get(day("2020-01-05"))).isEqualTo(daily("2020-01-01", 11, 25, 33, 44));
            assertConsistentWithGet("sum", HistoryQuery.all(), history);
        }

        @Test
        void valueWindowIsApplied() {
            HistoryQuery query = HistoryQuery.all().withValueDates(day("2020-01-02"), day("2020-01-03"));

            NavigableMap<Instant, TimeSeries> history = engine.history("sum", query);

            assertThat(history.get(day("2020-01-05"))).isEqualTo(daily("2020-01-02", 25, 33));
            assertConsistentWithGet("sum", query, history);
        }

        @Test
        void nestedFormulasAreReplayedThroughTheirLeaves() {
            engine.register("scaled", "(* 2 (series \"sum\"))");

            NavigableMap<Instant, TimeSeries> history = engine.history("scaled", HistoryQuery.all());

            assertThat(history).hasSize(4);
            assertThat(history.lastEntry().getValue()).isEqualTo(daily("2020-01-01", 22, 50, 66, 88));
            assertConsistentWithGet("scaled", HistoryQuery.all(), history);
        }

        @Test
        void primariesAndUnknownNames() {
            assertThat(engine.history("a", HistoryQuery.all()).keySet())
                    .containsExactly(day("2020-01-01"), day("2020-01-03"), day("2020-01-05"));
            assertThat(engine.history("nope", HistoryQuery.all())).isEmpty();
        }
    }

    @Nested
    @DisplayName("Insertion-date bounds")
    class Bounds {

        @Test
        void leavesStartingLateAreCompletedAtTheLowerBound() {
            HistoryQuery query = HistoryQuery.all().withInsertionDates(day("2020-01-03"), day("2020-01-04"));

            NavigableMap<Instant, TimeSeries> history = engine.history("sum", query);

            assertThat(history.keySet()).containsExactly(day("2020-01-03"), day("2020-01-04"));
            assertThat(history.get(day("2020-01-03"))).isEqualTo(daily("2020-01-01", 11, 22, 33, 44));
            assertConsistentWithGet("sum", query, history);
        }

        @Test
        void upperBoundOnly() {
            HistoryQuery query = HistoryQuery.all().withInsertionDates(null, day("2020-01-03"));

            assertThat(engine.history("sum", query).keySet()).containsExactly(day("2020-01-02"), day("2020-01-03"));
        }
    }

    @Nested
    @DisplayName("Diff mode")
    class DiffMode {

        @Test
        void deltasAgainstThePreviousSnapshotOnePerSnapshotDate() {
            NavigableMap<Instant, TimeSeries> diffs = engine.history("sum", HistoryQuery.all().withDiffMode(true));

            assertThat(diffs.keySet())
                    .containsExactly(day("2020-01-02"), day("2020-01-03"), day("2020-01-04"), day("2020-01-05"));
            assertThat(diffs.get(day("2020-01-02"))).isEqualTo(daily("2020-01-01", 11, 22, 33));
            assertThat(diffs.get(day("2020-01-03"))).isEqualTo(daily("2020-01-04", 44));
            assertThat(diffs.get(day("2020-01-04")).isEmpty()).isTrue();
            assertThat(diffs.get(day("2020-01-05"))).isEqualTo(daily("2020-01-02", 25));
        }

        @Test
        void firstDeltaIsTakenAgainstTheValueBeforeTheRange() {
            HistoryQuery query = HistoryQuery.all().withInsertionDates(day("2020-01-04"), null).withDiffMode(true);

            NavigableMap<Instant, TimeSeries> diffs = engine.history("sum", query);

            assertThat(diffs.keySet()).containsExactly(day("2020-01-04"), day("2020-01-05"));
            assertThat(diffs.get(day("2020-01-04")).isEmpty()).isTrue();
            assertThat(diffs.get(day("2020-01-05"))).isEqualTo(daily("2020-01-02", 25));
        }
    }

    @Nested
    @DisplayName("Special operators")
    class SpecialOperators {

        @Test
        void timeTravelIsReplayedAtEachInsertionDate() {
            engine.register("frozen", "(asof (date \"2020-01-03\") (series \"a\"))");

            NavigableMap<Instant, TimeSeries> history = engine.history("frozen", HistoryQuery.all());

            assertThat(history.keySet())
                    .containsExactly(day("2020-01-01"), day("2020-01-03"), day("2020-01-05"));
            assertThat(history.values()).containsOnly(daily("2020-01-01", 1, 2, 3, 4));
        }

        @Test
        void constantContributesItsRevisionDate() {
            engine.register(
                    "offset",
                    "(add (series \"a\") (constant 10 (date \"2020-01-01\") (date \"2020-01-04\") \"D\" (date \"2020-01-02\")))");

            NavigableMap<Instant, TimeSeries> history = engine.history("offset", HistoryQuery.all());

            assertThat(history.keySet())
                    .containsExactly(day("2020-01-02"), day("2020-01-03"), day("2020-01-05"));
            assertThat(history.get(day("2020-01-02"))).isEqualTo(daily("2020-01-01", 11, 12, 13));
            assertConsistentWithGet("offset", HistoryQuery.all(), history);
            assertThat(engine.insertionDates("offset", null, null))
                    .containsExactly(day("2020-01-01"), day("2020-01-02"), day("2020-01-03"), day("2020-01-05"));
        }

        @Test
        void shiftedWindowsReadLeavesOutsideTheQueryWindow() {
            engine.register("shifted", "(time-shifted (series \"a\") #:days 1)");
            HistoryQuery query = HistoryQuery.all().withValueDates(day("2020-01-02"), day("2020-01-03"));

            NavigableMap<Instant, TimeSeries> history = engine.history("shifted", query);

            assertThat(history.get(day("2020-01-05"))).isEqualTo(daily("2020-01-02", 1, 5));
            assertConsistentWithGet("shifted", query, history);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        void unknownLeafFailsLikeALiveRead() {
            engine.register("ghostly", "(add (series \"a\") (series \"ghost\" #:fill 0))", false);

            assertThatThrownBy(() -> engine.get("ghostly", QueryContext.asOf(day("2020-01-01"))))
                    .isInstanceOf(UnknownSeriesException.class);
            assertThatThrownBy(() -> engine.history("ghostly", HistoryQuery.all()))
                    .isInstanceOfSatisfying(UnknownSeriesException.class, e -> {
                        assertThat(e.seriesNames()).containsExactly("ghost");
                        assertThat(e.phase()).isEqualTo(FormulaException.Phase.EVALUATION);
                    });
        }

        @Test
        void deletedSubFormulaFailsTheHistory() {
            engine.register("left", "(series \"a\")");
            engine.register("outer", "(add (series \"left\") (series \"b\"))");
            engine.delete("left");

            assertThatThrownBy(() -> engine.history("outer", HistoryQuery.all()))
                    .isInstanceOfSatisfying(UnknownSeriesException.class, e -> assertThat(e.seriesNames())
                            .containsExactly("left"));
        }

        @Test
        void oneFailingDateFailsTheWholeCall() {
            OperatorRegistry registry = BuiltinOperators.newRegistry().overlay();
            registry.register(OperatorDescriptor.builder("fragile", call -> {
                        Instant revision = call.context().revisionDate();
                        if (revision != null && !revision.isBefore(day("2020-01-04"))) {
                            throw new IllegalStateException("no data after the 3rd");
                        }
                        return call.series("x");
                    })
                    .signature(Signature.builder().param("x", Base.SERIES).returns(Base.SERIES).build())
                    .build());
            FormulaEngine fragileEngine =
                    FormulaEngine.builder().seriesStore(store).registry(registry).build();
            fragileEngine.register("weak", "(fragile (series \"a\"))");

            assertThatThrownBy(() -> fragileEngine.history("weak", HistoryQuery.all()))
                    .isInstanceOfSatisfying(EvaluationFailedException.class, e -> {
                        assertThat(e.getMessage()).contains("no data after the 3rd");
                        assertThat(e.formulaName()).isEqualTo("weak");
                    });
            assertThat(fragileEngine.history("weak", HistoryQuery.all().withInsertionDates(null, day("2020-01-03"))))
                    .containsOnlyKeys(day("2020-01-01"), day("2020-01-03"));
        }
    }

    @Nested
    @DisplayName("Staircase")
    class Staircase {

        private FormulaEngine stairs;

        /** Revision {@code d} rewrites days {@code d..d+4} to {@code d/2}; older days keep their value. */
        @BeforeEach
        void setUp() {
            TestSeriesStore revisions = new TestSeriesStore();
            for (int d = 1; d <= 5; d++) {
                TimeSeries.Builder snapshot = TimeSeries.builder();
                for (int j = 1; j <= d + 4; j++) {
                    snapshot.put(jan(j), Math.min(j, d) / 2.0);
                }
                revisions.insert("sa", jan(d), snapshot.build()).insert("sb", jan(d), snapshot.build());
            }
            stairs = FormulaEngine.builder().seriesStore(revisions).build();
            stairs.register("s-addition", "(add (series \"sa\") (series \"sb\"))");
        }

        private Instant jan(int dayOfMonth) {
            return day("2018-01-01").plus(Duration.ofDays(dayOfMonth - 1L));
        }

        private TimeSeries expected() {
            TimeSeries.Builder out = TimeSeries.builder();
            double[] values = {1, 2, 3, 4, 5, 5, 5, 5};
            for (int i = 0; i < values.length; i++) {
                out.put(jan(i + 2), values[i]);
            }
            return out.build();
        }

        @Test
        void eachValueDateIsReadFromTheRevisionDeltaBeforeIt() {
            assertThat(stairs.staircase("s-addition", Duration.ofHours(12), null, null)).isEqualTo(expected());
        }

        @Test
        void nestedFormulasGiveTheSameStaircase() {
            stairs.register("slow-down", "(series \"sa\")");
            stairs.register("s-addition-nested", "(add (series \"slow-down\") (series \"sb\"))");

            assertThat(stairs.staircase("s-addition-nested", Duration.ofHours(12), null, null))
                    .isEqualTo(expected());
        }

        @Test
        void valueWindowAndPrimaries() {
            assertThat(stairs.staircase("s-addition", Duration.ofHours(12), jan(3), jan(4)))
                    .isEqualTo(TimeSeries.builder().put(jan(3), 2).put(jan(4), 3).build());
            assertThat(stairs.staircase("sa", Duration.ZERO, jan(8), null))
                    .isEqualTo(TimeSeries.builder().put(jan(8), 2.5).put(jan(9), 2.5).build());
        }

        @Test
        void unknownNamesAndNegativeDelta() {
            assertThat(stairs.staircase("nope", Duration.ofHours(1), null, null).isEmpty()).isTrue();
            assertThatThrownBy(() -> stairs.staircase("s-addition", Duration.ofHours(-1), null, null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("delta must not be negative");
        }
    }

    @Test
    void queryContextOfASnapshotKeepsTheWindow() {
        HistoryQuery query = HistoryQuery.all().withValueDates(day("2020-01-02"), null);

        assertThat(query.contextAt(day("2020-01-03")))
                .isEqualTo(new QueryContext(day("2020-01-03"), day("2020-01-02"), null));
    }
}
