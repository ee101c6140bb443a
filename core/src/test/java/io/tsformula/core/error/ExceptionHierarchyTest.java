package io.tsformula.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for the exception hierarchy: two abstract tiers below {@link FormulaException}. */
class ExceptionHierarchyTest {

    // --- Hierarchy structure ---

    @Test
    void formulaExceptionIsAbstractAndRoot() {
        assertThat(FormulaException.class).isAbstract();
        assertThat(FormulaException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void registrationAndEvaluationTiersAreAbstract() {
        assertThat(FormulaRegistrationException.class).isAbstract();
        assertThat(FormulaRegistrationException.class.getSuperclass()).isEqualTo(FormulaException.class);
        assertThat(FormulaEvalException.class).isAbstract();
        assertThat(FormulaEvalException.class.getSuperclass()).isEqualTo(FormulaException.class);
    }

    // --- Registration-time exceptions ---

    @Test
    void syntaxExceptionCarriesPosition() {
        var ex = new FormulaSyntaxException("unbalanced parenthesis", "f", "(add", 4);

        assertThat(ex).isInstanceOf(FormulaRegistrationException.class);
        assertThat(ex.formulaName()).isEqualTo("f");
        assertThat(ex.detail()).isEqualTo("unbalanced parenthesis");
        assertThat(ex.phase()).isEqualTo(FormulaException.Phase.REGISTRATION);
        assertThat(ex.source()).isEqualTo("(add");
        assertThat(ex.position()).isEqualTo(4);
    }

    @Test
    void typeMismatchCarriesOperatorAndTypes() {
        var ex = new TypeMismatchException("bad arg", "f", "(+ 1 \"a\")", "+", "b", "Union[Number, Series]", "String");

        assertThat(ex).isInstanceOf(FormulaRegistrationException.class);
        assertThat(ex.operator()).isEqualTo("+");
        assertThat(ex.argument()).isEqualTo("b");
        assertThat(ex.expected()).isEqualTo("Union[Number, Series]");
        assertThat(ex.actual()).isEqualTo("String");
    }

    @Test
    void unknownOperatorListsOperators() {
        var ex = new UnknownOperatorException("unknown", "f", "(foo (bar))", List.of("foo", "bar"));

        assertThat(ex).isInstanceOf(FormulaRegistrationException.class);
        assertThat(ex.operators()).containsExactly("foo", "bar");
    }

    @Test
    void cycleAndCollisionAreRegistrationErrors() {
        var cycle = new CircularReferenceException("cycle", "a", List.of("a", "b", "a"));
        var collision = new NameCollisionException("taken", "a");

        assertThat(cycle.cycle()).containsExactly("a", "b", "a");
        assertThat(cycle.phase()).isEqualTo(FormulaException.Phase.REGISTRATION);
        assertThat(collision).isInstanceOf(FormulaRegistrationException.class);
        assertThat(collision.source()).isNull();
    }

    @Test
    void timezoneIncompatibilityCopiesAwareness() {
        var awareness = new HashMap<>(Map.of("a:add/series", "tzaware", "n:add/series", "tznaive"));
        var ex = new TimezoneIncompatibilityException("mixed", "f", "(add ...)", awareness);
        awareness.clear();

        assertThat(ex.awareness()).containsEntry("n:add/series", "tznaive").hasSize(2);
    }

    // --- Evaluation-time exceptions ---

    @Test
    void evaluationFailureKeepsCauseAndRevision() {
        var cause = new ArithmeticException("overflow");
        var revision = Instant.parse("2020-01-01T00:00:00Z");
        var ex = new EvaluationFailedException("operator `*` failed: overflow", cause, "f", revision);

        assertThat(ex).isInstanceOf(FormulaEvalException.class);
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.revisionDate()).isEqualTo(revision);
        assertThat(ex.phase()).isEqualTo(FormulaException.Phase.EVALUATION);
    }

    // --- Unknown series surfaces in both phases ---

    @Test
    void unknownSeriesCarriesItsPhase() {
        var atRegistration = new UnknownSeriesException("unknown", "f", FormulaException.Phase.REGISTRATION, List.of("x"));
        var atEvaluation = new UnknownSeriesException("unknown", null, FormulaException.Phase.EVALUATION, List.of("x"));

        assertThat(atRegistration).isNotInstanceOf(FormulaRegistrationException.class);
        assertThat(atRegistration.phase()).isEqualTo(FormulaException.Phase.REGISTRATION);
        assertThat(atEvaluation.phase()).isEqualTo(FormulaException.Phase.EVALUATION);
        assertThat(atEvaluation.formulaName()).isNull();
        assertThat(atEvaluation.seriesNames()).containsExactly("x");
    }

    @Test
    void configLoadExceptionIsOutsideTheFormulaHierarchy() {
        var ex = new ConfigLoadException("missing file");

        assertThat(ex).isNotInstanceOf(FormulaException.class);
        assertThat(ex).isInstanceOf(RuntimeException.class);
    }
}
