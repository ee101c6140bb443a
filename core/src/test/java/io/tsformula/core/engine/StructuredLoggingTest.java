package io.tsformula.core.engine;

import static io.tsformula.core.testkit.TestSeries.daily;
import static io.tsformula.core.testkit.TestSeries.day;
import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.tsformula.core.testkit.TestSeriesStore;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/**
 * Tests for the {@code key=value} log entries of catalog mutations. Every registration, rename
 * and deletion is logged once; deleting a referenced formula is a warning.
 */
@DisplayName("StructuredLoggingTest")
class StructuredLoggingTest {

    private FormulaEngine engine;
    private ListAppender<ILoggingEvent> logAppender;
    private Logger engineLogger;
    private Logger trackerLogger;

    @BeforeEach
    void setUp() {
        TestSeriesStore store = new TestSeriesStore().insert("a", day("2020-01-01"), daily("2020-01-01", 1, 2));
        engine = FormulaEngine.builder().seriesStore(store).build();

        logAppender = new ListAppender<>();
        logAppender.start();
        engineLogger = (Logger) LoggerFactory.getLogger(FormulaEngine.class);
        engineLogger.addAppender(logAppender);
        trackerLogger = (Logger) LoggerFactory.getLogger(DependencyTracker.class);
        trackerLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        engineLogger.detachAppender(logAppender);
        trackerLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    private List<String> messages(Level level, String prefix) {
        return logAppender.list.stream()
                .filter(e -> e.getLevel().equals(level))
                .map(ILoggingEvent::getFormattedMessage)
                .filter(m -> m.startsWith(prefix))
                .toList();
    }

    @Test
    @DisplayName("Registration logs name, hash and whether a formula was replaced")
    void registrationIsLogged() {
        engine.register("f", "(cumsum (series \"a\"))");
        engine.register("f", "(cumsum (series \"a\" #:fill 0))");

        List<String> logs = messages(Level.INFO, "Formula registered:");
        assertThat(logs).hasSize(2);
        assertThat(logs.get(0))
                .startsWith("Formula registered: name=f, hash=")
                .endsWith("replaced=false");
        assertThat(logs.get(1)).contains("hash=" + engine.contentHash("f").orElseThrow()).endsWith("replaced=true");
    }

    @Test
    @DisplayName("Deleting a referenced formula warns with its dependents")
    void deletingAReferencedFormulaWarns() {
        engine.register("base", "(cumsum (series \"a\"))");
        engine.register("top", "(cumsum (series \"base\"))");

        engine.delete("base");
        engine.delete("top");

        assertThat(messages(Level.WARN, "Formula deleted while referenced:"))
                .containsExactly("Formula deleted while referenced: name=base, dependents=[top]");
        assertThat(messages(Level.INFO, "Formula deleted:")).containsExactly("Formula deleted: name=top");
    }

    @Test
    @DisplayName("Rename logs the rewritten formulas")
    void renameIsLogged() {
        engine.register("f", "(cumsum (series \"a\"))");

        engine.rename("a", "b");

        assertThat(messages(Level.INFO, "Series renamed:"))
                .containsExactly("Series renamed: from=a, to=b, rewrittenFormulas=[f]");
    }

    @Test
    @DisplayName("Unknown timezone awareness is a warning, not an error")
    void unknownAwarenessWarns() {
        engine.register("dangling", "(cumsum (series \"missing\"))", false);

        assertThat(messages(Level.WARN, "Unknown timezone awareness in formula:"))
                .singleElement()
                .asString()
                .contains("formula=dangling")
                .contains("missing");
    }
}
