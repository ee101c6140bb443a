package io.tsformula.core.store;

import static org.assertj.core.api.Assertions.assertThat;

import io.tsformula.core.model.Formula;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryFormulaStoreTest {

    private InMemoryFormulaStore store;

    private static Formula formula(String name) {
        return new Formula(name, "(series \"a\")", "hash-" + name, null, null);
    }

    @BeforeEach
    void setUp() {
        store = new InMemoryFormulaStore();
        store.save(formula("f1"));
        store.save(formula("f2"));
        store.save(formula("f3"));
        store.replaceDependencies("f2", Set.of("f1"));
        store.replaceDependencies("f3", Set.of("f1", "f2"));
    }

    @Test
    void saveReplacesByName() {
        store.save(formula("f1").withContentHash("other"));

        assertThat(store.find("f1").orElseThrow().contentHash()).isEqualTo("other");
        assertThat(store.names()).containsExactlyInAnyOrder("f1", "f2", "f3");
        assertThat(store.find("missing")).isEmpty();
    }

    @Test
    void edgesInBothDirections() {
        assertThat(store.dependenciesOf("f3")).containsExactlyInAnyOrder("f1", "f2");
        assertThat(store.dependenciesOf("f1")).isEmpty();
        assertThat(store.directDependents("f1")).containsExactlyInAnyOrder("f2", "f3");
    }

    @Test
    void emptyDependenciesRemoveTheEntry() {
        store.replaceDependencies("f3", Set.of());

        assertThat(store.dependenciesOf("f3")).isEmpty();
        assertThat(store.directDependents("f2")).isEmpty();
    }

    @Test
    void removeDropsEveryEdgeTouchingTheFormula() {
        assertThat(store.remove("f1")).isTrue();

        assertThat(store.find("f1")).isEmpty();
        assertThat(store.directDependents("f1")).isEmpty();
        assertThat(store.dependenciesOf("f3")).containsExactly("f2");
        assertThat(store.dependenciesOf("f2")).isEmpty();
        assertThat(store.remove("f1")).isFalse();
    }

    @Test
    void concurrentSavesAreAllVisible() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            CompletableFuture.allOf(IntStream.range(0, 100)
                            .mapToObj(i -> CompletableFuture.runAsync(() -> store.save(formula("g" + i)), pool))
                            .toArray(CompletableFuture[]::new))
                    .get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.names()).hasSize(103);
    }
}
