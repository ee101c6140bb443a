package io.tsformula.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tsformula.core.error.ConfigLoadException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for {@link EngineConfigLoader} and {@link EngineConfig}. */
@DisplayName("EngineConfigLoader")
class EngineConfigLoaderTest {

    private static final Function<String, String> NO_ENV = name -> null;

    @TempDir
    Path tempDir;

    private Path write(String yaml) throws IOException {
        Path file = tempDir.resolve("tsformula.yaml");
        Files.writeString(file, yaml);
        return file;
    }

    @Test
    void readsEverySetting() throws IOException {
        Path file = write("""
                engine:
                  concurrency: 4
                  cache: false
                  reject-unknown: false
                """);

        assertThat(EngineConfigLoader.load(file, NO_ENV)).isEqualTo(new EngineConfig(4, false, false));
    }

    @Test
    void missingKeysKeepDefaults() throws IOException {
        Path file = write("""
                engine:
                  concurrency: 2
                """);

        EngineConfig config = EngineConfigLoader.load(file, NO_ENV);

        assertThat(config.concurrency()).isEqualTo(2);
        assertThat(config.cacheEnabled()).isEqualTo(EngineConfig.DEFAULT.cacheEnabled());
        assertThat(config.rejectUnknown()).isEqualTo(EngineConfig.DEFAULT.rejectUnknown());
    }

    @Test
    void emptyDocumentYieldsDefaults() throws IOException {
        assertThat(EngineConfigLoader.load(write(""), NO_ENV)).isEqualTo(EngineConfig.DEFAULT);
    }

    @Test
    void environmentOverridesYaml() throws IOException {
        Path file = write("""
                engine:
                  concurrency: 4
                  cache: true
                """);
        Map<String, String> env = Map.of(
                EngineConfigLoader.ENV_CONCURRENCY, " 8 ",
                EngineConfigLoader.ENV_CACHE, "false",
                EngineConfigLoader.ENV_REJECT_UNKNOWN, "");

        EngineConfig config = EngineConfigLoader.load(file, env::get);

        assertThat(config.concurrency()).isEqualTo(8);
        assertThat(config.cacheEnabled()).isFalse();
        assertThat(config.rejectUnknown()).isTrue();
    }

    @Test
    void loadsFromAStream() {
        InputStream in = new ByteArrayInputStream("engine: {concurrency: 1}".getBytes(StandardCharsets.UTF_8));

        assertThat(EngineConfigLoader.load(in, NO_ENV).concurrency()).isEqualTo(1);
    }

    @Test
    void loadsTheClasspathFixture() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/config/tsformula-test.yaml")) {
            assertThat(in).isNotNull();
            assertThat(EngineConfigLoader.load(in, NO_ENV)).isEqualTo(new EngineConfig(3, true, false));
        }
    }

    @Test
    void missingFileIsRejected() {
        assertThatThrownBy(() -> EngineConfigLoader.load(tempDir.resolve("absent.yaml"), NO_ENV))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void malformedYamlIsRejected() throws IOException {
        Path file = write("engine: [unclosed");

        assertThatThrownBy(() -> EngineConfigLoader.load(file, NO_ENV))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("parse");
    }

    @Test
    void invalidValuesAreRejected() throws IOException {
        Path zero = write("engine:\n  concurrency: 0\n");
        assertThatThrownBy(() -> EngineConfigLoader.load(zero, NO_ENV))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("Invalid engine configuration");

        Path text = write("engine:\n  concurrency: many\n");
        assertThatThrownBy(() -> EngineConfigLoader.load(text, NO_ENV))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("`concurrency` must be an integer");

        Path ok = write("engine:\n  concurrency: 2\n");
        assertThatThrownBy(() -> EngineConfigLoader.load(ok, Map.of(EngineConfigLoader.ENV_CONCURRENCY, "x")::get))
                .isInstanceOf(ConfigLoadException.class);
    }

    @Test
    void withersReplaceOneSetting() {
        EngineConfig config = EngineConfig.DEFAULT.withConcurrency(1).withCacheEnabled(false).withRejectUnknown(false);

        assertThat(config).isEqualTo(new EngineConfig(1, false, false));
        assertThatThrownBy(() -> EngineConfig.DEFAULT.withConcurrency(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
