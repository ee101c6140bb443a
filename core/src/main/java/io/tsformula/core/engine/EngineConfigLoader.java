package io.tsformula.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.tsformula.core.error.ConfigLoadException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link EngineConfig} from YAML with an environment variable overlay.
 *
 * <p>
 * Expected layout:
 *
 * <pre>
 * engine:
 *   concurrency: 8
 *   cache: true
 *   reject-unknown: false
 * </pre>
 *
 * <p>
 * Missing keys keep the values of {@link EngineConfig#DEFAULT}. {@code TSFORMULA_CONCURRENCY},
 * {@code TSFORMULA_CACHE} and {@code TSFORMULA_REJECT_UNKNOWN} take precedence over YAML values.
 * An env var is "set" if and only if it is defined AND its trimmed value is non-empty.
 */
public final class EngineConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(EngineConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final String ENV_CONCURRENCY = "TSFORMULA_CONCURRENCY";
    static final String ENV_CACHE = "TSFORMULA_CACHE";
    static final String ENV_REJECT_UNKNOWN = "TSFORMULA_REJECT_UNKNOWN";

    private EngineConfigLoader() {
        // utility class
    }

    /**
     * Loads the configuration file, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, malformed or holds invalid values
     */
    public static EngineConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the configuration file, applying overrides from {@code envLookup}. Returning
     * {@code null} means the variable is not defined.
     *
     * @throws ConfigLoadException if the file is missing, malformed or holds invalid values
     */
    public static EngineConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            EngineConfig config = load(in, envLookup);
            LOG.info(
                    "Loaded engine configuration: path={}, concurrency={}, cache={}, rejectUnknown={}",
                    configPath,
                    config.concurrency(),
                    config.cacheEnabled(),
                    config.rejectUnknown());
            return config;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read configuration: " + configPath, e);
        }
    }

    /**
     * Loads the configuration from a YAML stream (e.g. a classpath resource).
     *
     * @throws ConfigLoadException if the YAML is malformed or holds invalid values
     */
    public static EngineConfig load(InputStream yaml, Function<String, String> envLookup) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(yaml);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration", e);
        }
        JsonNode engine = root == null ? YAML_MAPPER.createObjectNode() : root.path("engine");
        EngineConfig defaults = EngineConfig.DEFAULT;
        try {
            int concurrency = envIntOrDefault(envLookup, ENV_CONCURRENCY, intOrDefault(engine, "concurrency", defaults.concurrency()));
            boolean cache = envBoolOrDefault(envLookup, ENV_CACHE, boolOrDefault(engine, "cache", defaults.cacheEnabled()));
            boolean rejectUnknown = envBoolOrDefault(
                    envLookup, ENV_REJECT_UNKNOWN, boolOrDefault(engine, "reject-unknown", defaults.rejectUnknown()));
            return new EngineConfig(concurrency, cache, rejectUnknown);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid engine configuration: " + e.getMessage(), e);
        }
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static boolean envBoolOrDefault(Function<String, String> envLookup, String envVar, boolean yamlDefault) {
        return isSet(envLookup, envVar) ? Boolean.parseBoolean(envLookup.apply(envVar).trim()) : yamlDefault;
    }

    private static int envIntOrDefault(Function<String, String> envLookup, String envVar, int yamlDefault) {
        return isSet(envLookup, envVar) ? Integer.parseInt(envLookup.apply(envVar).trim()) : yamlDefault;
    }

    // --- YAML helpers ---

    private static boolean boolOrDefault(JsonNode node, String field, boolean defaultValue) {
        return node.has(field) ? node.get(field).asBoolean() : defaultValue;
    }

    private static int intOrDefault(JsonNode node, String field, int defaultValue) {
        if (!node.has(field)) {
            return defaultValue;
        }
        JsonNode value = node.get(field);
        if (!value.canConvertToInt()) {
            throw new IllegalArgumentException("`" + field + "` must be an integer, got: " + value.asText());
        }
        return value.asInt();
    }
}
