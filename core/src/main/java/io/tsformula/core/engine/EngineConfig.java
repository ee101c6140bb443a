package io.tsformula.core.engine;

/**
 * Engine settings.
 *
 * <p>
 * Immutable and thread-safe.
 *
 * @param concurrency   size of the worker pool of one top-level evaluation; 1 evaluates
 *                      synchronously (default: 16)
 * @param cacheEnabled  whether sub-expressions are memoized within one evaluation (default: true)
 * @param rejectUnknown whether registration fails on references to unknown series
 *                      (default: true)
 */
public record EngineConfig(int concurrency, boolean cacheEnabled, boolean rejectUnknown) {

    /** Default settings: 16 workers, cache on, unknown series rejected. */
    public static final EngineConfig DEFAULT = new EngineConfig(16, true, true);

    public EngineConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive, got: " + concurrency);
        }
    }

    public EngineConfig withConcurrency(int value) {
        return new EngineConfig(value, cacheEnabled, rejectUnknown);
    }

    public EngineConfig withCacheEnabled(boolean value) {
        return new EngineConfig(concurrency, value, rejectUnknown);
    }

    public EngineConfig withRejectUnknown(boolean value) {
        return new EngineConfig(concurrency, cacheEnabled, value);
    }
}
