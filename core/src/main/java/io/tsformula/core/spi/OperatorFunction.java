package io.tsformula.core.spi;

/**
 * Executable body of an operator.
 *
 * <p>
 * Receives its arguments already evaluated and bound to parameter names. Returns a
 * {@link io.tsformula.core.model.TimeSeries}, a {@link Number}, a {@link String}, a
 * {@link Boolean}, a {@link java.time.Instant}, a {@link java.util.List} of series, or
 * {@code null} for nil.
 *
 * <p>
 * Implementations MUST be stateless and thread-safe; dependent operators run on worker threads.
 */
@FunctionalInterface
public interface OperatorFunction {

    Object apply(OperatorCall call);
}
