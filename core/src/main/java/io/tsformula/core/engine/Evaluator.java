package io.tsformula.core.engine;

import io.tsformula.core.error.EvaluationFailedException;
import io.tsformula.core.error.FormulaException;
import io.tsformula.core.model.Expr;
import io.tsformula.core.model.QueryContext;
import io.tsformula.core.model.TimeSeries;
import io.tsformula.core.parse.FormulaSerializer;
import io.tsformula.core.spi.ContextScope;
import io.tsformula.core.spi.OperatorCall;
import io.tsformula.core.spi.SeriesResolver;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive, environment-passing evaluator of formula trees.
 *
 * <p>
 * Calls of {@link Capability#DEPENDENT} operators are submitted to a bounded worker pool and
 * represented by pending futures, resolved only when an enclosing operator needs the value, so
 * that independent leaves are fetched in parallel. A pool size of 1 evaluates synchronously on
 * the calling thread.
 *
 * <p>
 * With caching enabled, every sub-expression is memoized for the duration of one
 * {@link Session}. Cache reads and writes happen on the orchestrating thread only.
 *
 * <p>
 * Symbols {@value #REVISION_DATE}, {@value #FROM_VALUE_DATE} and {@value #TO_VALUE_DATE}
 * evaluate to the active query context values.
 */
public final class Evaluator {

    private static final Logger LOG = LoggerFactory.getLogger(Evaluator.class);

    public static final String LET = "let";
    public static final String REVISION_DATE = "revision_date";
    public static final String FROM_VALUE_DATE = "from_value_date";
    public static final String TO_VALUE_DATE = "to_value_date";

    private static final AtomicInteger POOL_SEQ = new AtomicInteger();

    private final OperatorRegistry registry;
    private final int concurrency;

    public Evaluator(OperatorRegistry registry, int concurrency) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive, got: " + concurrency);
        }
        this.concurrency = concurrency;
    }

    /**
     * Evaluates {@code tree} in a fresh session.
     *
     * @param tree        the expression
     * @param context     the top-level query context
     * @param resolver    serves named series
     * @param cache       whether to memoize sub-expressions
     * @param formulaName the formula being evaluated, for error reporting; may be null
     * @return the value: a {@link TimeSeries}, number, string, boolean, instant or {@code null}
     */
    public Object evaluate(Expr tree, QueryContext context, SeriesResolver resolver, boolean cache, String formulaName) {
        try (Session session = openSession(resolver, formulaName)) {
            return session.evaluate(tree, context, cache ? new EvaluationCache() : null);
        }
    }

    /**
     * Opens a session sharing one worker pool across several evaluations. Close it to release the
     * pool.
     */
    public Session openSession(SeriesResolver resolver, String formulaName) {
        return new Session(resolver, formulaName);
    }

    /** A worker pool plus the resolver it evaluates against. */
    public final class Session implements AutoCloseable {

        private final SeriesResolver resolver;
        private final String formulaName;
        private final ExecutorService pool;
        private long nextScopeId = 1;

        private Session(SeriesResolver resolver, String formulaName) {
            this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
            this.formulaName = formulaName;
            this.pool = concurrency > 1 ? Executors.newFixedThreadPool(concurrency, threadFactory()) : null;
        }

        /**
         * Evaluates {@code tree} under {@code context}, memoizing in {@code cache} when not null.
         *
         * @throws FormulaException on any failure; foreign exceptions are wrapped in
         *     {@link EvaluationFailedException}
         */
        public Object evaluate(Expr tree, QueryContext context, EvaluationCache cache) {
            Objects.requireNonNull(tree, "tree must not be null");
            Objects.requireNonNull(context, "context must not be null");
            long start = System.nanoTime();
            Object value = resolve(eval(tree, context, Env.root(), cache), context);
            if (value instanceof TimeSeries ts) {
                value = ts.slice(context.fromValueDate(), context.toValueDate());
            }
            if (LOG.isDebugEnabled()) {
                LOG.debug(
                        "Evaluated formula: formula={}, context={}, durationUs={}, cacheHits={}, cacheMisses={}",
                        formulaName,
                        context.serialize(),
                        (System.nanoTime() - start) / 1_000,
                        cache != null ? cache.hits() : 0,
                        cache != null ? cache.misses() : 0);
            }
            return value;
        }

        @Override
        public void close() {
            if (pool != null) {
                pool.shutdown();
            }
        }

        private Object eval(Expr node, QueryContext ctx, Env env, EvaluationCache cache) {
            if (node instanceof Expr.Symbol s) {
                return symbol(s.name(), ctx, env);
            }
            if (!(node instanceof Expr.ListExpr list)) {
                return literal(node);
            }
            if (cache == null) {
                return evalCall(list, ctx, env, null);
            }
            String key = EvaluationCache.key(FormulaSerializer.serialize(list), ctx, env.id());
            if (cache.contains(key)) {
                return cache.get(key);
            }
            Object value = evalCall(list, ctx, env, cache);
            cache.put(key, value);
            return value;
        }

        private Object evalCall(Expr.ListExpr list, QueryContext ctx, Env env, EvaluationCache cache) {
            String op = list.op();
            if (LET.equals(op)) {
                return evalLet(list, ctx, env, cache);
            }
            OperatorDescriptor descriptor = registry.lookup(op)
                    .orElseThrow(() -> new EvaluationFailedException(
                            "unknown operator `" + op + "`", formulaName, ctx.revisionDate()));

            if (descriptor.has(Capability.NAMED_REFERENCE)) {
                Optional<Expr> inlined = inlineDefinition(list);
                if (inlined.isPresent()) {
                    return eval(inlined.get(), ctx, env, cache);
                }
            }
            if (descriptor.has(Capability.AUTOTROPHIC)) {
                Optional<TimeSeries> replay = resolver.autotrophic(FormulaSerializer.serialize(list), ctx);
                if (replay.isPresent()) {
                    return replay.get();
                }
            }

            Signature.Binding binding;
            try {
                binding = descriptor.signature().bind(list);
            } catch (Signature.ArgumentMismatchException e) {
                throw new EvaluationFailedException(e.getMessage(), e, formulaName, ctx.revisionDate());
            }
            String body = descriptor.contextScope().map(ContextScope::bodyParameter).orElse(null);

            Map<String, Object> pending = new LinkedHashMap<>();
            for (Map.Entry<String, Expr> entry : binding.arguments().entrySet()) {
                if (!entry.getKey().equals(body)) {
                    pending.put(entry.getKey(), eval(entry.getValue(), ctx, env, cache));
                }
            }
            List<Object> packed = new ArrayList<>();
            for (Expr item : binding.packed()) {
                packed.add(eval(item, ctx, env, cache));
            }

            Map<String, Object> args = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : pending.entrySet()) {
                args.put(entry.getKey(), resolve(entry.getValue(), ctx));
            }
            if (binding.packedName() != null) {
                List<Object> spread = new ArrayList<>();
                for (Object item : packed) {
                    Object value = resolve(item, ctx);
                    if (value instanceof List<?> values) {
                        spread.addAll(values);
                    } else {
                        spread.add(value);
                    }
                }
                args.put(binding.packedName(), spread);
            }

            if (body != null) {
                OperatorCall outer = new OperatorCall(op, list, args, ctx, resolver);
                QueryContext inner = invoke(() -> descriptor.contextScope().get().rebind(outer), op, ctx);
                args.put(body, resolve(eval(binding.arguments().get(body), inner, env, cache), inner));
            }

            OperatorCall call = new OperatorCall(op, list, args, ctx, resolver);
            if (pool != null && descriptor.has(Capability.DEPENDENT)) {
                return pool.submit(() -> invoke(() -> descriptor.function().apply(call), op, ctx));
            }
            return invoke(() -> descriptor.function().apply(call), op, ctx);
        }

        /** The node evaluating a formula reference in place, honouring its series options. */
        private Optional<Expr> inlineDefinition(Expr.ListExpr ref) {
            List<Expr> positional = ref.positional();
            if (positional.isEmpty() || !(positional.get(0) instanceof Expr.Str name)) {
                return Optional.empty();
            }
            return resolver.definition(name.value()).map(definition -> {
                List<Expr> options = Expander.seriesOptions(ref);
                if (options.isEmpty()) {
                    return definition;
                }
                List<Expr> wrapped = new ArrayList<>();
                wrapped.add(Expr.sym("options"));
                wrapped.add(definition);
                wrapped.addAll(options);
                return new Expr.ListExpr(wrapped);
            });
        }

        private Object evalLet(Expr.ListExpr list, QueryContext ctx, Env env, EvaluationCache cache) {
            List<Expr> args = list.args();
            if (args.size() % 2 == 0) {
                throw new EvaluationFailedException(
                        "`let` needs name/value pairs followed by a body", formulaName, ctx.revisionDate());
            }
            Env scope = new Env(env, nextScopeId++);
            for (int i = 0; i < args.size() - 1; i += 2) {
                if (!(args.get(i) instanceof Expr.Symbol name)) {
                    throw new EvaluationFailedException(
                            "`let` binding names must be symbols", formulaName, ctx.revisionDate());
                }
                scope.bind(name.name(), resolve(eval(args.get(i + 1), ctx, scope, cache), ctx));
            }
            return eval(args.get(args.size() - 1), ctx, scope, cache);
        }

        private Object symbol(String name, QueryContext ctx, Env env) {
            Optional<Object> bound = env.lookup(name);
            if (bound.isPresent()) {
                return bound.get() == Env.Nil.VALUE ? null : bound.get();
            }
            return switch (name) {
                case REVISION_DATE -> ctx.revisionDate();
                case FROM_VALUE_DATE -> ctx.fromValueDate();
                case TO_VALUE_DATE -> ctx.toValueDate();
                default -> throw new EvaluationFailedException(
                        "unbound symbol `" + name + "`", formulaName, ctx.revisionDate());
            };
        }

        private Object resolve(Object value, QueryContext ctx) {
            if (!(value instanceof Future<?> future)) {
                return value;
            }
            try {
                return future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new EvaluationFailedException("evaluation interrupted", e, formulaName, ctx.revisionDate());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof FormulaException fe) {
                    throw fe;
                }
                throw new EvaluationFailedException(
                        "evaluation failed: " + cause.getMessage(), cause, formulaName, ctx.revisionDate());
            }
        }

        private <T> T invoke(Invocation<T> invocation, String op, QueryContext ctx) {
            try {
                return invocation.run();
            } catch (FormulaException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new EvaluationFailedException(
                        "operator `" + op + "` failed: " + e.getMessage(), e, formulaName, ctx.revisionDate());
            }
        }
    }

    @FunctionalInterface
    private interface Invocation<T> {
        T run();
    }

    private static Object literal(Expr atom) {
        if (atom instanceof Expr.Int i) {
            return i.value();
        }
        if (atom instanceof Expr.Flo f) {
            return f.value();
        }
        if (atom instanceof Expr.Str s) {
            return s.value();
        }
        if (atom instanceof Expr.Bool b) {
            return b.value();
        }
        return null;
    }

    private static ThreadFactory threadFactory() {
        int poolId = POOL_SEQ.incrementAndGet();
        AtomicInteger threadSeq = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "tsformula-eval-" + poolId + "-" + threadSeq.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
