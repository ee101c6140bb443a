package io.tsformula.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.tsformula.core.error.FormulaException;
import io.tsformula.core.error.NameCollisionException;
import io.tsformula.core.error.UnknownSeriesException;
import io.tsformula.core.model.Expr;
import io.tsformula.core.model.Formula;
import io.tsformula.core.model.FormulaStats;
import io.tsformula.core.model.HistoryQuery;
import io.tsformula.core.model.QueryContext;
import io.tsformula.core.model.SeriesMetadata;
import io.tsformula.core.model.TimeSeries;
import io.tsformula.core.operators.BuiltinOperators;
import io.tsformula.core.parse.FormulaParser;
import io.tsformula.core.parse.FormulaSerializer;
import io.tsformula.core.spi.CatalogView;
import io.tsformula.core.spi.FormulaStore;
import io.tsformula.core.spi.SeriesResolver;
import io.tsformula.core.spi.SeriesStore;
import io.tsformula.core.store.InMemoryFormulaStore;
import io.tsformula.core.types.FormulaType;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the formula engine: registers formulas, evaluates them, reconstructs their
 * histories and keeps their dependency graph consistent across renames and deletions.
 *
 * <p>
 * A name denotes either a primary series (owned by the {@link SeriesStore}) or a formula (owned
 * by the {@link FormulaStore}), never both. Registration is fail-fast: a formula is stored only
 * once every check passed.
 *
 * <p>
 * Thread-safe for concurrent evaluation. Registration, rename and delete are not atomic with
 * respect to each other; callers serialize catalog mutations.
 */
public final class FormulaEngine {

    private static final Logger LOG = LoggerFactory.getLogger(FormulaEngine.class);

    private final SeriesStore series;
    private final FormulaStore formulas;
    private final OperatorRegistry registry;
    private final EngineConfig config;
    private final CatalogView catalog;
    private final TypeChecker typeChecker;
    private final Expander expander;
    private final DependencyTracker tracker;
    private final Evaluator evaluator;
    private final SeriesResolver liveResolver;
    private final HistoryReconstructor historian;

    private FormulaEngine(Builder b) {
        this.series = Objects.requireNonNull(b.series, "series store must not be null");
        this.formulas = b.formulas != null ? b.formulas : new InMemoryFormulaStore();
        this.registry = b.registry != null ? b.registry : BuiltinOperators.newRegistry();
        this.config = b.config != null ? b.config : EngineConfig.DEFAULT;
        this.catalog = new StoreCatalog(series, formulas);
        this.typeChecker = new TypeChecker(registry);
        this.expander = new Expander(registry, formulas);
        this.tracker = new DependencyTracker(registry, formulas, catalog, expander);
        this.evaluator = new Evaluator(registry, config.concurrency());
        this.liveResolver = new LiveResolver();
        this.historian = new HistoryReconstructor(
                registry, evaluator, expander, tracker, series, formulas, liveResolver, config.cacheEnabled());
    }

    public static Builder builder() {
        return new Builder();
    }

    public OperatorRegistry registry() {
        return registry;
    }

    public EngineConfig config() {
        return config;
    }

    // ── Registration ──

    /** Registers {@code text} as formula {@code name}, rejecting unknown series per configuration. */
    public void register(String name, String text) {
        register(name, text, config.rejectUnknown());
    }

    /**
     * Registers (or replaces) formula {@code name}.
     *
     * @param rejectUnknown whether references to unknown series are an error
     * @throws io.tsformula.core.error.FormulaRegistrationException on syntax, operator, type,
     *     timezone, collision or cycle errors
     * @throws UnknownSeriesException if {@code rejectUnknown} and the formula names unknown series
     */
    public void register(String name, String text, boolean rejectUnknown) {
        requireName(name);
        Objects.requireNonNull(text, "text must not be null");
        if (series.exists(name)) {
            throw new NameCollisionException("`" + name + "` already exists as a primary series", name);
        }
        Expr tree = FormulaParser.parse(text, name);
        String canonical = FormulaSerializer.serialize(tree);
        typeChecker.requireType(tree, FormulaType.Base.SERIES, name, canonical);

        Set<String> referenced = tracker.findSeries(tree).keySet();
        if (rejectUnknown) {
            List<String> unknown = tracker.unknownSeries(referenced);
            if (!unknown.isEmpty()) {
                throw new UnknownSeriesException(
                        "formula `" + name + "` refers to unknown series " + quoted(unknown),
                        name,
                        FormulaException.Phase.REGISTRATION,
                        unknown);
            }
        }
        Expr expanded = expander.expandDefinition(name, tree);
        Boolean tzaware = tracker.checkTimezones(name, tree, canonical);
        String hash = DependencyTracker.sha1(FormulaSerializer.serialize(expanded));

        Optional<Formula> previous = formulas.find(name);
        SeriesMetadata core = tzaware == null ? null : SeriesMetadata.defaults(tzaware);
        formulas.save(new Formula(
                name, canonical, hash, core, previous.map(Formula::userMetadata).orElse(null)));
        tracker.registerDependents(name, tree);
        if (previous.isPresent()) {
            tracker.rehashDependents(name);
        }
        LOG.info("Formula registered: name={}, hash={}, replaced={}", name, hash, previous.isPresent());
    }

    // ── Evaluation ──

    /**
     * Evaluates ad-hoc formula text.
     *
     * @return the value: a {@link TimeSeries}, a number, a string, a boolean, an instant or
     *     {@code null}
     */
    public Object evalFormula(String text, QueryContext context) {
        Expr tree = FormulaParser.parse(text);
        typeChecker.requireType(tree, FormulaType.Base.ANY, null, FormulaSerializer.serialize(tree));
        return evaluate(tree, context, config.cacheEnabled());
    }

    /** Evaluates {@code tree} against the live catalog. */
    public Object evaluate(Expr tree, QueryContext context, boolean cache) {
        return evaluator.evaluate(tree, context, liveResolver, cache, null);
    }

    /**
     * Reads series {@code name} (primary or formula) under {@code context}.
     *
     * @return the series, or empty when no series has that name
     */
    public Optional<TimeSeries> get(String name, QueryContext context) {
        Objects.requireNonNull(context, "context must not be null");
        if (series.exists(name)) {
            return series.get(name, context);
        }
        Optional<Formula> formula = formulas.find(name);
        if (formula.isEmpty()) {
            return Optional.empty();
        }
        Object value = evaluator.evaluate(
                FormulaParser.parse(formula.get().text(), name),
                context,
                liveResolver,
                config.cacheEnabled(),
                name);
        return Optional.of(value instanceof TimeSeries ts ? ts.withoutOptions() : TimeSeries.empty());
    }

    // ── Introspection ──

    /** Canonical text of formula {@code name}. */
    public Optional<String> formula(String name) {
        return formulas.find(name).filter(f -> !series.exists(name)).map(Formula::text);
    }

    /** Fully expanded text of formula {@code name}. */
    public Optional<String> expandedFormula(String name) {
        return expandedFormula(name, ExpansionOptions.DEFAULT);
    }

    /** Text of formula {@code name} expanded to at most {@code level} nested inlinings. */
    public Optional<String> expandedFormula(String name, int level) {
        return expandedFormula(name, ExpansionOptions.maxDepth(level));
    }

    /** Text of formula {@code name} expanded under {@code options}. */
    public Optional<String> expandedFormula(String name, ExpansionOptions options) {
        return formula(name).map(text ->
                FormulaSerializer.serialize(expander.expand(FormulaParser.parse(text, name), options)));
    }

    /** Component tree of formula {@code name}; see {@link DependencyTracker#formulaComponents}. */
    public Optional<JsonNode> formulaComponents(String name, boolean expanded) {
        return tracker.formulaComponents(name, expanded);
    }

    /** Depth of formula {@code name}, empty if it is not a formula. */
    public OptionalInt formulaDepth(String name) {
        return formula(name).isPresent() ? OptionalInt.of(tracker.formulaDepth(name)) : OptionalInt.empty();
    }

    /** Formulas depending on {@code name}, sorted. */
    public List<String> dependents(String name, boolean direct) {
        return tracker.dependents(name, direct);
    }

    /** Stored content hash of formula {@code name}. */
    public Optional<String> contentHash(String name) {
        return formulas.find(name).filter(f -> !series.exists(name)).map(Formula::contentHash);
    }

    /** Structural statistics of formula {@code name}. */
    public Optional<FormulaStats> formulaStats(String name) {
        return formula(name).map(text -> tracker.formulaStats(name));
    }

    // ── History ──

    /**
     * Revision history of {@code name}, primary or formula.
     *
     * @return revision date to snapshot (or delta in diff mode), empty for unknown names
     */
    public NavigableMap<Instant, TimeSeries> history(String name, HistoryQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        if (!catalog.exists(name)) {
            return new TreeMap<>();
        }
        return historian.history(name, query);
    }

    /** Revision dates of {@code name} within the inclusive bounds ({@code null} = unbounded). */
    public List<Instant> insertionDates(String name, Instant from, Instant to) {
        return historian.insertionDates(name, from, to);
    }

    /**
     * Staircase of {@code name}: each value date read from the latest revision inserted at least
     * {@code delta} before it.
     *
     * @return the staircase, empty for unknown names
     */
    public TimeSeries staircase(String name, Duration delta, Instant fromValueDate, Instant toValueDate) {
        if (!catalog.exists(name)) {
            return TimeSeries.empty();
        }
        return historian.staircase(name, delta, fromValueDate, toValueDate);
    }

    // ── Catalog ──

    public boolean exists(String name) {
        return catalog.exists(name);
    }

    /** {@code "primary"} or {@code "formula"}, empty for unknown names. */
    public Optional<String> type(String name) {
        if (catalog.isPrimary(name)) {
            return Optional.of("primary");
        }
        return catalog.isFormula(name) ? Optional.of("formula") : Optional.empty();
    }

    /** Metadata of {@code name}: core metadata merged with user metadata for formulas. */
    public Optional<ObjectNode> metadata(String name) {
        if (catalog.isPrimary(name)) {
            return series.metadata(name).map(SeriesMetadata::toJson);
        }
        return formulas.find(name).map(Formula::metadata);
    }

    /**
     * Replaces the user metadata of formula {@code name}. Core metadata keys are derived and
     * cannot be set.
     *
     * @throws IllegalArgumentException if {@code name} is not a formula or {@code metadata} holds
     *     a core key
     */
    public void updateMetadata(String name, ObjectNode metadata) {
        Objects.requireNonNull(metadata, "metadata must not be null");
        Formula formula = formulas.find(name)
                .filter(f -> !series.exists(name))
                .orElseThrow(() -> new IllegalArgumentException("no formula named `" + name + "`"));
        Iterator<String> keys = SeriesMetadata.NAIVE.toJson().fieldNames();
        while (keys.hasNext()) {
            String key = keys.next();
            if (metadata.has(key)) {
                throw new IllegalArgumentException("metadata key `" + key + "` is derived and cannot be set");
            }
        }
        formulas.save(formula.withUserMetadata(metadata));
        LOG.info("Formula metadata updated: name={}, keys={}", name, metadata.size());
    }

    /**
     * Renames series {@code oldName} and rewrites every formula reference to it.
     *
     * @throws IllegalArgumentException if {@code oldName} does not exist or {@code newName} is
     *     already referenced by a formula
     * @throws NameCollisionException   if {@code newName} already exists
     */
    public void rename(String oldName, String newName) {
        requireName(newName);
        if (!catalog.exists(oldName)) {
            throw new IllegalArgumentException("no series named `" + oldName + "`");
        }
        if (catalog.exists(newName)) {
            throw new NameCollisionException("`" + newName + "` already exists", newName);
        }
        List<String> referencing = new ArrayList<>();
        for (String name : new TreeSet<>(formulas.names())) {
            Map<String, Expr.ListExpr> refs = tracker.findSeries(parse(name));
            if (refs.containsKey(newName)) {
                throw new IllegalArgumentException("new name is already referenced by `" + name + "`");
            }
            if (refs.containsKey(oldName)) {
                referencing.add(name);
            }
        }

        if (catalog.isPrimary(oldName)) {
            series.rename(oldName, newName);
        } else {
            Formula formula = formulas.find(oldName).orElseThrow();
            Set<String> needs = formulas.dependenciesOf(oldName);
            formulas.remove(oldName);
            formulas.save(formula.withName(newName));
            formulas.replaceDependencies(newName, needs);
        }

        for (String name : referencing) {
            Expr rewritten = renameReferences(parse(name), oldName, newName);
            Formula formula = formulas.find(name).orElseThrow();
            formulas.save(formula.withText(FormulaSerializer.serialize(rewritten), tracker.contentHash(rewritten)));
            tracker.registerDependents(name, rewritten);
        }
        for (String name : referencing) {
            tracker.rehashDependents(name);
        }
        LOG.info("Series renamed: from={}, to={}, rewrittenFormulas={}", oldName, newName, referencing);
    }

    /**
     * Deletes series {@code name}. Formulas referencing it are kept and fail when evaluated.
     *
     * @return {@code false} if no series had that name
     */
    public boolean delete(String name) {
        if (catalog.isPrimary(name)) {
            boolean deleted = series.delete(name);
            LOG.info("Primary series deleted: name={}", name);
            return deleted;
        }
        List<String> dependents = tracker.dependents(name, true);
        boolean deleted = formulas.remove(name);
        if (deleted) {
            if (!dependents.isEmpty()) {
                LOG.warn("Formula deleted while referenced: name={}, dependents={}", name, dependents);
            } else {
                LOG.info("Formula deleted: name={}", name);
            }
        }
        return deleted;
    }

    // ── Internals ──

    private Expr parse(String formulaName) {
        return FormulaParser.parse(formulas.find(formulaName).orElseThrow().text(), formulaName);
    }

    private Expr renameReferences(Expr node, String oldName, String newName) {
        if (!(node instanceof Expr.ListExpr list)) {
            return node;
        }
        Optional<String> ref = expander.referencedName(list);
        if (ref.isPresent() && ref.get().equals(oldName)) {
            List<Expr> args = list.args();
            for (int i = 0; i < args.size(); i++) {
                if (args.get(i) instanceof Expr.Str s && s.value().equals(oldName)) {
                    return list.with(i + 1, Expr.str(newName));
                }
            }
        }
        List<Expr> items = new ArrayList<>();
        for (Expr item : list.items()) {
            items.add(renameReferences(item, oldName, newName));
        }
        return new Expr.ListExpr(items);
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("series name must not be null or blank");
        }
    }

    private static String quoted(List<String> names) {
        List<String> out = new ArrayList<>();
        names.forEach(n -> out.add("`" + n + "`"));
        return String.join(", ", out);
    }

    /** Reads primaries from the store and evaluates formulas in place. */
    private final class LiveResolver implements SeriesResolver {

        @Override
        public Optional<TimeSeries> series(String name, QueryContext context) {
            return get(name, context);
        }

        @Override
        public Optional<Expr> definition(String name) {
            if (series.exists(name)) {
                return Optional.empty();
            }
            return formulas.find(name).map(f -> FormulaParser.parse(f.text(), name));
        }

        @Override
        public CatalogView catalog() {
            return catalog;
        }
    }

    /** Fluent builder; only the series store is mandatory. */
    public static final class Builder {

        private SeriesStore series;
        private FormulaStore formulas;
        private OperatorRegistry registry;
        private EngineConfig config;

        Builder() {}

        public Builder seriesStore(SeriesStore store) {
            this.series = store;
            return this;
        }

        public Builder formulaStore(FormulaStore store) {
            this.formulas = store;
            return this;
        }

        public Builder registry(OperatorRegistry operators) {
            this.registry = operators;
            return this;
        }

        public Builder config(EngineConfig engineConfig) {
            this.config = engineConfig;
            return this;
        }

        public FormulaEngine build() {
            return new FormulaEngine(this);
        }
    }
}
