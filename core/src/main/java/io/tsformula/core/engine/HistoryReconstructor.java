package io.tsformula.core.engine;

import io.tsformula.core.model.Expr;
import io.tsformula.core.model.Formula;
import io.tsformula.core.model.HistoryQuery;
import io.tsformula.core.model.QueryContext;
import io.tsformula.core.model.TimeSeries;
import io.tsformula.core.parse.FormulaParser;
import io.tsformula.core.parse.FormulaSerializer;
import io.tsformula.core.spi.CatalogView;
import io.tsformula.core.spi.FormulaStore;
import io.tsformula.core.spi.OperatorCall;
import io.tsformula.core.spi.SeriesResolver;
import io.tsformula.core.spi.SeriesStore;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Synthesizes the revision history of a formula from the histories of its leaves.
 *
 * <p>
 * The formula is expanded, the history of every leaf is collected, and the formula is evaluated
 * once per candidate date (the union of the leaves' revision dates) against a resolver that
 * answers from those precomputed histories. Trees containing a {@link Capability#TIME_TRAVEL}
 * operator cannot be replayed that way and are re-evaluated as of each insertion date instead.
 *
 * <p>
 * When a lower insertion-date bound is given, leaves whose history starts after the earliest
 * collected date are completed with their value as of that date, so that every leaf contributes
 * to the first snapshot.
 */
public final class HistoryReconstructor {

    private static final Logger LOG = LoggerFactory.getLogger(HistoryReconstructor.class);

    private final OperatorRegistry registry;
    private final Evaluator evaluator;
    private final Expander expander;
    private final DependencyTracker tracker;
    private final SeriesStore store;
    private final FormulaStore formulas;
    private final SeriesResolver live;
    private final boolean cacheEnabled;

    public HistoryReconstructor(
            OperatorRegistry registry,
            Evaluator evaluator,
            Expander expander,
            DependencyTracker tracker,
            SeriesStore store,
            FormulaStore formulas,
            SeriesResolver live,
            boolean cacheEnabled) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.expander = Objects.requireNonNull(expander, "expander must not be null");
        this.tracker = Objects.requireNonNull(tracker, "tracker must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.formulas = Objects.requireNonNull(formulas, "formulas must not be null");
        this.live = Objects.requireNonNull(live, "live must not be null");
        this.cacheEnabled = cacheEnabled;
    }

    /**
     * Reconstructs the history of {@code name}.
     *
     * @return revision date to snapshot (or delta, in diff mode); empty snapshots are pruned
     */
    public NavigableMap<Instant, TimeSeries> history(String name, HistoryQuery query) {
        long start = System.nanoTime();
        NavigableMap<Instant, TimeSeries> snapshots = snapshots(name, query.withDiffMode(false));
        if (query.diffMode() && !snapshots.isEmpty()) {
            QueryContext before = query.contextAt(snapshots.firstKey().minusSeconds(1));
            TimeSeries baseline = live.series(name, before).orElse(TimeSeries.empty());
            snapshots = diffs(baseline, snapshots);
        }
        LOG.debug(
                "History reconstructed: series={}, revisions={}, diffMode={}, durationMs={}",
                name,
                snapshots.size(),
                query.diffMode(),
                (System.nanoTime() - start) / 1_000_000);
        return snapshots;
    }

    /**
     * Builds the staircase of {@code name}: every value date {@code v} carries its value in the
     * latest revision inserted at or before {@code v - delta}.
     *
     * @param delta non-negative lag between a revision and the value dates it is trusted for
     */
    public TimeSeries staircase(String name, Duration delta, Instant fromValueDate, Instant toValueDate) {
        Objects.requireNonNull(delta, "delta must not be null");
        if (delta.isNegative()) {
            throw new IllegalArgumentException("delta must not be negative: " + delta);
        }
        NavigableMap<Instant, TimeSeries> revisions =
                history(name, HistoryQuery.all().withValueDates(fromValueDate, toValueDate));
        TreeSet<Instant> valueDates = new TreeSet<>();
        revisions.values().forEach(ts -> valueDates.addAll(ts.points().keySet()));

        TimeSeries.Builder out = TimeSeries.builder();
        for (Instant valueDate : valueDates) {
            Map.Entry<Instant, TimeSeries> revision = revisions.floorEntry(valueDate.minus(delta));
            if (revision != null && revision.getValue().get(valueDate) != null) {
                out.put(valueDate, revision.getValue().get(valueDate));
            }
        }
        TimeSeries staircase = out.build();
        LOG.debug("Staircase built: series={}, delta={}, points={}", name, delta, staircase.size());
        return staircase;
    }

    /** Revision dates of {@code name} within the inclusive bounds, sorted and distinct. */
    public List<Instant> insertionDates(String name, Instant from, Instant to) {
        CatalogView catalog = tracker.catalog();
        if (catalog.isPrimary(name)) {
            return store.insertionDates(name, from, to);
        }
        Formula formula = formulas.find(name).orElse(null);
        if (formula == null) {
            return List.of();
        }
        Expr tree = expander.expand(FormulaParser.parse(formula.text(), name));
        TreeSet<Instant> dates = new TreeSet<>();
        for (String leaf : tracker.findSeries(tree).keySet()) {
            dates.addAll(insertionDates(leaf, from, to));
        }
        for (Expr.ListExpr site : autotrophicSites(tree)) {
            OperatorDescriptor descriptor = registry.require(site.op());
            if (descriptor.insertionDatesProvider().isPresent()) {
                dates.addAll(descriptor.insertionDatesProvider().get().insertionDates(bind(site, name), from, to));
            } else if (descriptor.historyProvider().isPresent()) {
                HistoryQuery bounds = HistoryQuery.all().withInsertionDates(from, to);
                dates.addAll(descriptor.historyProvider().get().history(bind(site, name), bounds).keySet());
            }
        }
        HistoryQuery bounds = HistoryQuery.all().withInsertionDates(from, to);
        dates.removeIf(d -> !bounds.admits(d));
        return new ArrayList<>(dates);
    }

    private NavigableMap<Instant, TimeSeries> snapshots(String name, HistoryQuery query) {
        CatalogView catalog = tracker.catalog();
        if (catalog.isPrimary(name)) {
            return prune(store.history(name, query));
        }
        Formula formula = formulas.find(name).orElse(null);
        if (formula == null) {
            return new TreeMap<>();
        }
        Expr tree = expander.expand(FormulaParser.parse(formula.text(), name));
        if (hasTimeTravel(tree)) {
            return replayByInsertionDates(name, tree, query);
        }

        // leaves are read over the whole value range: context scopes may move the window
        HistoryQuery leafQuery = query.withValueDates(null, null);
        Map<String, NavigableMap<Instant, TimeSeries>> leaves = new LinkedHashMap<>();
        for (String leaf : tracker.findSeries(tree).keySet()) {
            // unknown leaves stay unresolved so that evaluating them fails as a live read does
            if (catalog.exists(leaf)) {
                leaves.put(leaf, new TreeMap<>(snapshots(leaf, leafQuery)));
            } else {
                LOG.warn("History leaf unknown: formula={}, series={}", name, leaf);
            }
        }
        Map<String, NavigableMap<Instant, TimeSeries>> autos = new LinkedHashMap<>();
        Map<String, Expr.ListExpr> autoSites = new LinkedHashMap<>();
        for (Expr.ListExpr site : autotrophicSites(tree)) {
            OperatorDescriptor descriptor = registry.require(site.op());
            if (descriptor.historyProvider().isPresent()) {
                String key = FormulaSerializer.serialize(site);
                autoSites.put(key, site);
                autos.put(key, new TreeMap<>(descriptor.historyProvider().get().history(bind(site, name), leafQuery)));
            }
        }

        if (query.fromInsertionDate() != null) {
            completeStart(name, leafQuery, leaves, autos, autoSites);
        }

        TreeSet<Instant> dates = new TreeSet<>();
        leaves.values().forEach(h -> dates.addAll(h.keySet()));
        autos.values().forEach(h -> dates.addAll(h.keySet()));
        dates.removeIf(d -> !query.admits(d));

        NavigableMap<Instant, TimeSeries> out = new TreeMap<>();
        HistoricalResolver resolver = new HistoricalResolver(leaves, autos);
        try (Evaluator.Session session = evaluator.openSession(resolver, name)) {
            for (Instant date : dates) {
                Object value = session.evaluate(tree, query.contextAt(date), cacheEnabled ? new EvaluationCache() : null);
                if (value instanceof TimeSeries ts && !ts.isEmpty()) {
                    out.put(date, ts.withoutOptions());
                }
            }
        }
        return out;
    }

    private NavigableMap<Instant, TimeSeries> replayByInsertionDates(String name, Expr tree, HistoryQuery query) {
        NavigableMap<Instant, TimeSeries> out = new TreeMap<>();
        List<Instant> dates = insertionDates(name, query.fromInsertionDate(), query.toInsertionDate());
        try (Evaluator.Session session = evaluator.openSession(live, name)) {
            for (Instant date : dates) {
                Object value = session.evaluate(tree, query.contextAt(date), cacheEnabled ? new EvaluationCache() : null);
                if (value instanceof TimeSeries ts && !ts.isEmpty()) {
                    out.put(date, ts.withoutOptions());
                }
            }
        }
        return out;
    }

    private void completeStart(
            String name,
            HistoryQuery query,
            Map<String, NavigableMap<Instant, TimeSeries>> leaves,
            Map<String, NavigableMap<Instant, TimeSeries>> autos,
            Map<String, Expr.ListExpr> autoSites) {
        Instant min = null;
        for (NavigableMap<Instant, TimeSeries> h : concat(leaves, autos)) {
            if (!h.isEmpty() && (min == null || h.firstKey().isBefore(min))) {
                min = h.firstKey();
            }
        }
        if (min == null) {
            return;
        }
        QueryContext atMin = query.contextAt(min);
        for (Map.Entry<String, NavigableMap<Instant, TimeSeries>> entry : leaves.entrySet()) {
            NavigableMap<Instant, TimeSeries> h = entry.getValue();
            if (h.isEmpty() || h.firstKey().isAfter(min)) {
                live.series(entry.getKey(), atMin)
                        .filter(ts -> !ts.isEmpty())
                        .ifPresent(ts -> h.put(atMin.revisionDate(), ts));
            }
        }
        for (Map.Entry<String, NavigableMap<Instant, TimeSeries>> entry : autos.entrySet()) {
            NavigableMap<Instant, TimeSeries> h = entry.getValue();
            if (h.isEmpty() || h.firstKey().isAfter(min)) {
                Object value = evaluator.evaluate(autoSites.get(entry.getKey()), atMin, live, false, name);
                if (value instanceof TimeSeries ts && !ts.isEmpty()) {
                    h.put(min, ts);
                }
            }
        }
        LOG.debug("Completed history start: formula={}, from={}", name, min);
    }

    private static List<NavigableMap<Instant, TimeSeries>> concat(
            Map<String, NavigableMap<Instant, TimeSeries>> a, Map<String, NavigableMap<Instant, TimeSeries>> b) {
        List<NavigableMap<Instant, TimeSeries>> all = new ArrayList<>(a.values());
        all.addAll(b.values());
        return all;
    }

    /** Binds the arguments of an autotrophic call site, evaluated under the latest context. */
    private OperatorCall bind(Expr.ListExpr site, String formulaName) {
        OperatorDescriptor descriptor = registry.require(site.op());
        Signature.Binding binding = descriptor.signature().bind(site);
        Map<String, Object> args = new LinkedHashMap<>();
        for (Map.Entry<String, Expr> entry : binding.arguments().entrySet()) {
            args.put(entry.getKey(), evaluator.evaluate(entry.getValue(), QueryContext.latest(), live, false, formulaName));
        }
        if (binding.packedName() != null) {
            List<Object> packed = new ArrayList<>();
            for (Expr item : binding.packed()) {
                packed.add(evaluator.evaluate(item, QueryContext.latest(), live, false, formulaName));
            }
            args.put(binding.packedName(), packed);
        }
        return new OperatorCall(site.op(), site, args, QueryContext.latest(), live);
    }

    private boolean hasTimeTravel(Expr node) {
        if (!(node instanceof Expr.ListExpr list)) {
            return false;
        }
        if (registry.lookup(list.op()).map(d -> d.has(Capability.TIME_TRAVEL)).orElse(false)) {
            return true;
        }
        return list.args().stream().anyMatch(this::hasTimeTravel);
    }

    private List<Expr.ListExpr> autotrophicSites(Expr tree) {
        List<Expr.ListExpr> sites = new ArrayList<>();
        collectSites(tree, sites);
        return sites;
    }

    private void collectSites(Expr node, List<Expr.ListExpr> sites) {
        if (!(node instanceof Expr.ListExpr list)) {
            return;
        }
        if (registry.lookup(list.op()).map(d -> d.has(Capability.AUTOTROPHIC)).orElse(false)) {
            sites.add(list);
            return;
        }
        for (Expr child : list.args()) {
            collectSites(child, sites);
        }
    }

    private static NavigableMap<Instant, TimeSeries> prune(NavigableMap<Instant, TimeSeries> history) {
        NavigableMap<Instant, TimeSeries> out = new TreeMap<>();
        history.forEach((date, ts) -> {
            if (!ts.isEmpty()) {
                out.put(date, ts);
            }
        });
        return out;
    }

    private static NavigableMap<Instant, TimeSeries> diffs(TimeSeries baseline, NavigableMap<Instant, TimeSeries> snapshots) {
        NavigableMap<Instant, TimeSeries> out = new TreeMap<>();
        TimeSeries previous = baseline;
        for (Map.Entry<Instant, TimeSeries> entry : snapshots.entrySet()) {
            out.put(entry.getKey(), previous.diff(entry.getValue()));
            previous = entry.getValue();
        }
        return out;
    }

    /** Serves leaves from precomputed histories: the latest snapshot at or before the revision date. */
    private final class HistoricalResolver implements SeriesResolver {

        private final Map<String, NavigableMap<Instant, TimeSeries>> leaves;
        private final Map<String, NavigableMap<Instant, TimeSeries>> autos;

        HistoricalResolver(
                Map<String, NavigableMap<Instant, TimeSeries>> leaves,
                Map<String, NavigableMap<Instant, TimeSeries>> autos) {
            this.leaves = leaves;
            this.autos = autos;
        }

        @Override
        public Optional<TimeSeries> series(String name, QueryContext context) {
            NavigableMap<Instant, TimeSeries> history = leaves.get(name);
            if (history == null) {
                return live.series(name, context);
            }
            return Optional.of(floor(history, context));
        }

        @Override
        public Optional<TimeSeries> autotrophic(String site, QueryContext context) {
            NavigableMap<Instant, TimeSeries> history = autos.get(site);
            return history == null ? Optional.empty() : Optional.of(floor(history, context));
        }

        @Override
        public CatalogView catalog() {
            return live.catalog();
        }

        private TimeSeries floor(NavigableMap<Instant, TimeSeries> history, QueryContext context) {
            Map.Entry<Instant, TimeSeries> entry =
                    context.revisionDate() == null ? history.lastEntry() : history.floorEntry(context.revisionDate());
            if (entry == null) {
                return TimeSeries.empty();
            }
            return entry.getValue().slice(context.fromValueDate(), context.toValueDate());
        }
    }
}
