package io.tsformula.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.tsformula.core.error.TimezoneIncompatibilityException;
import io.tsformula.core.model.Expr;
import io.tsformula.core.model.Formula;
import io.tsformula.core.model.FormulaStats;
import io.tsformula.core.model.SeriesMetadata;
import io.tsformula.core.parse.FormulaParser;
import io.tsformula.core.parse.FormulaSerializer;
import io.tsformula.core.spi.CatalogView;
import io.tsformula.core.spi.FormulaStore;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks which series a formula needs, the dependency edges between formulas, and content
 * hashes.
 *
 * <p>
 * The content hash of a formula is the SHA-1 of its fully expanded, serialized tree. Editing a
 * sub-formula therefore changes the hash of every formula depending on it;
 * {@link #rehashDependents(String)} keeps the stored hashes in step.
 */
public final class DependencyTracker {

    private static final Logger LOG = LoggerFactory.getLogger(DependencyTracker.class);

    private final OperatorRegistry registry;
    private final FormulaStore formulas;
    private final CatalogView catalog;
    private final Expander expander;

    public DependencyTracker(OperatorRegistry registry, FormulaStore formulas, CatalogView catalog, Expander expander) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.formulas = Objects.requireNonNull(formulas, "formulas must not be null");
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.expander = Objects.requireNonNull(expander, "expander must not be null");
    }

    // ── Discovery ──

    /** Series referenced by {@code tree}, in order of appearance, each with its referencing node. */
    public Map<String, Expr.ListExpr> findSeries(Expr tree) {
        Map<String, Expr.ListExpr> found = new LinkedHashMap<>();
        collectSeries(tree, found);
        return found;
    }

    private void collectSeries(Expr node, Map<String, Expr.ListExpr> found) {
        if (!(node instanceof Expr.ListExpr list)) {
            return;
        }
        registry.lookup(list.op())
                .flatMap(OperatorDescriptor::seriesFinder)
                .ifPresent(finder -> found.putAll(finder.find(catalog, list)));
        for (Expr child : list.args()) {
            collectSeries(child, found);
        }
    }

    /** Core metadata of the series below {@code tree}, keyed by name; unknown metadata is left out. */
    public Map<String, SeriesMetadata> findMetadata(Expr tree) {
        if (!(tree instanceof Expr.ListExpr list)) {
            return Map.of();
        }
        Optional<OperatorDescriptor> descriptor = registry.lookup(list.op());
        if (descriptor.isPresent() && descriptor.get().metadataFinder().isPresent()) {
            return descriptor.get().metadataFinder().get().find(catalog, list, this::findMetadata);
        }
        Map<String, SeriesMetadata> found = new LinkedHashMap<>();
        for (Expr child : list.args()) {
            found.putAll(findMetadata(child));
        }
        return found;
    }

    /**
     * Checks that every series below {@code tree} agrees on timezone awareness.
     *
     * @return the common awareness, or {@code null} when no leaf metadata is known
     * @throws TimezoneIncompatibilityException naming every {@code name:path:awareness} entry
     */
    public Boolean checkTimezones(String formulaName, Expr tree, String source) {
        Map<String, Boolean> status = new LinkedHashMap<>();
        collectAwareness(tree, "", status);
        Boolean first = null;
        boolean conflict = false;
        for (Boolean aware : status.values()) {
            if (aware == null) {
                continue;
            }
            if (first == null) {
                first = aware;
            } else if (!first.equals(aware)) {
                conflict = true;
            }
        }
        if (conflict) {
            Map<String, String> labels = new LinkedHashMap<>();
            status.forEach((k, v) -> labels.put(k, label(v)));
            List<String> shown = new ArrayList<>();
            labels.forEach((k, v) -> shown.add("`" + k + ":" + v + "`"));
            throw new TimezoneIncompatibilityException(
                    "formula `" + formulaName + "` has tzaware vs tznaive series: " + String.join(", ", shown),
                    formulaName,
                    source,
                    labels);
        }
        if (status.containsValue(null)) {
            LOG.warn("Unknown timezone awareness in formula: formula={}, series={}", formulaName, status);
        }
        return first;
    }

    private void collectAwareness(Expr node, String path, Map<String, Boolean> status) {
        if (!(node instanceof Expr.ListExpr list)) {
            return;
        }
        String here = path.isEmpty() ? list.op() : path + "/" + list.op();
        Optional<OperatorDescriptor> descriptor = registry.lookup(list.op());
        if (descriptor.isPresent() && descriptor.get().metadataFinder().isPresent()) {
            Map<String, SeriesMetadata> metas = findMetadata(list);
            for (String name : findSeries(list).keySet()) {
                SeriesMetadata meta = metas.get(name);
                status.put(name + ":" + here, meta == null ? null : meta.tzaware());
            }
            return;
        }
        for (Expr child : list.args()) {
            collectAwareness(child, here, status);
        }
    }

    private static String label(Boolean aware) {
        if (aware == null) {
            return "unknown";
        }
        return aware ? "tzaware" : "tznaive";
    }

    // ── Edges ──

    /** Replaces the outgoing edges of {@code name} with the formulas {@code tree} references. */
    public Set<String> registerDependents(String name, Expr tree) {
        Set<String> needs = new TreeSet<>();
        for (String dep : findSeries(tree).keySet()) {
            if (catalog.isFormula(dep)) {
                needs.add(dep);
            }
        }
        formulas.replaceDependencies(name, needs);
        LOG.debug("Registered dependencies: formula={}, needs={}", name, needs);
        return needs;
    }

    /** Formulas depending on {@code name}, directly or transitively, sorted. */
    public List<String> dependents(String name, boolean direct) {
        if (direct) {
            return new ArrayList<>(new TreeSet<>(formulas.directDependents(name)));
        }
        Set<String> seen = new TreeSet<>();
        Deque<String> queue = new ArrayDeque<>(formulas.directDependents(name));
        while (!queue.isEmpty()) {
            String next = queue.poll();
            if (seen.add(next)) {
                queue.addAll(formulas.directDependents(next));
            }
        }
        seen.remove(name);
        return new ArrayList<>(seen);
    }

    // ── Hashing ──

    /** SHA-1 hex digest of the serialized, fully expanded {@code tree}. */
    public String contentHash(Expr tree) {
        return sha1(FormulaSerializer.serialize(expander.expand(tree)));
    }

    /**
     * Recomputes and stores the content hash of every transitive dependent of {@code name}.
     *
     * @return the names whose stored hash changed
     */
    public List<String> rehashDependents(String name) {
        List<String> changed = new ArrayList<>();
        for (String dependent : dependents(name, false)) {
            Optional<Formula> formula = formulas.find(dependent);
            if (formula.isEmpty()) {
                continue;
            }
            String hash = contentHash(FormulaParser.parse(formula.get().text(), dependent));
            if (!hash.equals(formula.get().contentHash())) {
                formulas.save(formula.get().withContentHash(hash));
                changed.add(dependent);
            }
        }
        if (!changed.isEmpty()) {
            LOG.debug("Rehashed dependents: formula={}, changed={}", name, changed);
        }
        return changed;
    }

    static String sha1(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 is not available", e);
        }
    }

    // ── Structure ──

    /**
     * Component tree of a formula: {@code {name: [component, ...]}} where, when {@code expanded},
     * formula components are themselves shown as nested objects.
     *
     * @return the components, or empty when {@code name} is not a formula
     */
    public Optional<JsonNode> formulaComponents(String name, boolean expanded) {
        Optional<Formula> formula = formulas.find(name);
        if (formula.isEmpty() || !catalog.isFormula(name)) {
            return Optional.empty();
        }
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        ArrayNode components = root.putArray(name);
        for (String component : findSeries(FormulaParser.parse(formula.get().text(), name)).keySet()) {
            if (expanded && catalog.isFormula(component)) {
                components.add(formulaComponents(component, true).orElseThrow());
            } else {
                components.add(component);
            }
        }
        return Optional.of(root);
    }

    /**
     * Maximum number of formula references traversed to reach the bottom of {@code name}; 0 for
     * a formula over primaries only.
     */
    public int formulaDepth(String name) {
        return depth(name, new HashSet<>());
    }

    private int depth(String name, Set<String> path) {
        Optional<Formula> formula = formulas.find(name);
        if (formula.isEmpty() || !path.add(name)) {
            return 0;
        }
        int max = 0;
        for (String dep : findSeries(FormulaParser.parse(formula.get().text(), name)).keySet()) {
            if (catalog.isFormula(dep)) {
                max = Math.max(max, 1 + depth(dep, path));
            }
        }
        path.remove(name);
        return max;
    }

    /** Structural statistics of {@code name}. */
    public FormulaStats formulaStats(String name) {
        Formula formula = formulas.find(name).orElseThrow(() -> new IllegalArgumentException("no formula named `" + name + "`"));
        Map<String, Integer> named = new TreeMap<>();
        Map<String, Integer> primaries = new TreeMap<>();
        int[] degree = {0};
        explore(FormulaParser.parse(formula.text(), name), 0, named, primaries, degree, new HashSet<>(Set.of(name)));

        Map<String, List<String>> autos = new TreeMap<>();
        collectAutotrophic(expander.expand(FormulaParser.parse(formula.text(), name)), autos);
        return new FormulaStats(name, degree[0], new TreeMap<>(named), new TreeMap<>(primaries), new TreeMap<>(autos));
    }

    private void explore(
            Expr tree,
            int depth,
            Map<String, Integer> named,
            Map<String, Integer> primaries,
            int[] degree,
            Set<String> path) {
        int here = depth + 1;
        degree[0] = Math.max(degree[0], here);
        for (String series : findSeries(tree).keySet()) {
            if (catalog.isPrimary(series)) {
                primaries.merge(series, 1, Integer::sum);
                continue;
            }
            Optional<Formula> formula = formulas.find(series);
            if (formula.isEmpty() || path.contains(series)) {
                continue;
            }
            named.merge(series, 1, Integer::sum);
            path.add(series);
            explore(FormulaParser.parse(formula.get().text(), series), here, named, primaries, degree, path);
            path.remove(series);
        }
    }

    private void collectAutotrophic(Expr node, Map<String, List<String>> autos) {
        if (!(node instanceof Expr.ListExpr list)) {
            return;
        }
        registry.lookup(list.op())
                .filter(d -> d.has(Capability.AUTOTROPHIC))
                .ifPresent(d -> autos.computeIfAbsent(d.name(), k -> new ArrayList<>())
                        .add(FormulaSerializer.serialize(list)));
        for (Expr child : list.args()) {
            collectAutotrophic(child, autos);
        }
    }

    /** Names of {@code names} that are neither primaries nor formulas. */
    public List<String> unknownSeries(Collection<String> names) {
        List<String> unknown = new ArrayList<>();
        for (String n : names) {
            if (!catalog.exists(n)) {
                unknown.add(n);
            }
        }
        return unknown;
    }

    /** Catalog used by the finders. */
    public CatalogView catalog() {
        return catalog;
    }
}
