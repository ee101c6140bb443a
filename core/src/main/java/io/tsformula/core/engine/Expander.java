package io.tsformula.core.engine;

import io.tsformula.core.error.CircularReferenceException;
import io.tsformula.core.model.Expr;
import io.tsformula.core.model.Formula;
import io.tsformula.core.parse.FormulaParser;
import io.tsformula.core.spi.FormulaStore;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Inlines named formula references, producing a tree whose leaves are primaries and
 * autotrophic calls.
 *
 * <p>
 * Expansion is purely functional: the input tree is never modified. Series options
 * ({@code #:fill}, {@code #:limit}, {@code #:weight}) of an inlined reference are re-attached
 * around the inlined body as {@code (options <body> #:fill ...)}.
 */
public final class Expander {

    /** Series options carried over to the inlined body. */
    static final List<String> SERIES_OPTIONS = List.of("fill", "limit", "weight");

    private final OperatorRegistry registry;
    private final FormulaStore formulas;

    public Expander(OperatorRegistry registry, FormulaStore formulas) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.formulas = Objects.requireNonNull(formulas, "formulas must not be null");
    }

    /** Fully expands {@code tree}. */
    public Expr expand(Expr tree) {
        return expand(tree, ExpansionOptions.DEFAULT);
    }

    /**
     * Expands {@code tree} under {@code options}.
     *
     * @throws CircularReferenceException if a formula reaches itself through inlining
     */
    public Expr expand(Expr tree, ExpansionOptions options) {
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(options, "options must not be null");
        return expand(tree, options, new ArrayDeque<>(), options.maxDepth());
    }

    /**
     * Fully expands {@code tree} as the definition of formula {@code rootName}, so that a
     * definition reaching {@code rootName} again is reported as circular.
     *
     * @throws CircularReferenceException if the definition reaches {@code rootName}
     */
    public Expr expandDefinition(String rootName, Expr tree) {
        Deque<String> stack = new ArrayDeque<>();
        stack.push(rootName);
        return expand(tree, ExpansionOptions.DEFAULT, stack, -1);
    }

    /**
     * Returns the name referenced by a named-reference node, or empty for any other node.
     */
    public Optional<String> referencedName(Expr node) {
        if (!(node instanceof Expr.ListExpr list)) {
            return Optional.empty();
        }
        Optional<OperatorDescriptor> descriptor = registry.lookup(list.op());
        if (descriptor.isEmpty() || !descriptor.get().has(Capability.NAMED_REFERENCE)) {
            return Optional.empty();
        }
        List<Expr> positional = list.positional();
        if (!positional.isEmpty() && positional.get(0) instanceof Expr.Str name) {
            return Optional.of(name.value());
        }
        return list.keyword("name").filter(Expr.Str.class::isInstance).map(e -> ((Expr.Str) e).value());
    }

    private Expr expand(Expr node, ExpansionOptions options, Deque<String> stack, int depth) {
        if (!(node instanceof Expr.ListExpr list)) {
            return node;
        }
        Optional<String> reference = referencedName(list);
        if (reference.isPresent()) {
            return inline(list, reference.get(), options, stack, depth);
        }

        List<Expr> items = new ArrayList<>(list.items().size());
        boolean changed = false;
        for (Expr item : list.items()) {
            Expr expanded = expand(item, options, stack, depth);
            changed |= expanded != item;
            items.add(expanded);
        }
        Expr.ListExpr rebuilt = changed ? new Expr.ListExpr(items) : list;
        if (options.scopes()) {
            Optional<OperatorDescriptor> descriptor = registry.lookup(list.op());
            if (descriptor.isPresent() && descriptor.get().argScopeRewriter().isPresent()) {
                return descriptor.get().argScopeRewriter().get().rewrite(rebuilt);
            }
        }
        return rebuilt;
    }

    private Expr inline(Expr.ListExpr ref, String name, ExpansionOptions options, Deque<String> stack, int depth) {
        if (!options.showNames().isEmpty()
                && (options.showNames().contains(name) || !reaches(ref, options.showNames(), new HashSet<>()))) {
            return ref;
        }
        if (options.stopNames().contains(name) || depth == 0) {
            return ref;
        }
        if (stack.contains(name)) {
            List<String> cycle = new ArrayList<>();
            stack.descendingIterator().forEachRemaining(cycle::add);
            cycle.add(name);
            throw new CircularReferenceException(
                    "formula `" + name + "` refers to itself through " + String.join(" -> ", cycle), name, cycle);
        }
        Optional<Formula> formula = formulas.find(name);
        if (formula.isEmpty()) {
            return ref;
        }
        stack.push(name);
        Expr body;
        try {
            body = expand(FormulaParser.parse(formula.get().text(), name), options, stack, depth < 0 ? depth : depth - 1);
        } finally {
            stack.pop();
        }
        List<Expr> seriesOptions = seriesOptions(ref);
        if (seriesOptions.isEmpty()) {
            return body;
        }
        List<Expr> wrapped = new ArrayList<>();
        wrapped.add(Expr.sym("options"));
        wrapped.add(body);
        wrapped.addAll(seriesOptions);
        return new Expr.ListExpr(wrapped);
    }

    /** Keyword/value pairs of {@code ref} that are series options, in source order. */
    static List<Expr> seriesOptions(Expr.ListExpr ref) {
        List<Expr> out = new ArrayList<>();
        List<Expr> args = ref.args();
        for (int i = 0; i < args.size() - 1; i++) {
            if (args.get(i) instanceof Expr.Keyword k && SERIES_OPTIONS.contains(k.name())) {
                out.add(k);
                out.add(args.get(++i));
            }
        }
        return out;
    }

    /** Returns {@code true} if {@code node} references, possibly through formulas, one of {@code names}. */
    private boolean reaches(Expr node, Set<String> names, Set<String> visited) {
        if (!(node instanceof Expr.ListExpr list)) {
            return false;
        }
        Optional<String> reference = referencedName(list);
        if (reference.isPresent()) {
            String name = reference.get();
            if (names.contains(name)) {
                return true;
            }
            if (visited.add(name)) {
                Optional<Formula> formula = formulas.find(name);
                if (formula.isPresent() && reaches(FormulaParser.parse(formula.get().text(), name), names, visited)) {
                    return true;
                }
            }
        }
        for (Expr child : list.args()) {
            if (reaches(child, names, visited)) {
                return true;
            }
        }
        return false;
    }
}
