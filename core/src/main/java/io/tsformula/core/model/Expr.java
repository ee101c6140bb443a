package io.tsformula.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable symbolic expression tree. A node is either an atom (number, string, boolean, nil,
 * symbol or keyword tag) or an ordered list {@code (operator arg ...)}.
 *
 * <p>
 * Implementations are a sealed hierarchy. Rewriters never mutate a node; they build new trees.
 * Equality is structural, so two trees parsed from cosmetically different text compare equal.
 */
public sealed interface Expr {

    /** Returns {@code true} for every node that is not a {@link ListExpr}. */
    default boolean isAtom() {
        return !(this instanceof ListExpr);
    }

    // ── Atoms ──

    /** Integer literal. */
    record Int(long value) implements Expr {}

    /** Floating point literal. */
    record Flo(double value) implements Expr {}

    /** Double-quoted string literal. */
    record Str(String value) implements Expr {
        public Str {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /** Boolean literal ({@code #t} / {@code #f}). */
    record Bool(boolean value) implements Expr {}

    /** The {@code nil} literal. */
    record Nil() implements Expr {
        public static final Nil INSTANCE = new Nil();
    }

    /** A bare symbol: an operator name or a {@code let}-bound variable. */
    record Symbol(String name) implements Expr {
        public Symbol {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    /** A keyword tag ({@code #:fill}) marking the next element as a keyword argument. */
    record Keyword(String name) implements Expr {
        public Keyword {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    /**
     * An operator application. The first element is the operator symbol; the remaining elements
     * are positional arguments, or keyword tags followed by their values.
     */
    record ListExpr(List<Expr> items) implements Expr {

        public ListExpr {
            Objects.requireNonNull(items, "items must not be null");
            if (items.isEmpty()) {
                throw new IllegalArgumentException("an expression list must not be empty");
            }
            items = List.copyOf(items);
        }

        /** Returns the operator name, or empty when the head is not a symbol. */
        public Optional<String> operator() {
            return items.get(0) instanceof Symbol s ? Optional.of(s.name()) : Optional.empty();
        }

        /** Returns the operator name, or {@code ""} when the head is not a symbol. */
        public String op() {
            return operator().orElse("");
        }

        /** All elements after the operator, keyword tags included. */
        public List<Expr> args() {
            return items.subList(1, items.size());
        }

        /** Positional arguments only (keyword tags and their values are skipped). */
        public List<Expr> positional() {
            List<Expr> out = new ArrayList<>();
            List<Expr> args = args();
            for (int i = 0; i < args.size(); i++) {
                if (args.get(i) instanceof Keyword) {
                    i++;
                    continue;
                }
                out.add(args.get(i));
            }
            return Collections.unmodifiableList(out);
        }

        /** Returns the value following keyword tag {@code name}, if present. */
        public Optional<Expr> keyword(String name) {
            List<Expr> args = args();
            for (int i = 0; i < args.size() - 1; i++) {
                if (args.get(i) instanceof Keyword k && k.name().equals(name)) {
                    return Optional.of(args.get(i + 1));
                }
            }
            return Optional.empty();
        }

        /** Returns a copy of this node with {@code replacement} at index {@code idx}. */
        public ListExpr with(int idx, Expr replacement) {
            List<Expr> copy = new ArrayList<>(items);
            copy.set(idx, replacement);
            return new ListExpr(copy);
        }
    }

    // ── Factories ──

    static Symbol sym(String name) {
        return new Symbol(name);
    }

    static Str str(String value) {
        return new Str(value);
    }

    static Keyword kw(String name) {
        return new Keyword(name);
    }

    static ListExpr list(Expr... items) {
        return new ListExpr(List.of(items));
    }

    /** Builds {@code (op args...)}. */
    static ListExpr call(String op, Expr... args) {
        List<Expr> items = new ArrayList<>(args.length + 1);
        items.add(new Symbol(op));
        Collections.addAll(items, args);
        return new ListExpr(items);
    }

    /** Wraps a Java literal value into the matching atom. */
    static Expr literal(Object value) {
        if (value == null) {
            return Nil.INSTANCE;
        }
        if (value instanceof Expr e) {
            return e;
        }
        if (value instanceof Integer || value instanceof Long) {
            return new Int(((Number) value).longValue());
        }
        if (value instanceof Number n) {
            return new Flo(n.doubleValue());
        }
        if (value instanceof Boolean b) {
            return new Bool(b);
        }
        if (value instanceof String s) {
            return new Str(s);
        }
        throw new IllegalArgumentException("no literal form for " + value.getClass().getSimpleName());
    }
}
