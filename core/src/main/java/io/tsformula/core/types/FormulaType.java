package io.tsformula.core.types;

import io.tsformula.core.model.Expr;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Static types of the formula language.
 *
 * <p>
 * Base types are the constants of {@link Base}. Composite types are {@link Union} (any member),
 * {@link Defaulted} (transparent wrapper tolerating omission), {@link Packed} (variadic tail) and
 * {@link ListOf}. Compatibility is decided by {@link #accepts(FormulaType, FormulaType)}.
 */
public sealed interface FormulaType {

    /** Human readable name, as shown in type errors. */
    String displayName();

    /** Base (non-composite) types. */
    enum Base implements FormulaType {
        SERIES("Series"),
        NUMBER("Number"),
        INT("Integer"),
        FLOAT("Float"),
        STRING("String"),
        SERIES_NAME("SeriesName"),
        BOOLEAN("Boolean"),
        TIMESTAMP("Timestamp"),
        NIL("Nil"),
        ANY("Any");

        private final String displayName;

        Base(String displayName) {
            this.displayName = displayName;
        }

        @Override
        public String displayName() {
            return displayName;
        }
    }

    /** Any of the member types. */
    record Union(List<FormulaType> members) implements FormulaType {
        public Union {
            Objects.requireNonNull(members, "members must not be null");
            if (members.size() < 2) {
                throw new IllegalArgumentException("a union needs at least two members");
            }
            members = List.copyOf(members);
        }

        @Override
        public String displayName() {
            return members.stream().map(FormulaType::displayName).collect(Collectors.joining(", ", "Union[", "]"));
        }
    }

    /**
     * An optional parameter of type {@code inner}; when omitted, {@code defaultValue} is supplied
     * at call time.
     */
    record Defaulted(FormulaType inner, Expr defaultValue) implements FormulaType {
        public Defaulted {
            Objects.requireNonNull(inner, "inner must not be null");
            defaultValue = defaultValue != null ? defaultValue : Expr.Nil.INSTANCE;
        }

        @Override
        public String displayName() {
            return "Default[" + inner.displayName() + "]";
        }
    }

    /** Variadic tail of {@code inner} values; a {@code List(inner)} value is spread. */
    record Packed(FormulaType inner) implements FormulaType {
        public Packed {
            Objects.requireNonNull(inner, "inner must not be null");
        }

        @Override
        public String displayName() {
            return "Packed[" + inner.displayName() + "]";
        }
    }

    /** A list of {@code element} values. */
    record ListOf(FormulaType element) implements FormulaType {
        public ListOf {
            Objects.requireNonNull(element, "element must not be null");
        }

        @Override
        public String displayName() {
            return "List[" + element.displayName() + "]";
        }
    }

    // ── Factories ──

    static FormulaType union(FormulaType... members) {
        return new Union(List.of(members));
    }

    static FormulaType defaulted(FormulaType inner, Object defaultValue) {
        return new Defaulted(inner, Expr.literal(defaultValue));
    }

    static FormulaType optional(FormulaType inner) {
        return new Defaulted(inner, Expr.Nil.INSTANCE);
    }

    static FormulaType packed(FormulaType inner) {
        return new Packed(inner);
    }

    static FormulaType listOf(FormulaType element) {
        return new ListOf(element);
    }

    // ── Rules ──

    /** Type of a literal atom, or {@link Base#ANY} for symbols and keywords. */
    static FormulaType ofLiteral(Expr atom) {
        if (atom instanceof Expr.Int) {
            return Base.INT;
        }
        if (atom instanceof Expr.Flo) {
            return Base.FLOAT;
        }
        if (atom instanceof Expr.Str) {
            return Base.STRING;
        }
        if (atom instanceof Expr.Bool) {
            return Base.BOOLEAN;
        }
        if (atom instanceof Expr.Nil) {
            return Base.NIL;
        }
        return Base.ANY;
    }

    /**
     * Returns {@code true} if a value of type {@code actual} may be passed where {@code expected}
     * is declared.
     *
     * <p>
     * A union on the actual side is accepted when at least one member is; narrowing is expected
     * to have made the type concrete where it matters.
     */
    static boolean accepts(FormulaType expected, FormulaType actual) {
        if (expected == Base.ANY || actual == Base.ANY) {
            return true;
        }
        if (expected instanceof Defaulted d) {
            return actual == Base.NIL || accepts(d.inner(), actual);
        }
        if (actual instanceof Defaulted d) {
            return accepts(expected, d.inner());
        }
        if (actual instanceof Union u) {
            return u.members().stream().anyMatch(m -> accepts(expected, m));
        }
        if (expected instanceof Union u) {
            return u.members().stream().anyMatch(m -> accepts(m, actual));
        }
        if (expected instanceof Packed p) {
            if (actual instanceof ListOf l) {
                return accepts(p.inner(), l.element());
            }
            return accepts(p.inner(), actual);
        }
        if (expected instanceof ListOf e) {
            return actual instanceof ListOf a && accepts(e.element(), a.element());
        }
        if (expected == actual) {
            return true;
        }
        if (expected == Base.NUMBER) {
            return actual == Base.INT || actual == Base.FLOAT;
        }
        if (expected == Base.FLOAT) {
            return actual == Base.INT;
        }
        if (expected == Base.STRING) {
            return actual == Base.SERIES_NAME;
        }
        if (expected == Base.SERIES_NAME) {
            return actual == Base.STRING;
        }
        return false;
    }

    /** Returns {@code true} if {@code type} is, or may be, a series. */
    static boolean isSeriesLike(FormulaType type) {
        if (type == Base.SERIES) {
            return true;
        }
        if (type instanceof Union u) {
            return u.members().stream().anyMatch(FormulaType::isSeriesLike);
        }
        return type instanceof Defaulted d && isSeriesLike(d.inner());
    }

    /** Returns {@code true} for the numeric base types. */
    static boolean isNumeric(FormulaType type) {
        return type == Base.NUMBER || type == Base.INT || type == Base.FLOAT;
    }

    /**
     * The most specific numeric type covering both operands: {@code Integer} when both are
     * integers, {@code Float} when either is a float, {@code Number} otherwise.
     */
    static FormulaType numericJoin(FormulaType a, FormulaType b) {
        if (a == Base.INT && b == Base.INT) {
            return Base.INT;
        }
        if (a == Base.FLOAT || b == Base.FLOAT) {
            return Base.FLOAT;
        }
        return Base.NUMBER;
    }
}
