package io.tsformula.core.engine;

import io.tsformula.core.model.Expr;
import io.tsformula.core.types.FormulaType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Declared parameters and return type of an operator.
 *
 * <p>
 * Positional parameters are matched in declaration order; a trailing {@link FormulaType.Packed}
 * parameter absorbs the remaining positional arguments. Every parameter may also be passed by
 * keyword ({@code #:name value}); keyword-only parameters cannot be passed positionally. Omitted
 * {@link FormulaType.Defaulted} parameters take their default.
 *
 * <p>
 * Immutable and thread-safe.
 */
public final class Signature {

    /**
     * One declared parameter.
     *
     * @param name        parameter name, also its keyword
     * @param type        declared type
     * @param keywordOnly {@code true} if the parameter can only be passed as {@code #:name}
     */
    public record Param(String name, FormulaType type, boolean keywordOnly) {
        public Param {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("parameter name must not be null or blank");
            }
            if (type == null) {
                throw new IllegalArgumentException("parameter `" + name + "` has no declared type");
            }
        }

        public boolean packed() {
            return type instanceof FormulaType.Packed;
        }

        public boolean optional() {
            return type instanceof FormulaType.Defaulted || packed();
        }
    }

    private final List<Param> params;
    private final FormulaType returnType;

    private Signature(List<Param> params, FormulaType returnType) {
        this.params = List.copyOf(params);
        this.returnType = returnType;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Param> params() {
        return params;
    }

    public FormulaType returnType() {
        return returnType;
    }

    public Optional<Param> param(String name) {
        return params.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    /**
     * Matches the arguments of {@code node} to this signature.
     *
     * @throws ArgumentMismatchException on unknown or duplicate keywords, surplus positional
     *     arguments and missing mandatory parameters
     */
    public Binding bind(Expr.ListExpr node) {
        String op = node.op();
        List<Param> positional = params.stream().filter(p -> !p.keywordOnly()).toList();
        Map<String, Expr> single = new LinkedHashMap<>();
        List<Expr> packed = new ArrayList<>();
        Set<String> keywordBound = new HashSet<>();
        int next = 0;
        List<Expr> args = node.args();
        for (int i = 0; i < args.size(); i++) {
            Expr arg = args.get(i);
            if (arg instanceof Expr.Keyword k) {
                Param param = param(k.name())
                        .orElseThrow(() -> new ArgumentMismatchException(
                                k.name(), "unknown keyword `#:" + k.name() + "` for operator `" + op + "`"));
                if (param.packed()) {
                    throw new ArgumentMismatchException(
                            k.name(), "variadic argument `" + k.name() + "` of `" + op + "` cannot be a keyword");
                }
                if (!keywordBound.add(k.name()) || single.containsKey(k.name())) {
                    throw new ArgumentMismatchException(
                            k.name(), "argument `" + k.name() + "` given twice to `" + op + "`");
                }
                single.put(k.name(), args.get(++i));
                continue;
            }
            while (next < positional.size() && single.containsKey(positional.get(next).name())) {
                next++;
            }
            if (next >= positional.size()) {
                throw new ArgumentMismatchException(null, "too many arguments for operator `" + op + "`");
            }
            Param param = positional.get(next);
            if (param.packed()) {
                packed.add(arg);
            } else {
                single.put(param.name(), arg);
                next++;
            }
        }

        Map<String, Expr> bound = new LinkedHashMap<>();
        Set<String> defaulted = new HashSet<>();
        String packedName = null;
        for (Param param : params) {
            if (param.packed()) {
                packedName = param.name();
                continue;
            }
            Expr value = single.get(param.name());
            if (value == null) {
                if (param.type() instanceof FormulaType.Defaulted d) {
                    value = d.defaultValue();
                    defaulted.add(param.name());
                } else {
                    throw new ArgumentMismatchException(
                            param.name(), "missing argument `" + param.name() + "` for operator `" + op + "`");
                }
            }
            bound.put(param.name(), value);
        }
        return new Binding(bound, defaulted, packedName, packed);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        for (Param p : params) {
            if (sb.length() > 1) {
                sb.append(' ');
            }
            sb.append(p.keywordOnly() ? "#:" : "").append(p.name()).append(':').append(p.type().displayName());
        }
        return sb.append(") -> ").append(returnType.displayName()).toString();
    }

    /**
     * Arguments of one call matched to parameters.
     *
     * @param arguments  single-valued parameters in declaration order (defaults included)
     * @param defaulted  names of parameters bound to their default
     * @param packedName name of the variadic parameter, or {@code null}
     * @param packed     arguments absorbed by the variadic parameter
     */
    public record Binding(Map<String, Expr> arguments, Set<String> defaulted, String packedName, List<Expr> packed) {
        public Binding {
            arguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
            defaulted = Set.copyOf(defaulted);
            packed = List.copyOf(packed);
        }
    }

    /** Raised when a call's arguments do not fit the signature. */
    public static final class ArgumentMismatchException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        private final String argument;

        ArgumentMismatchException(String argument, String message) {
            super(message);
            this.argument = argument;
        }

        /** The offending parameter name, or {@code null}. */
        public String argument() {
            return argument;
        }
    }

    /** Fluent builder; parameters are kept in call order. */
    public static final class Builder {

        private final List<Param> params = new ArrayList<>();
        private FormulaType returnType;

        Builder() {}

        public Builder param(String name, FormulaType type) {
            params.add(new Param(name, type, false));
            return this;
        }

        public Builder keyword(String name, FormulaType type) {
            params.add(new Param(name, type, true));
            return this;
        }

        public Builder returns(FormulaType type) {
            this.returnType = type;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the return type is undeclared, a name repeats, or a
         *     variadic parameter is not the last positional one
         */
        public Signature build() {
            if (returnType == null) {
                throw new IllegalArgumentException("return type must be declared");
            }
            Set<String> names = new HashSet<>();
            boolean seenPacked = false;
            for (Param p : params) {
                if (!names.add(p.name())) {
                    throw new IllegalArgumentException("duplicate parameter `" + p.name() + "`");
                }
                if (p.keywordOnly()) {
                    continue;
                }
                if (seenPacked) {
                    throw new IllegalArgumentException("variadic parameter must be the last positional one");
                }
                seenPacked = p.packed();
            }
            return new Signature(params, returnType);
        }
    }
}
