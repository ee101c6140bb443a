package io.tsformula.core.engine;

import io.tsformula.core.error.TypeMismatchException;
import io.tsformula.core.error.UnknownOperatorException;
import io.tsformula.core.model.Expr;
import io.tsformula.core.parse.FormulaSerializer;
import io.tsformula.core.types.FormulaType;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Static type inference over formula trees, driven by the operator signatures of an
 * {@link OperatorRegistry}.
 *
 * <p>
 * {@link #check(Expr)} never throws for ill-typed input; it returns a {@link TypeCheck.Failure}.
 * {@link #requireType(Expr, FormulaType, String, String)} converts failures into the
 * registration exceptions.
 */
public final class TypeChecker {

    private final OperatorRegistry registry;

    public TypeChecker(OperatorRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /** Infers the type of {@code tree}. */
    public TypeCheck check(Expr tree) {
        Objects.requireNonNull(tree, "tree must not be null");
        List<String> unknown = unknownOperators(tree);
        if (!unknown.isEmpty()) {
            return new TypeCheck.Failure(
                    "unknown operators: " + String.join(", ", unknown), null, null, null, null, unknown);
        }
        try {
            return new TypeCheck.Success(infer(tree, contextScope()));
        } catch (Mismatch m) {
            return m.failure;
        }
    }

    /**
     * Checks that {@code tree} is well typed and that its type is acceptable where
     * {@code expected} is required.
     *
     * @return the inferred type
     * @throws UnknownOperatorException if the tree uses unregistered operators
     * @throws TypeMismatchException    if the tree is ill typed or has the wrong root type
     */
    public FormulaType requireType(Expr tree, FormulaType expected, String formulaName, String source) {
        TypeCheck result = check(tree);
        if (result instanceof TypeCheck.Failure f) {
            if (!f.unknownOperators().isEmpty()) {
                throw new UnknownOperatorException(
                        "formula `" + formulaName + "` refers to unknown operators "
                                + String.join(", ", f.unknownOperators().stream().map(o -> "`" + o + "`").toList()),
                        formulaName,
                        source,
                        f.unknownOperators());
            }
            throw new TypeMismatchException(
                    f.message(), formulaName, source, f.operator(), f.argument(), f.expected(), f.actual());
        }
        FormulaType type = ((TypeCheck.Success) result).type();
        if (!FormulaType.accepts(expected, type) || type == FormulaType.Base.ANY) {
            throw new TypeMismatchException(
                    "formula `" + formulaName + "` must return a `" + expected.displayName() + "`, not `"
                            + type.displayName() + "`",
                    formulaName,
                    source,
                    null,
                    null,
                    expected.displayName(),
                    type.displayName());
        }
        return type;
    }

    /** All operators of {@code tree} missing from the registry, in order of appearance. */
    public List<String> unknownOperators(Expr tree) {
        Set<String> unknown = new LinkedHashSet<>();
        collectUnknown(tree, unknown);
        return new ArrayList<>(unknown);
    }

    private void collectUnknown(Expr node, Set<String> unknown) {
        if (!(node instanceof Expr.ListExpr list)) {
            return;
        }
        String op = list.op();
        if (!Evaluator.LET.equals(op) && !registry.has(op)) {
            unknown.add(op.isEmpty() ? FormulaSerializer.serialize(list.items().get(0)) : op);
        }
        for (Expr child : list.args()) {
            collectUnknown(child, unknown);
        }
    }

    private static Map<String, FormulaType> contextScope() {
        Map<String, FormulaType> scope = new HashMap<>();
        scope.put(Evaluator.REVISION_DATE, FormulaType.Base.TIMESTAMP);
        scope.put(Evaluator.FROM_VALUE_DATE, FormulaType.Base.TIMESTAMP);
        scope.put(Evaluator.TO_VALUE_DATE, FormulaType.Base.TIMESTAMP);
        return scope;
    }

    private FormulaType infer(Expr node, Map<String, FormulaType> scope) {
        if (node instanceof Expr.Symbol s) {
            FormulaType bound = scope.get(s.name());
            if (bound == null) {
                throw new Mismatch(new TypeCheck.Failure(
                        "unbound symbol `" + s.name() + "`", null, s.name(), null, null, List.of()));
            }
            return bound;
        }
        if (!(node instanceof Expr.ListExpr list)) {
            return FormulaType.ofLiteral(node);
        }
        String op = list.op();
        if (Evaluator.LET.equals(op)) {
            return inferLet(list, scope);
        }
        OperatorDescriptor descriptor = registry.require(op);
        Signature signature = descriptor.signature();
        Signature.Binding binding;
        try {
            binding = signature.bind(list);
        } catch (Signature.ArgumentMismatchException e) {
            throw new Mismatch(new TypeCheck.Failure(e.getMessage(), op, e.argument(), null, null, List.of()));
        }

        Map<String, FormulaType> argTypes = new LinkedHashMap<>();
        for (Map.Entry<String, Expr> entry : binding.arguments().entrySet()) {
            String paramName = entry.getKey();
            FormulaType declared = signature.param(paramName).orElseThrow().type();
            if (binding.defaulted().contains(paramName)) {
                argTypes.put(paramName, declared);
                continue;
            }
            FormulaType actual = infer(entry.getValue(), scope);
            requireAccepted(op, paramName, declared, actual, entry.getValue());
            argTypes.put(paramName, actual);
        }
        if (binding.packedName() != null) {
            FormulaType declared = signature.param(binding.packedName()).orElseThrow().type();
            List<FormulaType> members = new ArrayList<>();
            for (Expr item : binding.packed()) {
                FormulaType actual = infer(item, scope);
                requireAccepted(op, binding.packedName(), declared, actual, item);
                members.add(actual);
            }
            argTypes.put(binding.packedName(), members.isEmpty() ? declared : joinAll(members));
        }

        FormulaType declaredReturn = signature.returnType();
        return descriptor.returnTypeNarrower()
                .map(n -> n.narrow(declaredReturn, argTypes))
                .orElse(declaredReturn);
    }

    private FormulaType inferLet(Expr.ListExpr list, Map<String, FormulaType> scope) {
        List<Expr> args = list.args();
        if (args.size() % 2 == 0) {
            throw new Mismatch(new TypeCheck.Failure(
                    "`let` needs name/value pairs followed by a body", Evaluator.LET, null, null, null, List.of()));
        }
        Map<String, FormulaType> inner = new HashMap<>(scope);
        for (int i = 0; i < args.size() - 1; i += 2) {
            if (!(args.get(i) instanceof Expr.Symbol name)) {
                throw new Mismatch(new TypeCheck.Failure(
                        "`let` binding names must be symbols, got `" + FormulaSerializer.serialize(args.get(i)) + "`",
                        Evaluator.LET,
                        null,
                        null,
                        null,
                        List.of()));
            }
            inner.put(name.name(), infer(args.get(i + 1), inner));
        }
        return infer(args.get(args.size() - 1), inner);
    }

    private static void requireAccepted(String op, String param, FormulaType declared, FormulaType actual, Expr arg) {
        if (FormulaType.accepts(declared, actual)) {
            return;
        }
        FormulaType shown = declared instanceof FormulaType.Packed p ? p.inner() : declared;
        throw new Mismatch(new TypeCheck.Failure(
                "argument `" + param + "` of `" + op + "` expects `" + shown.displayName() + "`, got `"
                        + actual.displayName() + "` from `" + FormulaSerializer.serialize(arg) + "`",
                op,
                param,
                shown.displayName(),
                actual.displayName(),
                List.of()));
    }

    private static FormulaType joinAll(List<FormulaType> members) {
        Set<FormulaType> distinct = new LinkedHashSet<>(members);
        return distinct.size() == 1 ? distinct.iterator().next() : new FormulaType.Union(new ArrayList<>(distinct));
    }

    private static final class Mismatch extends RuntimeException {

        private static final long serialVersionUID = 1L;

        private final transient TypeCheck.Failure failure;

        Mismatch(TypeCheck.Failure failure) {
            super(failure.message(), null, false, false);
            this.failure = failure;
        }
    }
}
