package io.tsformula.core.parse;

import io.tsformula.core.model.Expr;
import java.util.Objects;

/**
 * Serializes an {@link Expr} tree to canonical formula text: single spaces between elements, no
 * spaces inside parentheses, floats always carrying a decimal point or exponent.
 *
 * <p>
 * Parsing canonical text and serializing it again yields the same text.
 */
public final class FormulaSerializer {

    private FormulaSerializer() {
        // utility class
    }

    /** Returns the canonical text of {@code expr}. */
    public static String serialize(Expr expr) {
        Objects.requireNonNull(expr, "expr must not be null");
        StringBuilder sb = new StringBuilder();
        write(expr, sb);
        return sb.toString();
    }

    /** Parses and re-serializes {@code text}. */
    public static String canonicalize(String text) {
        return serialize(FormulaParser.parse(text));
    }

    private static void write(Expr expr, StringBuilder sb) {
        if (expr instanceof Expr.ListExpr list) {
            sb.append('(');
            boolean first = true;
            for (Expr item : list.items()) {
                if (!first) {
                    sb.append(' ');
                }
                write(item, sb);
                first = false;
            }
            sb.append(')');
        } else if (expr instanceof Expr.Int i) {
            sb.append(i.value());
        } else if (expr instanceof Expr.Flo f) {
            sb.append(formatFloat(f.value()));
        } else if (expr instanceof Expr.Str s) {
            sb.append('"');
            for (char c : s.value().toCharArray()) {
                switch (c) {
                    case '"' -> sb.append("\\\"");
                    case '\\' -> sb.append("\\\\");
                    case '\n' -> sb.append("\\n");
                    case '\t' -> sb.append("\\t");
                    default -> sb.append(c);
                }
            }
            sb.append('"');
        } else if (expr instanceof Expr.Bool b) {
            sb.append(b.value() ? "#t" : "#f");
        } else if (expr instanceof Expr.Nil) {
            sb.append("nil");
        } else if (expr instanceof Expr.Symbol s) {
            sb.append(s.name());
        } else if (expr instanceof Expr.Keyword k) {
            sb.append("#:").append(k.name());
        }
    }

    private static String formatFloat(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("non-finite float has no formula literal: " + value);
        }
        return Double.toString(value);
    }
}
