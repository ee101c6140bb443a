package io.tsformula.core.parse;

import io.tsformula.core.error.FormulaSyntaxException;
import io.tsformula.core.model.Expr;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parses formula text (parenthesized prefix expressions) into an {@link Expr} tree.
 *
 * <p>
 * Grammar:
 * <ul>
 * <li>list: {@code (} expr* {@code )}, never empty</li>
 * <li>string: double-quoted, with {@code \"} and {@code \\} escapes</li>
 * <li>keyword tag: {@code #:name}</li>
 * <li>booleans: {@code #t}, {@code #f}; nil: {@code nil}</li>
 * <li>numbers: integers ({@code -12}) and floats ({@code 1.5}, {@code .5}, {@code 1e3})</li>
 * <li>anything else is a symbol; {@code ;} starts a comment running to end of line</li>
 * </ul>
 *
 * <p>
 * Stateless and thread-safe; each call uses its own cursor.
 */
public final class FormulaParser {

    private FormulaParser() {
        // utility class
    }

    /**
     * Parses {@code text} into a tree.
     *
     * @param text the formula source
     * @return the parsed tree
     * @throws FormulaSyntaxException if the text is malformed or holds more than one expression
     */
    public static Expr parse(String text) {
        return parse(text, null);
    }

    /**
     * Parses {@code text}, attributing syntax errors to the formula named {@code formulaName}.
     *
     * @param text        the formula source
     * @param formulaName the formula being registered, may be null
     * @return the parsed tree
     * @throws FormulaSyntaxException if the text is malformed
     */
    public static Expr parse(String text, String formulaName) {
        Objects.requireNonNull(text, "text must not be null");
        Cursor cursor = new Cursor(text, formulaName);
        cursor.skipBlanks();
        if (cursor.atEnd()) {
            throw cursor.error("empty formula");
        }
        Expr expr = cursor.readExpr();
        cursor.skipBlanks();
        if (!cursor.atEnd()) {
            throw cursor.error("unexpected trailing input");
        }
        return expr;
    }

    private static final class Cursor {

        private final String text;
        private final String formulaName;
        private int pos;

        Cursor(String text, String formulaName) {
            this.text = text;
            this.formulaName = formulaName;
        }

        boolean atEnd() {
            return pos >= text.length();
        }

        FormulaSyntaxException error(String what) {
            String where = atEnd() ? "end of input" : "position " + pos;
            return new FormulaSyntaxException(
                    "syntax error at " + where + ": " + what + " in `" + text.strip() + "`", formulaName, text, pos);
        }

        void skipBlanks() {
            while (!atEnd()) {
                char c = text.charAt(pos);
                if (Character.isWhitespace(c)) {
                    pos++;
                } else if (c == ';') {
                    while (!atEnd() && text.charAt(pos) != '\n') {
                        pos++;
                    }
                } else {
                    return;
                }
            }
        }

        Expr readExpr() {
            char c = text.charAt(pos);
            if (c == '(') {
                return readList();
            }
            if (c == ')') {
                throw error("unbalanced `)`");
            }
            if (c == '"') {
                return readString();
            }
            return readAtom();
        }

        Expr readList() {
            int start = pos;
            pos++; // (
            List<Expr> items = new ArrayList<>();
            while (true) {
                skipBlanks();
                if (atEnd()) {
                    pos = start;
                    throw error("unclosed `(`");
                }
                if (text.charAt(pos) == ')') {
                    pos++;
                    break;
                }
                items.add(readExpr());
            }
            if (items.isEmpty()) {
                pos = start;
                throw error("empty expression `()`");
            }
            if (items.get(items.size() - 1) instanceof Expr.Keyword k) {
                throw error("keyword `#:" + k.name() + "` has no value");
            }
            return new Expr.ListExpr(items);
        }

        Expr readString() {
            int start = pos;
            pos++; // opening quote
            StringBuilder sb = new StringBuilder();
            while (!atEnd()) {
                char c = text.charAt(pos++);
                if (c == '"') {
                    return new Expr.Str(sb.toString());
                }
                if (c == '\\') {
                    if (atEnd()) {
                        break;
                    }
                    char escaped = text.charAt(pos++);
                    switch (escaped) {
                        case 'n' -> sb.append('\n');
                        case 't' -> sb.append('\t');
                        default -> sb.append(escaped);
                    }
                    continue;
                }
                sb.append(c);
            }
            pos = start;
            throw error("unterminated string");
        }

        Expr readAtom() {
            int start = pos;
            while (!atEnd()) {
                char c = text.charAt(pos);
                if (Character.isWhitespace(c) || c == '(' || c == ')' || c == '"' || c == ';') {
                    break;
                }
                pos++;
            }
            String token = text.substring(start, pos);
            if (token.startsWith("#:")) {
                if (token.length() == 2) {
                    pos = start;
                    throw error("keyword without a name");
                }
                return new Expr.Keyword(token.substring(2));
            }
            switch (token) {
                case "#t":
                case "true":
                    return new Expr.Bool(true);
                case "#f":
                case "false":
                    return new Expr.Bool(false);
                case "nil":
                    return Expr.Nil.INSTANCE;
                default:
                    break;
            }
            if (token.startsWith("#")) {
                pos = start;
                throw error("unknown literal `" + token + "`");
            }
            Expr number = readNumber(token);
            return number != null ? number : new Expr.Symbol(token);
        }

        private static Expr readNumber(String token) {
            if (!looksNumeric(token)) {
                return null;
            }
            try {
                if (token.indexOf('.') < 0 && token.indexOf('e') < 0 && token.indexOf('E') < 0) {
                    return new Expr.Int(Long.parseLong(token));
                }
                return new Expr.Flo(Double.parseDouble(token));
            } catch (NumberFormatException e) {
                return null;
            }
        }

        private static boolean looksNumeric(String token) {
            int i = 0;
            if (token.startsWith("-") || token.startsWith("+")) {
                i = 1;
            }
            if (i >= token.length()) {
                return false;
            }
            char c = token.charAt(i);
            return Character.isDigit(c) || (c == '.' && i + 1 < token.length() && Character.isDigit(token.charAt(i + 1)));
        }
    }
}
