package br.edu.ifba.graphsync.codec;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Rewrites {@code INSERT ... VALUES} statements into {@code INSERT ... SELECT} form so that
 * semi-structured parameters can be wrapped in the column's parse function.
 *
 * <p>Semi-structured columns do not accept a parse function call inside a {@code VALUES}
 * list, but they do inside a {@code SELECT}. Given</p>
 *
 * <pre>{@code
 * INSERT INTO entity_records (id, attributes) VALUES (?, ?), (?, ?)
 * }</pre>
 *
 * <p>with the second and fourth parameters bound to {@link SemiStructuredParameter}s, the
 * rewriter produces</p>
 *
 * <pre>{@code
 * INSERT INTO entity_records (id, attributes) SELECT ?, PARSE_JSON(?) UNION ALL SELECT ?, PARSE_JSON(?)
 * }</pre>
 *
 * <p>Placeholder order is preserved. Statements that are not inserts, carry no
 * semi-structured parameter, or cannot be split reliably are returned unchanged.</p>
 */
public final class InsertSelectRewriter implements WriteStatementInterceptor {

    private static final Logger logger = LoggerFactory.getLogger(InsertSelectRewriter.class);

    private final String parseFunction;

    /**
     * Creates a rewriter for the given parse function.
     *
     * @param parseFunction the function that turns JSON text into a semi-structured value,
     *                      e.g. {@code PARSE_JSON}
     */
    public InsertSelectRewriter(@NotNull String parseFunction) {
        Objects.requireNonNull(parseFunction, "parseFunction must not be null");
        if (parseFunction.isBlank()) {
            throw new IllegalArgumentException("parseFunction must not be blank");
        }
        this.parseFunction = parseFunction;
    }

    @NotNull
    public String getParseFunction() {
        return parseFunction;
    }

    @Override
    @NotNull
    public String beforeExecute(@NotNull String sql, @NotNull List<?> parameters) {
        if (!sql.stripLeading().toUpperCase(Locale.ROOT).startsWith("INSERT")) {
            return sql;
        }
        int valuesAt = findTopLevelKeyword(sql, "VALUES");
        if (valuesAt < 0) {
            return sql;
        }

        List<List<String>> rows = splitRows(sql.substring(valuesAt + "VALUES".length()));
        if (rows == null || rows.isEmpty()) {
            logger.debug("Insert statement could not be split into value tuples, leaving it unchanged");
            return sql;
        }

        String header = sql.substring(0, valuesAt).stripTrailing();
        int ordinal = countPlaceholders(header);
        boolean semiStructured = false;

        List<String> selects = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            List<String> expressions = new ArrayList<>(row.size());
            for (String raw : row) {
                String expression = raw.strip();
                if ("?".equals(expression) && ordinal < parameters.size()
                        && parameters.get(ordinal) instanceof SemiStructuredParameter) {
                    expression = parseFunction + "(?)";
                    semiStructured = true;
                } else if (callsParseFunction(expression)) {
                    semiStructured = true;
                }
                ordinal += countPlaceholders(expression);
                expressions.add(expression);
            }
            selects.add("SELECT " + String.join(", ", expressions));
        }

        if (!semiStructured) {
            return sql;
        }
        return header + " " + String.join(" UNION ALL ", selects);
    }

    private boolean callsParseFunction(String expression) {
        String upper = expression.toUpperCase(Locale.ROOT);
        String fn = parseFunction.toUpperCase(Locale.ROOT);
        int at = upper.indexOf(fn);
        while (at >= 0) {
            int after = at + fn.length();
            while (after < upper.length() && Character.isWhitespace(upper.charAt(after))) {
                after++;
            }
            boolean boundary = at == 0 || !isIdentifierChar(upper.charAt(at - 1));
            if (boundary && after < upper.length() && upper.charAt(after) == '(') {
                return true;
            }
            at = upper.indexOf(fn, at + 1);
        }
        return false;
    }

    /**
     * Returns the offset of a keyword that appears outside quotes and parentheses, or -1.
     */
    static int findTopLevelKeyword(String sql, String keyword) {
        int depth = 0;
        int length = sql.length();
        for (int i = 0; i < length; i++) {
            char c = sql.charAt(i);
            if (c == '\'' || c == '"') {
                i = skipQuoted(sql, i);
                if (i < 0) {
                    return -1;
                }
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (depth == 0 && sql.regionMatches(true, i, keyword, 0, keyword.length())) {
                boolean before = i == 0 || !isIdentifierChar(sql.charAt(i - 1));
                int end = i + keyword.length();
                boolean after = end >= length || !isIdentifierChar(sql.charAt(end));
                if (before && after) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Splits {@code (a, b), (c, d)} into expression lists. Returns null when the text holds
     * anything other than parenthesized tuples separated by commas and an optional trailing
     * semicolon.
     */
    static List<List<String>> splitRows(String tail) {
        List<List<String>> rows = new ArrayList<>();
        int i = skipWhitespace(tail, 0);
        while (i < tail.length()) {
            if (tail.charAt(i) != '(') {
                return null;
            }
            int close = findClosingParen(tail, i);
            if (close < 0) {
                return null;
            }
            rows.add(splitTopLevel(tail.substring(i + 1, close)));
            i = skipWhitespace(tail, close + 1);
            if (i < tail.length() && tail.charAt(i) == ',') {
                i = skipWhitespace(tail, i + 1);
                if (i >= tail.length()) {
                    return null;
                }
            } else if (i < tail.length() && tail.charAt(i) == ';') {
                return skipWhitespace(tail, i + 1) == tail.length() ? rows : null;
            } else if (i < tail.length()) {
                return null;
            }
        }
        return rows;
    }

    private static List<String> splitTopLevel(String inner) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < inner.length(); i++) {
            char c = inner.charAt(i);
            if (c == '\'' || c == '"') {
                i = skipQuoted(inner, i);
                if (i < 0) {
                    break;
                }
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (c == ',' && depth == 0) {
                parts.add(inner.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(inner.substring(start));
        return parts;
    }

    private static int findClosingParen(String text, int open) {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\'' || c == '"') {
                i = skipQuoted(text, i);
                if (i < 0) {
                    return -1;
                }
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Counts {@code ?} placeholders outside string literals and quoted identifiers.
     */
    static int countPlaceholders(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\'' || c == '"') {
                i = skipQuoted(text, i);
                if (i < 0) {
                    break;
                }
            } else if (c == '?') {
                count++;
            }
        }
        return count;
    }

    /**
     * Returns the index of the closing quote for the quote at {@code open}, or -1 if the
     * literal is unterminated. A doubled quote inside the literal is an escape.
     */
    private static int skipQuoted(String text, int open) {
        char quote = text.charAt(open);
        int i = open + 1;
        while (i < text.length()) {
            if (text.charAt(i) == quote) {
                if (i + 1 < text.length() && text.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i;
            }
            i++;
        }
        return -1;
    }

    private static int skipWhitespace(String text, int from) {
        int i = from;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }
}
