package io.pactkit.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A path into a JSON document, either concrete ({@code $.items[2].id}) or a rule expression with
 * wildcards ({@code $.items[*].id}, {@code $.*}).
 *
 * <p>Supported syntax: {@code $} root, {@code .name} and {@code ['name']} fields, {@code [n]}
 * indexes, {@code [*]} any index and {@code .*} any field.
 *
 * <p>Thread-safe and immutable.
 */
public final class DocPath {

    /** One segment of a path. */
    public sealed interface Token {
        record Root() implements Token {}

        record Field(String name) implements Token {}

        record Index(int index) implements Token {}

        /** {@code [*]} */
        record AnyIndex() implements Token {}

        /** {@code .*} */
        record AnyField() implements Token {}
    }

    private static final DocPath ROOT = new DocPath(List.of(new Token.Root()));

    private final List<Token> tokens;

    private DocPath(List<Token> tokens) {
        this.tokens = tokens;
    }

    /** The root path {@code $}. */
    public static DocPath root() {
        return ROOT;
    }

    /**
     * Parses a path expression.
     *
     * @throws IllegalArgumentException if the expression is malformed
     */
    public static DocPath parse(String expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        String expr = expression.trim();
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        if (expr.startsWith("$")) {
            i = 1;
        }
        tokens.add(new Token.Root());
        while (i < expr.length()) {
            char c = expr.charAt(i);
            if (c == '.') {
                int start = ++i;
                if (i < expr.length() && expr.charAt(i) == '*') {
                    tokens.add(new Token.AnyField());
                    i++;
                    continue;
                }
                while (i < expr.length() && expr.charAt(i) != '.' && expr.charAt(i) != '[') {
                    i++;
                }
                if (start == i) {
                    throw new IllegalArgumentException("Empty field name at offset " + start + " in '" + expression + "'");
                }
                tokens.add(new Token.Field(expr.substring(start, i)));
            } else if (c == '[') {
                int close;
                if (i + 1 < expr.length() && expr.charAt(i + 1) == '\'') {
                    close = expr.indexOf("']", i + 2);
                    if (close < 0) {
                        throw new IllegalArgumentException("Unterminated field name at offset " + i + " in '" + expression + "'");
                    }
                    tokens.add(new Token.Field(expr.substring(i + 2, close)));
                    i = close + 2;
                    continue;
                }
                close = expr.indexOf(']', i);
                if (close < 0) {
                    throw new IllegalArgumentException("Unterminated index at offset " + i + " in '" + expression + "'");
                }
                String inner = expr.substring(i + 1, close).trim();
                if ("*".equals(inner)) {
                    tokens.add(new Token.AnyIndex());
                } else {
                    try {
                        tokens.add(new Token.Index(Integer.parseInt(inner)));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException(
                                "Invalid index '" + inner + "' at offset " + i + " in '" + expression + "'", e);
                    }
                }
                i = close + 1;
            } else if (tokens.size() == 1 && i == 0) {
                // bare field name without leading '$.'
                int start = i;
                while (i < expr.length() && expr.charAt(i) != '.' && expr.charAt(i) != '[') {
                    i++;
                }
                tokens.add(new Token.Field(expr.substring(start, i)));
            } else {
                throw new IllegalArgumentException("Unexpected '" + c + "' at offset " + i + " in '" + expression + "'");
            }
        }
        return new DocPath(Collections.unmodifiableList(tokens));
    }

    /** Returns this path extended by a field segment. */
    public DocPath field(String name) {
        return append(new Token.Field(name));
    }

    /** Returns this path extended by an index segment. */
    public DocPath index(int index) {
        return append(new Token.Index(index));
    }

    private DocPath append(Token token) {
        List<Token> next = new ArrayList<>(tokens.size() + 1);
        next.addAll(tokens);
        next.add(token);
        return new DocPath(Collections.unmodifiableList(next));
    }

    public List<Token> tokens() {
        return tokens;
    }

    /** Number of segments, including the root. */
    public int length() {
        return tokens.size();
    }

    /**
     * Weight of this rule path against a concrete path. Zero means no match. The rule path must
     * match a prefix of {@code concrete}; every exact segment scores 2 and every wildcard 1, and
     * the weight is their product, so more specific paths win.
     */
    public int weight(DocPath concrete) {
        if (tokens.size() > concrete.tokens.size()) {
            return 0;
        }
        int weight = 1;
        for (int i = 0; i < tokens.size(); i++) {
            int w = tokenWeight(tokens.get(i), concrete.tokens.get(i));
            if (w == 0) {
                return 0;
            }
            weight *= w;
        }
        return weight;
    }

    /** True if this rule path matches {@code concrete} segment for segment. */
    public boolean matchesExactly(DocPath concrete) {
        return tokens.size() == concrete.tokens.size() && weight(concrete) > 0;
    }

    private static int tokenWeight(Token rule, Token actual) {
        if (rule instanceof Token.Root) {
            return actual instanceof Token.Root ? 2 : 0;
        }
        if (rule instanceof Token.Field f) {
            return actual instanceof Token.Field a && a.name().equals(f.name()) ? 2 : 0;
        }
        if (rule instanceof Token.Index idx) {
            return actual instanceof Token.Index a && a.index() == idx.index() ? 2 : 0;
        }
        if (rule instanceof Token.AnyIndex) {
            return actual instanceof Token.Index ? 1 : 0;
        }
        // AnyField matches fields and indexes alike
        return actual instanceof Token.Root ? 0 : 1;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Token token : tokens) {
            if (token instanceof Token.Root) {
                sb.append('$');
            } else if (token instanceof Token.Field f) {
                if (isIdentifier(f.name())) {
                    sb.append('.').append(f.name());
                } else {
                    sb.append("['").append(f.name()).append("']");
                }
            } else if (token instanceof Token.Index idx) {
                sb.append('[').append(idx.index()).append(']');
            } else if (token instanceof Token.AnyIndex) {
                sb.append("[*]");
            } else {
                sb.append(".*");
            }
        }
        return sb.toString();
    }

    private static boolean isIdentifier(String name) {
        if (name.isEmpty()) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '_' && c != '-' && c != ':' && c != '$') {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DocPath other && tokens.equals(other.tokens);
    }

    @Override
    public int hashCode() {
        return tokens.hashCode();
    }
}
