package io.pactkit.core.generators;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.regex.Pattern;

/**
 * Generates a string matching a regular expression.
 *
 * <p>Covers literals, escapes ({@code \d \w \s} and their negations), character classes with
 * ranges and negation, groups, alternation and the usual quantifiers. Anchors and word boundaries
 * produce nothing. Look-around and back-references are rejected. Every generated value is checked
 * against the pattern before it is returned.
 */
public final class RegexValueGenerator {

    /** Extra repetitions allowed for unbounded quantifiers. */
    private static final int UNBOUNDED_EXTRA = 5;

    private static final String DIGITS = "0123456789";
    private static final String WORD = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789_";
    private static final String PRINTABLE;

    static {
        StringBuilder sb = new StringBuilder();
        for (char c = 33; c < 127; c++) {
            sb.append(c);
        }
        PRINTABLE = sb.toString();
    }

    private sealed interface Node {}

    private record Choice(String chars) implements Node {}

    private record Sequence(List<Node> items) implements Node {}

    private record Alternation(List<Node> options) implements Node {}

    private record Repeat(Node node, int min, int max) implements Node {}

    private RegexValueGenerator() {}

    /**
     * Generates a value for {@code regex}.
     *
     * @throws IllegalArgumentException if the regex uses unsupported constructs or the result does
     *                                  not match
     */
    public static String generate(String regex, Random random) {
        Pattern compiled = Pattern.compile(regex);
        Parser parser = new Parser(regex);
        Node root = parser.parseAlternation();
        if (parser.pos < regex.length()) {
            throw new IllegalArgumentException("Unbalanced ')' at offset " + parser.pos + " in '" + regex + "'");
        }
        StringBuilder out = new StringBuilder();
        emit(root, random, out);
        String value = out.toString();
        if (!compiled.matcher(value).matches()) {
            throw new IllegalArgumentException("Could not generate a value matching '" + regex + "'");
        }
        return value;
    }

    private static void emit(Node node, Random random, StringBuilder out) {
        if (node instanceof Choice c) {
            if (!c.chars().isEmpty()) {
                out.append(c.chars().charAt(random.nextInt(c.chars().length())));
            }
        } else if (node instanceof Sequence s) {
            for (Node item : s.items()) {
                emit(item, random, out);
            }
        } else if (node instanceof Alternation a) {
            emit(a.options().get(random.nextInt(a.options().size())), random, out);
        } else if (node instanceof Repeat r) {
            int count = r.min() + (r.max() > r.min() ? random.nextInt(r.max() - r.min() + 1) : 0);
            for (int i = 0; i < count; i++) {
                emit(r.node(), random, out);
            }
        }
    }

    private static final class Parser {
        private final String src;
        private int pos;

        Parser(String src) {
            this.src = src;
        }

        Node parseAlternation() {
            List<Node> options = new ArrayList<>();
            options.add(parseSequence());
            while (pos < src.length() && src.charAt(pos) == '|') {
                pos++;
                options.add(parseSequence());
            }
            return options.size() == 1 ? options.get(0) : new Alternation(options);
        }

        private Node parseSequence() {
            List<Node> items = new ArrayList<>();
            while (pos < src.length() && src.charAt(pos) != '|' && src.charAt(pos) != ')') {
                Node atom = parseAtom();
                items.add(parseQuantifier(atom));
            }
            return new Sequence(items);
        }

        private Node parseAtom() {
            char c = src.charAt(pos++);
            switch (c) {
                case '(' -> {
                    if (pos < src.length() && src.charAt(pos) == '?') {
                        if (pos + 1 < src.length() && src.charAt(pos + 1) == ':') {
                            pos += 2;
                        } else {
                            throw unsupported("look-around or inline flags");
                        }
                    }
                    Node inner = parseAlternation();
                    expect(')');
                    return inner;
                }
                case '[' -> {
                    return parseClass();
                }
                case '.' -> {
                    return new Choice(WORD);
                }
                case '^', '$' -> {
                    return new Sequence(List.of());
                }
                case '\\' -> {
                    return parseEscape(false);
                }
                default -> {
                    return new Choice(String.valueOf(c));
                }
            }
        }

        private Node parseEscape(boolean inClass) {
            if (pos >= src.length()) {
                throw unsupported("trailing backslash");
            }
            char e = src.charAt(pos++);
            return switch (e) {
                case 'd' -> new Choice(DIGITS);
                case 'D' -> new Choice("abcxyzABCXYZ");
                case 'w' -> new Choice(WORD);
                case 'W' -> new Choice("-!@#%&");
                case 's' -> new Choice(" ");
                case 'S' -> new Choice("abcxyz");
                case 'n' -> new Choice("\n");
                case 't' -> new Choice("\t");
                case 'r' -> new Choice("\r");
                case 'b', 'B', 'A', 'z', 'Z' -> {
                    if (inClass) {
                        throw unsupported("boundary inside a character class");
                    }
                    yield new Sequence(List.of());
                }
                default -> {
                    if (Character.isDigit(e) || e == 'k' || e == 'p' || e == 'P' || e == 'u' || e == 'x') {
                        throw unsupported("escape \\" + e);
                    }
                    yield new Choice(String.valueOf(e));
                }
            };
        }

        private Node parseClass() {
            boolean negated = pos < src.length() && src.charAt(pos) == '^';
            if (negated) {
                pos++;
            }
            StringBuilder set = new StringBuilder();
            boolean first = true;
            while (pos < src.length() && (src.charAt(pos) != ']' || first)) {
                first = false;
                char c = src.charAt(pos++);
                if (c == '[') {
                    throw unsupported("nested character class");
                }
                if (c == '\\') {
                    Node escaped = parseEscape(true);
                    set.append(((Choice) escaped).chars());
                    continue;
                }
                if (pos + 1 < src.length() && src.charAt(pos) == '-' && src.charAt(pos + 1) != ']') {
                    char end = src.charAt(pos + 1);
                    if (end == '\\') {
                        throw unsupported("escaped range bound");
                    }
                    pos += 2;
                    if (end < c) {
                        throw new IllegalArgumentException("Invalid range " + c + "-" + end + " in '" + src + "'");
                    }
                    for (char x = c; x <= end; x++) {
                        set.append(x);
                    }
                } else {
                    set.append(c);
                }
            }
            expect(']');
            if (!negated) {
                return new Choice(set.toString());
            }
            StringBuilder complement = new StringBuilder();
            for (char c : PRINTABLE.toCharArray()) {
                if (set.indexOf(String.valueOf(c)) < 0) {
                    complement.append(c);
                }
            }
            return new Choice(complement.toString());
        }

        private Node parseQuantifier(Node atom) {
            if (pos >= src.length()) {
                return atom;
            }
            char c = src.charAt(pos);
            Node result;
            switch (c) {
                case '*' -> {
                    pos++;
                    result = new Repeat(atom, 0, UNBOUNDED_EXTRA);
                }
                case '+' -> {
                    pos++;
                    result = new Repeat(atom, 1, 1 + UNBOUNDED_EXTRA);
                }
                case '?' -> {
                    pos++;
                    result = new Repeat(atom, 0, 1);
                }
                case '{' -> {
                    int close = src.indexOf('}', pos);
                    if (close < 0) {
                        return atom;
                    }
                    String body = src.substring(pos + 1, close);
                    pos = close + 1;
                    int comma = body.indexOf(',');
                    int min;
                    int max;
                    if (comma < 0) {
                        min = Integer.parseInt(body.trim());
                        max = min;
                    } else {
                        min = Integer.parseInt(body.substring(0, comma).trim());
                        String upper = body.substring(comma + 1).trim();
                        max = upper.isEmpty() ? min + UNBOUNDED_EXTRA : Integer.parseInt(upper);
                    }
                    result = new Repeat(atom, min, max);
                }
                default -> {
                    return atom;
                }
            }
            // lazy and possessive modifiers do not change what can be generated
            if (pos < src.length() && (src.charAt(pos) == '?' || src.charAt(pos) == '+')) {
                pos++;
            }
            return result;
        }

        private void expect(char c) {
            if (pos >= src.length() || src.charAt(pos) != c) {
                throw new IllegalArgumentException("Expected '" + c + "' at offset " + pos + " in '" + src + "'");
            }
            pos++;
        }

        private IllegalArgumentException unsupported(String what) {
            return new IllegalArgumentException("Unsupported regex construct (" + what + ") in '" + src + "'");
        }
    }
}
