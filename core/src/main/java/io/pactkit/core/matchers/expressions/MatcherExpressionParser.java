package io.pactkit.core.matchers.expressions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.pactkit.core.generators.Generator;
import io.pactkit.core.matchers.MatchingRule;
import io.pactkit.core.matchers.MatchingRuleDefinition;
import io.pactkit.core.matchers.ValueType;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parses matcher expressions such as {@code matching(datetime, 'yyyy-MM-dd', '2000-01-01')} into
 * a {@link MatchingRuleDefinition}.
 *
 * <p>Grammar:
 *
 * <pre>
 * expression  := definition ( ',' definition )*
 * definition  := 'matching' '(' rule ')'
 *              | 'notEmpty' '(' primitive ')'
 *              | 'eachKey' '(' definition ')' | 'eachValue' '(' definition ')'
 *              | 'atLeast' '(' INT ')' | 'atMost' '(' INT ')'
 *              | 'fromProviderState' '(' STRING ',' primitive ')'
 * rule        := 'equalTo' ',' primitive | 'type' ',' primitive
 *              | 'number' ',' NUMBER | 'integer' ',' INT | 'decimal' ',' NUMBER | 'boolean' ',' BOOL
 *              | ('datetime' | 'date' | 'time') ',' STRING ',' STRING
 *              | 'regex' ',' STRING ',' STRING | 'include' ',' STRING | 'semver' ',' STRING
 *              | 'contentType' ',' STRING ',' STRING | '$' STRING
 * primitive   := STRING | INT | DECIMAL | BOOL | 'null'
 * </pre>
 *
 * <p>Strings are single-quoted; {@code \'} and {@code \\} are escapes and other backslashes are
 * kept as written. Text that does not start with a definition keyword is a plain string value.
 *
 * <p>Pure and thread-safe: parsing never throws, errors are returned as {@link ParseResult.Failure}.
 */
public final class MatcherExpressionParser {

    private static final Pattern DEFINITION_START = Pattern.compile(
            "^\\s*(matching|notEmpty|eachKey|eachValue|atLeast|atMost|fromProviderState)\\s*\\(.*", Pattern.DOTALL);

    private static final String DEFINITION_KEYWORDS =
            "(matching, notEmpty, eachKey, eachValue, atLeast, atMost, fromProviderState)";

    private final String source;
    private final List<Token> tokens;
    private int position;

    private MatcherExpressionParser(String source, List<Token> tokens) {
        this.source = source;
        this.tokens = tokens;
    }

    /** Parses an expression. */
    public static ParseResult parse(String expression) {
        if (expression == null || expression.isBlank()) {
            return new ParseResult.Failure(
                    new ParseError("Expected a matching rule definition, but got an empty string", "", 0));
        }
        if (!DEFINITION_START.matcher(expression).matches()) {
            return new ParseResult.Success(
                    new MatchingRuleDefinition(TextNode.valueOf(expression), ValueType.STRING, List.of(), null));
        }
        try {
            MatcherExpressionParser parser = new MatcherExpressionParser(expression, tokenize(expression));
            return new ParseResult.Success(parser.expression());
        } catch (SyntaxError e) {
            return new ParseResult.Failure(e.error);
        }
    }

    // ---- lexer ----

    private enum Kind {
        LEFT_BRACKET,
        RIGHT_BRACKET,
        COMMA,
        DOLLAR,
        STRING,
        INT,
        DECIMAL,
        BOOLEAN,
        NULL,
        ID,
        EOF
    }

    /** A token; {@code text} is the unquoted contents for strings. */
    private record Token(Kind kind, String text, String raw, int offset) {}

    private static List<Token> tokenize(String source) throws SyntaxError {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(') {
                tokens.add(new Token(Kind.LEFT_BRACKET, "(", "(", i++));
            } else if (c == ')') {
                tokens.add(new Token(Kind.RIGHT_BRACKET, ")", ")", i++));
            } else if (c == ',') {
                tokens.add(new Token(Kind.COMMA, ",", ",", i++));
            } else if (c == '$') {
                tokens.add(new Token(Kind.DOLLAR, "$", "$", i++));
            } else if (c == '\'') {
                int start = i++;
                StringBuilder sb = new StringBuilder();
                boolean closed = false;
                while (i < source.length()) {
                    char s = source.charAt(i);
                    if (s == '\\' && i + 1 < source.length()
                            && (source.charAt(i + 1) == '\'' || source.charAt(i + 1) == '\\')) {
                        sb.append(source.charAt(i + 1));
                        i += 2;
                    } else if (s == '\'') {
                        closed = true;
                        i++;
                        break;
                    } else {
                        sb.append(s);
                        i++;
                    }
                }
                if (!closed) {
                    throw new SyntaxError("Unterminated string literal", source.substring(start), byteOffset(source, start));
                }
                tokens.add(new Token(Kind.STRING, sb.toString(), source.substring(start, i), start));
            } else if (c == '-' || Character.isDigit(c)) {
                int start = i++;
                while (i < source.length() && Character.isDigit(source.charAt(i))) {
                    i++;
                }
                Kind kind = Kind.INT;
                if (i + 1 < source.length() && source.charAt(i) == '.' && Character.isDigit(source.charAt(i + 1))) {
                    kind = Kind.DECIMAL;
                    i++;
                    while (i < source.length() && Character.isDigit(source.charAt(i))) {
                        i++;
                    }
                }
                if (i < source.length() && (source.charAt(i) == 'e' || source.charAt(i) == 'E')) {
                    int exp = i + 1;
                    if (exp < source.length() && (source.charAt(exp) == '-' || source.charAt(exp) == '+')) {
                        exp++;
                    }
                    if (exp < source.length() && Character.isDigit(source.charAt(exp))) {
                        kind = Kind.DECIMAL;
                        i = exp;
                        while (i < source.length() && Character.isDigit(source.charAt(i))) {
                            i++;
                        }
                    }
                }
                String text = source.substring(start, i);
                if ("-".equals(text)) {
                    throw new SyntaxError("Expected a number", text, byteOffset(source, start));
                }
                tokens.add(new Token(kind, text, text, start));
            } else if (Character.isLetter(c)) {
                int start = i;
                while (i < source.length() && Character.isLetter(source.charAt(i))) {
                    i++;
                }
                String word = source.substring(start, i);
                Kind kind = switch (word) {
                    case "true", "false" -> Kind.BOOLEAN;
                    case "null" -> Kind.NULL;
                    default -> Kind.ID;
                };
                tokens.add(new Token(kind, word, word, start));
            } else {
                throw new SyntaxError("Unexpected character", String.valueOf(c), byteOffset(source, i));
            }
        }
        tokens.add(new Token(Kind.EOF, "", "", source.length()));
        return tokens;
    }

    private static int byteOffset(String source, int charIndex) {
        return source.substring(0, charIndex).getBytes(StandardCharsets.UTF_8).length;
    }

    // ---- parser ----

    private MatchingRuleDefinition expression() throws SyntaxError {
        MatchingRuleDefinition result = definition();
        while (peek().kind() == Kind.COMMA) {
            Token comma = next();
            result = merge(result, definition(), comma);
        }
        Token end = next();
        if (end.kind() != Kind.EOF) {
            throw error("Expected a comma or the end of the expression", end);
        }
        return result;
    }

    private MatchingRuleDefinition definition() throws SyntaxError {
        Token keyword = next();
        if (keyword.kind() != Kind.ID) {
            throw error("Expected a type of matching rule definition " + DEFINITION_KEYWORDS, keyword);
        }
        switch (keyword.text()) {
            case "matching" -> {
                expect(Kind.LEFT_BRACKET, "'('");
                MatchingRuleDefinition rule = matchingRule();
                expect(Kind.RIGHT_BRACKET, "')'");
                return rule;
            }
            case "notEmpty" -> {
                expect(Kind.LEFT_BRACKET, "'('");
                Primitive value = primitive();
                expect(Kind.RIGHT_BRACKET, "')'");
                return new MatchingRuleDefinition(value.node(), value.type(), List.of(new MatchingRule.NotEmpty()), null);
            }
            case "eachKey", "eachValue" -> {
                expect(Kind.LEFT_BRACKET, "'('");
                MatchingRuleDefinition inner = definition();
                expect(Kind.RIGHT_BRACKET, "')'");
                MatchingRule rule = "eachKey".equals(keyword.text())
                        ? new MatchingRule.EachKey(inner)
                        : new MatchingRule.EachValue(inner);
                return new MatchingRuleDefinition(TextNode.valueOf(""), ValueType.UNKNOWN, List.of(rule), null);
            }
            case "atLeast", "atMost" -> {
                expect(Kind.LEFT_BRACKET, "'('");
                Token n = expect(Kind.INT, "an integer");
                expect(Kind.RIGHT_BRACKET, "')'");
                int bound = boundedInt(n);
                MatchingRule rule = "atLeast".equals(keyword.text())
                        ? new MatchingRule.MinType(bound)
                        : new MatchingRule.MaxType(bound);
                return new MatchingRuleDefinition(TextNode.valueOf(""), ValueType.UNKNOWN, List.of(rule), null);
            }
            case "fromProviderState" -> {
                expect(Kind.LEFT_BRACKET, "'('");
                Token expr = expect(Kind.STRING, "a provider state expression string");
                expect(Kind.COMMA, "','");
                Primitive value = primitive();
                expect(Kind.RIGHT_BRACKET, "')'");
                Generator generator = new Generator.ProviderState(expr.text(), dataType(value.type()));
                return new MatchingRuleDefinition(value.node(), value.type(), List.of(), generator);
            }
            default -> throw error("Expected a type of matching rule definition " + DEFINITION_KEYWORDS, keyword);
        }
    }

    private MatchingRuleDefinition matchingRule() throws SyntaxError {
        Token type = next();
        if (type.kind() == Kind.DOLLAR) {
            Token name = expect(Kind.STRING, "a reference name string");
            return new MatchingRuleDefinition(
                    TextNode.valueOf(""), ValueType.UNKNOWN, List.of(new MatchingRule.Reference(name.text())), null);
        }
        if (type.kind() != Kind.ID) {
            throw error("Expected the type of matcher", type);
        }
        switch (type.text()) {
            case "equalTo" -> {
                return primitiveRule(new MatchingRule.Equality());
            }
            case "type" -> {
                return primitiveRule(new MatchingRule.Type());
            }
            case "number" -> {
                expect(Kind.COMMA, "','");
                Token n = number(true);
                return define(numberNode(n), ValueType.NUMBER, new MatchingRule.NumberType(), null);
            }
            case "integer" -> {
                expect(Kind.COMMA, "','");
                Token n = expect(Kind.INT, "an integer");
                return define(numberNode(n), ValueType.INTEGER, new MatchingRule.IntegerType(), null);
            }
            case "decimal" -> {
                expect(Kind.COMMA, "','");
                Token n = number(true);
                return define(numberNode(n), ValueType.DECIMAL, new MatchingRule.DecimalType(), null);
            }
            case "boolean" -> {
                expect(Kind.COMMA, "','");
                Token b = expect(Kind.BOOLEAN, "a boolean");
                return define(BooleanNode.valueOf(Boolean.parseBoolean(b.text())), ValueType.BOOLEAN,
                        new MatchingRule.BooleanType(), null);
            }
            case "datetime", "timestamp", "date", "time" -> {
                expect(Kind.COMMA, "','");
                String format = expect(Kind.STRING, "a format string").text();
                expect(Kind.COMMA, "','");
                String value = expect(Kind.STRING, "a string value").text();
                MatchingRule rule;
                Generator generator;
                if ("date".equals(type.text())) {
                    rule = new MatchingRule.Date(format);
                    generator = new Generator.Date(format, null);
                } else if ("time".equals(type.text())) {
                    rule = new MatchingRule.Time(format);
                    generator = new Generator.Time(format, null);
                } else {
                    rule = new MatchingRule.Timestamp(format);
                    generator = new Generator.DateTime(format, null);
                }
                return define(TextNode.valueOf(value), ValueType.STRING, rule, generator);
            }
            case "regex" -> {
                expect(Kind.COMMA, "','");
                String regex = expect(Kind.STRING, "a regex string").text();
                expect(Kind.COMMA, "','");
                String value = expect(Kind.STRING, "a string value").text();
                return define(TextNode.valueOf(value), ValueType.STRING, new MatchingRule.Regex(regex), null);
            }
            case "include" -> {
                expect(Kind.COMMA, "','");
                String value = expect(Kind.STRING, "a string value").text();
                return define(TextNode.valueOf(value), ValueType.STRING, new MatchingRule.Include(value), null);
            }
            case "semver" -> {
                expect(Kind.COMMA, "','");
                String value = expect(Kind.STRING, "a string value").text();
                return define(TextNode.valueOf(value), ValueType.STRING, new MatchingRule.Semver(), null);
            }
            case "contentType" -> {
                expect(Kind.COMMA, "','");
                String contentType = expect(Kind.STRING, "a content type string").text();
                expect(Kind.COMMA, "','");
                String value = expect(Kind.STRING, "a string value").text();
                return define(TextNode.valueOf(value), ValueType.UNKNOWN, new MatchingRule.ContentType(contentType), null);
            }
            default -> throw error("Expected the type of matcher", type);
        }
    }

    private MatchingRuleDefinition primitiveRule(MatchingRule rule) throws SyntaxError {
        expect(Kind.COMMA, "','");
        Primitive value = primitive();
        return define(value.node(), value.type(), rule, null);
    }

    private static MatchingRuleDefinition define(JsonNode value, ValueType type, MatchingRule rule, Generator generator) {
        return new MatchingRuleDefinition(value, type, List.of(rule), generator);
    }

    private record Primitive(JsonNode node, ValueType type) {}

    private Primitive primitive() throws SyntaxError {
        Token token = next();
        return switch (token.kind()) {
            case STRING -> new Primitive(TextNode.valueOf(token.text()), ValueType.STRING);
            case NULL -> new Primitive(NullNode.getInstance(), ValueType.STRING);
            case INT -> new Primitive(numberNode(token), ValueType.INTEGER);
            case DECIMAL -> new Primitive(numberNode(token), ValueType.DECIMAL);
            case BOOLEAN -> new Primitive(BooleanNode.valueOf(Boolean.parseBoolean(token.text())), ValueType.BOOLEAN);
            default -> throw error("Expected a primitive value", token);
        };
    }

    private Token number(boolean allowDecimal) throws SyntaxError {
        Token token = next();
        if (token.kind() == Kind.INT || allowDecimal && token.kind() == Kind.DECIMAL) {
            return token;
        }
        throw error("Expected a number", token);
    }

    private static JsonNode numberNode(Token token) {
        if (token.kind() == Kind.DECIMAL) {
            return DecimalNode.valueOf(new BigDecimal(token.text()));
        }
        BigInteger value = new BigInteger(token.text());
        if (value.bitLength() < 32) {
            return JsonNodeFactory.instance.numberNode(value.intValue());
        }
        if (value.bitLength() < 64) {
            return JsonNodeFactory.instance.numberNode(value.longValue());
        }
        return JsonNodeFactory.instance.numberNode(value);
    }

    private int boundedInt(Token token) throws SyntaxError {
        try {
            int value = Integer.parseInt(token.text());
            if (value >= 0) {
                return value;
            }
        } catch (NumberFormatException e) {
            throw error("Expected a non-negative integer within range", token);
        }
        throw error("Expected a non-negative integer", token);
    }

    private static Generator.DataType dataType(ValueType type) {
        return switch (type) {
            case INTEGER -> Generator.DataType.INTEGER;
            case DECIMAL, NUMBER -> Generator.DataType.DECIMAL;
            case BOOLEAN -> Generator.DataType.BOOLEAN;
            case STRING -> Generator.DataType.STRING;
            case UNKNOWN -> Generator.DataType.RAW;
        };
    }

    /**
     * Combines two definitions of the same value: rules are concatenated and the first non-empty
     * example wins. Two generators cannot be combined.
     */
    private MatchingRuleDefinition merge(MatchingRuleDefinition first, MatchingRuleDefinition second, Token comma)
            throws SyntaxError {
        if (first.generator() != null && second.generator() != null) {
            throw error("Conflicting generators: only one generator-bearing rule may apply to a value", comma);
        }
        List<MatchingRule> rules = new ArrayList<>(first.rules());
        rules.addAll(second.rules());
        JsonNode value = isEmptyExample(first.value()) ? second.value() : first.value();
        Generator generator = first.generator() != null ? first.generator() : second.generator();
        return new MatchingRuleDefinition(value, first.valueType().merge(second.valueType()), rules, generator);
    }

    static boolean isEmptyExample(JsonNode value) {
        return value.isNull() || value.isTextual() && value.textValue().isEmpty();
    }

    // ---- token cursor ----

    private Token peek() {
        return tokens.get(position);
    }

    private Token next() {
        Token token = tokens.get(position);
        if (token.kind() != Kind.EOF) {
            position++;
        }
        return token;
    }

    private Token expect(Kind kind, String description) throws SyntaxError {
        Token token = next();
        if (token.kind() != kind) {
            throw error("Expected " + description, token);
        }
        return token;
    }

    private SyntaxError error(String message, Token token) {
        return new SyntaxError(message, token.raw(), byteOffset(source, token.offset()));
    }

    /** Internal unwinding signal; converted to a {@link ParseResult.Failure} at the entry point. */
    private static final class SyntaxError extends Exception {

        private static final long serialVersionUID = 1L;

        private final transient ParseError error;

        SyntaxError(String message, String token, int offset) {
            super(message, null, false, false);
            this.error = new ParseError(message, token, offset);
        }
    }
}
