package io.pactkit.core.generators;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.pactkit.core.model.JsonValues;
import java.math.BigDecimal;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Produces example values when a pact is replayed: random numbers and strings, dates relative to
 * now, values taken from provider state, the mock server's own URL.
 *
 * <p>{@link #generate} may throw when its inputs cannot be resolved; callers go through
 * {@link GeneratorEngine}, which falls back to the example value.
 *
 * <p>Thread-safe and immutable.
 */
public sealed interface Generator {

    /** The {@code type} name used in pact JSON. */
    String type();

    /** Produces a value. {@code example} is the value already present in the document. */
    JsonNode generate(JsonNode example, GenerationContext context);

    /** JSON form, e.g. {@code {"type":"RandomInt","min":0,"max":10}}. */
    ObjectNode toJson();

    private static ObjectNode base(String type) {
        ObjectNode node = JsonValues.MAPPER.createObjectNode();
        node.put("type", type);
        return node;
    }

    record RandomInt(int min, int max) implements Generator {
        public RandomInt {
            if (max < min) {
                throw new IllegalArgumentException("max must not be less than min: " + min + ".." + max);
            }
        }

        @Override
        public String type() {
            return "RandomInt";
        }

        @Override
        public JsonNode generate(JsonNode example, GenerationContext context) {
            long span = (long) max - (long) min + 1;
            return number(min + (long) (context.random().nextDouble() * span));
        }

        @Override
        public ObjectNode toJson() {
            return base(type()).put("min", min).put("max", max);
        }
    }

    record RandomDecimal(int digits) implements Generator {
        public RandomDecimal {
            if (digits < 1) {
                throw new IllegalArgumentException("digits must be positive, got: " + digits);
            }
        }

        @Override
        public String type() {
            return "RandomDecimal";
        }

        @Override
        public JsonNode generate(JsonNode example, GenerationContext context) {
            StringBuilder sb = new StringBuilder();
            sb.append(1 + context.random().nextInt(9));
            for (int i = 1; i < digits; i++) {
                sb.append(context.random().nextInt(10));
            }
            if (digits == 1) {
                return DecimalNode.valueOf(new BigDecimal(sb + ".0"));
            }
            int point = 1 + context.random().nextInt(digits - 1);
            sb.insert(point, '.');
            return DecimalNode.valueOf(new BigDecimal(sb.toString()));
        }

        @Override
        public ObjectNode toJson() {
            return base(type()).put("digits", digits);
        }
    }

    record RandomHexadecimal(int digits) implements Generator {
        @Override
        public String type() {
            return "RandomHexadecimal";
        }

        @Override
        public JsonNode generate(JsonNode example, GenerationContext context) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < digits; i++) {
                sb.append(Character.forDigit(context.random().nextInt(16), 16));
            }
            return TextNode.valueOf(sb.toString().toUpperCase(Locale.ROOT));
        }

        @Override
        public ObjectNode toJson() {
            return base(type()).put("digits", digits);
        }
    }

    record RandomString(int size) implements Generator {
        private static final String ALPHANUMERIC =
                "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

        @Override
        public String type() {
            return "RandomString";
        }

        @Override
        public JsonNode generate(JsonNode example, GenerationContext context) {
            StringBuilder sb = new StringBuilder(size);
            for (int i = 0; i < size; i++) {
                sb.append(ALPHANUMERIC.charAt(context.random().nextInt(ALPHANUMERIC.length())));
            }
            return TextNode.valueOf(sb.toString());
        }

        @Override
        public ObjectNode toJson() {
            return base(type()).put("size", size);
        }
    }

    record Regex(String regex) implements Generator {
        public Regex {
            Objects.requireNonNull(regex, "regex must not be null");
        }

        @Override
        public String type() {
            return "Regex";
        }

        @Override
        public JsonNode generate(JsonNode example, GenerationContext context) {
            return TextNode.valueOf(RegexValueGenerator.generate(regex, context.random()));
        }

        @Override
        public ObjectNode toJson() {
            return base(type()).put("regex", regex);
        }
    }

    /** Output formats of {@link Uuid}. */
    enum UuidFormat {
        SIMPLE("simple"),
        LOWER_CASE_HYPHENATED("lower-case-hyphenated"),
        UPPER_CASE_HYPHENATED("upper-case-hyphenated"),
        URN("URN");

        private final String label;

        UuidFormat(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }

        public static UuidFormat parse(String value) {
            if (value == null) {
                return LOWER_CASE_HYPHENATED;
            }
            for (UuidFormat format : values()) {
                if (format.label.equalsIgnoreCase(value)) {
                    return format;
                }
            }
            throw new IllegalArgumentException("Unknown UUID format: " + value);
        }
    }

    record Uuid(UuidFormat format) implements Generator {
        public Uuid {
            format = format == null ? UuidFormat.LOWER_CASE_HYPHENATED : format;
        }

        @Override
        public String type() {
            return "Uuid";
        }

        @Override
        public JsonNode generate(JsonNode example, GenerationContext context) {
            UUID uuid = new UUID(context.random().nextLong(), context.random().nextLong());
            String text = uuid.toString();
            return TextNode.valueOf(
                    switch (format) {
                        case SIMPLE -> text.replace("-", "");
                        case LOWER_CASE_HYPHENATED -> text;
                        case UPPER_CASE_HYPHENATED -> text.toUpperCase(Locale.ROOT);
                        case URN -> "urn:uuid:" + text;
                    });
        }

        @Override
        public ObjectNode toJson() {
            ObjectNode node = base(type());
            if (format != UuidFormat.LOWER_CASE_HYPHENATED) {
                node.put("format", format.label());
            }
            return node;
        }
    }

    record Date(String format, String expression) implements Generator {
        @Override
        public String type() {
            return "Date";
        }

        @Override
        public JsonNode generate(JsonNode example, GenerationContext context) {
            return TextNode.valueOf(DateExpressions.render(DateExpressions.Kind.DATE, format, expression));
        }

        @Override
        public ObjectNode toJson() {
            return withFormat(base(type()), format, expression);
        }
    }

    record Time(String format, String expression) implements Generator {
        @Override
        public String type() {
            return "Time";
        }

        @Override
        public JsonNode generate(JsonNode example, GenerationContext context) {
            return TextNode.valueOf(DateExpressions.render(DateExpressions.Kind.TIME, format, expression));
        }

        @Override
        public ObjectNode toJson() {
            return withFormat(base(type()), format, expression);
        }
    }

    record DateTime(String format, String expression) implements Generator {
        @Override
        public String type() {
            return "DateTime";
        }

        @Override
        public JsonNode generate(JsonNode example, GenerationContext context) {
            return TextNode.valueOf(DateExpressions.render(DateExpressions.Kind.DATE_TIME, format, expression));
        }

        @Override
        public ObjectNode toJson() {
            return withFormat(base(type()), format, expression);
        }
    }

    private static ObjectNode withFormat(ObjectNode node, String format, String expression) {
        if (format != null) {
            node.put("format", format);
        }
        if (expression != null) {
            node.put("expression", expression);
        }
        return node;
    }

    record RandomBoolean() implements Generator {
        @Override
        public String type() {
            return "RandomBoolean";
        }

        @Override
        public JsonNode generate(JsonNode example, GenerationContext context) {
            return BooleanNode.valueOf(context.random().nextBoolean());
        }

        @Override
        public ObjectNode toJson() {
            return base(type());
        }
    }

    /** Target type of a {@link ProviderState} generator's result. */
    enum DataType {
        STRING,
        INTEGER,
        DECIMAL,
        FLOAT,
        BOOLEAN,
        RAW;

        public static DataType parse(String value) {
            return value == null ? RAW : DataType.valueOf(value.toUpperCase(Locale.ROOT));
        }
    }

    /**
     * Value taken from provider-state parameters through a {@code ${name}} expression.
     *
     * @param expression e.g. {@code ${id}} or {@code /widgets/${id}}
     * @param dataType   type to convert the result to
     */
    record ProviderState(String expression, DataType dataType) implements Generator {
        public ProviderState {
            Objects.requireNonNull(expression, "expression must not be null");
            dataType = dataType == null ? DataType.RAW : dataType;
        }

        @Override
        public String type() {
            return "ProviderState";
        }

        @Override
        public JsonNode generate(JsonNode example, GenerationContext context) {
            JsonNode value = ProviderStateExpressions.evaluate(expression, context.providerStateParams());
            return switch (dataType) {
                case STRING -> TextNode.valueOf(JsonValues.asString(value));
                case INTEGER -> LongNode.valueOf(Long.parseLong(JsonValues.asString(value).trim()));
                case DECIMAL, FLOAT -> DecimalNode.valueOf(new BigDecimal(JsonValues.asString(value).trim()));
                case BOOLEAN -> BooleanNode.valueOf(Boolean.parseBoolean(JsonValues.asString(value).trim()));
                case RAW -> value;
            };
        }

        @Override
        public ObjectNode toJson() {
            ObjectNode node = base(type()).put("expression", expression);
            if (dataType != DataType.RAW) {
                node.put("dataType", dataType.name());
            }
            return node;
        }
    }

    /**
     * Rewrites a URL so that it points at the running mock server.
     *
     * @param example URL recorded in the pact
     * @param regex   pattern whose first group is the part of the URL to keep
     */
    record MockServerUrl(String example, String regex) implements Generator {
        public MockServerUrl {
            Objects.requireNonNull(example, "example must not be null");
            Objects.requireNonNull(regex, "regex must not be null");
        }

        @Override
        public String type() {
            return "MockServerURL";
        }

        @Override
        public JsonNode generate(JsonNode example, GenerationContext context) {
            if (context.mockServerUrl() == null) {
                throw new IllegalStateException("No mock server URL in the generation context");
            }
            Matcher m = Pattern.compile(regex).matcher(this.example);
            if (!m.find() || m.groupCount() < 1) {
                throw new IllegalArgumentException(
                        "Regex '" + regex + "' does not capture a path in '" + this.example + "'");
            }
            String base = context.mockServerUrl().endsWith("/")
                    ? context.mockServerUrl().substring(0, context.mockServerUrl().length() - 1)
                    : context.mockServerUrl();
            return TextNode.valueOf(base + m.group(1));
        }

        @Override
        public ObjectNode toJson() {
            return base(type()).put("example", example).put("regex", regex);
        }
    }

    private static JsonNode number(long value) {
        return value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE ? IntNode.valueOf((int) value) : LongNode.valueOf(value);
    }
}
