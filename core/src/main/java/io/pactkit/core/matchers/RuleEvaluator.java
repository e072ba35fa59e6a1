package io.pactkit.core.matchers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BinaryNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.pactkit.core.model.ContentTypes;
import io.pactkit.core.model.DocPath;
import io.pactkit.core.model.JsonValues;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies matching rules to values.
 *
 * <p>Every evaluation returns a {@link MatchResult}; nothing here throws for bad input. An
 * invalid regex or date format is reported as a mismatch naming the broken rule.
 *
 * <p>Thread-safe, stateless utility class.
 */
public final class RuleEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(RuleEvaluator.class);

    /** Semantic Versioning 2.0.0. */
    private static final Pattern SEMVER = Pattern.compile(
            "^(0|[1-9]\\d*)\\.(0|[1-9]\\d*)\\.(0|[1-9]\\d*)"
                    + "(?:-((?:0|[1-9]\\d*|\\d*[a-zA-Z-][0-9a-zA-Z-]*)(?:\\.(?:0|[1-9]\\d*|\\d*[a-zA-Z-][0-9a-zA-Z-]*))*))?"
                    + "(?:\\+([0-9a-zA-Z-]+(?:\\.[0-9a-zA-Z-]+)*))?$");

    private RuleEvaluator() {}

    /**
     * Applies one rule.
     *
     * @param rule     the rule
     * @param expected the example value the rule was recorded with
     * @param actual   the value to check
     * @param path     location of the value, used in mismatch reports
     */
    public static MatchResult evaluate(MatchingRule rule, JsonNode expected, JsonNode actual, DocPath path) {
        return MatchResult.of(rule.accept(new Evaluation(expected, actual, path)));
    }

    /**
     * Applies a rule list. With AND logic every rule must match and all failures are reported; with
     * OR logic one match is enough and failures are reported only when every rule fails.
     */
    public static MatchResult evaluate(RuleList rules, JsonNode expected, JsonNode actual, DocPath path) {
        List<Mismatch.BodyMismatch> mismatches = new ArrayList<>();
        for (MatchingRule rule : rules.rules()) {
            List<Mismatch.BodyMismatch> result = rule.accept(new Evaluation(expected, actual, path));
            if (result.isEmpty() && rules.logic() == RuleLogic.OR) {
                return MatchResult.MATCHED;
            }
            mismatches.addAll(result);
        }
        return MatchResult.of(mismatches);
    }

    /** True if {@code value} is a valid semantic version. */
    public static boolean isSemver(String value) {
        return SEMVER.matcher(value).matches();
    }

    /** Visits one rule against one expected/actual pair. */
    private static final class Evaluation implements MatchingRule.Visitor<List<Mismatch.BodyMismatch>> {

        private final JsonNode expected;
        private final JsonNode actual;
        private final DocPath path;

        Evaluation(JsonNode expected, JsonNode actual, DocPath path) {
            this.expected = expected;
            this.actual = actual;
            this.path = path;
        }

        private List<Mismatch.BodyMismatch> fail(String format, Object... args) {
            return List.of(new Mismatch.BodyMismatch(path.toString(), expected, actual, String.format(format, args)));
        }

        private List<Mismatch.BodyMismatch> ok() {
            return List.of();
        }

        private String actualText() {
            return JsonValues.asString(actual);
        }

        @Override
        public List<Mismatch.BodyMismatch> visitEquality(MatchingRule.Equality rule) {
            if (JsonValues.deepEquals(expected, actual)) {
                return ok();
            }
            return fail(
                    "Expected %s (%s) to be equal to %s (%s)",
                    JsonValues.display(actual),
                    JsonValues.typeName(actual),
                    JsonValues.display(expected),
                    JsonValues.typeName(expected));
        }

        @Override
        public List<Mismatch.BodyMismatch> visitRegex(MatchingRule.Regex rule) {
            Pattern pattern;
            try {
                pattern = Pattern.compile(rule.regex());
            } catch (PatternSyntaxException e) {
                LOG.warn("Invalid regex in matching rule at {}: {}", path, e.getDescription());
                return fail("Invalid regex '%s' in matching rule: %s", rule.regex(), e.getDescription());
            }
            if (actual == null || actual.isNull() || actual.isMissingNode() || actual.isContainerNode()) {
                return fail("Expected %s to match '%s'", JsonValues.display(actual), rule.regex());
            }
            if (pattern.matcher(actualText()).matches()) {
                return ok();
            }
            return fail("Expected '%s' to match '%s'", actualText(), rule.regex());
        }

        @Override
        public List<Mismatch.BodyMismatch> visitType(MatchingRule.Type rule) {
            return typeCheck();
        }

        private List<Mismatch.BodyMismatch> typeCheck() {
            if (JsonValues.sameType(expected, actual)) {
                return ok();
            }
            return fail(
                    "Expected %s (%s) to be the same type as %s (%s)",
                    JsonValues.display(actual),
                    JsonValues.typeName(actual),
                    JsonValues.display(expected),
                    JsonValues.typeName(expected));
        }

        private List<Mismatch.BodyMismatch> sizeCheck(int min, int max) {
            List<Mismatch.BodyMismatch> result = new ArrayList<>(typeCheck());
            if (actual != null && actual.isArray()) {
                if (actual.size() < min) {
                    result.add(new Mismatch.BodyMismatch(
                            path.toString(),
                            expected,
                            actual,
                            String.format("Expected %s to have at least %d item(s)", JsonValues.display(actual), min)));
                }
                if (actual.size() > max) {
                    result.add(new Mismatch.BodyMismatch(
                            path.toString(),
                            expected,
                            actual,
                            String.format("Expected %s to have at most %d item(s)", JsonValues.display(actual), max)));
                }
            }
            return result;
        }

        @Override
        public List<Mismatch.BodyMismatch> visitMinType(MatchingRule.MinType rule) {
            return sizeCheck(rule.min(), Integer.MAX_VALUE);
        }

        @Override
        public List<Mismatch.BodyMismatch> visitMaxType(MatchingRule.MaxType rule) {
            return sizeCheck(0, rule.max());
        }

        @Override
        public List<Mismatch.BodyMismatch> visitMinMaxType(MatchingRule.MinMaxType rule) {
            return sizeCheck(rule.min(), rule.max());
        }

        // yyyy is year-of-era, which STRICT resolution only turns into a date when an era is known
        private static DateTimeFormatter strictFormatter(String pattern) {
            return new DateTimeFormatterBuilder()
                    .appendPattern(pattern)
                    .parseDefaulting(ChronoField.ERA, 1)
                    .toFormatter(Locale.ROOT)
                    .withResolverStyle(ResolverStyle.STRICT);
        }

        private List<Mismatch.BodyMismatch> temporal(String kind, String format, String defaultFormat) {
            String pattern = format != null ? format : defaultFormat;
            if (actual == null || !actual.isTextual()) {
                return fail("Expected %s to be a %s string", JsonValues.display(actual), kind);
            }
            try {
                strictFormatter(pattern).parse(actual.textValue());
                return ok();
            } catch (IllegalArgumentException e) {
                return fail("Invalid %s format '%s' in matching rule: %s", kind, pattern, e.getMessage());
            } catch (DateTimeParseException e) {
                return fail("Expected '%s' to match a %s format of '%s': %s", actual.textValue(), kind, pattern, e.getMessage());
            }
        }

        @Override
        public List<Mismatch.BodyMismatch> visitTimestamp(MatchingRule.Timestamp rule) {
            return temporal("datetime", rule.format(), "yyyy-MM-dd'T'HH:mm:ss[.SSS][XXX]");
        }

        @Override
        public List<Mismatch.BodyMismatch> visitTime(MatchingRule.Time rule) {
            return temporal("time", rule.format(), "HH:mm[:ss]");
        }

        @Override
        public List<Mismatch.BodyMismatch> visitDate(MatchingRule.Date rule) {
            return temporal("date", rule.format(), "yyyy-MM-dd");
        }

        @Override
        public List<Mismatch.BodyMismatch> visitNumber(MatchingRule.NumberType rule) {
            if (actual != null && actual.isNumber()) {
                return ok();
            }
            return fail("Expected %s to be a number", JsonValues.display(actual));
        }

        @Override
        public List<Mismatch.BodyMismatch> visitInteger(MatchingRule.IntegerType rule) {
            if (actual != null && actual.isIntegralNumber()) {
                return ok();
            }
            return fail("Expected %s to be an integer", JsonValues.display(actual));
        }

        @Override
        public List<Mismatch.BodyMismatch> visitDecimal(MatchingRule.DecimalType rule) {
            if (actual != null && actual.isFloatingPointNumber()) {
                return ok();
            }
            return fail("Expected %s to be a decimal number", JsonValues.display(actual));
        }

        @Override
        public List<Mismatch.BodyMismatch> visitNull(MatchingRule.NullType rule) {
            if (actual != null && actual.isNull()) {
                return ok();
            }
            return fail("Expected %s to be a null value", JsonValues.display(actual));
        }

        @Override
        public List<Mismatch.BodyMismatch> visitBoolean(MatchingRule.BooleanType rule) {
            if (actual != null
                    && (actual.isBoolean()
                            || (actual.isTextual()
                                    && ("true".equals(actual.textValue()) || "false".equals(actual.textValue()))))) {
                return ok();
            }
            return fail("Expected %s to be a boolean value", JsonValues.display(actual));
        }

        @Override
        public List<Mismatch.BodyMismatch> visitContentType(MatchingRule.ContentType rule) {
            String detected = actual instanceof BinaryNode binary
                    ? ContentTypes.detect(binary.binaryValue())
                    : ContentTypes.sniff(actualText());
            if (ContentTypes.sameFamily(rule.mimeType(), detected)) {
                return ok();
            }
            return fail(
                    "Expected binary contents to have content type '%s' but detected contents was '%s'",
                    rule.mimeType(), detected);
        }

        @Override
        public List<Mismatch.BodyMismatch> visitArrayContains(MatchingRule.ArrayContains rule) {
            if (actual == null || !actual.isArray()) {
                return fail("Expected %s to be a List", JsonValues.display(actual));
            }
            List<Mismatch.BodyMismatch> result = new ArrayList<>();
            for (MatchingRule.Variant variant : rule.variants()) {
                JsonNode template = expected != null && expected.isArray() ? expected.get(variant.index()) : null;
                if (template == null) {
                    result.add(new Mismatch.BodyMismatch(
                            path.toString(),
                            expected,
                            actual,
                            String.format("ArrayContains variant %d has no example in the expected list", variant.index())));
                    continue;
                }
                if (findVariant(template, variant) < 0) {
                    result.add(new Mismatch.BodyMismatch(
                            path.toString(),
                            template,
                            actual,
                            String.format(
                                    "Variant at index %d (%s) was not found in the actual list (searched indices 0..%d)",
                                    variant.index(), JsonValues.display(template), Math.max(0, actual.size() - 1))));
                }
            }
            return result;
        }

        /** Index of the first actual element satisfying the variant, or -1. */
        private int findVariant(JsonNode template, MatchingRule.Variant variant) {
            for (int i = 0; i < actual.size(); i++) {
                if (BodyMatcher.compare(template, actual.get(i), variant.rules(), true).isEmpty()) {
                    return i;
                }
            }
            return -1;
        }

        @Override
        public List<Mismatch.BodyMismatch> visitEachKey(MatchingRule.EachKey rule) {
            if (actual == null || !actual.isObject()) {
                return fail("Expected %s to be a Map", JsonValues.display(actual));
            }
            List<Mismatch.BodyMismatch> result = new ArrayList<>();
            MatchingRuleDefinition definition = rule.definition();
            Iterator<String> keys = actual.fieldNames();
            while (keys.hasNext()) {
                String key = keys.next();
                DocPath keyPath = path.field(key);
                for (Mismatch.BodyMismatch m :
                        checkMember(definition, TextNode.valueOf(key), keyPath)) {
                    result.add(new Mismatch.BodyMismatch(
                            path.toString(), definition.value(), TextNode.valueOf(key),
                            String.format("Key '%s': %s", key, m.mismatch())));
                }
            }
            return result;
        }

        @Override
        public List<Mismatch.BodyMismatch> visitEachValue(MatchingRule.EachValue rule) {
            if (actual == null || !actual.isContainerNode()) {
                return fail("Expected %s to be a Map or a List", JsonValues.display(actual));
            }
            List<Mismatch.BodyMismatch> result = new ArrayList<>();
            if (actual.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> fields = actual.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    result.addAll(checkMember(rule.definition(), field.getValue(), path.field(field.getKey())));
                }
            } else {
                for (int i = 0; i < actual.size(); i++) {
                    result.addAll(checkMember(rule.definition(), actual.get(i), path.index(i)));
                }
            }
            return result;
        }

        /** Compares one member against a definition, with the definition's rules rooted at the member. */
        private static List<Mismatch.BodyMismatch> checkMember(
                MatchingRuleDefinition definition, JsonNode member, DocPath memberPath) {
            MatchingRuleCategory rules = definition.rules().isEmpty()
                    ? MatchingRuleCategory.empty(MatchingRules.BODY)
                    : MatchingRuleCategory.empty(MatchingRules.BODY)
                            .with("$", new RuleList(definition.rules(), RuleLogic.AND));
            List<Mismatch.BodyMismatch> result = new ArrayList<>();
            for (Mismatch.BodyMismatch m : BodyMatcher.compare(definition.value(), member, rules, true)) {
                result.add(m.relocate(memberPath.toString()));
            }
            return result;
        }

        @Override
        public List<Mismatch.BodyMismatch> visitInclude(MatchingRule.Include rule) {
            if (actualText().contains(rule.value())) {
                return ok();
            }
            return fail("Expected '%s' to include '%s'", actualText(), rule.value());
        }

        @Override
        public List<Mismatch.BodyMismatch> visitNotEmpty(MatchingRule.NotEmpty rule) {
            if (!JsonValues.isEmpty(actual)) {
                return ok();
            }
            return fail("Expected %s to not be empty", JsonValues.display(actual));
        }

        @Override
        public List<Mismatch.BodyMismatch> visitSemver(MatchingRule.Semver rule) {
            if (actual != null && actual.isTextual() && isSemver(actual.textValue())) {
                return ok();
            }
            return fail("'%s' is not a valid semantic version", actualText());
        }

        @Override
        public List<Mismatch.BodyMismatch> visitStatusCode(MatchingRule.StatusCode rule) {
            if (actual != null && actual.canConvertToInt() && actual.isIntegralNumber()
                    && rule.group().matches(actual.asInt())) {
                return ok();
            }
            return fail("Expected status code %s to be %s", actualText(), describe(rule.group()));
        }

        private static String describe(StatusGroup group) {
            if (group instanceof StatusGroup.Named named) {
                return "a " + named.name() + " status (" + named.low() + "-" + named.high() + ")";
            }
            return "one of " + ((StatusGroup.Codes) group).codes();
        }

        @Override
        public List<Mismatch.BodyMismatch> visitValues(MatchingRule.Values rule) {
            return typeCheck();
        }

        @Override
        public List<Mismatch.BodyMismatch> visitReference(MatchingRule.Reference rule) {
            return typeCheck();
        }
    }
}
