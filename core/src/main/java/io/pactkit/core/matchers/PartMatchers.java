package io.pactkit.core.matchers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BinaryNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.pactkit.core.model.Body;
import io.pactkit.core.model.ContentTypes;
import io.pactkit.core.model.DocPath;
import io.pactkit.core.model.JsonValues;
import io.pactkit.core.model.MultiValues;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Comparisons shared by request, response and message matching. */
final class PartMatchers {

    /** Headers whose values legitimately contain commas. */
    private static final Set<String> UNSPLIT_HEADERS =
            Set.of("date", "expires", "last-modified", "if-modified-since", "if-unmodified-since", "set-cookie",
                    "www-authenticate", "retry-after");

    private PartMatchers() {}

    static List<Mismatch> path(String expected, String actual, MatchingRules rules) {
        RuleList list = rules.category(MatchingRules.PATH).single();
        if (!list.isEmpty()) {
            MatchResult result =
                    RuleEvaluator.evaluate(list, TextNode.valueOf(expected), TextNode.valueOf(actual), DocPath.root());
            List<Mismatch> out = new ArrayList<>();
            result.mismatches().forEach(m -> out.add(new Mismatch.PathMismatch(expected, actual, m.mismatch())));
            return out;
        }
        if (expected.equals(actual)) {
            return List.of();
        }
        return List.of(new Mismatch.PathMismatch(
                expected, actual, String.format("Expected path '%s' but received '%s'", expected, actual)));
    }

    static List<Mismatch> status(int expected, int actual, MatchingRules rules) {
        RuleList list = rules.category(MatchingRules.STATUS).single();
        if (!list.isEmpty()) {
            MatchResult result =
                    RuleEvaluator.evaluate(list, IntNode.valueOf(expected), IntNode.valueOf(actual), DocPath.root());
            List<Mismatch> out = new ArrayList<>();
            result.mismatches().forEach(m -> out.add(new Mismatch.StatusMismatch(expected, actual, m.mismatch())));
            return out;
        }
        if (expected == actual) {
            return List.of();
        }
        return List.of(new Mismatch.StatusMismatch(
                expected, actual, String.format("Expected status %d but was %d", expected, actual)));
    }

    static List<Mismatch> query(
            Map<String, List<String>> expected, Map<String, List<String>> actual, MatchingRules rules) {
        List<Mismatch> out = new ArrayList<>();
        MatchingRuleCategory category = rules.category(MatchingRules.QUERY);
        for (Map.Entry<String, List<String>> entry : expected.entrySet()) {
            String name = entry.getKey();
            List<String> actualValues = actual.get(name);
            if (actualValues == null) {
                out.add(new Mismatch.QueryMismatch(
                        name,
                        String.join(",", entry.getValue()),
                        null,
                        String.format("Expected query parameter '%s' but was missing", name)));
                continue;
            }
            RuleList list = category.forName(name, false);
            for (String failure : compareValues(entry.getValue(), actualValues, list, false, "query parameter", name)) {
                out.add(new Mismatch.QueryMismatch(
                        name, String.join(",", entry.getValue()), String.join(",", actualValues), failure));
            }
        }
        for (Map.Entry<String, List<String>> entry : actual.entrySet()) {
            if (!expected.containsKey(entry.getKey())) {
                out.add(new Mismatch.QueryMismatch(
                        entry.getKey(),
                        null,
                        String.join(",", entry.getValue()),
                        String.format("Unexpected query parameter '%s' received", entry.getKey())));
            }
        }
        return out;
    }

    static List<Mismatch> headers(
            Map<String, List<String>> expected, Map<String, List<String>> actual, MatchingRules rules) {
        List<Mismatch> out = new ArrayList<>();
        MatchingRuleCategory category = rules.category(MatchingRules.HEADER);
        for (Map.Entry<String, List<String>> entry : expected.entrySet()) {
            String name = entry.getKey();
            Optional<List<String>> found = MultiValues.getIgnoreCase(actual, name);
            if (found.isEmpty()) {
                out.add(new Mismatch.HeaderMismatch(
                        name,
                        String.join(", ", entry.getValue()),
                        null,
                        String.format("Expected header '%s' but was missing", name)));
                continue;
            }
            List<String> expectedValues = splitHeader(name, entry.getValue());
            List<String> actualValues = splitHeader(name, found.get());
            RuleList list = category.forName(name, true);
            for (String failure : compareValues(expectedValues, actualValues, list, true, "header", name)) {
                out.add(new Mismatch.HeaderMismatch(
                        name, String.join(", ", entry.getValue()), String.join(", ", found.get()), failure));
            }
        }
        return out;
    }

    private static List<String> splitHeader(String name, List<String> values) {
        if (UNSPLIT_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
            return values;
        }
        List<String> result = new ArrayList<>();
        for (String value : values) {
            for (String part : value.split(",")) {
                String trimmed = part.trim();
                if (!trimmed.isEmpty()) {
                    result.add(trimmed);
                }
            }
        }
        return result;
    }

    /**
     * Compares a multi-valued item. With rules, every actual value is checked against the expected
     * value at the same index (or the first one). Without rules, the value lists must be equal.
     */
    private static List<String> compareValues(
            List<String> expected, List<String> actual, RuleList rules, boolean header, String kind, String name) {
        List<String> failures = new ArrayList<>();
        if (!rules.isEmpty()) {
            for (int i = 0; i < actual.size(); i++) {
                String example = i < expected.size() ? expected.get(i) : (expected.isEmpty() ? "" : expected.get(0));
                RuleEvaluator.evaluate(
                                rules, TextNode.valueOf(example), TextNode.valueOf(actual.get(i)), DocPath.root())
                        .mismatches()
                        .forEach(m -> failures.add(
                                String.format("Mismatch with %s '%s': %s", kind, name, m.mismatch())));
            }
            return failures;
        }
        if (expected.size() != actual.size()) {
            failures.add(String.format(
                    "Expected %s '%s' to have %d value(s) %s but received %d value(s) %s",
                    kind, name, expected.size(), expected, actual.size(), actual));
            return failures;
        }
        boolean mediaType = header && isMediaTypeHeader(name);
        for (int i = 0; i < expected.size(); i++) {
            String e = expected.get(i);
            String a = actual.get(i);
            boolean same = mediaType ? mediaTypeCompatible(e, a) : e.equals(a);
            if (!same) {
                failures.add(String.format("Expected %s '%s' to have value '%s' but was '%s'", kind, name, e, a));
            }
        }
        return failures;
    }

    private static boolean isMediaTypeHeader(String name) {
        return name.equalsIgnoreCase("Content-Type") || name.equalsIgnoreCase("Accept");
    }

    /** Same base type, and every expected parameter present with the same value. */
    static boolean mediaTypeCompatible(String expected, String actual) {
        String eBase = ContentTypes.baseType(expected);
        if (eBase == null || !eBase.equals(ContentTypes.baseType(actual))) {
            return false;
        }
        Map<String, String> actualParams = ContentTypes.parameters(actual);
        for (Map.Entry<String, String> param : ContentTypes.parameters(expected).entrySet()) {
            String value = actualParams.get(param.getKey());
            if (value == null || !value.equalsIgnoreCase(param.getValue())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Compares bodies. A missing expected body accepts anything. JSON bodies are compared
     * structurally; other bodies by their text, or by a rule on {@code $} when one exists.
     */
    static List<Mismatch> body(
            Body expected,
            String expectedContentType,
            Body actual,
            String actualContentType,
            MatchingRules rules,
            boolean allowUnexpectedKeys) {
        if (!expected.isPresent()) {
            return List.of();
        }
        JsonNode expectedContent = expected.content();
        if (!actual.isPresent() || isEmptyText(actual.content()) && !isEmptyText(expectedContent)) {
            if (isEmptyText(expectedContent)) {
                return List.of();
            }
            return List.of(new Mismatch.BodyMismatch(
                    "$",
                    expectedContent,
                    null,
                    String.format("Expected body '%s' but was missing", expected.asText())));
        }
        String eType = expectedContentType != null ? expectedContentType : ContentTypes.sniff(expected.asText());
        String aType = actualContentType != null ? actualContentType : ContentTypes.sniff(actual.asText());
        if (!ContentTypes.sameFamily(eType, aType)) {
            return List.of(new Mismatch.BodyTypeMismatch(
                    ContentTypes.baseType(eType),
                    ContentTypes.baseType(aType),
                    String.format(
                            "Expected a body of '%s' but the actual content type was '%s'",
                            ContentTypes.baseType(eType), ContentTypes.baseType(aType))));
        }
        MatchingRuleCategory bodyRules = rules.category(MatchingRules.BODY);
        if (ContentTypes.isJson(eType)) {
            if (expectedContent.isTextual()) {
                JsonNode parsed = JsonValues.tryParse(expectedContent.textValue());
                expectedContent = parsed != null && parsed.isContainerNode() ? parsed : expectedContent;
            }
            JsonNode actualJson = actual.content();
            if (actualJson.isTextual() && expectedContent.isContainerNode()) {
                actualJson = JsonValues.tryParse(actualJson.textValue());
                if (actualJson == null) {
                    return List.of(new Mismatch.BodyMismatch(
                            "$", expectedContent, actual.content(), "Failed to parse the actual body as JSON"));
                }
            }
            return new ArrayList<>(BodyMatcher.compare(expectedContent, actualJson, bodyRules, allowUnexpectedKeys));
        }
        TextNode expectedText = TextNode.valueOf(expected.asText());
        TextNode actualText = TextNode.valueOf(actual.asText());
        RuleList list = bodyRules.resolve(DocPath.root());
        if (!list.isEmpty()) {
            JsonNode actualValue = actual.base64() ? decoded(actualText) : actualText;
            return new ArrayList<>(
                    RuleEvaluator.evaluate(list, expectedText, actualValue, DocPath.root()).mismatches());
        }
        if (expectedText.equals(actualText)) {
            return List.of();
        }
        return List.of(new Mismatch.BodyMismatch(
                "$",
                expectedText,
                actualText,
                String.format(
                        "Expected body '%s' to match '%s' using equality but did not match",
                        expectedText.textValue(), actualText.textValue())));
    }

    /** Binary form of a base64 body, or the text itself if it is not valid base64. */
    private static JsonNode decoded(TextNode base64) {
        try {
            return BinaryNode.valueOf(Base64.getDecoder().decode(base64.textValue()));
        } catch (IllegalArgumentException e) {
            return base64;
        }
    }

    private static boolean isEmptyText(JsonNode node) {
        return node != null && node.isTextual() && node.textValue().isEmpty();
    }
}
