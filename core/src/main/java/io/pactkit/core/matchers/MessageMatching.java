package io.pactkit.core.matchers;

import com.fasterxml.jackson.databind.JsonNode;
import io.pactkit.core.model.DocPath;
import io.pactkit.core.model.JsonValues;
import io.pactkit.core.model.Message;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Compares an actual message with the expected one: contents, then metadata. */
public final class MessageMatching {

    private MessageMatching() {}

    public static List<Mismatch> match(Message expected, Message actual) {
        List<Mismatch> mismatches = new ArrayList<>(PartMatchers.body(
                expected.contents(),
                contentType(expected),
                actual.contents(),
                contentType(actual),
                expected.matchingRules(),
                true));
        mismatches.addAll(metadata(expected, actual));
        return mismatches;
    }

    /** The message content type, from metadata first, then the contents. */
    public static String contentType(Message message) {
        for (String key : List.of("contentType", "content-type", "Content-Type")) {
            JsonNode value = message.metadata().get(key);
            if (value != null && value.isTextual()) {
                return value.textValue();
            }
        }
        return message.contents().contentType();
    }

    private static List<Mismatch> metadata(Message expected, Message actual) {
        List<Mismatch> out = new ArrayList<>();
        MatchingRuleCategory rules = expected.matchingRules().category(MatchingRules.METADATA);
        for (Map.Entry<String, JsonNode> entry : expected.metadata().entrySet()) {
            String key = entry.getKey();
            JsonNode expectedValue = entry.getValue();
            JsonNode actualValue = actual.metadata().get(key);
            if (actualValue == null) {
                out.add(new Mismatch.MetadataMismatch(
                        key,
                        JsonValues.asString(expectedValue),
                        null,
                        String.format("Expected message metadata '%s' but was missing", key)));
                continue;
            }
            RuleList list = rules.forName(key, false);
            if (!list.isEmpty()) {
                RuleEvaluator.evaluate(list, expectedValue, actualValue, DocPath.root().field(key))
                        .mismatches()
                        .forEach(m -> out.add(new Mismatch.MetadataMismatch(
                                key, JsonValues.asString(expectedValue), JsonValues.asString(actualValue), m.mismatch())));
            } else if (!sameMetadataValue(key, expectedValue, actualValue)) {
                out.add(new Mismatch.MetadataMismatch(
                        key,
                        JsonValues.asString(expectedValue),
                        JsonValues.asString(actualValue),
                        String.format(
                                "Expected metadata '%s' to have value %s but was %s",
                                key, JsonValues.display(expectedValue), JsonValues.display(actualValue))));
            }
        }
        return out;
    }

    private static boolean sameMetadataValue(String key, JsonNode expected, JsonNode actual) {
        if (key.equalsIgnoreCase("contentType") || key.equalsIgnoreCase("content-type")) {
            return PartMatchers.mediaTypeCompatible(JsonValues.asString(expected), JsonValues.asString(actual));
        }
        return JsonValues.deepEquals(expected, actual)
                || JsonValues.asString(expected).equals(JsonValues.asString(actual));
    }
}
