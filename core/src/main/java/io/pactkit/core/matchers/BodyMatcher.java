package io.pactkit.core.matchers;

import com.fasterxml.jackson.databind.JsonNode;
import io.pactkit.core.model.DocPath;
import io.pactkit.core.model.JsonValues;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Recursive comparison of an expected JSON tree against an actual one under a body rule category.
 *
 * <p>Every difference is collected in one pass; comparison never stops at the first failure.
 * Without a rule, objects need the same keys (unless unexpected keys are allowed), arrays need the
 * same length and scalars must be equal. Type-like rules relax this for the governed subtree:
 * arrays may have any length, each element being compared with the expected element at the same
 * index or with the first one.
 *
 * <p>Thread-safe, stateless utility class.
 */
public final class BodyMatcher {

    private BodyMatcher() {}

    /**
     * Compares two trees.
     *
     * @param expected            the expected tree
     * @param actual              the actual tree, {@code null} when missing
     * @param rules               body rules keyed by path expression
     * @param allowUnexpectedKeys true to tolerate object keys absent from the expected tree
     *                            (responses and messages); false for requests
     * @return every mismatch found, empty when the trees match
     */
    public static List<Mismatch.BodyMismatch> compare(
            JsonNode expected, JsonNode actual, MatchingRuleCategory rules, boolean allowUnexpectedKeys) {
        List<Mismatch.BodyMismatch> mismatches = new ArrayList<>();
        new Walk(rules, allowUnexpectedKeys, mismatches).compare(DocPath.root(), expected, actual);
        return mismatches;
    }

    private record Walk(MatchingRuleCategory rules, boolean allowUnexpectedKeys, List<Mismatch.BodyMismatch> out) {

        void compare(DocPath path, JsonNode expected, JsonNode actual) {
            RuleList applicable = rules.resolve(path);
            if (!applicable.isEmpty()) {
                compareWithRules(path, applicable, expected, actual);
                return;
            }
            if (actual == null || actual.isMissingNode()) {
                out.add(new Mismatch.BodyMismatch(
                        path.toString(),
                        expected,
                        null,
                        String.format("Expected %s but was missing", JsonValues.display(expected))));
                return;
            }
            if (expected.isObject()) {
                if (!actual.isObject()) {
                    typeMismatch(path, expected, actual);
                } else {
                    compareObjects(path, expected, actual, !allowUnexpectedKeys);
                }
            } else if (expected.isArray()) {
                if (!actual.isArray()) {
                    typeMismatch(path, expected, actual);
                } else {
                    compareArrays(path, expected, actual);
                }
            } else {
                out.addAll(RuleEvaluator.evaluate(new MatchingRule.Equality(), expected, actual, path)
                        .mismatches());
            }
        }

        private void compareWithRules(DocPath path, RuleList applicable, JsonNode expected, JsonNode actual) {
            out.addAll(RuleEvaluator.evaluate(applicable, expected, actual, path).mismatches());
            if (!applicable.cascades() || expected == null || actual == null) {
                return;
            }
            if (expected.isArray() && actual.isArray()) {
                if (expected.isEmpty()) {
                    return;
                }
                for (int i = 0; i < actual.size(); i++) {
                    JsonNode template = i < expected.size() ? expected.get(i) : expected.get(0);
                    compare(path.index(i), template, actual.get(i));
                }
            } else if (expected.isObject() && actual.isObject()) {
                boolean values = applicable.rules().stream().anyMatch(MatchingRule.Values.class::isInstance);
                if (values) {
                    compareValues(path, expected, actual);
                } else {
                    compareObjects(path, expected, actual, false);
                }
            }
        }

        /** Every actual entry is compared with the first expected value, whatever its key. */
        private void compareValues(DocPath path, JsonNode expected, JsonNode actual) {
            if (expected.isEmpty()) {
                return;
            }
            JsonNode template = expected.elements().next();
            Iterator<Map.Entry<String, JsonNode>> fields = actual.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                compare(path.field(field.getKey()), template, field.getValue());
            }
        }

        private void compareObjects(DocPath path, JsonNode expected, JsonNode actual, boolean strictKeys) {
            if (strictKeys) {
                if (expected.isEmpty() && !actual.isEmpty()) {
                    out.add(new Mismatch.BodyMismatch(
                            path.toString(),
                            expected,
                            actual,
                            String.format("Expected an empty Map but received %s", JsonValues.display(actual))));
                    return;
                }
                Set<String> expectedKeys = keys(expected);
                Set<String> actualKeys = keys(actual);
                if (!expectedKeys.containsAll(actualKeys)) {
                    out.add(new Mismatch.BodyMismatch(
                            path.toString(),
                            expected,
                            actual,
                            String.format(
                                    "Expected a Map with keys %s but received one with keys %s",
                                    expectedKeys, actualKeys)));
                }
            }
            Iterator<Map.Entry<String, JsonNode>> fields = expected.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                DocPath child = path.field(field.getKey());
                JsonNode actualValue = actual.get(field.getKey());
                if (actualValue == null) {
                    out.add(new Mismatch.BodyMismatch(
                            child.toString(),
                            field.getValue(),
                            null,
                            String.format(
                                    "Expected entry %s=%s but was missing",
                                    field.getKey(), JsonValues.display(field.getValue()))));
                } else {
                    compare(child, field.getValue(), actualValue);
                }
            }
        }

        private void compareArrays(DocPath path, JsonNode expected, JsonNode actual) {
            if (expected.isEmpty() && !actual.isEmpty()) {
                out.add(new Mismatch.BodyMismatch(
                        path.toString(),
                        expected,
                        actual,
                        String.format("Expected an empty List but received %s", JsonValues.display(actual))));
                return;
            }
            if (expected.size() != actual.size()) {
                out.add(new Mismatch.BodyMismatch(
                        path.toString(),
                        expected,
                        actual,
                        String.format(
                                "Expected a List with %d elements but received %d elements",
                                expected.size(), actual.size())));
            }
            int common = Math.min(expected.size(), actual.size());
            for (int i = 0; i < common; i++) {
                compare(path.index(i), expected.get(i), actual.get(i));
            }
        }

        private void typeMismatch(DocPath path, JsonNode expected, JsonNode actual) {
            out.add(new Mismatch.BodyMismatch(
                    path.toString(),
                    expected,
                    actual,
                    String.format(
                            "Type mismatch: Expected %s %s but received %s %s",
                            JsonValues.typeName(expected),
                            JsonValues.display(expected),
                            JsonValues.typeName(actual),
                            JsonValues.display(actual))));
        }

        private static Set<String> keys(JsonNode node) {
            Set<String> keys = new TreeSet<>();
            node.fieldNames().forEachRemaining(keys::add);
            return keys;
        }
    }
}
