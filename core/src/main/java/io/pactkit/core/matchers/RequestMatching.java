package io.pactkit.core.matchers;

import io.pactkit.core.model.HttpRequest;
import java.util.ArrayList;
import java.util.List;

/**
 * Compares a received HTTP request with an expected one using the expected request's matching
 * rules.
 *
 * <p>Order of checks: method, path, query, headers, body. Every mismatch is reported. Request
 * bodies do not tolerate object keys absent from the expectation.
 */
public final class RequestMatching {

    private RequestMatching() {}

    /** Every difference between {@code actual} and {@code expected}; empty when they match. */
    public static List<Mismatch> match(HttpRequest expected, HttpRequest actual) {
        List<Mismatch> mismatches = new ArrayList<>();
        if (!expected.method().equalsIgnoreCase(actual.method())) {
            mismatches.add(new Mismatch.MethodMismatch(expected.method(), actual.method()));
        }
        mismatches.addAll(PartMatchers.path(expected.path(), actual.path(), expected.matchingRules()));
        mismatches.addAll(PartMatchers.query(expected.query(), actual.query(), expected.matchingRules()));
        mismatches.addAll(PartMatchers.headers(expected.headers(), actual.headers(), expected.matchingRules()));
        mismatches.addAll(PartMatchers.body(
                expected.body(),
                expected.contentType(),
                actual.body(),
                actual.contentType(),
                expected.matchingRules(),
                false));
        return mismatches;
    }

    /** True if the method and path match, the cheapest pre-filter when looking for candidates. */
    public static boolean sameMethodAndPath(HttpRequest expected, HttpRequest actual) {
        return expected.method().equalsIgnoreCase(actual.method())
                && PartMatchers.path(expected.path(), actual.path(), expected.matchingRules()).isEmpty();
    }
}
