package io.pactkit.core.matchers;

import io.pactkit.core.model.HttpResponse;
import java.util.ArrayList;
import java.util.List;

/**
 * Compares a provider's actual response with the expected one. Unlike requests, response bodies
 * may carry object keys the expectation does not mention.
 */
public final class ResponseMatching {

    private ResponseMatching() {}

    public static List<Mismatch> match(HttpResponse expected, HttpResponse actual) {
        List<Mismatch> mismatches = new ArrayList<>();
        mismatches.addAll(PartMatchers.status(expected.status(), actual.status(), expected.matchingRules()));
        mismatches.addAll(PartMatchers.headers(expected.headers(), actual.headers(), expected.matchingRules()));
        mismatches.addAll(PartMatchers.body(
                expected.body(),
                expected.contentType(),
                actual.body(),
                actual.contentType(),
                expected.matchingRules(),
                true));
        return mismatches;
    }
}
