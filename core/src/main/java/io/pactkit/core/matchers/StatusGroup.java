package io.pactkit.core.matchers;

import java.util.List;
import java.util.Objects;

/**
 * A set of HTTP status codes accepted by a {@link MatchingRule.StatusCode} rule: either a named
 * group ({@code success}, {@code clientError}, ...) or an explicit code list.
 *
 * <p>Thread-safe and immutable.
 */
public sealed interface StatusGroup {

    StatusGroup INFORMATION = new Named("information", 100, 199);
    StatusGroup SUCCESS = new Named("success", 200, 299);
    StatusGroup REDIRECT = new Named("redirect", 300, 399);
    StatusGroup CLIENT_ERROR = new Named("clientError", 400, 499);
    StatusGroup SERVER_ERROR = new Named("serverError", 500, 599);
    StatusGroup NON_ERROR = new Named("nonError", 100, 399);
    StatusGroup ERROR = new Named("error", 400, 599);

    /** Returns {@code true} if the given status code belongs to this group. */
    boolean matches(int statusCode);

    /**
     * A named contiguous range of codes, inclusive.
     *
     * @param name the group name used in pact JSON and the matcher DSL
     * @param low  lower bound (inclusive)
     * @param high upper bound (inclusive)
     */
    record Named(String name, int low, int high) implements StatusGroup {
        public Named {
            Objects.requireNonNull(name, "name must not be null");
            if (low < 100 || high > 599 || low > high) {
                throw new IllegalArgumentException("Invalid status range: " + low + "-" + high);
            }
        }

        @Override
        public boolean matches(int statusCode) {
            return statusCode >= low && statusCode <= high;
        }
    }

    /**
     * An explicit list of accepted codes.
     *
     * @param codes the codes (must not be empty)
     */
    record Codes(List<Integer> codes) implements StatusGroup {
        public Codes {
            Objects.requireNonNull(codes, "codes must not be null");
            if (codes.isEmpty()) {
                throw new IllegalArgumentException("Status code list must not be empty");
            }
            codes = List.copyOf(codes);
        }

        @Override
        public boolean matches(int statusCode) {
            return codes.contains(statusCode);
        }
    }

    /**
     * Looks up a named group.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    static StatusGroup named(String name) {
        for (StatusGroup group :
                List.of(INFORMATION, SUCCESS, REDIRECT, CLIENT_ERROR, SERVER_ERROR, NON_ERROR, ERROR)) {
            if (((Named) group).name().equalsIgnoreCase(name)) {
                return group;
            }
        }
        if ("info".equalsIgnoreCase(name)) {
            return INFORMATION;
        }
        throw new IllegalArgumentException("Unknown status code group: '" + name + "'");
    }
}
