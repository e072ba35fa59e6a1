package io.pactkit.mockserver.server;

import io.pactkit.core.matchers.Mismatch;
import io.pactkit.core.matchers.RequestMatching;
import io.pactkit.core.model.HttpRequest;
import io.pactkit.core.model.Interaction;
import java.util.ArrayList;
import java.util.List;

/**
 * Picks the interaction a received request belongs to.
 *
 * <p>
 * Every interaction is compared with the request. The first full match in
 * registration order wins and any later full matches are noted as ambiguous.
 * Without a full match the request is attributed to the closest interaction:
 * one with the same method and path first, then the fewest mismatches, then
 * registration order.
 */
final class InteractionMatcher {

    private InteractionMatcher() {}

    /**
     * Result of matching one request.
     *
     * @param index   interaction the outcome is attributed to, {@code -1} if none
     * @param outcome what happened
     */
    record Decision(int index, MatchOutcome outcome) {}

    static Decision find(List<Interaction> interactions, HttpRequest actual) {
        int matchedIndex = -1;
        List<String> ambiguous = new ArrayList<>();
        int closestIndex = -1;
        boolean closestSamePath = false;
        List<Mismatch> closestMismatches = List.of();

        for (int i = 0; i < interactions.size(); i++) {
            HttpRequest expected = interactions.get(i).request();
            List<Mismatch> mismatches = RequestMatching.match(expected, actual);
            if (mismatches.isEmpty()) {
                if (matchedIndex < 0) {
                    matchedIndex = i;
                } else {
                    ambiguous.add(interactions.get(i).description());
                }
                continue;
            }
            boolean samePath = RequestMatching.sameMethodAndPath(expected, actual);
            if (closestIndex < 0
                    || samePath && !closestSamePath
                    || samePath == closestSamePath && mismatches.size() < closestMismatches.size()) {
                closestIndex = i;
                closestSamePath = samePath;
                closestMismatches = mismatches;
            }
        }

        if (matchedIndex >= 0) {
            return new Decision(
                    matchedIndex,
                    new MatchOutcome.RequestMatch(
                            interactions.get(matchedIndex).description(), actual.method(), actual.path(), ambiguous));
        }
        String description = closestIndex >= 0 ? interactions.get(closestIndex).description() : null;
        MatchOutcome outcome = closestSamePath
                ? new MatchOutcome.RequestMismatch(description, actual.method(), actual.path(), closestMismatches)
                : new MatchOutcome.RequestNotFound(description, actual.method(), actual.path(), closestMismatches);
        return new Decision(closestIndex, outcome);
    }
}
