package io.pactkit.verifier;

import io.pactkit.core.model.ProviderState;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Selects which interactions a run verifies.
 *
 * @param description regex an interaction description must contain a match for, or {@code null}
 * @param state       regex one of the provider-state names must contain a match for, or {@code null}
 * @param noState     only interactions without provider states
 * @param consumers   consumer names to verify; empty means all
 */
public record InteractionFilter(Pattern description, Pattern state, boolean noState, Set<String> consumers) {

    public static final InteractionFilter NONE = new InteractionFilter(null, null, false, Set.of());

    public InteractionFilter {
        consumers = consumers == null ? Set.of() : Set.copyOf(consumers);
    }

    public boolean acceptsConsumer(String consumer) {
        return consumers.isEmpty() || consumers.contains(consumer);
    }

    public boolean accepts(String interactionDescription, List<ProviderState> states) {
        if (description != null && !description.matcher(interactionDescription).find()) {
            return false;
        }
        if (noState) {
            return states.isEmpty();
        }
        if (state != null) {
            return states.stream().anyMatch(s -> state.matcher(s.name()).find());
        }
        return true;
    }
}
