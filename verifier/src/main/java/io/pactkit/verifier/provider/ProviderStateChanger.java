package io.pactkit.verifier.provider;

import com.fasterxml.jackson.databind.JsonNode;
import io.pactkit.core.model.ProviderState;
import java.util.Map;

/**
 * Puts the provider into the state an interaction was recorded against.
 *
 * <p>
 * {@link #change} returns values the provider reports for the state; they are
 * merged into the state's parameters before request generators run.
 */
@FunctionalInterface
public interface ProviderStateChanger {

    /** Changer for runs without a state-change URL: every state is accepted as is. */
    ProviderStateChanger NONE = (state, action) -> Map.of();

    /**
     * @throws ProviderException    if the provider could not be called or rejected the state
     * @throws InterruptedException if interrupted while waiting for the provider
     */
    Map<String, JsonNode> change(ProviderState state, StateChangeAction action)
            throws ProviderException, InterruptedException;
}
