package io.pactkit.core.handles;

import io.pactkit.core.model.Interaction;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * An HTTP interaction under construction.
 *
 * @param pactHandle  the owning pact
 * @param interaction current state of the interaction
 * @param testName    name of the test that registered it, written as a V4 comment; may be null
 */
public record InteractionDraft(int pactHandle, Interaction interaction, String testName) {

    public InteractionDraft {
        Objects.requireNonNull(interaction, "interaction must not be null");
    }

    public InteractionDraft map(UnaryOperator<Interaction> update) {
        return new InteractionDraft(pactHandle, update.apply(interaction), testName);
    }

    public InteractionDraft withTestName(String name) {
        return new InteractionDraft(pactHandle, interaction, name);
    }
}
