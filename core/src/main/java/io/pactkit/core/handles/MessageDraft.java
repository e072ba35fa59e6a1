package io.pactkit.core.handles;

import io.pactkit.core.model.Message;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * A message under construction.
 *
 * @param pactHandle the owning message pact
 * @param message    current state of the message
 */
public record MessageDraft(int pactHandle, Message message) {

    public MessageDraft {
        Objects.requireNonNull(message, "message must not be null");
    }

    public MessageDraft map(UnaryOperator<Message> update) {
        return new MessageDraft(pactHandle, update.apply(message));
    }
}
