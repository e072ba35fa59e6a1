package io.pactkit.core.api;

/** Which half of an HTTP interaction a mutator targets. */
public enum InteractionPart {
    REQUEST,
    RESPONSE
}
