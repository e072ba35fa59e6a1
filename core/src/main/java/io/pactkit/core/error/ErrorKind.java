package io.pactkit.core.error;

/** Category of a {@link PactKitException}. */
public enum ErrorKind {
    /** Malformed matcher expression. */
    PARSE,
    /** Mutation of a frozen pact, interaction or message. */
    CONFIGURATION,
    /** Pact JSON that cannot be read into the model. */
    INVALID_PACT,
    /** Listener could not be bound (address in use or invalid). */
    BIND,
    /** TLS setup failure for the mock server listener. */
    TLS,
    /** Pact file could not be written or merged. */
    PACT_WRITE,
    /** Unexpected defect. */
    INTERNAL
}
