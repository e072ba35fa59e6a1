package io.pactkit.verifier;

/** Lifecycle of a {@link Verifier}: {@code CONFIGURED -> EXECUTING -> SUCCESS | FAILURES}. */
public enum VerifierState {
    CONFIGURED,
    EXECUTING,
    SUCCESS,
    FAILURES
}
