package io.pactkit.mockserver.server;

/** Lifecycle of a {@link MockServer}. */
public enum MockServerState {
    CREATED,
    STARTING,
    RUNNING,
    /** Running, and every interaction has been matched with no failures. */
    MATCHED,
    /** Running, with requests recorded but not all interactions matched cleanly. */
    PARTIALLY_MATCHED,
    STOPPING,
    STOPPED
}
