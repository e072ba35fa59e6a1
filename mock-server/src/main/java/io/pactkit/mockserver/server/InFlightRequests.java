package io.pactkit.mockserver.server;

/**
 * Counts requests being handled so a stopping server can wait for them.
 *
 * <p>
 * Stopping goes through two phases. While draining, requests are still
 * admitted but marked so their connection is closed after the response.
 * Once closed, no new request is admitted.
 */
final class InFlightRequests {

    private final Object lock = new Object();
    private int active;
    private boolean draining;
    private boolean closed;

    /** Admits a request; {@code false} once closed. Every admitted request must call {@link #exit()}. */
    boolean tryEnter() {
        synchronized (lock) {
            if (closed) {
                return false;
            }
            active++;
            return true;
        }
    }

    void exit() {
        synchronized (lock) {
            active--;
        }
    }

    int active() {
        synchronized (lock) {
            return active;
        }
    }

    /** Marks the server as stopping; requests are still admitted. */
    void beginDrain() {
        synchronized (lock) {
            draining = true;
        }
    }

    boolean isDraining() {
        synchronized (lock) {
            return draining || closed;
        }
    }

    /** Refuses every later request. Requests already admitted run to completion. */
    void close() {
        synchronized (lock) {
            draining = true;
            closed = true;
        }
    }
}
