package io.pactkit.core.error;

/**
 * Abstract base for all pact-kit exceptions. Never thrown directly; the concrete subclasses each map
 * to one {@link ErrorKind}.
 *
 * <p>Matching failures are not exceptions. They are returned as values (see
 * {@link io.pactkit.core.matchers.MatchResult}).
 */
public abstract class PactKitException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    protected PactKitException(String message, ErrorKind kind) {
        super(message);
        this.kind = kind;
    }

    protected PactKitException(String message, Throwable cause, ErrorKind kind) {
        super(message, cause);
        this.kind = kind;
    }

    /** The error category. */
    public ErrorKind kind() {
        return kind;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }
}
