package io.pactkit.verifier.source;

/** Thrown when a pact source cannot be read, fetched or parsed. */
public class PactSourceException extends Exception {

    private static final long serialVersionUID = 1L;

    public PactSourceException(String message) {
        super(message);
    }

    public PactSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
