package io.pactkit.core.error;

/** Thrown when a mock server listener cannot be bound to the requested address. */
public final class MockServerBindException extends PactKitException {

    private static final long serialVersionUID = 1L;

    private final String address;

    public MockServerBindException(String message, String address, Throwable cause) {
        super(message, cause, ErrorKind.BIND);
        this.address = address;
    }

    /** The address that could not be bound, as given by the caller. */
    public String address() {
        return address;
    }
}
