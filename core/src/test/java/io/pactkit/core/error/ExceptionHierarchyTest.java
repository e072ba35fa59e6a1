package io.pactkit.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import io.pactkit.core.matchers.expressions.ParseError;
import java.io.IOException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

/** Tests for the exception hierarchy: one abstract root, one {@link ErrorKind} per concrete type. */
class ExceptionHierarchyTest {

    @AfterEach
    void clearLastError() {
        LastError.clear();
    }

    // --- Hierarchy structure ---

    @Test
    void pactKitExceptionIsAbstractAndRoot() {
        assertThat(PactKitException.class).isAbstract();
        assertThat(PactKitException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void mergeConflictIsAWriteFailure() {
        var ex = new PactMergeConflictException("a request for widgets", "/tmp/pacts/web-api.json");

        assertThat(ex).isInstanceOf(PactWriteException.class);
        assertThat(ex.kind()).isEqualTo(ErrorKind.PACT_WRITE);
        assertThat(ex.description()).isEqualTo("a request for widgets");
        assertThat(ex.detail())
                .isEqualTo("Cannot merge pact file '/tmp/pacts/web-api.json': interaction 'a request for widgets'"
                        + " already exists with different content");
    }

    // --- Kinds ---

    @Test
    void matcherExpressionExceptionCarriesTheParseError() {
        var error = new ParseError("Expected an integer", "'x'", 18);
        var ex = new MatcherExpressionException(error);

        assertThat(ex.kind()).isEqualTo(ErrorKind.PARSE);
        assertThat(ex.error()).isSameAs(error);
        assertThat(ex.getMessage()).isEqualTo("Expected an integer (got ''x'' at offset 18)");
    }

    @Test
    void frozenHandleException() {
        var ex = new FrozenHandleException(7);

        assertThat(ex.kind()).isEqualTo(ErrorKind.CONFIGURATION);
        assertThat(ex.handle()).isEqualTo(7);
        assertThat(ex.getMessage()).isEqualTo("Handle 7 is frozen and can no longer be modified");
    }

    @Test
    void bindExceptionKeepsAddressAndCause() {
        var cause = new IOException("Address already in use");
        var ex = new MockServerBindException("Failed to bind", "127.0.0.1:8080", cause);

        assertThat(ex.kind()).isEqualTo(ErrorKind.BIND);
        assertThat(ex.address()).isEqualTo("127.0.0.1:8080");
        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void remainingKinds() {
        assertThat(new InvalidPactException("bad").kind()).isEqualTo(ErrorKind.INVALID_PACT);
        assertThat(new TlsConfigurationException("no keystore").kind()).isEqualTo(ErrorKind.TLS);
        assertThat(new InternalFaultException("unreachable").kind()).isEqualTo(ErrorKind.INTERNAL);
        assertThat(new PactWriteException("disk full", new IOException()).kind()).isEqualTo(ErrorKind.PACT_WRITE);
    }

    // --- LastError ---

    @Test
    void lastErrorIsPerThread() throws InterruptedException {
        LastError.record(new InvalidPactException("broken pact"));

        String[] seenByOther = new String[1];
        Thread other = new Thread(() -> seenByOther[0] = LastError.get());
        other.start();
        other.join();

        assertThat(LastError.get()).isEqualTo("broken pact");
        assertThat(seenByOther[0]).isNull();
    }

    @Test
    void lastErrorFallsBackToTheClassName() {
        LastError.record(new IllegalStateException());

        assertThat(LastError.get()).isEqualTo("java.lang.IllegalStateException");
    }
}
