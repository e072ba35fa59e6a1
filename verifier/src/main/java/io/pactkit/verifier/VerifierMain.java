package io.pactkit.verifier;

import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Command-line entry point.
 *
 * <pre>{@code
 * java -jar pact-kit-verifier.jar --dir pacts --provider-name widgets --port 8080
 * }</pre>
 */
public final class VerifierMain {

    private VerifierMain() {
        // utility class
    }

    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int code = VerifierCommand.newCommandLine(
                        new PrintWriter(System.out, true, StandardCharsets.UTF_8),
                        new PrintWriter(System.err, true, StandardCharsets.UTF_8))
                .execute(args);
        System.exit(code);
    }
}
