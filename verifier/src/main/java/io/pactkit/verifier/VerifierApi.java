package io.pactkit.verifier;

import io.pactkit.core.error.LastError;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-call entry point for embedding the verifier: the command-line
 * options, one per line. Returns the exit codes of {@link VerifierCommand};
 * nothing is thrown.
 */
public final class VerifierApi {

    private static final Logger LOG = LoggerFactory.getLogger(VerifierApi.class);

    private VerifierApi() {
        // utility class
    }

    /**
     * @param newlineDelimitedArgs options as on the command line, one per line; blank lines are ignored
     * @return 0 success, 1 verification failures, 2 null input, 3 internal fault, 4 invalid arguments
     */
    public static int verify(String newlineDelimitedArgs) {
        if (newlineDelimitedArgs == null) {
            LastError.record("verifier arguments are required");
            return VerifierCommand.EXIT_NULL_ARGUMENT;
        }
        String[] args = newlineDelimitedArgs.lines()
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .toArray(String[]::new);
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        try {
            int code = VerifierCommand.newCommandLine(new PrintWriter(out, true), new PrintWriter(err, true))
                    .execute(args);
            if (!out.toString().isBlank()) {
                LOG.info("{}", out.toString().strip());
            }
            if (code != VerifierCommand.EXIT_OK && !err.toString().isBlank()) {
                LastError.record(err.toString().strip());
                LOG.warn("{}", err.toString().strip());
            } else if (code == VerifierCommand.EXIT_FAILURES) {
                LastError.record("Verification failures found");
            }
            return code;
        } catch (RuntimeException e) {
            LOG.error("Verifier failed with arguments {}", Arrays.toString(args), e);
            LastError.record(e);
            return VerifierCommand.EXIT_INTERNAL_FAULT;
        }
    }
}
