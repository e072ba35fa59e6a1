package io.pactkit.verifier;

import io.pactkit.verifier.provider.ProviderInfo;
import io.pactkit.verifier.report.VerificationReport;
import io.pactkit.verifier.source.Credentials;
import io.pactkit.verifier.source.PactSource;
import java.io.IOException;
import java.io.PrintWriter;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/**
 * Command-line front end of the {@link Verifier}. The same options are
 * accepted from {@link VerifierMain} and, one per line, from
 * {@link VerifierApi#verify(String)}.
 *
 * <table>
 * <caption>Exit codes</caption>
 * <tr><td>0</td><td>every interaction verified</td></tr>
 * <tr><td>1</td><td>verification failures found</td></tr>
 * <tr><td>2</td><td>no arguments given (API only)</td></tr>
 * <tr><td>3</td><td>internal fault</td></tr>
 * <tr><td>4</td><td>invalid arguments</td></tr>
 * </table>
 */
@Command(
        name = "pact-verifier",
        mixinStandardHelpOptions = true,
        version = "pact-verifier 0.1.0",
        sortOptions = false,
        description = "Verifies a provider against consumer pacts from files, directories, URLs or a pact broker.")
public final class VerifierCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(VerifierCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURES = 1;
    public static final int EXIT_NULL_ARGUMENT = 2;
    public static final int EXIT_INTERNAL_FAULT = 3;
    public static final int EXIT_INVALID_ARGUMENTS = 4;

    @Spec
    private CommandSpec spec;

    // --- sources ---

    @Option(names = {"-f", "--file"}, paramLabel = "FILE", description = "Pact file to verify (repeatable)")
    private List<Path> files = new ArrayList<>();

    @Option(names = {"-d", "--dir"}, paramLabel = "DIR", description = "Directory of *.json pact files (repeatable)")
    private List<Path> directories = new ArrayList<>();

    @Option(names = {"-u", "--url"}, paramLabel = "URL", description = "URL of a pact file (repeatable)")
    private List<URI> urls = new ArrayList<>();

    @Option(names = {"-b", "--broker-url"}, paramLabel = "URL", description = "Pact broker to fetch the provider's latest pacts from")
    private URI brokerUrl;

    @Option(names = "--user", description = "Username for URL and broker sources")
    private String user;

    @Option(names = "--password", description = "Password for URL and broker sources")
    private String password;

    @Option(names = {"-t", "--token"}, description = "Bearer token for URL and broker sources")
    private String token;

    // --- provider ---

    @Option(names = {"-n", "--provider-name"}, description = "Provider name (required with --broker-url)")
    private String providerName;

    @Option(names = "--hostname", defaultValue = "localhost", description = "Provider host (default: ${DEFAULT-VALUE})")
    private String hostname;

    @Option(names = {"-p", "--port"}, defaultValue = "8080", description = "Provider port (default: ${DEFAULT-VALUE})")
    private int port;

    @Option(names = "--scheme", defaultValue = "http", description = "http or https (default: ${DEFAULT-VALUE})")
    private String scheme;

    @Option(names = "--base-path", defaultValue = "", description = "Path prefix added to every request")
    private String basePath;

    @Option(names = "--request-timeout", defaultValue = "5000", paramLabel = "MS",
            description = "Provider request timeout in milliseconds (default: ${DEFAULT-VALUE})")
    private int requestTimeoutMs;

    @Option(names = "--header", paramLabel = "NAME=VALUE", description = "Header added to every provider request (repeatable)")
    private Map<String, String> headers = new LinkedHashMap<>();

    // --- provider states ---

    @Option(names = {"-s", "--state-change-url"}, paramLabel = "URL", description = "Provider-state callback URL")
    private URI stateChangeUrl;

    @Option(names = "--state-change-teardown", description = "Also call the state-change URL with action=teardown")
    private boolean stateChangeTeardown;

    // --- filters ---

    @Option(names = "--filter-description", paramLabel = "REGEX", description = "Only interactions whose description matches")
    private String filterDescription;

    @Option(names = "--filter-state", paramLabel = "REGEX", description = "Only interactions with a provider state that matches")
    private String filterState;

    @Option(names = "--filter-no-state", description = "Only interactions without provider states")
    private boolean filterNoState;

    @Option(names = {"-c", "--filter-consumer"}, paramLabel = "NAME", description = "Only pacts from this consumer (repeatable)")
    private List<String> filterConsumers = new ArrayList<>();

    // --- execution ---

    @Option(names = "--parallel", defaultValue = "1", paramLabel = "N", description = "Sources verified at once (default: ${DEFAULT-VALUE})")
    private int parallelism;

    @Option(names = "--json", paramLabel = "FILE", description = "Write the report as JSON to this file")
    private Path jsonReport;

    /** Picocli command line with the exit-code mapping above, printing to the given writers. */
    public static CommandLine newCommandLine(PrintWriter out, PrintWriter err) {
        CommandLine commandLine = new CommandLine(new VerifierCommand());
        commandLine.setOut(out);
        commandLine.setErr(err);
        commandLine.getCommandSpec().exitCodeOnInvalidInput(EXIT_INVALID_ARGUMENTS);
        commandLine.setParameterExceptionHandler((ex, args) -> {
            CommandLine cmd = ex.getCommandLine();
            cmd.getErr().println(ex.getMessage());
            cmd.usage(cmd.getErr());
            return EXIT_INVALID_ARGUMENTS;
        });
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            LOG.error("Verification failed unexpectedly: {}", ex.getMessage(), ex);
            cmd.getErr().println("Internal error: " + ex.getMessage());
            return EXIT_INTERNAL_FAULT;
        });
        return commandLine;
    }

    @Override
    public Integer call() {
        VerifierConfig config = toConfig();
        VerificationReport report = Verifier.create(config).execute();

        PrintWriter out = spec.commandLine().getOut();
        out.println(report.summary());
        out.flush();
        if (jsonReport != null) {
            writeJson(report);
        }
        return report.success() ? EXIT_OK : EXIT_FAILURES;
    }

    VerifierConfig toConfig() {
        Credentials credentials = token != null
                ? Credentials.bearer(token)
                : user != null ? Credentials.basic(user, password) : Credentials.NONE;

        List<PactSource> sources = new ArrayList<>();
        files.forEach(f -> sources.add(new PactSource.FileSource(f)));
        directories.forEach(d -> sources.add(new PactSource.DirectorySource(d)));
        urls.forEach(u -> sources.add(new PactSource.UrlSource(u, credentials)));
        if (brokerUrl != null) {
            if (providerName == null || providerName.isBlank()) {
                throw new ParameterException(spec.commandLine(), "--provider-name is required with --broker-url");
            }
            sources.add(new PactSource.BrokerSource(brokerUrl, providerName, credentials));
        }
        if (sources.isEmpty()) {
            throw new ParameterException(spec.commandLine(),
                    "No pact source given: use --file, --dir, --url or --broker-url");
        }
        if (filterNoState && filterState != null) {
            throw new ParameterException(spec.commandLine(), "--filter-no-state and --filter-state are mutually exclusive");
        }

        try {
            ProviderInfo.Builder provider = ProviderInfo.builder()
                    .scheme(scheme)
                    .host(hostname)
                    .port(port)
                    .basePath(basePath)
                    .requestTimeoutMs(requestTimeoutMs)
                    .headers(headers);
            if (providerName != null) {
                provider.name(providerName);
            }
            InteractionFilter filter = new InteractionFilter(
                    compile("--filter-description", filterDescription),
                    compile("--filter-state", filterState),
                    filterNoState,
                    new LinkedHashSet<>(filterConsumers));
            return VerifierConfig.builder()
                    .provider(provider.build())
                    .sources(sources)
                    .filter(filter)
                    .stateChangeUrl(stateChangeUrl)
                    .stateChangeTeardown(stateChangeTeardown)
                    .parallelism(parallelism)
                    .build();
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage(), e);
        }
    }

    private Pattern compile(String option, String regex) {
        if (regex == null) {
            return null;
        }
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new ParameterException(spec.commandLine(), option + " is not a valid regex: " + e.getDescription(), e);
        }
    }

    private void writeJson(VerificationReport report) {
        try {
            Path parent = jsonReport.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(jsonReport, report.toJson().toPrettyString());
            LOG.info("Report written to {}", jsonReport);
        } catch (IOException e) {
            LOG.error("Failed to write report to {}: {}", jsonReport, e.getMessage());
        }
    }
}
