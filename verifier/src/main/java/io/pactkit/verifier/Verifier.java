package io.pactkit.verifier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.pactkit.core.generators.GenerationContext;
import io.pactkit.core.generators.GeneratorEngine;
import io.pactkit.core.generators.Generators;
import io.pactkit.core.matchers.MatchingRules;
import io.pactkit.core.matchers.MessageMatching;
import io.pactkit.core.matchers.Mismatch;
import io.pactkit.core.matchers.ResponseMatching;
import io.pactkit.core.model.HttpRequest;
import io.pactkit.core.model.HttpResponse;
import io.pactkit.core.model.Interaction;
import io.pactkit.core.model.JsonValues;
import io.pactkit.core.model.Message;
import io.pactkit.core.model.ProviderState;
import io.pactkit.verifier.provider.HttpProviderStateChanger;
import io.pactkit.verifier.provider.ProviderClient;
import io.pactkit.verifier.provider.ProviderException;
import io.pactkit.verifier.provider.ProviderStateChanger;
import io.pactkit.verifier.provider.StateChangeAction;
import io.pactkit.verifier.report.InteractionOutcome;
import io.pactkit.verifier.report.VerificationReport;
import io.pactkit.verifier.report.VerificationResult;
import io.pactkit.verifier.source.HttpPactFetcher;
import io.pactkit.verifier.source.LoadedPact;
import io.pactkit.verifier.source.PactLoader;
import io.pactkit.verifier.source.PactSource;
import io.pactkit.verifier.source.PactSourceException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replays pact interactions against a running provider and collects the
 * outcome of each in a {@link VerificationReport}.
 *
 * <p>
 * For every interaction: put the provider into each recorded state, apply the
 * request generators with the state values, send the request, and match the
 * reply against the recorded response. Messages are requested by POSTing
 * their description and states to the provider base URL. Transport failures
 * and failed state changes are reported as provider errors, separately from
 * mismatches.
 *
 * <p>
 * A verifier runs once: {@code CONFIGURED -> EXECUTING -> SUCCESS | FAILURES}.
 */
public final class Verifier {

    private static final Logger LOG = LoggerFactory.getLogger(Verifier.class);

    /** Header a message provider uses to return metadata, as base64-encoded JSON. */
    static final String MESSAGE_METADATA_HEADER = "Pact-Message-Metadata";

    private final VerifierConfig config;
    private final PactLoader loader;
    private final ProviderClient client;
    private final ProviderStateChanger stateChanger;
    private final AtomicReference<VerifierState> state = new AtomicReference<>(VerifierState.CONFIGURED);

    public Verifier(VerifierConfig config, PactLoader loader, ProviderClient client, ProviderStateChanger stateChanger) {
        this.config = config;
        this.loader = loader;
        this.client = client;
        this.stateChanger = stateChanger;
    }

    /** A verifier wired with the HTTP fetcher, provider client and state-change callback from {@code config}. */
    public static Verifier create(VerifierConfig config) {
        ProviderClient client = new ProviderClient(config.provider());
        ProviderStateChanger stateChanger = config.stateChangeUrl() == null
                ? ProviderStateChanger.NONE
                : new HttpProviderStateChanger(client, config.stateChangeUrl(), config.stateChangeTeardown());
        PactLoader loader = new PactLoader(new HttpPactFetcher(Duration.ofMillis(config.provider().requestTimeoutMs())));
        return new Verifier(config, loader, client, stateChanger);
    }

    public VerifierState state() {
        return state.get();
    }

    /**
     * Verifies every source.
     *
     * @throws IllegalStateException if this verifier has already run
     */
    public VerificationReport execute() {
        if (!state.compareAndSet(VerifierState.CONFIGURED, VerifierState.EXECUTING)) {
            throw new IllegalStateException("Verifier has already been executed");
        }
        long startTime = System.nanoTime();
        LOG.info("Verifying provider '{}' at {} against {} source(s)",
                config.provider().name(), config.provider().baseUrl(), config.sources().size());

        VerificationReport report = new VerificationReport();
        try {
            if (config.parallelism() <= 1 || config.sources().size() <= 1) {
                for (PactSource source : config.sources()) {
                    verifySource(source, report);
                }
            } else {
                verifyConcurrently(report);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            report.recordSourceError("Verification interrupted");
        }

        state.set(report.success() ? VerifierState.SUCCESS : VerifierState.FAILURES);
        LOG.info("Verification finished in {} ms: {}", (System.nanoTime() - startTime) / 1_000_000, report.summary());
        return report;
    }

    private void verifyConcurrently(VerificationReport report) throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(config.parallelism(), config.sources().size()));
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (PactSource source : config.sources()) {
                futures.add(pool.submit(() -> {
                    verifySource(source, report);
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    LOG.error("Unexpected failure verifying a source", e.getCause());
                    report.recordSourceError("Unexpected failure: " + e.getCause().getMessage());
                }
            }
        } finally {
            pool.shutdownNow();
        }
    }

    private void verifySource(PactSource source, VerificationReport report) throws InterruptedException {
        List<LoadedPact> pacts;
        try {
            pacts = loader.load(source);
        } catch (PactSourceException e) {
            LOG.error("Failed to load {}: {}", source.describe(), e.getMessage());
            report.recordSourceError(source.describe() + ": " + e.getMessage());
            return;
        }
        for (LoadedPact loaded : pacts) {
            String consumer = loaded.pact().consumer();
            if (!config.filter().acceptsConsumer(consumer)) {
                LOG.debug("Skipping pact from consumer '{}' ({})", consumer, loaded.origin());
                continue;
            }
            if (!loaded.pact().provider().equals(config.provider().name())) {
                LOG.warn("Pact {} is for provider '{}', verifying it against '{}'",
                        loaded.origin(), loaded.pact().provider(), config.provider().name());
            }
            for (Interaction interaction : loaded.pact().interactions()) {
                if (config.filter().accepts(interaction.description(), interaction.providerStates())) {
                    InteractionOutcome outcome = verifyInteraction(interaction);
                    record(report, loaded, interaction.description(), interaction.pending(), outcome);
                }
            }
            for (Message message : loaded.pact().messages()) {
                if (config.filter().accepts(message.description(), message.providerStates())) {
                    InteractionOutcome outcome = verifyMessage(message);
                    record(report, loaded, message.description(), false, outcome);
                }
            }
        }
    }

    private static void record(
            VerificationReport report, LoadedPact loaded, String description, boolean pending, InteractionOutcome outcome) {
        if (outcome.passed()) {
            LOG.info("  {} - '{}': passed", loaded.pact().consumer(), description);
        } else {
            LOG.warn("  {} - '{}': {}{}", loaded.pact().consumer(), description, outcome.status(),
                    pending ? " (pending)" : "");
        }
        report.record(new VerificationResult(loaded.origin(), loaded.pact().consumer(), description, pending, outcome));
    }

    InteractionOutcome verifyInteraction(Interaction interaction) throws InterruptedException {
        InteractionOutcome outcome;
        try {
            GenerationContext context = setUpStates(interaction.providerStates());
            HttpRequest request = GeneratorEngine.applyToRequest(interaction.request(), context);
            HttpResponse actual = client.execute(request);
            outcome = outcomeOf(ResponseMatching.match(interaction.response(), actual));
        } catch (ProviderException e) {
            outcome = providerError(e);
        }
        tearDownStates(interaction.providerStates());
        return outcome;
    }

    InteractionOutcome verifyMessage(Message message) throws InterruptedException {
        InteractionOutcome outcome;
        try {
            setUpStates(message.providerStates());
            HttpResponse reply = client.postJson(client.uri("/", Map.of()), messageRequest(message).toString());
            if (reply.status() < 200 || reply.status() >= 300) {
                outcome = new InteractionOutcome.ProviderError(
                        "MessageRequestFailed",
                        "Provider answered the request for message '" + message.description() + "' with status "
                                + reply.status());
            } else {
                outcome = outcomeOf(MessageMatching.match(message, toMessage(message, reply)));
            }
        } catch (ProviderException e) {
            outcome = providerError(e);
        }
        tearDownStates(message.providerStates());
        return outcome;
    }

    private GenerationContext setUpStates(List<ProviderState> states) throws ProviderException, InterruptedException {
        GenerationContext context = GeneratorEngine.withProviderStates(GenerationContext.empty(), states);
        Map<String, JsonNode> values = new LinkedHashMap<>(context.providerStateParams());
        for (ProviderState providerState : states) {
            values.putAll(stateChanger.change(providerState, StateChangeAction.SETUP));
        }
        return context.withProviderStateParams(values);
    }

    private void tearDownStates(List<ProviderState> states) throws InterruptedException {
        for (int i = states.size() - 1; i >= 0; i--) {
            try {
                stateChanger.change(states.get(i), StateChangeAction.TEARDOWN);
            } catch (ProviderException e) {
                LOG.warn("Teardown of provider state '{}' failed: {}", states.get(i).name(), e.getMessage());
            }
        }
    }

    private static InteractionOutcome outcomeOf(List<Mismatch> mismatches) {
        return mismatches.isEmpty() ? new InteractionOutcome.Passed() : new InteractionOutcome.Failed(mismatches);
    }

    private static InteractionOutcome providerError(ProviderException e) {
        return new InteractionOutcome.ProviderError(e.getClass().getSimpleName(), e.getMessage());
    }

    static ObjectNode messageRequest(Message message) {
        ObjectNode body = JsonValues.MAPPER.createObjectNode();
        body.put("description", message.description());
        if (!message.providerStates().isEmpty()) {
            ArrayNode states = body.putArray("providerStates");
            for (ProviderState providerState : message.providerStates()) {
                ObjectNode node = states.addObject();
                node.put("name", providerState.name());
                if (!providerState.params().isEmpty()) {
                    ObjectNode params = node.putObject("params");
                    providerState.params().forEach(params::set);
                }
            }
        }
        return body;
    }

    /** The provider's reply as a message: body as contents, metadata from the metadata header. */
    static Message toMessage(Message expected, HttpResponse reply) {
        Map<String, JsonNode> metadata = new LinkedHashMap<>();
        reply.header("Content-Type").ifPresent(values -> {
            if (!values.isEmpty()) {
                metadata.put("contentType", TextNode.valueOf(values.get(0)));
            }
        });
        reply.header(MESSAGE_METADATA_HEADER).ifPresent(values -> {
            if (!values.isEmpty()) {
                metadata.putAll(decodeMetadata(values.get(0)));
            }
        });
        return new Message(
                expected.description(),
                expected.providerStates(),
                reply.body(),
                metadata,
                MatchingRules.EMPTY,
                Generators.EMPTY);
    }

    private static Map<String, JsonNode> decodeMetadata(String header) {
        Map<String, JsonNode> metadata = new LinkedHashMap<>();
        try {
            String json = new String(Base64.getDecoder().decode(header.trim()), StandardCharsets.UTF_8);
            JsonNode node = JsonValues.MAPPER.readTree(json);
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                metadata.put(field.getKey(), field.getValue());
            }
        } catch (IllegalArgumentException | JsonProcessingException e) {
            LOG.warn("Ignoring unreadable {} header: {}", MESSAGE_METADATA_HEADER, e.getMessage());
        }
        return metadata;
    }
}
