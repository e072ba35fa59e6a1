package io.pactkit.core.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.pactkit.core.error.FrozenHandleException;
import io.pactkit.core.error.LastError;
import io.pactkit.core.error.PactWriteException;
import io.pactkit.core.generators.GenerationContext;
import io.pactkit.core.generators.Generator;
import io.pactkit.core.generators.GeneratorEngine;
import io.pactkit.core.generators.GeneratorJson;
import io.pactkit.core.generators.Generators;
import io.pactkit.core.handles.HandleRegistry;
import io.pactkit.core.handles.InteractionDraft;
import io.pactkit.core.handles.MessageDraft;
import io.pactkit.core.handles.PactDraft;
import io.pactkit.core.matchers.IntegrationJson;
import io.pactkit.core.matchers.MatchingRule;
import io.pactkit.core.matchers.MatchingRuleCategory;
import io.pactkit.core.matchers.MatchingRuleJson;
import io.pactkit.core.matchers.MatchingRules;
import io.pactkit.core.matchers.RuleList;
import io.pactkit.core.model.Body;
import io.pactkit.core.model.ContentTypes;
import io.pactkit.core.model.HttpRequest;
import io.pactkit.core.model.HttpResponse;
import io.pactkit.core.model.Interaction;
import io.pactkit.core.model.JsonValues;
import io.pactkit.core.model.Message;
import io.pactkit.core.model.MultiValues;
import io.pactkit.core.model.Pact;
import io.pactkit.core.model.ProviderState;
import io.pactkit.core.model.SpecVersion;
import io.pactkit.core.pact.PactFiles;
import io.pactkit.core.pact.PactWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handle-based API for building pacts and message pacts.
 *
 * <p>Every object is addressed by an integer handle. Mutators return {@code false} for an unknown
 * or frozen handle and never throw; the reason is available from {@link #lastError()} on the same
 * thread. Creation methods return {@code 0} on failure. Once a mock server has been started for a
 * pact, the pact and its interactions are frozen.
 *
 * <p>Thread-safe. Updates to the same handle are serialised; different handles never block each
 * other.
 */
public final class PactHandles {

    private static final Logger LOG = LoggerFactory.getLogger(PactHandles.class);

    private static final PactHandles SHARED = new PactHandles();

    /** Pact file written. */
    public static final int WRITE_OK = 0;
    /** Unexpected failure while writing. */
    public static final int WRITE_FAULT = 1;
    /** IO failure or merge conflict. */
    public static final int WRITE_IO_ERROR = 2;
    /** No pact with that handle. */
    public static final int WRITE_NO_SUCH_PACT = 3;

    private final HandleRegistry<PactDraft> pacts = new HandleRegistry<>();
    private final HandleRegistry<InteractionDraft> interactions = new HandleRegistry<>();
    private final HandleRegistry<PactDraft> messagePacts = new HandleRegistry<>();
    private final HandleRegistry<MessageDraft> messages = new HandleRegistry<>();

    /** Process-wide instance used by the control APIs. */
    public static PactHandles shared() {
        return SHARED;
    }

    /** Message of the last failure on the calling thread, or {@code null}. */
    public static String lastError() {
        return LastError.get();
    }

    // ---------------------------------------------------------------- pacts

    /** Creates a pact. Returns {@code 0} if either name is null. */
    public int newPact(String consumer, String provider) {
        if (consumer == null || provider == null) {
            LastError.record("consumer and provider names are required");
            return 0;
        }
        int handle = pacts.allocate(PactDraft.of(consumer, provider));
        LOG.debug("Created pact handle {} for {} -> {}", handle, consumer, provider);
        return handle;
    }

    public boolean withSpecification(int pact, SpecVersion version) {
        if (version == null) {
            LastError.record("specification version is required");
            return false;
        }
        return mutate(pacts, "pact", pact, p -> p.withSpecVersion(version));
    }

    /** Sets {@code metadata[namespace][name]}. */
    public boolean withPactMetadata(int pact, String namespace, String name, String value) {
        if (namespace == null || name == null || value == null) {
            LastError.record("metadata namespace, name and value are required");
            return false;
        }
        return mutate(pacts, "pact", pact, p -> p.withMetadata(namespace, name, value));
    }

    /** Releases a pact and all its interactions. */
    public boolean freePactHandle(int pact) {
        for (int interaction : interactions.handles(d -> d.pactHandle() == pact)) {
            interactions.release(interaction);
        }
        boolean released = pacts.release(pact);
        if (!released) {
            LastError.record("Unknown pact handle " + pact);
        }
        return released;
    }

    /** Snapshot of the pact with its interactions in registration order. */
    public Optional<Pact> pact(int pact) {
        return pacts.get(pact).map(draft -> draft.toPact(interactionsOf(pact), List.of()));
    }

    /** Freezes a pact and its interactions against further changes. */
    public boolean freezePact(int pact) {
        if (!pacts.freeze(pact)) {
            return false;
        }
        interactions.handles(d -> d.pactHandle() == pact).forEach(interactions::freeze);
        LOG.debug("Froze pact handle {}", pact);
        return true;
    }

    public boolean isFrozen(int pact) {
        return pacts.isFrozen(pact);
    }

    /** Pact JSON for the handle, or {@code null} if it is unknown. */
    public String pactHandleToJson(int pact) {
        Optional<Pact> snapshot = pact(pact);
        if (snapshot.isEmpty()) {
            LastError.record("Unknown pact handle " + pact);
            return null;
        }
        return JsonValues.writePretty(pactJson(pact, snapshot.get()));
    }

    /**
     * Writes the pact to {@code directory}.
     *
     * @return {@link #WRITE_OK}, {@link #WRITE_FAULT}, {@link #WRITE_IO_ERROR} or
     *     {@link #WRITE_NO_SUCH_PACT}
     */
    public int pactHandleWriteFile(int pact, String directory, boolean overwrite) {
        Optional<Pact> snapshot = pact(pact);
        if (snapshot.isEmpty()) {
            LastError.record("Unknown pact handle " + pact);
            return WRITE_NO_SUCH_PACT;
        }
        return writeFile(snapshot.get(), directory, overwrite);
    }

    // ---------------------------------------------------------------- interactions

    /**
     * Adds an interaction to a pact. An existing interaction with the same description is
     * released and replaced, so its handle goes stale. Returns {@code 0} for an unknown or frozen
     * pact.
     */
    public int newInteraction(int pact, String description) {
        if (description == null) {
            LastError.record("interaction description is required");
            return 0;
        }
        int[] created = new int[1];
        try {
            // under the pact's write lock, so a concurrent freeze sees the new interaction
            boolean known = pacts.update(pact, draft -> {
                releaseDuplicates(interactions, "interaction", description,
                        d -> d.pactHandle() == pact && d.interaction().description().equals(description));
                created[0] = interactions.allocate(new InteractionDraft(pact, Interaction.named(description), null));
                return draft;
            });
            if (!known) {
                LastError.record("Unknown pact handle " + pact);
                return 0;
            }
        } catch (FrozenHandleException e) {
            LastError.record(e);
            return 0;
        }
        return created[0];
    }

    public boolean uponReceiving(int interaction, String description) {
        if (description == null) {
            LastError.record("interaction description is required");
            return false;
        }
        return mutateInteraction(interaction, i -> i.withDescription(description));
    }

    public boolean given(int interaction, String state) {
        if (state == null) {
            LastError.record("provider state is required");
            return false;
        }
        return mutateInteraction(interaction, i -> i.withProviderStates(appendState(i.providerStates(), state)));
    }

    /**
     * Adds a parameter to the provider state {@code state}, creating the state if needed. A value
     * that parses as JSON is stored as JSON, anything else as a string.
     */
    public boolean givenWithParam(int interaction, String state, String name, String value) {
        if (state == null || name == null) {
            LastError.record("provider state and parameter name are required");
            return false;
        }
        return mutateInteraction(interaction,
                i -> i.withProviderStates(withParam(i.providerStates(), state, name, parseParam(value))));
    }

    /** Adds a provider state whose parameters are given as a JSON object. */
    public boolean givenWithParams(int interaction, String state, String paramsJson) {
        if (state == null) {
            LastError.record("provider state is required");
            return false;
        }
        Map<String, JsonNode> params;
        try {
            params = objectFields(paramsJson);
        } catch (IllegalArgumentException e) {
            LastError.record(e);
            return false;
        }
        return mutateInteraction(interaction, i -> {
            List<ProviderState> states = new ArrayList<>(i.providerStates());
            states.add(new ProviderState(state, params));
            return i.withProviderStates(states);
        });
    }

    /** Sets the request method and path. The path may be an integration JSON matcher. */
    public boolean withRequest(int interaction, String method, String path) {
        return mutateInteraction(interaction, i -> {
            HttpRequest request = i.request();
            if (method != null) {
                request = request.withMethod(method);
            }
            if (path != null) {
                IntegrationJson.Processed processed =
                        IntegrationJson.processItem(MatchingRules.PATH, MatchingRuleCategory.SINGLE_KEY, path);
                request = request.withPath(JsonValues.asString(processed.value()))
                        .withMatchingRules(request.matchingRules().merge(asRules(processed)))
                        .withGenerators(request.generators().merge(asGenerators(MatchingRules.PATH, processed)));
            }
            return i.withRequest(request);
        });
    }

    /** Sets value {@code index} of query parameter {@code name}. The value may be a matcher. */
    public boolean withQueryParameter(int interaction, String name, int index, String value) {
        if (name == null || index < 0) {
            LastError.record("query parameter name and a non-negative index are required");
            return false;
        }
        return mutateInteraction(interaction, i -> {
            HttpRequest request = i.request();
            IntegrationJson.Processed processed =
                    IntegrationJson.processItem(MatchingRules.QUERY, name, value == null ? "" : value);
            request = request.withQuery(MultiValues.withValue(
                            request.query(), name, index, JsonValues.asString(processed.value()), false))
                    .withMatchingRules(request.matchingRules().merge(asRules(processed)))
                    .withGenerators(request.generators().merge(asGenerators(MatchingRules.QUERY, processed)));
            return i.withRequest(request);
        });
    }

    /** Sets value {@code index} of header {@code name}. The value may be a matcher. */
    public boolean withHeader(int interaction, InteractionPart part, String name, int index, String value) {
        if (part == null || name == null || index < 0) {
            LastError.record("part, header name and a non-negative index are required");
            return false;
        }
        return mutateInteraction(interaction, i -> {
            IntegrationJson.Processed processed =
                    IntegrationJson.processItem(MatchingRules.HEADER, name, value == null ? "" : value);
            String text = JsonValues.asString(processed.value());
            MatchingRules rules = asRules(processed);
            Generators generators = asGenerators(MatchingRules.HEADER, processed);
            if (part == InteractionPart.REQUEST) {
                HttpRequest request = i.request();
                return i.withRequest(request
                        .withHeaders(MultiValues.withValue(request.headers(), name, index, text, true))
                        .withMatchingRules(request.matchingRules().merge(rules))
                        .withGenerators(request.generators().merge(generators)));
            }
            HttpResponse response = i.response();
            return i.withResponse(response
                    .withHeaders(MultiValues.withValue(response.headers(), name, index, text, true))
                    .withMatchingRules(response.matchingRules().merge(rules))
                    .withGenerators(response.generators().merge(generators)));
        });
    }

    public boolean responseStatus(int interaction, int status) {
        if (status < 100 || status > 599) {
            LastError.record("Invalid HTTP status " + status);
            return false;
        }
        return mutateInteraction(interaction, i -> i.withResponse(i.response().withStatus(status)));
    }

    /**
     * Sets a body. JSON bodies may embed integration JSON matchers, which replace the body rules
     * and generators of that part. A {@code Content-Type} header is added when none is set.
     */
    public boolean withBody(int interaction, InteractionPart part, String contentType, String body) {
        if (part == null) {
            LastError.record("part is required");
            return false;
        }
        return mutateInteraction(interaction, i -> {
            BodyUpdate update = bodyUpdate(contentType, body);
            if (part == InteractionPart.REQUEST) {
                HttpRequest request = i.request();
                return i.withRequest(request
                        .withBody(update.body())
                        .withHeaders(withDefaultContentType(request.headers(), update.body()))
                        .withMatchingRules(request.matchingRules().withCategory(update.rules()))
                        .withGenerators(request.generators().withCategory(MatchingRules.BODY, update.generators())));
            }
            HttpResponse response = i.response();
            return i.withResponse(response
                    .withBody(update.body())
                    .withHeaders(withDefaultContentType(response.headers(), update.body()))
                    .withMatchingRules(response.matchingRules().withCategory(update.rules()))
                    .withGenerators(response.generators().withCategory(MatchingRules.BODY, update.generators())));
        });
    }

    /**
     * Sets a binary body, stored base64-encoded. The body is matched by content type rather than
     * by bytes.
     */
    public boolean withBinaryFile(int interaction, InteractionPart part, String contentType, byte[] data) {
        if (part == null || contentType == null || data == null) {
            LastError.record("part, content type and data are required");
            return false;
        }
        Body body = new Body(TextNode.valueOf(Base64.getEncoder().encodeToString(data)), contentType, true);
        MatchingRuleCategory rules = MatchingRuleCategory.empty(MatchingRules.BODY)
                .with("$", RuleList.of(new MatchingRule.ContentType(contentType)));
        return mutateInteraction(interaction, i -> {
            if (part == InteractionPart.REQUEST) {
                HttpRequest request = i.request();
                return i.withRequest(request
                        .withBody(body)
                        .withHeaders(withDefaultContentType(request.headers(), body))
                        .withMatchingRules(request.matchingRules().withCategory(rules)));
            }
            HttpResponse response = i.response();
            return i.withResponse(response
                    .withBody(body)
                    .withHeaders(withDefaultContentType(response.headers(), body))
                    .withMatchingRules(response.matchingRules().withCategory(rules)));
        });
    }

    /** Merges a pact-JSON {@code matchingRules} block into one part. */
    public boolean withMatchingRules(int interaction, InteractionPart part, String rulesJson) {
        MatchingRules rules;
        try {
            rules = MatchingRuleJson.read(JsonValues.parse(rulesJson));
        } catch (RuntimeException e) {
            LastError.record(e);
            return false;
        }
        return mutateInteraction(interaction, i -> part == InteractionPart.REQUEST
                ? i.withRequest(i.request().withMatchingRules(i.request().matchingRules().merge(rules)))
                : i.withResponse(i.response().withMatchingRules(i.response().matchingRules().merge(rules))));
    }

    /** Merges a pact-JSON {@code generators} block into one part. */
    public boolean withGenerators(int interaction, InteractionPart part, String generatorsJson) {
        Generators generators;
        try {
            generators = GeneratorJson.readGenerators(JsonValues.parse(generatorsJson));
        } catch (RuntimeException e) {
            LastError.record(e);
            return false;
        }
        return mutateInteraction(interaction, i -> part == InteractionPart.REQUEST
                ? i.withRequest(i.request().withGenerators(i.request().generators().merge(generators)))
                : i.withResponse(i.response().withGenerators(i.response().generators().merge(generators))));
    }

    /** Records the name of the test that defined the interaction (written for V4 pacts). */
    public boolean interactionTestName(int interaction, String testName) {
        if (testName == null) {
            LastError.record("test name is required");
            return false;
        }
        return guarded(() -> updateOrRecord(interactions, "interaction", interaction, d -> d.withTestName(testName)));
    }

    /** Marks the interaction pending: its verification failures are reported but do not fail a run. */
    public boolean withPending(int interaction, boolean pending) {
        return mutateInteraction(interaction, i -> i.withPending(pending));
    }

    /** Current snapshot of an interaction. */
    public Optional<Interaction> interaction(int interaction) {
        return interactions.read(interaction, InteractionDraft::interaction);
    }

    // ---------------------------------------------------------------- messages

    public int newMessagePact(String consumer, String provider) {
        if (consumer == null || provider == null) {
            LastError.record("consumer and provider names are required");
            return 0;
        }
        return messagePacts.allocate(PactDraft.of(consumer, provider));
    }

    /** Adds a message, replacing any message of the same description in that message pact. */
    public int newMessage(int messagePact, String description) {
        if (description == null) {
            LastError.record("message description is required");
            return 0;
        }
        int[] created = new int[1];
        boolean known = messagePacts.update(messagePact, draft -> {
            releaseDuplicates(messages, "message", description,
                    d -> d.pactHandle() == messagePact && d.message().description().equals(description));
            created[0] = messages.allocate(new MessageDraft(messagePact, Message.named(description)));
            return draft;
        });
        if (!known) {
            LastError.record("Unknown message pact handle " + messagePact);
            return 0;
        }
        return created[0];
    }

    public boolean withMessagePactMetadata(int messagePact, String namespace, String name, String value) {
        if (namespace == null || name == null || value == null) {
            LastError.record("metadata namespace, name and value are required");
            return false;
        }
        return mutate(messagePacts, "message pact", messagePact, p -> p.withMetadata(namespace, name, value));
    }

    public boolean messageExpectsToReceive(int message, String description) {
        if (description == null) {
            LastError.record("message description is required");
            return false;
        }
        return mutateMessage(message, m -> m.withDescription(description));
    }

    public boolean messageGiven(int message, String state) {
        if (state == null) {
            LastError.record("provider state is required");
            return false;
        }
        return mutateMessage(message, m -> m.withProviderStates(appendState(m.providerStates(), state)));
    }

    public boolean messageGivenWithParam(int message, String state, String name, String value) {
        if (state == null || name == null) {
            LastError.record("provider state and parameter name are required");
            return false;
        }
        return mutateMessage(message,
                m -> m.withProviderStates(withParam(m.providerStates(), state, name, parseParam(value))));
    }

    /** Sets the message contents; JSON contents may embed integration JSON matchers. */
    public boolean messageWithContents(int message, String contentType, String contents) {
        return mutateMessage(message, m -> {
            BodyUpdate update = bodyUpdate(contentType, contents);
            return m.withContents(update.body())
                    .withMatchingRules(m.matchingRules().withCategory(update.rules()))
                    .withGenerators(m.generators().withCategory(MatchingRules.BODY, update.generators()));
        });
    }

    /** Sets one metadata entry. The value may be an integration JSON matcher. */
    public boolean messageWithMetadata(int message, String key, String value) {
        if (key == null) {
            LastError.record("metadata key is required");
            return false;
        }
        return mutateMessage(message, m -> {
            IntegrationJson.Processed processed = IntegrationJson.processItem(MatchingRules.METADATA, key, value);
            Map<String, JsonNode> metadata = new LinkedHashMap<>(m.metadata());
            metadata.put(key, processed.value());
            return m.withMetadata(metadata)
                    .withMatchingRules(m.matchingRules().merge(asRules(processed)))
                    .withGenerators(m.generators().merge(asGenerators(MatchingRules.METADATA, processed)));
        });
    }

    /**
     * The message as JSON with its generators applied, or {@code null} for an unknown handle.
     */
    public String messageReify(int message) {
        Optional<Message> snapshot = messages.read(message, MessageDraft::message);
        if (snapshot.isEmpty()) {
            LastError.record("Unknown message handle " + message);
            return null;
        }
        Message m = snapshot.get();
        GenerationContext context = GeneratorEngine.withProviderStates(GenerationContext.empty(), m.providerStates());
        Message reified = GeneratorEngine.applyToMessage(m, context);
        ObjectNode json = JsonValues.MAPPER.createObjectNode();
        json.put("description", reified.description());
        ArrayNode states = json.putArray("providerStates");
        for (ProviderState state : reified.providerStates()) {
            ObjectNode s = states.addObject().put("name", state.name());
            ObjectNode params = s.putObject("params");
            state.params().forEach(params::set);
        }
        json.set("contents", reified.contents().isPresent() ? reified.contents().content() : null);
        ObjectNode metadata = json.putObject("metadata");
        reified.metadata().forEach(metadata::set);
        return JsonValues.write(json);
    }

    public Optional<Message> message(int message) {
        return messages.read(message, MessageDraft::message);
    }

    /** Message pact snapshot with its messages in registration order. */
    public Optional<Pact> messagePact(int messagePact) {
        return messagePacts.get(messagePact).map(draft -> draft.toPact(List.of(), messagesOf(messagePact)));
    }

    /** Same status codes as {@link #pactHandleWriteFile}. */
    public int writeMessagePactFile(int messagePact, String directory, boolean overwrite) {
        Optional<Pact> snapshot = messagePact(messagePact);
        if (snapshot.isEmpty()) {
            LastError.record("Unknown message pact handle " + messagePact);
            return WRITE_NO_SUCH_PACT;
        }
        return writeFile(snapshot.get(), directory, overwrite);
    }

    public boolean freeMessagePactHandle(int messagePact) {
        for (int message : messages.handles(d -> d.pactHandle() == messagePact)) {
            messages.release(message);
        }
        boolean released = messagePacts.release(messagePact);
        if (!released) {
            LastError.record("Unknown message pact handle " + messagePact);
        }
        return released;
    }

    // ---------------------------------------------------------------- internals

    private record BodyUpdate(Body body, MatchingRuleCategory rules, Map<String, Generator> generators) {}

    private static BodyUpdate bodyUpdate(String contentType, String text) {
        if (text == null) {
            return new BodyUpdate(Body.MISSING, MatchingRuleCategory.empty(MatchingRules.BODY), Map.of());
        }
        String effectiveType = contentType != null ? contentType : ContentTypes.sniff(text);
        if (ContentTypes.isJson(effectiveType)) {
            JsonNode parsed = JsonValues.tryParse(text);
            if (parsed != null) {
                IntegrationJson.Processed processed = IntegrationJson.processBody(parsed);
                return new BodyUpdate(
                        new Body(processed.value(), effectiveType, false), processed.rules(), processed.generators());
            }
            LOG.debug("Body declared as {} is not valid JSON; storing it as text", effectiveType);
        }
        return new BodyUpdate(
                Body.of(text, effectiveType), MatchingRuleCategory.empty(MatchingRules.BODY), Map.of());
    }

    private static Map<String, List<String>> withDefaultContentType(Map<String, List<String>> headers, Body body) {
        if (body.contentType() == null || MultiValues.getIgnoreCase(headers, "Content-Type").isPresent()) {
            return headers;
        }
        return MultiValues.withValue(headers, "Content-Type", 0, body.contentType(), true);
    }

    private static MatchingRules asRules(IntegrationJson.Processed processed) {
        if (processed.rules().isEmpty()) {
            return MatchingRules.EMPTY;
        }
        return MatchingRules.EMPTY.withCategory(processed.rules());
    }

    private static Generators asGenerators(String category, IntegrationJson.Processed processed) {
        if (processed.generators().isEmpty()) {
            return Generators.EMPTY;
        }
        return Generators.EMPTY.withCategory(category, processed.generators());
    }

    private static List<ProviderState> appendState(List<ProviderState> states, String name) {
        List<ProviderState> next = new ArrayList<>(states);
        next.add(ProviderState.of(name));
        return next;
    }

    private static List<ProviderState> withParam(List<ProviderState> states, String name, String key, JsonNode value) {
        List<ProviderState> next = new ArrayList<>(states);
        for (int i = next.size() - 1; i >= 0; i--) {
            if (next.get(i).name().equals(name)) {
                next.set(i, next.get(i).withParam(key, value));
                return next;
            }
        }
        next.add(ProviderState.of(name).withParam(key, value));
        return next;
    }

    private static JsonNode parseParam(String value) {
        if (value == null) {
            return TextNode.valueOf("");
        }
        JsonNode parsed = JsonValues.tryParse(value);
        return parsed != null ? parsed : TextNode.valueOf(value);
    }

    private static Map<String, JsonNode> objectFields(String json) {
        Map<String, JsonNode> fields = new LinkedHashMap<>();
        if (json == null || json.isBlank()) {
            return fields;
        }
        JsonNode node = JsonValues.parse(json);
        if (!node.isObject()) {
            throw new IllegalArgumentException("Provider state parameters must be a JSON object");
        }
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            fields.put(entry.getKey(), entry.getValue());
        }
        return fields;
    }

    private List<Interaction> interactionsOf(int pact) {
        List<Interaction> result = new ArrayList<>();
        for (int handle : interactions.handles(d -> d.pactHandle() == pact)) {
            interactions.read(handle, InteractionDraft::interaction).ifPresent(result::add);
        }
        return result;
    }

    private List<Message> messagesOf(int messagePact) {
        List<Message> result = new ArrayList<>();
        for (int handle : messages.handles(d -> d.pactHandle() == messagePact)) {
            messages.read(handle, MessageDraft::message).ifPresent(result::add);
        }
        return result;
    }

    private ObjectNode pactJson(int pact, Pact snapshot) {
        ObjectNode json = PactWriter.toJson(snapshot);
        if (snapshot.specVersion() != SpecVersion.V4) {
            return json;
        }
        List<Integer> handles = interactions.handles(d -> d.pactHandle() == pact);
        JsonNode written = json.path("interactions");
        for (int i = 0; i < handles.size() && i < written.size(); i++) {
            String testName = interactions.read(handles.get(i), InteractionDraft::testName).orElse(null);
            if (testName != null) {
                ((ObjectNode) written.get(i)).putObject("comments").put("testname", testName);
            }
        }
        return json;
    }

    private static int writeFile(Pact pact, String directory, boolean overwrite) {
        if (directory == null) {
            LastError.record("output directory is required");
            return WRITE_IO_ERROR;
        }
        try {
            PactFiles.write(pact, Path.of(directory), overwrite);
            return WRITE_OK;
        } catch (PactWriteException e) {
            LOG.warn("Failed to write pact {}: {}", pact.fileName(), e.getMessage());
            LastError.record(e);
            return WRITE_IO_ERROR;
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure writing pact {}", pact.fileName(), e);
            LastError.record(e);
            return WRITE_FAULT;
        }
    }

    private boolean mutateInteraction(int handle, UnaryOperator<Interaction> update) {
        return guarded(() -> updateOrRecord(interactions, "interaction", handle, d -> d.map(update)));
    }

    private boolean mutateMessage(int handle, UnaryOperator<Message> update) {
        return guarded(() -> updateOrRecord(messages, "message", handle, d -> d.map(update)));
    }

    private static <T> void releaseDuplicates(
            HandleRegistry<T> registry, String kind, String description, Predicate<T> sameDescription) {
        for (int handle : registry.handles(sameDescription)) {
            LOG.warn("There is an existing {} with description '{}'; it will be replaced", kind, description);
            registry.release(handle);
        }
    }

    private static <T> boolean mutate(HandleRegistry<T> registry, String kind, int handle, UnaryOperator<T> update) {
        return guarded(() -> updateOrRecord(registry, kind, handle, update));
    }

    private static <T> boolean updateOrRecord(HandleRegistry<T> registry, String kind, int handle, UnaryOperator<T> update) {
        if (!registry.update(handle, update)) {
            LastError.record("Unknown " + kind + " handle " + handle);
            return false;
        }
        return true;
    }

    private static boolean guarded(BooleanSupplier action) {
        try {
            return action.getAsBoolean();
        } catch (RuntimeException e) {
            LOG.debug("Handle update refused: {}", e.getMessage());
            LastError.record(e);
            return false;
        }
    }
}
