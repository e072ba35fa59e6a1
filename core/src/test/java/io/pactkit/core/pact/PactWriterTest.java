package io.pactkit.core.pact;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.pactkit.core.generators.Generator;
import io.pactkit.core.generators.Generators;
import io.pactkit.core.matchers.MatchingRule;
import io.pactkit.core.matchers.MatchingRules;
import io.pactkit.core.matchers.RuleList;
import io.pactkit.core.model.Body;
import io.pactkit.core.model.HttpRequest;
import io.pactkit.core.model.HttpResponse;
import io.pactkit.core.model.Interaction;
import io.pactkit.core.model.JsonValues;
import io.pactkit.core.model.Message;
import io.pactkit.core.model.Pact;
import io.pactkit.core.model.ProviderState;
import io.pactkit.core.model.SpecVersion;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("PactWriter")
class PactWriterTest {

    private static Interaction widgets() {
        HttpRequest request = HttpRequest.defaults()
                .withPath("/widgets")
                .withQuery(Map.of("tag", List.of("a", "b c")))
                .withHeaders(Map.of("Accept", List.of("application/json", "text/plain")));
        HttpResponse response = HttpResponse.defaults()
                .withHeaders(Map.of("Content-Type", List.of("application/json")))
                .withBody(Body.json(JsonValues.parse("{\"id\":1}")))
                .withMatchingRules(MatchingRules.EMPTY.with(
                        MatchingRules.BODY, "$.id", RuleList.of(new MatchingRule.IntegerType())))
                .withGenerators(Generators.EMPTY.with("body", "$.id", new Generator.RandomInt(1, 9)));
        return Interaction.named("a request for widgets")
                .withProviderStates(List.of(ProviderState.of("widgets exist").withParam("count", IntNode.valueOf(1))))
                .withRequest(request)
                .withResponse(response);
    }

    private static Pact pact(SpecVersion version, List<Interaction> interactions, List<Message> messages) {
        return new Pact("web", "widgets", interactions, messages, Map.of(), version);
    }

    @Nested
    @DisplayName("V2")
    class V2 {

        @Test
        void legacyLayout() {
            var json = PactWriter.toJson(pact(SpecVersion.V2, List.of(widgets()), List.of()));
            var interaction = json.get("interactions").get(0);

            assertThat(interaction.get("providerState").asText()).isEqualTo("widgets exist");
            assertThat(interaction.get("request").get("query").asText()).isEqualTo("tag=a&tag=b+c");
            assertThat(interaction.get("request").get("headers").get("Accept").asText())
                    .isEqualTo("application/json, text/plain");
            assertThat(interaction.get("response").get("matchingRules").has("$.body.id")).isTrue();
            assertThat(interaction.get("response").has("generators")).isFalse();
            assertThat(json.get("metadata").get("pactSpecification").get("version").asText()).isEqualTo("2.0.0");
        }
    }

    @Nested
    @DisplayName("V3")
    class V3 {

        @Test
        void nestedLayout() {
            var json = PactWriter.toJson(pact(SpecVersion.V3, List.of(widgets()), List.of()));
            var interaction = json.get("interactions").get(0);

            assertThat(interaction.get("providerStates").get(0).get("params").get("count").asInt()).isEqualTo(1);
            assertThat(interaction.get("request").get("query").get("tag")).hasSize(2);
            assertThat(interaction.get("response").get("matchingRules").get("body").has("$.id")).isTrue();
            assertThat(interaction.get("response").get("generators").get("body").get("$.id").get("type").asText())
                    .isEqualTo("RandomInt");
            assertThat(json.get("metadata").get("pact-kit").get("version").asText())
                    .isEqualTo(PactWriter.IMPLEMENTATION_VERSION);
        }

        @Test
        void messageOnlyPactWritesMessages() {
            var message = Message.named("an event")
                    .withContents(Body.json(JsonValues.parse("{\"id\":1}")))
                    .withMetadata(Map.of("topic", TextNode.valueOf("orders")));

            var json = PactWriter.toJson(pact(SpecVersion.V3, List.of(), List.of(message)));

            assertThat(json.has("interactions")).isFalse();
            assertThat(json.get("messages").get(0).get("metadata").get("topic").asText()).isEqualTo("orders");
        }

        @Test
        void writtenPactReadsBackEqual() {
            var interaction = widgets().withRequest(
                    widgets().request().withHeaders(Map.of("Accept", List.of("application/json"))));
            var pact = pact(SpecVersion.V3, List.of(interaction), List.of());

            assertThat(PactReader.read(PactWriter.toJsonString(pact)).interactions())
                    .containsExactlyElementsOf(pact.interactions());
        }
    }

    @Nested
    @DisplayName("V4")
    class V4 {

        @Test
        void typedInteractionsAndWrappedBodies() {
            var message = Message.named("an event").withContents(Body.json(JsonValues.parse("{\"id\":1}")));
            var json = PactWriter.toJson(
                    pact(SpecVersion.V4, List.of(widgets().withPending(true)), List.of(message)));
            var interactions = json.get("interactions");

            assertThat(interactions).hasSize(2);
            assertThat(interactions.get(0).get("type").asText()).isEqualTo("Synchronous/HTTP");
            assertThat(interactions.get(0).get("pending").asBoolean()).isTrue();
            assertThat(interactions.get(0).get("request").get("headers").get("Accept")).hasSize(2);
            var body = interactions.get(0).get("response").get("body");
            assertThat(body.get("content")).isEqualTo(JsonValues.parse("{\"id\":1}"));
            assertThat(body.get("contentType").asText()).isEqualTo("application/json");
            assertThat(body.get("encoded").asBoolean()).isFalse();
            assertThat(interactions.get(1).get("type").asText()).isEqualTo("Asynchronous/Messages");
        }

        @Test
        void binaryBodiesAreMarkedEncoded() {
            var interaction = Interaction.named("upload").withRequest(HttpRequest.defaults()
                    .withMethod("POST")
                    .withBody(new Body(TextNode.valueOf("iVBORw0KGgo="), "image/png", true)));

            var json = PactWriter.toJson(pact(SpecVersion.V4, List.of(interaction), List.of()));

            assertThat(json.get("interactions").get(0).get("request").get("body").get("encoded").asText())
                    .isEqualTo("base64");
        }
    }

    @Test
    void queryStringEncodesKeysAndValues() {
        assertThat(PactWriter.queryString(Map.of("q", List.of("a&b")))).isEqualTo("q=a%26b");
    }
}
