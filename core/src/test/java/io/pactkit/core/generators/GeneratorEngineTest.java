package io.pactkit.core.generators;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.pactkit.core.matchers.MatchingRuleCategory;
import io.pactkit.core.model.Body;
import io.pactkit.core.model.HttpRequest;
import io.pactkit.core.model.HttpResponse;
import io.pactkit.core.model.JsonValues;
import io.pactkit.core.model.Message;
import io.pactkit.core.model.ProviderState;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("GeneratorEngine")
class GeneratorEngineTest {

    private static GenerationContext seeded() {
        return new GenerationContext(null, Map.of(), new Random(42));
    }

    @Nested
    @DisplayName("single generators")
    class Single {

        @Test
        void seededRandomIsDeterministic() {
            var generator = new Generator.RandomString(12);

            var first = GeneratorEngine.generate(generator, TextNode.valueOf(""), seeded());
            var second = GeneratorEngine.generate(generator, TextNode.valueOf(""), seeded());

            assertThat(first).isEqualTo(second);
            assertThat(first.asText()).hasSize(12).matches("[A-Za-z0-9]+");
        }

        @Test
        void randomIntStaysInRange() {
            var context = seeded();
            for (int i = 0; i < 100; i++) {
                assertThat(GeneratorEngine.generate(new Generator.RandomInt(3, 7), IntNode.valueOf(0), context).asInt())
                        .isBetween(3, 7);
            }
        }

        @Test
        void randomDecimalHasTheRequestedDigits() {
            var value = GeneratorEngine.generate(new Generator.RandomDecimal(6), IntNode.valueOf(0), seeded());

            assertThat(value.isBigDecimal()).isTrue();
            assertThat(value.asText().replace(".", "")).hasSize(6);
        }

        @Test
        void uuidFormats() {
            assertThat(GeneratorEngine.generate(new Generator.Uuid(Generator.UuidFormat.SIMPLE), null, seeded())
                            .asText())
                    .matches("[0-9a-f]{32}");
            assertThat(GeneratorEngine.generate(new Generator.Uuid(Generator.UuidFormat.URN), null, seeded())
                            .asText())
                    .startsWith("urn:uuid:");
        }

        @Test
        void regexValueMatchesItsPattern() {
            var value = GeneratorEngine.generate(new Generator.Regex("[A-Z]{3}-\\d{4}"), TextNode.valueOf(""), seeded());

            assertThat(value.asText()).matches("[A-Z]{3}-\\d{4}");
        }

        @Test
        void missingProviderStateParameterKeepsTheExample() {
            var value = GeneratorEngine.generate(
                    new Generator.ProviderState("${id}", Generator.DataType.RAW), TextNode.valueOf("example"), seeded());

            assertThat(value).isEqualTo(TextNode.valueOf("example"));
        }

        @Test
        void providerStateValueIsConverted() {
            var context = GeneratorEngine.withProviderStates(
                    seeded(), List.of(ProviderState.of("a widget exists").withParam("id", TextNode.valueOf("42"))));

            var value = GeneratorEngine.generate(
                    new Generator.ProviderState("${id}", Generator.DataType.INTEGER), IntNode.valueOf(0), context);

            assertThat(value.isIntegralNumber()).isTrue();
            assertThat(value.asLong()).isEqualTo(42L);
        }

        @Test
        void laterProviderStatesOverrideEarlierOnes() {
            var context = GeneratorEngine.withProviderStates(seeded(), List.of(
                    ProviderState.of("first").withParam("id", IntNode.valueOf(1)),
                    ProviderState.of("second").withParam("id", IntNode.valueOf(2))));

            assertThat(context.providerStateParams()).containsEntry("id", IntNode.valueOf(2));
        }

        @Test
        void mockServerUrlIsRewritten() {
            var generator = new Generator.MockServerUrl("http://example.com/widgets/1", ".*(/widgets/\\d+)$");

            assertThat(GeneratorEngine.generate(
                            generator, TextNode.valueOf("x"), seeded().withMockServerUrl("http://127.0.0.1:1234/"))
                    .asText())
                    .isEqualTo("http://127.0.0.1:1234/widgets/1");
            assertThat(GeneratorEngine.generate(generator, TextNode.valueOf("x"), seeded()))
                    .isEqualTo(TextNode.valueOf("x"));
        }
    }

    @Nested
    @DisplayName("documents")
    class Documents {

        @Test
        void bodyGeneratorsApplyAtEveryMatchingPath() {
            var body = JsonValues.parse("{\"items\":[{\"id\":0},{\"id\":0}],\"total\":2}");

            var result = GeneratorEngine.applyToBody(
                    body, Map.of("$.items[*].id", new Generator.RandomInt(100, 100)), seeded());

            assertThat(result).isEqualTo(JsonValues.parse("{\"items\":[{\"id\":100},{\"id\":100}],\"total\":2}"));
            assertThat(body.get("items").get(0).get("id").asInt()).isZero();
        }

        @Test
        void rootGeneratorReplacesTheWholeBody() {
            var result = GeneratorEngine.applyToBody(
                    JsonValues.parse("1"), Map.of("$", new Generator.RandomInt(5, 5)), seeded());

            assertThat(result).isEqualTo(IntNode.valueOf(5));
        }

        @Test
        void responseStatusHeadersAndBody() {
            var generators = Generators.EMPTY
                    .with("status", MatchingRuleCategory.SINGLE_KEY, new Generator.RandomInt(201, 201))
                    .with("header", "X-Id", new Generator.Regex("[0-9]{3}"))
                    .with("body", "$.id", new Generator.RandomInt(9, 9));
            var response = HttpResponse.defaults()
                    .withHeaders(Map.of("x-id", List.of("000")))
                    .withBody(Body.json(JsonValues.parse("{\"id\":1}")))
                    .withGenerators(generators);

            var result = GeneratorEngine.applyToResponse(response, seeded());

            assertThat(result.status()).isEqualTo(201);
            assertThat(result.header("X-Id")).hasValueSatisfying(values ->
                    assertThat(values).singleElement().asString().matches("[0-9]{3}"));
            assertThat(result.body().content()).isEqualTo(JsonValues.parse("{\"id\":9}"));
        }

        @Test
        void requestPathFromProviderState() {
            var request = HttpRequest.defaults()
                    .withPath("/widgets/1")
                    .withGenerators(Generators.EMPTY.with("path", MatchingRuleCategory.SINGLE_KEY,
                            new Generator.ProviderState("/widgets/${id}", Generator.DataType.STRING)));
            var context = seeded().withProviderStateParams(Map.of("id", IntNode.valueOf(7)));

            assertThat(GeneratorEngine.applyToRequest(request, context).path()).isEqualTo("/widgets/7");
        }

        @Test
        void messageMetadataAndContents() {
            var message = Message.named("an event")
                    .withContents(Body.json(JsonValues.parse("{\"seq\":0}")))
                    .withMetadata(Map.of("partition", IntNode.valueOf(0)))
                    .withGenerators(Generators.EMPTY
                            .with("metadata", "partition", new Generator.RandomInt(3, 3))
                            .with("body", "$.seq", new Generator.RandomInt(8, 8)));

            var result = GeneratorEngine.applyToMessage(message, seeded());

            assertThat(result.metadata()).containsEntry("partition", IntNode.valueOf(3));
            assertThat(result.contents().content()).isEqualTo(JsonValues.parse("{\"seq\":8}"));
        }
    }
}
