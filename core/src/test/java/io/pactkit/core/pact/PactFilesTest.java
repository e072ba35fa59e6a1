package io.pactkit.core.pact;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.pactkit.core.error.PactMergeConflictException;
import io.pactkit.core.error.PactWriteException;
import io.pactkit.core.model.Body;
import io.pactkit.core.model.HttpResponse;
import io.pactkit.core.model.Interaction;
import io.pactkit.core.model.JsonValues;
import io.pactkit.core.model.Pact;
import io.pactkit.core.model.ProviderState;
import io.pactkit.core.model.SpecVersion;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for {@link PactFiles}: writing, merging and conflicts. */
class PactFilesTest {

    @TempDir
    Path dir;

    private static Interaction interaction(String description, int id) {
        return Interaction.named(description)
                .withResponse(HttpResponse.defaults().withBody(Body.json(JsonValues.parse("{\"id\":" + id + "}"))));
    }

    private static Pact pact(SpecVersion version, Interaction... interactions) {
        return new Pact("web", "widgets", List.of(interactions), List.of(), Map.of(), version);
    }

    @Test
    void writesToConsumerProviderFile() {
        Path file = PactFiles.write(pact(SpecVersion.V3, interaction("a", 1)), dir, false);

        assertThat(file).isEqualTo(dir.resolve("web-widgets.json"));
        assertThat(PactReader.read(file).interactions()).hasSize(1);
    }

    @Test
    void createsMissingDirectories() {
        Path nested = dir.resolve("build/pacts");

        assertThat(PactFiles.write(pact(SpecVersion.V3, interaction("a", 1)), nested, false)).exists();
    }

    @Test
    void newInteractionsAreAppended() {
        PactFiles.write(pact(SpecVersion.V3, interaction("a", 1)), dir, false);
        Path file = PactFiles.write(pact(SpecVersion.V3, interaction("b", 2)), dir, false);

        assertThat(PactReader.read(file).interactions())
                .extracting(Interaction::description)
                .containsExactly("a", "b");
    }

    @Test
    void identicalInteractionIsKeptOnce() {
        PactFiles.write(pact(SpecVersion.V3, interaction("a", 1)), dir, false);
        Path file = PactFiles.write(pact(SpecVersion.V3, interaction("a", 1)), dir, false);

        assertThat(PactReader.read(file).interactions()).hasSize(1);
    }

    @Test
    void sameDescriptionInDifferentStateIsAnotherInteraction() {
        PactFiles.write(pact(SpecVersion.V3, interaction("a", 1)), dir, false);
        Interaction other = interaction("a", 2).withProviderStates(List.of(ProviderState.of("empty store")));
        Path file = PactFiles.write(pact(SpecVersion.V3, other), dir, false);

        assertThat(PactReader.read(file).interactions()).hasSize(2);
    }

    @Test
    void conflictingInteractionIsRejected() {
        PactFiles.write(pact(SpecVersion.V3, interaction("a", 1)), dir, false);

        assertThatThrownBy(() -> PactFiles.write(pact(SpecVersion.V3, interaction("a", 2)), dir, false))
                .isInstanceOf(PactMergeConflictException.class)
                .hasMessageContaining("interaction 'a' already exists with different content");
    }

    @Test
    void overwriteReplacesTheFile() {
        PactFiles.write(pact(SpecVersion.V3, interaction("a", 1)), dir, false);
        Path file = PactFiles.write(pact(SpecVersion.V3, interaction("a", 2)), dir, true);

        assertThat(PactReader.read(file).interactions()).singleElement()
                .satisfies(i -> assertThat(i.response().body().content().get("id").asInt()).isEqualTo(2));
    }

    @Test
    void mergeUsesTheNewerSpecification() {
        PactFiles.write(pact(SpecVersion.V2, interaction("a", 1)), dir, false);
        Path file = PactFiles.write(pact(SpecVersion.V4, interaction("b", 2)), dir, false);

        assertThat(PactReader.read(file).specVersion()).isEqualTo(SpecVersion.V4);
    }

    @Test
    void unreadableExistingFileIsAWriteError() throws IOException {
        Files.writeString(dir.resolve("web-widgets.json"), "not json", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> PactFiles.write(pact(SpecVersion.V3, interaction("a", 1)), dir, false))
                .isInstanceOf(PactWriteException.class)
                .hasMessageContaining("cannot be merged");
    }
}
