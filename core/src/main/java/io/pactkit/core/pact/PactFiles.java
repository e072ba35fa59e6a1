package io.pactkit.core.pact;

import com.fasterxml.jackson.databind.JsonNode;
import io.pactkit.core.error.InvalidPactException;
import io.pactkit.core.error.PactMergeConflictException;
import io.pactkit.core.error.PactWriteException;
import io.pactkit.core.model.Interaction;
import io.pactkit.core.model.JsonValues;
import io.pactkit.core.model.Message;
import io.pactkit.core.model.Pact;
import io.pactkit.core.model.ProviderState;
import io.pactkit.core.model.SpecVersion;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes pact files to disk, merging with an existing file for the same consumer and provider
 * unless asked to overwrite.
 *
 * <p>Interactions are keyed by description and provider states. Re-registering an identical
 * interaction is a no-op; the same key with different content is a
 * {@link PactMergeConflictException}. Writes in one JVM are serialised.
 */
public final class PactFiles {

    private static final Logger LOG = LoggerFactory.getLogger(PactFiles.class);

    private static final Object WRITE_LOCK = new Object();

    private PactFiles() {}

    /**
     * Writes {@code pact} to {@code <dir>/<consumer>-<provider>.json}.
     *
     * @param overwrite replace an existing file instead of merging with it
     * @return the file written
     * @throws PactMergeConflictException if merging finds a conflicting interaction
     * @throws PactWriteException         if the file cannot be read or written
     */
    public static Path write(Pact pact, Path dir, boolean overwrite) {
        Path file = dir.resolve(pact.fileName());
        synchronized (WRITE_LOCK) {
            Pact toWrite = pact;
            if (!overwrite && Files.exists(file)) {
                Pact existing;
                try {
                    existing = PactReader.read(file);
                } catch (InvalidPactException e) {
                    throw new PactWriteException("Existing pact file " + file + " cannot be merged: " + e.getMessage(), e);
                }
                toWrite = merge(existing, pact, file.toString());
            }
            try {
                Files.createDirectories(dir);
                Files.writeString(file, PactWriter.toJsonString(toWrite), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new PactWriteException("Failed to write pact file " + file + ": " + e.getMessage(), e);
            }
            LOG.info("Wrote pact file {} ({} interactions, {} messages, overwrite={})",
                    file, toWrite.interactions().size(), toWrite.messages().size(), overwrite);
            return file;
        }
    }

    /**
     * Merges {@code incoming} into {@code existing}. The result keeps the existing order, appends
     * new interactions, and uses the newer of the two specification versions.
     */
    public static Pact merge(Pact existing, Pact incoming, String fileName) {
        SpecVersion version = incoming.specVersion().compareTo(existing.specVersion()) >= 0
                ? incoming.specVersion()
                : existing.specVersion();
        List<Interaction> interactions = mergeList(
                existing.interactions(), incoming.interactions(),
                i -> key(i.description(), i.providerStates()),
                (i, v) -> PactWriter.interactionJson(i, v), Interaction::description, version, fileName);
        List<Message> messages = mergeList(
                existing.messages(), incoming.messages(),
                m -> key(m.description(), m.providerStates()),
                (m, v) -> PactWriter.messageJson(m, v), Message::description, version, fileName);
        return new Pact(incoming.consumer(), incoming.provider(), interactions, messages, incoming.metadata(), version);
    }

    private static <T> List<T> mergeList(
            List<T> existing,
            List<T> incoming,
            Function<T, String> keyOf,
            BiFunction<T, SpecVersion, JsonNode> jsonOf,
            Function<T, String> descriptionOf,
            SpecVersion version,
            String fileName) {
        List<T> merged = new ArrayList<>(existing);
        for (T candidate : incoming) {
            String key = keyOf.apply(candidate);
            T match = null;
            for (T current : existing) {
                if (keyOf.apply(current).equals(key)) {
                    match = current;
                    break;
                }
            }
            if (match == null) {
                merged.add(candidate);
            } else if (!Objects.equals(jsonOf.apply(match, version), jsonOf.apply(candidate, version))) {
                throw new PactMergeConflictException(descriptionOf.apply(candidate), fileName);
            }
        }
        return merged;
    }

    private static String key(String description, List<ProviderState> states) {
        StringBuilder key = new StringBuilder(description);
        for (ProviderState state : states) {
            key.append('\u0000').append(state.name()).append(JsonValues.write(JsonValues.MAPPER.valueToTree(state.params())));
        }
        return key.toString();
    }
}
