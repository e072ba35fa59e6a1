package io.pactkit.verifier.source;

import com.fasterxml.jackson.databind.JsonNode;
import io.pactkit.core.error.InvalidPactException;
import io.pactkit.core.model.Pact;
import io.pactkit.core.pact.PactReader;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a {@link PactSource} into parsed pacts. Local sources are read
 * directly; URLs and brokers go through a {@link PactFetcher}.
 *
 * <p>
 * Broker lookup follows the HAL link {@code pb:latest-provider-pacts} from
 * the broker root, expands its {@code {provider}} template, then fetches every
 * pact listed under {@code pb:pacts} (or {@code pacts}) in the result.
 */
public final class PactLoader {

    private static final Logger LOG = LoggerFactory.getLogger(PactLoader.class);

    static final String LATEST_PROVIDER_PACTS = "pb:latest-provider-pacts";

    private final PactFetcher fetcher;

    public PactLoader(PactFetcher fetcher) {
        this.fetcher = fetcher;
    }

    /**
     * @throws PactSourceException  if the source cannot be read or holds an invalid pact
     * @throws InterruptedException if interrupted while fetching
     */
    public List<LoadedPact> load(PactSource source) throws PactSourceException, InterruptedException {
        List<LoadedPact> pacts;
        if (source instanceof PactSource.FileSource file) {
            pacts = List.of(readFile(file.file()));
        } else if (source instanceof PactSource.DirectorySource directory) {
            pacts = readDirectory(directory.directory());
        } else if (source instanceof PactSource.UrlSource url) {
            pacts = List.of(parse(url.url().toString(), fetcher.fetch(url.url(), url.credentials())));
        } else if (source instanceof PactSource.BrokerSource broker) {
            pacts = fromBroker(broker);
        } else {
            throw new IllegalArgumentException("Unsupported pact source " + source);
        }
        LOG.info("Loaded {} pact(s) from {}", pacts.size(), source.describe());
        return pacts;
    }

    private static LoadedPact readFile(Path file) throws PactSourceException {
        if (!Files.isRegularFile(file)) {
            throw new PactSourceException("Pact file does not exist: " + file);
        }
        try {
            return new LoadedPact(file.toString(), PactReader.read(file));
        } catch (InvalidPactException e) {
            throw new PactSourceException("Invalid pact file " + file + ": " + e.getMessage(), e);
        }
    }

    private static List<LoadedPact> readDirectory(Path directory) throws PactSourceException {
        if (!Files.isDirectory(directory)) {
            throw new PactSourceException("Pact directory does not exist: " + directory);
        }
        List<Path> files;
        try (Stream<Path> entries = Files.list(directory)) {
            files = entries.filter(p -> p.getFileName().toString().endsWith(".json"))
                    .filter(Files::isRegularFile)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new PactSourceException("Failed to list pact directory " + directory, e);
        }
        List<LoadedPact> pacts = new ArrayList<>();
        for (Path file : files) {
            pacts.add(readFile(file));
        }
        return pacts;
    }

    private List<LoadedPact> fromBroker(PactSource.BrokerSource broker)
            throws PactSourceException, InterruptedException {
        JsonNode root = fetcher.fetch(broker.brokerUrl(), broker.credentials());
        JsonNode template = root.path("_links").path(LATEST_PROVIDER_PACTS).path("href");
        if (!template.isTextual()) {
            throw new PactSourceException(
                    "Pact broker at " + broker.brokerUrl() + " has no '" + LATEST_PROVIDER_PACTS + "' link");
        }
        URI latest = broker.brokerUrl().resolve(template.textValue()
                .replace("{provider}", encodePathSegment(broker.providerName())));

        JsonNode listing;
        try {
            listing = fetcher.fetch(latest, broker.credentials());
        } catch (PactSourceException e) {
            throw new PactSourceException("No pacts for provider '" + broker.providerName()
                    + "' were found in the pact broker: " + e.getMessage(), e);
        }
        JsonNode links = listing.path("_links").has("pb:pacts")
                ? listing.path("_links").path("pb:pacts")
                : listing.path("_links").path("pacts");

        List<LoadedPact> pacts = new ArrayList<>();
        for (JsonNode link : links) {
            String href = link.path("href").asText(null);
            if (href == null) {
                continue;
            }
            URI pactUri = broker.brokerUrl().resolve(href);
            pacts.add(parse(pactUri.toString(), fetcher.fetch(pactUri, broker.credentials())));
        }
        if (pacts.isEmpty()) {
            throw new PactSourceException(
                    "No pacts for provider '" + broker.providerName() + "' were found in the pact broker");
        }
        return pacts;
    }

    private static String encodePathSegment(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static LoadedPact parse(String origin, JsonNode document) throws PactSourceException {
        try {
            Pact pact = PactReader.read(document);
            return new LoadedPact(origin, pact);
        } catch (InvalidPactException e) {
            throw new PactSourceException("Invalid pact from " + origin + ": " + e.getMessage(), e);
        }
    }
}
