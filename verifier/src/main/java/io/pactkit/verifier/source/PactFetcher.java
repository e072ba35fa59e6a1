package io.pactkit.verifier.source;

import com.fasterxml.jackson.databind.JsonNode;
import java.net.URI;

/** Retrieves JSON documents (pacts and broker HAL resources) from remote locations. */
@FunctionalInterface
public interface PactFetcher {

    /**
     * @throws PactSourceException  if the document cannot be fetched or is not JSON
     * @throws InterruptedException if interrupted while waiting
     */
    JsonNode fetch(URI uri, Credentials credentials) throws PactSourceException, InterruptedException;
}
