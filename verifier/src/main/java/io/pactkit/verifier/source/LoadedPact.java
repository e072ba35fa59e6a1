package io.pactkit.verifier.source;

import io.pactkit.core.model.Pact;

/**
 * A pact read from a source.
 *
 * @param origin file path or URL the pact was read from
 * @param pact   the parsed pact
 */
public record LoadedPact(String origin, Pact pact) {}
