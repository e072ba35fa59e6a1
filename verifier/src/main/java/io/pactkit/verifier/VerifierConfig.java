package io.pactkit.verifier;

import io.pactkit.verifier.provider.ProviderInfo;
import io.pactkit.verifier.source.PactSource;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Everything a verification run needs.
 *
 * @param provider            where the provider listens
 * @param sources             pact sources, verified in order unless {@code parallelism > 1}
 * @param filter              interaction selection
 * @param stateChangeUrl      provider-state callback, or {@code null} to skip state changes
 * @param stateChangeTeardown also call the callback with {@code action=teardown} after each interaction
 * @param parallelism         number of sources verified at once
 */
public record VerifierConfig(
        ProviderInfo provider,
        List<PactSource> sources,
        InteractionFilter filter,
        URI stateChangeUrl,
        boolean stateChangeTeardown,
        int parallelism) {

    public VerifierConfig {
        Objects.requireNonNull(provider, "provider must not be null");
        sources = List.copyOf(sources);
        filter = filter == null ? InteractionFilter.NONE : filter;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private ProviderInfo provider = ProviderInfo.builder().build();
        private final List<PactSource> sources = new ArrayList<>();
        private InteractionFilter filter = InteractionFilter.NONE;
        private URI stateChangeUrl;
        private boolean stateChangeTeardown;
        private int parallelism = 1;

        Builder() {}

        public Builder provider(ProviderInfo provider) {
            this.provider = provider;
            return this;
        }

        public Builder source(PactSource source) {
            this.sources.add(source);
            return this;
        }

        public Builder sources(List<PactSource> sources) {
            this.sources.addAll(sources);
            return this;
        }

        public Builder filter(InteractionFilter filter) {
            this.filter = filter;
            return this;
        }

        public Builder stateChangeUrl(URI stateChangeUrl) {
            this.stateChangeUrl = stateChangeUrl;
            return this;
        }

        public Builder stateChangeTeardown(boolean stateChangeTeardown) {
            this.stateChangeTeardown = stateChangeTeardown;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public VerifierConfig build() {
            if (sources.isEmpty()) {
                throw new IllegalArgumentException("at least one pact source is required");
            }
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
            }
            return new VerifierConfig(provider, sources, filter, stateChangeUrl, stateChangeTeardown, parallelism);
        }
    }
}
