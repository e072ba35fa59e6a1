package io.pactkit.verifier.source;

import java.net.URI;
import java.nio.file.Path;
import java.util.Objects;

/** Where pacts to verify come from. */
public sealed interface PactSource {

    /** Short form used in logs and the report. */
    String describe();

    /** A single pact file. */
    record FileSource(Path file) implements PactSource {
        public FileSource {
            Objects.requireNonNull(file, "file must not be null");
        }

        @Override
        public String describe() {
            return "file " + file;
        }
    }

    /** Every {@code *.json} file directly inside a directory, in name order. */
    record DirectorySource(Path directory) implements PactSource {
        public DirectorySource {
            Objects.requireNonNull(directory, "directory must not be null");
        }

        @Override
        public String describe() {
            return "directory " + directory;
        }
    }

    /** A pact document served over HTTP(S). */
    record UrlSource(URI url, Credentials credentials) implements PactSource {
        public UrlSource {
            Objects.requireNonNull(url, "url must not be null");
            credentials = credentials == null ? Credentials.NONE : credentials;
        }

        @Override
        public String describe() {
            return "url " + url;
        }
    }

    /** The latest pacts for a provider, looked up through a pact broker's HAL links. */
    record BrokerSource(URI brokerUrl, String providerName, Credentials credentials) implements PactSource {
        public BrokerSource {
            Objects.requireNonNull(brokerUrl, "brokerUrl must not be null");
            Objects.requireNonNull(providerName, "providerName must not be null");
            credentials = credentials == null ? Credentials.NONE : credentials;
        }

        @Override
        public String describe() {
            return "broker " + brokerUrl + " (provider " + providerName + ")";
        }
    }
}
