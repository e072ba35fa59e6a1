package io.pactkit.core.error;

/**
 * Thrown when merging into an existing pact file finds an interaction with the same description
 * and provider states but different content.
 */
public final class PactMergeConflictException extends PactWriteException {

    private static final long serialVersionUID = 1L;

    private final String description;

    public PactMergeConflictException(String description, String file) {
        super(String.format(
                "Cannot merge pact file '%s': interaction '%s' already exists with different content",
                file, description));
        this.description = description;
    }

    /** Description of the conflicting interaction. */
    public String description() {
        return description;
    }
}
