package io.pactkit.core.model;

import java.util.Locale;

/** Pact specification versions understood by the reader and writer. */
public enum SpecVersion {
    V1("1.0.0"),
    V1_1("1.1.0"),
    V2("2.0.0"),
    V3("3.0.0"),
    V4("4.0");

    private final String label;

    SpecVersion(String label) {
        this.label = label;
    }

    /** Version string written to {@code metadata.pactSpecification.version}. */
    public String label() {
        return label;
    }

    /** True if this version writes matching rules nested by category. */
    public boolean nestedRules() {
        return ordinal() >= V3.ordinal();
    }

    /**
     * Parses a version label such as {@code 3.0.0}, {@code v4} or {@code V1_1}.
     *
     * @throws IllegalArgumentException for an unknown version
     */
    public static SpecVersion parse(String value) {
        String v = value.trim().toLowerCase(Locale.ROOT).replace('_', '.');
        if (v.startsWith("v")) {
            v = v.substring(1);
        }
        if (v.startsWith("1.1")) {
            return V1_1;
        }
        if (v.startsWith("1")) {
            return V1;
        }
        if (v.startsWith("2")) {
            return V2;
        }
        if (v.startsWith("3")) {
            return V3;
        }
        if (v.startsWith("4")) {
            return V4;
        }
        throw new IllegalArgumentException("Unknown pact specification version: " + value);
    }
}
