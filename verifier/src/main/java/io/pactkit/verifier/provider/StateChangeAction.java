package io.pactkit.verifier.provider;

import java.util.Locale;

/** Phase of a provider-state callback. */
public enum StateChangeAction {
    SETUP,
    TEARDOWN;

    /** Value sent as {@code action} in the callback body. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
