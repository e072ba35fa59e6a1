package io.pactkit.core.error;

/**
 * Per-thread record of the last error swallowed by an API facade. Facades that report failure as a
 * boolean or a status code store the message here so the caller can fetch it afterwards.
 */
public final class LastError {

    private static final ThreadLocal<String> LAST = new ThreadLocal<>();

    private LastError() {
        // utility class
    }

    /** Records the message of {@code error} as the calling thread's last error. */
    public static void record(Throwable error) {
        LAST.set(error.getMessage() != null ? error.getMessage() : error.getClass().getName());
    }

    /** Records a plain message as the calling thread's last error. */
    public static void record(String message) {
        LAST.set(message);
    }

    /** Returns the calling thread's last error message, or {@code null} if there is none. */
    public static String get() {
        return LAST.get();
    }

    /** Forgets the calling thread's last error. */
    public static void clear() {
        LAST.remove();
    }
}
