package me.golemcore.oracle.domain.service;

/**
 * Character-based token estimation shared by every budgeted component.
 */
public final class TokenEstimationSupport {

    private static final int CHARS_PER_TOKEN = 4;

    private TokenEstimationSupport() {
    }

    public static int estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    public static int estimate(String... parts) {
        int total = 0;
        for (String part : parts) {
            total += estimate(part);
        }
        return total;
    }
}
