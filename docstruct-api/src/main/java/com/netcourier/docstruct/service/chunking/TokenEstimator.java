package com.netcourier.docstruct.service.chunking;

/**
 * Character based token estimate: one token per four characters, rounded up.
 */
public final class TokenEstimator {

    static final int CHARS_PER_TOKEN = 4;

    private TokenEstimator() {
    }

    public static int estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return Math.max(1, (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN);
    }

    public static int maxCharsFor(int tokens) {
        return tokens * CHARS_PER_TOKEN;
    }
}
