package com.examparse.common.util;

/**
 * Approximate token count for log lines about request size. Korean text runs at
 * roughly 2.5 characters per token.
 */
public final class TokenCounter {

    private static final double CHARS_PER_TOKEN = 2.5;

    private TokenCounter() {}

    public static int countTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
    }
}
