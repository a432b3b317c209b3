package com.batchinsight.util;

import javax.annotation.Nonnull;

/**
 * Null-safe string helpers for span names, metric tags and stored error messages.
 */
public final class Strings {

    private Strings() {
        // Utility class
    }

    /**
     * Returns "unknown" for null or blank input.
     */
    @Nonnull
    public static String safe(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        return value;
    }

    /**
     * Shortens {@code value} to at most {@code maxLength} characters, marking the cut with "...".
     */
    public static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        if (maxLength <= 3) {
            return value.substring(0, maxLength);
        }
        return value.substring(0, maxLength - 3) + "...";
    }

    /**
     * Message of a throwable, falling back to its class name when the message is empty.
     */
    @Nonnull
    public static String describe(Throwable t) {
        if (t == null) {
            return "unknown";
        }
        String message = t.getMessage();
        if (message == null || message.isBlank()) {
            return t.getClass().getSimpleName();
        }
        return message;
    }
}
