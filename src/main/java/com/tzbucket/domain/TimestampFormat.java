package com.tzbucket.domain;

import java.util.Locale;

/**
 * Input encodings accepted for timestamps.
 */
public enum TimestampFormat {

    /** Unix epoch milliseconds, e.g. {@code 1793362500000}. */
    EPOCH_MS("epoch_ms"),

    /** Unix epoch seconds, e.g. {@code 1793362500}. */
    EPOCH_S("epoch_s"),

    /** RFC 3339 with a mandatory offset, e.g. {@code 2026-03-29T00:15:00Z}. */
    RFC3339("rfc3339"),

    /** Heuristic detection between the three formats above. */
    AUTO("auto");

    private final String wireName;

    TimestampFormat(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static TimestampFormat fromString(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (TimestampFormat format : values()) {
            if (format.wireName.equals(normalized)) {
                return format;
            }
        }
        throw new IllegalArgumentException(
            String.format("Invalid format '%s'. Expected: epoch_ms, epoch_s, rfc3339, auto", value));
    }

    @Override
    public String toString() {
        return wireName;
    }
}
