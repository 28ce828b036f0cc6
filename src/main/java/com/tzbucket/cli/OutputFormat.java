package com.tzbucket.cli;

import java.util.Locale;

/**
 * Rendering mode for command output and error envelopes.
 */
public enum OutputFormat {

    JSON,
    TEXT;

    /**
     * Strict parse of the {@code --output-format} value.
     *
     * @throws IllegalArgumentException for anything other than json or text
     */
    public static OutputFormat fromString(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "json" -> JSON;
            case "text" -> TEXT;
            default -> throw new IllegalArgumentException(
                String.format("Invalid output_format '%s'. Expected: json, text", value));
        };
    }

    /**
     * Lenient variant used to render errors, including an invalid {@code --output-format} itself.
     */
    public static OutputFormat hint(String value) {
        return value != null && value.trim().equalsIgnoreCase("json") ? JSON : TEXT;
    }
}
