package com.tzbucket.parse;

import com.tzbucket.domain.TimestampFormat;
import com.tzbucket.exception.TimestampParseException;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;

/**
 * Converts timestamp text into UTC instants.
 *
 * <p>All inputs are trimmed before evaluation. Numeric inputs outside the representable
 * range are reported as {@link TimestampParseException}, never as arithmetic failures.
 *
 * <p>Auto-detection is a heuristic: integers above {@value #AUTO_MILLIS_THRESHOLD} are read
 * as milliseconds, everything else as seconds. Values near that threshold and negative
 * (pre-1970) epochs can be misclassified; pass an explicit format for those.
 */
public class TimestampParser {

    /** Integers strictly greater than this are treated as milliseconds by {@link #parseAuto}. */
    public static final long AUTO_MILLIS_THRESHOLD = 10_000_000_000L;

    /**
     * RFC 3339 date-time: seconds required, fraction optional, {@code Z} or {@code +HH:MM} offset.
     * Case-insensitive so {@code t} and {@code z} are accepted; a space separator is normalized first.
     */
    private static final DateTimeFormatter RFC3339_FORMAT = new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .appendLiteral('T')
        .appendValue(ChronoField.HOUR_OF_DAY, 2)
        .appendLiteral(':')
        .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
        .appendLiteral(':')
        .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
        .optionalStart()
        .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
        .optionalEnd()
        .appendOffset("+HH:MM", "Z")
        .toFormatter()
        .withResolverStyle(ResolverStyle.STRICT)
        .withChronology(IsoChronology.INSTANCE);

    private static final DateTimeFormatter LOCAL_FORMAT =
        DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm[:ss]").withResolverStyle(ResolverStyle.STRICT);

    private static final int DATE_TIME_SEPARATOR_INDEX = 10;

    /**
     * Parses {@code input} according to {@code format}.
     *
     * @throws TimestampParseException if the text does not match the format or is out of range
     */
    public Instant parse(String input, TimestampFormat format) {
        String trimmed = input == null ? "" : input.trim();

        return switch (format) {
            case EPOCH_MS -> parseEpochMillis(trimmed);
            case EPOCH_S -> parseEpochSeconds(trimmed);
            case RFC3339 -> parseRfc3339(trimmed);
            case AUTO -> parseAuto(trimmed);
        };
    }

    /**
     * Parses with format detection: RFC 3339 when the text contains {@code T}, {@code Z},
     * {@code +} or a {@code -} where an offset suffix would start; otherwise an integer,
     * milliseconds above {@link #AUTO_MILLIS_THRESHOLD} and seconds below it.
     */
    public Instant parseAuto(String input) {
        String trimmed = input == null ? "" : input.trim();

        if (looksLikeRfc3339(trimmed)) {
            return parseRfc3339(trimmed);
        }

        long value;
        try {
            value = Long.parseLong(trimmed);
        } catch (NumberFormatException e) {
            throw new TimestampParseException(trimmed,
                String.format("Could not auto-detect format for: '%s'", trimmed), e);
        }
        return value > AUTO_MILLIS_THRESHOLD ? parseEpochMillis(trimmed) : parseEpochSeconds(trimmed);
    }

    /**
     * Parses a local wall-clock time without offset. Accepted shapes:
     * {@code YYYY-MM-DDTHH:MM:SS}, {@code YYYY-MM-DD HH:MM:SS}, {@code YYYY-MM-DDTHH:MM},
     * {@code YYYY-MM-DD HH:MM}.
     */
    public LocalDateTime parseLocalTime(String input) {
        String trimmed = input == null ? "" : input.trim();

        try {
            return LocalDateTime.parse(normalizeSeparator(trimmed), LOCAL_FORMAT);
        } catch (DateTimeParseException e) {
            throw new TimestampParseException(trimmed, String.format(
                "Invalid local time format '%s'. Expected: YYYY-MM-DDTHH:MM:SS", trimmed), e);
        }
    }

    private Instant parseEpochMillis(String input) {
        long millis;
        try {
            millis = Long.parseLong(input);
        } catch (NumberFormatException e) {
            throw new TimestampParseException(input, String.format(
                "Invalid epoch milliseconds: '%s'. Expected integer value.", input), e);
        }
        return Instant.ofEpochMilli(millis);
    }

    private Instant parseEpochSeconds(String input) {
        long seconds;
        try {
            seconds = Long.parseLong(input);
        } catch (NumberFormatException e) {
            throw new TimestampParseException(input, String.format(
                "Invalid epoch seconds: '%s'. Expected integer value.", input), e);
        }
        try {
            // results must stay expressible in epoch milliseconds
            Math.multiplyExact(seconds, 1000L);
            return Instant.ofEpochSecond(seconds);
        } catch (ArithmeticException | DateTimeException e) {
            throw new TimestampParseException(input, "Epoch seconds out of range: " + seconds, e);
        }
    }

    private Instant parseRfc3339(String input) {
        Instant instant;
        try {
            instant = OffsetDateTime.parse(normalizeSeparator(input), RFC3339_FORMAT).toInstant();
        } catch (DateTimeParseException e) {
            throw new TimestampParseException(input, String.format(
                "Invalid RFC3339 timestamp: '%s'. Error: %s", input, e.getMessage()), e);
        }
        try {
            instant.toEpochMilli();
        } catch (ArithmeticException e) {
            throw new TimestampParseException(input, "RFC3339 timestamp out of range: " + input, e);
        }
        return instant;
    }

    /** Replaces a space between date and time with {@code T}. */
    private static String normalizeSeparator(String text) {
        if (text.length() > DATE_TIME_SEPARATOR_INDEX && text.charAt(DATE_TIME_SEPARATOR_INDEX) == ' ') {
            return text.substring(0, DATE_TIME_SEPARATOR_INDEX) + 'T' + text.substring(DATE_TIME_SEPARATOR_INDEX + 1);
        }
        return text;
    }

    private static boolean looksLikeRfc3339(String text) {
        if (text.indexOf('T') >= 0 || text.indexOf('t') >= 0 || text.indexOf('Z') >= 0
            || text.indexOf('z') >= 0 || text.indexOf('+') >= 0) {
            return true;
        }
        return text.length() > 6 && text.charAt(text.length() - 6) == '-';
    }
}
