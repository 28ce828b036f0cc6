package com.tzbucket.zone;

import com.tzbucket.exception.InvalidTimezoneException;
import com.tzbucket.exception.ResolutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.zone.ZoneOffsetTransition;
import java.time.zone.ZoneRules;
import java.util.List;
import java.util.Set;

/**
 * Thin adapter over the JDK's bundled IANA timezone database ({@code java.time.zone}).
 *
 * <p>Holds no mutable state; the rule data is loaded once by the JDK and is safe to
 * share across threads.
 */
public class TimeZoneProvider {

    private static final Logger log = LoggerFactory.getLogger(TimeZoneProvider.class);

    private static final DateTimeFormatter OFFSET_FORMAT =
        DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ssxxx");
    private static final DateTimeFormatter UTC_FORMAT =
        DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    private final Set<String> availableZoneIds = ZoneId.getAvailableZoneIds();

    /**
     * Resolves an IANA zone name such as {@code Europe/Berlin}.
     * Raw offsets ({@code +01:00}) are not zone names and are rejected.
     *
     * @throws InvalidTimezoneException if the name is unknown
     */
    public ZoneId parseZone(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidTimezoneException(String.valueOf(name));
        }
        String trimmed = name.trim();
        if (!availableZoneIds.contains(trimmed)) {
            throw new InvalidTimezoneException(trimmed);
        }
        try {
            return ZoneId.of(trimmed);
        } catch (DateTimeException e) {
            throw new InvalidTimezoneException(trimmed, e);
        }
    }

    /**
     * Converts a UTC instant to the local wall-clock of {@code zone}.
     *
     * @throws ResolutionException if the instant is outside the supported date range
     */
    public ZonedDateTime toLocal(Instant instant, ZoneId zone) {
        try {
            return ZonedDateTime.ofInstant(instant, zone);
        } catch (DateTimeException e) {
            throw new ResolutionException("Instant out of range for local conversion: " + instant, e);
        }
    }

    /**
     * Maps a local wall-clock time to its UTC candidates.
     *
     * @return unique instant, both instants of an overlap, or the gap transition
     */
    public LocalMapping toUtcCandidates(LocalDateTime local, ZoneId zone) {
        ZoneRules rules = zone.getRules();
        List<ZoneOffset> offsets = rules.getValidOffsets(local);

        switch (offsets.size()) {
            case 1:
                return new LocalMapping.Unique(local, ZonedDateTime.ofStrict(local, offsets.get(0), zone));
            case 2: {
                ZonedDateTime first = ZonedDateTime.ofStrict(local, offsets.get(0), zone);
                ZonedDateTime second = ZonedDateTime.ofStrict(local, offsets.get(1), zone);
                return first.toInstant().isBefore(second.toInstant())
                    ? new LocalMapping.Ambiguous(local, first, second)
                    : new LocalMapping.Ambiguous(local, second, first);
            }
            default:
                return new LocalMapping.Nonexistent(local, rules.getTransition(local));
        }
    }

    /**
     * Resolves local midnight of {@code date} to UTC.
     *
     * <p>Takes the earliest valid instant at or after midnight: the earlier occurrence
     * if midnight is repeated, or the transition instant if midnight falls in a gap
     * (the day then starts at the first wall-clock time after the jump).
     */
    public Instant localMidnightToUtc(LocalDate date, ZoneId zone) {
        LocalDateTime midnight = date.atStartOfDay();
        LocalMapping mapping = toUtcCandidates(midnight, zone);

        return switch (mapping.kind()) {
            case UNIQUE, AMBIGUOUS -> mapping.earliest()
                .map(ZonedDateTime::toInstant)
                .orElseThrow(() -> new ResolutionException("Could not resolve local midnight for date " + date));
            case NONEXISTENT -> {
                ZoneOffsetTransition transition = ((LocalMapping.Nonexistent) mapping).transition();
                if (transition == null) {
                    throw new ResolutionException("Could not resolve local midnight for date " + date);
                }
                log.debug("Local midnight {} skipped in {}, day starts at transition {}",
                    date, zone, transition.getInstant());
                yield transition.getInstant();
            }
        };
    }

    /** Formats a zoned time as {@code 2026-03-29T00:00:00+01:00} (zero offset renders as {@code +00:00}). */
    public static String formatWithOffset(ZonedDateTime dateTime) {
        return dateTime.format(OFFSET_FORMAT);
    }

    /** Formats an instant as {@code 2026-03-28T23:00:00Z}, truncated to whole seconds. */
    public static String formatUtc(Instant instant) {
        return UTC_FORMAT.format(instant);
    }
}
