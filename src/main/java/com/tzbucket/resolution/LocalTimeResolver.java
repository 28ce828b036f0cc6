package com.tzbucket.resolution;

import com.tzbucket.domain.AmbiguousPolicy;
import com.tzbucket.domain.ExplainResult;
import com.tzbucket.domain.LocalTimeStatus;
import com.tzbucket.domain.NonexistentPolicy;
import com.tzbucket.exception.PolicyException;
import com.tzbucket.exception.ResolutionException;
import com.tzbucket.zone.LocalMapping;
import com.tzbucket.zone.TimeZoneProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Classifies a local wall-clock time as normal, ambiguous or nonexistent and applies
 * the configured policy to pick a concrete instant.
 *
 * <p>Shift-forward runs a bounded second-by-second search on both sides of the gap, so it
 * handles irregular historical transitions as well as the usual one hour jump.
 */
public class LocalTimeResolver {

    private static final Logger log = LoggerFactory.getLogger(LocalTimeResolver.class);

    /** Default search bound: two days of wall-clock seconds. */
    public static final int DEFAULT_SEARCH_BOUND_SECONDS = 2 * 24 * 60 * 60;

    private static final DateTimeFormatter LOCAL_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss");

    private final TimeZoneProvider timeZoneProvider;
    private final int searchBoundSeconds;

    public LocalTimeResolver(TimeZoneProvider timeZoneProvider, int searchBoundSeconds) {
        if (searchBoundSeconds <= 0) {
            throw new IllegalArgumentException("Search bound must be positive: " + searchBoundSeconds);
        }
        this.timeZoneProvider = timeZoneProvider;
        this.searchBoundSeconds = searchBoundSeconds;
    }

    public LocalTimeResolver(TimeZoneProvider timeZoneProvider) {
        this(timeZoneProvider, DEFAULT_SEARCH_BOUND_SECONDS);
    }

    /**
     * Explains and resolves {@code local} in {@code zone}.
     *
     * @throws PolicyException if the time is ambiguous or nonexistent and the matching policy is {@code error}
     * @throws ResolutionException if shift-forward finds no valid time within the search bound
     */
    public ExplainResult explain(LocalDateTime local, ZoneId zone,
                                 NonexistentPolicy nonexistentPolicy, AmbiguousPolicy ambiguousPolicy) {
        LocalMapping mapping = timeZoneProvider.toUtcCandidates(local, zone);
        String localText = local.format(LOCAL_FORMAT);

        return switch (mapping.kind()) {
            case UNIQUE -> new ExplainResult(localText, zone.getId(), LocalTimeStatus.NORMAL, null);
            case AMBIGUOUS -> new ExplainResult(localText, zone.getId(), LocalTimeStatus.AMBIGUOUS,
                resolveAmbiguous((LocalMapping.Ambiguous) mapping, localText, zone, ambiguousPolicy));
            case NONEXISTENT -> new ExplainResult(localText, zone.getId(), LocalTimeStatus.NONEXISTENT,
                resolveNonexistent(local, localText, zone, nonexistentPolicy));
        };
    }

    private ExplainResult.Resolution resolveAmbiguous(LocalMapping.Ambiguous mapping, String localText,
                                                      ZoneId zone, AmbiguousPolicy policy) {
        return switch (policy) {
            case ERROR -> throw new PolicyException(String.format(
                "Ambiguous time '%s' in timezone '%s'. Occurs twice due to DST fall back. "
                    + "Use --policy-ambiguous=first or --policy-ambiguous=second to resolve.",
                localText, zone.getId()), LocalTimeStatus.AMBIGUOUS);
            case FIRST -> new ExplainResult.Resolution(policy.wireName(),
                TimeZoneProvider.formatWithOffset(mapping.earlier()));
            case SECOND -> new ExplainResult.Resolution(policy.wireName(),
                TimeZoneProvider.formatWithOffset(mapping.later()));
        };
    }

    private ExplainResult.Resolution resolveNonexistent(LocalDateTime local, String localText,
                                                        ZoneId zone, NonexistentPolicy policy) {
        return switch (policy) {
            case ERROR -> throw new PolicyException(String.format(
                "Nonexistent time '%s' in timezone '%s'. Skipped due to DST spring forward. "
                    + "Use --policy-nonexistent=shift_forward to resolve.",
                localText, zone.getId()), LocalTimeStatus.NONEXISTENT);
            case SHIFT_FORWARD -> new ExplainResult.Resolution(policy.wireName(),
                TimeZoneProvider.formatWithOffset(shiftForward(local, zone)));
        };
    }

    /**
     * Moves a skipped local time forward by the width of the gap that contains it.
     *
     * @throws ResolutionException if no valid local time lies within the search bound on either side
     */
    public ZonedDateTime shiftForward(LocalDateTime local, ZoneId zone) {
        ZonedDateTime previous = findPreviousValid(local, zone).orElseThrow(() -> new ResolutionException(
            String.format("No valid local time within %d seconds before '%s' in %s", searchBoundSeconds, local, zone)));
        ZonedDateTime next = findNextValid(local, zone).orElseThrow(() -> new ResolutionException(
            String.format("No valid local time within %d seconds after '%s' in %s", searchBoundSeconds, local, zone)));

        Duration gap = Duration.between(previous.toLocalDateTime(), next.toLocalDateTime()).minusSeconds(1);
        LocalDateTime shifted = local.plus(gap);
        LocalMapping shiftedMapping = timeZoneProvider.toUtcCandidates(shifted, zone);

        log.debug("Shifting nonexistent {} in {} by gap {} (previous={}, next={})", local, zone, gap, previous, next);

        return shiftedMapping.single()
            .or(shiftedMapping::earliest)
            .orElse(next);
    }

    /** Latest resolvable local time strictly before {@code local}, preferring the later of two candidates. */
    Optional<ZonedDateTime> findPreviousValid(LocalDateTime local, ZoneId zone) {
        for (int seconds = 1; seconds <= searchBoundSeconds; seconds++) {
            Optional<ZonedDateTime> candidate = timeZoneProvider.toUtcCandidates(local.minusSeconds(seconds), zone).latest();
            if (candidate.isPresent()) {
                return candidate;
            }
        }
        return Optional.empty();
    }

    /** Earliest resolvable local time strictly after {@code local}, preferring the earlier of two candidates. */
    Optional<ZonedDateTime> findNextValid(LocalDateTime local, ZoneId zone) {
        for (int seconds = 1; seconds <= searchBoundSeconds; seconds++) {
            Optional<ZonedDateTime> candidate = timeZoneProvider.toUtcCandidates(local.plusSeconds(seconds), zone).earliest();
            if (candidate.isPresent()) {
                return candidate;
            }
        }
        return Optional.empty();
    }
}
