package com.tzbucket.bucket;

import com.tzbucket.domain.Bucket;
import com.tzbucket.domain.Interval;
import com.tzbucket.domain.WeekStart;
import com.tzbucket.exception.ResolutionException;
import com.tzbucket.zone.TimeZoneProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Enumerates every bucket overlapping a UTC interval.
 */
public class RangeEnumerator {

    private static final Logger log = LoggerFactory.getLogger(RangeEnumerator.class);

    private final BucketComputer bucketComputer;
    private final TimeZoneProvider timeZoneProvider;
    private final int maxBuckets;

    public RangeEnumerator(BucketComputer bucketComputer, TimeZoneProvider timeZoneProvider, int maxBuckets) {
        this.bucketComputer = bucketComputer;
        this.timeZoneProvider = timeZoneProvider;
        this.maxBuckets = maxBuckets;
    }

    /**
     * Lists the buckets intersecting {@code [startUtc, endUtc)}, sorted by start instant
     * and unique by key.
     *
     * @throws IllegalArgumentException if {@code startUtc} is not before {@code endUtc}
     *         or the range spans more than the configured bucket limit
     */
    public List<Bucket> enumerate(Instant startUtc, Instant endUtc, ZoneId zone, Interval interval, WeekStart weekStart) {
        if (!startUtc.isBefore(endUtc)) {
            throw new IllegalArgumentException(String.format(
                "Invalid range: start '%s' must be earlier than end '%s'", startUtc, endUtc));
        }
        WeekStart effectiveWeekStart = weekStart != null ? weekStart : WeekStart.MONDAY;

        LocalDate endDate = timeZoneProvider.toLocal(endUtc, zone).toLocalDate();
        LocalDate current = interval.alignDate(
            timeZoneProvider.toLocal(startUtc, zone).toLocalDate(), effectiveWeekStart);

        Map<String, Bucket> byKey = new LinkedHashMap<>();
        while (!current.isAfter(endDate)) {
            LocalDate next = advance(current, interval);
            if (isSkipped(current, next, zone)) {
                log.debug("Local date {} does not exist in {}, no bucket", current, zone);
                current = next;
                continue;
            }
            Bucket bucket = bucketComputer.bucketStartingOn(current, zone, interval);
            if (bucket.overlaps(startUtc, endUtc)) {
                byKey.putIfAbsent(bucket.key(), bucket);
                if (byKey.size() > maxBuckets) {
                    throw new IllegalArgumentException(String.format(
                        "Range too large: more than %d %s buckets between %s and %s",
                        maxBuckets, interval, startUtc, endUtc));
                }
            }
            current = next;
        }

        List<Bucket> buckets = new ArrayList<>(byKey.values());
        buckets.sort(Comparator.comparing(Bucket::startInstant));

        log.debug("Enumerated {} {} buckets in {} for [{}, {})", buckets.size(), interval, zone, startUtc, endUtc);
        return buckets;
    }

    /**
     * True if the zone jumped over the whole bucket, e.g. Pacific/Apia on 2011-12-30:
     * both boundary midnights resolve to the same instant.
     */
    private boolean isSkipped(LocalDate start, LocalDate end, ZoneId zone) {
        return timeZoneProvider.localMidnightToUtc(start, zone).equals(timeZoneProvider.localMidnightToUtc(end, zone));
    }

    private static LocalDate advance(LocalDate current, Interval interval) {
        try {
            return interval.nextBoundary(current);
        } catch (DateTimeException e) {
            throw new ResolutionException("Range enumeration overflowed after local date " + current, e);
        }
    }
}
