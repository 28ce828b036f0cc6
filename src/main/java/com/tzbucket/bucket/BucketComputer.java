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

/**
 * Computes calendar-aligned, DST-correct buckets.
 *
 * <p>Boundaries are derived as local calendar dates, and each boundary's local midnight is
 * resolved to UTC on its own. A spring-forward day therefore lasts 23 real hours and a
 * fall-back day 25; no fixed 24h/7d duration is ever added to an instant.
 *
 * Thread-safe and stateless - all methods are pure functions.
 */
public class BucketComputer {

    private static final Logger log = LoggerFactory.getLogger(BucketComputer.class);

    private final TimeZoneProvider timeZoneProvider;

    public BucketComputer(TimeZoneProvider timeZoneProvider) {
        this.timeZoneProvider = timeZoneProvider;
    }

    /**
     * Computes the bucket containing {@code instant}.
     *
     * @param instant UTC instant to bucket
     * @param zone zone whose calendar defines the bucket
     * @param interval bucket granularity
     * @param weekStart week convention; {@code null} means Monday
     * @return bucket with {@code start_utc <= instant < end_utc}
     * @throws ResolutionException if date arithmetic leaves the supported range
     */
    public Bucket computeBucket(Instant instant, ZoneId zone, Interval interval, WeekStart weekStart) {
        WeekStart effectiveWeekStart = weekStart != null ? weekStart : WeekStart.MONDAY;
        LocalDate localDate = timeZoneProvider.toLocal(instant, zone).toLocalDate();

        LocalDate startDate;
        LocalDate endDate;
        try {
            startDate = interval.alignDate(localDate, effectiveWeekStart);
            endDate = interval.nextBoundary(startDate);
        } catch (DateTimeException e) {
            throw new ResolutionException("Bucket boundary out of range for local date " + localDate, e);
        }

        Bucket bucket = bucketForDates(startDate, endDate, zone, interval);
        log.debug("Bucketed {} in {} ({}): key={}, start={}, end={}",
            instant, zone, interval, bucket.key(), bucket.startUtc(), bucket.endUtc());
        return bucket;
    }

    /**
     * Computes the bucket whose first local date is {@code startDate}.
     * {@code startDate} must already be aligned for {@code interval}.
     */
    public Bucket bucketStartingOn(LocalDate startDate, ZoneId zone, Interval interval) {
        try {
            return bucketForDates(startDate, interval.nextBoundary(startDate), zone, interval);
        } catch (DateTimeException e) {
            throw new ResolutionException("Bucket boundary out of range for local date " + startDate, e);
        }
    }

    private Bucket bucketForDates(LocalDate startDate, LocalDate endDate, ZoneId zone, Interval interval) {
        // each boundary resolved independently
        Instant startUtc = timeZoneProvider.localMidnightToUtc(startDate, zone);
        Instant endUtc = timeZoneProvider.localMidnightToUtc(endDate, zone);

        if (!startUtc.isBefore(endUtc)) {
            throw new ResolutionException(String.format(
                "Degenerate bucket for %s in %s: start %s is not before end %s", startDate, zone, startUtc, endUtc));
        }

        return new Bucket(
            interval.formatKey(startDate),
            TimeZoneProvider.formatWithOffset(timeZoneProvider.toLocal(startUtc, zone)),
            TimeZoneProvider.formatWithOffset(timeZoneProvider.toLocal(endUtc, zone)),
            TimeZoneProvider.formatUtc(startUtc),
            TimeZoneProvider.formatUtc(endUtc)
        );
    }
}
