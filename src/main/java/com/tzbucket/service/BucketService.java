package com.tzbucket.service;

import com.tzbucket.bucket.BucketComputer;
import com.tzbucket.bucket.RangeEnumerator;
import com.tzbucket.domain.AmbiguousPolicy;
import com.tzbucket.domain.Bucket;
import com.tzbucket.domain.BucketResult;
import com.tzbucket.domain.ExplainResult;
import com.tzbucket.domain.InputTimestamp;
import com.tzbucket.domain.Interval;
import com.tzbucket.domain.NonexistentPolicy;
import com.tzbucket.domain.TimestampFormat;
import com.tzbucket.domain.WeekStart;
import com.tzbucket.exception.ErrorKind;
import com.tzbucket.exception.TzBucketException;
import com.tzbucket.parse.TimestampParser;
import com.tzbucket.resolution.LocalTimeResolver;
import com.tzbucket.zone.TimeZoneProvider;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Facade over the bucketing core used by the command-line surface.
 *
 * Responsibilities:
 * - Request-level validation
 * - Composition of parser, zone provider, bucket computer and resolver
 * - Metrics and logging
 */
public class BucketService {

    private static final Logger log = LoggerFactory.getLogger(BucketService.class);

    private final TimeZoneProvider timeZoneProvider;
    private final TimestampParser timestampParser;
    private final BucketComputer bucketComputer;
    private final RangeEnumerator rangeEnumerator;
    private final LocalTimeResolver localTimeResolver;
    private final MeterRegistry meterRegistry;

    private final AtomicLong inputErrors = new AtomicLong(0);

    public BucketService(
            TimeZoneProvider timeZoneProvider,
            TimestampParser timestampParser,
            BucketComputer bucketComputer,
            RangeEnumerator rangeEnumerator,
            LocalTimeResolver localTimeResolver,
            MeterRegistry meterRegistry) {
        this.timeZoneProvider = timeZoneProvider;
        this.timestampParser = timestampParser;
        this.bucketComputer = bucketComputer;
        this.rangeEnumerator = rangeEnumerator;
        this.localTimeResolver = localTimeResolver;
        this.meterRegistry = meterRegistry;

        meterRegistry.gauge("tzbucket.input.errors", inputErrors);
    }

    /**
     * Resolves a zone name.
     *
     * @throws com.tzbucket.exception.InvalidTimezoneException for unknown names
     */
    public ZoneId zone(String name) {
        return track(() -> timeZoneProvider.parseZone(name));
    }

    /**
     * Parses one timestamp and computes its bucket.
     *
     * @param raw timestamp text, trimmed before parsing
     * @param format input encoding
     * @param zone bucket zone
     * @param interval bucket granularity
     * @param weekStart week convention
     * @return complete record for the input
     */
    public BucketResult bucket(String raw, TimestampFormat format, ZoneId zone, Interval interval, WeekStart weekStart) {
        Objects.requireNonNull(format, "Format cannot be null");
        Objects.requireNonNull(zone, "Zone cannot be null");
        Objects.requireNonNull(interval, "Interval cannot be null");

        String trimmed = raw == null ? "" : raw.trim();
        Instant instant = track(() -> timestampParser.parse(trimmed, format));
        Bucket bucket = bucketComputer.computeBucket(instant, zone, interval, weekStart);

        Counter.builder("tzbucket.buckets.computed")
            .tag("interval", interval.wireName())
            .register(meterRegistry)
            .increment();

        return new BucketResult(
            new InputTimestamp(trimmed, instant.toEpochMilli()),
            zone.getId(),
            interval,
            bucket
        );
    }

    /**
     * Convenience form of {@link #bucket} taking the zone by name.
     */
    public BucketResult computeBucketFromString(String raw, TimestampFormat format, String tzName,
                                                Interval interval, WeekStart weekStart) {
        return bucket(raw, format, zone(tzName), interval, weekStart);
    }

    /**
     * Lists all buckets overlapping {@code [start, end)} given as RFC 3339 text.
     *
     * @throws ValidationException if start is not earlier than end
     */
    public List<Bucket> range(String start, String end, ZoneId zone, Interval interval, WeekStart weekStart) {
        Instant startUtc = track(() -> timestampParser.parse(start, TimestampFormat.RFC3339));
        Instant endUtc = track(() -> timestampParser.parse(end, TimestampFormat.RFC3339));

        if (!startUtc.isBefore(endUtc)) {
            inputErrors.incrementAndGet();
            throw new ValidationException(String.format(
                "Invalid range: start '%s' must be earlier than end '%s'", start.trim(), end.trim()));
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            List<Bucket> buckets = rangeEnumerator.enumerate(startUtc, endUtc, zone, interval, weekStart);
            log.debug("Range query: tz={}, interval={}, start={}, end={}, results={}",
                zone, interval, startUtc, endUtc, buckets.size());
            return buckets;
        } catch (IllegalArgumentException e) {
            inputErrors.incrementAndGet();
            throw new ValidationException(e.getMessage());
        } finally {
            sample.stop(meterRegistry.timer("tzbucket.range.time", "interval", interval.wireName()));
        }
    }

    /**
     * Explains how a local wall-clock time resolves in {@code zone}.
     */
    public ExplainResult explain(String localText, ZoneId zone,
                                 NonexistentPolicy nonexistentPolicy, AmbiguousPolicy ambiguousPolicy) {
        LocalDateTime local = track(() -> timestampParser.parseLocalTime(localText));
        ExplainResult result = track(() -> localTimeResolver.explain(local, zone, nonexistentPolicy, ambiguousPolicy));

        Counter.builder("tzbucket.resolutions")
            .tag("status", result.status().tag())
            .register(meterRegistry)
            .increment();

        log.debug("Explained {} in {}: status={}", result.localTime(), result.tz(), result.status());
        return result;
    }

    public long getInputErrors() {
        return inputErrors.get();
    }

    private <T> T track(Supplier<T> call) {
        try {
            return call.get();
        } catch (TzBucketException e) {
            if (e.kind() == ErrorKind.INPUT) {
                inputErrors.incrementAndGet();
            }
            throw e;
        }
    }

    /**
     * Request validation exception.
     */
    public static class ValidationException extends RuntimeException {
        public ValidationException(String message) {
            super(message);
        }
    }
}
