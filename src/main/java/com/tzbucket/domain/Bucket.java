package com.tzbucket.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;

/**
 * Immutable calendar bucket with boundaries rendered in local time and UTC.
 *
 * <p>{@code startLocal}/{@code endLocal} are the same instants as {@code startUtc}/{@code endUtc}
 * re-expressed with the offset in effect at each instant, so their offsets may differ
 * when the bucket spans a DST transition.
 *
 * @param key stable identifier: {@code YYYY-MM-DD} for day/week, {@code YYYY-MM} for month
 * @param startLocal inclusive start, ISO-8601 with offset
 * @param endLocal exclusive end, ISO-8601 with offset
 * @param startUtc inclusive start, ISO-8601 with {@code Z}
 * @param endUtc exclusive end, ISO-8601 with {@code Z}
 */
@JsonPropertyOrder({"key", "start_local", "end_local", "start_utc", "end_utc"})
public record Bucket(
    @JsonProperty("key") String key,
    @JsonProperty("start_local") String startLocal,
    @JsonProperty("end_local") String endLocal,
    @JsonProperty("start_utc") String startUtc,
    @JsonProperty("end_utc") String endUtc
) {

    /** Parses {@link #startUtc()} back to an instant. */
    public Instant startInstant() {
        return Instant.parse(startUtc);
    }

    /** Parses {@link #endUtc()} back to an instant. */
    public Instant endInstant() {
        return Instant.parse(endUtc);
    }

    /** Returns true if {@code instant} lies in {@code [start, end)}. */
    public boolean contains(Instant instant) {
        return !instant.isBefore(startInstant()) && instant.isBefore(endInstant());
    }

    /** Returns true if this bucket intersects the half-open range {@code [from, to)}. */
    public boolean overlaps(Instant from, Instant to) {
        return startInstant().isBefore(to) && endInstant().isAfter(from);
    }
}
