package com.tzbucket.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Calendar granularities for bucketing.
 * All boundaries are derived with local date arithmetic, never with fixed durations,
 * so a bucket spanning a DST transition keeps its calendar meaning (23h or 25h days).
 */
public enum Interval {

    DAY("day"),
    WEEK("week"),
    MONTH("month");

    private static final DateTimeFormatter DAY_KEY = DateTimeFormatter.ofPattern("uuuu-MM-dd");
    private static final DateTimeFormatter MONTH_KEY = DateTimeFormatter.ofPattern("uuuu-MM");

    private final String wireName;

    Interval(String wireName) {
        this.wireName = wireName;
    }

    /** Returns the lowercase name used on the command line and in JSON output. */
    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Aligns a local date to the first date of its bucket.
     *
     * @param date local calendar date
     * @param weekStart week convention, only consulted for {@link #WEEK}
     * @return first local date of the bucket containing {@code date}
     */
    public LocalDate alignDate(LocalDate date, WeekStart weekStart) {
        return switch (this) {
            case DAY -> date;
            case WEEK -> date.minusDays(weekStart.daysSinceWeekStart(date.getDayOfWeek()));
            case MONTH -> date.withDayOfMonth(1);
        };
    }

    /** Returns the exclusive end date of a bucket starting at {@code startDate}. */
    public LocalDate nextBoundary(LocalDate startDate) {
        return switch (this) {
            case DAY -> startDate.plusDays(1);
            case WEEK -> startDate.plusDays(7);
            case MONTH -> startDate.withDayOfMonth(1).plusMonths(1);
        };
    }

    /**
     * Formats the stable bucket key: {@code YYYY-MM-DD} for day and week buckets
     * (the week's first date, whatever the week convention), {@code YYYY-MM} for months.
     */
    public String formatKey(LocalDate startDate) {
        return switch (this) {
            case DAY, WEEK -> startDate.format(DAY_KEY);
            case MONTH -> startDate.format(MONTH_KEY);
        };
    }

    /**
     * Parses the wire name (case-insensitive).
     *
     * @throws IllegalArgumentException for anything other than day, week or month
     */
    public static Interval fromString(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (Interval interval : values()) {
            if (interval.wireName.equals(normalized)) {
                return interval;
            }
        }
        throw new IllegalArgumentException(
            String.format("Invalid interval '%s'. Expected: day, week, month", value));
    }

    @Override
    public String toString() {
        return wireName;
    }
}
