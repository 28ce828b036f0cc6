package com.tzbucket.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.DayOfWeek;
import java.util.Locale;

/**
 * First day of a week bucket. Only meaningful for {@link Interval#WEEK}.
 */
public enum WeekStart {

    /** ISO 8601 weeks. */
    MONDAY("monday"),
    SUNDAY("sunday");

    private final String wireName;

    WeekStart(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Returns the 0-based offset of {@code day} from the start of its week.
     * Monday start: Monday=0 .. Sunday=6. Sunday start: Sunday=0 .. Saturday=6.
     */
    public int daysSinceWeekStart(DayOfWeek day) {
        return switch (this) {
            case MONDAY -> day.getValue() - 1;
            case SUNDAY -> day.getValue() % 7;
        };
    }

    public static WeekStart fromString(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (WeekStart weekStart : values()) {
            if (weekStart.wireName.equals(normalized)) {
                return weekStart;
            }
        }
        throw new IllegalArgumentException(
            String.format("Invalid week_start '%s'. Expected: monday, sunday", value));
    }

    @Override
    public String toString() {
        return wireName;
    }
}
