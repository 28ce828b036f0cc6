package com.tzbucket.domain;

import java.util.Locale;

/**
 * Handling of local times repeated by a backward clock jump
 * (e.g. 02:00-02:59 on the fall-back day in Europe/Berlin).
 */
public enum AmbiguousPolicy {

    /** Reject the local time. */
    ERROR("error"),

    /** Earlier instant, the offset still in effect before the transition (DST). */
    FIRST("first"),

    /** Later instant, the offset in effect after the transition (standard time). */
    SECOND("second");

    private final String wireName;

    AmbiguousPolicy(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static AmbiguousPolicy fromString(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (AmbiguousPolicy policy : values()) {
            if (policy.wireName.equals(normalized)) {
                return policy;
            }
        }
        throw new IllegalArgumentException(
            String.format("Invalid policy_ambiguous '%s'. Expected: error, first, second", value));
    }

    @Override
    public String toString() {
        return wireName;
    }
}
