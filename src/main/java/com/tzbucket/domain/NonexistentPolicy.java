package com.tzbucket.domain;

import java.util.Locale;

/**
 * Handling of local times skipped by a forward clock jump
 * (e.g. 02:00-02:59 on the spring-forward day in Europe/Berlin).
 */
public enum NonexistentPolicy {

    /** Reject the local time. */
    ERROR("error"),

    /** Move the local time forward by the width of the skipped range. */
    SHIFT_FORWARD("shift_forward");

    private final String wireName;

    NonexistentPolicy(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static NonexistentPolicy fromString(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (NonexistentPolicy policy : values()) {
            if (policy.wireName.equals(normalized)) {
                return policy;
            }
        }
        throw new IllegalArgumentException(
            String.format("Invalid policy_nonexistent '%s'. Expected: error, shift_forward", value));
    }

    @Override
    public String toString() {
        return wireName;
    }
}
