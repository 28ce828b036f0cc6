package com.tzbucket.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of a local wall-clock time within a zone.
 */
public enum LocalTimeStatus {

    NORMAL("normal"),
    AMBIGUOUS("ambiguous"),
    NONEXISTENT("nonexistent");

    private final String tag;

    LocalTimeStatus(String tag) {
        this.tag = tag;
    }

    /** Machine-readable tag used in JSON output and error envelopes. */
    @JsonValue
    public String tag() {
        return tag;
    }

    @Override
    public String toString() {
        return tag;
    }
}
