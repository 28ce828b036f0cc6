package com.tzbucket.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw input text together with the UTC instant it resolved to.
 *
 * @param ts trimmed input text
 * @param epochMs resolved instant in epoch milliseconds
 */
public record InputTimestamp(
    @JsonProperty("ts") String ts,
    @JsonProperty("epoch_ms") long epochMs
) {}
