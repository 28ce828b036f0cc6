package com.tzbucket.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Externally visible record produced for one bucketed input line.
 */
@JsonPropertyOrder({"input", "tz", "interval", "bucket"})
public record BucketResult(
    @JsonProperty("input") InputTimestamp input,
    @JsonProperty("tz") String tz,
    @JsonProperty("interval") Interval interval,
    @JsonProperty("bucket") Bucket bucket
) {}
