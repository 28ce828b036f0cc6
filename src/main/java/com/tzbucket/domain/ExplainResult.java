package com.tzbucket.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Explanation of how a local wall-clock time maps to UTC in a zone.
 *
 * @param localTime the requested local time, {@code YYYY-MM-DDTHH:MM:SS}
 * @param tz zone name
 * @param status normal, ambiguous or nonexistent
 * @param resolution applied policy and result, absent for normal times
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"local_time", "tz", "status", "resolution"})
public record ExplainResult(
    @JsonProperty("local_time") String localTime,
    @JsonProperty("tz") String tz,
    @JsonProperty("status") LocalTimeStatus status,
    @JsonProperty("resolution") Resolution resolution
) {

    /**
     * Policy that resolved an ambiguous or nonexistent time.
     *
     * @param policy policy wire name (first, second, shift_forward)
     * @param result resolved instant, ISO-8601 with offset
     */
    @JsonPropertyOrder({"policy", "result"})
    public record Resolution(
        @JsonProperty("policy") String policy,
        @JsonProperty("result") String result
    ) {}
}
