package com.tzbucket.cli;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Error envelope written to stderr in JSON mode.
 *
 * @param error human-readable message
 * @param exitCode process exit code (2 input, 3 runtime)
 * @param status {@code ambiguous} or {@code nonexistent} for policy rejections, absent otherwise
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"error", "exit_code", "status"})
public record ErrorResponse(
    @JsonProperty("error") String error,
    @JsonProperty("exit_code") int exitCode,
    @JsonProperty("status") String status
) {

    public ErrorResponse(String error, int exitCode) {
        this(error, exitCode, null);
    }
}
