package com.tzbucket.exception;

import com.tzbucket.domain.LocalTimeStatus;

/**
 * Raised when an ambiguous or nonexistent local time meets an {@code error} policy.
 * Carries the status tag so callers can react without parsing the message.
 */
public class PolicyException extends TzBucketException {

    private final LocalTimeStatus status;

    public PolicyException(String message, LocalTimeStatus status) {
        super(ErrorKind.INPUT, message);
        this.status = status;
    }

    public LocalTimeStatus status() {
        return status;
    }
}
