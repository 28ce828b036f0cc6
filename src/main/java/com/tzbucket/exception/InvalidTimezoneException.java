package com.tzbucket.exception;

/**
 * Raised when a zone name is not a known IANA timezone.
 */
public class InvalidTimezoneException extends TzBucketException {

    private final String zoneName;

    public InvalidTimezoneException(String zoneName, Throwable cause) {
        super(ErrorKind.INPUT, "Invalid timezone: " + zoneName, cause);
        this.zoneName = zoneName;
    }

    public InvalidTimezoneException(String zoneName) {
        this(zoneName, null);
    }

    public String zoneName() {
        return zoneName;
    }
}
