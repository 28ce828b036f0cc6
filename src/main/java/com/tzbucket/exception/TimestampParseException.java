package com.tzbucket.exception;

/**
 * Raised for malformed timestamp text or numeric values outside the representable range.
 */
public class TimestampParseException extends TzBucketException {

    private final String input;

    public TimestampParseException(String input, String message) {
        super(ErrorKind.INPUT, "Parse error: " + message);
        this.input = input;
    }

    public TimestampParseException(String input, String message, Throwable cause) {
        super(ErrorKind.INPUT, "Parse error: " + message, cause);
        this.input = input;
    }

    /** Offending text, after trimming. */
    public String input() {
        return input;
    }
}
