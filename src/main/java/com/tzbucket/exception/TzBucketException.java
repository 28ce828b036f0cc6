package com.tzbucket.exception;

/**
 * Base class of the typed failures raised by the bucketing core.
 */
public abstract class TzBucketException extends RuntimeException {

    private final ErrorKind kind;

    protected TzBucketException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected TzBucketException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public int exitCode() {
        return kind.exitCode();
    }
}
