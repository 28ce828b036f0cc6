package com.tzbucket.exception;

/**
 * Internal resolution failure: date arithmetic overflow or an exhausted search bound.
 */
public class ResolutionException extends TzBucketException {

    public ResolutionException(String message) {
        super(ErrorKind.RUNTIME, message);
    }

    public ResolutionException(String message, Throwable cause) {
        super(ErrorKind.RUNTIME, message, cause);
    }
}
