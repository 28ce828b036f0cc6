package com.tzbucket.cli;

import com.tzbucket.exception.TzBucketException;

/**
 * Failure of a single input line of the bucket command; keeps the kind of its cause.
 */
public class LineProcessingException extends TzBucketException {

    public LineProcessingException(String line, TzBucketException cause) {
        super(cause.kind(), String.format("Error processing '%s': %s", line, cause.getMessage()), cause);
    }
}
