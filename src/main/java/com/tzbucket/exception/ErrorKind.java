package com.tzbucket.exception;

/**
 * Coarse error category, mapped to the process exit code.
 */
public enum ErrorKind {

    /** Bad timezone, timestamp, option value or a policy rejection. */
    INPUT(2),

    /** Internal resolution failure, I/O failure or overflow. */
    RUNTIME(3);

    private final int exitCode;

    ErrorKind(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
