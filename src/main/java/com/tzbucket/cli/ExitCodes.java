package com.tzbucket.cli;

/**
 * Process exit codes.
 */
public final class ExitCodes {

    public static final int SUCCESS = 0;
    public static final int INPUT_ERROR = 2;
    public static final int RUNTIME_ERROR = 3;

    private ExitCodes() {
    }
}
