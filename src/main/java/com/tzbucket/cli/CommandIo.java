package com.tzbucket.cli;

import java.io.InputStream;
import java.io.PrintStream;

/**
 * Standard streams of one command invocation.
 */
public record CommandIo(InputStream in, PrintStream out, PrintStream err) {

    public static CommandIo system() {
        return new CommandIo(System.in, System.out, System.err);
    }
}
