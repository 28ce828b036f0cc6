package com.tzbucket.cli;

import java.io.IOException;

/**
 * A subcommand of the command-line surface.
 */
public interface CliCommand {

    /** Subcommand name as typed on the command line. */
    String name();

    /** Output format used when {@code --output-format} is absent. */
    OutputFormat defaultOutputFormat();

    /**
     * Runs the command.
     *
     * @return process exit code
     * @throws IOException if reading input fails
     */
    int execute(CommandOptions options, CommandIo io) throws IOException;
}
