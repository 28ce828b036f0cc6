package com.tzbucket.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Routes the first positional argument to its {@link CliCommand} and turns every failure
 * into an exit code.
 */
@Component
public class CommandLineDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandLineDispatcher.class);

    private final Map<String, CliCommand> commands;
    private final CliExceptionHandler exceptionHandler;

    public CommandLineDispatcher(List<CliCommand> commands, CliExceptionHandler exceptionHandler) {
        this.commands = commands.stream()
            .collect(Collectors.toMap(CliCommand::name, Function.identity(), (a, b) -> a, TreeMap::new));
        this.exceptionHandler = exceptionHandler;
    }

    public int dispatch(ApplicationArguments args, CommandIo io) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty()) {
            io.err().println(usage());
            return ExitCodes.INPUT_ERROR;
        }

        String name = positional.get(0);
        CliCommand command = commands.get(name);
        if (command == null) {
            io.err().println("Unknown command: " + name);
            io.err().println(usage());
            return ExitCodes.INPUT_ERROR;
        }

        CommandOptions options = new CommandOptions(args);
        OutputFormat errorFormat = OutputFormat.hint(
            options.value("output-format", command.defaultOutputFormat().name()));

        log.debug("Running command '{}' with options {}", name, args.getOptionNames());
        try {
            return command.execute(options, io);
        } catch (Exception e) {
            return exceptionHandler.handle(e, errorFormat, io.err());
        }
    }

    String usage() {
        return "Usage: tzbucket <command> [--option=value ...]\n"
            + "Commands: " + String.join(", ", commands.keySet()) + "\n"
            + "  bucket   --tz --interval --week-start --format --output-format --input | --stdin\n"
            + "  range    --tz --start --end --interval --week-start --output-format\n"
            + "  explain  --tz --local --policy-nonexistent --policy-ambiguous --output-format";
    }
}
