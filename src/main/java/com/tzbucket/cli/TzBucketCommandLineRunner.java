package com.tzbucket.cli;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the requested command once the context is up; the result becomes the process exit code.
 */
@Component
@ConditionalOnProperty(prefix = "tzbucket.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TzBucketCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    private final CommandLineDispatcher dispatcher;
    private int exitCode = ExitCodes.SUCCESS;

    public TzBucketCommandLineRunner(CommandLineDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = dispatcher.dispatch(args, CommandIo.system());
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
