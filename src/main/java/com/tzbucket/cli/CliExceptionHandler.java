package com.tzbucket.cli;

import com.tzbucket.exception.ErrorKind;
import com.tzbucket.exception.PolicyException;
import com.tzbucket.exception.TzBucketException;
import com.tzbucket.service.BucketService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;

/**
 * Maps failures of a command to an exit code and reports them on stderr.
 * Rejected input is logged at DEBUG only since the envelope already reaches stderr.
 */
@Component
public class CliExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(CliExceptionHandler.class);

    private final OutputRenderer renderer;

    public CliExceptionHandler(OutputRenderer renderer) {
        this.renderer = renderer;
    }

    /**
     * Reports {@code ex} on {@code err} in the given format.
     *
     * @return exit code for the failure
     */
    public int handle(Throwable ex, OutputFormat format, PrintStream err) {
        ErrorResponse response = toErrorResponse(ex);
        if (format == OutputFormat.JSON) {
            err.println(renderer.pretty(response));
        } else {
            err.println("Error: " + response.error());
        }
        err.flush();
        return response.exitCode();
    }

    /**
     * Deterministic mapping from exception to error envelope.
     */
    public ErrorResponse toErrorResponse(Throwable ex) {
        if (ex instanceof PolicyException policy) {
            log.debug("Policy rejected local time: {}", policy.getMessage());
            return new ErrorResponse(policy.getMessage(), policy.exitCode(), policy.status().tag());
        }
        if (ex instanceof TzBucketException typed) {
            if (typed.kind() == ErrorKind.INPUT) {
                log.debug("Input error: {}", typed.getMessage());
            } else {
                log.error("Runtime error: {}", typed.getMessage(), typed);
            }
            return new ErrorResponse(typed.getMessage(), typed.exitCode());
        }
        if (ex instanceof BucketService.ValidationException || ex instanceof IllegalArgumentException) {
            log.debug("Invalid argument: {}", ex.getMessage());
            return new ErrorResponse(ex.getMessage(), ExitCodes.INPUT_ERROR);
        }
        if (ex instanceof IOException || ex instanceof UncheckedIOException) {
            log.error("I/O error: {}", ex.getMessage(), ex);
            return new ErrorResponse(ex.getMessage(), ExitCodes.RUNTIME_ERROR);
        }

        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return new ErrorResponse("Unexpected error: " + ex.getMessage(), ExitCodes.RUNTIME_ERROR);
    }
}
