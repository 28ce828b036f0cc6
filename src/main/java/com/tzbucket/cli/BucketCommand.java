package com.tzbucket.cli;

import com.tzbucket.config.TzBucketProperties;
import com.tzbucket.domain.Bucket;
import com.tzbucket.domain.BucketResult;
import com.tzbucket.domain.Interval;
import com.tzbucket.domain.TimestampFormat;
import com.tzbucket.domain.WeekStart;
import com.tzbucket.exception.TzBucketException;
import com.tzbucket.service.BucketService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;

/**
 * {@code bucket}: reads one timestamp per line and prints the bucket of each.
 *
 * <p>Blank lines are skipped. With {@code tzbucket.bucket.fail-fast=false} a malformed line
 * is reported and skipped, and the run ends with the highest exit code seen.
 */
@Component
public class BucketCommand implements CliCommand {

    private static final Logger log = LoggerFactory.getLogger(BucketCommand.class);

    private static final String STDIN = "-";

    private final BucketService bucketService;
    private final OutputRenderer renderer;
    private final CliExceptionHandler exceptionHandler;
    private final TzBucketProperties properties;

    public BucketCommand(BucketService bucketService, OutputRenderer renderer,
                         CliExceptionHandler exceptionHandler, TzBucketProperties properties) {
        this.bucketService = bucketService;
        this.renderer = renderer;
        this.exceptionHandler = exceptionHandler;
        this.properties = properties;
    }

    @Override
    public String name() {
        return "bucket";
    }

    @Override
    public OutputFormat defaultOutputFormat() {
        return OutputFormat.TEXT;
    }

    @Override
    public int execute(CommandOptions options, CommandIo io) throws IOException {
        TzBucketProperties.Defaults defaults = properties.getDefaults();
        OutputFormat outputFormat = OutputFormat.fromString(options.value("output-format", "text"));
        ZoneId zone = bucketService.zone(options.value("tz", defaults.getTimezone()));
        Interval interval = Interval.fromString(options.value("interval", defaults.getInterval()));
        WeekStart weekStart = WeekStart.fromString(options.value("week-start", defaults.getWeekStart()));
        TimestampFormat format = TimestampFormat.fromString(options.value("format", defaults.getFormat()));
        boolean failFast = properties.getBucket().isFailFast();

        int exitCode = ExitCodes.SUCCESS;
        long processed = 0;
        long skipped = 0;

        try (BufferedReader reader = openInput(options, io)) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }

                BucketResult result;
                try {
                    result = bucketService.bucket(trimmed, format, zone, interval, weekStart);
                } catch (TzBucketException e) {
                    LineProcessingException failure = new LineProcessingException(trimmed, e);
                    if (failFast) {
                        throw failure;
                    }
                    skipped++;
                    exitCode = Math.max(exitCode, exceptionHandler.handle(failure, outputFormat, io.err()));
                    continue;
                }

                io.out().println(outputFormat == OutputFormat.JSON
                    ? renderer.compact(result)
                    : formatText(result.bucket()));
                processed++;
            }
        }
        io.out().flush();

        log.debug("Bucketed {} lines in {} ({}), skipped {}", processed, zone, interval, skipped);
        return exitCode;
    }

    private static BufferedReader openInput(CommandOptions options, CommandIo io) throws IOException {
        String input = options.value("input", STDIN);
        if (options.flag("stdin") || STDIN.equals(input)) {
            return new BufferedReader(new InputStreamReader(io.in(), StandardCharsets.UTF_8));
        }
        try {
            return Files.newBufferedReader(Path.of(input), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IOException(String.format("Failed to open file '%s': %s", input, e.getMessage()), e);
        }
    }

    static String formatText(Bucket bucket) {
        return String.format("%s -> %s to %s", bucket.key(), bucket.startLocal(), bucket.endLocal());
    }
}
