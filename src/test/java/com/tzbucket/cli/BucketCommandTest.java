package com.tzbucket.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tzbucket.bucket.BucketComputer;
import com.tzbucket.bucket.RangeEnumerator;
import com.tzbucket.config.TzBucketProperties;
import com.tzbucket.exception.ResolutionException;
import com.tzbucket.exception.TimestampParseException;
import com.tzbucket.parse.TimestampParser;
import com.tzbucket.resolution.LocalTimeResolver;
import com.tzbucket.service.BucketService;
import com.tzbucket.zone.TimeZoneProvider;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link BucketCommand} input handling: files, stdin and per-line recovery.
 */
@DisplayName("BucketCommand Tests")
class BucketCommandTest {

    @TempDir
    Path tempDir;

    private TzBucketProperties properties;
    private BucketService bucketService;
    private BucketCommand command;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        TimeZoneProvider provider = new TimeZoneProvider();
        BucketComputer computer = new BucketComputer(provider);
        bucketService = new BucketService(provider, new TimestampParser(), computer,
            new RangeEnumerator(computer, provider, 10_000), new LocalTimeResolver(provider),
            new SimpleMeterRegistry());

        properties = new TzBucketProperties();
        OutputRenderer renderer = new OutputRenderer(new ObjectMapper());
        command = new BucketCommand(bucketService, renderer, new CliExceptionHandler(renderer), properties);

        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int execute(String stdin, String... args) throws Exception {
        CommandIo io = new CommandIo(
            new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
        return command.execute(new CommandOptions(new DefaultApplicationArguments(args)), io);
    }

    @Test
    @DisplayName("Should read timestamps from --input file")
    void testInputFile() throws Exception {
        Path input = tempDir.resolve("timestamps.txt");
        Files.writeString(input, "2026-03-29T12:00:00Z\n2026-03-30T12:00:00Z\n");

        int exitCode = execute("", "bucket", "--input=" + input, "--tz=Europe/Berlin",
            "--format=rfc3339", "--interval=week", "--week-start=sunday");

        assertThat(exitCode).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8).split("\n")).containsExactly(
            "2026-03-29 -> 2026-03-29T00:00:00+01:00 to 2026-04-05T00:00:00+02:00",
            "2026-03-29 -> 2026-03-29T00:00:00+01:00 to 2026-04-05T00:00:00+02:00");
    }

    @Test
    @DisplayName("--stdin should take precedence over --input")
    void testStdinFlag() throws Exception {
        int exitCode = execute("1774785600\n", "bucket", "--stdin", "--input=/does/not/exist",
            "--format=epoch_s", "--interval=month");

        assertThat(exitCode).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8)).startsWith("2026-03 -> 2026-03-01T00:00:00+00:00");
    }

    @Test
    @DisplayName("Missing input file should surface as an I/O error")
    void testMissingFile() {
        Path missing = tempDir.resolve("missing.txt");

        Throwable failure = catchThrowable(() -> execute("", "bucket", "--input=" + missing));

        assertThat(failure).isInstanceOf(IOException.class)
            .hasMessageStartingWith("Failed to open file '" + missing + "'");
        assertThat(new CliExceptionHandler(new OutputRenderer(new ObjectMapper())).toErrorResponse(failure).exitCode())
            .isEqualTo(ExitCodes.RUNTIME_ERROR);
    }

    @Test
    @DisplayName("Without fail-fast, malformed lines are reported and skipped")
    void testSkipMalformedLines() throws Exception {
        properties.getBucket().setFailFast(false);

        int exitCode = execute("1774785600000\nbogus\n1792929600000\n",
            "bucket", "--tz=Europe/Berlin", "--output-format=json");

        assertThat(exitCode).isEqualTo(ExitCodes.INPUT_ERROR);
        assertThat(out.toString(StandardCharsets.UTF_8).split("\n")).hasSize(2);
        String errors = err.toString(StandardCharsets.UTF_8);
        assertThat(errors).contains("\"error\": \"Error processing 'bogus': Parse error:");
        assertThat(errors).contains("\"exit_code\": 2");
        assertThat(bucketService.getInputErrors()).isEqualTo(1);
    }

    @Test
    @DisplayName("Without fail-fast, a runtime failure on any line should set exit code 3")
    void testSkippedRuntimeFailureWins() throws Exception {
        properties.getBucket().setFailFast(false);
        BucketService failing = mock(BucketService.class);
        when(failing.bucket(anyString(), any(), any(), any(), any())).thenAnswer(invocation -> {
            String raw = invocation.getArgument(0);
            if (raw.equals("bad")) {
                throw new TimestampParseException(raw, "Invalid epoch milliseconds: 'bad'");
            }
            throw new ResolutionException("No valid local time within search bound");
        });
        OutputRenderer renderer = new OutputRenderer(new ObjectMapper());
        command = new BucketCommand(failing, renderer, new CliExceptionHandler(renderer), properties);

        int exitCode = execute("bad\n1774785600000\nbad\n", "bucket");

        assertThat(exitCode).isEqualTo(ExitCodes.RUNTIME_ERROR);
        assertThat(out.toString(StandardCharsets.UTF_8)).isEmpty();
        assertThat(err.toString(StandardCharsets.UTF_8).split("\n")).containsExactly(
            "Error: Error processing 'bad': Invalid epoch milliseconds: 'bad'",
            "Error: Error processing '1774785600000': No valid local time within search bound",
            "Error: Error processing 'bad': Invalid epoch milliseconds: 'bad'");
        verify(failing, times(3)).bucket(anyString(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("Defaults should come from configuration")
    void testConfiguredDefaults() throws Exception {
        properties.getDefaults().setTimezone("Europe/Berlin");
        properties.getDefaults().setFormat("auto");

        int exitCode = execute("1774785600\n", "bucket");

        assertThat(exitCode).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8).trim())
            .isEqualTo("2026-03-29 -> 2026-03-29T00:00:00+01:00 to 2026-03-30T00:00:00+02:00");
    }
}
