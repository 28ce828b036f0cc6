package com.tzbucket.cli;

import com.tzbucket.domain.AmbiguousPolicy;
import com.tzbucket.domain.ExplainResult;
import com.tzbucket.domain.NonexistentPolicy;
import com.tzbucket.service.BucketService;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.time.ZoneId;

/**
 * {@code explain}: reports whether a local time is normal, ambiguous or nonexistent and
 * how the selected policies resolve it.
 */
@Component
public class ExplainCommand implements CliCommand {

    private final BucketService bucketService;
    private final OutputRenderer renderer;

    public ExplainCommand(BucketService bucketService, OutputRenderer renderer) {
        this.bucketService = bucketService;
        this.renderer = renderer;
    }

    @Override
    public String name() {
        return "explain";
    }

    @Override
    public OutputFormat defaultOutputFormat() {
        return OutputFormat.JSON;
    }

    @Override
    public int execute(CommandOptions options, CommandIo io) {
        OutputFormat outputFormat = OutputFormat.fromString(options.value("output-format", "json"));
        ZoneId zone = bucketService.zone(options.required("tz"));
        String local = options.required("local");
        NonexistentPolicy nonexistentPolicy =
            NonexistentPolicy.fromString(options.value("policy-nonexistent", "error"));
        AmbiguousPolicy ambiguousPolicy =
            AmbiguousPolicy.fromString(options.value("policy-ambiguous", "error"));

        ExplainResult result = bucketService.explain(local, zone, nonexistentPolicy, ambiguousPolicy);

        PrintStream out = io.out();
        if (outputFormat == OutputFormat.JSON) {
            out.println(renderer.pretty(result));
        } else {
            out.println("Local time: " + result.localTime());
            out.println("Timezone: " + result.tz());
            out.println("Status: " + result.status().tag());
            if (result.resolution() != null) {
                out.printf("Resolution: %s -> %s%n", result.resolution().policy(), result.resolution().result());
            }
        }
        out.flush();
        return ExitCodes.SUCCESS;
    }
}
