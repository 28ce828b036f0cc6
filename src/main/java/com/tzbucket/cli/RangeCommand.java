package com.tzbucket.cli;

import com.tzbucket.config.TzBucketProperties;
import com.tzbucket.domain.Bucket;
import com.tzbucket.domain.Interval;
import com.tzbucket.domain.WeekStart;
import com.tzbucket.service.BucketService;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.util.List;

/**
 * {@code range}: lists every bucket overlapping {@code [--start, --end)}.
 */
@Component
public class RangeCommand implements CliCommand {

    private final BucketService bucketService;
    private final OutputRenderer renderer;
    private final TzBucketProperties properties;

    public RangeCommand(BucketService bucketService, OutputRenderer renderer, TzBucketProperties properties) {
        this.bucketService = bucketService;
        this.renderer = renderer;
        this.properties = properties;
    }

    @Override
    public String name() {
        return "range";
    }

    @Override
    public OutputFormat defaultOutputFormat() {
        return OutputFormat.JSON;
    }

    @Override
    public int execute(CommandOptions options, CommandIo io) {
        TzBucketProperties.Defaults defaults = properties.getDefaults();
        OutputFormat outputFormat = OutputFormat.fromString(options.value("output-format", "json"));
        ZoneId zone = bucketService.zone(options.required("tz"));
        Interval interval = Interval.fromString(options.value("interval", defaults.getInterval()));
        WeekStart weekStart = WeekStart.fromString(options.value("week-start", defaults.getWeekStart()));
        String start = options.required("start");
        String end = options.required("end");

        List<Bucket> buckets = bucketService.range(start, end, zone, interval, weekStart);

        if (outputFormat == OutputFormat.JSON) {
            io.out().println(renderer.pretty(buckets));
        } else {
            for (Bucket bucket : buckets) {
                io.out().printf("%s: %s to %s%n", bucket.key(), bucket.startLocal(), bucket.endLocal());
            }
        }
        io.out().flush();
        return ExitCodes.SUCCESS;
    }
}
