package com.tzbucket.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized configuration for tzbucket.
 * Maps to 'tzbucket.*' properties in application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "tzbucket")
public class TzBucketProperties {

    @Valid
    private Defaults defaults = new Defaults();
    @Valid
    private Resolver resolver = new Resolver();
    @Valid
    private Range range = new Range();
    private Bucket bucket = new Bucket();
    private Cli cli = new Cli();

    /**
     * Option values used when the command line does not supply one.
     */
    @Data
    public static class Defaults {
        @NotBlank
        private String timezone = "UTC";
        @NotBlank
        private String interval = "day";
        @NotBlank
        private String weekStart = "monday";
        @NotBlank
        private String format = "epoch_ms";
    }

    @Data
    public static class Resolver {
        @Min(1)
        private int searchBoundSeconds = 2 * 24 * 60 * 60;  // seconds searched on each side of a gap
    }

    @Data
    public static class Range {
        @Min(1)
        private int maxBuckets = 10_000;
    }

    @Data
    public static class Bucket {
        private boolean failFast = true;  // abort the run on the first malformed line
    }

    @Data
    public static class Cli {
        private boolean enabled = true;
    }
}
