package com.tzbucket;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * tzbucket
 *
 * DST-safe calendar bucketing of timestamps in IANA timezones.
 *
 * Key Features:
 * - Day, week (Monday or Sunday start) and month buckets computed in local calendar time
 * - Boundaries resolved independently to UTC (23h and 25h days around DST transitions)
 * - Explanation and policy-driven resolution of ambiguous and nonexistent local times
 * - Epoch milliseconds, epoch seconds and RFC 3339 input, with optional auto-detection
 * - Line-oriented bucket, range and explain commands with JSON or text output
 *
 * @since 1.0.0
 */
@SpringBootApplication
public class TzBucketApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(TzBucketApplication.class, args)));
    }
}
