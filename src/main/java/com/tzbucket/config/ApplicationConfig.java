package com.tzbucket.config;

import com.tzbucket.bucket.BucketComputer;
import com.tzbucket.bucket.RangeEnumerator;
import com.tzbucket.parse.TimestampParser;
import com.tzbucket.resolution.LocalTimeResolver;
import com.tzbucket.service.BucketService;
import com.tzbucket.zone.TimeZoneProvider;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for core application beans.
 */
@Configuration
public class ApplicationConfig {

    @Bean
    public TimeZoneProvider timeZoneProvider() {
        return new TimeZoneProvider();
    }

    @Bean
    public TimestampParser timestampParser() {
        return new TimestampParser();
    }

    @Bean
    public BucketComputer bucketComputer(TimeZoneProvider timeZoneProvider) {
        return new BucketComputer(timeZoneProvider);
    }

    @Bean
    public RangeEnumerator rangeEnumerator(BucketComputer bucketComputer,
                                           TimeZoneProvider timeZoneProvider,
                                           TzBucketProperties properties) {
        return new RangeEnumerator(bucketComputer, timeZoneProvider, properties.getRange().getMaxBuckets());
    }

    @Bean
    public LocalTimeResolver localTimeResolver(TimeZoneProvider timeZoneProvider, TzBucketProperties properties) {
        return new LocalTimeResolver(timeZoneProvider, properties.getResolver().getSearchBoundSeconds());
    }

    @Bean
    public BucketService bucketService(TimeZoneProvider timeZoneProvider,
                                       TimestampParser timestampParser,
                                       BucketComputer bucketComputer,
                                       RangeEnumerator rangeEnumerator,
                                       LocalTimeResolver localTimeResolver,
                                       MeterRegistry meterRegistry) {
        return new BucketService(timeZoneProvider, timestampParser, bucketComputer,
            rangeEnumerator, localTimeResolver, meterRegistry);
    }
}
