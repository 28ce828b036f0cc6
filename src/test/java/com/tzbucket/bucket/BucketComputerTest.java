package com.tzbucket.bucket;

import com.tzbucket.domain.Bucket;
import com.tzbucket.domain.Interval;
import com.tzbucket.domain.WeekStart;
import com.tzbucket.zone.TimeZoneProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link BucketComputer}.
 *
 * <p>Covers fixed-offset zones, both DST transitions in Europe/Berlin and a historical
 * transition at local midnight (America/Sao_Paulo, 2018).
 */
@DisplayName("BucketComputer Tests")
class BucketComputerTest {

    private static final ZoneId UTC = ZoneId.of("UTC");
    private static final ZoneId BERLIN = ZoneId.of("Europe/Berlin");
    private static final ZoneId SAO_PAULO = ZoneId.of("America/Sao_Paulo");

    private BucketComputer computer;

    @BeforeEach
    void setUp() {
        computer = new BucketComputer(new TimeZoneProvider());
    }

    @ParameterizedTest(name = "{0} in {1} -> {2} hours")
    @MethodSource("dayLengthProvider")
    @DisplayName("Day buckets should follow the local calendar, not a fixed 24h")
    void testDayLength(String instant, ZoneId zone, long expectedHours) {
        Bucket bucket = computer.computeBucket(Instant.parse(instant), zone, Interval.DAY, WeekStart.MONDAY);

        assertThat(Duration.between(bucket.startInstant(), bucket.endInstant()).toHours()).isEqualTo(expectedHours);
    }

    static Stream<Arguments> dayLengthProvider() {
        return Stream.of(
            Arguments.of("2026-03-29T12:00:00Z", UTC, 24L),
            Arguments.of("2026-03-28T12:00:00Z", BERLIN, 24L),
            Arguments.of("2026-03-29T12:00:00Z", BERLIN, 23L),
            Arguments.of("2026-10-25T12:00:00Z", BERLIN, 25L),
            Arguments.of("2026-07-01T00:00:00Z", ZoneId.of("Asia/Kolkata"), 24L),
            Arguments.of("2018-11-04T12:00:00Z", SAO_PAULO, 23L)
        );
    }

    @Test
    @DisplayName("Spring-forward day keeps local midnights with their own offsets")
    void testSpringForwardDay() {
        Bucket bucket = computer.computeBucket(
            Instant.parse("2026-03-29T12:00:00Z"), BERLIN, Interval.DAY, WeekStart.MONDAY);

        assertThat(bucket.key()).isEqualTo("2026-03-29");
        assertThat(bucket.startLocal()).isEqualTo("2026-03-29T00:00:00+01:00");
        assertThat(bucket.endLocal()).isEqualTo("2026-03-30T00:00:00+02:00");
        assertThat(bucket.startUtc()).isEqualTo("2026-03-28T23:00:00Z");
        assertThat(bucket.endUtc()).isEqualTo("2026-03-29T22:00:00Z");
    }

    @Test
    @DisplayName("Fall-back day spans 25 hours")
    void testFallBackDay() {
        Bucket bucket = computer.computeBucket(
            Instant.parse("2026-10-25T12:00:00Z"), BERLIN, Interval.DAY, WeekStart.MONDAY);

        assertThat(bucket.key()).isEqualTo("2026-10-25");
        assertThat(bucket.startLocal()).isEqualTo("2026-10-25T00:00:00+02:00");
        assertThat(bucket.endLocal()).isEqualTo("2026-10-26T00:00:00+01:00");
        assertThat(bucket.startUtc()).isEqualTo("2026-10-24T22:00:00Z");
        assertThat(bucket.endUtc()).isEqualTo("2026-10-25T23:00:00Z");
    }

    @Test
    @DisplayName("Normal day in Berlin starts at 23:00 UTC the day before")
    void testNormalDay() {
        Bucket bucket = computer.computeBucket(
            Instant.parse("2026-03-28T12:00:00Z"), BERLIN, Interval.DAY, WeekStart.MONDAY);

        assertThat(bucket.startUtc()).isEqualTo("2026-03-27T23:00:00Z");
        assertThat(bucket.endUtc()).isEqualTo("2026-03-28T23:00:00Z");
    }

    @ParameterizedTest(name = "{0} -> {1} [{2}, {3})")
    @MethodSource("transitionDayProvider")
    @DisplayName("Instants early on transition days should land in the local day bucket")
    void testTransitionDayInstants(String instant, String key, String startUtc, String endUtc) {
        Bucket bucket = computer.computeBucket(Instant.parse(instant), BERLIN, Interval.DAY, WeekStart.MONDAY);

        assertThat(bucket.key()).isEqualTo(key);
        assertThat(bucket.startUtc()).isEqualTo(startUtc);
        assertThat(bucket.endUtc()).isEqualTo(endUtc);
    }

    static Stream<Arguments> transitionDayProvider() {
        return Stream.of(
            Arguments.of("2026-03-29T00:15:00Z", "2026-03-29", "2026-03-28T23:00:00Z", "2026-03-29T22:00:00Z"),
            Arguments.of("2026-10-25T01:00:00Z", "2026-10-25", "2026-10-24T22:00:00Z", "2026-10-25T23:00:00Z")
        );
    }

    @Test
    @DisplayName("Week key depends on the week start convention")
    void testWeekStart() {
        Instant sunday = Instant.parse("2026-03-29T12:00:00Z");

        Bucket monday = computer.computeBucket(sunday, BERLIN, Interval.WEEK, WeekStart.MONDAY);
        Bucket sundayStart = computer.computeBucket(sunday, BERLIN, Interval.WEEK, WeekStart.SUNDAY);

        assertThat(monday.key()).isEqualTo("2026-03-23");
        assertThat(monday.startLocal()).isEqualTo("2026-03-23T00:00:00+01:00");
        assertThat(monday.endLocal()).isEqualTo("2026-03-30T00:00:00+02:00");
        assertThat(Duration.between(monday.startInstant(), monday.endInstant()).toHours()).isEqualTo(7 * 24 - 1);

        assertThat(sundayStart.key()).isEqualTo("2026-03-29");
        assertThat(sundayStart.endLocal()).isEqualTo("2026-04-05T00:00:00+02:00");
    }

    @Test
    @DisplayName("Null week start should default to Monday")
    void testNullWeekStart() {
        Bucket bucket = computer.computeBucket(Instant.parse("2026-03-29T12:00:00Z"), BERLIN, Interval.WEEK, null);

        assertThat(bucket.key()).isEqualTo("2026-03-23");
    }

    @Test
    @DisplayName("Month bucket spanning spring-forward")
    void testMonth() {
        Bucket bucket = computer.computeBucket(
            Instant.parse("2026-03-15T08:00:00Z"), BERLIN, Interval.MONTH, WeekStart.MONDAY);

        assertThat(bucket.key()).isEqualTo("2026-03");
        assertThat(bucket.startUtc()).isEqualTo("2026-02-28T23:00:00Z");
        assertThat(bucket.endUtc()).isEqualTo("2026-03-31T22:00:00Z");
    }

    @Test
    @DisplayName("December bucket should end on January 1st of the next year")
    void testDecember() {
        Bucket bucket = computer.computeBucket(
            Instant.parse("2026-12-15T10:00:00Z"), UTC, Interval.MONTH, WeekStart.MONDAY);

        assertThat(bucket.key()).isEqualTo("2026-12");
        assertThat(bucket.startLocal()).isEqualTo("2026-12-01T00:00:00+00:00");
        assertThat(bucket.endUtc()).isEqualTo("2027-01-01T00:00:00Z");
    }

    @Test
    @DisplayName("Midnight inside a gap starts the day at the first instant after the jump")
    void testMidnightGap() {
        Bucket bucket = computer.computeBucket(
            Instant.parse("2018-11-04T12:00:00Z"), SAO_PAULO, Interval.DAY, WeekStart.MONDAY);

        assertThat(bucket.key()).isEqualTo("2018-11-04");
        assertThat(bucket.startLocal()).isEqualTo("2018-11-04T01:00:00-02:00");
        assertThat(bucket.startUtc()).isEqualTo("2018-11-04T03:00:00Z");
        assertThat(bucket.endUtc()).isEqualTo("2018-11-05T02:00:00Z");

        Bucket previous = computer.bucketStartingOn(LocalDate.of(2018, 11, 3), SAO_PAULO, Interval.DAY);
        assertThat(previous.endUtc()).isEqualTo(bucket.startUtc());
    }

    @Test
    @DisplayName("Every instant around the Berlin transitions falls inside its own bucket")
    void testContainment() {
        Instant from = Instant.parse("2026-03-28T00:00:00Z");
        for (int minutes = 0; minutes < 4 * 24 * 60; minutes += 17) {
            Instant instant = from.plusSeconds(minutes * 60L);
            for (Interval interval : Interval.values()) {
                Bucket bucket = computer.computeBucket(instant, BERLIN, interval, WeekStart.MONDAY);
                assertThat(bucket.contains(instant))
                    .as("%s %s in [%s, %s)", interval, instant, bucket.startUtc(), bucket.endUtc())
                    .isTrue();
            }
        }

        Instant fallBack = Instant.parse("2026-10-24T20:00:00Z");
        for (int minutes = 0; minutes < 6 * 60; minutes += 7) {
            Instant instant = fallBack.plusSeconds(minutes * 60L);
            assertThat(computer.computeBucket(instant, BERLIN, Interval.DAY, WeekStart.MONDAY).contains(instant)).isTrue();
        }
    }

    @Test
    @DisplayName("Recomputing from a bucket's start yields the same bucket")
    void testIdempotence() {
        for (Interval interval : Interval.values()) {
            Bucket bucket = computer.computeBucket(
                Instant.parse("2026-10-25T01:30:00Z"), BERLIN, interval, WeekStart.SUNDAY);

            assertThat(computer.computeBucket(bucket.startInstant(), BERLIN, interval, WeekStart.SUNDAY))
                .isEqualTo(bucket);
        }
    }

    @Test
    @DisplayName("Consecutive day buckets should tile the timeline without gaps")
    void testContiguity() {
        LocalDate date = LocalDate.of(2026, 1, 1);
        Bucket previous = computer.bucketStartingOn(date, BERLIN, Interval.DAY);
        while (date.getYear() == 2026) {
            date = date.plusDays(1);
            Bucket next = computer.bucketStartingOn(date, BERLIN, Interval.DAY);
            assertThat(next.startUtc()).as("start of %s", date).isEqualTo(previous.endUtc());
            previous = next;
        }
    }
}
