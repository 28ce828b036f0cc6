package com.tzbucket.zone;

import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.time.zone.ZoneOffsetTransition;
import java.util.Optional;

/**
 * Outcome of mapping a local wall-clock time to UTC within a zone:
 * exactly one instant, two instants (overlap) or none (gap).
 */
public sealed interface LocalMapping
        permits LocalMapping.Unique, LocalMapping.Ambiguous, LocalMapping.Nonexistent {

    enum Kind { UNIQUE, AMBIGUOUS, NONEXISTENT }

    /** The local wall-clock time that was mapped. */
    LocalDateTime local();

    Kind kind();

    /** The single instant, if the mapping is unique. */
    default Optional<ZonedDateTime> single() {
        return Optional.empty();
    }

    /** The unique instant, or the earlier of two. Empty inside a gap. */
    Optional<ZonedDateTime> earliest();

    /** The unique instant, or the later of two. Empty inside a gap. */
    Optional<ZonedDateTime> latest();

    record Unique(LocalDateTime local, ZonedDateTime instant) implements LocalMapping {

        @Override
        public Kind kind() {
            return Kind.UNIQUE;
        }

        @Override
        public Optional<ZonedDateTime> single() {
            return Optional.of(instant);
        }

        @Override
        public Optional<ZonedDateTime> earliest() {
            return Optional.of(instant);
        }

        @Override
        public Optional<ZonedDateTime> latest() {
            return Optional.of(instant);
        }
    }

    /**
     * Local time repeated by a backward transition.
     *
     * @param earlier occurrence under the offset before the transition
     * @param later occurrence under the offset after the transition
     */
    record Ambiguous(LocalDateTime local, ZonedDateTime earlier, ZonedDateTime later) implements LocalMapping {

        @Override
        public Kind kind() {
            return Kind.AMBIGUOUS;
        }

        @Override
        public Optional<ZonedDateTime> earliest() {
            return Optional.of(earlier);
        }

        @Override
        public Optional<ZonedDateTime> latest() {
            return Optional.of(later);
        }
    }

    /**
     * Local time skipped by a forward transition.
     *
     * @param transition the gap transition containing {@code local}
     */
    record Nonexistent(LocalDateTime local, ZoneOffsetTransition transition) implements LocalMapping {

        @Override
        public Kind kind() {
            return Kind.NONEXISTENT;
        }

        @Override
        public Optional<ZonedDateTime> earliest() {
            return Optional.empty();
        }

        @Override
        public Optional<ZonedDateTime> latest() {
            return Optional.empty();
        }
    }
}
