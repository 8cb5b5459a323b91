package org.odsutils.models;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Closed time span [start, stop].
 */
public record TimeWindow(Instant start, Instant stop) {

    public TimeWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(stop, "stop");
    }

    public Duration duration() {
        return Duration.between(start, stop);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && !instant.isAfter(stop);
    }
}
