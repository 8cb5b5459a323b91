package org.odsutils.models;

import java.time.Duration;
import java.util.List;

/**
 * Union of record spans within an instance.
 *
 * @param covered total duration of the merged spans
 * @param span    time from the first merged start to the last merged stop
 * @param merged  the merged, non-overlapping spans in time order
 */
public record CoverageReport(Duration covered, Duration span, List<TimeWindow> merged) {

    public double fraction() {
        return seconds(covered) / seconds(span);
    }

    private static double seconds(Duration duration) {
        return duration.getSeconds() + duration.getNano() / 1_000_000_000.0;
    }
}
