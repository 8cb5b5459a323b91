package org.odsutils.service.check;

import org.odsutils.models.TimeWindow;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Merges time windows into the minimal set of non-overlapping windows covering the same instants.
 * Windows that touch ({@code next.start == current.stop}) are merged; any gap keeps them apart.
 * <p>
 * Example: {@code [1..3], [2..5], [7..9]} becomes {@code [1..5], [7..9]}.
 */
public final class IntervalMerger {

    private IntervalMerger() {
    }

    public static List<TimeWindow> merge(List<TimeWindow> windows) {
        if (windows == null || windows.isEmpty()) {
            return new ArrayList<>();
        }

        List<TimeWindow> sorted = new ArrayList<>(windows);
        sorted.sort(Comparator.comparing(TimeWindow::start));

        List<TimeWindow> merged = new ArrayList<>();
        TimeWindow current = sorted.get(0);
        for (int i = 1; i < sorted.size(); i++) {
            TimeWindow next = sorted.get(i);
            if (!next.start().isAfter(current.stop())) {
                if (next.stop().isAfter(current.stop())) {
                    current = new TimeWindow(current.start(), next.stop());
                }
            } else {
                merged.add(current);
                current = next;
            }
        }
        merged.add(current);
        return merged;
    }
}
