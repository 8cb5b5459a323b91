package org.odsutils.service.check;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.odsutils.adapters.HorizonCheck;
import org.odsutils.models.CoverageReport;
import org.odsutils.models.OdsRecord;
import org.odsutils.models.TimeWindow;
import org.odsutils.models.enums.AdjustSide;
import org.odsutils.models.standard.Standard;
import org.odsutils.service.instance.OdsInstance;
import org.odsutils.service.instance.RecordSorter;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-only analyses of an instance: coverage, overlap adjustment, record comparison and horizon
 * visibility.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OdsCheck {

    private final HorizonCheck horizonCheck;

    public boolean isSame(OdsRecord first, OdsRecord second, List<String> fields) {
        for (String field : fields) {
            if (!first.has(field) || !second.has(field)) {
                return false;
            }
            if (!first.stringValue(field).equals(second.stringValue(field))) {
                return false;
            }
        }
        return true;
    }

    public boolean isDuplicate(OdsInstance instance, OdsRecord record, List<String> fields) {
        List<String> checked = fields == null ? instance.getStandard().fields() : fields;
        for (OdsRecord entry : instance.getRecords()) {
            if (isSame(entry, record, checked)) {
                return true;
            }
        }
        return false;
    }

    public Optional<TimeWindow> observation(OdsRecord record, Standard standard, double elevationLimitDeg, Duration timeStep) {
        return horizonCheck.aboveHorizon(record, standard, elevationLimitDeg, timeStep);
    }

    /**
     * Fraction of the overall span covered by the union of the record spans. Records missing a
     * start or stop are left out.
     *
     * @return empty when there is no usable span (no windows, or a zero-length total span)
     */
    public Optional<CoverageReport> coverage(OdsInstance instance) {
        Standard standard = instance.getStandard();
        List<OdsRecord> sorted = RecordSorter.sort(instance.getRecords(), List.of(standard.stop(), standard.start()), false, false);
        List<TimeWindow> windows = new ArrayList<>();
        for (OdsRecord record : sorted) {
            Optional<Instant> start = record.instant(standard.start());
            Optional<Instant> stop = record.instant(standard.stop());
            if (start.isPresent() && stop.isPresent() && !stop.get().isBefore(start.get())) {
                windows.add(new TimeWindow(start.get(), stop.get()));
            }
        }
        List<TimeWindow> merged = IntervalMerger.merge(windows);
        if (merged.isEmpty()) {
            log.error("Instance {}: no records with a usable time span, coverage undefined", instance.getName());
            return Optional.empty();
        }
        Duration covered = Duration.ZERO;
        for (TimeWindow window : merged) {
            covered = covered.plus(window.duration());
        }
        Duration span = Duration.between(merged.get(0).start(), merged.get(merged.size() - 1).stop());
        if (span.isZero()) {
            log.error("Instance {}: total span is zero length, coverage undefined", instance.getName());
            return Optional.empty();
        }
        CoverageReport report = new CoverageReport(covered, span, List.copyOf(merged));
        log.info("Time covered: {} of {} ({}%)", covered, span, String.format("%.1f", 100.0 * report.fraction()));
        return Optional.of(report);
    }

    /**
     * Resolves overlaps between neighbours (in start/stop order) by moving one side by
     * {@code offsetSeconds}. Single pass: an overlap created further down the list is not revisited.
     *
     * @return adjusted copies of the records, sorted by start then stop
     */
    public List<OdsRecord> continuity(OdsInstance instance, double offsetSeconds, AdjustSide adjust) {
        Standard standard = instance.getStandard();
        List<OdsRecord> adjusted = RecordSorter.sort(instance.getRecords(), List.of(standard.start(), standard.stop()), false, false);
        Duration offset = Duration.ofMillis(Math.round(offsetSeconds * 1000.0));
        for (int i = 0; i < adjusted.size() - 1; i++) {
            OdsRecord current = adjusted.get(i);
            OdsRecord next = adjusted.get(i + 1);
            Instant thisStop = current.instant(standard.stop()).orElse(null);
            Instant nextStart = next.instant(standard.start()).orElse(null);
            if (thisStop == null || nextStart == null || !nextStart.isBefore(thisStop)) {
                continue;
            }
            if (adjust == AdjustSide.START) {
                nextStart = thisStop.plus(offset);
            } else {
                thisStop = nextStart.minus(offset);
            }
            current.set(standard.stop(), thisStop);
            next.set(standard.start(), nextStart);
            if (nextStart.isBefore(thisStop)) {
                log.warn("Entries {} and {}: new start is before stop so still need to fix.", i, i + 1);
            }
        }
        return adjusted;
    }
}
