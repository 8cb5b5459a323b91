package org.odsutils.adapters;

import org.junit.jupiter.api.Test;
import org.odsutils.OdsTestFixtures;
import org.odsutils.models.OdsRecord;
import org.odsutils.models.TimeWindow;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SiderealHorizonCheckTest {

    private final SiderealHorizonCheck horizonCheck = new SiderealHorizonCheck();

    private OdsRecord record(double ra, double dec) {
        Map<String, Object> entry = OdsTestFixtures.entry("src", "2024-06-01T00:00:00", "2024-06-01T01:00:00");
        entry.put("src_ra_j2000_deg", ra);
        entry.put("src_dec_j2000_deg", dec);
        return OdsTestFixtures.normalizer().normalize(entry, Map.of());
    }

    @Test
    void siderealTimeAtJ2000() {
        assertThat(SiderealHorizonCheck.localSiderealDegrees(Instant.parse("2000-01-01T12:00:00Z"), 0.0))
                .isCloseTo(280.46061837, within(1e-6));
    }

    @Test
    void poleSitsAtSiteLatitude() {
        double elevation = SiderealHorizonCheck.elevation(Instant.parse("2024-06-01T00:00:00Z"), 40.8, -121.5, 0.0, 90.0);

        assertThat(elevation).isCloseTo(40.8, within(1e-6));
    }

    @Test
    void circumpolarSourceIsVisibleThroughout() {
        Optional<TimeWindow> window = horizonCheck.aboveHorizon(record(37.95, 89.26), OdsTestFixtures.standard(), 30.0, Duration.ofMinutes(10));

        assertThat(window).contains(new TimeWindow(
                Instant.parse("2024-06-01T00:00:00Z"),
                Instant.parse("2024-06-01T00:50:00Z")));
    }

    @Test
    void southernSourceNeverRises() {
        assertThat(horizonCheck.aboveHorizon(record(0.0, -80.0), OdsTestFixtures.standard(), 0.0, Duration.ofMinutes(10)))
                .isEmpty();
    }

    @Test
    void missingPositionGivesNoWindow() {
        OdsRecord record = record(0.0, 0.0);
        record.set("src_ra_j2000_deg", null);

        assertThat(horizonCheck.aboveHorizon(record, OdsTestFixtures.standard(), 0.0, Duration.ofMinutes(10))).isEmpty();
    }
}
