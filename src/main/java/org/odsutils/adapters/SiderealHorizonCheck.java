package org.odsutils.adapters;

import lombok.extern.slf4j.Slf4j;
import org.odsutils.models.OdsRecord;
import org.odsutils.models.TimeWindow;
import org.odsutils.models.standard.Standard;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Elevation from mean sidereal time and the J2000 source position. No precession, nutation or
 * refraction: good to a fraction of a degree, which is enough for scheduling checks.
 */
@Slf4j
public class SiderealHorizonCheck implements HorizonCheck {

    private static final double SECONDS_PER_DAY = 86_400.0;
    private static final double UNIX_EPOCH_JD = 2_440_587.5;
    private static final double J2000_JD = 2_451_545.0;

    @Override
    public Optional<TimeWindow> aboveHorizon(OdsRecord record, Standard standard, double elevationLimitDeg, Duration timeStep) {
        if (timeStep == null || timeStep.isZero() || timeStep.isNegative()) {
            log.warn("Invalid time step {} for horizon check", timeStep);
            return Optional.empty();
        }
        Instant start = record.instant(standard.start()).orElse(null);
        Instant stop = record.instant(standard.stop()).orElse(null);
        Double lat = degrees(record, standard.lat());
        Double lon = degrees(record, standard.lon());
        Double ra = degrees(record, standard.ra());
        Double dec = degrees(record, standard.dec());
        if (start == null || stop == null || lat == null || lon == null || ra == null || dec == null) {
            log.warn("Record {} lacks times or position for horizon check", record.get(standard.source()));
            return Optional.empty();
        }

        Instant first = null;
        Instant last = null;
        for (Instant step = start; step.isBefore(stop); step = step.plus(timeStep)) {
            if (elevation(step, lat, lon, ra, dec) > elevationLimitDeg) {
                if (first == null) {
                    first = step;
                }
                last = step;
            }
        }
        if (first == null) {
            return Optional.empty();
        }
        return Optional.of(new TimeWindow(first.truncatedTo(ChronoUnit.SECONDS), last.truncatedTo(ChronoUnit.SECONDS)));
    }

    static double elevation(Instant time, double latDeg, double lonDeg, double raDeg, double decDeg) {
        double hourAngle = Math.toRadians(localSiderealDegrees(time, lonDeg) - raDeg);
        double lat = Math.toRadians(latDeg);
        double dec = Math.toRadians(decDeg);
        double sinAlt = Math.sin(dec) * Math.sin(lat) + Math.cos(dec) * Math.cos(lat) * Math.cos(hourAngle);
        return Math.toDegrees(Math.asin(Math.max(-1.0, Math.min(1.0, sinAlt))));
    }

    static double localSiderealDegrees(Instant time, double lonDeg) {
        double julianDate = time.toEpochMilli() / 1000.0 / SECONDS_PER_DAY + UNIX_EPOCH_JD;
        double days = julianDate - J2000_JD;
        double centuries = days / 36_525.0;
        double gmst = 280.46061837 + 360.98564736629 * days + 0.000387933 * centuries * centuries;
        double lst = (gmst + lonDeg) % 360.0;
        return lst < 0 ? lst + 360.0 : lst;
    }

    private static Double degrees(OdsRecord record, String field) {
        if (field == null) {
            return null;
        }
        Object value = record.get(field);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }
}
