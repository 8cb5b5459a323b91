package org.odsutils.utils;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

public final class TimeFormats {

    /** External form written to ODS files: ISO-8601, whole seconds, UTC, no zone designator. */
    public static final DateTimeFormatter ISO_SECONDS =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss").withZone(ZoneOffset.UTC);

    // fixed width so that string order matches time order
    private static final DateTimeFormatter SORTABLE =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSS").withZone(ZoneOffset.UTC);

    private TimeFormats() {
    }

    public static String isoSeconds(Instant instant) {
        return instant == null ? null : ISO_SECONDS.format(instant.truncatedTo(ChronoUnit.SECONDS));
    }

    public static String sortable(Instant instant) {
        return SORTABLE.format(instant);
    }

    /**
     * Renders a field value the way it is compared and sorted: instants in fixed-width UTC form,
     * {@code null} as {@code None}, everything else through {@link String#valueOf(Object)}.
     */
    public static String stringify(Object value) {
        if (value == null) {
            return "None";
        }
        if (value instanceof Instant instant) {
            return sortable(instant);
        }
        return String.valueOf(value);
    }

    /** Converts instants to their external form and leaves every other value untouched. */
    public static Object externalValue(Object value) {
        if (value instanceof Instant instant) {
            return isoSeconds(instant);
        }
        return value;
    }
}
