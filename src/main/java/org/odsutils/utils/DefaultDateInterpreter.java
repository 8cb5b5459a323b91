package org.odsutils.utils;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Interprets the date descriptions accepted throughout the tools. Naive date-times are taken as UTC.
 * A trailing {@code /offset} shifts the base time, e.g. {@code now/90m}, {@code 2024-01-01T00:00/-2h};
 * an offset without a unit is in minutes.
 */
@Slf4j
public class DefaultDateInterpreter implements DateInterpreter {

    private static final Map<Character, Double> OFFSET_UNIT_SECONDS = Map.of(
            'd', 24.0 * 3600.0,
            'h', 3600.0,
            'm', 60.0,
            's', 1.0
    );

    private static final Pattern OFFSET = Pattern.compile("^[+-]?\\d+(\\.\\d*)?[dhms]?$");
    private static final Pattern YEAR = Pattern.compile("^\\d{4}$");
    private static final Pattern YEAR_MONTH = Pattern.compile("^\\d{4}-\\d{2}$");
    private static final Pattern SPACE_SEPARATED = Pattern.compile("^\\d{4}-\\d{2}-\\d{2} \\d.*");

    private static final List<DateTimeFormatter> COMPACT_FORMATS = List.of(
            "uuuu-MM-dd'T'HH:mm", "yy-MM-dd'T'HH:mm",
            "uuuu-MM-dd HH:mm", "yy-MM-dd HH:mm",
            "uuuu/MM/dd'T'HH:mm", "yy/MM/dd'T'HH:mm",
            "uuuu/MM/dd HH:mm", "yy/MM/dd HH:mm",
            "dd/MM/uuuu'T'HH:mm", "dd/MM/yy'T'HH:mm",
            "dd/MM/uuuu HH:mm", "dd/MM/yy HH:mm",
            "uuuuMMdd'T'HHmm", "yyMMdd'T'HHmm",
            "uuuuMMdd HHmm", "yyMMdd HHmm",
            "uuuuMMdd_HHmm", "yyMMdd_HHmm",
            "uuuuMMddHHmm", "yyMMddHHmm"
    ).stream().map(pattern -> DateTimeFormatter.ofPattern(pattern, Locale.ROOT)).toList();

    private final Clock clock;

    public DefaultDateInterpreter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Instant now() {
        return clock.instant();
    }

    @Override
    public Optional<Instant> interpret(Object input) {
        if (input == null) {
            return Optional.empty();
        }
        if (input instanceof Instant instant) {
            return Optional.of(instant);
        }
        if (input instanceof OffsetDateTime offsetDateTime) {
            return Optional.of(offsetDateTime.toInstant());
        }
        if (input instanceof ZonedDateTime zonedDateTime) {
            return Optional.of(zonedDateTime.toInstant());
        }
        if (input instanceof LocalDateTime localDateTime) {
            return Optional.of(localDateTime.toInstant(ZoneOffset.UTC));
        }
        if (input instanceof LocalDate localDate) {
            return Optional.of(localDate.atStartOfDay().toInstant(ZoneOffset.UTC));
        }
        if (input instanceof Date date) {
            return Optional.of(date.toInstant());
        }
        return interpretText(input.toString().trim());
    }

    private Optional<Instant> interpretText(String text) {
        if (text.isEmpty()) {
            return Optional.empty();
        }
        int slash = text.lastIndexOf('/');
        if (slash > 0 && isOffset(text.substring(0, slash), text.substring(slash + 1))) {
            Optional<Duration> offset = parseOffset(text.substring(slash + 1));
            if (offset.isEmpty()) {
                return Optional.empty();
            }
            return interpretText(text.substring(0, slash).trim()).map(base -> base.plus(offset.get()));
        }

        switch (text.toLowerCase(Locale.ROOT)) {
            case "now", "today", "current" -> {
                return Optional.of(now());
            }
            case "yesterday" -> {
                return Optional.of(now().minus(Duration.ofHours(24)));
            }
            case "tomorrow" -> {
                return Optional.of(now().plus(Duration.ofHours(24)));
            }
            default -> {
                // fall through to the formatted forms
            }
        }

        if (YEAR.matcher(text).matches()) {
            return attempt(() -> LocalDate.of(Integer.parseInt(text), 1, 1).atStartOfDay().toInstant(ZoneOffset.UTC));
        }
        if (YEAR_MONTH.matcher(text).matches()) {
            return attempt(() -> YearMonth.parse(text).atDay(1).atStartOfDay().toInstant(ZoneOffset.UTC));
        }

        String iso = SPACE_SEPARATED.matcher(text).matches() ? text.replaceFirst(" ", "T") : text;
        Optional<Instant> parsed = attempt(() -> Instant.parse(iso))
                .or(() -> attempt(() -> OffsetDateTime.parse(iso).toInstant()))
                .or(() -> attempt(() -> LocalDateTime.parse(iso).toInstant(ZoneOffset.UTC)))
                .or(() -> attempt(() -> LocalDate.parse(iso).atStartOfDay().toInstant(ZoneOffset.UTC)));
        if (parsed.isPresent()) {
            return parsed;
        }
        for (DateTimeFormatter formatter : COMPACT_FORMATS) {
            parsed = attempt(() -> LocalDateTime.parse(text, formatter).toInstant(ZoneOffset.UTC));
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        log.debug("Unable to interpret '{}' as a date", text);
        return Optional.empty();
    }

    /**
     * A unitless tail after a base that itself holds a {@code /} is a date part ({@code 2024/05/17}),
     * not an offset in minutes.
     */
    private static boolean isOffset(String base, String tail) {
        if (!OFFSET.matcher(tail).matches()) {
            return false;
        }
        boolean hasUnit = OFFSET_UNIT_SECONDS.containsKey(tail.charAt(tail.length() - 1));
        return hasUnit || base.indexOf('/') < 0;
    }

    private Optional<Duration> parseOffset(String offset) {
        char unit = offset.charAt(offset.length() - 1);
        try {
            double seconds;
            if (OFFSET_UNIT_SECONDS.containsKey(unit)) {
                seconds = OFFSET_UNIT_SECONDS.get(unit) * Double.parseDouble(offset.substring(0, offset.length() - 1));
            } else {
                seconds = 60.0 * Double.parseDouble(offset);
            }
            return Optional.of(Duration.ofMillis(Math.round(seconds * 1000.0)));
        } catch (NumberFormatException ex) {
            log.debug("Invalid time offset '{}'", offset);
            return Optional.empty();
        }
    }

    private static Optional<Instant> attempt(Supplier<Instant> parser) {
        try {
            return Optional.of(parser.get());
        } catch (DateTimeException | NumberFormatException ex) {
            return Optional.empty();
        }
    }
}
