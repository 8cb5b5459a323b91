package org.odsutils.utils;

import java.time.Instant;
import java.util.Optional;

public interface DateInterpreter {

    /**
     * Interprets a date description ("now", "yesterday", "2024-05-01T10:00", "now/30m", an
     * {@link Instant}, ...) as an absolute instant.
     *
     * @return the instant, or empty when the input is {@code null} or cannot be interpreted
     */
    Optional<Instant> interpret(Object input);

    Instant now();
}
