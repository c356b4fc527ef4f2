package io.ietfdata.core;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Datatracker timestamps: ISO-8601 local date-times without an offset, always meaning UTC.
 *
 * <p>Fractional seconds are accepted on input ({@code 2019-03-01T10:15:30.123456}) and never written.
 */
public final class Timestamps {
    private Timestamps() {}

    private static final DateTimeFormatter QUERY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    /**
     * Parses a wire timestamp.
     *
     * @throws java.time.format.DateTimeParseException if the text is not a local date-time
     */
    public static Instant parse(String text) {
        Objects.requireNonNull(text, "text");
        return LocalDateTime.parse(text.trim(), DateTimeFormatter.ISO_LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC);
    }

    /**
     * Formats an instant for use as a query parameter value, truncated to whole seconds.
     */
    public static String format(Instant instant) {
        Objects.requireNonNull(instant, "instant");
        return QUERY_FORMAT.format(LocalDateTime.ofInstant(instant.truncatedTo(ChronoUnit.SECONDS), ZoneOffset.UTC));
    }
}
