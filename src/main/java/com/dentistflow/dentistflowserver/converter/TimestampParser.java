package com.dentistflow.dentistflowserver.converter;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Parsing of client supplied times. Appointment times are RFC3339 with an offset,
 * list filters are plain ISO dates interpreted in UTC.
 */
public final class TimestampParser {

    private TimestampParser() {
    }

    /**
     * Strict RFC3339 parsing.
     *
     * @throws DateTimeParseException if the value is missing or malformed
     */
    public static Instant parseRfc3339(String value) {
        if (value == null) {
            throw new DateTimeParseException("Missing timestamp", "", 0);
        }
        return OffsetDateTime.parse(value.trim(), DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
    }

    /**
     * Lenient variant used by partial updates and list filters: a malformed value is
     * treated as if it had not been supplied.
     */
    public static Optional<Instant> parseOrOmit(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        try {
            return Optional.of(parseRfc3339(value));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public static Optional<LocalDate> parseDateOrOmit(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        try {
            return Optional.of(LocalDate.parse(value.trim(), DateTimeFormatter.ISO_LOCAL_DATE));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /** 00:00 UTC of the given day. */
    public static Instant startOfDay(LocalDate date) {
        return date.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    /** 23:59 UTC of the given day, the inclusive upper bound of a date range. */
    public static Instant endOfDay(LocalDate date) {
        return startOfDay(date).plusSeconds(23 * 3600 + 59 * 60);
    }
}
