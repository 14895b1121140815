package com.driftwatch.core.ledger;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;

/**
 * Parses the {@code date} column of the ledger tables.
 * <p>
 * Driftwatch writes ISO-8601 instants. External stages may write local
 * date-times such as {@code 2023-06-20 14:03:11.123456} or plain dates;
 * those are read as UTC.
 */
final class LedgerTimestamps {

    private static final DateTimeFormatter SPACED_LOCAL = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .optionalEnd()
            .toFormatter();

    private LedgerTimestamps() {}

    static String format(Instant instant) {
        return instant.toString();
    }

    /**
     * @throws IllegalArgumentException if the value matches none of the accepted forms
     */
    static Instant parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("blank timestamp");
        }
        String value = raw.trim();
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException ignored) {
            // fall through to the local forms
        }
        try {
            return LocalDateTime.parse(value, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            // fall through
        }
        try {
            return LocalDateTime.parse(value, SPACED_LOCAL).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            // fall through
        }
        try {
            return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("unrecognised timestamp '" + value + "'", e);
        }
    }
}
