package com.facttracker.service;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;

/**
 * Reading and writing of the timestamps stored inside the fact ledger.
 *
 * Writes always use the second-precision form {@code yyyy-MM-dd'T'HH:mm:ss'Z'}.
 * Reads also accept legacy values with fractional seconds, a numeric offset,
 * or no zone designator at all (taken as UTC). Anything else reads as absent,
 * including impossible calendar dates and instants outside years 0001-9999.
 */
public final class FactTimestamps {

    private static final DateTimeFormatter WIRE_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    private static final DateTimeFormatter LENIENT_READ_FORMAT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT);

    private static final Instant EARLIEST = Instant.parse("0001-01-01T00:00:00Z");
    private static final Instant LATEST = Instant.parse("9999-12-31T23:59:59Z");

    private FactTimestamps() {
    }

    /**
     * Formats an instant in the ledger wire format, dropping sub-second precision.
     *
     * @param instant the instant to format
     * @return e.g. {@code 2024-01-15T10:30:00Z}
     */
    public static String format(Instant instant) {
        return WIRE_FORMAT.format(instant.truncatedTo(ChronoUnit.SECONDS));
    }

    /**
     * Parses a stored {@code learned_at} value.
     *
     * @param raw the stored text, possibly null
     * @return the instant, or empty when the value is absent or unparsable
     */
    public static Optional<Instant> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            TemporalAccessor parsed = LENIENT_READ_FORMAT.parseBest(raw.trim(),
                    OffsetDateTime::from, LocalDateTime::from);
            Instant instant = parsed instanceof OffsetDateTime
                    ? ((OffsetDateTime) parsed).toInstant()
                    : ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
            if (instant.isBefore(EARLIEST) || instant.isAfter(LATEST)) {
                return Optional.empty();
            }
            return Optional.of(instant);
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    /**
     * Parses a stored {@code last_activity_date} value ({@code yyyy-MM-dd}).
     *
     * @param raw the stored text, possibly null
     * @return the date, or empty when the value is absent or malformed
     */
    public static Optional<LocalDate> parseDate(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(raw.trim(), DateTimeFormatter.ISO_LOCAL_DATE));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    public static String formatDate(LocalDate date) {
        return DateTimeFormatter.ISO_LOCAL_DATE.format(date);
    }
}
