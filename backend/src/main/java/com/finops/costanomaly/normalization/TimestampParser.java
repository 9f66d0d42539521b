package com.finops.costanomaly.normalization;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;

/**
 * ISO-8601 timestamp parsing shared by every stage of the engine.
 *
 * Accepted forms:
 * 1. Date-time with zone designator or offset: 2024-03-01T10:00:00Z, 2024-03-01T10:00:00+02:00
 * 2. Local date-time, read as UTC: 2024-03-01T10:00:00
 * 3. Calendar date, read as UTC midnight: 2024-03-01
 * 4. Forms 1 and 2 with a space instead of 'T': 2024-03-01 10:00:00
 *
 * Anything else is reported as empty so that callers can skip the record.
 */
public final class TimestampParser {

    private TimestampParser() {
    }

    public static Optional<Instant> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String text = value.trim();
        if (text.length() > 10 && text.charAt(10) == ' ') {
            text = text.substring(0, 10) + 'T' + text.substring(11);
        }

        if (text.indexOf('T') < 0) {
            return parseDate(text);
        }

        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(text, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return Optional.of(((OffsetDateTime) parsed).toInstant());
            }
            return Optional.of(((LocalDateTime) parsed).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Optional<Instant> parseDate(String text) {
        try {
            return Optional.of(LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
