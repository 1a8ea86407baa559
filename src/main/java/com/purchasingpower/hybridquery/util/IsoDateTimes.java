package com.purchasingpower.hybridquery.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * ISO-8601 date-time handling shared by validation and the stores.
 * Values without an offset are taken as UTC.
 */
public final class IsoDateTimes {

    private static final List<Function<String, Instant>> PARSERS = List.of(
        Instant::parse,
        text -> OffsetDateTime.parse(text).toInstant(),
        text -> ZonedDateTime.parse(text).toInstant(),
        text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC),
        text -> LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC));

    private IsoDateTimes() {
    }

    /**
     * Parse an instant, offset or zoned date-time, local date-time or date.
     */
    public static Optional<Instant> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        return PARSERS.stream()
            .map(parser -> tryParse(parser, trimmed))
            .flatMap(Optional::stream)
            .findFirst();
    }

    private static Optional<Instant> tryParse(Function<String, Instant> parser, String text) {
        try {
            return Optional.of(parser.apply(text));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Convert a {@code java.time} value to an instant, or empty for types without
     * a point on the time line (e.g. {@code LocalTime}).
     */
    public static Optional<Instant> toInstant(TemporalAccessor temporal) {
        if (temporal instanceof Instant instant) {
            return Optional.of(instant);
        }
        if (temporal instanceof OffsetDateTime dateTime) {
            return Optional.of(dateTime.toInstant());
        }
        if (temporal instanceof ZonedDateTime dateTime) {
            return Optional.of(dateTime.toInstant());
        }
        if (temporal instanceof LocalDateTime dateTime) {
            return Optional.of(dateTime.toInstant(ZoneOffset.UTC));
        }
        if (temporal instanceof LocalDate date) {
            return Optional.of(date.atStartOfDay().toInstant(ZoneOffset.UTC));
        }
        return Optional.empty();
    }
}
