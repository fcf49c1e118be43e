package com.quarry.service.frame;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.util.regex.Pattern;

/**
 * Converts backend timestamp values to epoch milliseconds.
 *
 * Numbers above 5e14 are microseconds, numbers below 10 billion are seconds,
 * anything in between is already milliseconds. Strings are parsed as dates and read as UTC
 * unless they carry a zone or offset.
 */
public final class TimeNormalizer {

    static final long MICROS_THRESHOLD = 500_000_000_000_000L;
    static final long SECONDS_THRESHOLD = 10_000_000_000L;
    static final long TIME_LIKE_NUMBER_THRESHOLD = 1_000_000_000L;

    private static final Pattern ISO_PREFIX = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}:\\d{2}");
    private static final Pattern EXPLICIT_ZONE = Pattern.compile("(Z|[+-]\\d{2}:?\\d{2})$");

    // yyyy-MM-dd[T| ]HH:mm[:ss[.fraction]]
    private static final DateTimeFormatter LOCAL_DATE_TIME = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .appendValue(ChronoField.HOUR_OF_DAY, 2)
            .appendLiteral(':')
            .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
            .optionalStart()
            .appendLiteral(':')
            .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .optionalEnd()
            .toFormatter();

    private TimeNormalizer() {
    }

    /**
     * @return epoch millis, or null when the value is missing or unparseable
     */
    public static Long toMillis(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return numberToMillis(number);
        }
        if (value instanceof String text) {
            Instant instant = parseInstant(text);
            return instant != null ? instant.toEpochMilli() : null;
        }
        return null;
    }

    static long numberToMillis(Number number) {
        double raw = number.doubleValue();
        long value = number.longValue();
        if (raw > MICROS_THRESHOLD) {
            return value / 1000L;
        }
        if (raw < SECONDS_THRESHOLD) {
            return Math.round(raw * 1000d);
        }
        return value;
    }

    /**
     * Whether a value looks like a timestamp: a number above one billion, an ISO-like
     * date-time string, or any date string of at least 10 characters.
     */
    public static boolean isTimeLike(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue() > TIME_LIKE_NUMBER_THRESHOLD;
        }
        if (value instanceof String text) {
            if (ISO_PREFIX.matcher(text).find()) {
                return true;
            }
            return text.length() >= 10 && parseInstant(text) != null;
        }
        return false;
    }

    static Instant parseInstant(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (EXPLICIT_ZONE.matcher(trimmed).find()) {
            Instant zoned = parseZoned(trimmed);
            if (zoned != null) {
                return zoned;
            }
        }
        try {
            return LocalDateTime.parse(trimmed, LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC);
        } catch (DateTimeException ignored) {
            // not a local date-time, try a bare date next
        }
        try {
            return LocalDate.parse(trimmed, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeException ignored) {
            // fall through to RFC 1123
        }
        try {
            return ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        } catch (DateTimeException e) {
            return null;
        }
    }

    private static Instant parseZoned(String text) {
        String normalized = text.replace(' ', 'T');
        try {
            return OffsetDateTime.parse(normalized, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        } catch (DateTimeException e) {
            try {
                // offsets written without a colon, e.g. +0530
                return OffsetDateTime.parse(normalized, DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss[.SSSSSSSSS][.SSSSSS][.SSS]XX"))
                        .toInstant();
            } catch (DateTimeException ignored) {
                return null;
            }
        }
    }
}
