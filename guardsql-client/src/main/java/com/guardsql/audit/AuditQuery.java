package com.guardsql.audit;

import com.guardsql.error.InputException;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Filters for reading audit entries back.
 */
@Value
@Builder
public class AuditQuery {
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /** Maximum entries, 0 for all. */
    @Builder.Default
    int limit = 100;
    /** Take the oldest entries instead of the newest. Output is chronological either way. */
    boolean first;
    String since;
    String until;
    /** Regular expression searched in the query text. */
    String pattern;
    /** Read orphaned stores instead of the main one. */
    boolean orphans;

    long sinceMicros(ZoneId zone) {
        return since == null ? Long.MIN_VALUE : toMicros(parseTimestamp(since, zone));
    }

    long untilMicros(ZoneId zone) {
        return until == null ? Long.MAX_VALUE : toMicros(parseTimestamp(until, zone));
    }

    Pattern compiledPattern() {
        if (pattern == null) {
            return null;
        }
        try {
            return Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw InputException.badArgument(pattern, "a regular expression");
        }
    }

    /**
     * Parse RFC 3339, {@code yyyy-MM-dd HH:mm:ss} or {@code yyyy-MM-dd}, the latter two in the
     * given zone.
     *
     * @param text timestamp text
     * @param zone zone for local forms
     * @return instant
     */
    static Instant parseTimestamp(String text, ZoneId zone) {
        String s = text.trim();
        Instant parsed = tryParse(() -> OffsetDateTime.parse(s).toInstant());
        if (parsed == null) {
            parsed = tryParse(() -> LocalDateTime.parse(s, DATE_TIME).atZone(zone).toInstant());
        }
        if (parsed == null) {
            parsed = tryParse(() -> LocalDate.parse(s).atStartOfDay(zone).toInstant());
        }
        if (parsed == null) {
            throw InputException.badArgument(text, "RFC 3339, 'yyyy-MM-dd HH:mm:ss' or 'yyyy-MM-dd'");
        }
        return parsed;
    }

    private static Instant tryParse(Supplier<Instant> parser) {
        try {
            return parser.get();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Epoch microseconds, clamped to the {@code long} range.
     *
     * @param instant instant
     * @return epoch microseconds
     */
    static long toMicros(Instant instant) {
        try {
            return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000L), instant.getNano() / 1_000);
        } catch (ArithmeticException e) {
            return instant.getEpochSecond() < 0 ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
    }
}
