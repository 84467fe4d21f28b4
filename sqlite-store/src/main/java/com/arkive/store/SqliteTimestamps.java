package com.arkive.store;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Text form of instants in the store. Fixed width UTC with millisecond precision, so that comparing the text
 * compares the instants.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class SqliteTimestamps {

    private static final DateTimeFormatter FORMATTER =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSX").withZone(ZoneOffset.UTC);

    public static Instant truncate(Instant instant) {
        return instant.truncatedTo(ChronoUnit.MILLIS);
    }

    public static String format(Instant instant) {
        return instant == null ? null : FORMATTER.format(instant);
    }

    /**
     * Formats the smallest stored instant not before {@code instant}, for use as an inclusive lower bound.
     */
    public static String formatCeiling(Instant instant) {
        if (instant == null) {
            return null;
        }
        Instant truncated = truncate(instant);
        return format(truncated.equals(instant) ? truncated : truncated.plusMillis(1));
    }

    public static Instant parse(String text) {
        return text == null ? null : Instant.parse(text);
    }
}
