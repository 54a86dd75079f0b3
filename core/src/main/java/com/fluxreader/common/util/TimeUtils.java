package com.fluxreader.common.util;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

public final class TimeUtils {
    private static final DateTimeFormatter LOCAL_STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private TimeUtils() {
    }

    /**
     * Parses an ISO-8601 timestamp with offset or {@code Z} suffix into unix seconds.
     *
     * @return seconds since epoch, or {@code null} if the value is missing or malformed
     */
    public static Long isoToUnix(String iso) {
        if (iso == null || iso.isBlank()) return null;
        try {
            return OffsetDateTime.parse(iso.trim()).toEpochSecond();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Lenient variant used for storage housekeeping: falls back to the date part at noon UTC.
     */
    public static Long dateToUnix(String iso) {
        Long full = isoToUnix(iso);
        if (full != null) return full;
        if (iso == null || iso.length() < 10) return null;
        try {
            return LocalDate.parse(iso.substring(0, 10)).atTime(12, 0).toEpochSecond(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public static String nowStamp() {
        return java.time.LocalDateTime.now().format(LOCAL_STAMP);
    }
}
