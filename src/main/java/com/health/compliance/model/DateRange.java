package com.health.compliance.model;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;

/**
 * Inclusive calendar-day range.
 */
public record DateRange(LocalDate start, LocalDate end) {

    public DateRange {
        if (start == null || end == null) {
            throw new IllegalArgumentException("startDate and endDate are required");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("endDate " + end + " is before startDate " + start);
        }
    }

    public static DateRange singleDay(LocalDate day) {
        return new DateRange(day, day);
    }

    /**
     * The {@code days} days ending today, both ends inclusive.
     */
    public static DateRange lastDays(LocalDate today, int days) {
        if (days < 1) {
            throw new IllegalArgumentException("days must be at least 1, got " + days);
        }
        return new DateRange(today.minusDays(days - 1L), today);
    }

    /**
     * Parses optional request parameters. A missing end defaults to today, a missing start to
     * {@code defaultDays} before the end.
     */
    public static DateRange parse(String startDate, String endDate, LocalDate today, int defaultDays) {
        LocalDate end = isBlank(endDate) ? today : parseDate("endDate", endDate);
        LocalDate start = isBlank(startDate) ? end.minusDays(defaultDays - 1L) : parseDate("startDate", startDate);
        return new DateRange(start, end);
    }

    public static LocalDate parseDate(String parameter, String value) {
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(
                    "Invalid " + parameter + " '" + value + "': expected format YYYY-MM-DD");
        }
    }

    public long startMillis(ZoneId zone) {
        return start.atStartOfDay(zone).toInstant().toEpochMilli();
    }

    /** Last millisecond of the end day. */
    public long endMillis(ZoneId zone) {
        return end.plusDays(1).atStartOfDay(zone).toInstant().toEpochMilli() - 1;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
