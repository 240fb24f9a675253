package com.eduhub.scheduling.domain.recurrence;

import com.eduhub.common.exception.ValidationException;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;

/**
 * Inclusive local-date window over which recurrence rules are expanded.
 */
public record Term(LocalDate startDate, LocalDate endDate, ZoneId timeZone) {

    public Term {
        if (startDate == null || endDate == null || timeZone == null) {
            throw new ValidationException("Term requires startDate, endDate and timeZone");
        }
        if (endDate.isBefore(startDate)) {
            throw new ValidationException("endDate must be on or after startDate");
        }
    }

    public static Term of(String startDate, String endDate, String timeZone) {
        return new Term(parseDate("startDate", startDate), parseDate("endDate", endDate), parseZone(timeZone));
    }

    /**
     * Term starting on {@code startDate} and covering exactly {@code weeks} weeks, so that
     * every weekday occurs {@code weeks} times.
     */
    public static Term spanningWeeks(LocalDate startDate, int weeks, ZoneId timeZone) {
        if (weeks <= 0) {
            throw new ValidationException("weeks must be positive");
        }
        if (startDate == null) {
            throw new ValidationException("Term requires startDate, endDate and timeZone");
        }
        return new Term(startDate, startDate.plusWeeks(weeks).minusDays(1), timeZone);
    }

    /**
     * Absolute window from local midnight of the first day up to (excluding) local midnight
     * after the last day.
     */
    public BookingWindow toUtcWindow() {
        return new BookingWindow(
                startDate.atStartOfDay(timeZone).toInstant(),
                endDate.plusDays(1).atStartOfDay(timeZone).toInstant());
    }

    public static LocalDate parseDate(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ValidationException(field + " must be YYYY-MM-DD: " + value, e);
        }
    }

    public static ZoneId parseZone(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("timeZone is required");
        }
        String zone = value.trim();
        if (!ZoneId.getAvailableZoneIds().contains(zone)) {
            throw new ValidationException("timeZone must be a valid IANA timezone: " + value);
        }
        return ZoneId.of(zone);
    }
}
