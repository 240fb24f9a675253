package com.eduhub.scheduling.domain.recurrence;

import com.eduhub.common.exception.ValidationException;
import com.eduhub.common.util.Constants;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.format.TextStyle;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Weekly booking pattern: one weekday, a local start time and a duration.
 * Weekdays use ISO numbering (1 = Monday ... 7 = Sunday).
 */
public record RecurrenceRule(DayOfWeek weekday, LocalTime startTimeLocal, int durationMinutes) {

    private static final Pattern TIME = Pattern.compile(Constants.LOCAL_TIME_PATTERN);
    private static final int MINUTES_PER_DAY = 24 * 60;

    public RecurrenceRule {
        if (weekday == null || startTimeLocal == null) {
            throw new ValidationException("Recurrence rule requires weekday and startTimeLocal");
        }
        if (durationMinutes <= 0) {
            throw new ValidationException("durationMinutes must be positive");
        }
        startTimeLocal = startTimeLocal.withSecond(0).withNano(0);
    }

    public static RecurrenceRule of(int isoWeekday, String startTimeLocal, int durationMinutes) {
        if (isoWeekday < 1 || isoWeekday > 7) {
            throw new ValidationException("weekday must be 1-7, got " + isoWeekday);
        }
        if (startTimeLocal == null || !TIME.matcher(startTimeLocal.trim()).matches()) {
            throw new ValidationException("startTimeLocal must be HH:mm, got " + startTimeLocal);
        }
        return new RecurrenceRule(DayOfWeek.of(isoWeekday), LocalTime.parse(startTimeLocal.trim()), durationMinutes);
    }

    /**
     * Local end time on the same calendar day.
     *
     * @throws ValidationException when the session would end at or after local midnight
     */
    public LocalTime endTimeLocal() {
        int startMinute = startTimeLocal.getHour() * 60 + startTimeLocal.getMinute();
        if (startMinute + durationMinutes >= MINUTES_PER_DAY) {
            throw new ValidationException(String.format(
                    "durationMinutes crosses midnight; adjust schedule for start %s (%d min)",
                    startTimeLocal, durationMinutes));
        }
        return startTimeLocal.plusMinutes(durationMinutes);
    }

    /** Operator-facing label, e.g. {@code Tue 6:30 PM (60 min)}. */
    public String label() {
        int hour = startTimeLocal.getHour();
        int hour12 = hour % 12 == 0 ? 12 : hour % 12;
        String suffix = hour >= 12 ? "PM" : "AM";
        return String.format("%s %d:%02d %s (%d min)",
                weekday.getDisplayName(TextStyle.SHORT, Locale.ENGLISH),
                hour12, startTimeLocal.getMinute(), suffix, durationMinutes);
    }
}
