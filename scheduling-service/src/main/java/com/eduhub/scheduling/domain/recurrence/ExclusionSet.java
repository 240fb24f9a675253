package com.eduhub.scheduling.domain.recurrence;

import com.eduhub.common.exception.ValidationException;
import com.eduhub.common.util.Constants;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Local calendar dates (in the term's zone) on which no occurrence is generated.
 */
public record ExclusionSet(Set<LocalDate> dates) {

    private static final Pattern DATE = Pattern.compile(Constants.ISO_DATE_PATTERN);
    private static final ExclusionSet NONE = new ExclusionSet(Set.of());

    public ExclusionSet {
        dates = dates == null ? Set.of() : Set.copyOf(dates);
    }

    public static ExclusionSet none() {
        return NONE;
    }

    public static ExclusionSet of(Collection<LocalDate> dates) {
        return new ExclusionSet(Set.copyOf(dates));
    }

    /**
     * Parses blackout-date lines. Blank lines and lines starting with {@code #} are ignored;
     * anything else must be a valid {@code YYYY-MM-DD} date.
     */
    public static ExclusionSet parse(List<String> lines) {
        if (lines == null || lines.isEmpty()) {
            return NONE;
        }
        Set<LocalDate> parsed = new TreeSet<>();
        for (String line : lines) {
            String trimmed = line == null ? "" : line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            if (!DATE.matcher(trimmed).matches()) {
                throw new ValidationException("Invalid exclude date format: " + trimmed);
            }
            try {
                parsed.add(LocalDate.parse(trimmed));
            } catch (DateTimeParseException e) {
                throw new ValidationException("Invalid exclude date: " + trimmed, e);
            }
        }
        return new ExclusionSet(parsed);
    }

    public boolean contains(LocalDate date) {
        return dates.contains(date);
    }

    public int size() {
        return dates.size();
    }
}
