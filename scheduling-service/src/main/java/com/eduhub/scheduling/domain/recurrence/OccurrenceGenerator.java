package com.eduhub.scheduling.domain.recurrence;

import com.eduhub.common.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Expands a weekly recurrence rule over a term into absolute occurrences.
 *
 * The local wall-clock start is fixed; the UTC instant follows the zone's offset on each
 * date, so the same 18:30 start lands on different UTC instants either side of a DST change.
 * A start inside a DST gap moves forward by the gap length. The end is the (resolved) local
 * start plus the duration on the wall clock, converted with the offset in force at that moment.
 *
 * Pure and deterministic: no I/O, no dependency on the current time.
 */
@Component
public class OccurrenceGenerator {

    public List<Occurrence> generate(Term term, RecurrenceRule rule, ExclusionSet exclusions) {
        if (term == null || rule == null) {
            throw new ValidationException("Term and recurrence rule are required");
        }
        ExclusionSet excluded = exclusions == null ? ExclusionSet.none() : exclusions;
        // Fails fast on midnight-crossing rules before any date is walked
        rule.endTimeLocal();

        LocalTime start = rule.startTimeLocal();
        List<Occurrence> occurrences = new ArrayList<>();
        for (LocalDate date = firstMatchingDate(term, rule);
             !date.isAfter(term.endDate());
             date = date.plusWeeks(1)) {
            if (excluded.contains(date)) {
                continue;
            }
            ZonedDateTime localStart = ZonedDateTime.of(date, start, term.timeZone());
            ZonedDateTime localEnd = ZonedDateTime.of(
                    localStart.toLocalDateTime().plusMinutes(rule.durationMinutes()), term.timeZone());
            occurrences.add(new Occurrence(date, localStart.toInstant(), localEnd.toInstant()));
        }
        occurrences.sort(Comparator.comparing(Occurrence::startAtUtc));
        return occurrences;
    }

    private LocalDate firstMatchingDate(Term term, RecurrenceRule rule) {
        int delta = (rule.weekday().getValue() - term.startDate().getDayOfWeek().getValue() + 7) % 7;
        return term.startDate().plusDays(delta);
    }
}
