package com.eduhub.scheduling.domain.recurrence;

import com.eduhub.common.exception.ValidationException;

import java.time.Instant;
import java.util.Collection;

/**
 * Half-open absolute window {@code [start, endExclusive)}.
 */
public record BookingWindow(Instant start, Instant endExclusive) {

    public BookingWindow {
        if (start == null || endExclusive == null) {
            throw new ValidationException("Window requires start and end");
        }
        if (!endExclusive.isAfter(start)) {
            throw new ValidationException("Window end must be after its start");
        }
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(endExclusive);
    }

    /**
     * Smallest window holding every occurrence from its start up to its end.
     */
    public static BookingWindow enclosing(Collection<Occurrence> occurrences) {
        if (occurrences.isEmpty()) {
            throw new IllegalArgumentException("Cannot build a window over no occurrences");
        }
        Instant from = null;
        Instant to = null;
        for (Occurrence occurrence : occurrences) {
            if (from == null || occurrence.startAtUtc().isBefore(from)) {
                from = occurrence.startAtUtc();
            }
            if (to == null || occurrence.endAtUtc().isAfter(to)) {
                to = occurrence.endAtUtc();
            }
        }
        return new BookingWindow(from, to);
    }
}
