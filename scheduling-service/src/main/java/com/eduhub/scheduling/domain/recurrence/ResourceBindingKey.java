package com.eduhub.scheduling.domain.recurrence;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Uniqueness domain of a booking: two sessions with the same tutor, center and start
 * instant conflict no matter which rule produced them.
 * The start is kept at millisecond precision so equality matches the store's key.
 */
public record ResourceBindingKey(String tutorId, String centerId, Instant startAt) {

    public ResourceBindingKey {
        Objects.requireNonNull(tutorId, "tutorId");
        Objects.requireNonNull(centerId, "centerId");
        startAt = Objects.requireNonNull(startAt, "startAt").truncatedTo(ChronoUnit.MILLIS);
    }

    public String format() {
        return tutorId + "-" + centerId + "-" + startAt.toEpochMilli();
    }
}
