package com.eduhub.scheduling.domain.recurrence;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One concrete instance of a recurrence rule. Exists only during a generation pass.
 */
public record Occurrence(LocalDate localDate, Instant startAtUtc, Instant endAtUtc) {
}
