package com.eduhub.scheduling.domain.store;

import java.time.Instant;

/**
 * Earliest and latest start among a selection of sessions, both inclusive.
 */
public record StartRange(Instant earliest, Instant latest) {
}
