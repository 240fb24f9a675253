package com.eduhub.scheduling.domain.service;

import com.eduhub.scheduling.domain.commit.CommitSummary;
import com.eduhub.scheduling.domain.recurrence.BookingWindow;

import java.util.List;

/**
 * @param summary            created, skipped (already stored plus race shortfall), deleted, batch conflicts
 * @param alreadyExistsCount candidates whose binding was already stored at snapshot time
 * @param range              term window in UTC
 * @param scheduleLabels     one label per rule, e.g. {@code Tue 6:30 PM (60 min)}
 */
public record GenerationReport(
        CommitSummary summary,
        int candidateCount,
        int alreadyExistsCount,
        BookingWindow range,
        List<String> scheduleLabels
) {
}
