package com.eduhub.scheduling.api.dto;

import com.eduhub.scheduling.domain.commit.CommitSummary;
import com.eduhub.scheduling.domain.service.GenerationReport;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for session generation. Only the first few conflicts are returned.
 */
public record GenerateSessionsResponse(
        int candidateCount,
        int createdCount,
        int skippedCount,
        int alreadyExistsCount,
        int deletedCount,
        int conflictCount,
        List<String> sampleConflicts,
        boolean dryRun,
        Instant rangeFrom,
        Instant rangeTo,
        List<String> schedules
) {

    static final int SAMPLE_LIMIT = 10;

    public static GenerateSessionsResponse from(GenerationReport report) {
        CommitSummary summary = report.summary();
        List<String> conflicts = summary.conflicts();
        return new GenerateSessionsResponse(
                report.candidateCount(),
                summary.createdCount(),
                summary.skippedCount(),
                report.alreadyExistsCount(),
                summary.deletedCount(),
                conflicts.size(),
                conflicts.subList(0, Math.min(SAMPLE_LIMIT, conflicts.size())),
                summary.dryRun(),
                report.range().start(),
                report.range().endExclusive(),
                report.scheduleLabels());
    }
}
