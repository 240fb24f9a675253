package com.eduhub.scheduling.domain.commit;

import java.util.List;

public record CommitSummary(int createdCount, int skippedCount, int deletedCount, List<String> conflicts, boolean dryRun) {

    public CommitSummary {
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
    }

    public CommitSummary withDeleted(int deleted) {
        return new CommitSummary(createdCount, skippedCount, deleted, conflicts, dryRun);
    }

    public CommitSummary withAdditionalSkipped(int skipped, List<String> batchConflicts) {
        return new CommitSummary(createdCount, skippedCount + skipped, deletedCount, batchConflicts, dryRun);
    }
}
