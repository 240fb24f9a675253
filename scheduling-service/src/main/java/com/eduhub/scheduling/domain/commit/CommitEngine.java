package com.eduhub.scheduling.domain.commit;

import com.eduhub.common.exception.PersistenceException;
import com.eduhub.scheduling.domain.resolver.Candidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Writes creatable candidates through a {@link SessionWriter} and reconciles the count.
 *
 * A row may be inserted by a concurrent run between the snapshot read and this write; the
 * skip-duplicates write then persists fewer rows than requested. That shortfall is counted
 * as skipped, never raised. Store failures propagate as {@link PersistenceException}; there
 * are no retries here because every write path is idempotent.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CommitEngine {

    private final Map<String, SessionWriter> writers;

    public SessionWriter writer(boolean dryRun) {
        SessionWriter writer = writers.get(dryRun ? DryRunSessionWriter.NAME : LiveSessionWriter.NAME);
        if (writer == null) {
            throw new IllegalStateException("No session writer registered for dryRun=" + dryRun);
        }
        return writer;
    }

    public CommitSummary commit(String tenantId, String timezone, List<Candidate> creatable, SessionWriter writer) {
        if (creatable.isEmpty()) {
            return new CommitSummary(0, 0, 0, List.of(), writer.isDryRun());
        }

        List<NewSession> rows = creatable.stream()
                .map(candidate -> NewSession.from(tenantId, candidate, timezone))
                .toList();

        int persisted = writer.write(rows);
        int shortfall = rows.size() - persisted;
        if (shortfall > 0) {
            log.warn("Concurrent insert detected for tenant {}: {} of {} sessions already existed at write time",
                    tenantId, shortfall, rows.size());
        }
        return new CommitSummary(persisted, Math.max(shortfall, 0), 0, List.of(), writer.isDryRun());
    }
}
