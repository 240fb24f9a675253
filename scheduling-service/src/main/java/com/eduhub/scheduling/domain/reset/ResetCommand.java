package com.eduhub.scheduling.domain.reset;

import java.util.List;

/**
 * Operator request to clear generated sessions over a term for some centers.
 * Environment, flag tokens, dates and zone are parsed when the command runs.
 */
public record ResetCommand(
        String environment,
        List<String> flags,
        String tenantId,
        String actorId,
        String startDate,
        String endDate,
        String timeZone,
        List<String> centerIds,
        boolean dryRun
) {
}
