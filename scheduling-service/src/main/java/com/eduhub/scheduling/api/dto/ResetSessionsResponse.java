package com.eduhub.scheduling.api.dto;

public record ResetSessionsResponse(
        int deletedCount,
        boolean dryRun
) {
}
