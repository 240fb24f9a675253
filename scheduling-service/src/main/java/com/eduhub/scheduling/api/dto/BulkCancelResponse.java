package com.eduhub.scheduling.api.dto;

public record BulkCancelResponse(
        int requestedCount,
        int canceledCount
) {
}
