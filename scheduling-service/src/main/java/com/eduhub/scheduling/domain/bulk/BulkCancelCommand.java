package com.eduhub.scheduling.domain.bulk;

import com.eduhub.scheduling.domain.model.CancelReasonCode;

import java.util.List;

public record BulkCancelCommand(
        String environment,
        List<String> flags,
        String tenantId,
        String actorId,
        List<String> sessionIds,
        CancelReasonCode reasonCode
) {
}
