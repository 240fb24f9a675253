package com.eduhub.scheduling.api.dto;

import com.eduhub.scheduling.domain.bulk.BulkCancelCommand;
import com.eduhub.scheduling.domain.model.CancelReasonCode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

public record BulkCancelRequest(
        @NotBlank(message = "Environment cannot be blank")
        String env,

        List<String> flags,

        @NotEmpty(message = "Session IDs cannot be empty")
        @Size(max = 500, message = "At most 500 sessions per request")
        List<@NotBlank String> sessionIds,

        @NotNull(message = "Reason code cannot be null")
        CancelReasonCode reasonCode
) {

    public BulkCancelCommand toCommand(String tenantId, String actorId) {
        return new BulkCancelCommand(env, flags,
                tenantId, actorId, sessionIds, reasonCode);
    }
}
