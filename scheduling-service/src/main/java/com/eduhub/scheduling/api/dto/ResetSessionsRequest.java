package com.eduhub.scheduling.api.dto;

import com.eduhub.common.util.Constants;
import com.eduhub.scheduling.domain.reset.ResetCommand;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;

import java.util.List;

public record ResetSessionsRequest(
        @NotBlank(message = "Environment cannot be blank")
        String env,

        List<String> flags,

        @NotBlank(message = "Start date cannot be blank")
        @Pattern(regexp = Constants.ISO_DATE_PATTERN, message = "Start date must be YYYY-MM-DD")
        String startDate,

        @NotBlank(message = "End date cannot be blank")
        @Pattern(regexp = Constants.ISO_DATE_PATTERN, message = "End date must be YYYY-MM-DD")
        String endDate,

        @NotBlank(message = "Time zone cannot be blank")
        String timeZone,

        @NotEmpty(message = "At least one center is required")
        List<@NotBlank String> centerIds,

        boolean dryRun
) {

    public ResetCommand toCommand(String tenantId, String actorId) {
        return new ResetCommand(env, flags,
                tenantId, actorId, startDate, endDate, timeZone, centerIds, dryRun);
    }
}
