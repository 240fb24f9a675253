package com.eduhub.scheduling.api.dto;

import com.eduhub.common.util.Constants;
import com.eduhub.scheduling.domain.service.GenerationCommand;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;

import java.util.List;

public record GenerateSessionsRequest(
        @NotBlank(message = "Environment cannot be blank")
        String env,

        List<String> flags,

        @NotBlank(message = "Term start cannot be blank")
        @Pattern(regexp = Constants.ISO_DATE_PATTERN, message = "Term start must be YYYY-MM-DD")
        String termStart,

        @Pattern(regexp = Constants.ISO_DATE_PATTERN, message = "Term end must be YYYY-MM-DD")
        String termEnd,

        @Positive(message = "Weeks must be positive")
        Integer weeks,

        @NotBlank(message = "Time zone cannot be blank")
        String timeZone,

        @NotEmpty(message = "At least one rule is required")
        List<@NotNull(message = "Rule cannot be null") @Valid RuleRequest> rules,

        List<String> excludeDates,

        boolean replaceExistingInRange,

        boolean dryRun
) {

    public GenerationCommand toCommand(String tenantId, String actorId) {
        return new GenerationCommand(
                env,
                flags,
                tenantId,
                actorId,
                termStart,
                termEnd,
                weeks,
                timeZone,
                rules.stream().map(RuleRequest::toDefinition).toList(),
                excludeDates,
                replaceExistingInRange,
                dryRun);
    }
}
