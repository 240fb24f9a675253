package com.eduhub.scheduling.api.dto;

import com.eduhub.common.util.Constants;
import com.eduhub.scheduling.domain.model.SessionType;
import com.eduhub.scheduling.domain.service.GenerationCommand;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;

public record RuleRequest(
        @NotNull(message = "Weekday cannot be null")
        @Min(value = 1, message = "Weekday must be 1-7 (Mon-Sun)")
        @Max(value = 7, message = "Weekday must be 1-7 (Mon-Sun)")
        Integer weekday,

        @NotBlank(message = "Start time cannot be blank")
        @Pattern(regexp = Constants.LOCAL_TIME_PATTERN, message = "Start time must be HH:mm")
        String startTime,

        @NotNull(message = "Duration cannot be null")
        @Positive(message = "Duration must be positive")
        Integer durationMinutes,

        @NotBlank(message = "Tutor ID cannot be blank")
        String tutorId,

        @NotBlank(message = "Center ID cannot be blank")
        String centerId,

        String groupId,

        SessionType sessionType
) {

    GenerationCommand.RuleDefinition toDefinition() {
        return new GenerationCommand.RuleDefinition(weekday, startTime, durationMinutes, tutorId, centerId, groupId,
                sessionType);
    }
}
