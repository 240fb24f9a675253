package com.eduhub.scheduling.domain.service;

import com.eduhub.scheduling.domain.model.SessionType;

import java.util.List;

/**
 * Operator request to expand recurrence rules over a term.
 *
 * The term is either {@code termStart..termEnd} or {@code termStart} plus {@code weeks}.
 * Raw operator values (environment, flag tokens, dates, rules) are parsed inside the pipeline,
 * so every rejected run is audited.
 */
public record GenerationCommand(
        String environment,
        List<String> flags,
        String tenantId,
        String actorId,
        String termStart,
        String termEnd,
        Integer weeks,
        String timeZone,
        List<RuleDefinition> rules,
        List<String> excludeDates,
        boolean replaceExistingInRange,
        boolean dryRun
) {

    public record RuleDefinition(
            int weekday,
            String startTime,
            int durationMinutes,
            String tutorId,
            String centerId,
            String groupId,
            SessionType sessionType
    ) {
    }

    public GenerationCommand asDryRun() {
        return new GenerationCommand(environment, flags, tenantId, actorId, termStart, termEnd, weeks, timeZone,
                rules, excludeDates, replaceExistingInRange, true);
    }
}
