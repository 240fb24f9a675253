package com.eduhub.scheduling.domain.commit;

import com.eduhub.scheduling.domain.model.SessionType;
import com.eduhub.scheduling.domain.resolver.Candidate;

import java.time.Instant;
import java.util.UUID;

/**
 * Row to be inserted by a skip-duplicates write.
 */
public record NewSession(
        String id,
        String tenantId,
        String centerId,
        String tutorId,
        SessionType sessionType,
        String groupId,
        Instant startAt,
        Instant endAt,
        String timezone
) {

    public static NewSession from(String tenantId, Candidate candidate, String timezone) {
        return new NewSession(
                UUID.randomUUID().toString(),
                tenantId,
                candidate.binding().centerId(),
                candidate.binding().tutorId(),
                candidate.binding().sessionType(),
                candidate.binding().groupId(),
                candidate.key().startAt(),
                candidate.occurrence().endAtUtc(),
                timezone);
    }
}
