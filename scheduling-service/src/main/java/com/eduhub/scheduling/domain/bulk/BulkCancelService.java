package com.eduhub.scheduling.domain.bulk;

import com.eduhub.common.exception.ValidationException;
import com.eduhub.scheduling.domain.model.SessionStatus;
import com.eduhub.scheduling.domain.safety.CapabilityFlag;
import com.eduhub.scheduling.domain.safety.DeploymentEnvironment;
import com.eduhub.scheduling.domain.safety.SafetyGate;
import com.eduhub.scheduling.domain.store.SessionStore;
import com.eduhub.scheduling.domain.store.StartRange;
import com.eduhub.scheduling.events.SchedulingAuditEvent;
import com.eduhub.scheduling.events.SchedulingAuditPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Cancels a batch of sessions in one tenant-scoped statement.
 *
 * Ids that are unknown, belong to another tenant or are already cancelled are simply not
 * counted; they never abort the batch. Cancelling twice is therefore harmless.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BulkCancelService {

    private final SafetyGate safetyGate;
    private final SessionStore sessionStore;
    private final SchedulingAuditPublisher auditPublisher;

    public BulkTransitionResult bulkTransition(BulkCancelCommand command) {
        String environment = command.environment();
        try {
            DeploymentEnvironment env = DeploymentEnvironment.parse(command.environment());
            environment = env.name();
            safetyGate.authorize(CapabilityFlag.fromTokens(command.flags()), env);

            List<String> ids = distinctIds(command.sessionIds());
            if (command.reasonCode() == null) {
                throw new ValidationException("reasonCode is required");
            }

            Optional<StartRange> range = sessionStore.findStartRange(command.tenantId(), ids);
            int transitioned = sessionStore.updateSessionsStatus(
                    command.tenantId(), ids, SessionStatus.CANCELLED, command.reasonCode(), Instant.now());

            log.info("Bulk cancel for tenant {}: {} of {} sessions cancelled ({})",
                    command.tenantId(), transitioned, ids.size(), command.reasonCode());

            auditPublisher.publish(SchedulingAuditEvent.builder()
                    .action(SchedulingAuditEvent.ACTION_BULK_CANCELED)
                    .result(SchedulingAuditEvent.RESULT_SUCCESS)
                    .tenantId(command.tenantId())
                    .actorId(command.actorId())
                    .environment(environment)
                    .reasonCode(command.reasonCode().name())
                    .requestedCount(ids.size())
                    .transitionedCount(transitioned)
                    .skippedCount(ids.size() - transitioned)
                    .rangeFrom(range.map(StartRange::earliest).orElse(null))
                    .rangeTo(range.map(StartRange::latest).orElse(null))
                    .build());

            return new BulkTransitionResult(ids.size(), transitioned);
        } catch (RuntimeException e) {
            auditPublisher.publishFailure(SchedulingAuditEvent.ACTION_BULK_CANCELED, command.tenantId(),
                    command.actorId(), environment, false, e);
            throw e;
        }
    }

    private List<String> distinctIds(List<String> sessionIds) {
        if (sessionIds == null || sessionIds.isEmpty()) {
            throw new ValidationException("sessionIds must not be empty");
        }
        Set<String> distinct = new LinkedHashSet<>();
        for (String id : sessionIds) {
            if (id == null || id.isBlank()) {
                throw new ValidationException("sessionIds must not contain blank ids");
            }
            distinct.add(id.trim());
        }
        return new ArrayList<>(distinct);
    }
}
