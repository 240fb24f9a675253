package com.eduhub.scheduling.domain.reset;

import com.eduhub.common.exception.ValidationException;
import com.eduhub.scheduling.domain.model.SessionType;
import com.eduhub.scheduling.domain.recurrence.BookingWindow;
import com.eduhub.scheduling.domain.recurrence.Term;
import com.eduhub.scheduling.domain.safety.CapabilityFlag;
import com.eduhub.scheduling.domain.safety.DeploymentEnvironment;
import com.eduhub.scheduling.domain.safety.SafetyGate;
import com.eduhub.scheduling.domain.store.SessionStore;
import com.eduhub.scheduling.events.SchedulingAuditEvent;
import com.eduhub.scheduling.events.SchedulingAuditPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.Set;

/**
 * Deletes scheduled, generator-owned sessions in a half-open window for a set of centers.
 * One-on-one sessions, cancelled sessions and other centers are never touched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScopedResetService {

    private final SafetyGate safetyGate;
    private final SessionStore sessionStore;
    private final SchedulingAuditPublisher auditPublisher;

    /**
     * Standalone reset of a term window, audited as {@code sessions.reset}.
     */
    public int reset(ResetCommand command) {
        String environment = command.environment();
        try {
            DeploymentEnvironment env = DeploymentEnvironment.parse(command.environment());
            environment = env.name();
            Set<CapabilityFlag> flags = EnumSet.of(CapabilityFlag.RESET_IN_RANGE);
            flags.addAll(CapabilityFlag.fromTokens(command.flags()));
            safetyGate.authorize(flags, env);

            BookingWindow window = Term.of(command.startDate(), command.endDate(), command.timeZone()).toUtcWindow();
            ResetScope scope = ResetScope.ofCenters(command.centerIds());
            int deleted = resetRange(env, flags, command.tenantId(), scope, window, command.dryRun());

            auditPublisher.publish(SchedulingAuditEvent.builder()
                    .action(SchedulingAuditEvent.ACTION_RESET)
                    .result(SchedulingAuditEvent.RESULT_SUCCESS)
                    .tenantId(command.tenantId())
                    .actorId(command.actorId())
                    .environment(environment)
                    .deletedCount(deleted)
                    .rangeFrom(window.start())
                    .rangeTo(window.endExclusive())
                    .dryRun(command.dryRun())
                    .build());
            return deleted;
        } catch (RuntimeException e) {
            auditPublisher.publishFailure(SchedulingAuditEvent.ACTION_RESET, command.tenantId(), command.actorId(),
                    environment, command.dryRun(), e);
            throw e;
        }
    }

    public int resetRange(DeploymentEnvironment environment, String tenantId, ResetScope scope,
                          BookingWindow window, boolean dryRun) {
        return resetRange(environment, EnumSet.noneOf(CapabilityFlag.class), tenantId, scope, window, dryRun);
    }

    /**
     * @param flags additional operator flags, e.g. the production confirmation
     * @return rows deleted, or rows that would be deleted when {@code dryRun}
     */
    public int resetRange(DeploymentEnvironment environment, Set<CapabilityFlag> flags, String tenantId,
                          ResetScope scope, BookingWindow window, boolean dryRun) {
        Set<CapabilityFlag> requested = EnumSet.of(CapabilityFlag.RESET_IN_RANGE);
        requested.addAll(flags);
        if (scope == null) {
            throw new ValidationException("Reset requires at least one center");
        }
        safetyGate.authorize(requested, environment);

        if (dryRun) {
            int count = sessionStore.countSessions(tenantId, scope.centerIds(), SessionType.GENERATED, window);
            log.info("Dry run reset for tenant {}: {} sessions in [{}, {}) would be deleted",
                    tenantId, count, window.start(), window.endExclusive());
            return count;
        }

        int deleted = sessionStore.deleteSessions(tenantId, scope.centerIds(), SessionType.GENERATED, window);
        log.info("Reset for tenant {}: deleted {} sessions in [{}, {}) for centers {}",
                tenantId, deleted, window.start(), window.endExclusive(), scope.centerIds());
        return deleted;
    }
}
