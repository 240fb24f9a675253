package com.eduhub.scheduling.domain.service;

import com.eduhub.common.exception.ValidationException;
import com.eduhub.scheduling.domain.commit.CommitEngine;
import com.eduhub.scheduling.domain.commit.CommitSummary;
import com.eduhub.scheduling.domain.model.SessionType;
import com.eduhub.scheduling.domain.recurrence.BookingWindow;
import com.eduhub.scheduling.domain.recurrence.ExclusionSet;
import com.eduhub.scheduling.domain.recurrence.Occurrence;
import com.eduhub.scheduling.domain.recurrence.OccurrenceGenerator;
import com.eduhub.scheduling.domain.recurrence.RecurrenceRule;
import com.eduhub.scheduling.domain.recurrence.ResourceBindingKey;
import com.eduhub.scheduling.domain.recurrence.Term;
import com.eduhub.scheduling.domain.reset.ResetScope;
import com.eduhub.scheduling.domain.reset.ScopedResetService;
import com.eduhub.scheduling.domain.resolver.Candidate;
import com.eduhub.scheduling.domain.resolver.ConflictResolver;
import com.eduhub.scheduling.domain.resolver.Resolution;
import com.eduhub.scheduling.domain.resolver.RuleBinding;
import com.eduhub.scheduling.domain.safety.CapabilityFlag;
import com.eduhub.scheduling.domain.safety.DeploymentEnvironment;
import com.eduhub.scheduling.domain.safety.SafetyGate;
import com.eduhub.scheduling.domain.store.SessionStore;
import com.eduhub.scheduling.events.SchedulingAuditEvent;
import com.eduhub.scheduling.events.SchedulingAuditPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Generation pipeline: gate, expand, optional reset, snapshot, resolve, commit, audit.
 *
 * A preview and a real run share this path; only the session writer differs, so a preview
 * reports exactly what the real run would do against the same store state. Running the same
 * command twice creates nothing the second time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionGenerationService {

    private final SafetyGate safetyGate;
    private final OccurrenceGenerator occurrenceGenerator;
    private final ConflictResolver conflictResolver;
    private final CommitEngine commitEngine;
    private final ScopedResetService scopedResetService;
    private final SessionStore sessionStore;
    private final SchedulingAuditPublisher auditPublisher;

    public GenerationReport preview(GenerationCommand command) {
        return generate(command.asDryRun());
    }

    public GenerationReport generate(GenerationCommand command) {
        String environment = command.environment();
        try {
            DeploymentEnvironment env = DeploymentEnvironment.parse(command.environment());
            environment = env.name();
            Set<CapabilityFlag> flags = requestedFlags(command);
            safetyGate.authorize(flags, env);

            Term term = parseTerm(command);
            ExclusionSet exclusions = ExclusionSet.parse(command.excludeDates());
            List<Candidate> candidates = new ArrayList<>();
            List<String> labels = new ArrayList<>();
            Set<String> tutorIds = new LinkedHashSet<>();
            Set<String> centerIds = new LinkedHashSet<>();
            for (GenerationCommand.RuleDefinition definition : requireRules(command)) {
                RecurrenceRule rule = RecurrenceRule.of(definition.weekday(), definition.startTime(), definition.durationMinutes());
                RuleBinding binding = toBinding(definition, rule);
                labels.add(rule.label());
                tutorIds.add(binding.tutorId());
                centerIds.add(binding.centerId());
                for (Occurrence occurrence : occurrenceGenerator.generate(term, rule, exclusions)) {
                    candidates.add(new Candidate(occurrence, binding));
                }
            }

            BookingWindow termWindow = term.toUtcWindow();
            int deleted = 0;
            Set<ResourceBindingKey> resettable = Set.of();
            if (command.replaceExistingInRange()) {
                ResetScope scope = ResetScope.ofCenters(centerIds);
                if (command.dryRun()) {
                    resettable = sessionStore.findResettableBindings(command.tenantId(), scope.centerIds(), termWindow);
                }
                deleted = scopedResetService.resetRange(env, flags, command.tenantId(),
                        scope, termWindow, command.dryRun());
            }

            Set<ResourceBindingKey> existing = new HashSet<>();
            if (!candidates.isEmpty()) {
                BookingWindow candidateWindow = BookingWindow.enclosing(
                        candidates.stream().map(Candidate::occurrence).toList());
                existing.addAll(sessionStore.findBindings(command.tenantId(), tutorIds, centerIds, candidateWindow));
                existing.removeAll(resettable);
            }

            Resolution resolution = conflictResolver.resolve(candidates, existing);
            CommitSummary committed = commitEngine.commit(command.tenantId(), term.timeZone().getId(),
                    resolution.creatable(), commitEngine.writer(command.dryRun()));
            CommitSummary summary = committed
                    .withAdditionalSkipped(resolution.alreadyExists().size(), resolution.batchConflicts())
                    .withDeleted(deleted);

            log.info("Generation for tenant {} ({}{}): candidates={}, created={}, skipped={}, deleted={}, conflicts={}",
                    command.tenantId(), environment, command.dryRun() ? ", dry run" : "", candidates.size(),
                    summary.createdCount(), summary.skippedCount(), summary.deletedCount(), summary.conflicts().size());

            auditPublisher.publish(SchedulingAuditEvent.builder()
                    .action(SchedulingAuditEvent.ACTION_GENERATED)
                    .result(SchedulingAuditEvent.RESULT_SUCCESS)
                    .tenantId(command.tenantId())
                    .actorId(command.actorId())
                    .environment(environment)
                    .createdCount(summary.createdCount())
                    .skippedCount(summary.skippedCount())
                    .deletedCount(summary.deletedCount())
                    .conflictCount(summary.conflicts().size())
                    .conflicts(summary.conflicts())
                    .rangeFrom(termWindow.start())
                    .rangeTo(termWindow.endExclusive())
                    .dryRun(summary.dryRun())
                    .build());

            return new GenerationReport(summary, candidates.size(), resolution.alreadyExists().size(),
                    termWindow, labels);
        } catch (RuntimeException e) {
            auditPublisher.publishFailure(SchedulingAuditEvent.ACTION_GENERATED, command.tenantId(),
                    command.actorId(), environment, command.dryRun(), e);
            throw e;
        }
    }

    private Set<CapabilityFlag> requestedFlags(GenerationCommand command) {
        Set<CapabilityFlag> flags = CapabilityFlag.fromTokens(command.flags());
        if (command.replaceExistingInRange()) {
            flags.add(CapabilityFlag.RESET_IN_RANGE);
        }
        return flags;
    }

    private Term parseTerm(GenerationCommand command) {
        if (command.weeks() != null) {
            if (command.termEnd() != null) {
                throw new ValidationException("Provide either termEnd or weeks, not both");
            }
            return Term.spanningWeeks(Term.parseDate("termStart", command.termStart()),
                    command.weeks(), Term.parseZone(command.timeZone()));
        }
        return Term.of(command.termStart(), command.termEnd(), command.timeZone());
    }

    private List<GenerationCommand.RuleDefinition> requireRules(GenerationCommand command) {
        if (command.rules() == null || command.rules().isEmpty()) {
            throw new ValidationException("At least one recurrence rule is required");
        }
        return command.rules();
    }

    private RuleBinding toBinding(GenerationCommand.RuleDefinition definition, RecurrenceRule rule) {
        if (definition.tutorId() == null || definition.tutorId().isBlank()) {
            throw new ValidationException("tutorId is required for " + rule.label());
        }
        if (definition.centerId() == null || definition.centerId().isBlank()) {
            throw new ValidationException("centerId is required for " + rule.label());
        }
        SessionType type = definition.sessionType() == null ? SessionType.GROUP : definition.sessionType();
        if (!SessionType.GENERATED.contains(type)) {
            throw new ValidationException("Recurring sessions must be GROUP or CLASS, got " + type);
        }
        return new RuleBinding(definition.tutorId().trim(), definition.centerId().trim(), definition.groupId(), type, rule.label());
    }
}
