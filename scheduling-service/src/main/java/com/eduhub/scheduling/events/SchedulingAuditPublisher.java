package com.eduhub.scheduling.events;

import com.eduhub.common.exception.BusinessException;
import com.eduhub.common.exception.PersistenceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Kafka publisher for scheduling audit records, keyed by tenant id.
 *
 * Sends are asynchronous; a failed send is logged and never reaches the caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchedulingAuditPublisher {

    private static final int MAX_AUDITED_CONFLICTS = 10;

    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Value("${scheduling.audit.topic:scheduling-audit}")
    private String topic;

    @Value("${scheduling.audit.enabled:true}")
    private boolean enabled;

    public void publish(SchedulingAuditEvent event) {
        if (!enabled) {
            log.debug("Audit disabled, dropping {} for tenant {}", event.getAction(), event.getTenantId());
            return;
        }
        if (event.getTimestamp() == null) {
            event.setTimestamp(Instant.now());
        }
        if (event.getConflicts() != null && event.getConflicts().size() > MAX_AUDITED_CONFLICTS) {
            event.setConflicts(event.getConflicts().subList(0, MAX_AUDITED_CONFLICTS));
        }

        log.info("Publishing audit {} {} for tenant {}", event.getAction(), event.getResult(), event.getTenantId());
        try {
            CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, event.getTenantId(), event);
            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    log.debug("Audit published to topic {}: offset={}", topic, result.getRecordMetadata().offset());
                } else {
                    log.error("Failed to publish audit {} to topic {}", event.getAction(), topic, ex);
                }
            });
        } catch (RuntimeException e) {
            log.error("Failed to send audit {} to topic {}", event.getAction(), topic, e);
        }
    }

    /**
     * Failure record for a run aborted by {@code error}.
     */
    public void publishFailure(String action, String tenantId, String actorId, String environment,
                               boolean dryRun, RuntimeException error) {
        publish(SchedulingAuditEvent.builder()
                .action(action)
                .result(SchedulingAuditEvent.RESULT_FAILURE)
                .tenantId(tenantId)
                .actorId(actorId)
                .environment(environment)
                .dryRun(dryRun)
                .errorCode(errorCode(error))
                .build());
    }

    static String errorCode(RuntimeException error) {
        if (error instanceof BusinessException business) {
            return business.getErrorCode();
        }
        if (error instanceof PersistenceException) {
            return PersistenceException.ERROR_CODE;
        }
        return "INTERNAL_ERROR";
    }
}
