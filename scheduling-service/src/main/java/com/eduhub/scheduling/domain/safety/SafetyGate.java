package com.eduhub.scheduling.domain.safety;

import com.eduhub.common.exception.ForbiddenOperationException;
import com.eduhub.common.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Decides whether a run may proceed in the given environment.
 *
 * Staging permits every capability. Production requires explicit confirmation and rejects
 * every destructive capability. Evaluated before any read or write.
 */
@Slf4j
@Component
public class SafetyGate {

    public void authorize(Set<CapabilityFlag> requested, DeploymentEnvironment environment) {
        if (environment == null) {
            throw new ValidationException("env is required (staging|production)");
        }
        if (environment != DeploymentEnvironment.PRODUCTION) {
            return;
        }
        if (!requested.contains(CapabilityFlag.CONFIRM_PRODUCTION)) {
            log.warn("Rejected production run without {}", CapabilityFlag.CONFIRM_PRODUCTION.getToken());
            throw new ForbiddenOperationException(
                    "Production runs require " + CapabilityFlag.CONFIRM_PRODUCTION.getToken());
        }
        for (CapabilityFlag flag : CapabilityFlag.values()) {
            if (flag.isDestructive() && requested.contains(flag)) {
                log.warn("Rejected destructive flag {} in production", flag.getToken());
                throw new ForbiddenOperationException(flag.getToken() + " is not allowed in production");
            }
        }
    }
}
