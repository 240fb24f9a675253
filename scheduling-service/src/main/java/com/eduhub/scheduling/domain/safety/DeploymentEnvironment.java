package com.eduhub.scheduling.domain.safety;

import com.eduhub.common.exception.ValidationException;

import java.util.Locale;

/**
 * Target environment of a run. Always supplied explicitly by the operator; there is no default.
 */
public enum DeploymentEnvironment {
    STAGING,
    PRODUCTION;

    public static DeploymentEnvironment parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("env is required (staging|production)");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "staging" -> STAGING;
            case "production" -> PRODUCTION;
            default -> throw new ValidationException("Invalid env: " + value + " (expected staging|production)");
        };
    }
}
