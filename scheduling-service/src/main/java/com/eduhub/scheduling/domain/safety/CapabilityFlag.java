package com.eduhub.scheduling.domain.safety;

import com.eduhub.common.exception.ValidationException;
import lombok.Getter;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Operator-requested capabilities. Destructive ones are never available in production.
 */
@Getter
public enum CapabilityFlag {
    CONFIRM_PRODUCTION("--confirm-prod", false),
    RESET_IN_RANGE("--replace-existing-in-range", true),
    SEED_TEST_DATA("--include-test-parents", true),
    RESET("--reset", true),
    TRUNCATE("--truncate", true),
    DELETE("--delete", true),
    DROP("--drop", true),
    WIPE("--wipe", true);

    private final String token;
    private final boolean destructive;

    CapabilityFlag(String token, boolean destructive) {
        this.token = token;
        this.destructive = destructive;
    }

    public static CapabilityFlag fromToken(String token) {
        if (token != null) {
            String trimmed = token.trim();
            for (CapabilityFlag flag : values()) {
                if (flag.token.equals(trimmed)) {
                    return flag;
                }
            }
        }
        throw new ValidationException("Unknown flag: " + token);
    }

    public static Set<CapabilityFlag> fromTokens(Collection<String> tokens) {
        Set<CapabilityFlag> flags = EnumSet.noneOf(CapabilityFlag.class);
        if (tokens != null) {
            tokens.forEach(token -> flags.add(fromToken(token)));
        }
        return flags;
    }
}
