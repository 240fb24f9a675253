package com.eduhub.scheduling.domain.reset;

import com.eduhub.common.exception.ValidationException;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Centers a reset may touch. Never empty.
 */
public record ResetScope(Set<String> centerIds) {

    public ResetScope {
        if (centerIds == null || centerIds.isEmpty()) {
            throw new ValidationException("Reset requires at least one center");
        }
        centerIds = Set.copyOf(centerIds);
    }

    public static ResetScope ofCenters(Collection<String> centerIds) {
        return new ResetScope(centerIds == null ? Set.of() : new LinkedHashSet<>(centerIds));
    }
}
