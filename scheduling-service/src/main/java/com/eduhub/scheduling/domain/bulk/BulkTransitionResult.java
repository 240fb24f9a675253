package com.eduhub.scheduling.domain.bulk;

/**
 * @param requestedCount    distinct ids in the request
 * @param transitionedCount rows actually moved to the target status
 */
public record BulkTransitionResult(int requestedCount, int transitionedCount) {
}
