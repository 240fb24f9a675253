package com.eduhub.scheduling.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Audit record of one scheduling run, published whether the run succeeded or failed.
 * Consumed by the tenant audit log.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchedulingAuditEvent {
    public static final String ACTION_GENERATED = "sessions.generated";
    public static final String ACTION_RESET = "sessions.reset";
    public static final String ACTION_BULK_CANCELED = "sessions.bulkCanceled";

    public static final String RESULT_SUCCESS = "SUCCESS";
    public static final String RESULT_FAILURE = "FAILURE";

    private String action;
    private String result;
    private String tenantId;
    private String actorId;
    private String environment;
    private int requestedCount;
    private int transitionedCount;
    private int createdCount;
    private int skippedCount;
    private int deletedCount;
    private int conflictCount;
    private List<String> conflicts;
    private String reasonCode;
    private Instant rangeFrom;
    private Instant rangeTo;
    private boolean dryRun;
    private String errorCode;
    private Instant timestamp;
}
