package com.eduhub.scheduling.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * A persisted tutoring session. Owned by the store; the scheduling engine only
 * reads its binding (tutor, center, start) and creates, deletes or cancels rows.
 *
 * At most one row exists per (tenant, tutor, center, start), cancelled rows included.
 */
@Entity
@Table(name = "sessions",
        uniqueConstraints = @UniqueConstraint(name = "uq_sessions_binding",
                columnNames = {"tenant_id", "tutor_id", "center_id", "start_at"}),
        indexes = {
                @Index(name = "idx_sessions_tenant_start", columnList = "tenant_id,start_at"),
                @Index(name = "idx_sessions_tenant_center_start", columnList = "tenant_id,center_id,start_at"),
                @Index(name = "idx_sessions_tenant_tutor_start", columnList = "tenant_id,tutor_id,start_at")
        })
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Session {

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "center_id", nullable = false)
    private String centerId;

    @Column(name = "tutor_id", nullable = false)
    private String tutorId;

    @Enumerated(EnumType.STRING)
    @Column(name = "session_type", nullable = false, length = 20)
    private SessionType sessionType;

    @Column(name = "group_id")
    private String groupId;

    @Column(name = "start_at", nullable = false)
    private Instant startAt;

    @Column(name = "end_at", nullable = false)
    private Instant endAt;

    @Column(name = "timezone", nullable = false, length = 64)
    private String timezone;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private SessionStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "cancel_reason_code", length = 32)
    private CancelReasonCode cancelReasonCode;

    @Column(name = "canceled_at")
    private Instant canceledAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
        if (status == null) {
            status = SessionStatus.SCHEDULED;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
