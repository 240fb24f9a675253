package com.eduhub.scheduling.domain.repository;

import com.eduhub.scheduling.domain.model.CancelReasonCode;
import com.eduhub.scheduling.domain.model.Session;
import com.eduhub.scheduling.domain.model.SessionStatus;
import com.eduhub.scheduling.domain.model.SessionType;
import com.eduhub.scheduling.domain.recurrence.ResourceBindingKey;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Repository for Session entity. Every query is scoped by tenant.
 */
public interface SessionRepository extends JpaRepository<Session, String> {

    /**
     * Inserts a session unless one with the same (tenant, tutor, center, start) already exists.
     *
     * Returns the number of rows inserted:
     * - 1: the row was written
     * - 0: the binding was already taken (possibly by a concurrent run)
     */
    @Modifying
    @Query(value = """
            INSERT INTO sessions (id, tenant_id, center_id, tutor_id, session_type, group_id,
                                  start_at, end_at, timezone, status, created_at, updated_at)
            VALUES (:id, :tenantId, :centerId, :tutorId, :sessionType, CAST(:groupId AS VARCHAR),
                    :startAt, :endAt, :timezone, 'SCHEDULED', :now, :now)
            ON CONFLICT (tenant_id, tutor_id, center_id, start_at) DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(@Param("id") String id,
                       @Param("tenantId") String tenantId,
                       @Param("centerId") String centerId,
                       @Param("tutorId") String tutorId,
                       @Param("sessionType") String sessionType,
                       @Param("groupId") String groupId,
                       @Param("startAt") Instant startAt,
                       @Param("endAt") Instant endAt,
                       @Param("timezone") String timezone,
                       @Param("now") Instant now);

    /**
     * Bindings of every session (any kind, any status) for the given tutors and centers
     * starting in {@code [from, to)}.
     */
    @Query("""
           SELECT new com.eduhub.scheduling.domain.recurrence.ResourceBindingKey(s.tutorId, s.centerId, s.startAt)
           FROM Session s
           WHERE s.tenantId = :tenantId
             AND s.tutorId IN :tutorIds
             AND s.centerId IN :centerIds
             AND s.startAt >= :from
             AND s.startAt < :to
           """)
    List<ResourceBindingKey> findBindings(@Param("tenantId") String tenantId,
                                          @Param("tutorIds") Collection<String> tutorIds,
                                          @Param("centerIds") Collection<String> centerIds,
                                          @Param("from") Instant from,
                                          @Param("to") Instant to);

    @Query("""
           SELECT new com.eduhub.scheduling.domain.recurrence.ResourceBindingKey(s.tutorId, s.centerId, s.startAt)
           FROM Session s
           WHERE s.tenantId = :tenantId
             AND s.centerId IN :centerIds
             AND s.sessionType IN :kinds
             AND s.status = :status
             AND s.startAt >= :from
             AND s.startAt < :to
           """)
    List<ResourceBindingKey> findBindingsByKindAndStatus(@Param("tenantId") String tenantId,
                                                         @Param("centerIds") Collection<String> centerIds,
                                                         @Param("kinds") Collection<SessionType> kinds,
                                                         @Param("status") SessionStatus status,
                                                         @Param("from") Instant from,
                                                         @Param("to") Instant to);

    @Query("""
           SELECT COUNT(s)
           FROM Session s
           WHERE s.tenantId = :tenantId
             AND s.centerId IN :centerIds
             AND s.sessionType IN :kinds
             AND s.status = :status
             AND s.startAt >= :from
             AND s.startAt < :to
           """)
    long countInRange(@Param("tenantId") String tenantId,
                      @Param("centerIds") Collection<String> centerIds,
                      @Param("kinds") Collection<SessionType> kinds,
                      @Param("status") SessionStatus status,
                      @Param("from") Instant from,
                      @Param("to") Instant to);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           DELETE FROM Session s
           WHERE s.tenantId = :tenantId
             AND s.centerId IN :centerIds
             AND s.sessionType IN :kinds
             AND s.status = :status
             AND s.startAt >= :from
             AND s.startAt < :to
           """)
    int deleteInRange(@Param("tenantId") String tenantId,
                      @Param("centerIds") Collection<String> centerIds,
                      @Param("kinds") Collection<SessionType> kinds,
                      @Param("status") SessionStatus status,
                      @Param("from") Instant from,
                      @Param("to") Instant to);

    /**
     * Moves sessions out of {@code from} in one statement. Rows already in another status,
     * missing, or owned by another tenant are left alone and not counted.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE Session s
           SET s.status = :to,
               s.cancelReasonCode = :reason,
               s.canceledAt = :at,
               s.updatedAt = :at
           WHERE s.tenantId = :tenantId
             AND s.id IN :ids
             AND s.status = :from
           """)
    int transitionStatus(@Param("tenantId") String tenantId,
                         @Param("ids") Collection<String> ids,
                         @Param("from") SessionStatus from,
                         @Param("to") SessionStatus to,
                         @Param("reason") CancelReasonCode reason,
                         @Param("at") Instant at);

    @Query("""
           SELECT MIN(s.startAt) AS earliest, MAX(s.startAt) AS latest
           FROM Session s
           WHERE s.tenantId = :tenantId
             AND s.id IN :ids
           """)
    StartRangeView findStartRange(@Param("tenantId") String tenantId,
                                  @Param("ids") Collection<String> ids);

    interface StartRangeView {
        Instant getEarliest();

        Instant getLatest();
    }
}
