package com.eduhub.scheduling.domain.store;

import com.eduhub.scheduling.domain.commit.NewSession;
import com.eduhub.scheduling.domain.model.CancelReasonCode;
import com.eduhub.scheduling.domain.model.SessionStatus;
import com.eduhub.scheduling.domain.model.SessionType;
import com.eduhub.scheduling.domain.recurrence.BookingWindow;
import com.eduhub.scheduling.domain.recurrence.ResourceBindingKey;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence collaborator for sessions. Every call is scoped to one tenant; an empty
 * tutor, center or id selection matches nothing.
 *
 * Implementations translate storage failures to
 * {@link com.eduhub.common.exception.PersistenceException}.
 */
public interface SessionStore {

    /**
     * Bindings of all stored sessions (any kind or status) for the tutors and centers whose
     * start falls in the window.
     */
    Set<ResourceBindingKey> findBindings(String tenantId, Collection<String> tutorIds,
                                         Collection<String> centerIds, BookingWindow window);

    /**
     * Bindings a scoped reset over the window would delete.
     */
    Set<ResourceBindingKey> findResettableBindings(String tenantId, Collection<String> centerIds, BookingWindow window);

    /**
     * Skip-duplicates insert.
     *
     * @return rows actually inserted
     */
    int createSessions(List<NewSession> rows);

    int deleteSessions(String tenantId, Collection<String> centerIds, Set<SessionType> kinds, BookingWindow window);

    int countSessions(String tenantId, Collection<String> centerIds, Set<SessionType> kinds, BookingWindow window);

    /**
     * Moves {@code SCHEDULED} sessions to {@code status}.
     *
     * @return rows actually transitioned
     */
    int updateSessionsStatus(String tenantId, Collection<String> ids, SessionStatus status,
                             CancelReasonCode reason, Instant at);

    Optional<StartRange> findStartRange(String tenantId, Collection<String> ids);
}
