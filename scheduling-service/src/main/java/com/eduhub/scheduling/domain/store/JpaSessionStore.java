package com.eduhub.scheduling.domain.store;

import com.eduhub.common.exception.PersistenceException;
import com.eduhub.scheduling.domain.commit.NewSession;
import com.eduhub.scheduling.domain.model.CancelReasonCode;
import com.eduhub.scheduling.domain.model.SessionStatus;
import com.eduhub.scheduling.domain.model.SessionType;
import com.eduhub.scheduling.domain.recurrence.BookingWindow;
import com.eduhub.scheduling.domain.recurrence.ResourceBindingKey;
import com.eduhub.scheduling.domain.repository.SessionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * {@link SessionStore} backed by Spring Data JPA on PostgreSQL.
 *
 * Transactions are opened through a {@link TransactionTemplate} inside the failure translation,
 * so an unreachable database (failing at begin or commit) surfaces as {@link PersistenceException}
 * like any failing statement.
 */
@Slf4j
@Component
public class JpaSessionStore implements SessionStore {

    private final SessionRepository sessionRepository;
    private final TransactionTemplate writeTransaction;
    private final TransactionTemplate readTransaction;

    public JpaSessionStore(SessionRepository sessionRepository, PlatformTransactionManager transactionManager) {
        this.sessionRepository = sessionRepository;
        this.writeTransaction = new TransactionTemplate(transactionManager);
        this.readTransaction = new TransactionTemplate(transactionManager);
        this.readTransaction.setReadOnly(true);
    }

    @Override
    public Set<ResourceBindingKey> findBindings(String tenantId, Collection<String> tutorIds,
                                                Collection<String> centerIds, BookingWindow window) {
        if (tutorIds.isEmpty() || centerIds.isEmpty()) {
            return Set.of();
        }
        return read("read session bindings", () -> new HashSet<>(sessionRepository.findBindings(
                tenantId, tutorIds, centerIds, window.start(), window.endExclusive())));
    }

    @Override
    public Set<ResourceBindingKey> findResettableBindings(String tenantId, Collection<String> centerIds,
                                                          BookingWindow window) {
        if (centerIds.isEmpty()) {
            return Set.of();
        }
        return read("read resettable bindings", () -> new HashSet<>(sessionRepository.findBindingsByKindAndStatus(
                tenantId, centerIds, SessionType.GENERATED, SessionStatus.SCHEDULED,
                window.start(), window.endExclusive())));
    }

    @Override
    public int createSessions(List<NewSession> rows) {
        if (rows.isEmpty()) {
            return 0;
        }
        Instant now = Instant.now();
        return write("create sessions", () -> {
            int inserted = 0;
            for (NewSession row : rows) {
                inserted += sessionRepository.insertIfAbsent(
                        row.id(), row.tenantId(), row.centerId(), row.tutorId(),
                        row.sessionType().name(), row.groupId(),
                        row.startAt(), row.endAt(), row.timezone(), now);
            }
            log.debug("Inserted {} of {} sessions", inserted, rows.size());
            return inserted;
        });
    }

    @Override
    public int deleteSessions(String tenantId, Collection<String> centerIds, Set<SessionType> kinds,
                              BookingWindow window) {
        if (centerIds.isEmpty() || kinds.isEmpty()) {
            return 0;
        }
        return write("delete sessions", () -> sessionRepository.deleteInRange(
                tenantId, centerIds, kinds, SessionStatus.SCHEDULED, window.start(), window.endExclusive()));
    }

    @Override
    public int countSessions(String tenantId, Collection<String> centerIds, Set<SessionType> kinds,
                             BookingWindow window) {
        if (centerIds.isEmpty() || kinds.isEmpty()) {
            return 0;
        }
        return read("count sessions", () -> Math.toIntExact(sessionRepository.countInRange(
                tenantId, centerIds, kinds, SessionStatus.SCHEDULED, window.start(), window.endExclusive())));
    }

    @Override
    public int updateSessionsStatus(String tenantId, Collection<String> ids, SessionStatus status,
                                    CancelReasonCode reason, Instant at) {
        if (ids.isEmpty()) {
            return 0;
        }
        return write("update session status", () -> sessionRepository.transitionStatus(
                tenantId, ids, SessionStatus.SCHEDULED, status, reason, at));
    }

    @Override
    public Optional<StartRange> findStartRange(String tenantId, Collection<String> ids) {
        if (ids.isEmpty()) {
            return Optional.empty();
        }
        return read("read start range", () -> {
            SessionRepository.StartRangeView view = sessionRepository.findStartRange(tenantId, ids);
            if (view == null || view.getEarliest() == null) {
                return Optional.empty();
            }
            return Optional.of(new StartRange(view.getEarliest(), view.getLatest()));
        });
    }

    private <T> T read(String operation, Supplier<T> call) {
        return translate(operation, readTransaction, call);
    }

    private <T> T write(String operation, Supplier<T> call) {
        return translate(operation, writeTransaction, call);
    }

    private <T> T translate(String operation, TransactionTemplate transaction, Supplier<T> call) {
        try {
            return transaction.execute(status -> call.get());
        } catch (DataAccessException | TransactionException e) {
            throw new PersistenceException("Session store failed to " + operation, e);
        }
    }
}
