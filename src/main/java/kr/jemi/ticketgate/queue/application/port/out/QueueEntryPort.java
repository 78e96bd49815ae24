package kr.jemi.ticketgate.queue.application.port.out;

import kr.jemi.ticketgate.queue.domain.QueueEntry;
import kr.jemi.ticketgate.queue.domain.QueueStatus;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface QueueEntryPort {

    /**
     * (event, user) 에 진행 중인 엔트리가 있으면 저장소의 유니크 제약 위반으로 실패한다.
     */
    QueueEntry insert(QueueEntry entry);

    QueueEntry update(QueueEntry entry);

    Optional<QueueEntry> findActive(long eventId, long userId);

    Optional<QueueEntry> findLatest(long eventId, long userId);

    List<QueueEntry> findByIds(Collection<Long> ids);

    long countAhead(long eventId, long sequence);

    long countByStatus(long eventId, QueueStatus status);

    List<QueueEntry> findWaiting(long eventId, int limit);

    /** WAITING 인 엔트리만 PROCESSING 으로 바꾼다. */
    int admit(Collection<Long> ids, LocalDateTime admittedAt, LocalDateTime deadline);

    /** 기한이 지난 PROCESSING 엔트리를 EXPIRED 로 바꾼다. */
    int expireOverdue(LocalDateTime now);

    int expireOverdue(long eventId, LocalDateTime now);

    /** 진행 중(WAITING/PROCESSING)일 때만 전이한다. */
    boolean changeActiveStatus(long id, QueueStatus from, QueueStatus to, LocalDateTime now);
}
