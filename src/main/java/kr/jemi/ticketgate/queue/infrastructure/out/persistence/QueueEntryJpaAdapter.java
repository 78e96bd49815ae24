package kr.jemi.ticketgate.queue.infrastructure.out.persistence;

import kr.jemi.ticketgate.queue.application.port.out.QueueEntryPort;
import kr.jemi.ticketgate.queue.domain.QueueEntry;
import kr.jemi.ticketgate.queue.domain.QueueStatus;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Component
public class QueueEntryJpaAdapter implements QueueEntryPort {

    private static final Integer ACTIVE = 1;

    private final QueueEntryJpaRepository queueEntryJpaRepository;

    public QueueEntryJpaAdapter(QueueEntryJpaRepository queueEntryJpaRepository) {
        this.queueEntryJpaRepository = queueEntryJpaRepository;
    }

    @Override
    public QueueEntry insert(QueueEntry entry) {
        return queueEntryJpaRepository.saveAndFlush(QueueEntryJpaEntity.fromDomain(entry)).toDomain();
    }

    @Override
    public QueueEntry update(QueueEntry entry) {
        return queueEntryJpaRepository.saveAndFlush(QueueEntryJpaEntity.fromDomain(entry)).toDomain();
    }

    @Override
    public Optional<QueueEntry> findActive(long eventId, long userId) {
        return queueEntryJpaRepository.findByEventIdAndUserIdAndActive(eventId, userId, ACTIVE)
                .map(QueueEntryJpaEntity::toDomain);
    }

    @Override
    public Optional<QueueEntry> findLatest(long eventId, long userId) {
        return queueEntryJpaRepository.findFirstByEventIdAndUserIdOrderBySequenceNoDesc(eventId, userId)
                .map(QueueEntryJpaEntity::toDomain);
    }

    @Override
    public List<QueueEntry> findByIds(Collection<Long> ids) {
        return queueEntryJpaRepository.findAllById(ids).stream()
                .map(QueueEntryJpaEntity::toDomain)
                .toList();
    }

    @Override
    public long countAhead(long eventId, long sequence) {
        return queueEntryJpaRepository.countAhead(eventId, sequence);
    }

    @Override
    public long countByStatus(long eventId, QueueStatus status) {
        return queueEntryJpaRepository.countByEventIdAndStatus(eventId, status);
    }

    @Override
    public List<QueueEntry> findWaiting(long eventId, int limit) {
        return queueEntryJpaRepository.findByEventIdAndStatusOrderBySequenceNoAsc(
                        eventId, QueueStatus.WAITING, PageRequest.of(0, limit)).stream()
                .map(QueueEntryJpaEntity::toDomain)
                .toList();
    }

    @Override
    public int admit(Collection<Long> ids, LocalDateTime admittedAt, LocalDateTime deadline) {
        return queueEntryJpaRepository.admit(ids, admittedAt, deadline, QueueStatus.WAITING, QueueStatus.PROCESSING);
    }

    @Override
    public int expireOverdue(LocalDateTime now) {
        return queueEntryJpaRepository.expireOverdue(now, QueueStatus.PROCESSING, QueueStatus.EXPIRED);
    }

    @Override
    public int expireOverdue(long eventId, LocalDateTime now) {
        return queueEntryJpaRepository.expireOverdue(eventId, now, QueueStatus.PROCESSING, QueueStatus.EXPIRED);
    }

    @Override
    public boolean changeActiveStatus(long id, QueueStatus from, QueueStatus to, LocalDateTime now) {
        if (!to.isTerminal()) {
            throw new IllegalArgumentException("종료 상태로만 전이할 수 있습니다: " + to);
        }
        return queueEntryJpaRepository.close(id, from, to, now) == 1;
    }
}
