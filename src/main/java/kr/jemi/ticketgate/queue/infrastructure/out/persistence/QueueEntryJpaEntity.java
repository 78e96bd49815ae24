package kr.jemi.ticketgate.queue.infrastructure.out.persistence;

import jakarta.persistence.*;
import kr.jemi.ticketgate.queue.domain.QueueEntry;
import kr.jemi.ticketgate.queue.domain.QueueStatus;

import java.time.LocalDateTime;

@Entity
@Table(name = "queue_entries",
        uniqueConstraints = @UniqueConstraint(name = "uk_queue_active_entry",
                columnNames = {"eventId", "userId", "active"}),
        indexes = {
                @Index(name = "idx_queue_event_status_seq", columnList = "eventId, status, sequenceNo"),
                @Index(name = "idx_queue_status_deadline", columnList = "status, processingDeadline")
        })
public class QueueEntryJpaEntity {

    @Id
    private Long id;

    @Column(nullable = false)
    private Long eventId;

    @Column(nullable = false)
    private Long userId;

    @Column(nullable = false)
    private Long sequenceNo;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private QueueStatus status;

    // 진행 중이면 1, 종료되면 NULL. MySQL 유니크 키는 NULL 을 중복으로 보지 않는다
    private Integer active;

    private LocalDateTime admittedAt;

    private LocalDateTime processingDeadline;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    protected QueueEntryJpaEntity() {}

    public static QueueEntryJpaEntity fromDomain(QueueEntry entry) {
        QueueEntryJpaEntity entity = new QueueEntryJpaEntity();
        entity.id = entry.getId();
        entity.eventId = entry.getEventId();
        entity.userId = entry.getUserId();
        entity.sequenceNo = entry.getSequence();
        entity.status = entry.getStatus();
        entity.active = entry.getStatus().isTerminal() ? null : 1;
        entity.admittedAt = entry.getAdmittedAt();
        entity.processingDeadline = entry.getProcessingDeadline();
        entity.createdAt = entry.getCreatedAt();
        entity.updatedAt = entry.getUpdatedAt();
        return entity;
    }

    public QueueEntry toDomain() {
        return new QueueEntry(id, eventId, userId, sequenceNo, status, admittedAt, processingDeadline,
                createdAt, updatedAt);
    }
}
