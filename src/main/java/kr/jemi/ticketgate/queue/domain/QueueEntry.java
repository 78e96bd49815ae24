package kr.jemi.ticketgate.queue.domain;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import kr.jemi.ticketgate.common.validation.SelfValidating;

import java.time.LocalDateTime;

/**
 * 한 사용자의 한 이벤트 입장 시도. (user, event) 당 WAITING/PROCESSING 상태는 하나만 존재한다.
 */
public class QueueEntry implements SelfValidating {

    private final long id;
    private final long eventId;
    private final long userId;
    @Min(1)
    private final long sequence;
    @NotNull
    private QueueStatus status;
    private LocalDateTime admittedAt;
    private LocalDateTime processingDeadline;
    @NotNull
    private final LocalDateTime createdAt;
    @NotNull
    private LocalDateTime updatedAt;

    public QueueEntry(long id, long eventId, long userId, long sequence, QueueStatus status,
                      LocalDateTime admittedAt, LocalDateTime processingDeadline,
                      LocalDateTime createdAt, LocalDateTime updatedAt) {
        this.id = id;
        this.eventId = eventId;
        this.userId = userId;
        this.sequence = sequence;
        this.status = status;
        this.admittedAt = admittedAt;
        this.processingDeadline = processingDeadline;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        validateSelf();
        if (status == QueueStatus.PROCESSING && processingDeadline == null) {
            throw new IllegalArgumentException("PROCESSING 상태는 입장 기한이 필요합니다");
        }
    }

    public static QueueEntry join(long id, long eventId, long userId, long sequence, LocalDateTime now) {
        return new QueueEntry(id, eventId, userId, sequence, QueueStatus.WAITING, null, null, now, now);
    }

    public void expire(LocalDateTime now) {
        if (status != QueueStatus.PROCESSING) {
            throw new IllegalStateException("PROCESSING 상태에서만 만료할 수 있습니다. 현재: " + status);
        }
        this.status = QueueStatus.EXPIRED;
        this.updatedAt = now;
    }

    /**
     * 저장된 상태가 PROCESSING 이어도 기한이 지났으면 EXPIRED 로 본다. 기한과 같은 순간도 만료다.
     */
    public QueueStatus effectiveStatus(LocalDateTime now) {
        if (isOverdue(now)) {
            return QueueStatus.EXPIRED;
        }
        return status;
    }

    public boolean isOverdue(LocalDateTime now) {
        return status == QueueStatus.PROCESSING && !now.isBefore(processingDeadline);
    }

    public boolean canProceed(LocalDateTime now) {
        return status == QueueStatus.PROCESSING && now.isBefore(processingDeadline);
    }

    public long getId() {
        return id;
    }

    public long getEventId() {
        return eventId;
    }

    public long getUserId() {
        return userId;
    }

    public long getSequence() {
        return sequence;
    }

    public QueueStatus getStatus() {
        return status;
    }

    public LocalDateTime getAdmittedAt() {
        return admittedAt;
    }

    public LocalDateTime getProcessingDeadline() {
        return processingDeadline;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }
}
