package kr.jemi.ticketgate.queue.domain;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import kr.jemi.ticketgate.common.validation.SelfValidating;

import java.time.LocalDateTime;

/**
 * @param position 앞에 있는 WAITING/PROCESSING 엔트리 수
 */
public record QueuePosition(long entryId, long eventId, @NotNull QueueStatus status, @Min(0) long position,
                            @Min(0) int estimatedWaitMinutes, boolean canProceed,
                            LocalDateTime processingDeadline) implements SelfValidating {

    public QueuePosition(long entryId, long eventId, QueueStatus status, long position,
                         int estimatedWaitMinutes, boolean canProceed, LocalDateTime processingDeadline) {
        this.entryId = entryId;
        this.eventId = eventId;
        this.status = status;
        this.position = position;
        this.estimatedWaitMinutes = estimatedWaitMinutes;
        this.canProceed = canProceed;
        this.processingDeadline = processingDeadline;
        validateSelf();
    }
}
