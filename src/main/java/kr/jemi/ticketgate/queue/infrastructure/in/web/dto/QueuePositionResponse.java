package kr.jemi.ticketgate.queue.infrastructure.in.web.dto;

import kr.jemi.ticketgate.queue.domain.QueuePosition;

import java.time.LocalDateTime;

public record QueuePositionResponse(long entryId, long eventId, String status, long position,
                                    int estimatedWaitMinutes, boolean canProceed,
                                    LocalDateTime processingDeadline) {

    public static QueuePositionResponse from(QueuePosition position) {
        return new QueuePositionResponse(position.entryId(), position.eventId(), position.status().name(),
                position.position(), position.estimatedWaitMinutes(), position.canProceed(),
                position.processingDeadline());
    }
}
