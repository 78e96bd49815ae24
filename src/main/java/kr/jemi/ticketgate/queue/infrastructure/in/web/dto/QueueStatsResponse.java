package kr.jemi.ticketgate.queue.infrastructure.in.web.dto;

import kr.jemi.ticketgate.queue.domain.QueueStats;

public record QueueStatsResponse(long eventId, boolean queueEnabled, long totalInQueue, long currentlyProcessing,
                                 Integer estimatedWaitMinutes, boolean queueActive) {

    public static QueueStatsResponse from(QueueStats stats) {
        return new QueueStatsResponse(stats.eventId(), stats.queueEnabled(), stats.waiting(), stats.processing(),
                stats.estimatedWaitMinutes(), stats.active());
    }
}
