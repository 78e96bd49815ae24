package kr.jemi.ticketgate.queue.application.port.in;

import kr.jemi.ticketgate.queue.domain.QueueStats;

public interface GetQueueStatsUseCase {

    QueueStats getStats(long eventId);
}
