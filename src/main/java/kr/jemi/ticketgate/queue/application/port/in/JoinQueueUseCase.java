package kr.jemi.ticketgate.queue.application.port.in;

import kr.jemi.ticketgate.queue.domain.QueuePosition;

public interface JoinQueueUseCase {

    QueuePosition join(long eventId, long userId);
}
