package kr.jemi.ticketgate.queue.application.port.in;

import kr.jemi.ticketgate.queue.domain.QueuePosition;

public interface GetQueuePositionUseCase {

    QueuePosition getPosition(long eventId, long userId);
}
