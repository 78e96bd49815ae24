package kr.jemi.ticketgate.queue.application.port.out;

import kr.jemi.ticketgate.queue.domain.QueueEventPolicy;

import java.util.List;

public interface QueueEventPolicyPort {

    QueueEventPolicy getPolicy(long eventId);

    List<Long> findQueueEnabledEventIds();
}
