package kr.jemi.ticketgate.booking.infrastructure.out.queue;

import kr.jemi.ticketgate.booking.application.port.out.QueueCompletionPort;
import kr.jemi.ticketgate.queue.api.QueueFacade;
import org.springframework.stereotype.Component;

@Component
public class QueueCompletionAdapter implements QueueCompletionPort {

    private final QueueFacade queueFacade;

    public QueueCompletionAdapter(QueueFacade queueFacade) {
        this.queueFacade = queueFacade;
    }

    @Override
    public void complete(long eventId, long userId) {
        queueFacade.complete(eventId, userId);
    }
}
