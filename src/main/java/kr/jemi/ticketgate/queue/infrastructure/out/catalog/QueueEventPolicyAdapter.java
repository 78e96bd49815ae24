package kr.jemi.ticketgate.queue.infrastructure.out.catalog;

import kr.jemi.ticketgate.catalog.api.CatalogFacade;
import kr.jemi.ticketgate.catalog.api.EventPolicy;
import kr.jemi.ticketgate.queue.application.port.out.QueueEventPolicyPort;
import kr.jemi.ticketgate.queue.domain.QueueEventPolicy;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

@Component
public class QueueEventPolicyAdapter implements QueueEventPolicyPort {

    private final CatalogFacade catalogFacade;
    private final Clock clock;

    public QueueEventPolicyAdapter(CatalogFacade catalogFacade, Clock clock) {
        this.catalogFacade = catalogFacade;
        this.clock = clock;
    }

    @Override
    public QueueEventPolicy getPolicy(long eventId) {
        EventPolicy event = catalogFacade.getEvent(eventId);
        return new QueueEventPolicy(event.eventId(), event.queueEnabled(), event.queueBatchSize(),
                event.queueProcessingMinutes(), event.isBookingOpen(LocalDateTime.now(clock)));
    }

    @Override
    public List<Long> findQueueEnabledEventIds() {
        return catalogFacade.findQueueEnabledEventIds();
    }
}
