package kr.jemi.ticketgate.catalog.application.service;

import kr.jemi.ticketgate.catalog.api.CatalogFacade;
import kr.jemi.ticketgate.catalog.api.EventPolicy;
import kr.jemi.ticketgate.catalog.application.port.out.EventPort;
import kr.jemi.ticketgate.catalog.domain.Event;
import kr.jemi.ticketgate.common.exception.BusinessException;
import kr.jemi.ticketgate.common.exception.ErrorCode;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class CatalogService implements CatalogFacade {

    private final EventPort eventPort;

    public CatalogService(EventPort eventPort) {
        this.eventPort = eventPort;
    }

    // 외부 카탈로그 변경은 spring.cache.redis.time-to-live 이내에 반영된다
    @Override
    @Cacheable(cacheNames = "eventPolicies", key = "#eventId")
    public EventPolicy getEvent(long eventId) {
        Event event = eventPort.findById(eventId)
                .orElseThrow(() -> new BusinessException(ErrorCode.EVENT_NOT_FOUND));
        return toPolicy(event);
    }

    @Override
    public List<Long> findQueueEnabledEventIds() {
        return eventPort.findQueueEnabledPublishedIds();
    }

    private static EventPolicy toPolicy(Event event) {
        return new EventPolicy(
                event.id(),
                event.slug(),
                event.title(),
                event.isPublished(),
                event.queueEnabled(),
                event.queueBatchSize(),
                event.queueProcessingMinutes(),
                event.maxTicketsPerBooking(),
                event.bookingOpensAt(),
                event.bookingClosesAt()
        );
    }
}
