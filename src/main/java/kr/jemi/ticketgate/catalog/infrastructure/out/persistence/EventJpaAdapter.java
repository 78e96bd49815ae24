package kr.jemi.ticketgate.catalog.infrastructure.out.persistence;

import kr.jemi.ticketgate.catalog.application.port.out.EventPort;
import kr.jemi.ticketgate.catalog.domain.Event;
import kr.jemi.ticketgate.catalog.domain.EventStatus;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
public class EventJpaAdapter implements EventPort {

    private final EventJpaRepository eventJpaRepository;

    public EventJpaAdapter(EventJpaRepository eventJpaRepository) {
        this.eventJpaRepository = eventJpaRepository;
    }

    @Override
    public Optional<Event> findById(long eventId) {
        return eventJpaRepository.findById(eventId).map(EventJpaEntity::toDomain);
    }

    @Override
    public List<Long> findQueueEnabledPublishedIds() {
        return eventJpaRepository.findQueueEnabledIds(EventStatus.PUBLISHED);
    }
}
