package kr.jemi.ticketgate.catalog.application.port.out;

import kr.jemi.ticketgate.catalog.domain.Event;

import java.util.List;
import java.util.Optional;

public interface EventPort {

    Optional<Event> findById(long eventId);

    List<Long> findQueueEnabledPublishedIds();
}
