package kr.jemi.ticketgate.catalog.api;

import java.util.List;

public interface CatalogFacade {

    /**
     * @throws kr.jemi.ticketgate.common.exception.BusinessException EVENT_NOT_FOUND
     */
    EventPolicy getEvent(long eventId);

    List<Long> findQueueEnabledEventIds();
}
