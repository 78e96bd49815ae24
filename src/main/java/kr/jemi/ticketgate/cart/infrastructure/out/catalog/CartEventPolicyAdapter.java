package kr.jemi.ticketgate.cart.infrastructure.out.catalog;

import kr.jemi.ticketgate.cart.application.port.out.CartEventPolicyPort;
import kr.jemi.ticketgate.cart.domain.CartEventPolicy;
import kr.jemi.ticketgate.catalog.api.CatalogFacade;
import kr.jemi.ticketgate.catalog.api.EventPolicy;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

@Component
public class CartEventPolicyAdapter implements CartEventPolicyPort {

    private final CatalogFacade catalogFacade;
    private final Clock clock;

    public CartEventPolicyAdapter(CatalogFacade catalogFacade, Clock clock) {
        this.catalogFacade = catalogFacade;
        this.clock = clock;
    }

    @Override
    public CartEventPolicy getPolicy(long eventId) {
        EventPolicy event = catalogFacade.getEvent(eventId);
        return new CartEventPolicy(event.eventId(), event.queueEnabled(), event.maxTicketsPerBooking(),
                event.isBookingOpen(LocalDateTime.now(clock)));
    }
}
