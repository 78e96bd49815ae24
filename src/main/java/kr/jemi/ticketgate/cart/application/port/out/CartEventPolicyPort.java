package kr.jemi.ticketgate.cart.application.port.out;

import kr.jemi.ticketgate.cart.domain.CartEventPolicy;

public interface CartEventPolicyPort {

    CartEventPolicy getPolicy(long eventId);
}
