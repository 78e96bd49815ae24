package kr.jemi.ticketgate.cart.application.port.in;

import kr.jemi.ticketgate.cart.domain.Cart;

public interface GetCartUseCase {

    Cart getActiveCart(long userId, long eventId);

    Cart getCart(long userId, long cartId);
}
