package kr.jemi.ticketgate.cart.application.port.in;

import kr.jemi.ticketgate.cart.domain.Cart;

public interface RemoveCartItemUseCase {

    Cart removeItem(long userId, long cartId, long itemId);
}
