package kr.jemi.ticketgate.cart.application.port.in;

import kr.jemi.ticketgate.cart.domain.Cart;

public interface UpdateCartItemUseCase {

    Cart updateQuantity(long userId, long cartId, long itemId, int quantity);
}
