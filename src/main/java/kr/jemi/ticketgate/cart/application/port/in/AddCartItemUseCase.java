package kr.jemi.ticketgate.cart.application.port.in;

import kr.jemi.ticketgate.cart.domain.Cart;

public interface AddCartItemUseCase {

    Cart addItem(AddCartItemCommand command);
}
