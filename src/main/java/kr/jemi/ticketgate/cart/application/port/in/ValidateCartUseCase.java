package kr.jemi.ticketgate.cart.application.port.in;

import kr.jemi.ticketgate.cart.domain.CartValidation;

public interface ValidateCartUseCase {

    CartValidation validate(long userId, long cartId);
}
