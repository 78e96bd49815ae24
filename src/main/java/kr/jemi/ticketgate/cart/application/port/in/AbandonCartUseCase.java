package kr.jemi.ticketgate.cart.application.port.in;

public interface AbandonCartUseCase {

    void abandon(long userId, long cartId);
}
