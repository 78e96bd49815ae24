package kr.jemi.ticketgate.cart.event;

public record CartExpiredEvent(long cartId, long userId, long eventId) {
}
