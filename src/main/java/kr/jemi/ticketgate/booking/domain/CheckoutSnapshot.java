package kr.jemi.ticketgate.booking.domain;

import java.util.List;

public record CheckoutSnapshot(long cartId, long userId, long eventId, List<CheckoutLine> lines) {
}
