package kr.jemi.ticketgate.booking.application.port.in;

import kr.jemi.ticketgate.booking.domain.ContactInfo;

public record BeginCheckoutCommand(long userId, long cartId, ContactInfo contact) {
}
