package kr.jemi.ticketgate.booking.application.port.in;

import kr.jemi.ticketgate.booking.domain.Booking;

public interface BeginCheckoutUseCase {

    Booking beginCheckout(BeginCheckoutCommand command);
}
