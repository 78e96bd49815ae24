package kr.jemi.ticketgate.booking.application.port.out;

import kr.jemi.ticketgate.booking.domain.CheckoutSnapshot;

public interface CheckoutCartPort {

    CheckoutSnapshot convert(long userId, long cartId, long bookingId);
}
