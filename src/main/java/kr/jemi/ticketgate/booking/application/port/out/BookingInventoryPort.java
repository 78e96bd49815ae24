package kr.jemi.ticketgate.booking.application.port.out;

import java.time.LocalDateTime;

public interface BookingInventoryPort {

    int transferFromCart(long cartId, long bookingId, LocalDateTime expiresAt);

    void sell(long bookingId);

    void release(long bookingId);
}
