package kr.jemi.ticketgate.booking.application.port.in;

import kr.jemi.ticketgate.booking.domain.Booking;

import java.util.List;

public interface GetBookingUseCase {

    Booking getBooking(long userId, long bookingId);

    List<Booking> getBookings(long userId);
}
