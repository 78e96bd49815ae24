package kr.jemi.ticketgate.booking.event;

public record BookingConfirmedEvent(long bookingId, String bookingNumber, long userId, long eventId,
                                    int ticketCount) {
}
