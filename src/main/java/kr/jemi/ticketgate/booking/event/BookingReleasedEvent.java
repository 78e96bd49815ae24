package kr.jemi.ticketgate.booking.event;

/**
 * 예매가 취소 또는 실패로 끝나 선점이 반납되었다.
 */
public record BookingReleasedEvent(long bookingId, String bookingNumber, long userId, long eventId,
                                   String status, String reason) {
}
