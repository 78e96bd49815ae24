package kr.jemi.ticketgate.booking.infrastructure.in.web.dto;

import kr.jemi.ticketgate.booking.domain.Booking;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

public record BookingResponse(long bookingId, String bookingNumber, long eventId, String status,
                              String paymentStatus, BigDecimal totalAmount, BigDecimal discountAmount,
                              BigDecimal finalAmount, String currency, int ticketCount,
                              LocalDateTime pendingExpiresAt, LocalDateTime confirmedAt, String failureReason,
                              List<BookingItemResponse> items) {

    public static BookingResponse from(Booking booking) {
        return new BookingResponse(booking.getId(), booking.getBookingNumber(), booking.getEventId(),
                booking.getStatus().name(), booking.getPaymentStatus().name(), booking.getTotalAmount(),
                booking.getDiscountAmount(), booking.getFinalAmount(), booking.getCurrency(),
                booking.ticketCount(), booking.getPendingExpiresAt(), booking.getConfirmedAt(),
                booking.getFailureReason(),
                booking.getItems().stream().map(BookingItemResponse::from).toList());
    }
}
