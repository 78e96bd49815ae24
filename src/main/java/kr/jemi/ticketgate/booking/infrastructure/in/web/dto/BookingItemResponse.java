package kr.jemi.ticketgate.booking.infrastructure.in.web.dto;

import kr.jemi.ticketgate.booking.domain.BookingItem;

import java.math.BigDecimal;

public record BookingItemResponse(long itemId, long categoryId, String categoryName, Long seatId,
                                  BigDecimal unitPrice, String ticketNumber) {

    public static BookingItemResponse from(BookingItem item) {
        return new BookingItemResponse(item.getId(), item.getCategoryId(), item.getCategoryName(),
                item.getSeatId(), item.getUnitPrice(), item.getTicketNumber());
    }
}
