package kr.jemi.ticketgate.booking.domain;

import java.math.BigDecimal;
import java.util.List;

public record CheckoutLine(long categoryId, String categoryName, int quantity, BigDecimal unitPrice,
                           List<Long> seatIds) {
}
