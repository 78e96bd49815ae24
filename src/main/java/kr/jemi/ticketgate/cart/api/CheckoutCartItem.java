package kr.jemi.ticketgate.cart.api;

import java.math.BigDecimal;
import java.util.List;

public record CheckoutCartItem(long categoryId, String categoryName, int quantity, BigDecimal unitPrice,
                               List<Long> seatIds) {
}
