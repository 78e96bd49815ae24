package kr.jemi.ticketgate.cart.infrastructure.in.web.dto;

import kr.jemi.ticketgate.cart.domain.CartItem;

import java.math.BigDecimal;
import java.util.List;

public record CartItemResponse(long itemId, long categoryId, String categoryName, int quantity,
                               List<Long> seatIds, BigDecimal unitPrice, BigDecimal subtotal) {

    public static CartItemResponse from(CartItem item) {
        return new CartItemResponse(item.getId(), item.getCategoryId(), item.getCategoryName(),
                item.getQuantity(), item.getSeatIds(), item.getUnitPrice(), item.subtotal());
    }
}
