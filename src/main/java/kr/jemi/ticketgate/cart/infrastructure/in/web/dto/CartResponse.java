package kr.jemi.ticketgate.cart.infrastructure.in.web.dto;

import kr.jemi.ticketgate.cart.domain.Cart;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

public record CartResponse(long cartId, long eventId, String status, LocalDateTime expiresAt,
                           int totalQuantity, BigDecimal totalAmount, List<CartItemResponse> items) {

    public static CartResponse from(Cart cart, LocalDateTime now) {
        return new CartResponse(cart.getId(), cart.getEventId(), cart.effectiveStatus(now).name(),
                cart.getExpiresAt(), cart.totalQuantity(), cart.totalAmount(),
                cart.getItems().stream().map(CartItemResponse::from).toList());
    }
}
