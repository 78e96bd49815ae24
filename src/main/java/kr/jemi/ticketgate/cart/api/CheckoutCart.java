package kr.jemi.ticketgate.cart.api;

import java.math.BigDecimal;
import java.util.List;

/**
 * 결제로 넘어가는 시점에 고정된 장바구니 내용. 단가는 담을 때의 가격이다.
 */
public record CheckoutCart(long cartId, long userId, long eventId, List<CheckoutCartItem> items) {

    public BigDecimal totalAmount() {
        return items.stream()
                .map(item -> item.unitPrice().multiply(BigDecimal.valueOf(item.quantity())))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public int totalQuantity() {
        return items.stream().mapToInt(CheckoutCartItem::quantity).sum();
    }
}
