package kr.jemi.ticketgate.cart.domain;

import java.math.BigDecimal;

public record CartCategory(long categoryId, long eventId, String name, BigDecimal price, int available) {
}
