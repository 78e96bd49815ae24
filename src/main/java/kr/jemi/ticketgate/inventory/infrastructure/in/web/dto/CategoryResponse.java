package kr.jemi.ticketgate.inventory.infrastructure.in.web.dto;

import kr.jemi.ticketgate.inventory.domain.SeatCategory;

import java.math.BigDecimal;

public record CategoryResponse(long categoryId, String name, BigDecimal price, int total, int available) {

    public static CategoryResponse from(SeatCategory category) {
        return new CategoryResponse(category.id(), category.name(), category.price(),
                category.total(), category.available());
    }
}
