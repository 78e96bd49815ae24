package kr.jemi.ticketgate.inventory.api;

import java.math.BigDecimal;

public record CategorySnapshot(long categoryId, long eventId, String name, BigDecimal price,
                               int total, int held, int sold, int available) {
}
