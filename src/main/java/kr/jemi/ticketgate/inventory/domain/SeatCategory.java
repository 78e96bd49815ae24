package kr.jemi.ticketgate.inventory.domain;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import kr.jemi.ticketgate.common.validation.SelfValidating;

import java.math.BigDecimal;

/**
 * 좌석 등급별 재고 카운터. {@code held + sold <= total} 이 항상 성립한다.
 */
public record SeatCategory(
        long id,
        long eventId,
        @NotBlank String name,
        @NotNull @DecimalMin("0") BigDecimal price,
        @Min(0) int total,
        @Min(0) int held,
        @Min(0) int sold
) implements SelfValidating {

    public SeatCategory(long id, long eventId, String name, BigDecimal price, int total, int held, int sold) {
        this.id = id;
        this.eventId = eventId;
        this.name = name;
        this.price = price;
        this.total = total;
        this.held = held;
        this.sold = sold;
        validateSelf();
        if (held + sold > total) {
            throw new IllegalStateException(
                    "좌석 등급 " + id + " 재고 불일치: held=" + held + ", sold=" + sold + ", total=" + total);
        }
    }

    public static SeatCategory create(long id, long eventId, String name, BigDecimal price, int total) {
        return new SeatCategory(id, eventId, name, price, total, 0, 0);
    }

    public int available() {
        return total - held - sold;
    }
}
