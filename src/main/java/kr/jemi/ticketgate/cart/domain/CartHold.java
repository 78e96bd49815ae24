package kr.jemi.ticketgate.cart.domain;

import java.time.LocalDateTime;
import java.util.List;

public record CartHold(long holdId, long categoryId, int quantity, List<Long> seatIds,
                       LocalDateTime expiresAt, boolean active) {

    public boolean isUsableAt(LocalDateTime now) {
        return active && now.isBefore(expiresAt);
    }
}
