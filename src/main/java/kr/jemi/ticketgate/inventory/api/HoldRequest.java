package kr.jemi.ticketgate.inventory.api;

import java.time.LocalDateTime;
import java.util.List;

/**
 * @param seatIds 지정석이면 좌석 id 목록, 비지정석이면 빈 목록. 지정석이면 quantity 는 좌석 수로 대체된다.
 */
public record HoldRequest(long cartId, long categoryId, int quantity, List<Long> seatIds, LocalDateTime expiresAt) {

    public HoldRequest {
        seatIds = seatIds == null ? List.of() : List.copyOf(seatIds);
    }
}
