package kr.jemi.ticketgate.cart.application.port.in;

import java.util.List;

/**
 * seatIds 가 비어 있으면 자유석, 있으면 지정석이며 수량은 좌석 수로 정해진다.
 */
public record AddCartItemCommand(long userId, long eventId, long categoryId, int quantity, List<Long> seatIds) {

    public AddCartItemCommand {
        seatIds = seatIds == null ? List.of() : seatIds.stream().distinct().toList();
        if (seatIds.isEmpty() && quantity < 1) {
            throw new IllegalArgumentException("수량은 1 이상이어야 합니다");
        }
    }

    public int requestedQuantity() {
        return seatIds.isEmpty() ? quantity : seatIds.size();
    }
}
