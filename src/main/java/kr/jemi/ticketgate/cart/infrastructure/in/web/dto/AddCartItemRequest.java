package kr.jemi.ticketgate.cart.infrastructure.in.web.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import kr.jemi.ticketgate.cart.application.port.in.AddCartItemCommand;

import java.util.List;

/**
 * 지정석이면 seatIds 를, 자유석이면 quantity 를 채운다.
 */
public record AddCartItemRequest(
        @NotNull(message = "좌석 등급은 필수입니다") Long categoryId,
        @Min(value = 1, message = "수량은 1 이상이어야 합니다") Integer quantity,
        @Size(max = 50, message = "한 번에 담을 수 있는 좌석은 50석까지입니다") List<Long> seatIds) {

    public AddCartItemCommand toCommand(long userId, long eventId) {
        return new AddCartItemCommand(userId, eventId, categoryId, quantity == null ? 0 : quantity, seatIds);
    }
}
