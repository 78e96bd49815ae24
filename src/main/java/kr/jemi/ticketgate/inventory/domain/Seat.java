package kr.jemi.ticketgate.inventory.domain;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import kr.jemi.ticketgate.common.validation.SelfValidating;

/**
 * 지정석. 선점 중이거나 판매된 좌석은 자신을 잡고 있는 hold id 를 가진다.
 */
public record Seat(long id, long categoryId, @NotBlank String label, @NotNull SeatStatus status, Long holdId)
        implements SelfValidating {

    public Seat(long id, long categoryId, String label, SeatStatus status, Long holdId) {
        this.id = id;
        this.categoryId = categoryId;
        this.label = label;
        this.status = status;
        this.holdId = holdId;
        validateSelf();
    }

    public static Seat available(long id, long categoryId, String label) {
        return new Seat(id, categoryId, label, SeatStatus.AVAILABLE, null);
    }
}
