package kr.jemi.ticketgate.inventory.application.port.out;

import kr.jemi.ticketgate.inventory.domain.SeatCategory;

import java.util.List;
import java.util.Optional;

/**
 * 좌석 등급 카운터. 변경 메서드는 모두 단일 조건부 UPDATE 이며 반영 여부를 반환한다.
 */
public interface CategoryCounterPort {

    Optional<SeatCategory> findById(long categoryId);

    List<SeatCategory> findByEventId(long eventId);

    int countAvailable(long categoryId);

    /** {@code total - held - sold >= quantity} 일 때만 held 를 늘린다. */
    boolean tryHold(long categoryId, int quantity);

    /** {@code held >= quantity} 일 때만 held 를 줄인다. */
    boolean release(long categoryId, int quantity);

    /** held 에서 sold 로 옮긴다. */
    boolean sell(long categoryId, int quantity);
}
