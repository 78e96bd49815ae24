package kr.jemi.ticketgate.inventory.application.port.out;

import kr.jemi.ticketgate.inventory.domain.Seat;

import java.util.Collection;
import java.util.List;

public interface SeatPort {

    List<Seat> findByIds(Collection<Long> seatIds);

    /**
     * 해당 등급의 AVAILABLE 좌석만 HELD 로 바꾸고 바뀐 좌석 수를 반환한다.
     */
    int hold(long categoryId, Collection<Long> seatIds, long holdId);

    int release(long holdId);

    int sell(long holdId);
}
