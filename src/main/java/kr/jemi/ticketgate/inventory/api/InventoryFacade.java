package kr.jemi.ticketgate.inventory.api;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 재고 원장. 모든 변경은 호출자의 트랜잭션에 참여하며, 실패하면 부분 반영 없이 예외로 끝난다.
 * 해제는 모두 멱등이다.
 */
public interface InventoryFacade {

    CategorySnapshot getCategory(long categoryId);

    /**
     * @throws kr.jemi.ticketgate.common.exception.BusinessException INSUFFICIENT_AVAILABILITY, SEAT_UNAVAILABLE
     */
    HoldView holdForCart(HoldRequest request);

    /**
     * 늘리면 차이만큼 추가 선점하고 줄이면 차이만큼 해제한다.
     */
    HoldView resize(long holdId, int newQuantity);

    void release(long holdId);

    void releaseCart(long cartId);

    void extendCart(long cartId, LocalDateTime expiresAt);

    List<HoldView> findHolds(Collection<Long> holdIds);

    int transferCartToBooking(long cartId, long bookingId, LocalDateTime expiresAt);

    void sellBooking(long bookingId);

    void releaseBooking(long bookingId);

    Map<Long, String> findSeatLabels(Collection<Long> seatIds);
}
