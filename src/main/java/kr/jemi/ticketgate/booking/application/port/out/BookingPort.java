package kr.jemi.ticketgate.booking.application.port.out;

import kr.jemi.ticketgate.booking.domain.Booking;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface BookingPort {

    Booking insert(Booking booking);

    Booking save(Booking booking);

    Optional<Booking> findById(long bookingId);

    Optional<Booking> findByIdForUpdate(long bookingId);

    Optional<Booking> findByTransactionId(String transactionId);

    List<Booking> findByUserId(long userId);

    /**
     * 거래가 없는 PENDING 예매에 대해 게이트웨이 거래 개설 권한을 선점한다.
     * staleBefore 이전의 선점은 끝나지 않은 것으로 보고 다시 가져올 수 있다.
     *
     * @return 이번 호출이 선점했으면 true
     */
    boolean claimTransactionOpening(long bookingId, LocalDateTime now, LocalDateTime staleBefore);

    void releaseTransactionOpening(long bookingId);

    /**
     * 거래가 열린 채 threshold 이전부터 PENDING 인 예매.
     */
    List<Long> findPendingWithTransactionBefore(LocalDateTime threshold, int limit);

    List<Long> findPendingExpired(LocalDateTime now, int limit);
}
