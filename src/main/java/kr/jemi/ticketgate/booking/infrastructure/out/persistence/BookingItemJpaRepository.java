package kr.jemi.ticketgate.booking.infrastructure.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface BookingItemJpaRepository extends JpaRepository<BookingItemJpaEntity, Long> {

    List<BookingItemJpaEntity> findByBookingIdOrderByIdAsc(Long bookingId);

    List<BookingItemJpaEntity> findByBookingIdInOrderByIdAsc(Collection<Long> bookingIds);
}
