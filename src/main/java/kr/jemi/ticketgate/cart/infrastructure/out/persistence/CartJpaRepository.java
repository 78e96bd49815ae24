package kr.jemi.ticketgate.cart.infrastructure.out.persistence;

import jakarta.persistence.LockModeType;
import kr.jemi.ticketgate.cart.domain.CartStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface CartJpaRepository extends JpaRepository<CartJpaEntity, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from CartJpaEntity c where c.id = :id")
    Optional<CartJpaEntity> findByIdForUpdate(@Param("id") Long id);

    Optional<CartJpaEntity> findByUserIdAndEventIdAndActive(Long userId, Long eventId, Integer active);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from CartJpaEntity c where c.userId = :userId and c.eventId = :eventId and c.active = 1")
    Optional<CartJpaEntity> findActiveForUpdate(@Param("userId") Long userId, @Param("eventId") Long eventId);

    @Query("""
            select c.id from CartJpaEntity c
             where c.status = :status
               and c.expiresAt <= :now
             order by c.expiresAt asc
            """)
    List<Long> findExpiredIds(@Param("status") CartStatus status,
                              @Param("now") LocalDateTime now,
                              Pageable pageable);
}
