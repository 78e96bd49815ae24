package kr.jemi.ticketgate.booking.infrastructure.out.persistence;

import jakarta.persistence.LockModeType;
import kr.jemi.ticketgate.booking.domain.BookingStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface BookingJpaRepository extends JpaRepository<BookingJpaEntity, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select b from BookingJpaEntity b where b.id = :id")
    Optional<BookingJpaEntity> findByIdForUpdate(@Param("id") Long id);

    Optional<BookingJpaEntity> findByTransactionId(String transactionId);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update BookingJpaEntity b set b.transactionOpeningAt = :now
             where b.id = :id
               and b.status = :status
               and b.transactionId is null
               and (b.transactionOpeningAt is null or b.transactionOpeningAt < :staleBefore)
            """)
    int claimTransactionOpening(@Param("id") Long id,
                                @Param("status") BookingStatus status,
                                @Param("now") LocalDateTime now,
                                @Param("staleBefore") LocalDateTime staleBefore);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update BookingJpaEntity b set b.transactionOpeningAt = null
             where b.id = :id and b.transactionId is null
            """)
    int releaseTransactionOpening(@Param("id") Long id);

    List<BookingJpaEntity> findByUserIdOrderByCreatedAtDesc(Long userId);

    @Query("""
            select b.id from BookingJpaEntity b
             where b.status = :status
               and b.transactionId is not null
               and b.updatedAt <= :threshold
             order by b.updatedAt asc
            """)
    List<Long> findPendingWithTransactionBefore(@Param("status") BookingStatus status,
                                                @Param("threshold") LocalDateTime threshold,
                                                Pageable pageable);

    @Query("""
            select b.id from BookingJpaEntity b
             where b.status = :status
               and b.pendingExpiresAt <= :now
             order by b.pendingExpiresAt asc
            """)
    List<Long> findPendingExpired(@Param("status") BookingStatus status,
                                  @Param("now") LocalDateTime now,
                                  Pageable pageable);
}
