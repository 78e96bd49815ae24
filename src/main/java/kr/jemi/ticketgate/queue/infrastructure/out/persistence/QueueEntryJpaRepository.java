package kr.jemi.ticketgate.queue.infrastructure.out.persistence;

import kr.jemi.ticketgate.queue.domain.QueueStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface QueueEntryJpaRepository extends JpaRepository<QueueEntryJpaEntity, Long> {

    Optional<QueueEntryJpaEntity> findByEventIdAndUserIdAndActive(Long eventId, Long userId, Integer active);

    Optional<QueueEntryJpaEntity> findFirstByEventIdAndUserIdOrderBySequenceNoDesc(Long eventId, Long userId);

    long countByEventIdAndStatus(Long eventId, QueueStatus status);

    @Query("""
            select count(q) from QueueEntryJpaEntity q
             where q.eventId = :eventId
               and q.active = 1
               and q.sequenceNo < :sequenceNo
            """)
    long countAhead(@Param("eventId") Long eventId, @Param("sequenceNo") Long sequenceNo);

    List<QueueEntryJpaEntity> findByEventIdAndStatusOrderBySequenceNoAsc(Long eventId, QueueStatus status,
                                                                         Pageable pageable);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update QueueEntryJpaEntity q
               set q.status = :processing, q.admittedAt = :admittedAt,
                   q.processingDeadline = :deadline, q.updatedAt = :admittedAt
             where q.id in :ids
               and q.status = :waiting
            """)
    int admit(@Param("ids") Collection<Long> ids,
              @Param("admittedAt") LocalDateTime admittedAt,
              @Param("deadline") LocalDateTime deadline,
              @Param("waiting") QueueStatus waiting,
              @Param("processing") QueueStatus processing);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update QueueEntryJpaEntity q
               set q.status = :expired, q.active = null, q.updatedAt = :now
             where q.status = :processing
               and q.processingDeadline <= :now
            """)
    int expireOverdue(@Param("now") LocalDateTime now,
                      @Param("processing") QueueStatus processing,
                      @Param("expired") QueueStatus expired);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update QueueEntryJpaEntity q
               set q.status = :expired, q.active = null, q.updatedAt = :now
             where q.eventId = :eventId
               and q.status = :processing
               and q.processingDeadline <= :now
            """)
    int expireOverdue(@Param("eventId") Long eventId,
                      @Param("now") LocalDateTime now,
                      @Param("processing") QueueStatus processing,
                      @Param("expired") QueueStatus expired);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update QueueEntryJpaEntity q
               set q.status = :to, q.active = null, q.updatedAt = :now
             where q.id = :id
               and q.status = :from
               and q.active = 1
            """)
    int close(@Param("id") Long id,
              @Param("from") QueueStatus from,
              @Param("to") QueueStatus to,
              @Param("now") LocalDateTime now);
}
