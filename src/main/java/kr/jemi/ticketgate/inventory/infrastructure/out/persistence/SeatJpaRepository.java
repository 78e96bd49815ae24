package kr.jemi.ticketgate.inventory.infrastructure.out.persistence;

import kr.jemi.ticketgate.inventory.domain.SeatStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;

public interface SeatJpaRepository extends JpaRepository<SeatJpaEntity, Long> {

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update SeatJpaEntity s
               set s.status = :held, s.holdId = :holdId
             where s.id in :ids
               and s.categoryId = :categoryId
               and s.status = :available
            """)
    int hold(@Param("categoryId") Long categoryId,
             @Param("ids") Collection<Long> ids,
             @Param("holdId") Long holdId,
             @Param("available") SeatStatus available,
             @Param("held") SeatStatus held);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update SeatJpaEntity s
               set s.status = :available, s.holdId = null
             where s.holdId = :holdId
               and s.status = :held
            """)
    int release(@Param("holdId") Long holdId,
                @Param("held") SeatStatus held,
                @Param("available") SeatStatus available);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update SeatJpaEntity s
               set s.status = :sold
             where s.holdId = :holdId
               and s.status = :held
            """)
    int sell(@Param("holdId") Long holdId,
             @Param("held") SeatStatus held,
             @Param("sold") SeatStatus sold);
}
