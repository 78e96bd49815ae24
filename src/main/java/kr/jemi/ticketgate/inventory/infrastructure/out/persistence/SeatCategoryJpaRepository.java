package kr.jemi.ticketgate.inventory.infrastructure.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface SeatCategoryJpaRepository extends JpaRepository<SeatCategoryJpaEntity, Long> {

    List<SeatCategoryJpaEntity> findByEventIdOrderByIdAsc(Long eventId);

    @Query("select c.totalSeats - c.heldSeats - c.soldSeats from SeatCategoryJpaEntity c where c.id = :id")
    Integer countAvailable(@Param("id") Long id);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update SeatCategoryJpaEntity c
               set c.heldSeats = c.heldSeats + :quantity
             where c.id = :id
               and c.totalSeats - c.heldSeats - c.soldSeats >= :quantity
            """)
    int hold(@Param("id") Long id, @Param("quantity") int quantity);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update SeatCategoryJpaEntity c
               set c.heldSeats = c.heldSeats - :quantity
             where c.id = :id
               and c.heldSeats >= :quantity
            """)
    int release(@Param("id") Long id, @Param("quantity") int quantity);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update SeatCategoryJpaEntity c
               set c.heldSeats = c.heldSeats - :quantity,
                   c.soldSeats = c.soldSeats + :quantity
             where c.id = :id
               and c.heldSeats >= :quantity
            """)
    int sell(@Param("id") Long id, @Param("quantity") int quantity);
}
