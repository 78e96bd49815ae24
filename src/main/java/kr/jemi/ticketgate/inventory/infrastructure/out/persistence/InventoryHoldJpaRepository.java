package kr.jemi.ticketgate.inventory.infrastructure.out.persistence;

import kr.jemi.ticketgate.inventory.domain.HoldOwner;
import kr.jemi.ticketgate.inventory.domain.HoldStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;

public interface InventoryHoldJpaRepository extends JpaRepository<InventoryHoldJpaEntity, Long> {

    List<InventoryHoldJpaEntity> findByOwnerAndOwnerIdAndStatus(HoldOwner owner, Long ownerId, HoldStatus status);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update InventoryHoldJpaEntity h
               set h.status = :to
             where h.id = :id
               and h.status = :from
            """)
    int changeStatus(@Param("id") Long id, @Param("from") HoldStatus from, @Param("to") HoldStatus to);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update InventoryHoldJpaEntity h
               set h.quantity = :quantity
             where h.id = :id
               and h.status = :active
            """)
    int updateQuantity(@Param("id") Long id, @Param("quantity") int quantity, @Param("active") HoldStatus active);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update InventoryHoldJpaEntity h
               set h.expiresAt = :expiresAt
             where h.owner = :owner
               and h.ownerId = :ownerId
               and h.status = :active
            """)
    int extendExpiry(@Param("owner") HoldOwner owner,
                     @Param("ownerId") Long ownerId,
                     @Param("expiresAt") LocalDateTime expiresAt,
                     @Param("active") HoldStatus active);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update InventoryHoldJpaEntity h
               set h.owner = :to, h.ownerId = :toId, h.expiresAt = :expiresAt
             where h.owner = :from
               and h.ownerId = :fromId
               and h.status = :active
            """)
    int transfer(@Param("from") HoldOwner from,
                 @Param("fromId") Long fromId,
                 @Param("to") HoldOwner to,
                 @Param("toId") Long toId,
                 @Param("expiresAt") LocalDateTime expiresAt,
                 @Param("active") HoldStatus active);
}
