package kr.jemi.ticketgate.inventory.application.port.out;

import kr.jemi.ticketgate.inventory.domain.HoldOwner;
import kr.jemi.ticketgate.inventory.domain.InventoryHold;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface InventoryHoldPort {

    InventoryHold insert(InventoryHold hold);

    Optional<InventoryHold> findById(long holdId);

    List<InventoryHold> findByIds(Collection<Long> holdIds);

    List<InventoryHold> findActiveByOwner(HoldOwner owner, long ownerId);

    /** ACTIVE 일 때만 RELEASED 로 바꾼다. */
    boolean markReleased(long holdId);

    /** ACTIVE 일 때만 SOLD 로 바꾼다. */
    boolean markSold(long holdId);

    boolean updateQuantity(long holdId, int quantity);

    int extendExpiry(HoldOwner owner, long ownerId, LocalDateTime expiresAt);

    int transfer(HoldOwner from, long fromId, HoldOwner to, long toId, LocalDateTime expiresAt);
}
