package kr.jemi.ticketgate.inventory.infrastructure.out.persistence;

import kr.jemi.ticketgate.inventory.application.port.out.InventoryHoldPort;
import kr.jemi.ticketgate.inventory.domain.HoldOwner;
import kr.jemi.ticketgate.inventory.domain.HoldStatus;
import kr.jemi.ticketgate.inventory.domain.InventoryHold;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Component
public class InventoryHoldJpaAdapter implements InventoryHoldPort {

    private final InventoryHoldJpaRepository inventoryHoldJpaRepository;

    public InventoryHoldJpaAdapter(InventoryHoldJpaRepository inventoryHoldJpaRepository) {
        this.inventoryHoldJpaRepository = inventoryHoldJpaRepository;
    }

    @Override
    public InventoryHold insert(InventoryHold hold) {
        return inventoryHoldJpaRepository.saveAndFlush(InventoryHoldJpaEntity.fromDomain(hold)).toDomain();
    }

    @Override
    public Optional<InventoryHold> findById(long holdId) {
        return inventoryHoldJpaRepository.findById(holdId).map(InventoryHoldJpaEntity::toDomain);
    }

    @Override
    public List<InventoryHold> findByIds(Collection<Long> holdIds) {
        return inventoryHoldJpaRepository.findAllById(holdIds).stream()
                .map(InventoryHoldJpaEntity::toDomain)
                .toList();
    }

    @Override
    public List<InventoryHold> findActiveByOwner(HoldOwner owner, long ownerId) {
        return inventoryHoldJpaRepository.findByOwnerAndOwnerIdAndStatus(owner, ownerId, HoldStatus.ACTIVE).stream()
                .map(InventoryHoldJpaEntity::toDomain)
                .toList();
    }

    @Override
    public boolean markReleased(long holdId) {
        return inventoryHoldJpaRepository.changeStatus(holdId, HoldStatus.ACTIVE, HoldStatus.RELEASED) == 1;
    }

    @Override
    public boolean markSold(long holdId) {
        return inventoryHoldJpaRepository.changeStatus(holdId, HoldStatus.ACTIVE, HoldStatus.SOLD) == 1;
    }

    @Override
    public boolean updateQuantity(long holdId, int quantity) {
        return inventoryHoldJpaRepository.updateQuantity(holdId, quantity, HoldStatus.ACTIVE) == 1;
    }

    @Override
    public int extendExpiry(HoldOwner owner, long ownerId, LocalDateTime expiresAt) {
        return inventoryHoldJpaRepository.extendExpiry(owner, ownerId, expiresAt, HoldStatus.ACTIVE);
    }

    @Override
    public int transfer(HoldOwner from, long fromId, HoldOwner to, long toId, LocalDateTime expiresAt) {
        return inventoryHoldJpaRepository.transfer(from, fromId, to, toId, expiresAt, HoldStatus.ACTIVE);
    }
}
