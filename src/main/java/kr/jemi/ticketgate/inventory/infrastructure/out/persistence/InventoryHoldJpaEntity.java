package kr.jemi.ticketgate.inventory.infrastructure.out.persistence;

import jakarta.persistence.*;
import kr.jemi.ticketgate.inventory.domain.HoldOwner;
import kr.jemi.ticketgate.inventory.domain.HoldStatus;
import kr.jemi.ticketgate.inventory.domain.InventoryHold;

import java.time.LocalDateTime;
import java.util.List;

@Entity
@Table(name = "inventory_holds",
        indexes = @Index(name = "idx_hold_owner_status", columnList = "owner, ownerId, status"))
public class InventoryHoldJpaEntity {

    @Id
    private Long id;

    @Column(nullable = false)
    private Long categoryId;

    @Column(nullable = false)
    private int quantity;

    @Convert(converter = SeatIdsConverter.class)
    @Column(length = 1000)
    private List<Long> seatIds;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private HoldOwner owner;

    @Column(nullable = false)
    private Long ownerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private HoldStatus status;

    @Column(nullable = false)
    private LocalDateTime expiresAt;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    protected InventoryHoldJpaEntity() {}

    public static InventoryHoldJpaEntity fromDomain(InventoryHold hold) {
        InventoryHoldJpaEntity entity = new InventoryHoldJpaEntity();
        entity.id = hold.getId();
        entity.categoryId = hold.getCategoryId();
        entity.quantity = hold.getQuantity();
        entity.seatIds = hold.getSeatIds();
        entity.owner = hold.getOwner();
        entity.ownerId = hold.getOwnerId();
        entity.status = hold.getStatus();
        entity.expiresAt = hold.getExpiresAt();
        entity.createdAt = hold.getCreatedAt();
        return entity;
    }

    public InventoryHold toDomain() {
        return new InventoryHold(id, categoryId, quantity, seatIds, owner, ownerId, status, expiresAt, createdAt);
    }
}
