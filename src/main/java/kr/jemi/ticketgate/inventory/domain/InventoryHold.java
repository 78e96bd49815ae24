package kr.jemi.ticketgate.inventory.domain;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import kr.jemi.ticketgate.common.validation.SelfValidating;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 장바구니 또는 예매에 묶인 재고 선점 기록.
 * 상태 전이(ACTIVE에서 RELEASED/SOLD)는 저장소의 조건부 갱신으로만 일어나며, 카운터는 전이가 실제로 일어났을 때만 움직인다.
 */
public class InventoryHold implements SelfValidating {

    private final long id;
    private final long categoryId;
    @Min(1)
    private final int quantity;
    @NotNull
    private final List<Long> seatIds;
    @NotNull
    private final HoldOwner owner;
    private final long ownerId;
    @NotNull
    private final HoldStatus status;
    @NotNull
    private final LocalDateTime expiresAt;
    @NotNull
    private final LocalDateTime createdAt;

    public InventoryHold(long id, long categoryId, int quantity, List<Long> seatIds, HoldOwner owner,
                         long ownerId, HoldStatus status, LocalDateTime expiresAt, LocalDateTime createdAt) {
        this.id = id;
        this.categoryId = categoryId;
        this.quantity = quantity;
        this.seatIds = seatIds == null ? List.of() : List.copyOf(seatIds);
        this.owner = owner;
        this.ownerId = ownerId;
        this.status = status;
        this.expiresAt = expiresAt;
        this.createdAt = createdAt;
        validateSelf();
        if (!this.seatIds.isEmpty() && this.seatIds.size() != quantity) {
            throw new IllegalArgumentException("지정석 선점은 좌석 수와 수량이 같아야 합니다");
        }
    }

    public static InventoryHold forCart(long id, long cartId, long categoryId, int quantity, List<Long> seatIds,
                                        LocalDateTime expiresAt, LocalDateTime now) {
        return new InventoryHold(id, categoryId, quantity, seatIds, HoldOwner.CART, cartId,
                HoldStatus.ACTIVE, expiresAt, now);
    }

    public boolean isActive() {
        return status == HoldStatus.ACTIVE;
    }

    /**
     * 만료 시각과 같은 순간부터 만료로 본다.
     */
    public boolean isExpired(LocalDateTime now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isAssignedSeating() {
        return !seatIds.isEmpty();
    }

    public long getId() {
        return id;
    }

    public long getCategoryId() {
        return categoryId;
    }

    public int getQuantity() {
        return quantity;
    }

    public List<Long> getSeatIds() {
        return seatIds;
    }

    public HoldOwner getOwner() {
        return owner;
    }

    public long getOwnerId() {
        return ownerId;
    }

    public HoldStatus getStatus() {
        return status;
    }

    public LocalDateTime getExpiresAt() {
        return expiresAt;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }
}
