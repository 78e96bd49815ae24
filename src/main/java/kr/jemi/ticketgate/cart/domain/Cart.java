package kr.jemi.ticketgate.cart.domain;

import jakarta.validation.constraints.NotNull;
import kr.jemi.ticketgate.common.validation.SelfValidating;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 한 사용자의 한 이벤트 장바구니. 항목 수량의 합은 재고 원장에 이 장바구니 이름으로 잡힌 선점과 항상 같다.
 */
public class Cart implements SelfValidating {

    private final long id;
    private final long userId;
    private final long eventId;
    @NotNull
    private CartStatus status;
    @NotNull
    private final List<CartItem> items;
    @NotNull
    private LocalDateTime expiresAt;
    private Long bookingId;
    @NotNull
    private final LocalDateTime createdAt;
    @NotNull
    private LocalDateTime updatedAt;

    public Cart(long id, long userId, long eventId, CartStatus status, List<CartItem> items,
                LocalDateTime expiresAt, Long bookingId, LocalDateTime createdAt, LocalDateTime updatedAt) {
        this.id = id;
        this.userId = userId;
        this.eventId = eventId;
        this.status = status;
        this.items = items == null ? new ArrayList<>() : new ArrayList<>(items);
        this.expiresAt = expiresAt;
        this.bookingId = bookingId;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        validateSelf();
    }

    public static Cart create(long id, long userId, long eventId, LocalDateTime now, LocalDateTime expiresAt) {
        return new Cart(id, userId, eventId, CartStatus.ACTIVE, List.of(), expiresAt, null, now, now);
    }

    /**
     * 스윕 전이라도 만료 시각이 지났으면 만료다. 만료 시각과 같은 순간도 만료로 본다.
     */
    public boolean isExpired(LocalDateTime now) {
        return status == CartStatus.ACTIVE && !now.isBefore(expiresAt);
    }

    public CartStatus effectiveStatus(LocalDateTime now) {
        return isExpired(now) ? CartStatus.EXPIRED : status;
    }

    public boolean isOwnedBy(long userId) {
        return this.userId == userId;
    }

    /**
     * 매 변경마다 만료를 연장하되, 장바구니 생성 시점부터의 최대 세션 길이를 넘지 않는다.
     */
    public LocalDateTime nextExpiry(LocalDateTime now, int holdMinutes, int maxSessionMinutes) {
        LocalDateTime rolling = now.plusMinutes(holdMinutes);
        LocalDateTime cap = createdAt.plusMinutes(maxSessionMinutes);
        return rolling.isBefore(cap) ? rolling : cap;
    }

    public void extend(LocalDateTime expiresAt, LocalDateTime now) {
        requireActive();
        this.expiresAt = expiresAt;
        this.updatedAt = now;
    }

    public void addItem(CartItem item, int maxTickets, LocalDateTime now) {
        requireActive();
        if (hasCategory(item.getCategoryId())) {
            throw new IllegalStateException("이미 담긴 좌석 등급입니다: " + item.getCategoryId());
        }
        if (totalQuantity() + item.getQuantity() > maxTickets) {
            throw new IllegalStateException("최대 예매 매수 초과: " + maxTickets);
        }
        items.add(item);
        this.updatedAt = now;
    }

    public void changeQuantity(long itemId, int quantity, int maxTickets, LocalDateTime now) {
        requireActive();
        CartItem item = findItem(itemId)
                .orElseThrow(() -> new IllegalArgumentException("장바구니 항목이 없습니다: " + itemId));
        if (totalQuantity() - item.getQuantity() + quantity > maxTickets) {
            throw new IllegalStateException("최대 예매 매수 초과: " + maxTickets);
        }
        item.changeQuantity(quantity);
        this.updatedAt = now;
    }

    public CartItem removeItem(long itemId, LocalDateTime now) {
        requireActive();
        CartItem item = findItem(itemId)
                .orElseThrow(() -> new IllegalArgumentException("장바구니 항목이 없습니다: " + itemId));
        items.remove(item);
        this.updatedAt = now;
        return item;
    }

    public void expire(LocalDateTime now) {
        requireActive();
        this.status = CartStatus.EXPIRED;
        this.updatedAt = now;
    }

    public void abandon(LocalDateTime now) {
        requireActive();
        this.status = CartStatus.ABANDONED;
        this.updatedAt = now;
    }

    public void convert(long bookingId, LocalDateTime now) {
        requireActive();
        if (isExpired(now)) {
            throw new IllegalStateException("만료된 장바구니는 전환할 수 없습니다: " + id);
        }
        this.status = CartStatus.CONVERTED;
        this.bookingId = bookingId;
        this.updatedAt = now;
    }

    public boolean hasCategory(long categoryId) {
        return items.stream().anyMatch(item -> item.getCategoryId() == categoryId);
    }

    public Optional<CartItem> findItem(long itemId) {
        return items.stream().filter(item -> item.getId() == itemId).findFirst();
    }

    public int totalQuantity() {
        return items.stream().mapToInt(CartItem::getQuantity).sum();
    }

    public BigDecimal totalAmount() {
        return items.stream().map(CartItem::subtotal).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private void requireActive() {
        if (status != CartStatus.ACTIVE) {
            throw new IllegalStateException("ACTIVE 상태의 장바구니만 변경할 수 있습니다. 현재: " + status);
        }
    }

    public long getId() {
        return id;
    }

    public long getUserId() {
        return userId;
    }

    public long getEventId() {
        return eventId;
    }

    public CartStatus getStatus() {
        return status;
    }

    public List<CartItem> getItems() {
        return List.copyOf(items);
    }

    public LocalDateTime getExpiresAt() {
        return expiresAt;
    }

    public Long getBookingId() {
        return bookingId;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }
}
