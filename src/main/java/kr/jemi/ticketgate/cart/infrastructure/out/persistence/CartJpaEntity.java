package kr.jemi.ticketgate.cart.infrastructure.out.persistence;

import jakarta.persistence.*;
import kr.jemi.ticketgate.cart.domain.Cart;
import kr.jemi.ticketgate.cart.domain.CartItem;
import kr.jemi.ticketgate.cart.domain.CartStatus;

import java.time.LocalDateTime;
import java.util.List;

@Entity
@Table(name = "carts",
        uniqueConstraints = @UniqueConstraint(name = "uk_cart_active",
                columnNames = {"userId", "eventId", "active"}),
        indexes = @Index(name = "idx_cart_status_expires", columnList = "status, expiresAt"))
public class CartJpaEntity {

    @Id
    private Long id;

    @Column(nullable = false)
    private Long userId;

    @Column(nullable = false)
    private Long eventId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CartStatus status;

    // ACTIVE 이면 1, 그 외 NULL
    private Integer active;

    @Column(nullable = false)
    private LocalDateTime expiresAt;

    private Long bookingId;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    protected CartJpaEntity() {}

    public static CartJpaEntity fromDomain(Cart cart) {
        CartJpaEntity entity = new CartJpaEntity();
        entity.id = cart.getId();
        entity.userId = cart.getUserId();
        entity.eventId = cart.getEventId();
        entity.status = cart.getStatus();
        entity.active = cart.getStatus() == CartStatus.ACTIVE ? 1 : null;
        entity.expiresAt = cart.getExpiresAt();
        entity.bookingId = cart.getBookingId();
        entity.createdAt = cart.getCreatedAt();
        entity.updatedAt = cart.getUpdatedAt();
        return entity;
    }

    public Cart toDomain(List<CartItem> items) {
        return new Cart(id, userId, eventId, status, items, expiresAt, bookingId, createdAt, updatedAt);
    }

    public Long getId() {
        return id;
    }
}
