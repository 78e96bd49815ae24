package kr.jemi.ticketgate.cart.infrastructure.out.persistence;

import jakarta.persistence.*;
import kr.jemi.ticketgate.cart.domain.CartItem;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

@Entity
@Table(name = "cart_items", indexes = @Index(name = "idx_cart_item_cart", columnList = "cartId"))
public class CartItemJpaEntity {

    @Id
    private Long id;

    @Column(nullable = false)
    private Long cartId;

    @Column(nullable = false)
    private Long categoryId;

    @Column(nullable = false, length = 100)
    private String categoryName;

    @Column(nullable = false)
    private Integer quantity;

    // 지정석 id 를 쉼표로 이어 저장, 자유석이면 빈 문자열
    @Column(nullable = false, length = 1000)
    private String seatIds;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal unitPrice;

    @Column(nullable = false)
    private Long holdId;

    @Column(nullable = false)
    private LocalDateTime addedAt;

    protected CartItemJpaEntity() {}

    public static CartItemJpaEntity fromDomain(long cartId, CartItem item) {
        CartItemJpaEntity entity = new CartItemJpaEntity();
        entity.id = item.getId();
        entity.cartId = cartId;
        entity.categoryId = item.getCategoryId();
        entity.categoryName = item.getCategoryName();
        entity.quantity = item.getQuantity();
        entity.seatIds = item.getSeatIds().stream().map(String::valueOf).collect(Collectors.joining(","));
        entity.unitPrice = item.getUnitPrice();
        entity.holdId = item.getHoldId();
        entity.addedAt = item.getAddedAt();
        return entity;
    }

    public CartItem toDomain() {
        List<Long> seats = seatIds.isBlank()
                ? List.of()
                : Arrays.stream(seatIds.split(",")).map(Long::valueOf).toList();
        return new CartItem(id, categoryId, categoryName, quantity, seats, unitPrice, holdId, addedAt);
    }

    public Long getId() {
        return id;
    }

    public Long getCartId() {
        return cartId;
    }
}
