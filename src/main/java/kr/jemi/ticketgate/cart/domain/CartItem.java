package kr.jemi.ticketgate.cart.domain;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import kr.jemi.ticketgate.common.validation.SelfValidating;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

public class CartItem implements SelfValidating {

    private final long id;
    private final long categoryId;
    @NotBlank
    private final String categoryName;
    @Min(1)
    private int quantity;
    @NotNull
    private final List<Long> seatIds;
    @NotNull
    @DecimalMin("0")
    private final BigDecimal unitPrice;
    private final long holdId;
    @NotNull
    private final LocalDateTime addedAt;

    public CartItem(long id, long categoryId, String categoryName, int quantity, List<Long> seatIds,
                    BigDecimal unitPrice, long holdId, LocalDateTime addedAt) {
        this.id = id;
        this.categoryId = categoryId;
        this.categoryName = categoryName;
        this.quantity = quantity;
        this.seatIds = seatIds == null ? List.of() : List.copyOf(seatIds);
        this.unitPrice = unitPrice;
        this.holdId = holdId;
        this.addedAt = addedAt;
        validateSelf();
    }

    void changeQuantity(int quantity) {
        if (isAssignedSeating()) {
            throw new IllegalStateException("지정석 항목은 수량을 바꿀 수 없습니다");
        }
        this.quantity = quantity;
        validateSelf();
    }

    public boolean isAssignedSeating() {
        return !seatIds.isEmpty();
    }

    public BigDecimal subtotal() {
        return unitPrice.multiply(BigDecimal.valueOf(quantity));
    }

    public long getId() {
        return id;
    }

    public long getCategoryId() {
        return categoryId;
    }

    public String getCategoryName() {
        return categoryName;
    }

    public int getQuantity() {
        return quantity;
    }

    public List<Long> getSeatIds() {
        return seatIds;
    }

    public BigDecimal getUnitPrice() {
        return unitPrice;
    }

    public long getHoldId() {
        return holdId;
    }

    public LocalDateTime getAddedAt() {
        return addedAt;
    }
}
