package kr.jemi.ticketgate.booking.domain;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import kr.jemi.ticketgate.common.validation.SelfValidating;

import java.math.BigDecimal;

/**
 * 티켓 한 장에 해당하는 예매 항목. 티켓 번호는 결제 확정 시에만 발급된다.
 */
public class BookingItem implements SelfValidating {

    private final long id;
    private final long categoryId;
    @NotBlank
    private final String categoryName;
    private final Long seatId;
    @NotNull
    @DecimalMin("0")
    private final BigDecimal unitPrice;
    private String ticketNumber;

    public BookingItem(long id, long categoryId, String categoryName, Long seatId, BigDecimal unitPrice,
                       String ticketNumber) {
        this.id = id;
        this.categoryId = categoryId;
        this.categoryName = categoryName;
        this.seatId = seatId;
        this.unitPrice = unitPrice;
        this.ticketNumber = ticketNumber;
        validateSelf();
    }

    void mintTicket(String ticketNumber) {
        if (this.ticketNumber != null) {
            throw new IllegalStateException("이미 발급된 티켓입니다: " + this.ticketNumber);
        }
        this.ticketNumber = ticketNumber;
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

    public Long getSeatId() {
        return seatId;
    }

    public BigDecimal getUnitPrice() {
        return unitPrice;
    }

    public String getTicketNumber() {
        return ticketNumber;
    }
}
