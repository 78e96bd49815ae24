package kr.jemi.ticketgate.booking.domain;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import kr.jemi.ticketgate.common.validation.SelfValidating;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * 결제 시도 한 건의 기록.
 * <p>
 * PENDING 에서 CONFIRMED, CANCELLED, FAILED 중 하나로 한 번만 전이한다.
 * CONFIRMED 와 결제 상태 SUCCESS 는 같은 전이에서 함께 설정된다.
 */
public class Booking implements SelfValidating {

    private final long id;
    @NotBlank
    private final String bookingNumber;
    private final long userId;
    private final long eventId;
    private final long cartId;
    @NotNull
    private BookingStatus status;
    @NotNull
    private PaymentStatus paymentStatus;
    @NotNull
    private final ContactInfo contact;
    @NotNull
    private final BigDecimal totalAmount;
    @NotNull
    private final BigDecimal discountAmount;
    @NotNull
    private final BigDecimal finalAmount;
    @NotBlank
    private final String currency;
    @NotEmpty
    private final List<BookingItem> items;
    @NotNull
    private final LocalDateTime pendingExpiresAt;
    private String transactionId;
    private String paymentId;
    private String paymentMethod;
    private String failureReason;
    @NotNull
    private final LocalDateTime createdAt;
    @NotNull
    private LocalDateTime updatedAt;
    private LocalDateTime confirmedAt;

    public Booking(long id, String bookingNumber, long userId, long eventId, long cartId,
                   BookingStatus status, PaymentStatus paymentStatus, ContactInfo contact,
                   BigDecimal totalAmount, BigDecimal discountAmount, BigDecimal finalAmount, String currency,
                   List<BookingItem> items, LocalDateTime pendingExpiresAt,
                   String transactionId, String paymentId, String paymentMethod, String failureReason,
                   LocalDateTime createdAt, LocalDateTime updatedAt, LocalDateTime confirmedAt) {
        this.id = id;
        this.bookingNumber = bookingNumber;
        this.userId = userId;
        this.eventId = eventId;
        this.cartId = cartId;
        this.status = status;
        this.paymentStatus = paymentStatus;
        this.contact = contact;
        this.totalAmount = totalAmount;
        this.discountAmount = discountAmount;
        this.finalAmount = finalAmount;
        this.currency = currency;
        this.items = items == null ? new ArrayList<>() : new ArrayList<>(items);
        this.pendingExpiresAt = pendingExpiresAt;
        this.transactionId = transactionId;
        this.paymentId = paymentId;
        this.paymentMethod = paymentMethod;
        this.failureReason = failureReason;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.confirmedAt = confirmedAt;
        validateSelf();
        if (status == BookingStatus.CONFIRMED && paymentStatus != PaymentStatus.SUCCESS) {
            throw new IllegalArgumentException("확정된 예매는 결제 성공 상태여야 합니다: " + bookingNumber);
        }
    }

    public static Booking create(long id, String bookingNumber, long userId, long eventId, long cartId,
                                 ContactInfo contact, String currency, List<BookingItem> items,
                                 LocalDateTime now, LocalDateTime pendingExpiresAt) {
        BigDecimal total = items.stream()
                .map(BookingItem::getUnitPrice)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return new Booking(id, bookingNumber, userId, eventId, cartId, BookingStatus.PENDING,
                PaymentStatus.PENDING, contact, total, BigDecimal.ZERO, total, currency, items,
                pendingExpiresAt, null, null, null, null, now, now, null);
    }

    public boolean isOwnedBy(long userId) {
        return this.userId == userId;
    }

    public boolean isPending() {
        return status == BookingStatus.PENDING;
    }

    public boolean isPendingExpired(LocalDateTime now) {
        return isPending() && !now.isBefore(pendingExpiresAt);
    }

    public boolean hasTransaction() {
        return transactionId != null;
    }

    public boolean isConfirmedBy(String transactionId) {
        return status == BookingStatus.CONFIRMED && transactionId != null && transactionId.equals(this.transactionId);
    }

    /**
     * 게이트웨이는 최소 화폐 단위 정수 금액을 쓴다.
     */
    public long amountInMinorUnits() {
        return finalAmount.movePointRight(2).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    public int ticketCount() {
        return items.size();
    }

    public void attachTransaction(String transactionId, LocalDateTime now) {
        requirePending();
        if (this.transactionId != null) {
            throw new IllegalStateException("이미 결제 거래가 열린 예매입니다: " + bookingNumber);
        }
        this.transactionId = transactionId;
        this.updatedAt = now;
    }

    public void confirm(String paymentId, String paymentMethod, Supplier<String> ticketNumbers, LocalDateTime now) {
        requirePending();
        this.status = BookingStatus.CONFIRMED;
        this.paymentStatus = PaymentStatus.SUCCESS;
        this.paymentId = paymentId;
        this.paymentMethod = paymentMethod;
        this.confirmedAt = now;
        this.updatedAt = now;
        items.forEach(item -> item.mintTicket(ticketNumbers.get()));
    }

    public void fail(String reason, String paymentId, LocalDateTime now) {
        requirePending();
        this.status = BookingStatus.FAILED;
        this.paymentStatus = PaymentStatus.FAILED;
        this.failureReason = reason;
        if (paymentId != null) {
            this.paymentId = paymentId;
        }
        this.updatedAt = now;
    }

    public void cancel(String reason, LocalDateTime now) {
        requirePending();
        this.status = BookingStatus.CANCELLED;
        this.paymentStatus = PaymentStatus.FAILED;
        this.failureReason = reason;
        this.updatedAt = now;
    }

    private void requirePending() {
        if (status != BookingStatus.PENDING) {
            throw new IllegalStateException("PENDING 상태의 예매만 전이할 수 있습니다. 현재: " + status);
        }
    }

    public long getId() {
        return id;
    }

    public String getBookingNumber() {
        return bookingNumber;
    }

    public long getUserId() {
        return userId;
    }

    public long getEventId() {
        return eventId;
    }

    public long getCartId() {
        return cartId;
    }

    public BookingStatus getStatus() {
        return status;
    }

    public PaymentStatus getPaymentStatus() {
        return paymentStatus;
    }

    public ContactInfo getContact() {
        return contact;
    }

    public BigDecimal getTotalAmount() {
        return totalAmount;
    }

    public BigDecimal getDiscountAmount() {
        return discountAmount;
    }

    public BigDecimal getFinalAmount() {
        return finalAmount;
    }

    public String getCurrency() {
        return currency;
    }

    public List<BookingItem> getItems() {
        return List.copyOf(items);
    }

    public LocalDateTime getPendingExpiresAt() {
        return pendingExpiresAt;
    }

    public String getTransactionId() {
        return transactionId;
    }

    public String getPaymentId() {
        return paymentId;
    }

    public String getPaymentMethod() {
        return paymentMethod;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }

    public LocalDateTime getConfirmedAt() {
        return confirmedAt;
    }
}
