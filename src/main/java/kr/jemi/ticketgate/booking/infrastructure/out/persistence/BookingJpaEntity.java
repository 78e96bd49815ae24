package kr.jemi.ticketgate.booking.infrastructure.out.persistence;

import jakarta.persistence.*;
import kr.jemi.ticketgate.booking.domain.Booking;
import kr.jemi.ticketgate.booking.domain.BookingItem;
import kr.jemi.ticketgate.booking.domain.BookingStatus;
import kr.jemi.ticketgate.booking.domain.ContactInfo;
import kr.jemi.ticketgate.booking.domain.PaymentStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@Entity
@Table(name = "bookings",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_booking_number", columnNames = "bookingNumber"),
                @UniqueConstraint(name = "uk_booking_transaction", columnNames = "transactionId")
        },
        indexes = {
                @Index(name = "idx_booking_user_created", columnList = "userId, createdAt"),
                @Index(name = "idx_booking_status_expires", columnList = "status, pendingExpiresAt")
        })
public class BookingJpaEntity {

    @Id
    private Long id;

    @Column(nullable = false, length = 40)
    private String bookingNumber;

    @Column(nullable = false)
    private Long userId;

    @Column(nullable = false)
    private Long eventId;

    @Column(nullable = false)
    private Long cartId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BookingStatus status;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    @Column(nullable = false, length = 100)
    private String contactName;

    @Column(nullable = false, length = 200)
    private String contactEmail;

    @Column(length = 30)
    private String contactPhone;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal totalAmount;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal discountAmount;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal finalAmount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(nullable = false)
    private LocalDateTime pendingExpiresAt;

    @Column(length = 100)
    private String transactionId;

    @Column(length = 100)
    private String paymentId;

    @Column(length = 30)
    private String paymentMethod;

    @Column(length = 100)
    private String failureReason;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    private LocalDateTime confirmedAt;

    // 거래 개설 선점 시각. 조건부 update 로만 바뀐다
    @Column(insertable = false, updatable = false)
    private LocalDateTime transactionOpeningAt;

    protected BookingJpaEntity() {}

    public static BookingJpaEntity fromDomain(Booking booking) {
        BookingJpaEntity entity = new BookingJpaEntity();
        entity.id = booking.getId();
        entity.bookingNumber = booking.getBookingNumber();
        entity.userId = booking.getUserId();
        entity.eventId = booking.getEventId();
        entity.cartId = booking.getCartId();
        entity.status = booking.getStatus();
        entity.paymentStatus = booking.getPaymentStatus();
        entity.contactName = booking.getContact().name();
        entity.contactEmail = booking.getContact().email();
        entity.contactPhone = booking.getContact().phone();
        entity.totalAmount = booking.getTotalAmount();
        entity.discountAmount = booking.getDiscountAmount();
        entity.finalAmount = booking.getFinalAmount();
        entity.currency = booking.getCurrency();
        entity.pendingExpiresAt = booking.getPendingExpiresAt();
        entity.transactionId = booking.getTransactionId();
        entity.paymentId = booking.getPaymentId();
        entity.paymentMethod = booking.getPaymentMethod();
        entity.failureReason = booking.getFailureReason();
        entity.createdAt = booking.getCreatedAt();
        entity.updatedAt = booking.getUpdatedAt();
        entity.confirmedAt = booking.getConfirmedAt();
        return entity;
    }

    public Booking toDomain(List<BookingItem> items) {
        return new Booking(id, bookingNumber, userId, eventId, cartId, status, paymentStatus,
                new ContactInfo(contactName, contactEmail, contactPhone),
                totalAmount, discountAmount, finalAmount, currency, items, pendingExpiresAt,
                transactionId, paymentId, paymentMethod, failureReason, createdAt, updatedAt, confirmedAt);
    }

    public Long getId() {
        return id;
    }
}
