package kr.jemi.ticketgate.booking.infrastructure.out.persistence;

import jakarta.persistence.*;
import kr.jemi.ticketgate.booking.domain.BookingItem;

import java.math.BigDecimal;

@Entity
@Table(name = "booking_items",
        uniqueConstraints = @UniqueConstraint(name = "uk_booking_item_ticket", columnNames = "ticketNumber"),
        indexes = @Index(name = "idx_booking_item_booking", columnList = "bookingId"))
public class BookingItemJpaEntity {

    @Id
    private Long id;

    @Column(nullable = false)
    private Long bookingId;

    @Column(nullable = false)
    private Long categoryId;

    @Column(nullable = false, length = 100)
    private String categoryName;

    private Long seatId;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal unitPrice;

    @Column(length = 40)
    private String ticketNumber;

    protected BookingItemJpaEntity() {}

    public static BookingItemJpaEntity fromDomain(long bookingId, BookingItem item) {
        BookingItemJpaEntity entity = new BookingItemJpaEntity();
        entity.id = item.getId();
        entity.bookingId = bookingId;
        entity.categoryId = item.getCategoryId();
        entity.categoryName = item.getCategoryName();
        entity.seatId = item.getSeatId();
        entity.unitPrice = item.getUnitPrice();
        entity.ticketNumber = item.getTicketNumber();
        return entity;
    }

    public BookingItem toDomain() {
        return new BookingItem(id, categoryId, categoryName, seatId, unitPrice, ticketNumber);
    }

    public Long getBookingId() {
        return bookingId;
    }
}
