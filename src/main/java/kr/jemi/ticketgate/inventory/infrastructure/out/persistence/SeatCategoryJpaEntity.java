package kr.jemi.ticketgate.inventory.infrastructure.out.persistence;

import jakarta.persistence.*;
import kr.jemi.ticketgate.inventory.domain.SeatCategory;

import java.math.BigDecimal;

@Entity
@Table(name = "seat_categories", indexes = @Index(name = "idx_seat_category_event", columnList = "eventId"))
public class SeatCategoryJpaEntity {

    @Id
    private Long id;

    @Column(nullable = false)
    private Long eventId;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Column(nullable = false)
    private int totalSeats;

    @Column(nullable = false)
    private int heldSeats;

    @Column(nullable = false)
    private int soldSeats;

    protected SeatCategoryJpaEntity() {}

    public static SeatCategoryJpaEntity fromDomain(SeatCategory category) {
        SeatCategoryJpaEntity entity = new SeatCategoryJpaEntity();
        entity.id = category.id();
        entity.eventId = category.eventId();
        entity.name = category.name();
        entity.price = category.price();
        entity.totalSeats = category.total();
        entity.heldSeats = category.held();
        entity.soldSeats = category.sold();
        return entity;
    }

    public SeatCategory toDomain() {
        return new SeatCategory(id, eventId, name, price, totalSeats, heldSeats, soldSeats);
    }
}
