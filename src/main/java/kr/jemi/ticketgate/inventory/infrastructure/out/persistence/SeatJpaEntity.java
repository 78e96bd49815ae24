package kr.jemi.ticketgate.inventory.infrastructure.out.persistence;

import jakarta.persistence.*;
import kr.jemi.ticketgate.inventory.domain.Seat;
import kr.jemi.ticketgate.inventory.domain.SeatStatus;

@Entity
@Table(name = "seats",
        uniqueConstraints = @UniqueConstraint(name = "uk_seat_label", columnNames = {"categoryId", "label"}),
        indexes = @Index(name = "idx_seat_hold", columnList = "holdId"))
public class SeatJpaEntity {

    @Id
    private Long id;

    @Column(nullable = false)
    private Long categoryId;

    @Column(nullable = false, length = 20)
    private String label;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SeatStatus status;

    private Long holdId;

    protected SeatJpaEntity() {}

    public static SeatJpaEntity fromDomain(Seat seat) {
        SeatJpaEntity entity = new SeatJpaEntity();
        entity.id = seat.id();
        entity.categoryId = seat.categoryId();
        entity.label = seat.label();
        entity.status = seat.status();
        entity.holdId = seat.holdId();
        return entity;
    }

    public Seat toDomain() {
        return new Seat(id, categoryId, label, status, holdId);
    }
}
