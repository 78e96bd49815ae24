package kr.jemi.ticketgate.catalog.infrastructure.out.persistence;

import jakarta.persistence.*;
import kr.jemi.ticketgate.catalog.domain.Event;
import kr.jemi.ticketgate.catalog.domain.EventStatus;

import java.time.LocalDateTime;

@Entity
@Table(name = "events", uniqueConstraints = @UniqueConstraint(name = "uk_event_slug", columnNames = "slug"))
public class EventJpaEntity {

    @Id
    private Long id;

    @Column(nullable = false)
    private String slug;

    @Column(nullable = false)
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private EventStatus status;

    @Column(nullable = false)
    private boolean queueEnabled;

    @Column(nullable = false)
    private int queueBatchSize;

    @Column(nullable = false)
    private int queueProcessingMinutes;

    @Column(nullable = false)
    private int maxTicketsPerBooking;

    private LocalDateTime bookingOpensAt;

    private LocalDateTime bookingClosesAt;

    protected EventJpaEntity() {}

    public static EventJpaEntity fromDomain(Event event) {
        EventJpaEntity entity = new EventJpaEntity();
        entity.id = event.id();
        entity.slug = event.slug();
        entity.title = event.title();
        entity.status = event.status();
        entity.queueEnabled = event.queueEnabled();
        entity.queueBatchSize = event.queueBatchSize();
        entity.queueProcessingMinutes = event.queueProcessingMinutes();
        entity.maxTicketsPerBooking = event.maxTicketsPerBooking();
        entity.bookingOpensAt = event.bookingOpensAt();
        entity.bookingClosesAt = event.bookingClosesAt();
        return entity;
    }

    public Event toDomain() {
        return new Event(id, slug, title, status, queueEnabled, queueBatchSize, queueProcessingMinutes,
                maxTicketsPerBooking, bookingOpensAt, bookingClosesAt);
    }
}
