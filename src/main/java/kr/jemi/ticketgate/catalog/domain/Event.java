package kr.jemi.ticketgate.catalog.domain;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import kr.jemi.ticketgate.common.validation.SelfValidating;

import java.time.LocalDateTime;

public record Event(
        long id,
        @NotBlank String slug,
        @NotBlank String title,
        @NotNull EventStatus status,
        boolean queueEnabled,
        @Min(1) int queueBatchSize,
        @Min(1) int queueProcessingMinutes,
        @Min(1) int maxTicketsPerBooking,
        LocalDateTime bookingOpensAt,
        LocalDateTime bookingClosesAt
) implements SelfValidating {

    public static final int DEFAULT_MAX_TICKETS_PER_BOOKING = 10;

    public Event(long id, String slug, String title, EventStatus status, boolean queueEnabled,
                 int queueBatchSize, int queueProcessingMinutes, int maxTicketsPerBooking,
                 LocalDateTime bookingOpensAt, LocalDateTime bookingClosesAt) {
        this.id = id;
        this.slug = slug;
        this.title = title;
        this.status = status;
        this.queueEnabled = queueEnabled;
        this.queueBatchSize = queueBatchSize;
        this.queueProcessingMinutes = queueProcessingMinutes;
        this.maxTicketsPerBooking = maxTicketsPerBooking;
        this.bookingOpensAt = bookingOpensAt;
        this.bookingClosesAt = bookingClosesAt;
        validateSelf();
        if (bookingOpensAt != null && bookingClosesAt != null && !bookingOpensAt.isBefore(bookingClosesAt)) {
            throw new IllegalArgumentException("예매 시작 시각은 종료 시각보다 앞서야 합니다");
        }
    }

    public boolean isPublished() {
        return status == EventStatus.PUBLISHED;
    }
}
