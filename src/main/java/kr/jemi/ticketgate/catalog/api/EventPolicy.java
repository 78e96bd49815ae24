package kr.jemi.ticketgate.catalog.api;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * 예매 흐름이 참조하는 이벤트 운영 정책. 카탈로그 관리 기능은 이 모듈 밖에 있다.
 * Redis 캐시에 직렬화되어 저장된다.
 */
public record EventPolicy(
        long eventId,
        String slug,
        String title,
        boolean published,
        boolean queueEnabled,
        int queueBatchSize,
        int queueProcessingMinutes,
        int maxTicketsPerBooking,
        LocalDateTime bookingOpensAt,
        LocalDateTime bookingClosesAt
) implements Serializable {

    /**
     * 공개 상태이고 {@code opensAt <= now < closesAt} 일 때만 열려 있다. 비어 있는 경계는 그쪽으로 열린 것으로 본다.
     */
    public boolean isBookingOpen(LocalDateTime now) {
        if (!published) {
            return false;
        }
        if (bookingOpensAt != null && now.isBefore(bookingOpensAt)) {
            return false;
        }
        return bookingClosesAt == null || now.isBefore(bookingClosesAt);
    }
}
