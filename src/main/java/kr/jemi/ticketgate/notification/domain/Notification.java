package kr.jemi.ticketgate.notification.domain;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 사용자에게 밀어 넣는 알림. 전달은 보장하지 않으며 같은 내용은 각 모듈 조회 API 로 다시 얻을 수 있다.
 */
public record Notification(long userId, NotificationType type, Map<String, Object> data, LocalDateTime occurredAt) {

    public Notification {
        data = Map.copyOf(data);
    }
}
