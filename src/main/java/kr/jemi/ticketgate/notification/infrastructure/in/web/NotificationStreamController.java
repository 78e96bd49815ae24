package kr.jemi.ticketgate.notification.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import kr.jemi.ticketgate.notification.application.port.in.SubscribeNotificationUseCase;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@Tag(name = "Notification", description = "대기열 입장, 장바구니 만료, 예매 결과 실시간 알림")
@RestController
public class NotificationStreamController {

    private final SubscribeNotificationUseCase subscribeNotificationUseCase;

    public NotificationStreamController(SubscribeNotificationUseCase subscribeNotificationUseCase) {
        this.subscribeNotificationUseCase = subscribeNotificationUseCase;
    }

    @Operation(summary = "알림 구독", description = "SSE 스트림입니다. 놓친 알림은 각 조회 API 로 다시 확인합니다.")
    @GetMapping(value = "/api/notifications/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@Parameter(description = "사용자 ID") @RequestHeader("X-User-Id") long userId) {
        return subscribeNotificationUseCase.subscribe(userId);
    }
}
