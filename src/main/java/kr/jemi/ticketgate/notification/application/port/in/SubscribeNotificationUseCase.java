package kr.jemi.ticketgate.notification.application.port.in;

import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

public interface SubscribeNotificationUseCase {

    SseEmitter subscribe(long userId);
}
