package kr.jemi.ticketgate.notification.application.port.out;

import kr.jemi.ticketgate.notification.domain.Notification;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

public interface NotificationChannelPort {

    SseEmitter open(long userId);

    /**
     * @return 전달에 성공한 연결 수
     */
    int push(Notification notification);

    void pingAll();
}
