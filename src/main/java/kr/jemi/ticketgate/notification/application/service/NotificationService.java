package kr.jemi.ticketgate.notification.application.service;

import kr.jemi.ticketgate.notification.application.port.in.KeepAliveUseCase;
import kr.jemi.ticketgate.notification.application.port.in.SendNotificationUseCase;
import kr.jemi.ticketgate.notification.application.port.in.SubscribeNotificationUseCase;
import kr.jemi.ticketgate.notification.application.port.out.NotificationChannelPort;
import kr.jemi.ticketgate.notification.domain.Notification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@Service
public class NotificationService implements SubscribeNotificationUseCase, SendNotificationUseCase, KeepAliveUseCase {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final NotificationChannelPort notificationChannelPort;

    public NotificationService(NotificationChannelPort notificationChannelPort) {
        this.notificationChannelPort = notificationChannelPort;
    }

    @Override
    public SseEmitter subscribe(long userId) {
        return notificationChannelPort.open(userId);
    }

    @Override
    public void send(Notification notification) {
        int delivered = notificationChannelPort.push(notification);
        log.debug("알림 전송: userId={}, type={}, delivered={}",
                notification.userId(), notification.type(), delivered);
    }

    @Override
    public void pingAll() {
        notificationChannelPort.pingAll();
    }
}
