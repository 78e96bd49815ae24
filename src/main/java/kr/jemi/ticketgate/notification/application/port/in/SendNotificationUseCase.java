package kr.jemi.ticketgate.notification.application.port.in;

import kr.jemi.ticketgate.notification.domain.Notification;

public interface SendNotificationUseCase {

    void send(Notification notification);
}
