package kr.jemi.ticketgate.notification.infrastructure.in.event;

import kr.jemi.ticketgate.booking.event.BookingConfirmedEvent;
import kr.jemi.ticketgate.booking.event.BookingReleasedEvent;
import kr.jemi.ticketgate.cart.event.CartExpiredEvent;
import kr.jemi.ticketgate.notification.application.port.in.SendNotificationUseCase;
import kr.jemi.ticketgate.notification.domain.Notification;
import kr.jemi.ticketgate.notification.domain.NotificationType;
import kr.jemi.ticketgate.queue.event.QueueAdmittedEvent;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;

@Component
public class NotificationEventListener {

    private final SendNotificationUseCase sendNotificationUseCase;
    private final Clock clock;

    public NotificationEventListener(SendNotificationUseCase sendNotificationUseCase, Clock clock) {
        this.sendNotificationUseCase = sendNotificationUseCase;
        this.clock = clock;
    }

    @Async
    @TransactionalEventListener
    public void on(QueueAdmittedEvent event) {
        LocalDateTime now = LocalDateTime.now(clock);
        for (Long userId : event.userIds()) {
            sendNotificationUseCase.send(new Notification(userId, NotificationType.QUEUE_ADMITTED,
                    Map.of("eventId", event.eventId(), "processingDeadline", event.processingDeadline().toString()),
                    now));
        }
    }

    @Async
    @TransactionalEventListener
    public void on(CartExpiredEvent event) {
        sendNotificationUseCase.send(new Notification(event.userId(), NotificationType.CART_EXPIRED,
                Map.of("cartId", event.cartId(), "eventId", event.eventId()),
                LocalDateTime.now(clock)));
    }

    @Async
    @TransactionalEventListener
    public void on(BookingConfirmedEvent event) {
        sendNotificationUseCase.send(new Notification(event.userId(), NotificationType.BOOKING_CONFIRMED,
                Map.of("bookingId", event.bookingId(), "bookingNumber", event.bookingNumber(),
                        "ticketCount", event.ticketCount()),
                LocalDateTime.now(clock)));
    }

    @Async
    @TransactionalEventListener
    public void on(BookingReleasedEvent event) {
        sendNotificationUseCase.send(new Notification(event.userId(), NotificationType.BOOKING_RELEASED,
                Map.of("bookingId", event.bookingId(), "bookingNumber", event.bookingNumber(),
                        "status", event.status(), "reason", event.reason()),
                LocalDateTime.now(clock)));
    }
}
