package kr.jemi.ticketgate.notification.domain;

public enum NotificationType {
    QUEUE_ADMITTED("queue-admitted"),
    CART_EXPIRED("cart-expired"),
    BOOKING_CONFIRMED("booking-confirmed"),
    BOOKING_RELEASED("booking-released");

    private final String eventName;

    NotificationType(String eventName) {
        this.eventName = eventName;
    }

    public String getEventName() {
        return eventName;
    }
}
