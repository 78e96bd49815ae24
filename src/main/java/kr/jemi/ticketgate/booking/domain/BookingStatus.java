package kr.jemi.ticketgate.booking.domain;

public enum BookingStatus {
    PENDING, CONFIRMED, CANCELLED, REFUNDED, FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
