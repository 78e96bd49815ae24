package kr.jemi.ticketgate.booking.domain;

public enum GatewayPaymentStatus {
    CREATED, AUTHORIZED, CAPTURED, FAILED, REFUNDED;

    public boolean isPaid() {
        return this == AUTHORIZED || this == CAPTURED;
    }
}
