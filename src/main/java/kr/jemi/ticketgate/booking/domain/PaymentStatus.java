package kr.jemi.ticketgate.booking.domain;

public enum PaymentStatus {
    PENDING, SUCCESS, FAILED, REFUNDED
}
