package kr.jemi.ticketgate.inventory.domain;

public enum SeatStatus {
    AVAILABLE, HELD, SOLD
}
