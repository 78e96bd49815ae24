package kr.jemi.ticketgate.inventory.domain;

public enum HoldStatus {
    ACTIVE, RELEASED, SOLD
}
