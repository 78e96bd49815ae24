package kr.jemi.ticketgate.inventory.domain;

public enum HoldOwner {
    CART, BOOKING
}
