package kr.jemi.ticketgate.cart.domain;

public enum CartStatus {
    ACTIVE, CONVERTED, ABANDONED, EXPIRED
}
