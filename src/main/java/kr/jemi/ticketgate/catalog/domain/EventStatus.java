package kr.jemi.ticketgate.catalog.domain;

public enum EventStatus {
    DRAFT, PUBLISHED, CANCELLED, COMPLETED
}
