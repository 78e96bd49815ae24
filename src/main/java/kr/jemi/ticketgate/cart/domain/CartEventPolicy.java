package kr.jemi.ticketgate.cart.domain;

public record CartEventPolicy(long eventId, boolean queueEnabled, int maxTicketsPerBooking, boolean bookingOpen) {
}
