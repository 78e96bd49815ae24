@org.springframework.modulith.NamedInterface("event")
package kr.jemi.ticketgate.booking.event;
