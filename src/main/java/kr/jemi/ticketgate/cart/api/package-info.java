@org.springframework.modulith.NamedInterface("api")
package kr.jemi.ticketgate.cart.api;
