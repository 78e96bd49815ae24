package kr.jemi.ticketgate.booking.infrastructure.out.gateway.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayOrderResponse(String id, long amount, String currency, String status) {
}
