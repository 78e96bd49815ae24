package kr.jemi.ticketgate.booking.infrastructure.out.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record GatewayOrderRequest(long amount, String currency, String receipt, Map<String, String> notes,
                                  @JsonProperty("payment_capture") int paymentCapture) {
}
