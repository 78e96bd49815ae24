package kr.jemi.ticketgate.booking.infrastructure.out.gateway.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayPaymentListResponse(int count, List<GatewayPaymentResponse> items) {
}
