package kr.jemi.ticketgate.booking.infrastructure.out.gateway.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import kr.jemi.ticketgate.booking.domain.GatewayPayment;
import kr.jemi.ticketgate.booking.domain.GatewayPaymentStatus;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayPaymentResponse(String id,
                                     @JsonProperty("order_id") String orderId,
                                     long amount,
                                     String status,
                                     String method,
                                     @JsonProperty("error_code") String errorCode) {

    public GatewayPayment toPayment() {
        return new GatewayPayment(id, orderId, mapStatus(status), amount, method, errorCode);
    }

    private static GatewayPaymentStatus mapStatus(String status) {
        if (status == null) {
            return GatewayPaymentStatus.CREATED;
        }
        return switch (status) {
            case "authorized" -> GatewayPaymentStatus.AUTHORIZED;
            case "captured" -> GatewayPaymentStatus.CAPTURED;
            case "failed" -> GatewayPaymentStatus.FAILED;
            case "refunded" -> GatewayPaymentStatus.REFUNDED;
            default -> GatewayPaymentStatus.CREATED;
        };
    }
}
