package kr.jemi.ticketgate.booking.infrastructure.out.gateway.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * {"event": "payment.captured", "payload": {"payment": {"entity": {...}}}}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayWebhookPayload(String event, Payload payload) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Payload(PaymentWrapper payment) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PaymentWrapper(GatewayPaymentResponse entity) {
    }

    public GatewayPaymentResponse paymentEntity() {
        if (payload == null || payload.payment() == null) {
            return null;
        }
        return payload.payment().entity();
    }
}
