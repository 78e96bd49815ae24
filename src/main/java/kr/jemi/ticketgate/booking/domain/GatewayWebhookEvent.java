package kr.jemi.ticketgate.booking.domain;

public record GatewayWebhookEvent(String type, GatewayPayment payment) {

    public static final String PAYMENT_CAPTURED = "payment.captured";
    public static final String PAYMENT_FAILED = "payment.failed";
}
