package kr.jemi.ticketgate.booking.application.port.in;

public interface HandlePaymentWebhookUseCase {

    void handle(String rawBody, String signature);
}
