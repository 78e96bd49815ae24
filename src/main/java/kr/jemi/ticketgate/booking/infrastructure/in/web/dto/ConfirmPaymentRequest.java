package kr.jemi.ticketgate.booking.infrastructure.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import kr.jemi.ticketgate.booking.application.port.in.ConfirmPaymentCommand;

public record ConfirmPaymentRequest(
        @NotBlank(message = "거래 id 는 필수입니다") String transactionId,
        @NotBlank(message = "결제 id 는 필수입니다") String paymentId,
        @NotBlank(message = "서명은 필수입니다") String signature) {

    public ConfirmPaymentCommand toCommand(long userId, long bookingId) {
        return new ConfirmPaymentCommand(userId, bookingId, transactionId, paymentId, signature);
    }
}
