package kr.jemi.ticketgate.booking.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import kr.jemi.ticketgate.booking.application.port.in.HandlePaymentWebhookUseCase;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Payment Webhook", description = "결제 게이트웨이 서버 간 알림")
@RestController
public class PaymentWebhookController {

    private final HandlePaymentWebhookUseCase handlePaymentWebhookUseCase;

    public PaymentWebhookController(HandlePaymentWebhookUseCase handlePaymentWebhookUseCase) {
        this.handlePaymentWebhookUseCase = handlePaymentWebhookUseCase;
    }

    // 서명은 원문 바이트 기준이라 본문을 문자열 그대로 받는다
    @Operation(summary = "결제 웹훅", description = "payment.captured, payment.failed 를 처리합니다.")
    @PostMapping("/api/payments/webhook")
    public ResponseEntity<Void> receive(
            @RequestBody String rawBody,
            @RequestHeader(value = "X-Gateway-Signature", required = false) String signature) {
        handlePaymentWebhookUseCase.handle(rawBody, signature);
        return ResponseEntity.ok().build();
    }
}
