package kr.jemi.ticketgate.booking.application.service;

import kr.jemi.ticketgate.booking.application.port.out.BookingPort;
import kr.jemi.ticketgate.booking.application.port.out.PaymentGatewayPort;
import kr.jemi.ticketgate.booking.domain.Booking;
import kr.jemi.ticketgate.booking.domain.BookingItem;
import kr.jemi.ticketgate.booking.domain.ContactInfo;
import kr.jemi.ticketgate.booking.domain.GatewayPayment;
import kr.jemi.ticketgate.booking.domain.GatewayPaymentStatus;
import kr.jemi.ticketgate.booking.domain.GatewayWebhookEvent;
import kr.jemi.ticketgate.common.exception.BusinessException;
import kr.jemi.ticketgate.common.exception.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.BDDMockito.*;

@ExtendWith(MockitoExtension.class)
class PaymentWebhookServiceTest {

    private static final ZoneId ZONE = ZoneId.of("Asia/Seoul");
    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 1, 10, 0);
    private static final String BODY = "{\"event\":\"payment.captured\"}";

    @Mock
    private BookingPort bookingPort;

    @Mock
    private BookingWriter bookingWriter;

    @Mock
    private PaymentGatewayPort paymentGatewayPort;

    private final PaymentSignatureVerifier signatureVerifier = new PaymentSignatureVerifier("key", "hook-secret");

    private PaymentWebhookService webhookService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.atZone(ZONE).toInstant(), ZONE);
        webhookService = new PaymentWebhookService(bookingPort, bookingWriter, paymentGatewayPort,
                signatureVerifier, clock);
    }

    private static Booking pending() {
        Booking booking = Booking.create(99L, "BK-20260301-0001", 100L, 10L, 7L,
                new ContactInfo("홍길동", "hong@example.com", null), "INR",
                List.of(new BookingItem(1L, 3L, "R석", null, new BigDecimal("1500"), null)),
                NOW.minusMinutes(5), NOW.plusMinutes(10));
        booking.attachTransaction("order_1", NOW.minusMinutes(4));
        return booking;
    }

    private String signature() {
        return signatureVerifier.sign("hook-secret", BODY);
    }

    @Test
    @DisplayName("서명이 틀리면 INVALID_WEBHOOK_SIGNATURE 이고 본문을 해석하지 않는다")
    void shouldRejectBadSignature() {
        assertThatThrownBy(() -> webhookService.handle(BODY, "forged"))
                .isInstanceOfSatisfying(BusinessException.class, e ->
                        assertThat(e.getErrorCode()).isEqualTo(ErrorCode.INVALID_WEBHOOK_SIGNATURE));
        then(paymentGatewayPort).shouldHaveNoInteractions();
    }

    @Test
    @DisplayName("결제 완료 웹훅은 금액이 맞으면 예매를 확정한다")
    void shouldConfirmOnCaptured() {
        // given
        given(paymentGatewayPort.parseWebhook(BODY)).willReturn(new GatewayWebhookEvent(
                GatewayWebhookEvent.PAYMENT_CAPTURED,
                new GatewayPayment("pay_1", "order_1", GatewayPaymentStatus.CAPTURED, 150000L, "card", null)));
        given(bookingPort.findByTransactionId("order_1")).willReturn(Optional.of(pending()));

        // when
        webhookService.handle(BODY, signature());

        // then
        then(bookingWriter).should().confirm(99L, "order_1", "pay_1", "card", NOW);
    }

    @Test
    @DisplayName("결제 완료 웹훅의 금액이 다르면 실패 처리한다")
    void shouldFailOnAmountMismatch() {
        // given
        given(paymentGatewayPort.parseWebhook(BODY)).willReturn(new GatewayWebhookEvent(
                GatewayWebhookEvent.PAYMENT_CAPTURED,
                new GatewayPayment("pay_1", "order_1", GatewayPaymentStatus.CAPTURED, 1L, "card", null)));
        given(bookingPort.findByTransactionId("order_1")).willReturn(Optional.of(pending()));

        // when
        webhookService.handle(BODY, signature());

        // then
        then(bookingWriter).should().fail(99L, CheckoutService.PAYMENT_NOT_SETTLED, "pay_1", NOW);
        then(bookingWriter).should(never()).confirm(anyLong(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("결제 실패 웹훅은 게이트웨이 오류 코드로 실패 처리한다")
    void shouldFailOnFailedEvent() {
        // given
        given(paymentGatewayPort.parseWebhook(BODY)).willReturn(new GatewayWebhookEvent(
                GatewayWebhookEvent.PAYMENT_FAILED,
                new GatewayPayment("pay_1", "order_1", GatewayPaymentStatus.FAILED, 150000L, "card",
                        "BAD_REQUEST_ERROR")));
        given(bookingPort.findByTransactionId("order_1")).willReturn(Optional.of(pending()));

        // when
        webhookService.handle(BODY, signature());

        // then
        then(bookingWriter).should().fail(99L, "BAD_REQUEST_ERROR", "pay_1", NOW);
    }

    @Test
    @DisplayName("알 수 없는 거래의 웹훅은 무시한다")
    void shouldIgnoreUnknownTransaction() {
        // given
        given(paymentGatewayPort.parseWebhook(BODY)).willReturn(new GatewayWebhookEvent(
                GatewayWebhookEvent.PAYMENT_CAPTURED,
                new GatewayPayment("pay_1", "order_x", GatewayPaymentStatus.CAPTURED, 150000L, "card", null)));
        given(bookingPort.findByTransactionId("order_x")).willReturn(Optional.empty());

        // when
        webhookService.handle(BODY, signature());

        // then
        then(bookingWriter).shouldHaveNoInteractions();
    }
}
