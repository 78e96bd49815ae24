package kr.jemi.ticketgate.booking.application.service;

import kr.jemi.ticketgate.booking.application.port.in.HandlePaymentWebhookUseCase;
import kr.jemi.ticketgate.booking.application.port.out.BookingPort;
import kr.jemi.ticketgate.booking.application.port.out.PaymentGatewayPort;
import kr.jemi.ticketgate.booking.domain.Booking;
import kr.jemi.ticketgate.booking.domain.GatewayPayment;
import kr.jemi.ticketgate.booking.domain.GatewayWebhookEvent;
import kr.jemi.ticketgate.common.exception.BusinessException;
import kr.jemi.ticketgate.common.exception.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

@Service
public class PaymentWebhookService implements HandlePaymentWebhookUseCase {

    private static final Logger log = LoggerFactory.getLogger(PaymentWebhookService.class);

    private final BookingPort bookingPort;
    private final BookingWriter bookingWriter;
    private final PaymentGatewayPort paymentGatewayPort;
    private final PaymentSignatureVerifier signatureVerifier;
    private final Clock clock;

    public PaymentWebhookService(BookingPort bookingPort,
                                 BookingWriter bookingWriter,
                                 PaymentGatewayPort paymentGatewayPort,
                                 PaymentSignatureVerifier signatureVerifier,
                                 Clock clock) {
        this.bookingPort = bookingPort;
        this.bookingWriter = bookingWriter;
        this.paymentGatewayPort = paymentGatewayPort;
        this.signatureVerifier = signatureVerifier;
        this.clock = clock;
    }

    @Override
    public void handle(String rawBody, String signature) {
        if (!signatureVerifier.verifyWebhook(rawBody, signature)) {
            log.warn("웹훅 서명 불일치");
            throw new BusinessException(ErrorCode.INVALID_WEBHOOK_SIGNATURE);
        }

        GatewayWebhookEvent event = paymentGatewayPort.parseWebhook(rawBody);
        GatewayPayment payment = event.payment();
        if (payment == null || payment.transactionId() == null) {
            log.info("처리 대상이 아닌 웹훅: type={}", event.type());
            return;
        }

        Optional<Booking> found = bookingPort.findByTransactionId(payment.transactionId());
        if (found.isEmpty()) {
            log.warn("웹훅 거래에 해당하는 예매 없음: type={}, transactionId={}", event.type(), payment.transactionId());
            return;
        }
        Booking booking = found.get();
        LocalDateTime now = LocalDateTime.now(clock);

        switch (event.type()) {
            case GatewayWebhookEvent.PAYMENT_CAPTURED -> {
                if (!payment.settles(booking)) {
                    log.warn("웹훅 결제 금액 불일치: bookingNumber={}, amount={}",
                            booking.getBookingNumber(), payment.amount());
                    bookingWriter.fail(booking.getId(), CheckoutService.PAYMENT_NOT_SETTLED, payment.paymentId(), now);
                    return;
                }
                if (booking.isPending() || booking.isConfirmedBy(payment.transactionId())) {
                    bookingWriter.confirm(booking.getId(), payment.transactionId(), payment.paymentId(),
                            payment.method(), now);
                } else {
                    log.warn("이미 종료된 예매에 결제 완료 웹훅: bookingNumber={}, status={}",
                            booking.getBookingNumber(), booking.getStatus());
                }
            }
            case GatewayWebhookEvent.PAYMENT_FAILED -> bookingWriter.fail(booking.getId(),
                    payment.errorCode() == null ? "GATEWAY_FAILED" : payment.errorCode(), payment.paymentId(), now);
            default -> log.info("무시한 웹훅: type={}", event.type());
        }
    }
}
