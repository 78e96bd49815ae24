package kr.jemi.ticketgate.booking.application.port.out;

import kr.jemi.ticketgate.booking.domain.GatewayPayment;
import kr.jemi.ticketgate.booking.domain.GatewayWebhookEvent;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 외부 결제 게이트웨이. 네트워크 오류는 GATEWAY_UNAVAILABLE 로 올라온다.
 */
public interface PaymentGatewayPort {

    /**
     * @return 게이트웨이 거래 id
     */
    String createTransaction(long amount, String currency, String reference, Map<String, String> notes);

    Optional<GatewayPayment> fetchPayment(String paymentId);

    List<GatewayPayment> findPayments(String transactionId);

    GatewayWebhookEvent parseWebhook(String rawBody);

    String publicKey();
}
