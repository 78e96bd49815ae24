package kr.jemi.ticketgate.booking.application.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * 게이트웨이 서명 검증. 비교는 상수 시간으로 한다.
 */
@Component
public class PaymentSignatureVerifier {

    private static final String ALGORITHM = "HmacSHA256";

    private final String keySecret;
    private final String webhookSecret;

    public PaymentSignatureVerifier(@Value("${ticketgate.payment.gateway.key-secret}") String keySecret,
                                    @Value("${ticketgate.payment.gateway.webhook-secret}") String webhookSecret) {
        this.keySecret = keySecret;
        this.webhookSecret = webhookSecret;
    }

    /**
     * 결제 완료 콜백 서명: HMAC_SHA256(keySecret, transactionId|paymentId)
     */
    public boolean verifyPayment(String transactionId, String paymentId, String signature) {
        if (transactionId == null || paymentId == null || signature == null) {
            return false;
        }
        return matches(sign(keySecret, transactionId + "|" + paymentId), signature);
    }

    public boolean verifyWebhook(String rawBody, String signature) {
        if (rawBody == null || signature == null) {
            return false;
        }
        return matches(sign(webhookSecret, rawBody), signature);
    }

    public String sign(String secret, String payload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("서명 생성 실패", e);
        }
    }

    private boolean matches(String expected, String actual) {
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                actual.toLowerCase().getBytes(StandardCharsets.UTF_8));
    }
}
