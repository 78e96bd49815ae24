package kr.jemi.ticketgate.booking.infrastructure.out.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import kr.jemi.ticketgate.booking.application.port.out.PaymentGatewayPort;
import kr.jemi.ticketgate.booking.domain.GatewayPayment;
import kr.jemi.ticketgate.booking.domain.GatewayWebhookEvent;
import kr.jemi.ticketgate.booking.infrastructure.out.gateway.dto.GatewayOrderRequest;
import kr.jemi.ticketgate.booking.infrastructure.out.gateway.dto.GatewayOrderResponse;
import kr.jemi.ticketgate.booking.infrastructure.out.gateway.dto.GatewayPaymentListResponse;
import kr.jemi.ticketgate.booking.infrastructure.out.gateway.dto.GatewayPaymentResponse;
import kr.jemi.ticketgate.booking.infrastructure.out.gateway.dto.GatewayWebhookPayload;
import kr.jemi.ticketgate.common.exception.BusinessException;
import kr.jemi.ticketgate.common.exception.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class PaymentGatewayRestAdapter implements PaymentGatewayPort {

    private static final Logger log = LoggerFactory.getLogger(PaymentGatewayRestAdapter.class);

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String keyId;

    public PaymentGatewayRestAdapter(@Qualifier("paymentGatewayRestClient") RestClient restClient,
                                     ObjectMapper objectMapper,
                                     @Value("${ticketgate.payment.gateway.key-id}") String keyId) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.keyId = keyId;
    }

    @Override
    public String createTransaction(long amount, String currency, String reference, Map<String, String> notes) {
        try {
            GatewayOrderResponse order = restClient.post()
                    .uri("/v1/orders")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new GatewayOrderRequest(amount, currency, reference, notes, 1))
                    .retrieve()
                    .body(GatewayOrderResponse.class);
            if (order == null || order.id() == null) {
                throw new BusinessException(ErrorCode.GATEWAY_UNAVAILABLE);
            }
            log.info("게이트웨이 주문 생성: orderId={}, amount={}", order.id(), amount);
            return order.id();
        } catch (RestClientException e) {
            log.error("게이트웨이 주문 생성 실패: reference={}, error={}", reference, e.getMessage());
            throw new BusinessException(ErrorCode.GATEWAY_UNAVAILABLE);
        }
    }

    @Override
    public Optional<GatewayPayment> fetchPayment(String paymentId) {
        try {
            GatewayPaymentResponse payment = restClient.get()
                    .uri("/v1/payments/{paymentId}", paymentId)
                    .retrieve()
                    .body(GatewayPaymentResponse.class);
            return Optional.ofNullable(payment).map(GatewayPaymentResponse::toPayment);
        } catch (RestClientResponseException e) {
            if (e.getStatusCode().isSameCodeAs(HttpStatus.NOT_FOUND)
                    || e.getStatusCode().isSameCodeAs(HttpStatus.BAD_REQUEST)) {
                log.warn("게이트웨이에 없는 결제: paymentId={}", paymentId);
                return Optional.empty();
            }
            log.error("게이트웨이 결제 조회 실패: paymentId={}, status={}", paymentId, e.getStatusCode());
            throw new BusinessException(ErrorCode.GATEWAY_UNAVAILABLE);
        } catch (RestClientException e) {
            log.error("게이트웨이 결제 조회 실패: paymentId={}, error={}", paymentId, e.getMessage());
            throw new BusinessException(ErrorCode.GATEWAY_UNAVAILABLE);
        }
    }

    @Override
    public List<GatewayPayment> findPayments(String transactionId) {
        try {
            GatewayPaymentListResponse payments = restClient.get()
                    .uri("/v1/orders/{orderId}/payments", transactionId)
                    .retrieve()
                    .body(GatewayPaymentListResponse.class);
            if (payments == null || payments.items() == null) {
                return List.of();
            }
            return payments.items().stream().map(GatewayPaymentResponse::toPayment).toList();
        } catch (RestClientException e) {
            log.error("게이트웨이 주문 결제 목록 조회 실패: orderId={}, error={}", transactionId, e.getMessage());
            throw new BusinessException(ErrorCode.GATEWAY_UNAVAILABLE);
        }
    }

    @Override
    public GatewayWebhookEvent parseWebhook(String rawBody) {
        try {
            GatewayWebhookPayload payload = objectMapper.readValue(rawBody, GatewayWebhookPayload.class);
            GatewayPaymentResponse entity = payload.paymentEntity();
            return new GatewayWebhookEvent(payload.event(), entity == null ? null : entity.toPayment());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("웹훅 본문을 해석할 수 없습니다", e);
        }
    }

    @Override
    public String publicKey() {
        return keyId;
    }
}
