package kr.jemi.ticketgate.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;

@Configuration
public class PaymentGatewayClientConfig {

    @Bean
    public RestClient paymentGatewayRestClient(RestClient.Builder builder,
                                               @Value("${ticketgate.payment.gateway.base-url}") String baseUrl,
                                               @Value("${ticketgate.payment.gateway.key-id}") String keyId,
                                               @Value("${ticketgate.payment.gateway.key-secret}") String keySecret,
                                               @Value("${ticketgate.payment.gateway.connect-timeout}") Duration connectTimeout,
                                               @Value("${ticketgate.payment.gateway.read-timeout}") Duration readTimeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeout);
        requestFactory.setReadTimeout(readTimeout);

        String credentials = Base64.getEncoder()
                .encodeToString((keyId + ":" + keySecret).getBytes(StandardCharsets.UTF_8));
        return builder
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Basic " + credentials)
                .build();
    }
}
