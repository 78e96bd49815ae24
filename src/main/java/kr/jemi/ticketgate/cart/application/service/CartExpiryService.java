package kr.jemi.ticketgate.cart.application.service;

import kr.jemi.ticketgate.cart.application.port.in.ExpireCartsUseCase;
import kr.jemi.ticketgate.cart.application.port.out.CartPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

@Service
public class CartExpiryService implements ExpireCartsUseCase {

    private static final Logger log = LoggerFactory.getLogger(CartExpiryService.class);

    private final CartPort cartPort;
    private final CartExpiryWriter cartExpiryWriter;
    private final Clock clock;
    private final int batchSize;

    public CartExpiryService(CartPort cartPort,
                             CartExpiryWriter cartExpiryWriter,
                             Clock clock,
                             @Value("${ticketgate.cart.expiry-batch-size}") int batchSize) {
        this.cartPort = cartPort;
        this.cartExpiryWriter = cartExpiryWriter;
        this.clock = clock;
        this.batchSize = batchSize;
    }

    @Override
    public int expireOverdue() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<Long> cartIds = cartPort.findExpiredActiveIds(now, batchSize);

        int expired = 0;
        for (Long cartId : cartIds) {
            try {
                if (cartExpiryWriter.expire(cartId, now)) {
                    expired++;
                }
            } catch (Exception e) {
                log.error("장바구니 만료 처리 실패: cartId={}", cartId, e);
            }
        }
        if (expired > 0) {
            log.info("장바구니 만료: count={}", expired);
        }
        return expired;
    }
}
