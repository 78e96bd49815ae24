package kr.jemi.ticketgate.cart.infrastructure.in.scheduler;

import kr.jemi.ticketgate.cart.application.port.in.ExpireCartsUseCase;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class CartExpiryScheduler {

    private static final Logger log = LoggerFactory.getLogger(CartExpiryScheduler.class);

    private final ExpireCartsUseCase expireCartsUseCase;

    public CartExpiryScheduler(ExpireCartsUseCase expireCartsUseCase) {
        this.expireCartsUseCase = expireCartsUseCase;
    }

    @Scheduled(fixedDelayString = "${ticketgate.cart.expiry-interval-ms}")
    @SchedulerLock(name = "expireCarts",
            lockAtMostFor = "${ticketgate.cart.lock-at-most-for}",
            lockAtLeastFor = "${ticketgate.cart.lock-at-least-for}")
    public void expire() {
        try {
            expireCartsUseCase.expireOverdue();
        } catch (Exception e) {
            log.error("장바구니 만료 스윕 실패", e);
        }
    }
}
