package kr.jemi.ticketgate.cart.application.service;

import kr.jemi.ticketgate.cart.application.port.out.CartInventoryPort;
import kr.jemi.ticketgate.cart.application.port.out.CartPort;
import kr.jemi.ticketgate.cart.domain.Cart;
import kr.jemi.ticketgate.cart.domain.CartStatus;
import kr.jemi.ticketgate.cart.event.CartExpiredEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

@Service
public class CartExpiryWriter {

    private final CartPort cartPort;
    private final CartInventoryPort cartInventoryPort;
    private final ApplicationEventPublisher eventPublisher;

    public CartExpiryWriter(CartPort cartPort, CartInventoryPort cartInventoryPort,
                            ApplicationEventPublisher eventPublisher) {
        this.cartPort = cartPort;
        this.cartInventoryPort = cartInventoryPort;
        this.eventPublisher = eventPublisher;
    }

    /**
     * 잠금 후 다시 확인한다. 그 사이 연장되었거나 전환된 장바구니는 건드리지 않는다.
     *
     * @return 만료 처리했으면 true
     */
    @Transactional
    public boolean expire(long cartId, LocalDateTime now) {
        return cartPort.findByIdForUpdate(cartId)
                .filter(cart -> cart.getStatus() == CartStatus.ACTIVE && cart.isExpired(now))
                .map(cart -> {
                    expireLocked(cart, now);
                    return true;
                })
                .orElse(false);
    }

    /**
     * 이미 행 잠금을 쥔 장바구니를 만료시키고 선점을 같은 트랜잭션에서 반납한다.
     */
    @Transactional
    public void expireLocked(Cart cart, LocalDateTime now) {
        cartInventoryPort.releaseCart(cart.getId());
        cart.expire(now);
        cartPort.save(cart);
        eventPublisher.publishEvent(new CartExpiredEvent(cart.getId(), cart.getUserId(), cart.getEventId()));
    }
}
