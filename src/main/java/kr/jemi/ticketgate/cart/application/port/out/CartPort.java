package kr.jemi.ticketgate.cart.application.port.out;

import kr.jemi.ticketgate.cart.domain.Cart;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface CartPort {

    Cart insert(Cart cart);

    Cart save(Cart cart);

    Optional<Cart> findById(long cartId);

    /**
     * 행 잠금을 건 조회. 같은 장바구니에 대한 동시 변경은 여기서 직렬화된다.
     */
    Optional<Cart> findByIdForUpdate(long cartId);

    Optional<Cart> findActive(long userId, long eventId);

    Optional<Cart> findActiveForUpdate(long userId, long eventId);

    List<Long> findExpiredActiveIds(LocalDateTime now, int limit);
}
