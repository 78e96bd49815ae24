package kr.jemi.ticketgate.cart.application.port.out;

import kr.jemi.ticketgate.cart.domain.CartCategory;
import kr.jemi.ticketgate.cart.domain.CartHold;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

public interface CartInventoryPort {

    CartCategory getCategory(long categoryId);

    CartHold hold(long cartId, long categoryId, int quantity, List<Long> seatIds, LocalDateTime expiresAt);

    CartHold resize(long holdId, int quantity);

    void release(long holdId);

    void releaseCart(long cartId);

    void extend(long cartId, LocalDateTime expiresAt);

    List<CartHold> findHolds(Collection<Long> holdIds);
}
