package kr.jemi.ticketgate.booking.infrastructure.out.cart;

import kr.jemi.ticketgate.booking.application.port.out.CheckoutCartPort;
import kr.jemi.ticketgate.booking.domain.CheckoutLine;
import kr.jemi.ticketgate.booking.domain.CheckoutSnapshot;
import kr.jemi.ticketgate.cart.api.CartFacade;
import kr.jemi.ticketgate.cart.api.CheckoutCart;
import org.springframework.stereotype.Component;

@Component
public class CheckoutCartAdapter implements CheckoutCartPort {

    private final CartFacade cartFacade;

    public CheckoutCartAdapter(CartFacade cartFacade) {
        this.cartFacade = cartFacade;
    }

    @Override
    public CheckoutSnapshot convert(long userId, long cartId, long bookingId) {
        CheckoutCart cart = cartFacade.convertForCheckout(userId, cartId, bookingId);
        return new CheckoutSnapshot(cart.cartId(), cart.userId(), cart.eventId(),
                cart.items().stream()
                        .map(item -> new CheckoutLine(item.categoryId(), item.categoryName(), item.quantity(),
                                item.unitPrice(), item.seatIds()))
                        .toList());
    }
}
