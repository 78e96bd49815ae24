package kr.jemi.ticketgate.cart.application.service;

import kr.jemi.ticketgate.cart.api.CartFacade;
import kr.jemi.ticketgate.cart.api.CheckoutCart;
import kr.jemi.ticketgate.cart.api.CheckoutCartItem;
import kr.jemi.ticketgate.cart.application.port.out.CartPort;
import kr.jemi.ticketgate.cart.domain.Cart;
import kr.jemi.ticketgate.cart.domain.CartStatus;
import kr.jemi.ticketgate.cart.domain.CartValidation;
import kr.jemi.ticketgate.common.exception.BusinessException;
import kr.jemi.ticketgate.common.exception.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

@Service
public class CartCheckoutService implements CartFacade {

    private static final Logger log = LoggerFactory.getLogger(CartCheckoutService.class);

    private final CartPort cartPort;
    private final CartValidator cartValidator;
    private final Clock clock;

    public CartCheckoutService(CartPort cartPort, CartValidator cartValidator, Clock clock) {
        this.cartPort = cartPort;
        this.cartValidator = cartValidator;
        this.clock = clock;
    }

    @Override
    @Transactional
    public CheckoutCart convertForCheckout(long userId, long cartId, long bookingId) {
        LocalDateTime now = LocalDateTime.now(clock);
        Cart cart = cartPort.findByIdForUpdate(cartId)
                .orElseThrow(() -> new BusinessException(ErrorCode.CART_NOT_FOUND));
        if (!cart.isOwnedBy(userId)) {
            throw new BusinessException(ErrorCode.FORBIDDEN);
        }
        if (cart.getStatus() == CartStatus.EXPIRED) {
            throw new BusinessException(ErrorCode.CART_EXPIRED);
        }
        if (cart.getStatus() != CartStatus.ACTIVE) {
            throw new BusinessException(ErrorCode.CART_INVALID, "장바구니 상태: " + cart.getStatus());
        }
        if (cart.isExpired(now)) {
            throw new BusinessException(ErrorCode.CART_EXPIRED);
        }

        CartValidation validation = cartValidator.validate(cart, now);
        if (!validation.valid()) {
            throw new BusinessException(ErrorCode.CART_INVALID, String.join(", ", validation.errors()));
        }

        cart.convert(bookingId, now);
        cartPort.save(cart);
        log.info("장바구니 결제 전환: cartId={}, bookingId={}", cartId, bookingId);

        return new CheckoutCart(cart.getId(), cart.getUserId(), cart.getEventId(),
                cart.getItems().stream()
                        .map(item -> new CheckoutCartItem(item.getCategoryId(), item.getCategoryName(),
                                item.getQuantity(), item.getUnitPrice(), item.getSeatIds()))
                        .toList());
    }
}
