package kr.jemi.ticketgate.cart.application.service;

import io.hypersistence.tsid.TSID;
import kr.jemi.ticketgate.cart.application.port.in.AbandonCartUseCase;
import kr.jemi.ticketgate.cart.application.port.in.AddCartItemCommand;
import kr.jemi.ticketgate.cart.application.port.in.AddCartItemUseCase;
import kr.jemi.ticketgate.cart.application.port.in.GetCartUseCase;
import kr.jemi.ticketgate.cart.application.port.in.RemoveCartItemUseCase;
import kr.jemi.ticketgate.cart.application.port.in.UpdateCartItemUseCase;
import kr.jemi.ticketgate.cart.application.port.in.ValidateCartUseCase;
import kr.jemi.ticketgate.cart.application.port.out.AdmissionCheckPort;
import kr.jemi.ticketgate.cart.application.port.out.CartEventPolicyPort;
import kr.jemi.ticketgate.cart.application.port.out.CartInventoryPort;
import kr.jemi.ticketgate.cart.application.port.out.CartPort;
import kr.jemi.ticketgate.cart.domain.Cart;
import kr.jemi.ticketgate.cart.domain.CartCategory;
import kr.jemi.ticketgate.cart.domain.CartEventPolicy;
import kr.jemi.ticketgate.cart.domain.CartHold;
import kr.jemi.ticketgate.cart.domain.CartItem;
import kr.jemi.ticketgate.cart.domain.CartStatus;
import kr.jemi.ticketgate.cart.domain.CartValidation;
import kr.jemi.ticketgate.common.exception.BusinessException;
import kr.jemi.ticketgate.common.exception.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

@Service
public class CartService implements AddCartItemUseCase, UpdateCartItemUseCase, RemoveCartItemUseCase,
        GetCartUseCase, ValidateCartUseCase, AbandonCartUseCase {

    private static final Logger log = LoggerFactory.getLogger(CartService.class);

    private final CartPort cartPort;
    private final CartInventoryPort cartInventoryPort;
    private final CartEventPolicyPort cartEventPolicyPort;
    private final AdmissionCheckPort admissionCheckPort;
    private final CartExpiryWriter cartExpiryWriter;
    private final CartValidator cartValidator;
    private final TSID.Factory tsidFactory;
    private final Clock clock;
    private final int holdMinutes;
    private final int maxSessionMinutes;

    public CartService(CartPort cartPort,
                       CartInventoryPort cartInventoryPort,
                       CartEventPolicyPort cartEventPolicyPort,
                       AdmissionCheckPort admissionCheckPort,
                       CartExpiryWriter cartExpiryWriter,
                       CartValidator cartValidator,
                       TSID.Factory tsidFactory,
                       Clock clock,
                       @Value("${ticketgate.cart.hold-minutes}") int holdMinutes,
                       @Value("${ticketgate.cart.max-session-minutes}") int maxSessionMinutes) {
        this.cartPort = cartPort;
        this.cartInventoryPort = cartInventoryPort;
        this.cartEventPolicyPort = cartEventPolicyPort;
        this.admissionCheckPort = admissionCheckPort;
        this.cartExpiryWriter = cartExpiryWriter;
        this.cartValidator = cartValidator;
        this.tsidFactory = tsidFactory;
        this.clock = clock;
        this.holdMinutes = holdMinutes;
        this.maxSessionMinutes = maxSessionMinutes;
    }

    @Override
    @Transactional
    public Cart addItem(AddCartItemCommand command) {
        LocalDateTime now = LocalDateTime.now(clock);
        CartEventPolicy policy = requireMutable(command.eventId(), command.userId());

        CartCategory category = cartInventoryPort.getCategory(command.categoryId());
        if (category.eventId() != command.eventId()) {
            throw new BusinessException(ErrorCode.CATEGORY_NOT_FOUND);
        }

        Cart cart = activeCartForUpdate(command.userId(), command.eventId(), now);
        if (cart.hasCategory(command.categoryId())) {
            throw new BusinessException(ErrorCode.CATEGORY_ALREADY_IN_CART);
        }
        int quantity = command.requestedQuantity();
        requireWithinLimit(cart.totalQuantity() + quantity, policy);

        LocalDateTime expiresAt = cart.nextExpiry(now, holdMinutes, maxSessionMinutes);
        CartHold hold = cartInventoryPort.hold(cart.getId(), command.categoryId(), quantity,
                command.seatIds(), expiresAt);
        CartItem item = new CartItem(tsidFactory.generate().toLong(), category.categoryId(), category.name(),
                hold.quantity(), hold.seatIds(), category.price(), hold.holdId(), now);
        cart.addItem(item, policy.maxTicketsPerBooking(), now);
        extend(cart, expiresAt, now);

        log.info("장바구니 담기: cartId={}, userId={}, categoryId={}, quantity={}",
                cart.getId(), cart.getUserId(), category.categoryId(), hold.quantity());
        return cartPort.save(cart);
    }

    @Override
    @Transactional
    public Cart updateQuantity(long userId, long cartId, long itemId, int quantity) {
        if (quantity < 1) {
            throw new IllegalArgumentException("수량은 1 이상이어야 합니다");
        }
        LocalDateTime now = LocalDateTime.now(clock);
        Cart cart = lockOwnedActiveCart(userId, cartId, now);
        CartEventPolicy policy = requireMutable(cart.getEventId(), userId);

        CartItem item = cart.findItem(itemId)
                .orElseThrow(() -> new BusinessException(ErrorCode.CART_ITEM_NOT_FOUND));
        if (item.isAssignedSeating()) {
            throw new BusinessException(ErrorCode.SEAT_ITEM_QUANTITY_FIXED);
        }
        requireWithinLimit(cart.totalQuantity() - item.getQuantity() + quantity, policy);

        cartInventoryPort.resize(item.getHoldId(), quantity);
        cart.changeQuantity(itemId, quantity, policy.maxTicketsPerBooking(), now);
        extend(cart, cart.nextExpiry(now, holdMinutes, maxSessionMinutes), now);

        log.info("장바구니 수량 변경: cartId={}, itemId={}, quantity={}", cartId, itemId, quantity);
        return cartPort.save(cart);
    }

    @Override
    @Transactional
    public Cart removeItem(long userId, long cartId, long itemId) {
        LocalDateTime now = LocalDateTime.now(clock);
        Cart cart = lockOwnedActiveCart(userId, cartId, now);
        requireMutable(cart.getEventId(), userId);

        CartItem item = cart.findItem(itemId)
                .orElseThrow(() -> new BusinessException(ErrorCode.CART_ITEM_NOT_FOUND));
        cartInventoryPort.release(item.getHoldId());
        cart.removeItem(itemId, now);
        extend(cart, cart.nextExpiry(now, holdMinutes, maxSessionMinutes), now);

        log.info("장바구니 항목 삭제: cartId={}, itemId={}", cartId, itemId);
        return cartPort.save(cart);
    }

    @Override
    @Transactional(readOnly = true)
    public Cart getActiveCart(long userId, long eventId) {
        return cartPort.findActive(userId, eventId)
                .orElseThrow(() -> new BusinessException(ErrorCode.CART_NOT_FOUND));
    }

    @Override
    @Transactional(readOnly = true)
    public Cart getCart(long userId, long cartId) {
        Cart cart = cartPort.findById(cartId)
                .orElseThrow(() -> new BusinessException(ErrorCode.CART_NOT_FOUND));
        requireOwner(cart, userId);
        return cart;
    }

    @Override
    @Transactional(readOnly = true)
    public CartValidation validate(long userId, long cartId) {
        Cart cart = getCart(userId, cartId);
        return cartValidator.validate(cart, LocalDateTime.now(clock));
    }

    @Override
    @Transactional
    public void abandon(long userId, long cartId) {
        Cart cart = cartPort.findByIdForUpdate(cartId)
                .orElseThrow(() -> new BusinessException(ErrorCode.CART_NOT_FOUND));
        requireOwner(cart, userId);
        if (cart.getStatus() == CartStatus.CONVERTED) {
            throw new BusinessException(ErrorCode.CART_NOT_ACTIVE);
        }
        if (cart.getStatus() != CartStatus.ACTIVE) {
            return;
        }
        cartInventoryPort.releaseCart(cartId);
        cart.abandon(LocalDateTime.now(clock));
        cartPort.save(cart);
        log.info("장바구니 포기: cartId={}, userId={}", cartId, userId);
    }

    private CartEventPolicy requireMutable(long eventId, long userId) {
        CartEventPolicy policy = cartEventPolicyPort.getPolicy(eventId);
        if (!policy.bookingOpen()) {
            throw new BusinessException(ErrorCode.BOOKING_WINDOW_CLOSED);
        }
        if (policy.queueEnabled() && !admissionCheckPort.isAdmitted(eventId, userId)) {
            throw new BusinessException(ErrorCode.ADMISSION_REQUIRED);
        }
        return policy;
    }

    private void requireWithinLimit(int totalQuantity, CartEventPolicy policy) {
        if (totalQuantity > policy.maxTicketsPerBooking()) {
            throw new BusinessException(ErrorCode.MAX_TICKETS_EXCEEDED,
                    "1회 최대 " + policy.maxTicketsPerBooking() + "매까지 예매할 수 있습니다");
        }
    }

    private void requireOwner(Cart cart, long userId) {
        if (!cart.isOwnedBy(userId)) {
            throw new BusinessException(ErrorCode.FORBIDDEN);
        }
    }

    private Cart lockOwnedActiveCart(long userId, long cartId, LocalDateTime now) {
        Cart cart = cartPort.findByIdForUpdate(cartId)
                .orElseThrow(() -> new BusinessException(ErrorCode.CART_NOT_FOUND));
        requireOwner(cart, userId);
        if (cart.getStatus() != CartStatus.ACTIVE) {
            throw new BusinessException(ErrorCode.CART_NOT_ACTIVE);
        }
        if (cart.isExpired(now)) {
            throw new BusinessException(ErrorCode.CART_EXPIRED);
        }
        return cart;
    }

    /**
     * 사용자의 활성 장바구니를 잠가서 가져오고, 없거나 이미 만료됐으면 새로 만든다.
     */
    private Cart activeCartForUpdate(long userId, long eventId, LocalDateTime now) {
        Optional<Cart> existing = cartPort.findActiveForUpdate(userId, eventId);
        if (existing.isPresent()) {
            Cart cart = existing.get();
            if (!cart.isExpired(now)) {
                return cart;
            }
            // 스윕보다 먼저 온 요청: 만료 처리 후 새 장바구니를 연다
            cartExpiryWriter.expireLocked(cart, now);
        }

        Cart cart = Cart.create(tsidFactory.generate().toLong(), userId, eventId, now,
                now.plusMinutes(Math.min(holdMinutes, maxSessionMinutes)));
        try {
            return cartPort.insert(cart);
        } catch (DataIntegrityViolationException | PessimisticLockingFailureException e) {
            // 같은 사용자의 첫 담기 요청이 동시에 들어와 한쪽만 장바구니를 만들었다
            throw new BusinessException(ErrorCode.CONCURRENT_REQUEST);
        }
    }

    private void extend(Cart cart, LocalDateTime expiresAt, LocalDateTime now) {
        cart.extend(expiresAt, now);
        cartInventoryPort.extend(cart.getId(), expiresAt);
    }
}
