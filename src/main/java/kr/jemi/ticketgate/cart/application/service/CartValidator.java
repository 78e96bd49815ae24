package kr.jemi.ticketgate.cart.application.service;

import kr.jemi.ticketgate.cart.application.port.out.CartEventPolicyPort;
import kr.jemi.ticketgate.cart.application.port.out.CartInventoryPort;
import kr.jemi.ticketgate.cart.domain.Cart;
import kr.jemi.ticketgate.cart.domain.CartCategory;
import kr.jemi.ticketgate.cart.domain.CartHold;
import kr.jemi.ticketgate.cart.domain.CartItem;
import kr.jemi.ticketgate.cart.domain.CartStatus;
import kr.jemi.ticketgate.cart.domain.CartValidation;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
public class CartValidator {

    private static final int LOW_STOCK_THRESHOLD = 5;

    private final CartInventoryPort cartInventoryPort;
    private final CartEventPolicyPort cartEventPolicyPort;

    public CartValidator(CartInventoryPort cartInventoryPort, CartEventPolicyPort cartEventPolicyPort) {
        this.cartInventoryPort = cartInventoryPort;
        this.cartEventPolicyPort = cartEventPolicyPort;
    }

    public CartValidation validate(Cart cart, LocalDateTime now) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (cart.getStatus() != CartStatus.ACTIVE) {
            errors.add("사용 중인 장바구니가 아닙니다: " + cart.getStatus());
            return new CartValidation(cart.getId(), errors, warnings);
        }
        if (cart.isExpired(now)) {
            errors.add("장바구니 유효시간이 만료되었습니다");
        }
        if (cart.getItems().isEmpty()) {
            errors.add("장바구니가 비어 있습니다");
        }
        if (!cartEventPolicyPort.getPolicy(cart.getEventId()).bookingOpen()) {
            errors.add("예매 가능 기간이 아닙니다");
        }

        Map<Long, CartHold> holds = cartInventoryPort.findHolds(
                        cart.getItems().stream().map(CartItem::getHoldId).toList()).stream()
                .collect(Collectors.toMap(CartHold::holdId, Function.identity()));

        for (CartItem item : cart.getItems()) {
            CartHold hold = holds.get(item.getHoldId());
            if (hold == null || !hold.active()) {
                errors.add("'" + item.getCategoryName() + "' 좌석 선점이 해제되었습니다");
            } else if (!hold.isUsableAt(now)) {
                errors.add("'" + item.getCategoryName() + "' 좌석 선점 시간이 만료되었습니다");
            } else if (hold.quantity() != item.getQuantity()) {
                errors.add("'" + item.getCategoryName() + "' 선점 수량이 장바구니와 다릅니다");
            }

            CartCategory category = cartInventoryPort.getCategory(item.getCategoryId());
            if (category.price().compareTo(item.getUnitPrice()) != 0) {
                warnings.add("'" + item.getCategoryName() + "' 가격이 " + item.getUnitPrice().toPlainString()
                        + "에서 " + category.price().toPlainString() + "(으)로 변경되었습니다. 담을 때의 가격으로 결제됩니다");
            }
            if (category.available() < LOW_STOCK_THRESHOLD) {
                warnings.add("'" + item.getCategoryName() + "' 잔여 좌석이 " + category.available() + "석 남았습니다");
            }
        }
        return new CartValidation(cart.getId(), errors, warnings);
    }
}
