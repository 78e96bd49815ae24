package kr.jemi.ticketgate.cart.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import kr.jemi.ticketgate.cart.application.port.in.AbandonCartUseCase;
import kr.jemi.ticketgate.cart.application.port.in.AddCartItemUseCase;
import kr.jemi.ticketgate.cart.application.port.in.GetCartUseCase;
import kr.jemi.ticketgate.cart.application.port.in.RemoveCartItemUseCase;
import kr.jemi.ticketgate.cart.application.port.in.UpdateCartItemUseCase;
import kr.jemi.ticketgate.cart.application.port.in.ValidateCartUseCase;
import kr.jemi.ticketgate.cart.domain.Cart;
import kr.jemi.ticketgate.cart.infrastructure.in.web.dto.AddCartItemRequest;
import kr.jemi.ticketgate.cart.infrastructure.in.web.dto.CartResponse;
import kr.jemi.ticketgate.cart.infrastructure.in.web.dto.CartValidationResponse;
import kr.jemi.ticketgate.cart.infrastructure.in.web.dto.UpdateCartItemRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDateTime;

@Tag(name = "Cart", description = "좌석 담기, 수량 변경, 결제 전 점검")
@RestController
public class CartApiController {

    private final AddCartItemUseCase addCartItemUseCase;
    private final UpdateCartItemUseCase updateCartItemUseCase;
    private final RemoveCartItemUseCase removeCartItemUseCase;
    private final GetCartUseCase getCartUseCase;
    private final ValidateCartUseCase validateCartUseCase;
    private final AbandonCartUseCase abandonCartUseCase;
    private final Clock clock;

    public CartApiController(AddCartItemUseCase addCartItemUseCase,
                             UpdateCartItemUseCase updateCartItemUseCase,
                             RemoveCartItemUseCase removeCartItemUseCase,
                             GetCartUseCase getCartUseCase,
                             ValidateCartUseCase validateCartUseCase,
                             AbandonCartUseCase abandonCartUseCase,
                             Clock clock) {
        this.addCartItemUseCase = addCartItemUseCase;
        this.updateCartItemUseCase = updateCartItemUseCase;
        this.removeCartItemUseCase = removeCartItemUseCase;
        this.getCartUseCase = getCartUseCase;
        this.validateCartUseCase = validateCartUseCase;
        this.abandonCartUseCase = abandonCartUseCase;
        this.clock = clock;
    }

    @Operation(summary = "좌석 담기", description = "좌석을 선점하고 장바구니에 담습니다. 활성 장바구니가 없으면 새로 만듭니다.")
    @PostMapping("/api/events/{eventId}/cart/items")
    public ResponseEntity<CartResponse> addItem(
            @PathVariable long eventId,
            @Parameter(description = "사용자 ID") @RequestHeader("X-User-Id") long userId,
            @Valid @RequestBody AddCartItemRequest request) {
        Cart cart = addCartItemUseCase.addItem(request.toCommand(userId, eventId));
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(cart));
    }

    @Operation(summary = "내 장바구니 조회", description = "이벤트별 활성 장바구니를 조회합니다.")
    @GetMapping("/api/events/{eventId}/cart")
    public ResponseEntity<CartResponse> getActiveCart(
            @PathVariable long eventId,
            @Parameter(description = "사용자 ID") @RequestHeader("X-User-Id") long userId) {
        return ResponseEntity.ok(toResponse(getCartUseCase.getActiveCart(userId, eventId)));
    }

    @GetMapping("/api/carts/{cartId}")
    public ResponseEntity<CartResponse> getCart(
            @PathVariable long cartId,
            @Parameter(description = "사용자 ID") @RequestHeader("X-User-Id") long userId) {
        return ResponseEntity.ok(toResponse(getCartUseCase.getCart(userId, cartId)));
    }

    @Operation(summary = "수량 변경", description = "자유석 항목의 수량을 바꿉니다. 지정석은 삭제 후 다시 담아야 합니다.")
    @PatchMapping("/api/carts/{cartId}/items/{itemId}")
    public ResponseEntity<CartResponse> updateItem(
            @PathVariable long cartId,
            @PathVariable long itemId,
            @Parameter(description = "사용자 ID") @RequestHeader("X-User-Id") long userId,
            @Valid @RequestBody UpdateCartItemRequest request) {
        Cart cart = updateCartItemUseCase.updateQuantity(userId, cartId, itemId, request.quantity());
        return ResponseEntity.ok(toResponse(cart));
    }

    @Operation(summary = "항목 삭제", description = "항목을 빼고 선점한 좌석을 반납합니다.")
    @DeleteMapping("/api/carts/{cartId}/items/{itemId}")
    public ResponseEntity<CartResponse> removeItem(
            @PathVariable long cartId,
            @PathVariable long itemId,
            @Parameter(description = "사용자 ID") @RequestHeader("X-User-Id") long userId) {
        return ResponseEntity.ok(toResponse(removeCartItemUseCase.removeItem(userId, cartId, itemId)));
    }

    @Operation(summary = "결제 전 점검", description = "선점 유효성, 예매 기간, 가격 변동을 점검합니다.")
    @GetMapping("/api/carts/{cartId}/validation")
    public ResponseEntity<CartValidationResponse> validate(
            @PathVariable long cartId,
            @Parameter(description = "사용자 ID") @RequestHeader("X-User-Id") long userId) {
        return ResponseEntity.ok(CartValidationResponse.from(validateCartUseCase.validate(userId, cartId)));
    }

    @Operation(summary = "장바구니 비우기", description = "장바구니를 포기하고 선점한 좌석을 모두 반납합니다.")
    @DeleteMapping("/api/carts/{cartId}")
    public ResponseEntity<Void> abandon(
            @PathVariable long cartId,
            @Parameter(description = "사용자 ID") @RequestHeader("X-User-Id") long userId) {
        abandonCartUseCase.abandon(userId, cartId);
        return ResponseEntity.noContent().build();
    }

    private CartResponse toResponse(Cart cart) {
        return CartResponse.from(cart, LocalDateTime.now(clock));
    }
}
