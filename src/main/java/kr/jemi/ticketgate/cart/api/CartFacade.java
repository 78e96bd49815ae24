package kr.jemi.ticketgate.cart.api;

public interface CartFacade {

    /**
     * 장바구니를 점검하고 CONVERTED 로 바꾼 뒤 내용을 돌려준다. 호출자의 트랜잭션에 참여한다.
     *
     * @throws kr.jemi.ticketgate.common.exception.BusinessException
     *         CART_NOT_FOUND, FORBIDDEN, CART_EXPIRED (만료 상태 포함), CART_INVALID (그 밖의 비활성 상태 포함)
     */
    CheckoutCart convertForCheckout(long userId, long cartId, long bookingId);
}
