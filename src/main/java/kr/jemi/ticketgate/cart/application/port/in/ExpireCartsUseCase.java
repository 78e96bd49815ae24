package kr.jemi.ticketgate.cart.application.port.in;

public interface ExpireCartsUseCase {

    /**
     * @return 이번 스윕에서 만료 처리한 장바구니 수
     */
    int expireOverdue();
}
