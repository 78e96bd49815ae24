package kr.jemi.ticketgate.booking.application.port.in;

import kr.jemi.ticketgate.booking.domain.PaymentTransaction;

public interface OpenPaymentTransactionUseCase {

    /**
     * 예매당 거래는 하나다. 이미 열린 거래가 있으면 그대로 돌려준다.
     */
    PaymentTransaction openTransaction(long userId, long bookingId);
}
