package kr.jemi.ticketgate.booking.infrastructure.in.web.dto;

import kr.jemi.ticketgate.booking.domain.PaymentTransaction;

public record PaymentTransactionResponse(long bookingId, String bookingNumber, String transactionId,
                                         long amount, String currency, String gatewayKey) {

    public static PaymentTransactionResponse from(PaymentTransaction transaction) {
        return new PaymentTransactionResponse(transaction.bookingId(), transaction.bookingNumber(),
                transaction.transactionId(), transaction.amount(), transaction.currency(),
                transaction.gatewayKey());
    }
}
