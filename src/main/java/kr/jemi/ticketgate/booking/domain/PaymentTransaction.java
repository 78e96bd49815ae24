package kr.jemi.ticketgate.booking.domain;

/**
 * 클라이언트가 게이트웨이 결제창을 띄우는 데 필요한 값.
 */
public record PaymentTransaction(long bookingId, String bookingNumber, String transactionId, long amount,
                                 String currency, String gatewayKey) {
}
