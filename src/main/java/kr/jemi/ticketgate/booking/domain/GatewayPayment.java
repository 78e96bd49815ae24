package kr.jemi.ticketgate.booking.domain;

/**
 * 게이트웨이가 보고한 결제 한 건.
 *
 * @param amount 최소 화폐 단위 금액
 */
public record GatewayPayment(String paymentId, String transactionId, GatewayPaymentStatus status, long amount,
                             String method, String errorCode) {

    public boolean settles(Booking booking) {
        return status.isPaid()
                && booking.getTransactionId() != null
                && booking.getTransactionId().equals(transactionId)
                && amount == booking.amountInMinorUnits();
    }
}
