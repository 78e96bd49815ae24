package kr.jemi.ticketgate.booking.application.port.in;

public record ConfirmPaymentCommand(long userId, long bookingId, String transactionId, String paymentId,
                                    String signature) {
}
