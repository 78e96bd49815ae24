package kr.jemi.ticketgate.booking.application.service;

import kr.jemi.ticketgate.booking.application.port.in.AbandonBookingUseCase;
import kr.jemi.ticketgate.booking.application.port.in.BeginCheckoutCommand;
import kr.jemi.ticketgate.booking.application.port.in.BeginCheckoutUseCase;
import kr.jemi.ticketgate.booking.application.port.in.ConfirmPaymentCommand;
import kr.jemi.ticketgate.booking.application.port.in.ConfirmPaymentUseCase;
import kr.jemi.ticketgate.booking.application.port.in.GetBookingUseCase;
import kr.jemi.ticketgate.booking.application.port.in.OpenPaymentTransactionUseCase;
import kr.jemi.ticketgate.booking.application.port.out.BookingPort;
import kr.jemi.ticketgate.booking.application.port.out.PaymentGatewayPort;
import kr.jemi.ticketgate.booking.domain.Booking;
import kr.jemi.ticketgate.booking.domain.BookingStatus;
import kr.jemi.ticketgate.booking.domain.GatewayPayment;
import kr.jemi.ticketgate.booking.domain.PaymentTransaction;
import kr.jemi.ticketgate.common.exception.BusinessException;
import kr.jemi.ticketgate.common.exception.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 결제 흐름 조율. 게이트웨이 호출은 트랜잭션 밖에서 하고, 상태 변경은 {@link BookingWriter} 에 맡긴다.
 */
@Service
public class CheckoutService implements BeginCheckoutUseCase, OpenPaymentTransactionUseCase,
        ConfirmPaymentUseCase, AbandonBookingUseCase, GetBookingUseCase {

    private static final Logger log = LoggerFactory.getLogger(CheckoutService.class);

    static final String SIGNATURE_MISMATCH = "SIGNATURE_MISMATCH";
    static final String TRANSACTION_MISMATCH = "TRANSACTION_MISMATCH";
    static final String PAYMENT_NOT_SETTLED = "PAYMENT_NOT_SETTLED";
    static final String USER_CANCELLED = "USER_CANCELLED";

    private final BookingPort bookingPort;
    private final BookingWriter bookingWriter;
    private final PaymentGatewayPort paymentGatewayPort;
    private final PaymentSignatureVerifier signatureVerifier;
    private final Clock clock;
    private final long openingClaimSeconds;

    public CheckoutService(BookingPort bookingPort,
                           BookingWriter bookingWriter,
                           PaymentGatewayPort paymentGatewayPort,
                           PaymentSignatureVerifier signatureVerifier,
                           Clock clock,
                           @Value("${ticketgate.payment.opening-claim-seconds:30}") long openingClaimSeconds) {
        this.bookingPort = bookingPort;
        this.bookingWriter = bookingWriter;
        this.paymentGatewayPort = paymentGatewayPort;
        this.signatureVerifier = signatureVerifier;
        this.clock = clock;
        this.openingClaimSeconds = openingClaimSeconds;
    }

    @Override
    public Booking beginCheckout(BeginCheckoutCommand command) {
        return bookingWriter.create(command.userId(), command.cartId(), command.contact(), LocalDateTime.now(clock));
    }

    @Override
    public PaymentTransaction openTransaction(long userId, long bookingId) {
        Booking booking = getBooking(userId, bookingId);
        if (!booking.isPending() || booking.isPendingExpired(LocalDateTime.now(clock))) {
            throw new BusinessException(ErrorCode.BOOKING_NOT_PENDING);
        }
        if (!booking.hasTransaction()) {
            booking = openGatewayTransaction(userId, booking);
        }
        return new PaymentTransaction(booking.getId(), booking.getBookingNumber(), booking.getTransactionId(),
                booking.amountInMinorUnits(), booking.getCurrency(), paymentGatewayPort.publicKey());
    }

    /**
     * 예매 행을 먼저 선점한 호출만 게이트웨이 거래를 만든다. 선점에 진 호출은 이긴 쪽이 붙인 거래를 읽거나
     * CONCURRENT_REQUEST 로 재시도를 요청한다.
     */
    private Booking openGatewayTransaction(long userId, Booking booking) {
        LocalDateTime now = LocalDateTime.now(clock);
        if (!bookingPort.claimTransactionOpening(booking.getId(), now, now.minusSeconds(openingClaimSeconds))) {
            Booking current = getBooking(userId, booking.getId());
            if (current.hasTransaction()) {
                return current;
            }
            if (!current.isPending()) {
                throw new BusinessException(ErrorCode.BOOKING_NOT_PENDING);
            }
            log.info("결제 거래 개설 중복 요청: bookingNumber={}", booking.getBookingNumber());
            throw new BusinessException(ErrorCode.CONCURRENT_REQUEST);
        }

        String transactionId;
        try {
            transactionId = paymentGatewayPort.createTransaction(booking.amountInMinorUnits(),
                    booking.getCurrency(), booking.getBookingNumber(),
                    Map.of("bookingId", String.valueOf(booking.getId()),
                            "bookingNumber", booking.getBookingNumber(),
                            "userId", String.valueOf(userId)));
        } catch (RuntimeException e) {
            bookingPort.releaseTransactionOpening(booking.getId());
            throw e;
        }

        Booking attached = bookingWriter.attachTransaction(booking.getId(), transactionId, LocalDateTime.now(clock));
        log.info("결제 거래 개설: bookingNumber={}, transactionId={}, amount={}",
                attached.getBookingNumber(), attached.getTransactionId(), attached.amountInMinorUnits());
        return attached;
    }

    @Override
    public Booking confirmPayment(ConfirmPaymentCommand command) {
        Booking booking = getBooking(command.userId(), command.bookingId());
        if (booking.isConfirmedBy(command.transactionId())) {
            return booking;
        }
        if (!booking.isPending()) {
            throw new BusinessException(ErrorCode.TRANSACTION_ALREADY_RESOLVED);
        }

        // 금액과 거래 id 는 클라이언트 값이 아니라 저장된 값으로 검증한다
        if (!booking.hasTransaction() || !booking.getTransactionId().equals(command.transactionId())) {
            throw verificationFailed(booking, TRANSACTION_MISMATCH, command.paymentId());
        }
        if (!signatureVerifier.verifyPayment(booking.getTransactionId(), command.paymentId(), command.signature())) {
            throw verificationFailed(booking, SIGNATURE_MISMATCH, command.paymentId());
        }

        Optional<GatewayPayment> payment = paymentGatewayPort.fetchPayment(command.paymentId());
        if (payment.isEmpty() || !payment.get().settles(booking)) {
            log.warn("게이트웨이 결제 불일치: bookingNumber={}, payment={}", booking.getBookingNumber(), payment);
            throw verificationFailed(booking, PAYMENT_NOT_SETTLED, command.paymentId());
        }

        return bookingWriter.confirm(booking.getId(), booking.getTransactionId(), command.paymentId(),
                payment.get().method(), LocalDateTime.now(clock));
    }

    @Override
    public Booking abandon(long userId, long bookingId) {
        Booking booking = getBooking(userId, bookingId);
        if (booking.getStatus() == BookingStatus.CANCELLED) {
            return booking;
        }
        Booking result = bookingWriter.cancel(bookingId, USER_CANCELLED, LocalDateTime.now(clock));
        if (result.getStatus() != BookingStatus.CANCELLED) {
            throw new BusinessException(ErrorCode.BOOKING_NOT_PENDING);
        }
        return result;
    }

    @Override
    public Booking getBooking(long userId, long bookingId) {
        Booking booking = bookingPort.findById(bookingId)
                .orElseThrow(() -> new BusinessException(ErrorCode.BOOKING_NOT_FOUND));
        if (!booking.isOwnedBy(userId)) {
            throw new BusinessException(ErrorCode.FORBIDDEN);
        }
        return booking;
    }

    @Override
    public List<Booking> getBookings(long userId) {
        return bookingPort.findByUserId(userId);
    }

    /**
     * 실패 상태를 먼저 커밋한 뒤 예외를 돌려준다.
     */
    private BusinessException verificationFailed(Booking booking, String reason, String paymentId) {
        log.warn("결제 검증 실패: bookingNumber={}, reason={}", booking.getBookingNumber(), reason);
        bookingWriter.fail(booking.getId(), reason, paymentId, LocalDateTime.now(clock));
        return new BusinessException(ErrorCode.PAYMENT_VERIFICATION_FAILED);
    }
}
