package kr.jemi.ticketgate.booking.application.service;

import kr.jemi.ticketgate.booking.application.port.in.ReconcileBookingsUseCase;
import kr.jemi.ticketgate.booking.application.port.out.BookingPort;
import kr.jemi.ticketgate.booking.application.port.out.PaymentGatewayPort;
import kr.jemi.ticketgate.booking.domain.Booking;
import kr.jemi.ticketgate.booking.domain.BookingStatus;
import kr.jemi.ticketgate.booking.domain.GatewayPayment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 결제 확인이 도착하지 않은 PENDING 예매를 정리한다.
 * 유예 시간이 지나면 게이트웨이에 결제 여부를 묻고, 제한 시간이 지나면 미결제를 확인한 뒤 취소한다.
 * 게이트웨이 상태를 알 수 없는 예매는 다음 회차로 넘긴다.
 */
@Service
public class BookingReconciliationService implements ReconcileBookingsUseCase {

    private static final Logger log = LoggerFactory.getLogger(BookingReconciliationService.class);

    static final String PAYMENT_TIMEOUT = "PAYMENT_TIMEOUT";

    private final BookingPort bookingPort;
    private final BookingWriter bookingWriter;
    private final PaymentGatewayPort paymentGatewayPort;
    private final Clock clock;
    private final int graceMinutes;
    private final int batchSize;

    public BookingReconciliationService(BookingPort bookingPort,
                                        BookingWriter bookingWriter,
                                        PaymentGatewayPort paymentGatewayPort,
                                        Clock clock,
                                        @Value("${ticketgate.booking.reconcile-grace-minutes}") int graceMinutes,
                                        @Value("${ticketgate.booking.reconcile-batch-size}") int batchSize) {
        this.bookingPort = bookingPort;
        this.bookingWriter = bookingWriter;
        this.paymentGatewayPort = paymentGatewayPort;
        this.clock = clock;
        this.graceMinutes = graceMinutes;
        this.batchSize = batchSize;
    }

    @Override
    public int reconcile() {
        LocalDateTime now = LocalDateTime.now(clock);
        int resolved = 0;
        Set<Long> checked = new HashSet<>();
        Set<Long> unknown = new HashSet<>();

        // 1. 게이트웨이에서는 결제됐는데 확인 호출이 오지 않은 건
        for (Long bookingId : bookingPort.findPendingWithTransactionBefore(now.minusMinutes(graceMinutes), batchSize)) {
            try {
                if (checkGateway(bookingId, now) == GatewayCheck.CONFIRMED) {
                    resolved++;
                }
                checked.add(bookingId);
            } catch (Exception e) {
                unknown.add(bookingId);
                log.warn("게이트웨이 대사 실패: bookingId={}, error={}", bookingId, e.getMessage());
            }
        }

        // 2. 제한 시간을 넘긴 건은 결제되지 않았음을 확인한 뒤에만 취소하고 선점을 반납
        for (Long bookingId : bookingPort.findPendingExpired(now, batchSize)) {
            if (unknown.contains(bookingId)) {
                log.warn("게이트웨이 결제 상태를 알 수 없어 취소 보류: bookingId={}", bookingId);
                continue;
            }
            try {
                if (!checked.contains(bookingId)) {
                    GatewayCheck check = checkGateway(bookingId, now);
                    if (check == GatewayCheck.CONFIRMED) {
                        resolved++;
                    }
                    if (check != GatewayCheck.UNPAID) {
                        continue;
                    }
                }
            } catch (Exception e) {
                log.warn("게이트웨이 결제 상태를 알 수 없어 취소 보류: bookingId={}, error={}", bookingId, e.getMessage());
                continue;
            }
            try {
                Booking booking = bookingWriter.cancel(bookingId, PAYMENT_TIMEOUT, now);
                if (booking.getStatus() == BookingStatus.CANCELLED) {
                    resolved++;
                }
            } catch (Exception e) {
                log.error("결제 대기 만료 취소 실패: bookingId={}", bookingId, e);
            }
        }

        if (resolved > 0) {
            log.info("결제 대사 처리: {}건", resolved);
        }
        return resolved;
    }

    /**
     * 게이트웨이에 결제 여부를 묻고, 결제된 건이면 확정한다. 거래가 없는 예매는 결제될 수 없으므로 묻지 않는다.
     */
    private GatewayCheck checkGateway(long bookingId, LocalDateTime now) {
        Optional<Booking> found = bookingPort.findById(bookingId).filter(Booking::isPending);
        if (found.isEmpty()) {
            return GatewayCheck.NOT_PENDING;
        }
        Booking booking = found.get();
        if (!booking.hasTransaction()) {
            return GatewayCheck.UNPAID;
        }
        List<GatewayPayment> payments = paymentGatewayPort.findPayments(booking.getTransactionId());
        Optional<GatewayPayment> settled = payments.stream().filter(payment -> payment.settles(booking)).findFirst();
        if (settled.isEmpty()) {
            log.debug("결제 대기 중: bookingNumber={}, payments={}", booking.getBookingNumber(), payments.size());
            return GatewayCheck.UNPAID;
        }

        GatewayPayment payment = settled.get();
        log.info("결제 불일치 복구 - 확정 처리: bookingNumber={}, paymentId={}",
                booking.getBookingNumber(), payment.paymentId());
        Booking confirmed = bookingWriter.confirm(bookingId, payment.transactionId(), payment.paymentId(),
                payment.method(), now);
        return confirmed.getStatus() == BookingStatus.CONFIRMED ? GatewayCheck.CONFIRMED : GatewayCheck.NOT_PENDING;
    }

    private enum GatewayCheck {
        CONFIRMED, UNPAID, NOT_PENDING
    }
}
