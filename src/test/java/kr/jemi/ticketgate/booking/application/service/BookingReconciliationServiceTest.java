package kr.jemi.ticketgate.booking.application.service;

import kr.jemi.ticketgate.booking.application.port.out.BookingPort;
import kr.jemi.ticketgate.booking.application.port.out.PaymentGatewayPort;
import kr.jemi.ticketgate.booking.domain.Booking;
import kr.jemi.ticketgate.booking.domain.BookingItem;
import kr.jemi.ticketgate.booking.domain.ContactInfo;
import kr.jemi.ticketgate.booking.domain.GatewayPayment;
import kr.jemi.ticketgate.booking.domain.GatewayPaymentStatus;
import kr.jemi.ticketgate.common.exception.BusinessException;
import kr.jemi.ticketgate.common.exception.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.BDDMockito.*;

@ExtendWith(MockitoExtension.class)
class BookingReconciliationServiceTest {

    private static final ZoneId ZONE = ZoneId.of("Asia/Seoul");
    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 1, 10, 0);

    @Mock
    private BookingPort bookingPort;

    @Mock
    private BookingWriter bookingWriter;

    @Mock
    private PaymentGatewayPort paymentGatewayPort;

    private BookingReconciliationService reconciliationService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.atZone(ZONE).toInstant(), ZONE);
        reconciliationService = new BookingReconciliationService(bookingPort, bookingWriter, paymentGatewayPort,
                clock, 2, 200);
    }

    private static Booking pending(long id) {
        Booking booking = Booking.create(id, "BK-20260301-" + id, 100L, 10L, 7L,
                new ContactInfo("홍길동", "hong@example.com", null), "INR",
                List.of(new BookingItem(1L, 3L, "R석", null, new BigDecimal("1500"), null)),
                NOW.minusMinutes(10), NOW.plusMinutes(5));
        booking.attachTransaction("order_" + id, NOW.minusMinutes(9));
        return booking;
    }

    private static Booking withStatus(Booking booking, boolean confirm) {
        if (confirm) {
            booking.confirm("pay", "card", () -> "TKT-" + booking.getId(), NOW);
        } else {
            booking.cancel(BookingReconciliationService.PAYMENT_TIMEOUT, NOW);
        }
        return booking;
    }

    @Test
    @DisplayName("게이트웨이에서 결제된 예매는 확정으로 복구한다")
    void shouldConfirmSettledPayment() {
        // given
        Booking booking = pending(1L);
        given(bookingPort.findPendingWithTransactionBefore(NOW.minusMinutes(2), 200)).willReturn(List.of(1L));
        given(bookingPort.findById(1L)).willReturn(Optional.of(booking));
        given(paymentGatewayPort.findPayments("order_1")).willReturn(List.of(
                new GatewayPayment("pay_0", "order_1", GatewayPaymentStatus.FAILED, 150000L, "card", "X"),
                new GatewayPayment("pay_1", "order_1", GatewayPaymentStatus.CAPTURED, 150000L, "card", null)));
        given(bookingWriter.confirm(1L, "order_1", "pay_1", "card", NOW)).willReturn(withStatus(pending(1L), true));
        given(bookingPort.findPendingExpired(NOW, 200)).willReturn(List.of());

        // when
        int resolved = reconciliationService.reconcile();

        // then
        assertThat(resolved).isEqualTo(1);
    }

    @Test
    @DisplayName("결제 기록이 없으면 확정하지 않고 넘어간다")
    void shouldSkipUnpaid() {
        // given
        given(bookingPort.findPendingWithTransactionBefore(NOW.minusMinutes(2), 200)).willReturn(List.of(1L));
        given(bookingPort.findById(1L)).willReturn(Optional.of(pending(1L)));
        given(paymentGatewayPort.findPayments("order_1")).willReturn(List.of());
        given(bookingPort.findPendingExpired(NOW, 200)).willReturn(List.of());

        // when
        int resolved = reconciliationService.reconcile();

        // then
        assertThat(resolved).isZero();
        then(bookingWriter).should(never()).confirm(anyLong(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("제한 시간이 지난 예매는 미결제를 확인한 뒤 취소하고, 다른 예매의 게이트웨이 장애는 처리를 막지 않는다")
    void shouldCancelExpiredEvenWhenGatewayFails() {
        // given
        given(bookingPort.findPendingWithTransactionBefore(NOW.minusMinutes(2), 200)).willReturn(List.of(1L));
        given(bookingPort.findById(1L)).willReturn(Optional.of(pending(1L)));
        given(paymentGatewayPort.findPayments("order_1"))
                .willThrow(new BusinessException(ErrorCode.GATEWAY_UNAVAILABLE));
        given(bookingPort.findPendingExpired(NOW, 200)).willReturn(List.of(2L, 3L));
        given(bookingPort.findById(2L)).willReturn(Optional.of(pending(2L)));
        given(bookingPort.findById(3L)).willReturn(Optional.of(pending(3L)));
        given(paymentGatewayPort.findPayments("order_2")).willReturn(List.of());
        given(paymentGatewayPort.findPayments("order_3")).willReturn(List.of());
        given(bookingWriter.cancel(2L, BookingReconciliationService.PAYMENT_TIMEOUT, NOW))
                .willReturn(withStatus(pending(2L), false));
        given(bookingWriter.cancel(3L, BookingReconciliationService.PAYMENT_TIMEOUT, NOW))
                .willReturn(withStatus(pending(3L), true));

        // when
        int resolved = reconciliationService.reconcile();

        // then
        assertThat(resolved).isEqualTo(1);
    }

    @Test
    @DisplayName("게이트웨이 조회가 실패한 예매는 제한 시간이 지났어도 이번 회차에 취소하지 않는다")
    void shouldNotCancelWhenGatewayStateUnknown() {
        // given
        given(bookingPort.findPendingWithTransactionBefore(NOW.minusMinutes(2), 200)).willReturn(List.of(1L));
        given(bookingPort.findById(1L)).willReturn(Optional.of(pending(1L)));
        given(paymentGatewayPort.findPayments("order_1"))
                .willThrow(new BusinessException(ErrorCode.GATEWAY_UNAVAILABLE));
        given(bookingPort.findPendingExpired(NOW, 200)).willReturn(List.of(1L));

        // when
        int resolved = reconciliationService.reconcile();

        // then
        assertThat(resolved).isZero();
        then(bookingWriter).should(never()).cancel(anyLong(), any(), any());
        then(paymentGatewayPort).should(times(1)).findPayments("order_1");
    }

    @Test
    @DisplayName("유예 조회 대상이 아니었던 만료 예매도 게이트웨이가 응답하지 않으면 취소를 보류한다")
    void shouldHoldCancelWhenExpiredCheckFails() {
        // given
        given(bookingPort.findPendingWithTransactionBefore(NOW.minusMinutes(2), 200)).willReturn(List.of());
        given(bookingPort.findPendingExpired(NOW, 200)).willReturn(List.of(4L));
        given(bookingPort.findById(4L)).willReturn(Optional.of(pending(4L)));
        given(paymentGatewayPort.findPayments("order_4"))
                .willThrow(new BusinessException(ErrorCode.GATEWAY_UNAVAILABLE));

        // when
        int resolved = reconciliationService.reconcile();

        // then
        assertThat(resolved).isZero();
        then(bookingWriter).should(never()).cancel(anyLong(), any(), any());
    }

    @Test
    @DisplayName("만료 직전에 결제된 예매는 취소 대신 확정한다")
    void shouldConfirmExpiredBookingPaidAtGateway() {
        // given
        given(bookingPort.findPendingWithTransactionBefore(NOW.minusMinutes(2), 200)).willReturn(List.of());
        given(bookingPort.findPendingExpired(NOW, 200)).willReturn(List.of(5L));
        given(bookingPort.findById(5L)).willReturn(Optional.of(pending(5L)));
        given(paymentGatewayPort.findPayments("order_5")).willReturn(List.of(
                new GatewayPayment("pay_5", "order_5", GatewayPaymentStatus.CAPTURED, 150000L, "card", null)));
        given(bookingWriter.confirm(5L, "order_5", "pay_5", "card", NOW)).willReturn(withStatus(pending(5L), true));

        // when
        int resolved = reconciliationService.reconcile();

        // then
        assertThat(resolved).isEqualTo(1);
        then(bookingWriter).should(never()).cancel(anyLong(), any(), any());
    }

    @Test
    @DisplayName("거래를 열지 않은 만료 예매는 게이트웨이에 묻지 않고 취소한다")
    void shouldCancelExpiredWithoutTransaction() {
        // given
        Booking booking = Booking.create(6L, "BK-20260301-6", 100L, 10L, 7L,
                new ContactInfo("홍길동", "hong@example.com", null), "INR",
                List.of(new BookingItem(1L, 3L, "R석", null, new BigDecimal("1500"), null)),
                NOW.minusMinutes(20), NOW);
        given(bookingPort.findPendingWithTransactionBefore(NOW.minusMinutes(2), 200)).willReturn(List.of());
        given(bookingPort.findPendingExpired(NOW, 200)).willReturn(List.of(6L));
        given(bookingPort.findById(6L)).willReturn(Optional.of(booking));
        given(bookingWriter.cancel(6L, BookingReconciliationService.PAYMENT_TIMEOUT, NOW))
                .willReturn(withStatus(pending(6L), false));

        // when
        int resolved = reconciliationService.reconcile();

        // then
        assertThat(resolved).isEqualTo(1);
        then(paymentGatewayPort).shouldHaveNoInteractions();
    }
}
