package kr.jemi.ticketgate.booking.application.service;

import kr.jemi.ticketgate.booking.application.port.in.ConfirmPaymentCommand;
import kr.jemi.ticketgate.booking.application.port.out.BookingPort;
import kr.jemi.ticketgate.booking.application.port.out.PaymentGatewayPort;
import kr.jemi.ticketgate.booking.domain.Booking;
import kr.jemi.ticketgate.booking.domain.BookingItem;
import kr.jemi.ticketgate.booking.domain.BookingStatus;
import kr.jemi.ticketgate.booking.domain.ContactInfo;
import kr.jemi.ticketgate.booking.domain.GatewayPayment;
import kr.jemi.ticketgate.booking.domain.GatewayPaymentStatus;
import kr.jemi.ticketgate.booking.domain.PaymentTransaction;
import kr.jemi.ticketgate.common.exception.BusinessException;
import kr.jemi.ticketgate.common.exception.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
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
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.BDDMockito.*;

@ExtendWith(MockitoExtension.class)
class CheckoutServiceTest {

    private static final ZoneId ZONE = ZoneId.of("Asia/Seoul");
    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 1, 10, 0);
    private static final long USER_ID = 100L;
    private static final long BOOKING_ID = 99L;

    @Mock
    private BookingPort bookingPort;

    @Mock
    private BookingWriter bookingWriter;

    @Mock
    private PaymentGatewayPort paymentGatewayPort;

    private final PaymentSignatureVerifier signatureVerifier = new PaymentSignatureVerifier("key-secret", "hook");

    private CheckoutService checkoutService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.atZone(ZONE).toInstant(), ZONE);
        checkoutService = new CheckoutService(bookingPort, bookingWriter, paymentGatewayPort, signatureVerifier, clock, 30L);
    }

    private static Booking pending(String transactionId, LocalDateTime pendingExpiresAt) {
        Booking booking = Booking.create(BOOKING_ID, "BK-20260301-0001", USER_ID, 10L, 7L,
                new ContactInfo("홍길동", "hong@example.com", null), "INR",
                List.of(new BookingItem(1L, 3L, "R석", null, new BigDecimal("1500"), null)),
                NOW.minusMinutes(5), pendingExpiresAt);
        if (transactionId != null) {
            booking.attachTransaction(transactionId, NOW.minusMinutes(4));
        }
        return booking;
    }

    private ConfirmPaymentCommand command(String transactionId, String paymentId) {
        return new ConfirmPaymentCommand(USER_ID, BOOKING_ID, transactionId, paymentId,
                signatureVerifier.sign("key-secret", transactionId + "|" + paymentId));
    }

    @Nested
    @DisplayName("openTransaction() - 결제 거래 개설")
    class OpenTransaction {

        @Test
        @DisplayName("저장된 금액으로 게이트웨이 거래를 만들고 예매에 연결한다")
        void shouldCreateGatewayOrder() {
            // given
            Booking booking = pending(null, NOW.plusMinutes(10));
            given(bookingPort.findById(BOOKING_ID)).willReturn(Optional.of(booking));
            given(bookingPort.claimTransactionOpening(BOOKING_ID, NOW, NOW.minusSeconds(30))).willReturn(true);
            given(paymentGatewayPort.createTransaction(eq(150000L), eq("INR"), eq("BK-20260301-0001"), anyMap()))
                    .willReturn("order_1");
            given(bookingWriter.attachTransaction(BOOKING_ID, "order_1", NOW)).willAnswer(invocation -> {
                booking.attachTransaction("order_1", NOW);
                return booking;
            });
            given(paymentGatewayPort.publicKey()).willReturn("rzp_test");

            // when
            PaymentTransaction transaction = checkoutService.openTransaction(USER_ID, BOOKING_ID);

            // then
            assertThat(transaction.transactionId()).isEqualTo("order_1");
            assertThat(transaction.amount()).isEqualTo(150000L);
            assertThat(transaction.gatewayKey()).isEqualTo("rzp_test");
        }

        @Test
        @DisplayName("이미 거래가 있으면 게이트웨이를 다시 부르지 않는다")
        void shouldReuseExistingTransaction() {
            // given
            given(bookingPort.findById(BOOKING_ID)).willReturn(Optional.of(pending("order_1", NOW.plusMinutes(10))));
            given(paymentGatewayPort.publicKey()).willReturn("rzp_test");

            // when
            PaymentTransaction transaction = checkoutService.openTransaction(USER_ID, BOOKING_ID);

            // then
            assertThat(transaction.transactionId()).isEqualTo("order_1");
            then(paymentGatewayPort).should(never()).createTransaction(anyLong(), any(), any(), any());
        }

        @Test
        @DisplayName("다른 요청이 개설을 선점했고 거래가 이미 붙었으면 그 거래를 돌려준다")
        void shouldReturnTransactionOpenedByOtherRequest() {
            // given
            given(bookingPort.findById(BOOKING_ID))
                    .willReturn(Optional.of(pending(null, NOW.plusMinutes(10))))
                    .willReturn(Optional.of(pending("order_1", NOW.plusMinutes(10))));
            given(bookingPort.claimTransactionOpening(eq(BOOKING_ID), any(), any())).willReturn(false);
            given(paymentGatewayPort.publicKey()).willReturn("rzp_test");

            // when
            PaymentTransaction transaction = checkoutService.openTransaction(USER_ID, BOOKING_ID);

            // then
            assertThat(transaction.transactionId()).isEqualTo("order_1");
            then(paymentGatewayPort).should(never()).createTransaction(anyLong(), any(), any(), any());
        }

        @Test
        @DisplayName("다른 요청이 개설 중이면 CONCURRENT_REQUEST")
        void shouldRejectWhileOtherRequestIsOpening() {
            // given
            given(bookingPort.findById(BOOKING_ID)).willReturn(Optional.of(pending(null, NOW.plusMinutes(10))));
            given(bookingPort.claimTransactionOpening(eq(BOOKING_ID), any(), any())).willReturn(false);

            // when & then
            assertThatThrownBy(() -> checkoutService.openTransaction(USER_ID, BOOKING_ID))
                    .isInstanceOfSatisfying(BusinessException.class, e ->
                            assertThat(e.getErrorCode()).isEqualTo(ErrorCode.CONCURRENT_REQUEST));
            then(paymentGatewayPort).should(never()).createTransaction(anyLong(), any(), any(), any());
        }

        @Test
        @DisplayName("게이트웨이 호출이 실패하면 선점을 풀어 재시도할 수 있게 한다")
        void shouldReleaseClaimWhenGatewayFails() {
            // given
            given(bookingPort.findById(BOOKING_ID)).willReturn(Optional.of(pending(null, NOW.plusMinutes(10))));
            given(bookingPort.claimTransactionOpening(eq(BOOKING_ID), any(), any())).willReturn(true);
            given(paymentGatewayPort.createTransaction(anyLong(), any(), any(), anyMap()))
                    .willThrow(new BusinessException(ErrorCode.GATEWAY_UNAVAILABLE));

            // when & then
            assertThatThrownBy(() -> checkoutService.openTransaction(USER_ID, BOOKING_ID))
                    .isInstanceOfSatisfying(BusinessException.class, e ->
                            assertThat(e.getErrorCode()).isEqualTo(ErrorCode.GATEWAY_UNAVAILABLE));
            then(bookingPort).should().releaseTransactionOpening(BOOKING_ID);
            then(bookingWriter).should(never()).attachTransaction(anyLong(), any(), any());
        }

        @Test
        @DisplayName("동시에 두 번 요청해도 게이트웨이 거래는 하나만 만든다")
        void shouldOpenSingleGatewayOrderUnderConcurrentRequests() throws Exception {
            // given
            AtomicBoolean claimed = new AtomicBoolean(false);
            CountDownLatch gatewayEntered = new CountDownLatch(1);
            CountDownLatch gatewayRelease = new CountDownLatch(1);
            given(bookingPort.findById(BOOKING_ID)).willAnswer(invocation -> Optional.of(pending(null, NOW.plusMinutes(10))));
            given(bookingPort.claimTransactionOpening(eq(BOOKING_ID), any(), any()))
                    .willAnswer(invocation -> claimed.compareAndSet(false, true));
            given(paymentGatewayPort.createTransaction(anyLong(), any(), any(), anyMap())).willAnswer(invocation -> {
                gatewayEntered.countDown();
                gatewayRelease.await(5, TimeUnit.SECONDS);
                return "order_1";
            });
            given(bookingWriter.attachTransaction(eq(BOOKING_ID), eq("order_1"), any()))
                    .willAnswer(invocation -> pending("order_1", NOW.plusMinutes(10)));
            given(paymentGatewayPort.publicKey()).willReturn("rzp_test");

            ExecutorService executor = Executors.newFixedThreadPool(2);
            try {
                // when
                Future<PaymentTransaction> first = executor.submit(() -> checkoutService.openTransaction(USER_ID, BOOKING_ID));
                assertThat(gatewayEntered.await(5, TimeUnit.SECONDS)).isTrue();
                Future<PaymentTransaction> second = executor.submit(() -> checkoutService.openTransaction(USER_ID, BOOKING_ID));

                // then
                assertThatThrownBy(() -> second.get(5, TimeUnit.SECONDS))
                        .hasCauseInstanceOf(BusinessException.class);
                gatewayRelease.countDown();
                assertThat(first.get(5, TimeUnit.SECONDS).transactionId()).isEqualTo("order_1");
                then(paymentGatewayPort).should(times(1)).createTransaction(anyLong(), any(), any(), anyMap());
            } finally {
                gatewayRelease.countDown();
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("결제 대기 시간이 지난 예매는 BOOKING_NOT_PENDING")
        void shouldRejectExpiredPending() {
            // given
            given(bookingPort.findById(BOOKING_ID)).willReturn(Optional.of(pending(null, NOW)));

            // when & then
            assertThatThrownBy(() -> checkoutService.openTransaction(USER_ID, BOOKING_ID))
                    .isInstanceOfSatisfying(BusinessException.class, e ->
                            assertThat(e.getErrorCode()).isEqualTo(ErrorCode.BOOKING_NOT_PENDING));
        }
    }

    @Nested
    @DisplayName("confirmPayment() - 결제 확인")
    class ConfirmPayment {

        @Test
        @DisplayName("서명과 게이트웨이 결제가 모두 맞으면 확정한다")
        void shouldConfirmVerifiedPayment() {
            // given
            Booking booking = pending("order_1", NOW.plusMinutes(10));
            given(bookingPort.findById(BOOKING_ID)).willReturn(Optional.of(booking));
            given(paymentGatewayPort.fetchPayment("pay_1")).willReturn(Optional.of(
                    new GatewayPayment("pay_1", "order_1", GatewayPaymentStatus.CAPTURED, 150000L, "upi", null)));
            given(bookingWriter.confirm(BOOKING_ID, "order_1", "pay_1", "upi", NOW)).willReturn(booking);

            // when
            checkoutService.confirmPayment(command("order_1", "pay_1"));

            // then
            then(bookingWriter).should().confirm(BOOKING_ID, "order_1", "pay_1", "upi", NOW);
            then(bookingWriter).should(never()).fail(anyLong(), any(), any(), any());
        }

        @Test
        @DisplayName("서명이 틀리면 예매를 실패 처리하고 PAYMENT_VERIFICATION_FAILED")
        void shouldFailOnBadSignature() {
            // given
            given(bookingPort.findById(BOOKING_ID)).willReturn(Optional.of(pending("order_1", NOW.plusMinutes(10))));

            // when & then
            assertThatThrownBy(() -> checkoutService.confirmPayment(
                    new ConfirmPaymentCommand(USER_ID, BOOKING_ID, "order_1", "pay_1", "forged")))
                    .isInstanceOfSatisfying(BusinessException.class, e ->
                            assertThat(e.getErrorCode()).isEqualTo(ErrorCode.PAYMENT_VERIFICATION_FAILED));
            then(bookingWriter).should().fail(BOOKING_ID, CheckoutService.SIGNATURE_MISMATCH, "pay_1", NOW);
            then(paymentGatewayPort).shouldHaveNoInteractions();
        }

        @Test
        @DisplayName("다른 거래 id 로 확인을 요청하면 실패 처리한다")
        void shouldFailOnTransactionMismatch() {
            // given
            given(bookingPort.findById(BOOKING_ID)).willReturn(Optional.of(pending("order_1", NOW.plusMinutes(10))));

            // when & then
            assertThatThrownBy(() -> checkoutService.confirmPayment(command("order_x", "pay_1")))
                    .isInstanceOfSatisfying(BusinessException.class, e ->
                            assertThat(e.getErrorCode()).isEqualTo(ErrorCode.PAYMENT_VERIFICATION_FAILED));
            then(bookingWriter).should().fail(BOOKING_ID, CheckoutService.TRANSACTION_MISMATCH, "pay_1", NOW);
        }

        @Test
        @DisplayName("게이트웨이 금액이 다르면 실패 처리한다")
        void shouldFailWhenAmountDiffers() {
            // given
            given(bookingPort.findById(BOOKING_ID)).willReturn(Optional.of(pending("order_1", NOW.plusMinutes(10))));
            given(paymentGatewayPort.fetchPayment("pay_1")).willReturn(Optional.of(
                    new GatewayPayment("pay_1", "order_1", GatewayPaymentStatus.CAPTURED, 100L, "upi", null)));

            // when & then
            assertThatThrownBy(() -> checkoutService.confirmPayment(command("order_1", "pay_1")))
                    .isInstanceOfSatisfying(BusinessException.class, e ->
                            assertThat(e.getErrorCode()).isEqualTo(ErrorCode.PAYMENT_VERIFICATION_FAILED));
            then(bookingWriter).should().fail(BOOKING_ID, CheckoutService.PAYMENT_NOT_SETTLED, "pay_1", NOW);
        }

        @Test
        @DisplayName("같은 거래로 이미 확정된 예매는 그대로 돌려준다")
        void shouldBeIdempotentForConfirmed() {
            // given
            Booking booking = pending("order_1", NOW.plusMinutes(10));
            booking.confirm("pay_1", "upi", () -> "TKT-1", NOW);
            given(bookingPort.findById(BOOKING_ID)).willReturn(Optional.of(booking));

            // when
            Booking result = checkoutService.confirmPayment(command("order_1", "pay_1"));

            // then
            assertThat(result.getStatus()).isEqualTo(BookingStatus.CONFIRMED);
            then(bookingWriter).shouldHaveNoInteractions();
            then(paymentGatewayPort).shouldHaveNoInteractions();
        }

        @Test
        @DisplayName("이미 취소된 예매는 TRANSACTION_ALREADY_RESOLVED")
        void shouldRejectCancelled() {
            // given
            Booking booking = pending("order_1", NOW.plusMinutes(10));
            booking.cancel("USER_CANCELLED", NOW);
            given(bookingPort.findById(BOOKING_ID)).willReturn(Optional.of(booking));

            // when & then
            assertThatThrownBy(() -> checkoutService.confirmPayment(command("order_1", "pay_1")))
                    .isInstanceOfSatisfying(BusinessException.class, e ->
                            assertThat(e.getErrorCode()).isEqualTo(ErrorCode.TRANSACTION_ALREADY_RESOLVED));
        }

        @Test
        @DisplayName("다른 사용자의 예매는 FORBIDDEN")
        void shouldRejectOtherUser() {
            // given
            given(bookingPort.findById(BOOKING_ID)).willReturn(Optional.of(pending("order_1", NOW.plusMinutes(10))));

            // when & then
            assertThatThrownBy(() -> checkoutService.confirmPayment(
                    new ConfirmPaymentCommand(999L, BOOKING_ID, "order_1", "pay_1", "sig")))
                    .isInstanceOfSatisfying(BusinessException.class, e ->
                            assertThat(e.getErrorCode()).isEqualTo(ErrorCode.FORBIDDEN));
        }
    }

    @Nested
    @DisplayName("abandon() - 결제 포기")
    class Abandon {

        @Test
        @DisplayName("확정된 예매는 포기할 수 없다")
        void shouldRejectConfirmed() {
            // given
            Booking booking = pending("order_1", NOW.plusMinutes(10));
            booking.confirm("pay_1", "upi", () -> "TKT-1", NOW);
            given(bookingPort.findById(BOOKING_ID)).willReturn(Optional.of(booking));
            given(bookingWriter.cancel(BOOKING_ID, CheckoutService.USER_CANCELLED, NOW)).willReturn(booking);

            // when & then
            assertThatThrownBy(() -> checkoutService.abandon(USER_ID, BOOKING_ID))
                    .isInstanceOfSatisfying(BusinessException.class, e ->
                            assertThat(e.getErrorCode()).isEqualTo(ErrorCode.BOOKING_NOT_PENDING));
        }

        @Test
        @DisplayName("이미 취소된 예매는 다시 취소하지 않고 돌려준다")
        void shouldBeIdempotentForCancelled() {
            // given
            Booking booking = pending(null, NOW.plusMinutes(10));
            booking.cancel("USER_CANCELLED", NOW);
            given(bookingPort.findById(BOOKING_ID)).willReturn(Optional.of(booking));

            // when
            Booking result = checkoutService.abandon(USER_ID, BOOKING_ID);

            // then
            assertThat(result.getStatus()).isEqualTo(BookingStatus.CANCELLED);
            then(bookingWriter).shouldHaveNoInteractions();
        }
    }
}
