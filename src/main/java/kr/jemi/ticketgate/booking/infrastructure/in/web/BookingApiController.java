package kr.jemi.ticketgate.booking.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import kr.jemi.ticketgate.booking.application.port.in.AbandonBookingUseCase;
import kr.jemi.ticketgate.booking.application.port.in.BeginCheckoutUseCase;
import kr.jemi.ticketgate.booking.application.port.in.ConfirmPaymentUseCase;
import kr.jemi.ticketgate.booking.application.port.in.GetBookingUseCase;
import kr.jemi.ticketgate.booking.application.port.in.OpenPaymentTransactionUseCase;
import kr.jemi.ticketgate.booking.infrastructure.in.web.dto.BeginCheckoutRequest;
import kr.jemi.ticketgate.booking.infrastructure.in.web.dto.BookingResponse;
import kr.jemi.ticketgate.booking.infrastructure.in.web.dto.ConfirmPaymentRequest;
import kr.jemi.ticketgate.booking.infrastructure.in.web.dto.PaymentTransactionResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Tag(name = "Booking", description = "결제 진행과 예매 조회")
@RestController
public class BookingApiController {

    private final BeginCheckoutUseCase beginCheckoutUseCase;
    private final OpenPaymentTransactionUseCase openPaymentTransactionUseCase;
    private final ConfirmPaymentUseCase confirmPaymentUseCase;
    private final AbandonBookingUseCase abandonBookingUseCase;
    private final GetBookingUseCase getBookingUseCase;

    public BookingApiController(BeginCheckoutUseCase beginCheckoutUseCase,
                                OpenPaymentTransactionUseCase openPaymentTransactionUseCase,
                                ConfirmPaymentUseCase confirmPaymentUseCase,
                                AbandonBookingUseCase abandonBookingUseCase,
                                GetBookingUseCase getBookingUseCase) {
        this.beginCheckoutUseCase = beginCheckoutUseCase;
        this.openPaymentTransactionUseCase = openPaymentTransactionUseCase;
        this.confirmPaymentUseCase = confirmPaymentUseCase;
        this.abandonBookingUseCase = abandonBookingUseCase;
        this.getBookingUseCase = getBookingUseCase;
    }

    @Operation(summary = "결제 시작", description = "장바구니를 점검하고 결제 대기 예매를 만듭니다.")
    @PostMapping("/api/carts/{cartId}/checkout")
    public ResponseEntity<BookingResponse> beginCheckout(
            @PathVariable long cartId,
            @Parameter(description = "사용자 ID") @RequestHeader("X-User-Id") long userId,
            @Valid @RequestBody BeginCheckoutRequest request) {
        BookingResponse response = BookingResponse.from(
                beginCheckoutUseCase.beginCheckout(request.toCommand(userId, cartId)));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "결제 거래 개설", description = "게이트웨이 거래를 엽니다. 다시 호출하면 같은 거래를 돌려줍니다.")
    @PostMapping("/api/bookings/{bookingId}/payment-transaction")
    public ResponseEntity<PaymentTransactionResponse> openTransaction(
            @PathVariable long bookingId,
            @Parameter(description = "사용자 ID") @RequestHeader("X-User-Id") long userId) {
        return ResponseEntity.ok(PaymentTransactionResponse.from(
                openPaymentTransactionUseCase.openTransaction(userId, bookingId)));
    }

    @Operation(summary = "결제 확인", description = "게이트웨이 서명과 결제 금액을 검증하고 예매를 확정합니다.")
    @PostMapping("/api/bookings/{bookingId}/payment-confirmation")
    public ResponseEntity<BookingResponse> confirmPayment(
            @PathVariable long bookingId,
            @Parameter(description = "사용자 ID") @RequestHeader("X-User-Id") long userId,
            @Valid @RequestBody ConfirmPaymentRequest request) {
        return ResponseEntity.ok(BookingResponse.from(
                confirmPaymentUseCase.confirmPayment(request.toCommand(userId, bookingId))));
    }

    @Operation(summary = "결제 포기", description = "결제창을 닫은 경우 호출합니다. 선점한 좌석을 모두 반납합니다.")
    @PostMapping("/api/bookings/{bookingId}/cancel")
    public ResponseEntity<BookingResponse> abandon(
            @PathVariable long bookingId,
            @Parameter(description = "사용자 ID") @RequestHeader("X-User-Id") long userId) {
        return ResponseEntity.ok(BookingResponse.from(abandonBookingUseCase.abandon(userId, bookingId)));
    }

    @GetMapping("/api/bookings/{bookingId}")
    public ResponseEntity<BookingResponse> getBooking(
            @PathVariable long bookingId,
            @Parameter(description = "사용자 ID") @RequestHeader("X-User-Id") long userId) {
        return ResponseEntity.ok(BookingResponse.from(getBookingUseCase.getBooking(userId, bookingId)));
    }

    @Operation(summary = "내 예매 목록", description = "최신순으로 조회합니다.")
    @GetMapping("/api/bookings")
    public ResponseEntity<List<BookingResponse>> getBookings(
            @Parameter(description = "사용자 ID") @RequestHeader("X-User-Id") long userId) {
        return ResponseEntity.ok(getBookingUseCase.getBookings(userId).stream()
                .map(BookingResponse::from)
                .toList());
    }
}
