package kr.jemi.ticketgate.booking.application.service;

import kr.jemi.ticketgate.booking.application.port.out.BookingInventoryPort;
import kr.jemi.ticketgate.booking.application.port.out.BookingPort;
import kr.jemi.ticketgate.booking.application.port.out.CheckoutCartPort;
import kr.jemi.ticketgate.booking.application.port.out.QueueCompletionPort;
import kr.jemi.ticketgate.booking.domain.Booking;
import kr.jemi.ticketgate.booking.domain.BookingItem;
import kr.jemi.ticketgate.booking.domain.CheckoutLine;
import kr.jemi.ticketgate.booking.domain.CheckoutSnapshot;
import kr.jemi.ticketgate.booking.domain.ContactInfo;
import kr.jemi.ticketgate.booking.event.BookingConfirmedEvent;
import kr.jemi.ticketgate.booking.event.BookingReleasedEvent;
import kr.jemi.ticketgate.common.exception.BusinessException;
import kr.jemi.ticketgate.common.exception.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 예매 상태 전이와 재고 정산을 한 트랜잭션으로 묶는다. 외부 호출은 여기서 하지 않는다.
 */
@Service
public class BookingWriter {

    private static final Logger log = LoggerFactory.getLogger(BookingWriter.class);

    private final BookingPort bookingPort;
    private final CheckoutCartPort checkoutCartPort;
    private final BookingInventoryPort bookingInventoryPort;
    private final QueueCompletionPort queueCompletionPort;
    private final BookingNumberGenerator numberGenerator;
    private final ApplicationEventPublisher eventPublisher;
    private final int pendingTimeoutMinutes;
    private final String currency;

    public BookingWriter(BookingPort bookingPort,
                         CheckoutCartPort checkoutCartPort,
                         BookingInventoryPort bookingInventoryPort,
                         QueueCompletionPort queueCompletionPort,
                         BookingNumberGenerator numberGenerator,
                         ApplicationEventPublisher eventPublisher,
                         @Value("${ticketgate.booking.pending-timeout-minutes}") int pendingTimeoutMinutes,
                         @Value("${ticketgate.payment.currency}") String currency) {
        this.bookingPort = bookingPort;
        this.checkoutCartPort = checkoutCartPort;
        this.bookingInventoryPort = bookingInventoryPort;
        this.queueCompletionPort = queueCompletionPort;
        this.numberGenerator = numberGenerator;
        this.eventPublisher = eventPublisher;
        this.pendingTimeoutMinutes = pendingTimeoutMinutes;
        this.currency = currency;
    }

    /**
     * 장바구니 전환, 예매 생성, 선점 이관을 한 번에 한다. 하나라도 실패하면 장바구니는 그대로 남는다.
     */
    @Transactional
    public Booking create(long userId, long cartId, ContactInfo contact, LocalDateTime now) {
        long bookingId = numberGenerator.nextId();
        CheckoutSnapshot snapshot = checkoutCartPort.convert(userId, cartId, bookingId);

        LocalDateTime pendingExpiresAt = now.plusMinutes(pendingTimeoutMinutes);
        Booking booking = Booking.create(bookingId, numberGenerator.bookingNumber(now), userId,
                snapshot.eventId(), cartId, contact, currency, toItems(snapshot), now, pendingExpiresAt);

        int transferred = bookingInventoryPort.transferFromCart(cartId, bookingId, pendingExpiresAt);
        if (transferred != snapshot.lines().size()) {
            throw new IllegalStateException("선점 이관 수 불일치: cartId=" + cartId
                    + ", lines=" + snapshot.lines().size() + ", transferred=" + transferred);
        }

        Booking saved = bookingPort.insert(booking);
        log.info("예매 생성: bookingNumber={}, userId={}, tickets={}, amount={}",
                saved.getBookingNumber(), userId, saved.ticketCount(), saved.getFinalAmount());
        return saved;
    }

    /**
     * 동시에 두 거래가 열렸다면 먼저 붙은 거래를 유지한다.
     */
    @Transactional
    public Booking attachTransaction(long bookingId, String transactionId, LocalDateTime now) {
        Booking booking = lock(bookingId);
        if (booking.hasTransaction()) {
            log.warn("이미 거래가 연결된 예매: bookingNumber={}, kept={}, dropped={}",
                    booking.getBookingNumber(), booking.getTransactionId(), transactionId);
            return booking;
        }
        if (!booking.isPending()) {
            throw new BusinessException(ErrorCode.BOOKING_NOT_PENDING);
        }
        booking.attachTransaction(transactionId, now);
        return bookingPort.save(booking);
    }

    /**
     * 같은 거래로 이미 확정된 예매는 그대로 돌려준다. 티켓은 한 번만 발급된다.
     */
    @Transactional
    public Booking confirm(long bookingId, String transactionId, String paymentId, String paymentMethod,
                           LocalDateTime now) {
        Booking booking = lock(bookingId);
        if (booking.isConfirmedBy(transactionId)) {
            return booking;
        }
        if (!booking.isPending()) {
            throw new BusinessException(ErrorCode.TRANSACTION_ALREADY_RESOLVED);
        }

        bookingInventoryPort.sell(bookingId);
        booking.confirm(paymentId, paymentMethod, numberGenerator::ticketNumber, now);
        Booking saved = bookingPort.save(booking);
        queueCompletionPort.complete(saved.getEventId(), saved.getUserId());

        log.info("예매 확정: bookingNumber={}, paymentId={}", saved.getBookingNumber(), paymentId);
        eventPublisher.publishEvent(new BookingConfirmedEvent(saved.getId(), saved.getBookingNumber(),
                saved.getUserId(), saved.getEventId(), saved.ticketCount()));
        return saved;
    }

    /**
     * PENDING 이 아니면 아무 것도 하지 않는다.
     */
    @Transactional
    public Booking fail(long bookingId, String reason, String paymentId, LocalDateTime now) {
        Booking booking = lock(bookingId);
        if (!booking.isPending()) {
            return booking;
        }
        bookingInventoryPort.release(bookingId);
        booking.fail(reason, paymentId, now);
        return released(bookingPort.save(booking), reason);
    }

    /**
     * PENDING 이 아니면 아무 것도 하지 않는다.
     */
    @Transactional
    public Booking cancel(long bookingId, String reason, LocalDateTime now) {
        Booking booking = lock(bookingId);
        if (!booking.isPending()) {
            return booking;
        }
        bookingInventoryPort.release(bookingId);
        booking.cancel(reason, now);
        return released(bookingPort.save(booking), reason);
    }

    private Booking released(Booking booking, String reason) {
        log.info("예매 종료: bookingNumber={}, status={}, reason={}",
                booking.getBookingNumber(), booking.getStatus(), reason);
        eventPublisher.publishEvent(new BookingReleasedEvent(booking.getId(), booking.getBookingNumber(),
                booking.getUserId(), booking.getEventId(), booking.getStatus().name(), reason));
        return booking;
    }

    private Booking lock(long bookingId) {
        return bookingPort.findByIdForUpdate(bookingId)
                .orElseThrow(() -> new BusinessException(ErrorCode.BOOKING_NOT_FOUND));
    }

    private List<BookingItem> toItems(CheckoutSnapshot snapshot) {
        List<BookingItem> items = new ArrayList<>();
        for (CheckoutLine line : snapshot.lines()) {
            if (line.seatIds().isEmpty()) {
                for (int i = 0; i < line.quantity(); i++) {
                    items.add(new BookingItem(numberGenerator.nextId(), line.categoryId(), line.categoryName(),
                            null, line.unitPrice(), null));
                }
            } else {
                for (Long seatId : line.seatIds()) {
                    items.add(new BookingItem(numberGenerator.nextId(), line.categoryId(), line.categoryName(),
                            seatId, line.unitPrice(), null));
                }
            }
        }
        return items;
    }
}
