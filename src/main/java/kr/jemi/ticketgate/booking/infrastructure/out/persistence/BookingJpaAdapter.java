package kr.jemi.ticketgate.booking.infrastructure.out.persistence;

import kr.jemi.ticketgate.booking.application.port.out.BookingPort;
import kr.jemi.ticketgate.booking.domain.Booking;
import kr.jemi.ticketgate.booking.domain.BookingItem;
import kr.jemi.ticketgate.booking.domain.BookingStatus;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Component
public class BookingJpaAdapter implements BookingPort {

    private final BookingJpaRepository bookingJpaRepository;
    private final BookingItemJpaRepository bookingItemJpaRepository;

    public BookingJpaAdapter(BookingJpaRepository bookingJpaRepository,
                             BookingItemJpaRepository bookingItemJpaRepository) {
        this.bookingJpaRepository = bookingJpaRepository;
        this.bookingItemJpaRepository = bookingItemJpaRepository;
    }

    @Override
    public Booking insert(Booking booking) {
        return save(booking);
    }

    /**
     * 항목은 생성 후 티켓 번호만 바뀌므로 항상 전체를 다시 쓴다.
     */
    @Override
    public Booking save(Booking booking) {
        bookingJpaRepository.save(BookingJpaEntity.fromDomain(booking));
        bookingItemJpaRepository.saveAll(booking.getItems().stream()
                .map(item -> BookingItemJpaEntity.fromDomain(booking.getId(), item))
                .toList());
        bookingJpaRepository.flush();
        return booking;
    }

    @Override
    public Optional<Booking> findById(long bookingId) {
        return bookingJpaRepository.findById(bookingId).map(this::toDomain);
    }

    @Override
    public Optional<Booking> findByIdForUpdate(long bookingId) {
        return bookingJpaRepository.findByIdForUpdate(bookingId).map(this::toDomain);
    }

    @Override
    public Optional<Booking> findByTransactionId(String transactionId) {
        return bookingJpaRepository.findByTransactionId(transactionId).map(this::toDomain);
    }

    @Override
    public boolean claimTransactionOpening(long bookingId, LocalDateTime now, LocalDateTime staleBefore) {
        return bookingJpaRepository.claimTransactionOpening(bookingId, BookingStatus.PENDING, now, staleBefore) == 1;
    }

    @Override
    public void releaseTransactionOpening(long bookingId) {
        bookingJpaRepository.releaseTransactionOpening(bookingId);
    }

    @Override
    public List<Booking> findByUserId(long userId) {
        List<BookingJpaEntity> bookings = bookingJpaRepository.findByUserIdOrderByCreatedAtDesc(userId);
        if (bookings.isEmpty()) {
            return List.of();
        }
        Map<Long, List<BookingItem>> items = bookingItemJpaRepository.findByBookingIdInOrderByIdAsc(
                        bookings.stream().map(BookingJpaEntity::getId).toList()).stream()
                .collect(Collectors.groupingBy(BookingItemJpaEntity::getBookingId,
                        Collectors.mapping(BookingItemJpaEntity::toDomain, Collectors.toList())));
        return bookings.stream()
                .map(booking -> booking.toDomain(items.getOrDefault(booking.getId(), List.of())))
                .toList();
    }

    @Override
    public List<Long> findPendingWithTransactionBefore(LocalDateTime threshold, int limit) {
        return bookingJpaRepository.findPendingWithTransactionBefore(BookingStatus.PENDING, threshold,
                PageRequest.of(0, limit));
    }

    @Override
    public List<Long> findPendingExpired(LocalDateTime now, int limit) {
        return bookingJpaRepository.findPendingExpired(BookingStatus.PENDING, now, PageRequest.of(0, limit));
    }

    private Booking toDomain(BookingJpaEntity entity) {
        return entity.toDomain(bookingItemJpaRepository.findByBookingIdOrderByIdAsc(entity.getId()).stream()
                .map(BookingItemJpaEntity::toDomain)
                .toList());
    }
}
