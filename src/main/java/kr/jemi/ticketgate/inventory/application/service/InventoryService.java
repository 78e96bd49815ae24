package kr.jemi.ticketgate.inventory.application.service;

import io.hypersistence.tsid.TSID;
import kr.jemi.ticketgate.common.exception.BusinessException;
import kr.jemi.ticketgate.common.exception.ErrorCode;
import kr.jemi.ticketgate.inventory.api.CategorySnapshot;
import kr.jemi.ticketgate.inventory.api.HoldRequest;
import kr.jemi.ticketgate.inventory.api.HoldView;
import kr.jemi.ticketgate.inventory.api.InventoryFacade;
import kr.jemi.ticketgate.inventory.application.port.in.GetCategoriesUseCase;
import kr.jemi.ticketgate.inventory.application.port.out.CategoryCounterPort;
import kr.jemi.ticketgate.inventory.application.port.out.InventoryHoldPort;
import kr.jemi.ticketgate.inventory.application.port.out.SeatPort;
import kr.jemi.ticketgate.inventory.domain.HoldOwner;
import kr.jemi.ticketgate.inventory.domain.InventoryHold;
import kr.jemi.ticketgate.inventory.domain.Seat;
import kr.jemi.ticketgate.inventory.domain.SeatCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
public class InventoryService implements InventoryFacade, GetCategoriesUseCase {

    private static final Logger log = LoggerFactory.getLogger(InventoryService.class);

    private final CategoryCounterPort categoryCounterPort;
    private final InventoryHoldPort inventoryHoldPort;
    private final SeatPort seatPort;
    private final TSID.Factory tsidFactory;
    private final Clock clock;

    public InventoryService(CategoryCounterPort categoryCounterPort,
                            InventoryHoldPort inventoryHoldPort,
                            SeatPort seatPort,
                            TSID.Factory tsidFactory,
                            Clock clock) {
        this.categoryCounterPort = categoryCounterPort;
        this.inventoryHoldPort = inventoryHoldPort;
        this.seatPort = seatPort;
        this.tsidFactory = tsidFactory;
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public List<SeatCategory> getCategories(long eventId) {
        return categoryCounterPort.findByEventId(eventId);
    }

    @Override
    @Transactional(readOnly = true)
    public CategorySnapshot getCategory(long categoryId) {
        return toSnapshot(findCategory(categoryId));
    }

    @Override
    @Transactional
    public HoldView holdForCart(HoldRequest request) {
        SeatCategory category = findCategory(request.categoryId());
        boolean assigned = !request.seatIds().isEmpty();
        int quantity = assigned ? request.seatIds().size() : request.quantity();
        if (quantity < 1) {
            throw new IllegalArgumentException("수량은 1 이상이어야 합니다");
        }

        if (!categoryCounterPort.tryHold(category.id(), quantity)) {
            throw insufficient(category);
        }

        long holdId = tsidFactory.generate().toLong();
        InventoryHold hold = InventoryHold.forCart(holdId, request.cartId(), category.id(), quantity,
                request.seatIds(), request.expiresAt(), LocalDateTime.now(clock));
        inventoryHoldPort.insert(hold);

        if (assigned) {
            int heldSeats = seatPort.hold(category.id(), request.seatIds(), holdId);
            if (heldSeats != quantity) {
                // 예외가 트랜잭션을 롤백시키므로 카운터와 hold 도 함께 되돌아간다
                throw new BusinessException(ErrorCode.SEAT_UNAVAILABLE);
            }
        }

        log.info("재고 선점: cartId={}, categoryId={}, quantity={}, holdId={}",
                request.cartId(), category.id(), quantity, holdId);
        return toView(hold);
    }

    @Override
    @Transactional
    public HoldView resize(long holdId, int newQuantity) {
        InventoryHold hold = inventoryHoldPort.findById(holdId)
                .filter(InventoryHold::isActive)
                .orElseThrow(() -> new BusinessException(ErrorCode.CART_INVALID, "선점이 이미 해제되었습니다"));
        if (hold.isAssignedSeating()) {
            throw new BusinessException(ErrorCode.SEAT_ITEM_QUANTITY_FIXED);
        }
        if (newQuantity < 1) {
            throw new IllegalArgumentException("수량은 1 이상이어야 합니다");
        }

        int delta = newQuantity - hold.getQuantity();
        if (delta > 0 && !categoryCounterPort.tryHold(hold.getCategoryId(), delta)) {
            throw insufficient(findCategory(hold.getCategoryId()));
        }
        if (delta < 0) {
            releaseCounter(hold.getCategoryId(), -delta);
        }
        if (delta != 0) {
            inventoryHoldPort.updateQuantity(holdId, newQuantity);
        }

        return new HoldView(holdId, hold.getCategoryId(), newQuantity, hold.getSeatIds(),
                hold.getExpiresAt(), true);
    }

    @Override
    @Transactional
    public void release(long holdId) {
        inventoryHoldPort.findById(holdId).ifPresent(this::releaseHold);
    }

    @Override
    @Transactional
    public void releaseCart(long cartId) {
        inventoryHoldPort.findActiveByOwner(HoldOwner.CART, cartId).forEach(this::releaseHold);
    }

    @Override
    @Transactional
    public void extendCart(long cartId, LocalDateTime expiresAt) {
        inventoryHoldPort.extendExpiry(HoldOwner.CART, cartId, expiresAt);
    }

    @Override
    @Transactional(readOnly = true)
    public List<HoldView> findHolds(Collection<Long> holdIds) {
        if (holdIds.isEmpty()) {
            return List.of();
        }
        return inventoryHoldPort.findByIds(holdIds).stream()
                .map(InventoryService::toView)
                .toList();
    }

    @Override
    @Transactional
    public int transferCartToBooking(long cartId, long bookingId, LocalDateTime expiresAt) {
        int moved = inventoryHoldPort.transfer(HoldOwner.CART, cartId, HoldOwner.BOOKING, bookingId, expiresAt);
        log.info("선점 이관: cartId={} -> bookingId={}, holds={}", cartId, bookingId, moved);
        return moved;
    }

    @Override
    @Transactional
    public void sellBooking(long bookingId) {
        for (InventoryHold hold : inventoryHoldPort.findActiveByOwner(HoldOwner.BOOKING, bookingId)) {
            if (!inventoryHoldPort.markSold(hold.getId())) {
                continue;
            }
            if (!categoryCounterPort.sell(hold.getCategoryId(), hold.getQuantity())) {
                throw new IllegalStateException("판매 전환 실패, 선점 수량 부족: categoryId=" + hold.getCategoryId());
            }
            if (hold.isAssignedSeating()) {
                seatPort.sell(hold.getId());
            }
        }
        log.info("재고 판매 확정: bookingId={}", bookingId);
    }

    @Override
    @Transactional
    public void releaseBooking(long bookingId) {
        inventoryHoldPort.findActiveByOwner(HoldOwner.BOOKING, bookingId).forEach(this::releaseHold);
    }

    @Override
    @Transactional(readOnly = true)
    public Map<Long, String> findSeatLabels(Collection<Long> seatIds) {
        if (seatIds.isEmpty()) {
            return Map.of();
        }
        return seatPort.findByIds(seatIds).stream()
                .collect(Collectors.toMap(Seat::id, Seat::label));
    }

    private void releaseHold(InventoryHold hold) {
        // 상태 전이에 성공한 호출만 카운터를 되돌린다. 이미 해제된 hold 는 아무 일도 하지 않는다.
        if (!inventoryHoldPort.markReleased(hold.getId())) {
            return;
        }
        releaseCounter(hold.getCategoryId(), hold.getQuantity());
        if (hold.isAssignedSeating()) {
            seatPort.release(hold.getId());
        }
        log.info("재고 해제: holdId={}, categoryId={}, quantity={}", hold.getId(), hold.getCategoryId(),
                hold.getQuantity());
    }

    private void releaseCounter(long categoryId, int quantity) {
        if (!categoryCounterPort.release(categoryId, quantity)) {
            throw new IllegalStateException("해제 실패, 선점 수량 부족: categoryId=" + categoryId);
        }
    }

    private SeatCategory findCategory(long categoryId) {
        return categoryCounterPort.findById(categoryId)
                .orElseThrow(() -> new BusinessException(ErrorCode.CATEGORY_NOT_FOUND));
    }

    private BusinessException insufficient(SeatCategory category) {
        int available = Math.max(0, categoryCounterPort.countAvailable(category.id()));
        String detail = available == 0
                ? "'" + category.name() + "' 등급이 매진되었습니다"
                : "'" + category.name() + "' 등급 잔여 좌석이 " + available + "석뿐입니다";
        return new BusinessException(ErrorCode.INSUFFICIENT_AVAILABILITY, detail);
    }

    private static CategorySnapshot toSnapshot(SeatCategory category) {
        return new CategorySnapshot(category.id(), category.eventId(), category.name(), category.price(),
                category.total(), category.held(), category.sold(), category.available());
    }

    private static HoldView toView(InventoryHold hold) {
        return new HoldView(hold.getId(), hold.getCategoryId(), hold.getQuantity(), hold.getSeatIds(),
                hold.getExpiresAt(), hold.isActive());
    }
}
