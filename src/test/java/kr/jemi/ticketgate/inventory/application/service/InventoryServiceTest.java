package kr.jemi.ticketgate.inventory.application.service;

import io.hypersistence.tsid.TSID;
import kr.jemi.ticketgate.common.exception.BusinessException;
import kr.jemi.ticketgate.common.exception.ErrorCode;
import kr.jemi.ticketgate.inventory.api.HoldRequest;
import kr.jemi.ticketgate.inventory.api.HoldView;
import kr.jemi.ticketgate.inventory.application.port.out.CategoryCounterPort;
import kr.jemi.ticketgate.inventory.application.port.out.InventoryHoldPort;
import kr.jemi.ticketgate.inventory.application.port.out.SeatPort;
import kr.jemi.ticketgate.inventory.domain.HoldOwner;
import kr.jemi.ticketgate.inventory.domain.HoldStatus;
import kr.jemi.ticketgate.inventory.domain.InventoryHold;
import kr.jemi.ticketgate.inventory.domain.SeatCategory;
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

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.BDDMockito.*;

@ExtendWith(MockitoExtension.class)
class InventoryServiceTest {

    private static final ZoneId ZONE = ZoneId.of("Asia/Seoul");
    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 1, 10, 0);
    private static final long CATEGORY_ID = 3L;
    private static final long CART_ID = 7L;

    @Mock
    private CategoryCounterPort categoryCounterPort;

    @Mock
    private InventoryHoldPort inventoryHoldPort;

    @Mock
    private SeatPort seatPort;

    private InventoryService inventoryService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.atZone(ZONE).toInstant(), ZONE);
        inventoryService = new InventoryService(categoryCounterPort, inventoryHoldPort, seatPort,
                TSID.Factory.newInstance256(0), clock);
    }

    private static SeatCategory category(int total, int held, int sold) {
        return new SeatCategory(CATEGORY_ID, 10L, "R석", new BigDecimal("1000"), total, held, sold);
    }

    private static InventoryHold activeHold(long holdId, int quantity, List<Long> seatIds) {
        return InventoryHold.forCart(holdId, CART_ID, CATEGORY_ID, quantity, seatIds, NOW.plusMinutes(15), NOW);
    }

    @Nested
    @DisplayName("holdForCart() - 재고 선점")
    class HoldForCart {

        @Test
        @DisplayName("카운터를 올린 뒤 선점 기록을 남긴다")
        void shouldHoldGeneralAdmission() {
            // given
            given(categoryCounterPort.findById(CATEGORY_ID)).willReturn(Optional.of(category(10, 0, 0)));
            given(categoryCounterPort.tryHold(CATEGORY_ID, 2)).willReturn(true);

            // when
            HoldView view = inventoryService.holdForCart(
                    new HoldRequest(CART_ID, CATEGORY_ID, 2, List.of(), NOW.plusMinutes(15)));

            // then
            assertThat(view.quantity()).isEqualTo(2);
            assertThat(view.active()).isTrue();
            then(inventoryHoldPort).should().insert(any(InventoryHold.class));
            then(seatPort).shouldHaveNoInteractions();
        }

        @Test
        @DisplayName("잔여가 부족하면 남은 수량을 알려주며 INSUFFICIENT_AVAILABILITY")
        void shouldRejectWhenInsufficient() {
            // given
            given(categoryCounterPort.findById(CATEGORY_ID)).willReturn(Optional.of(category(10, 8, 0)));
            given(categoryCounterPort.tryHold(CATEGORY_ID, 3)).willReturn(false);
            given(categoryCounterPort.countAvailable(CATEGORY_ID)).willReturn(2);

            // when & then
            assertThatThrownBy(() -> inventoryService.holdForCart(
                    new HoldRequest(CART_ID, CATEGORY_ID, 3, List.of(), NOW.plusMinutes(15))))
                    .isInstanceOfSatisfying(BusinessException.class, e -> {
                        assertThat(e.getErrorCode()).isEqualTo(ErrorCode.INSUFFICIENT_AVAILABILITY);
                        assertThat(e.getMessage()).contains("2석");
                    });
            then(inventoryHoldPort).shouldHaveNoInteractions();
        }

        @Test
        @DisplayName("매진이면 매진 메시지를 준다")
        void shouldReportSoldOut() {
            // given
            given(categoryCounterPort.findById(CATEGORY_ID)).willReturn(Optional.of(category(10, 10, 0)));
            given(categoryCounterPort.tryHold(CATEGORY_ID, 1)).willReturn(false);
            given(categoryCounterPort.countAvailable(CATEGORY_ID)).willReturn(0);

            // when & then
            assertThatThrownBy(() -> inventoryService.holdForCart(
                    new HoldRequest(CART_ID, CATEGORY_ID, 1, List.of(), NOW.plusMinutes(15))))
                    .isInstanceOfSatisfying(BusinessException.class, e ->
                            assertThat(e.getMessage()).contains("매진"));
        }

        @Test
        @DisplayName("지정석 중 하나라도 잡지 못하면 SEAT_UNAVAILABLE")
        void shouldRejectWhenSeatTaken() {
            // given
            given(categoryCounterPort.findById(CATEGORY_ID)).willReturn(Optional.of(category(10, 0, 0)));
            given(categoryCounterPort.tryHold(CATEGORY_ID, 2)).willReturn(true);
            given(seatPort.hold(eq(CATEGORY_ID), eq(List.of(11L, 12L)), anyLong())).willReturn(1);

            // when & then
            assertThatThrownBy(() -> inventoryService.holdForCart(
                    new HoldRequest(CART_ID, CATEGORY_ID, 0, List.of(11L, 12L), NOW.plusMinutes(15))))
                    .isInstanceOfSatisfying(BusinessException.class, e ->
                            assertThat(e.getErrorCode()).isEqualTo(ErrorCode.SEAT_UNAVAILABLE));
        }

        @Test
        @DisplayName("없는 등급이면 CATEGORY_NOT_FOUND")
        void shouldRejectUnknownCategory() {
            // given
            given(categoryCounterPort.findById(CATEGORY_ID)).willReturn(Optional.empty());

            // when & then
            assertThatThrownBy(() -> inventoryService.holdForCart(
                    new HoldRequest(CART_ID, CATEGORY_ID, 1, List.of(), NOW.plusMinutes(15))))
                    .isInstanceOfSatisfying(BusinessException.class, e ->
                            assertThat(e.getErrorCode()).isEqualTo(ErrorCode.CATEGORY_NOT_FOUND));
        }
    }

    @Nested
    @DisplayName("resize() - 선점 수량 변경")
    class Resize {

        @Test
        @DisplayName("늘리면 차이만큼만 추가 선점한다")
        void shouldHoldDeltaWhenGrowing() {
            // given
            given(inventoryHoldPort.findById(1L)).willReturn(Optional.of(activeHold(1L, 2, List.of())));
            given(categoryCounterPort.tryHold(CATEGORY_ID, 3)).willReturn(true);

            // when
            HoldView view = inventoryService.resize(1L, 5);

            // then
            assertThat(view.quantity()).isEqualTo(5);
            then(inventoryHoldPort).should().updateQuantity(1L, 5);
        }

        @Test
        @DisplayName("줄이면 차이만큼 카운터를 되돌린다")
        void shouldReleaseDeltaWhenShrinking() {
            // given
            given(inventoryHoldPort.findById(1L)).willReturn(Optional.of(activeHold(1L, 4, List.of())));
            given(categoryCounterPort.release(CATEGORY_ID, 3)).willReturn(true);

            // when
            inventoryService.resize(1L, 1);

            // then
            then(categoryCounterPort).should(never()).tryHold(anyLong(), anyInt());
            then(inventoryHoldPort).should().updateQuantity(1L, 1);
        }

        @Test
        @DisplayName("지정석 선점은 수량을 바꿀 수 없다")
        void shouldRejectAssignedSeating() {
            // given
            given(inventoryHoldPort.findById(1L)).willReturn(Optional.of(activeHold(1L, 1, List.of(11L))));

            // when & then
            assertThatThrownBy(() -> inventoryService.resize(1L, 2))
                    .isInstanceOfSatisfying(BusinessException.class, e ->
                            assertThat(e.getErrorCode()).isEqualTo(ErrorCode.SEAT_ITEM_QUANTITY_FIXED));
        }
    }

    @Nested
    @DisplayName("release() - 선점 해제")
    class Release {

        @Test
        @DisplayName("상태 전이에 성공한 경우에만 카운터와 좌석을 되돌린다")
        void shouldReleaseCounterAndSeats() {
            // given
            InventoryHold hold = activeHold(1L, 2, List.of(11L, 12L));
            given(inventoryHoldPort.findById(1L)).willReturn(Optional.of(hold));
            given(inventoryHoldPort.markReleased(1L)).willReturn(true);
            given(categoryCounterPort.release(CATEGORY_ID, 2)).willReturn(true);

            // when
            inventoryService.release(1L);

            // then
            then(seatPort).should().release(1L);
        }

        @Test
        @DisplayName("이미 해제된 선점을 다시 해제해도 카운터는 그대로다")
        void shouldBeIdempotent() {
            // given
            given(inventoryHoldPort.findById(1L)).willReturn(Optional.of(activeHold(1L, 2, List.of())));
            given(inventoryHoldPort.markReleased(1L)).willReturn(false);

            // when
            inventoryService.release(1L);

            // then
            then(categoryCounterPort).should(never()).release(anyLong(), anyInt());
        }
    }

    @Nested
    @DisplayName("sellBooking() - 판매 확정")
    class SellBooking {

        @Test
        @DisplayName("예매에 묶인 선점을 판매로 전환한다")
        void shouldSellHolds() {
            // given
            InventoryHold hold = new InventoryHold(1L, CATEGORY_ID, 2, List.of(), HoldOwner.BOOKING, 99L,
                    HoldStatus.ACTIVE, NOW.plusMinutes(15), NOW);
            given(inventoryHoldPort.findActiveByOwner(HoldOwner.BOOKING, 99L)).willReturn(List.of(hold));
            given(inventoryHoldPort.markSold(1L)).willReturn(true);
            given(categoryCounterPort.sell(CATEGORY_ID, 2)).willReturn(true);

            // when
            inventoryService.sellBooking(99L);

            // then
            then(categoryCounterPort).should().sell(CATEGORY_ID, 2);
            then(seatPort).should(never()).sell(anyLong());
        }

        @Test
        @DisplayName("카운터가 선점 수량보다 적으면 IllegalStateException")
        void shouldFailWhenCounterShort() {
            // given
            InventoryHold hold = new InventoryHold(1L, CATEGORY_ID, 2, List.of(), HoldOwner.BOOKING, 99L,
                    HoldStatus.ACTIVE, NOW.plusMinutes(15), NOW);
            given(inventoryHoldPort.findActiveByOwner(HoldOwner.BOOKING, 99L)).willReturn(List.of(hold));
            given(inventoryHoldPort.markSold(1L)).willReturn(true);
            given(categoryCounterPort.sell(CATEGORY_ID, 2)).willReturn(false);

            // when & then
            assertThatThrownBy(() -> inventoryService.sellBooking(99L))
                    .isInstanceOf(IllegalStateException.class);
        }
    }
}
