package kr.jemi.ticketgate.integration;

import kr.jemi.ticketgate.cart.application.port.in.AddCartItemCommand;
import kr.jemi.ticketgate.cart.application.port.in.AddCartItemUseCase;
import kr.jemi.ticketgate.catalog.domain.Event;
import kr.jemi.ticketgate.catalog.domain.EventStatus;
import kr.jemi.ticketgate.catalog.infrastructure.out.persistence.EventJpaEntity;
import kr.jemi.ticketgate.common.exception.BusinessException;
import kr.jemi.ticketgate.common.exception.ErrorCode;
import kr.jemi.ticketgate.inventory.application.port.in.GetCategoriesUseCase;
import kr.jemi.ticketgate.inventory.domain.SeatCategory;
import kr.jemi.ticketgate.inventory.infrastructure.out.persistence.SeatCategoryJpaEntity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ConcurrencyIntegrationTest extends IntegrationTestBase {

    private static final long EVENT_ID = 3_000L;
    private static final long CATEGORY_ID = 3_100L;

    @Autowired
    AddCartItemUseCase addCartItemUseCase;

    @Autowired
    GetCategoriesUseCase getCategoriesUseCase;

    private void seed(int totalSeats) {
        eventJpaRepository.save(EventJpaEntity.fromDomain(new Event(EVENT_ID, "open-air", "야외 공연",
                EventStatus.PUBLISHED, false, 100, 15, 10, null, null)));
        seatCategoryJpaRepository.save(SeatCategoryJpaEntity.fromDomain(
                SeatCategory.create(CATEGORY_ID, EVENT_ID, "일반석", new BigDecimal("800.00"), totalSeats)));
    }

    private SeatCategory category() {
        return getCategoriesUseCase.getCategories(EVENT_ID).get(0);
    }

    private Result race(int threadCount, int quantity) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch readyLatch = new CountDownLatch(threadCount);
        CountDownLatch startLatch = new CountDownLatch(1);
        AtomicInteger successCount = new AtomicInteger(0);
        Queue<ErrorCode> failures = new ConcurrentLinkedQueue<>();

        for (int i = 0; i < threadCount; i++) {
            long userId = 500L + i;
            executor.submit(() -> {
                readyLatch.countDown();
                try {
                    startLatch.await();
                    addCartItemUseCase.addItem(new AddCartItemCommand(userId, EVENT_ID, CATEGORY_ID, quantity, null));
                    successCount.incrementAndGet();
                } catch (BusinessException e) {
                    failures.add(e.getErrorCode());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }

        readyLatch.await();
        startLatch.countDown();
        executor.shutdown();
        executor.awaitTermination(30, TimeUnit.SECONDS);
        return new Result(successCount.get(), failures);
    }

    @Test
    @DisplayName("마지막 한 좌석에 동시에 담기: 정확히 1명만 성공")
    void concurrent_hold_of_last_seat_only_one_succeeds() throws InterruptedException {
        seed(1);
        int threadCount = 30;

        Result result = race(threadCount, 1);

        assertThat(result.successCount()).as("성공 수").isEqualTo(1);
        assertThat(result.failures())
                .as("실패 사유")
                .hasSize(threadCount - 1)
                .containsOnly(ErrorCode.INSUFFICIENT_AVAILABILITY);
        assertThat(category().held()).isEqualTo(1);
        assertThat(category().available()).isZero();
    }

    @Test
    @DisplayName("여러 장씩 동시에 담아도 held + sold 가 총 좌석을 넘지 않는다")
    void concurrent_multi_quantity_holds_never_oversell() throws InterruptedException {
        seed(10);
        int threadCount = 20;

        Result result = race(threadCount, 3);

        SeatCategory category = category();
        assertThat(result.successCount()).as("성공 수").isEqualTo(3);
        assertThat(category.held() + category.sold()).isLessThanOrEqualTo(category.total());
        assertThat(category.held()).isEqualTo(9);
    }

    private record Result(int successCount, Queue<ErrorCode> failures) {
    }
}
