package kr.jemi.ticketgate.booking.infrastructure.in.scheduler;

import kr.jemi.ticketgate.booking.application.port.in.ReconcileBookingsUseCase;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class BookingReconciliationScheduler {

    private static final Logger log = LoggerFactory.getLogger(BookingReconciliationScheduler.class);

    private final ReconcileBookingsUseCase reconcileBookingsUseCase;

    public BookingReconciliationScheduler(ReconcileBookingsUseCase reconcileBookingsUseCase) {
        this.reconcileBookingsUseCase = reconcileBookingsUseCase;
    }

    @Scheduled(fixedDelayString = "${ticketgate.booking.reconcile-interval-ms}")
    @SchedulerLock(name = "reconcileBookings",
            lockAtMostFor = "${ticketgate.booking.lock-at-most-for}",
            lockAtLeastFor = "${ticketgate.booking.lock-at-least-for}")
    public void reconcile() {
        try {
            reconcileBookingsUseCase.reconcile();
        } catch (Exception e) {
            log.error("결제 대사 스케줄 실패", e);
        }
    }
}
