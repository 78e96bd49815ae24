package kr.jemi.ticketgate.queue.infrastructure.in.scheduler;

import kr.jemi.ticketgate.queue.application.port.in.ExpireAdmissionsUseCase;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class ExpiredAdmissionCleanupScheduler {

    private static final Logger log = LoggerFactory.getLogger(ExpiredAdmissionCleanupScheduler.class);

    private final ExpireAdmissionsUseCase expireAdmissionsUseCase;

    public ExpiredAdmissionCleanupScheduler(ExpireAdmissionsUseCase expireAdmissionsUseCase) {
        this.expireAdmissionsUseCase = expireAdmissionsUseCase;
    }

    @Scheduled(fixedDelayString = "${ticketgate.queue.expiry-interval-ms}")
    @SchedulerLock(name = "expireAdmissions",
            lockAtMostFor = "${ticketgate.queue.lock-at-most-for}",
            lockAtLeastFor = "${ticketgate.queue.lock-at-least-for}")
    public void cleanup() {
        try {
            int expired = expireAdmissionsUseCase.expireOverdue();
            if (expired > 0) {
                log.info("입장 기한 만료 {} 건 정리", expired);
            }
        } catch (Exception e) {
            log.error("입장 기한 만료 정리 실패", e);
        }
    }
}
