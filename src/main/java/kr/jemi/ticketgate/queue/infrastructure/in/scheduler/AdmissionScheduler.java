package kr.jemi.ticketgate.queue.infrastructure.in.scheduler;

import kr.jemi.ticketgate.queue.application.port.in.AdmitUsersUseCase;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class AdmissionScheduler {

    private static final Logger log = LoggerFactory.getLogger(AdmissionScheduler.class);

    private final AdmitUsersUseCase admitUsersUseCase;

    public AdmissionScheduler(AdmitUsersUseCase admitUsersUseCase) {
        this.admitUsersUseCase = admitUsersUseCase;
    }

    @Scheduled(fixedDelayString = "${ticketgate.queue.admission-interval-ms}")
    @SchedulerLock(name = "admitQueue",
            lockAtMostFor = "${ticketgate.queue.lock-at-most-for}",
            lockAtLeastFor = "${ticketgate.queue.lock-at-least-for}")
    public void admit() {
        try {
            int admitted = admitUsersUseCase.admitBatch();
            if (admitted > 0) {
                log.debug("입장 배치 완료: admitted={}", admitted);
            }
        } catch (Exception e) {
            log.error("대기열 입장 스케줄러 실패", e);
        }
    }
}
