package kr.jemi.ticketgate.common.infrastructure.in.scheduler;

import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.modulith.events.IncompleteEventPublications;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 리스너가 끝내지 못한 모듈 이벤트(입장, 장바구니 만료, 예매 결과 알림)를 다시 발행한다.
 */
@Component
public class EventResubmitScheduler {

    private static final Logger log = LoggerFactory.getLogger(EventResubmitScheduler.class);

    private final IncompleteEventPublications incompleteEventPublications;
    private final Duration olderThan;

    public EventResubmitScheduler(IncompleteEventPublications incompleteEventPublications,
                                  @Value("${ticketgate.event-resubmit.older-than:PT5M}") Duration olderThan) {
        this.incompleteEventPublications = incompleteEventPublications;
        this.olderThan = olderThan;
    }

    @Scheduled(cron = "${ticketgate.event-resubmit.cron}")
    @SchedulerLock(name = "resubmitIncompletePublications",
            lockAtMostFor = "${ticketgate.event-resubmit.lock-at-most-for}",
            lockAtLeastFor = "${ticketgate.event-resubmit.lock-at-least-for}")
    public void resubmit() {
        try {
            log.debug("미완료 이벤트 재발행: olderThan={}", olderThan);
            incompleteEventPublications.resubmitIncompletePublicationsOlderThan(olderThan);
        } catch (Exception e) {
            log.error("미완료 이벤트 재발행 실패", e);
        }
    }
}
