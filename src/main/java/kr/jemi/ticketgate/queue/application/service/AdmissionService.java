package kr.jemi.ticketgate.queue.application.service;

import kr.jemi.ticketgate.queue.application.port.in.AdmitUsersUseCase;
import kr.jemi.ticketgate.queue.application.port.in.ExpireAdmissionsUseCase;
import kr.jemi.ticketgate.queue.application.port.out.QueueEntryPort;
import kr.jemi.ticketgate.queue.application.port.out.QueueEventPolicyPort;
import kr.jemi.ticketgate.queue.domain.QueueEventPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

@Service
public class AdmissionService implements AdmitUsersUseCase, ExpireAdmissionsUseCase {

    private static final Logger log = LoggerFactory.getLogger(AdmissionService.class);

    private final QueueEventPolicyPort queueEventPolicyPort;
    private final QueueEntryPort queueEntryPort;
    private final AdmissionWriter admissionWriter;
    private final Clock clock;

    public AdmissionService(QueueEventPolicyPort queueEventPolicyPort,
                            QueueEntryPort queueEntryPort,
                            AdmissionWriter admissionWriter,
                            Clock clock) {
        this.queueEventPolicyPort = queueEventPolicyPort;
        this.queueEntryPort = queueEntryPort;
        this.admissionWriter = admissionWriter;
        this.clock = clock;
    }

    /**
     * 이벤트마다 별도 트랜잭션으로 처리해 한 이벤트의 실패가 다른 이벤트의 입장을 막지 않게 한다.
     */
    @Override
    public int admitBatch() {
        int admitted = 0;
        for (Long eventId : queueEventPolicyPort.findQueueEnabledEventIds()) {
            try {
                QueueEventPolicy policy = queueEventPolicyPort.getPolicy(eventId);
                if (!policy.bookingOpen()) {
                    continue;
                }
                admitted += admissionWriter.admit(policy, LocalDateTime.now(clock)).size();
            } catch (Exception e) {
                log.error("이벤트 입장 배치 실패: eventId={}", eventId, e);
            }
        }
        return admitted;
    }

    @Override
    @Transactional
    public int expireOverdue() {
        return queueEntryPort.expireOverdue(LocalDateTime.now(clock));
    }
}
