package kr.jemi.ticketgate.queue.application.service;

import kr.jemi.ticketgate.queue.application.port.out.QueueEntryPort;
import kr.jemi.ticketgate.queue.domain.QueueEntry;
import kr.jemi.ticketgate.queue.domain.QueueEventPolicy;
import kr.jemi.ticketgate.queue.domain.QueueStatus;
import kr.jemi.ticketgate.queue.event.QueueAdmittedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

@Service
public class AdmissionWriter {

    private static final Logger log = LoggerFactory.getLogger(AdmissionWriter.class);

    private final QueueEntryPort queueEntryPort;
    private final ApplicationEventPublisher eventPublisher;

    public AdmissionWriter(QueueEntryPort queueEntryPort, ApplicationEventPublisher eventPublisher) {
        this.queueEntryPort = queueEntryPort;
        this.eventPublisher = eventPublisher;
    }

    /**
     * 만료 정리 → 빈 슬롯 계산 → 가장 오래 기다린 순서대로 입장. PROCESSING 인원은 batchSize 를 넘지 않는다.
     *
     * @return 입장한 사용자 id
     */
    @Transactional
    public List<Long> admit(QueueEventPolicy policy, LocalDateTime now) {
        long eventId = policy.eventId();

        // 1. 기한이 지난 입장을 먼저 비워 슬롯을 확보
        int expired = queueEntryPort.expireOverdue(eventId, now);
        if (expired > 0) {
            log.info("입장 기한 만료: eventId={}, count={}", eventId, expired);
        }

        // 2. 빈 슬롯 계산
        long processing = queueEntryPort.countByStatus(eventId, QueueStatus.PROCESSING);
        int slots = (int) Math.max(0, policy.batchSize() - processing);
        if (slots == 0) {
            return List.of();
        }

        // 3. FIFO 후보 조회
        List<Long> candidateIds = queueEntryPort.findWaiting(eventId, slots).stream()
                .map(QueueEntry::getId)
                .toList();
        if (candidateIds.isEmpty()) {
            return List.of();
        }

        // 4. WAITING 인 후보만 전이 (사이에 이탈한 사용자는 건너뜀)
        LocalDateTime deadline = now.plusMinutes(policy.processingMinutes());
        queueEntryPort.admit(candidateIds, now, deadline);
        List<Long> admittedUserIds = queueEntryPort.findByIds(candidateIds).stream()
                .filter(entry -> entry.getStatus() == QueueStatus.PROCESSING)
                .map(QueueEntry::getUserId)
                .toList();

        log.info("입장 배치: eventId={}, admitted={}, slots={}", eventId, admittedUserIds.size(), slots);
        eventPublisher.publishEvent(new QueueAdmittedEvent(eventId, admittedUserIds, deadline));
        return admittedUserIds;
    }
}
