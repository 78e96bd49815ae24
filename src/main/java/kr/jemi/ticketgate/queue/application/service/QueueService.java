package kr.jemi.ticketgate.queue.application.service;

import io.hypersistence.tsid.TSID;
import kr.jemi.ticketgate.common.exception.BusinessException;
import kr.jemi.ticketgate.common.exception.ErrorCode;
import kr.jemi.ticketgate.queue.api.QueueFacade;
import kr.jemi.ticketgate.queue.application.port.in.GetQueuePositionUseCase;
import kr.jemi.ticketgate.queue.application.port.in.GetQueueStatsUseCase;
import kr.jemi.ticketgate.queue.application.port.in.JoinQueueUseCase;
import kr.jemi.ticketgate.queue.application.port.in.LeaveQueueUseCase;
import kr.jemi.ticketgate.queue.application.port.out.QueueEntryPort;
import kr.jemi.ticketgate.queue.application.port.out.QueueEventPolicyPort;
import kr.jemi.ticketgate.queue.application.port.out.QueueSequencePort;
import kr.jemi.ticketgate.queue.domain.QueueEntry;
import kr.jemi.ticketgate.queue.domain.QueueEventPolicy;
import kr.jemi.ticketgate.queue.domain.QueuePosition;
import kr.jemi.ticketgate.queue.domain.QueueStats;
import kr.jemi.ticketgate.queue.domain.QueueStatus;
import kr.jemi.ticketgate.queue.domain.WaitTimeEstimator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

@Service
public class QueueService implements JoinQueueUseCase, GetQueuePositionUseCase, LeaveQueueUseCase,
        GetQueueStatsUseCase, QueueFacade {

    private static final Logger log = LoggerFactory.getLogger(QueueService.class);

    private final QueueEntryPort queueEntryPort;
    private final QueueSequencePort queueSequencePort;
    private final QueueEventPolicyPort queueEventPolicyPort;
    private final TSID.Factory tsidFactory;
    private final Clock clock;
    private final int avgCheckoutMinutes;

    public QueueService(QueueEntryPort queueEntryPort,
                        QueueSequencePort queueSequencePort,
                        QueueEventPolicyPort queueEventPolicyPort,
                        TSID.Factory tsidFactory,
                        Clock clock,
                        @Value("${ticketgate.queue.avg-checkout-minutes}") int avgCheckoutMinutes) {
        this.queueEntryPort = queueEntryPort;
        this.queueSequencePort = queueSequencePort;
        this.queueEventPolicyPort = queueEventPolicyPort;
        this.tsidFactory = tsidFactory;
        this.clock = clock;
        this.avgCheckoutMinutes = avgCheckoutMinutes;
    }

    @Override
    @Transactional
    public QueuePosition join(long eventId, long userId) {
        QueueEventPolicy policy = queueEventPolicyPort.getPolicy(eventId);
        if (!policy.queueEnabled()) {
            throw new BusinessException(ErrorCode.QUEUE_NOT_ENABLED);
        }
        if (!policy.bookingOpen()) {
            throw new BusinessException(ErrorCode.BOOKING_WINDOW_CLOSED);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Optional<QueueEntry> existing = queueEntryPort.findActive(eventId, userId);
        if (existing.isPresent()) {
            QueueEntry entry = existing.get();
            if (!entry.isOverdue(now)) {
                throw new BusinessException(ErrorCode.ALREADY_QUEUED);
            }
            // 스윕보다 먼저 도착한 재진입: 만료된 입장을 정리하고 맨 뒤로 다시 줄 선다
            entry.expire(now);
            queueEntryPort.update(entry);
        }

        long sequence = queueSequencePort.next(eventId);
        QueueEntry entry = QueueEntry.join(tsidFactory.generate().toLong(), eventId, userId, sequence, now);
        try {
            entry = queueEntryPort.insert(entry);
        } catch (DataIntegrityViolationException e) {
            throw new BusinessException(ErrorCode.ALREADY_QUEUED);
        }

        log.info("대기열 진입: eventId={}, userId={}, sequence={}", eventId, userId, sequence);
        return toPosition(entry, policy, now);
    }

    @Override
    @Transactional(readOnly = true)
    public QueuePosition getPosition(long eventId, long userId) {
        QueueEntry entry = queueEntryPort.findLatest(eventId, userId)
                .orElseThrow(() -> new BusinessException(ErrorCode.NOT_IN_QUEUE));
        QueueEventPolicy policy = queueEventPolicyPort.getPolicy(eventId);
        return toPosition(entry, policy, LocalDateTime.now(clock));
    }

    @Override
    @Transactional
    public void leave(long eventId, long userId) {
        LocalDateTime now = LocalDateTime.now(clock);
        queueEntryPort.findActive(eventId, userId).ifPresent(entry -> {
            // 기한이 지난 입장은 이미 종료된 것으로 보고 EXPIRED 로 정리한다
            QueueStatus target = entry.isOverdue(now) ? QueueStatus.EXPIRED : QueueStatus.LEFT;
            if (queueEntryPort.changeActiveStatus(entry.getId(), entry.getStatus(), target, now)) {
                log.info("대기열 이탈: eventId={}, userId={}, status={}", eventId, userId, target);
            }
        });
    }

    @Override
    @Transactional(readOnly = true)
    public QueueStats getStats(long eventId) {
        QueueEventPolicy policy = queueEventPolicyPort.getPolicy(eventId);
        if (!policy.queueEnabled()) {
            return QueueStats.disabled(eventId);
        }
        long waiting = queueEntryPort.countByStatus(eventId, QueueStatus.WAITING);
        long processing = queueEntryPort.countByStatus(eventId, QueueStatus.PROCESSING);
        int estimated = WaitTimeEstimator.estimateMinutes(waiting + processing, policy.batchSize(),
                policy.processingMinutes(), avgCheckoutMinutes);
        return new QueueStats(eventId, true, waiting, processing, estimated, policy.bookingOpen());
    }

    @Override
    @Transactional(readOnly = true)
    public boolean canProceed(long eventId, long userId) {
        LocalDateTime now = LocalDateTime.now(clock);
        return queueEntryPort.findActive(eventId, userId)
                .map(entry -> entry.canProceed(now))
                .orElse(false);
    }

    @Override
    @Transactional
    public void complete(long eventId, long userId) {
        queueEntryPort.findActive(eventId, userId)
                .filter(entry -> entry.getStatus() == QueueStatus.PROCESSING)
                .ifPresent(entry -> queueEntryPort.changeActiveStatus(entry.getId(), QueueStatus.PROCESSING,
                        QueueStatus.COMPLETED, LocalDateTime.now(clock)));
    }

    private QueuePosition toPosition(QueueEntry entry, QueueEventPolicy policy, LocalDateTime now) {
        QueueStatus status = entry.effectiveStatus(now);
        long ahead = status.isTerminal() ? 0 : queueEntryPort.countAhead(entry.getEventId(), entry.getSequence());
        int estimated = status == QueueStatus.WAITING
                ? WaitTimeEstimator.estimateMinutes(ahead, policy.batchSize(), policy.processingMinutes(),
                        avgCheckoutMinutes)
                : 0;
        return new QueuePosition(entry.getId(), entry.getEventId(), status, ahead, estimated,
                entry.canProceed(now), entry.getProcessingDeadline());
    }
}
